/*
 * Copyright lb-controller authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.lbcontroller.operator.networking.targetgroup;

import io.lbcontroller.operator.common.Reconciliation;

import java.util.Collection;

/**
 * Reconciles the targets of a target group
 */
public interface TargetGroupReconciler {
    /**
     * Deregisters the targets which are not desired and registers the missing ones
     *
     * @param reconciliation    Reconciliation marker
     * @param targetGroupArn    ARN of the target group
     * @param desired           Desired targets
     */
    void reconcileTargets(Reconciliation reconciliation, String targetGroupArn, Collection<Target> desired);
}
