/*
 * Copyright lb-controller authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.lbcontroller.operator.networking.targetgroup;

import io.lbcontroller.operator.common.Reconciliation;

import java.util.List;

/**
 * Reads and modifies the targets of target groups. Modifications are atomic: either all targets are (de)registered
 * or none.
 */
public interface TargetGroupManager {
    /**
     * @param reconciliation    Reconciliation marker
     * @param targetGroupArn    ARN of the target group
     *
     * @return  Targets registered in the target group, without the targets which are already draining
     */
    List<Target> fetchTargets(Reconciliation reconciliation, String targetGroupArn);

    /**
     * @param reconciliation    Reconciliation marker
     * @param targetGroupArn    ARN of the target group
     * @param targets           Targets to deregister
     */
    void deregisterTargets(Reconciliation reconciliation, String targetGroupArn, List<Target> targets);

    /**
     * @param reconciliation    Reconciliation marker
     * @param targetGroupArn    ARN of the target group
     * @param targets           Targets to register
     */
    void registerTargets(Reconciliation reconciliation, String targetGroupArn, List<Target> targets);
}
