/*
 * Copyright lb-controller authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.lbcontroller.operator.networking;

import io.lbcontroller.operator.common.Reconciliation;
import io.lbcontroller.operator.common.model.NamespaceAndName;
import io.lbcontroller.operator.networking.targetgroup.Target;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Derives the desired targets from the TargetGroupBindings and the endpoints of their Services
 */
public interface DesiredTargetsSource {
    /**
     * @return  All TargetGroupBindings
     */
    Set<NamespaceAndName> targetGroupBindings();

    /**
     * @param reconciliation        Reconciliation marker
     * @param targetGroupBinding    The TargetGroupBinding
     *
     * @return  The desired targets, or empty if the binding does not exist anymore
     */
    Optional<DesiredTargets> desiredTargets(Reconciliation reconciliation, NamespaceAndName targetGroupBinding);

    /**
     * Desired targets of a target group
     *
     * @param targetGroupArn    ARN of the target group
     * @param targets           Desired targets
     */
    record DesiredTargets(String targetGroupArn, List<Target> targets) {
        /**
         * Constructor
         *
         * @param targetGroupArn    ARN of the target group
         * @param targets           Desired targets
         */
        public DesiredTargets {
            targets = targets == null ? List.of() : List.copyOf(targets);
        }
    }
}
