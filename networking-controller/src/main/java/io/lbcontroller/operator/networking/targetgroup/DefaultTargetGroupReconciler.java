/*
 * Copyright lb-controller authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.lbcontroller.operator.networking.targetgroup;

import io.lbcontroller.operator.common.Reconciliation;
import io.lbcontroller.operator.common.ReconciliationLogger;
import io.lbcontroller.operator.networking.reconcile.ReconcilePlan;

import java.util.Collection;

/**
 * Reconciles the targets of a target group in a single pass. The target group is fully owned by its binding, so all
 * targets which are not desired are deregistered.
 */
public class DefaultTargetGroupReconciler implements TargetGroupReconciler {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(DefaultTargetGroupReconciler.class);

    private final TargetGroupManager targetGroupManager;

    /**
     * Constructor
     *
     * @param targetGroupManager    Manager used to read and modify the target groups
     */
    public DefaultTargetGroupReconciler(TargetGroupManager targetGroupManager) {
        this.targetGroupManager = targetGroupManager;
    }

    @Override
    public void reconcileTargets(Reconciliation reconciliation, String targetGroupArn, Collection<Target> desired) {
        ReconcilePlan.throwIfCancelled(reconciliation, "fetching targets of " + targetGroupArn);

        ReconcilePlan<Target> plan = ReconcilePlan.compute(
                targetGroupManager.fetchTargets(reconciliation, targetGroupArn),
                desired,
                TargetEquality.INSTANCE,
                target -> true);

        if (plan.isEmpty()) {
            LOGGER.debugCr(reconciliation, "Targets of {} are up to date", targetGroupArn);
            return;
        }

        LOGGER.infoCr(reconciliation, "Reconciling targets of {}: deregistering {} and registering {} targets",
                targetGroupArn, plan.toRevoke().size(), plan.toGrant().size());

        plan.execute(reconciliation,
                toDeregister -> targetGroupManager.deregisterTargets(reconciliation, targetGroupArn, toDeregister),
                toRegister -> targetGroupManager.registerTargets(reconciliation, targetGroupArn, toRegister));
    }
}
