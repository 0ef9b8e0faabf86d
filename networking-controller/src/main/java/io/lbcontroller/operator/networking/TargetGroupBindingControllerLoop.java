/*
 * Copyright lb-controller authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.lbcontroller.operator.networking;

import io.lbcontroller.operator.common.Reconciliation;
import io.lbcontroller.operator.common.ReconciliationLogger;
import io.lbcontroller.operator.common.controller.AbstractControllerLoop;
import io.lbcontroller.operator.common.controller.ControllerQueue;
import io.lbcontroller.operator.common.controller.ReconciliationLockManager;
import io.lbcontroller.operator.common.metrics.ControllerMetricsHolder;
import io.lbcontroller.operator.networking.DesiredTargetsSource.DesiredTargets;
import io.lbcontroller.operator.networking.targetgroup.TargetGroupReconciler;

import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Controller loop reconciling the targets of a TargetGroupBinding
 */
public class TargetGroupBindingControllerLoop extends AbstractControllerLoop {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(TargetGroupBindingControllerLoop.class);

    private final ControllerMetricsHolder metrics;
    private final DesiredTargetsSource desiredTargetsSource;
    private final TargetGroupReconciler targetGroupReconciler;

    /**
     * Creates the controller loop
     *
     * @param name                      Name of the loop
     * @param workQueue                 Work queue
     * @param lockManager               Lock manager
     * @param scheduledExecutor         Scheduled executor for the progress warnings
     * @param metrics                   Metrics holder
     * @param desiredTargetsSource      Source of the desired targets
     * @param targetGroupReconciler     Target group reconciler
     */
    public TargetGroupBindingControllerLoop(String name, ControllerQueue workQueue, ReconciliationLockManager lockManager,
                                            ScheduledExecutorService scheduledExecutor, ControllerMetricsHolder metrics,
                                            DesiredTargetsSource desiredTargetsSource, TargetGroupReconciler targetGroupReconciler) {
        super(name, workQueue, lockManager, scheduledExecutor);

        this.metrics = metrics;
        this.desiredTargetsSource = desiredTargetsSource;
        this.targetGroupReconciler = targetGroupReconciler;
    }

    @Override
    protected void reconcile(Reconciliation reconciliation) {
        Optional<DesiredTargets> desired = desiredTargetsSource.desiredTargets(reconciliation, reconciliation.resource());

        if (desired.isEmpty()) {
            LOGGER.debugCr(reconciliation, "TargetGroupBinding does not exist anymore");
            return;
        }

        targetGroupReconciler.reconcileTargets(reconciliation, desired.get().targetGroupArn(), desired.get().targets());
    }

    @Override
    protected ControllerMetricsHolder metrics() {
        return metrics;
    }
}
