/*
 * Copyright lb-controller authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.lbcontroller.operator.networking;

import io.lbcontroller.operator.common.MetricsProvider;
import io.lbcontroller.operator.common.controller.AbstractController;
import io.lbcontroller.operator.common.controller.AbstractControllerLoop;
import io.lbcontroller.operator.common.controller.ControllerQueue;
import io.lbcontroller.operator.common.controller.ReconciliationLockManager;
import io.lbcontroller.operator.common.metrics.ControllerMetricsHolder;
import io.lbcontroller.operator.common.model.LabelPredicate;
import io.lbcontroller.operator.common.model.NamespaceAndName;
import io.lbcontroller.operator.networking.targetgroup.TargetGroupReconciler;

import java.util.Set;
import java.util.concurrent.ScheduledExecutorService;

/**
 * TargetGroupBinding controller queues the reconciliations of the targets of the bound target groups
 */
public class TargetGroupBindingController extends AbstractController {
    /**
     * Kind of the reconciled resources
     */
    public static final String RESOURCE_KIND = "TargetGroupBinding";

    private final DesiredTargetsSource desiredTargetsSource;
    private final TargetGroupReconciler targetGroupReconciler;

    /**
     * Creates the TargetGroupBinding controller
     *
     * @param config                    Controller configuration
     * @param desiredTargetsSource      Source of the desired targets
     * @param targetGroupReconciler     Target group reconciler
     * @param metricsProvider           Metrics provider
     */
    public TargetGroupBindingController(ControllerConfig config, DesiredTargetsSource desiredTargetsSource,
                                        TargetGroupReconciler targetGroupReconciler, MetricsProvider metricsProvider) {
        super(RESOURCE_KIND, config.getTargetGroupBindingMaxConcurrentReconciles(), config.getWorkQueueSize(),
                config.getFullReconciliationIntervalMs(), config.getRetryMaxAttempts(), LabelPredicate.EVERYTHING, metricsProvider);

        this.desiredTargetsSource = desiredTargetsSource;
        this.targetGroupReconciler = targetGroupReconciler;
    }

    @Override
    protected AbstractControllerLoop createLoop(String name, ControllerQueue workQueue, ReconciliationLockManager lockManager,
                                                ScheduledExecutorService scheduledExecutor, ControllerMetricsHolder metrics) {
        return new TargetGroupBindingControllerLoop(name, workQueue, lockManager, scheduledExecutor, metrics, desiredTargetsSource, targetGroupReconciler);
    }

    @Override
    protected Set<NamespaceAndName> knownResources() {
        return desiredTargetsSource.targetGroupBindings();
    }
}
