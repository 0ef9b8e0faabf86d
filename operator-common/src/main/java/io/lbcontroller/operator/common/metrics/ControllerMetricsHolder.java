/*
 * Copyright lb-controller authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.lbcontroller.operator.common.metrics;

import io.lbcontroller.operator.common.MetricsProvider;
import io.lbcontroller.operator.common.model.LabelPredicate;
import io.micrometer.core.instrument.Counter;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * A metrics holder for controllers.
 */
public class ControllerMetricsHolder extends MetricsHolder {
    /**
     * Metric name for reconciliations which are already queued when we try to enqueue them again.
     */
    public static final String METRICS_RECONCILIATIONS_ALREADY_ENQUEUED = METRICS_PREFIX + "reconciliations.already.enqueued";
    /**
     * Metric name for reconciliations which were re-queued with a back-off after a failure.
     */
    public static final String METRICS_RECONCILIATIONS_RETRIED = METRICS_PREFIX + "reconciliations.retried";

    private final Map<MetricKey, Counter> alreadyQueuedReconciliationsCounterMap = new ConcurrentHashMap<>(1);
    private final Map<MetricKey, Counter> retriedReconciliationsCounterMap = new ConcurrentHashMap<>(1);

    /**
     * Constructs the controller metrics holder
     *
     * @param kind              Kind of the resources for which these metrics apply
     * @param selector          Selector used by the controller
     * @param metricsProvider   Metrics provider
     */
    public ControllerMetricsHolder(String kind, LabelPredicate selector, MetricsProvider metricsProvider) {
        super(kind, selector, metricsProvider);
    }

    /**
     * Counter metric for number of reconciliations which are already queued when we try to enqueue them again. This
     * might indicate for example that the periodic reconciliations are triggering too often.
     *
     * @param namespace     Namespace of the resources being reconciled
     *
     * @return  Metrics counter
     */
    public Counter alreadyEnqueuedReconciliationsCounter(String namespace) {
        return getCounter(new MetricKey(kind, namespace), METRICS_RECONCILIATIONS_ALREADY_ENQUEUED,
                "Number of reconciliations not enqueued because the same resource was already in the queue",
                alreadyQueuedReconciliationsCounterMap);
    }

    /**
     * Counter metric for number of reconciliations re-queued with a back-off after they failed.
     *
     * @param namespace     Namespace of the resources being reconciled
     *
     * @return  Metrics counter
     */
    public Counter retriedReconciliationsCounter(String namespace) {
        return getCounter(new MetricKey(kind, namespace), METRICS_RECONCILIATIONS_RETRIED,
                "Number of failed reconciliations which were re-queued with a back-off",
                retriedReconciliationsCounterMap);
    }
}
