/*
 * Copyright lb-controller authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.lbcontroller.operator.common.metrics;

import io.lbcontroller.operator.common.MetricsProvider;
import io.lbcontroller.operator.common.model.LabelPredicate;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Abstract base class holding the common reconciliation metrics. Subclasses can add more specialized metrics.
 */
public abstract class MetricsHolder {
    /**
     * Prefix used for metrics provided by the controller
     */
    public static final String METRICS_PREFIX = "lbc.";
    /**
     * Metric name for number of reconciliations.
     */
    public static final String METRICS_RECONCILIATIONS = METRICS_PREFIX + "reconciliations";
    /**
     * Metric name for number of periodic reconciliations.
     */
    public static final String METRICS_RECONCILIATIONS_PERIODICAL = METRICS_RECONCILIATIONS + ".periodical";
    /**
     * Metric name for number of failed reconciliations.
     */
    public static final String METRICS_RECONCILIATIONS_FAILED = METRICS_RECONCILIATIONS + ".failed";
    /**
     * Metric name for number of cancelled reconciliations.
     */
    public static final String METRICS_RECONCILIATIONS_CANCELLED = METRICS_RECONCILIATIONS + ".cancelled";
    /**
     * Metric name for number of successful reconciliations.
     */
    public static final String METRICS_RECONCILIATIONS_SUCCESSFUL = METRICS_RECONCILIATIONS + ".successful";
    /**
     * Metric name for duration of reconciliations.
     */
    public static final String METRICS_RECONCILIATIONS_DURATION = METRICS_RECONCILIATIONS + ".duration";
    /**
     * Metric name for number of locked reconciliations.
     */
    public static final String METRICS_RECONCILIATIONS_LOCKED = METRICS_RECONCILIATIONS + ".locked";

    protected final String kind;
    protected final LabelPredicate selector;
    protected final MetricsProvider metricsProvider;

    private final Map<MetricKey, Counter> periodicReconciliationsCounterMap = new ConcurrentHashMap<>(1);
    private final Map<MetricKey, Counter> reconciliationsCounterMap = new ConcurrentHashMap<>(1);
    private final Map<MetricKey, Counter> failedReconciliationsCounterMap = new ConcurrentHashMap<>(1);
    private final Map<MetricKey, Counter> cancelledReconciliationsCounterMap = new ConcurrentHashMap<>(1);
    private final Map<MetricKey, Counter> successfulReconciliationsCounterMap = new ConcurrentHashMap<>(1);
    private final Map<MetricKey, Counter> lockedReconciliationsCounterMap = new ConcurrentHashMap<>(1);
    private final Map<MetricKey, Timer> reconciliationsTimerMap = new ConcurrentHashMap<>(1);

    /**
     * Constructs the metrics holder
     *
     * @param kind              Kind of the resources for which these metrics apply
     * @param selector          Selector used by the controller (used as a metric tag)
     * @param metricsProvider   Metrics provider
     */
    public MetricsHolder(String kind, LabelPredicate selector, MetricsProvider metricsProvider) {
        this.kind = kind;
        this.selector = selector;
        this.metricsProvider = metricsProvider;
    }

    /**
     * Metrics provider used for the metrics by this holder class
     *
     * @return  Metrics provider
     */
    public MetricsProvider metricsProvider()    {
        return metricsProvider;
    }

    /**
     * Counter metric for number of periodic reconciliations. It is incremented once per timer-trigger, not for every
     * resource found by the periodical reconciliation.
     *
     * @param namespace     Namespace of the resources being reconciled
     *
     * @return  Metrics counter
     */
    public Counter periodicReconciliationsCounter(String namespace) {
        return getCounter(new MetricKey(kind, namespace), METRICS_RECONCILIATIONS_PERIODICAL,
                "Number of periodical reconciliations done by the controller", periodicReconciliationsCounterMap);
    }

    /**
     * Counter metric for number of reconciliations. Each reconciliation increments it once.
     *
     * @param namespace     Namespace of the resources being reconciled
     *
     * @return  Metrics counter
     */
    public Counter reconciliationsCounter(String namespace) {
        return getCounter(new MetricKey(kind, namespace), METRICS_RECONCILIATIONS,
                "Number of reconciliations done by the controller for individual resources", reconciliationsCounterMap);
    }

    /**
     * Counter metric for number of failed reconciliations.
     *
     * @param namespace     Namespace of the resources being reconciled
     *
     * @return  Metrics counter
     */
    public Counter failedReconciliationsCounter(String namespace) {
        return getCounter(new MetricKey(kind, namespace), METRICS_RECONCILIATIONS_FAILED,
                "Number of reconciliations done by the controller for individual resources which failed", failedReconciliationsCounterMap);
    }

    /**
     * Counter metric for number of reconciliations aborted by cancellation or deadline.
     *
     * @param namespace     Namespace of the resources being reconciled
     *
     * @return  Metrics counter
     */
    public Counter cancelledReconciliationsCounter(String namespace) {
        return getCounter(new MetricKey(kind, namespace), METRICS_RECONCILIATIONS_CANCELLED,
                "Number of reconciliations done by the controller for individual resources which were cancelled", cancelledReconciliationsCounterMap);
    }

    /**
     * Counter metric for number of successful reconciliations.
     *
     * @param namespace     Namespace of the resources being reconciled
     *
     * @return  Metrics counter
     */
    public Counter successfulReconciliationsCounter(String namespace) {
        return getCounter(new MetricKey(kind, namespace), METRICS_RECONCILIATIONS_SUCCESSFUL,
                "Number of reconciliations done by the controller for individual resources which were successful", successfulReconciliationsCounterMap);
    }

    /**
     * Timer which measures how long do the reconciliations take.
     *
     * @param namespace     Namespace of the resources being reconciled
     *
     * @return  Metrics timer
     */
    public Timer reconciliationsTimer(String namespace) {
        return metric(new MetricKey(kind, namespace), reconciliationsTimerMap,
                tags -> metricsProvider.timer(METRICS_RECONCILIATIONS_DURATION, "The time the reconciliation takes to complete", tags));
    }

    /**
     * Counter metric for number of reconciliations which did not happen because they did not get the lock (which means
     * that another reconciliation for the same resource was in progress).
     *
     * @param namespace     Namespace of the resources being reconciled
     *
     * @return  Metrics counter
     */
    public Counter lockedReconciliationsCounter(String namespace) {
        return getCounter(new MetricKey(kind, namespace), METRICS_RECONCILIATIONS_LOCKED,
                "Number of reconciliations skipped because another reconciliation for the same resource was still running", lockedReconciliationsCounterMap);
    }

    /**
     * Gets or creates the metric.
     *
     * @param metricKey         Key of the metric
     * @param metricMap         The map with the metrics
     * @param fn                Method for creating the metric from its tags
     *
     * @return  Metric
     *
     * @param <M>   Type of the metric
     */
    protected <M> M metric(MetricKey metricKey, Map<MetricKey, M> metricMap, Function<Tags, M> fn) {
        return metricMap.computeIfAbsent(metricKey, k -> fn.apply(tags(k)));
    }

    /**
     * Creates or gets a counter-type metric.
     *
     * @param metricKey         Key of the metric
     * @param metricName        Name of the metric
     * @param metricHelp        Help description of the metric
     * @param counterMap        Map with counters
     *
     * @return  Counter metric
     */
    protected Counter getCounter(MetricKey metricKey, String metricName, String metricHelp, Map<MetricKey, Counter> counterMap) {
        return metric(metricKey, counterMap, tags -> metricsProvider.counter(metricName, metricHelp, tags));
    }

    private Tags tags(MetricKey key) {
        return Tags.of(
                Tag.of("kind", key.kind()),
                Tag.of("namespace", key.namespace() == null || "*".equals(key.namespace()) ? "" : key.namespace()),
                Tag.of("selector", selector != null ? selector.toSelectorString() : ""));
    }
}
