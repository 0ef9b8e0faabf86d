/*
 * Copyright lb-controller authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.lbcontroller.operator.common.metrics;

/**
 * Key used for caching the metrics per kind and namespace.
 *
 * @param kind      Kind of the resource
 * @param namespace Namespace of the resource
 */
public record MetricKey(String kind, String namespace) {
    /**
     * Returns the key of the metric.
     *
     * @return  Key of the metric
     */
    public String getKey() {
        return String.format("%s/%s", kind, namespace);
    }
}
