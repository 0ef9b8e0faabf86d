/*
 * Copyright lb-controller authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.lbcontroller.operator.networking;

import io.lbcontroller.operator.common.config.ConfigParameter;
import io.lbcontroller.operator.common.model.LabelPredicate;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

import static io.lbcontroller.operator.common.config.ConfigParameterParser.INTEGER;
import static io.lbcontroller.operator.common.config.ConfigParameterParser.LABEL_PREDICATE;
import static io.lbcontroller.operator.common.config.ConfigParameterParser.LONG;
import static io.lbcontroller.operator.common.config.ConfigParameterParser.NON_EMPTY_STRING;
import static io.lbcontroller.operator.common.config.ConfigParameterParser.strictlyPositive;

/**
 * Networking controller configuration
 */
public class ControllerConfig {
    private static final Map<String, ConfigParameter<?>> CONFIG_VALUES = new HashMap<>();

    /**
     * Name of the Kubernetes cluster
     */
    public static final ConfigParameter<String> CLUSTER_NAME = new ConfigParameter<>("LBC_CLUSTER_NAME", NON_EMPTY_STRING, CONFIG_VALUES);
    /**
     * Maximum number of parallel reconciliations of Services
     */
    public static final ConfigParameter<Integer> SERVICE_MAX_CONCURRENT_RECONCILES = new ConfigParameter<>("LBC_SERVICE_MAX_CONCURRENT_RECONCILES", strictlyPositive(INTEGER), "3", CONFIG_VALUES);
    /**
     * Maximum number of parallel reconciliations of TargetGroupBindings
     */
    public static final ConfigParameter<Integer> TARGETGROUPBINDING_MAX_CONCURRENT_RECONCILES = new ConfigParameter<>("LBC_TARGETGROUPBINDING_MAX_CONCURRENT_RECONCILES", strictlyPositive(INTEGER), "3", CONFIG_VALUES);
    /**
     * Size of the work queue of each controller
     */
    public static final ConfigParameter<Integer> WORK_QUEUE_SIZE = new ConfigParameter<>("LBC_WORK_QUEUE_SIZE", strictlyPositive(INTEGER), "1024", CONFIG_VALUES);
    /**
     * How many milliseconds between the periodic reconciliations of all resources
     */
    public static final ConfigParameter<Long> FULL_RECONCILIATION_INTERVAL_MS = new ConfigParameter<>("LBC_FULL_RECONCILIATION_INTERVAL_MS", strictlyPositive(LONG), "36000000", CONFIG_VALUES);
    /**
     * How many times a failed reconciliation is retried before waiting for the next event or periodic reconciliation
     */
    public static final ConfigParameter<Integer> RETRY_MAX_ATTEMPTS = new ConfigParameter<>("LBC_RETRY_MAX_ATTEMPTS", strictlyPositive(INTEGER), "6", CONFIG_VALUES);
    /**
     * Selects the security group rules managed by the Service controller. Empty selects every rule.
     */
    public static final ConfigParameter<LabelPredicate> MANAGED_PERMISSION_SELECTOR = new ConfigParameter<>("LBC_MANAGED_PERMISSION_SELECTOR", LABEL_PREDICATE, "", CONFIG_VALUES);

    private final Map<String, Object> map;

    private ControllerConfig(Map<String, Object> map) {
        this.map = map;
    }

    /**
     * Creates the configuration from a map of environment variables. Unknown keys are ignored.
     *
     * @param map   Map with the environment variables
     *
     * @return  Controller configuration
     */
    public static ControllerConfig buildFromMap(Map<String, String> map) {
        Map<String, String> envMap = new HashMap<>(map);
        envMap.keySet().retainAll(ControllerConfig.keyNames());

        return new ControllerConfig(ConfigParameter.define(envMap, CONFIG_VALUES));
    }

    /**
     * @return Set of configuration key names
     */
    public static Set<String> keyNames() {
        return Collections.unmodifiableSet(CONFIG_VALUES.keySet());
    }

    /**
     * Gets the configuration value corresponding to the key
     *
     * @param <T>      Type of value
     * @param value    Instance of Config Parameter class
     *
     * @return         Configuration value
     */
    @SuppressWarnings("unchecked")
    public <T> T get(ConfigParameter<T> value) {
        return (T) this.map.get(value.key());
    }

    /**
     * @return  Name of the Kubernetes cluster
     */
    public String getClusterName() {
        return get(CLUSTER_NAME);
    }

    /**
     * @return  Maximum number of parallel Service reconciliations
     */
    public int getServiceMaxConcurrentReconciles() {
        return get(SERVICE_MAX_CONCURRENT_RECONCILES);
    }

    /**
     * @return  Maximum number of parallel TargetGroupBinding reconciliations
     */
    public int getTargetGroupBindingMaxConcurrentReconciles() {
        return get(TARGETGROUPBINDING_MAX_CONCURRENT_RECONCILES);
    }

    /**
     * @return  Size of the work queue
     */
    public int getWorkQueueSize() {
        return get(WORK_QUEUE_SIZE);
    }

    /**
     * @return  Interval of the periodic reconciliation
     */
    public long getFullReconciliationIntervalMs() {
        return get(FULL_RECONCILIATION_INTERVAL_MS);
    }

    /**
     * @return  Number of retries of a failed reconciliation
     */
    public int getRetryMaxAttempts() {
        return get(RETRY_MAX_ATTEMPTS);
    }

    /**
     * @return  Selector of the managed security group rules
     */
    public LabelPredicate getManagedPermissionSelector() {
        return get(MANAGED_PERMISSION_SELECTOR);
    }

    @Override
    public String toString() {
        return "ControllerConfig{" +
                "\n\tclusterName='" + getClusterName() + '\'' +
                "\n\tserviceMaxConcurrentReconciles=" + getServiceMaxConcurrentReconciles() +
                "\n\ttargetGroupBindingMaxConcurrentReconciles=" + getTargetGroupBindingMaxConcurrentReconciles() +
                "\n\tworkQueueSize=" + getWorkQueueSize() +
                "\n\tfullReconciliationIntervalMs=" + getFullReconciliationIntervalMs() +
                "\n\tretryMaxAttempts=" + getRetryMaxAttempts() +
                "\n\tmanagedPermissionSelector='" + getManagedPermissionSelector().toSelectorString() + '\'' +
                "}";
    }
}
