/*
 * Copyright lb-controller authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.lbcontroller.operator.networking;

import io.lbcontroller.operator.common.InvalidConfigurationException;
import io.lbcontroller.operator.common.model.LabelPredicate;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class ControllerConfigTest {
    private static final Map<String, String> ENV_VARS = new HashMap<>();
    static {
        ENV_VARS.put(ControllerConfig.CLUSTER_NAME.key(), "my-cluster");
        ENV_VARS.put(ControllerConfig.SERVICE_MAX_CONCURRENT_RECONCILES.key(), "5");
        ENV_VARS.put(ControllerConfig.TARGETGROUPBINDING_MAX_CONCURRENT_RECONCILES.key(), "7");
        ENV_VARS.put(ControllerConfig.WORK_QUEUE_SIZE.key(), "256");
        ENV_VARS.put(ControllerConfig.FULL_RECONCILIATION_INTERVAL_MS.key(), "60000");
        ENV_VARS.put(ControllerConfig.RETRY_MAX_ATTEMPTS.key(), "4");
        ENV_VARS.put(ControllerConfig.MANAGED_PERMISSION_SELECTOR.key(), "elbv2.k8s.aws/cluster=my-cluster");
    }

    @Test
    public void testConfig() {
        ControllerConfig config = ControllerConfig.buildFromMap(ENV_VARS);

        assertThat(config.getClusterName(), is("my-cluster"));
        assertThat(config.getServiceMaxConcurrentReconciles(), is(5));
        assertThat(config.getTargetGroupBindingMaxConcurrentReconciles(), is(7));
        assertThat(config.getWorkQueueSize(), is(256));
        assertThat(config.getFullReconciliationIntervalMs(), is(60_000L));
        assertThat(config.getRetryMaxAttempts(), is(4));
        assertThat(config.getManagedPermissionSelector(), is(LabelPredicate.fromString("elbv2.k8s.aws/cluster=my-cluster")));
    }

    @Test
    public void testDefaults() {
        ControllerConfig config = ControllerConfig.buildFromMap(Map.of(ControllerConfig.CLUSTER_NAME.key(), "my-cluster"));

        assertThat(config.getServiceMaxConcurrentReconciles(), is(3));
        assertThat(config.getTargetGroupBindingMaxConcurrentReconciles(), is(3));
        assertThat(config.getWorkQueueSize(), is(1024));
        assertThat(config.getFullReconciliationIntervalMs(), is(36_000_000L));
        assertThat(config.getRetryMaxAttempts(), is(6));
        assertThat(config.getManagedPermissionSelector(), is(LabelPredicate.EVERYTHING));
    }

    @Test
    public void testUnknownKeysAreIgnored() {
        Map<String, String> envVars = new HashMap<>(ENV_VARS);
        envVars.put("PATH", "/usr/bin");

        ControllerConfig config = ControllerConfig.buildFromMap(envVars);

        assertThat(ControllerConfig.keyNames().contains("PATH"), is(false));
        assertThat(config.getClusterName(), is("my-cluster"));
    }

    @Test
    public void testMissingClusterName() {
        Map<String, String> envVars = new HashMap<>(ENV_VARS);
        envVars.remove(ControllerConfig.CLUSTER_NAME.key());

        InvalidConfigurationException e = assertThrows(InvalidConfigurationException.class, () -> ControllerConfig.buildFromMap(envVars));
        assertThat(e.getMessage(), is("Config value: LBC_CLUSTER_NAME is mandatory"));
    }

    @Test
    public void testInvalidConcurrency() {
        Map<String, String> envVars = new HashMap<>(ENV_VARS);

        envVars.put(ControllerConfig.SERVICE_MAX_CONCURRENT_RECONCILES.key(), "0");
        assertThrows(InvalidConfigurationException.class, () -> ControllerConfig.buildFromMap(envVars));

        envVars.put(ControllerConfig.SERVICE_MAX_CONCURRENT_RECONCILES.key(), "-3");
        assertThrows(InvalidConfigurationException.class, () -> ControllerConfig.buildFromMap(envVars));

        envVars.put(ControllerConfig.SERVICE_MAX_CONCURRENT_RECONCILES.key(), "three");
        assertThrows(InvalidConfigurationException.class, () -> ControllerConfig.buildFromMap(envVars));
    }

    @Test
    public void testInvalidSelector() {
        Map<String, String> envVars = new HashMap<>(ENV_VARS);
        envVars.put(ControllerConfig.MANAGED_PERMISSION_SELECTOR.key(), "owner in (frontend");

        InvalidConfigurationException e = assertThrows(InvalidConfigurationException.class, () -> ControllerConfig.buildFromMap(envVars));
        assertThat(e.getMessage(), containsString("is not a valid label selector"));
    }

    @Test
    public void testToString() {
        String config = ControllerConfig.buildFromMap(ENV_VARS).toString();

        assertThat(config, containsString("clusterName='my-cluster'"));
        assertThat(config, containsString("managedPermissionSelector='elbv2.k8s.aws/cluster=my-cluster'"));
    }
}
