/*
 * Copyright lb-controller authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.lbcontroller.operator.networking;

import io.lbcontroller.operator.common.MicrometerMetricsProvider;
import io.lbcontroller.operator.common.Reconciliation;
import io.lbcontroller.operator.common.model.NamespaceAndName;
import io.lbcontroller.operator.networking.reconcile.GrantFailureException;
import io.lbcontroller.operator.networking.securitygroup.DefaultSecurityGroupReconciler;
import io.lbcontroller.operator.networking.securitygroup.IpPermission;
import io.lbcontroller.operator.networking.securitygroup.MockSecurityGroupManager;
import io.lbcontroller.operator.networking.securitygroup.RuleDirection;
import io.lbcontroller.operator.networking.securitygroup.SecurityGroupReconcileOptions;
import io.lbcontroller.operator.networking.securitygroup.SecurityGroupReconciler;
import io.lbcontroller.test.TestUtils;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.empty;

public class ServiceControllerTest {
    private static final String NAMESPACE = "my-namespace";
    private static final String GROUP_ID = "sg-0123456789abcdef0";
    private static final String SELECTOR = "elbv2.k8s.aws/cluster=my-cluster";

    private static final IpPermission MANAGED_HTTPS = IpPermission.forIpv4Cidr("tcp", 443, 443, "10.0.0.0/8", SELECTOR);
    private static final IpPermission MANAGED_STALE = IpPermission.forIpv4Cidr("tcp", 443, 443, "0.0.0.0/0", SELECTOR);
    private static final IpPermission FOREIGN = IpPermission.forIpv4Cidr("tcp", 22, 22, "172.16.0.0/12", "SSH from the office");
    private static final IpPermission MANAGED_HTTP = IpPermission.forIpv4Cidr("tcp", 80, 80, "10.0.0.0/8", SELECTOR);

    private static final IpPermission OWNED_HTTPS = owned("my-service", MANAGED_HTTPS);
    private static final IpPermission OWNED_STALE = owned("my-service", MANAGED_STALE);

    private final MeterRegistry registry = new SimpleMeterRegistry();
    private final MockSecurityGroupManager manager = new MockSecurityGroupManager();
    private final InMemoryIngressSource source = new InMemoryIngressSource();
    private ServiceController controller;

    @AfterEach
    public void teardown() {
        if (controller != null) {
            controller.stop();
        }
    }

    private static IpPermission owned(String service, IpPermission permission) {
        return permission.withOwnership(ServiceController.ownershipLabels(new NamespaceAndName(NAMESPACE, service)));
    }

    private ServiceController createController(long resyncIntervalMs) {
        return createController(resyncIntervalMs, new DefaultSecurityGroupReconciler(manager));
    }

    private ServiceController createController(long resyncIntervalMs, SecurityGroupReconciler reconciler) {
        ControllerConfig config = ControllerConfig.buildFromMap(Map.of(
                ControllerConfig.CLUSTER_NAME.key(), "my-cluster",
                ControllerConfig.SERVICE_MAX_CONCURRENT_RECONCILES.key(), "2",
                ControllerConfig.FULL_RECONCILIATION_INTERVAL_MS.key(), String.valueOf(resyncIntervalMs),
                ControllerConfig.MANAGED_PERMISSION_SELECTOR.key(), SELECTOR));

        return new ServiceController(config, source, reconciler, new MicrometerMetricsProvider(registry));
    }

    @Test
    public void testReconcilesOnlyManagedRules() {
        manager.withSecurityGroup(GROUP_ID, List.of(OWNED_STALE, FOREIGN), List.of());
        source.put("my-service", GROUP_ID, List.of(MANAGED_HTTPS));

        controller = createController(3_600_000L);
        controller.start();
        controller.enqueue(NAMESPACE, "my-service");

        TestUtils.waitFor("Service reconciliation", 10, 10_000, () -> counter("lbc.reconciliations.successful") == 1.0);
        assertThat(manager.rules(GROUP_ID, RuleDirection.INGRESS), containsInAnyOrder(FOREIGN, OWNED_HTTPS));
    }

    @Test
    public void testServiceWithoutSecurityGroupIsSkipped() {
        controller = createController(3_600_000L);
        controller.start();
        controller.enqueue(NAMESPACE, "not-a-load-balancer");

        TestUtils.waitFor("Service reconciliation", 10, 10_000, () -> counter("lbc.reconciliations.successful") == 1.0);
        assertThat(manager.calls().isEmpty(), is(true));
    }

    @Test
    public void testFailedReconciliationIsRetried() {
        manager.withSecurityGroup(GROUP_ID, List.of(), List.of());
        manager.failNextGrant(new GrantFailureException(GROUP_ID, "RequestLimitExceeded"));
        source.put("my-service", GROUP_ID, List.of(MANAGED_HTTPS));

        controller = createController(3_600_000L);
        controller.start();
        controller.enqueue(NAMESPACE, "my-service");

        TestUtils.waitFor("Service reconciliation to be retried", 10, 10_000, () -> counter("lbc.reconciliations.successful") == 1.0);
        assertThat(counter("lbc.reconciliations.failed"), is(1.0));
        assertThat(manager.rules(GROUP_ID, RuleDirection.INGRESS), is(List.of(OWNED_HTTPS)));
    }

    @Test
    public void testPeriodicReconciliationRepairsDrift() {
        manager.withSecurityGroup(GROUP_ID, List.of(OWNED_HTTPS), List.of());
        source.put("my-service", GROUP_ID, List.of(MANAGED_HTTPS));

        controller = createController(100L);
        controller.start();
        TestUtils.waitFor("first periodic reconciliation", 10, 10_000, () -> counter("lbc.reconciliations.successful") >= 1.0);

        // Somebody replaced the rule outside of the controller
        manager.withSecurityGroup(GROUP_ID, List.of(OWNED_STALE, FOREIGN), List.of());

        TestUtils.waitFor("drift to be repaired", 10, 10_000,
                () -> manager.rules(GROUP_ID, RuleDirection.INGRESS).size() == 2 && manager.rules(GROUP_ID, RuleDirection.INGRESS).contains(OWNED_HTTPS));
        assertThat(manager.rules(GROUP_ID, RuleDirection.INGRESS), containsInAnyOrder(FOREIGN, OWNED_HTTPS));
    }

    @Test
    public void testServicesSharingSecurityGroupKeepEachOthersRules() {
        manager.withSecurityGroup(GROUP_ID, List.of(FOREIGN), List.of());
        source.put("frontend", GROUP_ID, List.of(MANAGED_HTTPS));
        source.put("backend", GROUP_ID, List.of(MANAGED_HTTP));

        controller = createController(3_600_000L);
        controller.start();
        controller.enqueue(NAMESPACE, "frontend");
        controller.enqueue(NAMESPACE, "backend");

        TestUtils.waitFor("both Services to be reconciled", 10, 10_000, () -> counter("lbc.reconciliations.successful") == 2.0);
        assertThat(manager.rules(GROUP_ID, RuleDirection.INGRESS),
                containsInAnyOrder(FOREIGN, owned("frontend", MANAGED_HTTPS), owned("backend", MANAGED_HTTP)));

        // Converged: another pass of each Service leaves the group alone
        manager.clearCalls();
        controller.enqueue(NAMESPACE, "frontend");
        controller.enqueue(NAMESPACE, "backend");

        TestUtils.waitFor("both Services to be reconciled again", 10, 10_000, () -> counter("lbc.reconciliations.successful") == 4.0);
        assertThat(manager.mutations(), is(empty()));
        assertThat(manager.rules(GROUP_ID, RuleDirection.INGRESS),
                containsInAnyOrder(FOREIGN, owned("frontend", MANAGED_HTTPS), owned("backend", MANAGED_HTTP)));
    }

    @Test
    public void testDeletedServiceRevokesOnlyItsOwnRules() {
        manager.withSecurityGroup(GROUP_ID, List.of(owned("frontend", MANAGED_HTTPS), owned("backend", MANAGED_HTTP)), List.of());
        source.put("frontend", GROUP_ID, List.of());

        controller = createController(3_600_000L);
        controller.start();
        controller.enqueue(NAMESPACE, "frontend");

        TestUtils.waitFor("Service reconciliation", 10, 10_000, () -> counter("lbc.reconciliations.successful") == 1.0);
        assertThat(manager.rules(GROUP_ID, RuleDirection.INGRESS), is(List.of(owned("backend", MANAGED_HTTP))));
    }

    @Test
    public void testReconciliationsOfSharedSecurityGroupAreSerialized() {
        manager.withSecurityGroup(GROUP_ID, List.of(), List.of());
        for (int i = 0; i < 4; i++) {
            source.put("service-" + i, GROUP_ID, List.of(IpPermission.forIpv4Cidr("tcp", 8080 + i, 8080 + i, "10.0.0.0/8", SELECTOR)));
        }

        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        SecurityGroupReconciler delegate = new DefaultSecurityGroupReconciler(manager);
        SecurityGroupReconciler recording = new SecurityGroupReconciler() {
            @Override
            public void reconcileIngress(Reconciliation reconciliation, String groupId, Collection<IpPermission> desired, SecurityGroupReconcileOptions options) {
                maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
                try {
                    Thread.sleep(50);
                    delegate.reconcileIngress(reconciliation, groupId, desired, options);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    inFlight.decrementAndGet();
                }
            }

            @Override
            public void reconcileEgress(Reconciliation reconciliation, String groupId, Collection<IpPermission> desired, SecurityGroupReconcileOptions options) {
                delegate.reconcileEgress(reconciliation, groupId, desired, options);
            }
        };

        controller = createController(3_600_000L, recording);
        controller.start();
        for (int i = 0; i < 4; i++) {
            controller.enqueue(NAMESPACE, "service-" + i);
        }

        TestUtils.waitFor("all Services to be reconciled", 10, 10_000, () -> counter("lbc.reconciliations.successful") == 4.0);
        assertThat(maxInFlight.get(), is(1));
        assertThat(manager.rules(GROUP_ID, RuleDirection.INGRESS).size(), is(4));
    }

    private double counter(String name) {
        Counter counter = registry.find(name).tag("kind", ServiceController.RESOURCE_KIND).tag("namespace", NAMESPACE).counter();
        return counter == null ? 0.0 : counter.count();
    }

    static class InMemoryIngressSource implements DesiredIngressSource {
        private final Map<NamespaceAndName, DesiredIngress> services = new ConcurrentHashMap<>();

        void put(String name, String groupId, List<IpPermission> permissions) {
            services.put(new NamespaceAndName(NAMESPACE, name), new DesiredIngress(groupId, permissions));
        }

        @Override
        public Set<NamespaceAndName> services() {
            return Set.copyOf(services.keySet());
        }

        @Override
        public Optional<DesiredIngress> desiredIngress(Reconciliation reconciliation, NamespaceAndName service) {
            return Optional.ofNullable(services.get(service));
        }
    }
}
