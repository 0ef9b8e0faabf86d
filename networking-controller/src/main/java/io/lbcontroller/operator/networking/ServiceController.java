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
import io.lbcontroller.operator.common.model.NamespaceAndName;
import io.lbcontroller.operator.networking.securitygroup.SecurityGroupReconcileOptions;
import io.lbcontroller.operator.networking.securitygroup.SecurityGroupReconciler;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Service controller queues the reconciliations of the security group rules of Services. At most
 * {@link ControllerConfig#getServiceMaxConcurrentReconciles()} Services are reconciled in parallel and a single
 * Service is never reconciled twice at the same time. Services sharing a security group are serialized on the group,
 * and each Service only manages the rules stamped with its own {@link #ownershipLabels(NamespaceAndName)}.
 */
public class ServiceController extends AbstractController {
    /**
     * Kind of the reconciled resources
     */
    public static final String RESOURCE_KIND = "Service";

    /**
     * Rule label carrying the namespace of the Service owning the rule
     */
    public static final String SERVICE_NAMESPACE_LABEL = "service.k8s.aws/namespace";

    /**
     * Rule label carrying the name of the Service owning the rule
     */
    public static final String SERVICE_NAME_LABEL = "service.k8s.aws/name";

    private final DesiredIngressSource desiredIngressSource;
    private final SecurityGroupReconciler securityGroupReconciler;
    private final SecurityGroupReconcileOptions options;

    /**
     * Creates the Service controller
     *
     * @param config                    Controller configuration
     * @param desiredIngressSource      Source of the desired security group rules
     * @param securityGroupReconciler   Security group reconciler
     * @param metricsProvider           Metrics provider
     */
    public ServiceController(ControllerConfig config, DesiredIngressSource desiredIngressSource,
                             SecurityGroupReconciler securityGroupReconciler, MetricsProvider metricsProvider) {
        super(RESOURCE_KIND, config.getServiceMaxConcurrentReconciles(), config.getWorkQueueSize(),
                config.getFullReconciliationIntervalMs(), config.getRetryMaxAttempts(), config.getManagedPermissionSelector(), metricsProvider);

        this.desiredIngressSource = desiredIngressSource;
        this.securityGroupReconciler = securityGroupReconciler;
        this.options = SecurityGroupReconcileOptions.DEFAULT.withPermissionSelector(config.getManagedPermissionSelector());
    }

    @Override
    protected AbstractControllerLoop createLoop(String name, ControllerQueue workQueue, ReconciliationLockManager lockManager,
                                                ScheduledExecutorService scheduledExecutor, ControllerMetricsHolder metrics) {
        return new ServiceControllerLoop(name, workQueue, lockManager, scheduledExecutor, metrics, desiredIngressSource, securityGroupReconciler, options);
    }

    /**
     * @param service   Namespace and name of the Service
     *
     * @return  Labels stamped on the rules granted for the Service
     */
    public static Map<String, String> ownershipLabels(NamespaceAndName service) {
        return Map.of(SERVICE_NAMESPACE_LABEL, service.namespace(), SERVICE_NAME_LABEL, service.name());
    }

    @Override
    protected Set<NamespaceAndName> knownResources() {
        return desiredIngressSource.services();
    }
}
