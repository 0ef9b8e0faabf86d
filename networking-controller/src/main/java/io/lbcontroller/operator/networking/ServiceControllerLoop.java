/*
 * Copyright lb-controller authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.lbcontroller.operator.networking;

import io.lbcontroller.operator.common.Reconciliation;
import io.lbcontroller.operator.common.ReconciliationCancelledException;
import io.lbcontroller.operator.common.ReconciliationLogger;
import io.lbcontroller.operator.common.controller.AbstractControllerLoop;
import io.lbcontroller.operator.common.controller.ControllerQueue;
import io.lbcontroller.operator.common.controller.ReconciliationLockManager;
import io.lbcontroller.operator.common.metrics.ControllerMetricsHolder;
import io.lbcontroller.operator.common.model.LabelPredicate;
import io.lbcontroller.operator.networking.DesiredIngressSource.DesiredIngress;
import io.lbcontroller.operator.networking.reconcile.ResourceLockedException;
import io.lbcontroller.operator.networking.securitygroup.IpPermission;
import io.lbcontroller.operator.networking.securitygroup.SecurityGroupReconcileOptions;
import io.lbcontroller.operator.networking.securitygroup.SecurityGroupReconciler;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Controller loop reconciling the inbound security group rules of a Service. The rules of a Service are stamped with
 * its ownership labels and only the observed rules carrying them are considered for revocation, so Services sharing
 * a security group never revoke each other's rules. The reconciliations of one security group are serialized.
 */
public class ServiceControllerLoop extends AbstractControllerLoop {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(ServiceControllerLoop.class);

    /*test*/ static final long GROUP_LOCK_TIMEOUT_MS = 10_000;

    private final ReconciliationLockManager lockManager;
    private final ControllerMetricsHolder metrics;
    private final DesiredIngressSource desiredIngressSource;
    private final SecurityGroupReconciler securityGroupReconciler;
    private final SecurityGroupReconcileOptions options;

    /**
     * Creates the controller loop
     *
     * @param name                      Name of the loop
     * @param workQueue                 Work queue
     * @param lockManager               Lock manager, shared by the loops for the Service and security group locks
     * @param scheduledExecutor         Scheduled executor for the progress warnings
     * @param metrics                   Metrics holder
     * @param desiredIngressSource      Source of the desired rules
     * @param securityGroupReconciler   Security group reconciler
     * @param options                   Options of the security group reconciliations
     */
    public ServiceControllerLoop(String name, ControllerQueue workQueue, ReconciliationLockManager lockManager,
                                 ScheduledExecutorService scheduledExecutor, ControllerMetricsHolder metrics,
                                 DesiredIngressSource desiredIngressSource, SecurityGroupReconciler securityGroupReconciler,
                                 SecurityGroupReconcileOptions options) {
        super(name, workQueue, lockManager, scheduledExecutor);

        this.lockManager = lockManager;
        this.metrics = metrics;
        this.desiredIngressSource = desiredIngressSource;
        this.securityGroupReconciler = securityGroupReconciler;
        this.options = options;
    }

    /**
     * @param groupId   ID of the security group
     *
     * @return  Name of the lock serializing the reconciliations of the security group
     */
    /*test*/ static String groupLockName(String groupId) {
        return "sg::" + groupId;
    }

    @Override
    protected void reconcile(Reconciliation reconciliation) {
        Optional<DesiredIngress> desired = desiredIngressSource.desiredIngress(reconciliation, reconciliation.resource());

        if (desired.isEmpty()) {
            LOGGER.debugCr(reconciliation, "No security group is managed for this Service");
            return;
        }

        String groupId = desired.get().groupId();
        Map<String, String> ownership = ServiceController.ownershipLabels(reconciliation.resource());

        List<IpPermission> owned = new ArrayList<>(desired.get().permissions().size());
        for (IpPermission permission : desired.get().permissions()) {
            owned.add(permission.withOwnership(ownership));
        }

        SecurityGroupReconcileOptions scoped = options.withPermissionSelector(options.permissionSelector().and(LabelPredicate.fromMap(ownership)));

        // The Service lock is always held before the group lock, so the two cannot deadlock
        String lockName = groupLockName(groupId);
        boolean locked;
        try {
            locked = lockManager.tryLock(lockName, GROUP_LOCK_TIMEOUT_MS, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ReconciliationCancelledException("Interrupted while waiting for the lock of security group " + groupId, e);
        }

        if (!locked) {
            throw new ResourceLockedException(groupId, "Security group " + groupId + " is being reconciled for another Service");
        }

        try {
            securityGroupReconciler.reconcileIngress(reconciliation, groupId, owned, scoped);
        } finally {
            lockManager.unlock(lockName);
        }
    }

    @Override
    protected ControllerMetricsHolder metrics() {
        return metrics;
    }
}
