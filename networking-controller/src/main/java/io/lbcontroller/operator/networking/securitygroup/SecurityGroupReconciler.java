/*
 * Copyright lb-controller authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.lbcontroller.operator.networking.securitygroup;

import io.lbcontroller.operator.common.Reconciliation;

import java.util.Collection;

/**
 * Reconciles the rules of a security group to the desired rules
 */
public interface SecurityGroupReconciler {
    /**
     * Reconciles the inbound rules of the security group
     *
     * @param reconciliation    Reconciliation marker
     * @param groupId           ID of the security group
     * @param desired           Desired inbound rules
     * @param options           Reconciliation options
     */
    void reconcileIngress(Reconciliation reconciliation, String groupId, Collection<IpPermission> desired, SecurityGroupReconcileOptions options);

    /**
     * Reconciles the outbound rules of the security group
     *
     * @param reconciliation    Reconciliation marker
     * @param groupId           ID of the security group
     * @param desired           Desired outbound rules
     * @param options           Reconciliation options
     */
    void reconcileEgress(Reconciliation reconciliation, String groupId, Collection<IpPermission> desired, SecurityGroupReconcileOptions options);

    /**
     * Reconciles the inbound rules of the security group with the default options
     *
     * @param reconciliation    Reconciliation marker
     * @param groupId           ID of the security group
     * @param desired           Desired inbound rules
     */
    default void reconcileIngress(Reconciliation reconciliation, String groupId, Collection<IpPermission> desired) {
        reconcileIngress(reconciliation, groupId, desired, SecurityGroupReconcileOptions.DEFAULT);
    }

    /**
     * Reconciles the outbound rules of the security group with the default options
     *
     * @param reconciliation    Reconciliation marker
     * @param groupId           ID of the security group
     * @param desired           Desired outbound rules
     */
    default void reconcileEgress(Reconciliation reconciliation, String groupId, Collection<IpPermission> desired) {
        reconcileEgress(reconciliation, groupId, desired, SecurityGroupReconcileOptions.DEFAULT);
    }
}
