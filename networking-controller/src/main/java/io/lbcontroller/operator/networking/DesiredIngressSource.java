/*
 * Copyright lb-controller authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.lbcontroller.operator.networking;

import io.lbcontroller.operator.common.Reconciliation;
import io.lbcontroller.operator.common.model.NamespaceAndName;
import io.lbcontroller.operator.networking.securitygroup.IpPermission;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Derives the desired inbound security group rules from the Kubernetes Services. Implemented on top of the Kubernetes
 * informers which are not part of this module.
 */
public interface DesiredIngressSource {
    /**
     * @return  All Services which might need their security group rules reconciled
     */
    Set<NamespaceAndName> services();

    /**
     * Returns the desired rules of the Service. A deleted Service should return its security group with no rules so
     * that the owned rules are revoked.
     *
     * @param reconciliation    Reconciliation marker
     * @param service           The Service
     *
     * @return  The desired rules, or empty if the Service does not manage any security group
     */
    Optional<DesiredIngress> desiredIngress(Reconciliation reconciliation, NamespaceAndName service);

    /**
     * Desired inbound rules of a security group
     *
     * @param groupId       ID of the security group
     * @param permissions   Desired rules
     */
    record DesiredIngress(String groupId, List<IpPermission> permissions) {
        /**
         * Constructor
         *
         * @param groupId       ID of the security group
         * @param permissions   Desired rules
         */
        public DesiredIngress {
            permissions = permissions == null ? List.of() : List.copyOf(permissions);
        }
    }
}
