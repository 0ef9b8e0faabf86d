/*
 * Copyright lb-controller authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.lbcontroller.operator.networking.securitygroup;

/**
 * Direction of security group rules
 */
public enum RuleDirection {
    /**
     * Inbound rules
     */
    INGRESS,
    /**
     * Outbound rules
     */
    EGRESS
}
