/*
 * Copyright lb-controller authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.lbcontroller.operator.networking.securitygroup;

/**
 * Kind of the peer of a security group rule
 */
public enum PeerType {
    /**
     * IPv4 CIDR block
     */
    IPV4_CIDR,
    /**
     * IPv6 CIDR block
     */
    IPV6_CIDR,
    /**
     * Another security group
     */
    SECURITY_GROUP,
    /**
     * Managed prefix list
     */
    PREFIX_LIST
}
