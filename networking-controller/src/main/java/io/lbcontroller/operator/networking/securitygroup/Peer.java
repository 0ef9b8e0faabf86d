/*
 * Copyright lb-controller authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.lbcontroller.operator.networking.securitygroup;

import java.util.Objects;

/**
 * Source (for ingress) or destination (for egress) of a security group rule.
 *
 * @param type          Type of the peer
 * @param value         CIDR block, security group ID or prefix list ID
 * @param description   Rule description, can be null
 */
public record Peer(PeerType type, String value, String description) {
    /**
     * Constructor
     *
     * @param type          Type of the peer
     * @param value         CIDR block, security group ID or prefix list ID
     * @param description   Rule description, can be null
     */
    public Peer {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(value, "value");
    }

    /**
     * @param cidr          IPv4 CIDR
     * @param description   Description
     *
     * @return  IPv4 CIDR peer
     */
    public static Peer ipv4Cidr(String cidr, String description) {
        return new Peer(PeerType.IPV4_CIDR, cidr, description);
    }

    /**
     * @param cidr          IPv6 CIDR
     * @param description   Description
     *
     * @return  IPv6 CIDR peer
     */
    public static Peer ipv6Cidr(String cidr, String description) {
        return new Peer(PeerType.IPV6_CIDR, cidr, description);
    }

    /**
     * @param groupId       Security group ID
     * @param description   Description
     *
     * @return  Security group peer
     */
    public static Peer securityGroup(String groupId, String description) {
        return new Peer(PeerType.SECURITY_GROUP, groupId, description);
    }

    /**
     * @param prefixListId  Prefix list ID
     * @param description   Description
     *
     * @return  Prefix list peer
     */
    public static Peer prefixList(String prefixListId, String description) {
        return new Peer(PeerType.PREFIX_LIST, prefixListId, description);
    }
}
