/*
 * Copyright lb-controller authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.lbcontroller.operator.networking.securitygroup;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * A single security group rule. Protocol {@code -1} means all protocols and null ports mean all ports. The labels are
 * used only for the ownership bookkeeping inside the controller and are never sent to EC2.
 *
 * @param protocol  IP protocol name or number
 * @param fromPort  Start of the port range (or ICMP type), null for all ports
 * @param toPort    End of the port range (or ICMP code), null for all ports
 * @param peers     Peers of the rule
 * @param labels    Ownership labels
 */
public record IpPermission(String protocol, Integer fromPort, Integer toPort, List<Peer> peers, Map<String, String> labels) {
    /**
     * All protocols
     */
    public static final String ALL_PROTOCOLS = "-1";

    /**
     * Constructor
     *
     * @param protocol  IP protocol name or number
     * @param fromPort  Start of the port range, null for all ports
     * @param toPort    End of the port range, null for all ports
     * @param peers     Peers of the rule
     * @param labels    Ownership labels
     */
    public IpPermission {
        Objects.requireNonNull(protocol, "protocol");
        peers = peers == null ? List.of() : List.copyOf(peers);
        labels = labels == null ? Map.of() : Map.copyOf(labels);
    }

    /**
     * Creates a rule for a single IPv4 CIDR. The ownership labels are derived from the description.
     *
     * @param protocol      Protocol
     * @param fromPort      Start of the port range
     * @param toPort        End of the port range
     * @param cidr          IPv4 CIDR
     * @param description   Rule description
     *
     * @return  The rule
     */
    public static IpPermission forIpv4Cidr(String protocol, Integer fromPort, Integer toPort, String cidr, String description) {
        return forPeer(protocol, fromPort, toPort, Peer.ipv4Cidr(cidr, description));
    }

    /**
     * Creates a rule for a single IPv6 CIDR. The ownership labels are derived from the description.
     *
     * @param protocol      Protocol
     * @param fromPort      Start of the port range
     * @param toPort        End of the port range
     * @param cidr          IPv6 CIDR
     * @param description   Rule description
     *
     * @return  The rule
     */
    public static IpPermission forIpv6Cidr(String protocol, Integer fromPort, Integer toPort, String cidr, String description) {
        return forPeer(protocol, fromPort, toPort, Peer.ipv6Cidr(cidr, description));
    }

    /**
     * Creates a rule referencing another security group. The ownership labels are derived from the description.
     *
     * @param protocol      Protocol
     * @param fromPort      Start of the port range
     * @param toPort        End of the port range
     * @param groupId       Referenced security group
     * @param description   Rule description
     *
     * @return  The rule
     */
    public static IpPermission forSecurityGroup(String protocol, Integer fromPort, Integer toPort, String groupId, String description) {
        return forPeer(protocol, fromPort, toPort, Peer.securityGroup(groupId, description));
    }

    /**
     * Creates a rule referencing a prefix list. The ownership labels are derived from the description.
     *
     * @param protocol      Protocol
     * @param fromPort      Start of the port range
     * @param toPort        End of the port range
     * @param prefixListId  Prefix list
     * @param description   Rule description
     *
     * @return  The rule
     */
    public static IpPermission forPrefixList(String protocol, Integer fromPort, Integer toPort, String prefixListId, String description) {
        return forPeer(protocol, fromPort, toPort, Peer.prefixList(prefixListId, description));
    }

    /**
     * Creates a rule with a single peer. The ownership labels are derived from the peer description.
     *
     * @param protocol  Protocol
     * @param fromPort  Start of the port range
     * @param toPort    End of the port range
     * @param peer      Peer
     *
     * @return  The rule
     */
    public static IpPermission forPeer(String protocol, Integer fromPort, Integer toPort, Peer peer) {
        return new IpPermission(protocol, fromPort, toPort, List.of(peer), RuleDescriptionLabels.parse(peer.description()));
    }

    /**
     * Splits this rule into rules with a single peer each, which is the shape in which rules are read back from EC2.
     * The labels are kept on every part.
     *
     * @return  Single-peer rules. This rule itself when it has at most one peer.
     */
    public List<IpPermission> perPeer() {
        if (peers.size() <= 1) {
            return List.of(this);
        }

        List<IpPermission> parts = new ArrayList<>(peers.size());
        for (Peer peer : peers) {
            parts.add(new IpPermission(protocol, fromPort, toPort, List.of(peer), labels));
        }

        return parts;
    }

    /**
     * Adds ownership labels to this rule. The labels are written into the description of every peer, which replaces
     * any free-form text the description had.
     *
     * @param ownership     Labels identifying the owner
     *
     * @return  Copy of this rule carrying its labels merged with the ownership labels
     */
    public IpPermission withOwnership(Map<String, String> ownership) {
        Map<String, String> merged = new TreeMap<>(labels);
        merged.putAll(ownership);
        String description = RuleDescriptionLabels.format(merged);

        List<Peer> owned = new ArrayList<>(peers.size());
        for (Peer peer : peers) {
            owned.add(new Peer(peer.type(), peer.value(), description));
        }

        return new IpPermission(protocol, fromPort, toPort, owned, merged);
    }

    /**
     * @param newLabels     The new labels
     *
     * @return  Copy of this rule with different labels
     */
    public IpPermission withLabels(Map<String, String> newLabels) {
        return new IpPermission(protocol, fromPort, toPort, peers, newLabels);
    }
}
