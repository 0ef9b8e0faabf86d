/*
 * Copyright lb-controller authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.lbcontroller.operator.networking.securitygroup;

import io.lbcontroller.operator.networking.reconcile.EqualityPolicy;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Two rules are the same rule when they have:
 *
 * <ul>
 *     <li>the same protocol (names and numbers of well-known protocols are interchangeable, case is ignored)</li>
 *     <li>the same port range (null ports mean all ports). Ports are not compared for rules of all protocols, EC2
 *     reads them back without ports whatever was authorized.</li>
 *     <li>the same peers, compared as sets of type, value and description (null description is the same as an empty
 *     description, CIDR blocks are compared case-insensitively)</li>
 * </ul>
 *
 * The labels are never compared.
 */
public final class IpPermissionEquality implements EqualityPolicy<IpPermission> {
    /**
     * Shared instance
     */
    public static final IpPermissionEquality INSTANCE = new IpPermissionEquality();

    private static final Map<String, String> PROTOCOL_ALIASES = Map.of(
            "tcp", "6",
            "udp", "17",
            "icmp", "1",
            "icmpv6", "58",
            "all", IpPermission.ALL_PROTOCOLS
    );

    private IpPermissionEquality() { }

    @Override
    public boolean equivalent(IpPermission a, IpPermission b) {
        if (a == b) {
            return true;
        } else if (a == null || b == null) {
            return false;
        }

        String protocol = normalizeProtocol(a.protocol());

        return protocol.equals(normalizeProtocol(b.protocol()))
                && (IpPermission.ALL_PROTOCOLS.equals(protocol) || samePorts(a, b))
                && peerKeys(a.peers()).equals(peerKeys(b.peers()));
    }

    /**
     * Normalizes the protocol to its number
     *
     * @param protocol  Protocol name or number
     *
     * @return  Protocol number as a string, or the lower-cased value for unknown names
     */
    public static String normalizeProtocol(String protocol) {
        String lowerCase = protocol.trim().toLowerCase(Locale.ROOT);
        return PROTOCOL_ALIASES.getOrDefault(lowerCase, lowerCase);
    }

    private static boolean samePorts(IpPermission a, IpPermission b) {
        return Objects.equals(a.fromPort(), b.fromPort()) && Objects.equals(a.toPort(), b.toPort());
    }

    private static Set<PeerKey> peerKeys(List<Peer> peers) {
        Set<PeerKey> keys = new HashSet<>(peers.size());

        for (Peer peer : peers) {
            String value = peer.type() == PeerType.IPV4_CIDR || peer.type() == PeerType.IPV6_CIDR
                    ? peer.value().toLowerCase(Locale.ROOT) : peer.value();
            keys.add(new PeerKey(peer.type(), value, peer.description() == null ? "" : peer.description()));
        }

        return keys;
    }

    private record PeerKey(PeerType type, String value, String description) { }
}
