/*
 * Copyright lb-controller authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.lbcontroller.operator.networking.securitygroup;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Observed state of a security group. It is a view fetched for every reconciliation and is never cached.
 *
 * @param groupId   Security group ID
 * @param ingress   Inbound rules, one rule per peer
 * @param egress    Outbound rules, one rule per peer
 * @param tags      Tags of the security group
 */
public record SecurityGroupInfo(String groupId, List<IpPermission> ingress, List<IpPermission> egress, Map<String, String> tags) {
    /**
     * Constructor
     *
     * @param groupId   Security group ID
     * @param ingress   Inbound rules
     * @param egress    Outbound rules
     * @param tags      Tags of the security group
     */
    public SecurityGroupInfo {
        Objects.requireNonNull(groupId, "groupId");
        ingress = ingress == null ? List.of() : List.copyOf(ingress);
        egress = egress == null ? List.of() : List.copyOf(egress);
        tags = tags == null ? Map.of() : Map.copyOf(tags);
    }

    /**
     * @param direction     Direction of the rules
     *
     * @return  The rules in the given direction
     */
    public List<IpPermission> permissions(RuleDirection direction) {
        return direction == RuleDirection.INGRESS ? ingress : egress;
    }
}
