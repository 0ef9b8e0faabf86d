/*
 * Copyright lb-controller authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.lbcontroller.operator.networking.securitygroup;

import io.lbcontroller.operator.common.Reconciliation;
import io.lbcontroller.operator.common.ReconciliationCancelledException;
import io.lbcontroller.operator.common.ReconciliationLogger;
import io.lbcontroller.operator.networking.reconcile.FetchFailureException;
import io.lbcontroller.operator.networking.reconcile.GrantFailureException;
import io.lbcontroller.operator.networking.reconcile.RevokeFailureException;
import software.amazon.awssdk.core.exception.AbortedException;
import software.amazon.awssdk.core.exception.ApiCallAttemptTimeoutException;
import software.amazon.awssdk.core.exception.ApiCallTimeoutException;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.ec2.model.AuthorizeSecurityGroupEgressRequest;
import software.amazon.awssdk.services.ec2.model.AuthorizeSecurityGroupIngressRequest;
import software.amazon.awssdk.services.ec2.model.DescribeSecurityGroupsRequest;
import software.amazon.awssdk.services.ec2.model.DescribeSecurityGroupsResponse;
import software.amazon.awssdk.services.ec2.model.IpRange;
import software.amazon.awssdk.services.ec2.model.Ipv6Range;
import software.amazon.awssdk.services.ec2.model.PrefixListId;
import software.amazon.awssdk.services.ec2.model.RevokeSecurityGroupEgressRequest;
import software.amazon.awssdk.services.ec2.model.RevokeSecurityGroupEgressResponse;
import software.amazon.awssdk.services.ec2.model.RevokeSecurityGroupIngressRequest;
import software.amazon.awssdk.services.ec2.model.RevokeSecurityGroupIngressResponse;
import software.amazon.awssdk.services.ec2.model.SecurityGroup;
import software.amazon.awssdk.services.ec2.model.Tag;
import software.amazon.awssdk.services.ec2.model.UserIdGroupPair;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Security group manager backed by the EC2 API. The EC2 client is expected to be fully configured (region,
 * credentials, retries and rate limiting).
 *
 * EC2 groups several peers into one permission. This manager splits them so that every {@link IpPermission} has
 * exactly one peer and its ownership labels can be derived from the peer description.
 */
public class Ec2SecurityGroupManager implements SecurityGroupManager {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(Ec2SecurityGroupManager.class);

    private final Ec2Client ec2Client;

    /**
     * Constructor
     *
     * @param ec2Client     EC2 client
     */
    public Ec2SecurityGroupManager(Ec2Client ec2Client) {
        this.ec2Client = ec2Client;
    }

    @Override
    public Map<String, SecurityGroupInfo> fetchSecurityGroups(Reconciliation reconciliation, Collection<String> groupIds) {
        List<String> ids = List.copyOf(new LinkedHashSet<>(groupIds));
        String resourceId = String.join(",", ids);

        if (ids.isEmpty()) {
            return Map.of();
        }

        LOGGER.debugCr(reconciliation, "Describing security groups {}", ids);
        DescribeSecurityGroupsResponse response = call(reconciliation, "describing security groups " + resourceId,
                () -> ec2Client.describeSecurityGroups(DescribeSecurityGroupsRequest.builder().groupIds(ids).build()),
                e -> new FetchFailureException(resourceId, "Failed to describe security groups " + resourceId, e));

        Map<String, SecurityGroupInfo> securityGroups = new HashMap<>(ids.size());
        for (SecurityGroup securityGroup : response.securityGroups()) {
            securityGroups.put(securityGroup.groupId(), toSecurityGroupInfo(securityGroup));
        }

        for (String id : ids) {
            if (!securityGroups.containsKey(id)) {
                throw new FetchFailureException(id, "Security group " + id + " was not found");
            }
        }

        return securityGroups;
    }

    @Override
    public void revoke(Reconciliation reconciliation, String groupId, RuleDirection direction, List<IpPermission> permissions) {
        List<software.amazon.awssdk.services.ec2.model.IpPermission> ec2Permissions = toEc2Permissions(permissions);
        Function<SdkException, RuntimeException> failure = e -> new RevokeFailureException(groupId, "Failed to revoke " + direction + " rules of security group " + groupId, e);

        LOGGER.debugCr(reconciliation, "Revoking {} rules {} from security group {}", direction, ec2Permissions, groupId);

        if (direction == RuleDirection.INGRESS) {
            RevokeSecurityGroupIngressResponse response = call(reconciliation, "revoking ingress rules of " + groupId,
                    () -> ec2Client.revokeSecurityGroupIngress(RevokeSecurityGroupIngressRequest.builder().groupId(groupId).ipPermissions(ec2Permissions).build()),
                    failure);

            if (response.hasUnknownIpPermissions() && !response.unknownIpPermissions().isEmpty()) {
                LOGGER.warnCr(reconciliation, "Ingress rules {} were already missing in security group {}", response.unknownIpPermissions(), groupId);
            }
        } else {
            RevokeSecurityGroupEgressResponse response = call(reconciliation, "revoking egress rules of " + groupId,
                    () -> ec2Client.revokeSecurityGroupEgress(RevokeSecurityGroupEgressRequest.builder().groupId(groupId).ipPermissions(ec2Permissions).build()),
                    failure);

            if (response.hasUnknownIpPermissions() && !response.unknownIpPermissions().isEmpty()) {
                LOGGER.warnCr(reconciliation, "Egress rules {} were already missing in security group {}", response.unknownIpPermissions(), groupId);
            }
        }

        LOGGER.infoCr(reconciliation, "Revoked {} {} rules from security group {}", permissions.size(), direction, groupId);
    }

    @Override
    public void grant(Reconciliation reconciliation, String groupId, RuleDirection direction, List<IpPermission> permissions) {
        List<software.amazon.awssdk.services.ec2.model.IpPermission> ec2Permissions = toEc2Permissions(permissions);
        Function<SdkException, RuntimeException> failure = e -> new GrantFailureException(groupId, "Failed to authorize " + direction + " rules of security group " + groupId, e);

        LOGGER.debugCr(reconciliation, "Authorizing {} rules {} in security group {}", direction, ec2Permissions, groupId);

        if (direction == RuleDirection.INGRESS) {
            call(reconciliation, "authorizing ingress rules of " + groupId,
                    () -> ec2Client.authorizeSecurityGroupIngress(AuthorizeSecurityGroupIngressRequest.builder().groupId(groupId).ipPermissions(ec2Permissions).build()),
                    failure);
        } else {
            call(reconciliation, "authorizing egress rules of " + groupId,
                    () -> ec2Client.authorizeSecurityGroupEgress(AuthorizeSecurityGroupEgressRequest.builder().groupId(groupId).ipPermissions(ec2Permissions).build()),
                    failure);
        }

        LOGGER.infoCr(reconciliation, "Authorized {} {} rules in security group {}", permissions.size(), direction, groupId);
    }

    /**
     * Calls the EC2 API and translates its exceptions. Aborted and timed-out calls cancel the reconciliation.
     */
    private static <T> T call(Reconciliation reconciliation, String operation, Supplier<T> call, Function<SdkException, RuntimeException> failure) {
        try {
            return call.get();
        } catch (AbortedException | ApiCallTimeoutException | ApiCallAttemptTimeoutException e) {
            throw new ReconciliationCancelledException(reconciliation + " was cancelled while " + operation, e);
        } catch (SdkException e) {
            throw failure.apply(e);
        }
    }

    /* test */ static SecurityGroupInfo toSecurityGroupInfo(SecurityGroup securityGroup) {
        Map<String, String> tags = new HashMap<>();
        for (Tag tag : securityGroup.tags()) {
            tags.put(tag.key(), tag.value());
        }

        return new SecurityGroupInfo(securityGroup.groupId(),
                fromEc2Permissions(securityGroup.ipPermissions()),
                fromEc2Permissions(securityGroup.ipPermissionsEgress()),
                tags);
    }

    /* test */ static List<IpPermission> fromEc2Permissions(List<software.amazon.awssdk.services.ec2.model.IpPermission> ec2Permissions) {
        List<IpPermission> permissions = new ArrayList<>();

        for (software.amazon.awssdk.services.ec2.model.IpPermission p : ec2Permissions) {
            for (IpRange range : p.ipRanges()) {
                permissions.add(IpPermission.forPeer(p.ipProtocol(), p.fromPort(), p.toPort(), Peer.ipv4Cidr(range.cidrIp(), range.description())));
            }

            for (Ipv6Range range : p.ipv6Ranges()) {
                permissions.add(IpPermission.forPeer(p.ipProtocol(), p.fromPort(), p.toPort(), Peer.ipv6Cidr(range.cidrIpv6(), range.description())));
            }

            for (UserIdGroupPair pair : p.userIdGroupPairs()) {
                permissions.add(IpPermission.forPeer(p.ipProtocol(), p.fromPort(), p.toPort(), Peer.securityGroup(pair.groupId(), pair.description())));
            }

            for (PrefixListId prefixList : p.prefixListIds()) {
                permissions.add(IpPermission.forPeer(p.ipProtocol(), p.fromPort(), p.toPort(), Peer.prefixList(prefixList.prefixListId(), prefixList.description())));
            }
        }

        return permissions;
    }

    /* test */ static List<software.amazon.awssdk.services.ec2.model.IpPermission> toEc2Permissions(List<IpPermission> permissions) {
        // Rules with the same protocol and ports are merged into one EC2 permission
        Map<List<Object>, List<IpPermission>> grouped = new LinkedHashMap<>();
        for (IpPermission permission : permissions) {
            List<Object> key = new ArrayList<>(3);
            key.add(permission.protocol());
            key.add(permission.fromPort());
            key.add(permission.toPort());
            grouped.computeIfAbsent(key, k -> new ArrayList<>()).add(permission);
        }

        List<software.amazon.awssdk.services.ec2.model.IpPermission> ec2Permissions = new ArrayList<>(grouped.size());
        for (List<IpPermission> group : grouped.values()) {
            IpPermission first = group.get(0);
            List<IpRange> ipRanges = new ArrayList<>();
            List<Ipv6Range> ipv6Ranges = new ArrayList<>();
            List<UserIdGroupPair> groupPairs = new ArrayList<>();
            List<PrefixListId> prefixLists = new ArrayList<>();

            for (IpPermission permission : group) {
                for (Peer peer : permission.peers()) {
                    switch (peer.type()) {
                        case IPV4_CIDR -> ipRanges.add(IpRange.builder().cidrIp(peer.value()).description(peer.description()).build());
                        case IPV6_CIDR -> ipv6Ranges.add(Ipv6Range.builder().cidrIpv6(peer.value()).description(peer.description()).build());
                        case SECURITY_GROUP -> groupPairs.add(UserIdGroupPair.builder().groupId(peer.value()).description(peer.description()).build());
                        case PREFIX_LIST -> prefixLists.add(PrefixListId.builder().prefixListId(peer.value()).description(peer.description()).build());
                    }
                }
            }

            software.amazon.awssdk.services.ec2.model.IpPermission.Builder builder = software.amazon.awssdk.services.ec2.model.IpPermission.builder()
                    .ipProtocol(first.protocol())
                    .fromPort(first.fromPort())
                    .toPort(first.toPort());

            if (!ipRanges.isEmpty()) {
                builder.ipRanges(ipRanges);
            }
            if (!ipv6Ranges.isEmpty()) {
                builder.ipv6Ranges(ipv6Ranges);
            }
            if (!groupPairs.isEmpty()) {
                builder.userIdGroupPairs(groupPairs);
            }
            if (!prefixLists.isEmpty()) {
                builder.prefixListIds(prefixLists);
            }

            ec2Permissions.add(builder.build());
        }

        return ec2Permissions;
    }
}
