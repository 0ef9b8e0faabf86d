/*
 * Copyright lb-controller authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.lbcontroller.operator.networking.securitygroup;

import io.lbcontroller.operator.common.Reconciliation;
import io.lbcontroller.operator.common.ReconciliationLogger;
import io.lbcontroller.operator.networking.reconcile.FetchFailureException;
import io.lbcontroller.operator.networking.reconcile.ReconcilePlan;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Reconciles the security group rules in a single pass: fetch the current rules, compute the difference to the
 * desired rules, revoke the extra rules selected by the options and grant the missing rules. The reconciler holds no
 * state. Parallel reconciliations of the same security group have to be prevented by the caller.
 */
public class DefaultSecurityGroupReconciler implements SecurityGroupReconciler {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(DefaultSecurityGroupReconciler.class);

    private final SecurityGroupManager securityGroupManager;

    /**
     * Constructor
     *
     * @param securityGroupManager  Manager used to read and modify the security groups
     */
    public DefaultSecurityGroupReconciler(SecurityGroupManager securityGroupManager) {
        this.securityGroupManager = securityGroupManager;
    }

    @Override
    public void reconcileIngress(Reconciliation reconciliation, String groupId, Collection<IpPermission> desired, SecurityGroupReconcileOptions options) {
        reconcile(reconciliation, groupId, RuleDirection.INGRESS, desired, options);
    }

    @Override
    public void reconcileEgress(Reconciliation reconciliation, String groupId, Collection<IpPermission> desired, SecurityGroupReconcileOptions options) {
        reconcile(reconciliation, groupId, RuleDirection.EGRESS, desired, options);
    }

    private void reconcile(Reconciliation reconciliation, String groupId, RuleDirection direction, Collection<IpPermission> desired, SecurityGroupReconcileOptions options) {
        ReconcilePlan.throwIfCancelled(reconciliation, "fetching security group " + groupId);

        Map<String, SecurityGroupInfo> securityGroups = securityGroupManager.fetchSecurityGroups(reconciliation, List.of(groupId));
        SecurityGroupInfo securityGroup = securityGroups.get(groupId);

        if (securityGroup == null) {
            throw new FetchFailureException(groupId, "Security group " + groupId + " was not found");
        }

        ReconcilePlan<IpPermission> plan = ReconcilePlan.compute(
                securityGroup.permissions(direction),
                singlePeerRules(desired),
                IpPermissionEquality.INSTANCE,
                permission -> options.permissionSelector().test(permission.labels()));

        if (plan.isEmpty()) {
            LOGGER.debugCr(reconciliation, "{} rules of security group {} are up to date", direction, groupId);
            return;
        }

        LOGGER.infoCr(reconciliation, "Reconciling {} rules of security group {}: revoking {} and granting {} rules",
                direction, groupId, plan.toRevoke().size(), plan.toGrant().size());

        plan.execute(reconciliation,
                toRevoke -> securityGroupManager.revoke(reconciliation, groupId, direction, toRevoke),
                toGrant -> securityGroupManager.grant(reconciliation, groupId, direction, toGrant));
    }

    // Observed rules have exactly one peer, so desired rules are brought to the same shape before the diff
    private static List<IpPermission> singlePeerRules(Collection<IpPermission> desired) {
        List<IpPermission> rules = new ArrayList<>();

        if (desired != null) {
            for (IpPermission permission : desired) {
                rules.addAll(permission.perPeer());
            }
        }

        return rules;
    }
}
