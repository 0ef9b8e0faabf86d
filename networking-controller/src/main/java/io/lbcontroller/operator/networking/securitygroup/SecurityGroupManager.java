/*
 * Copyright lb-controller authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.lbcontroller.operator.networking.securitygroup;

import io.lbcontroller.operator.common.Reconciliation;
import io.lbcontroller.operator.common.ReconciliationCancelledException;
import io.lbcontroller.operator.networking.reconcile.FetchFailureException;
import io.lbcontroller.operator.networking.reconcile.GrantFailureException;
import io.lbcontroller.operator.networking.reconcile.RevokeFailureException;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Reads and modifies the rules of security groups
 */
public interface SecurityGroupManager {
    /**
     * Fetches the current state of the security groups. The state is always read from the cloud provider.
     *
     * @param reconciliation    Reconciliation marker
     * @param groupIds          IDs of the security groups
     *
     * @return  Map with the state of every requested security group
     *
     * @throws FetchFailureException if the state cannot be read or any of the groups does not exist
     * @throws ReconciliationCancelledException if the call was aborted
     */
    Map<String, SecurityGroupInfo> fetchSecurityGroups(Reconciliation reconciliation, Collection<String> groupIds);

    /**
     * Removes the rules. Either all rules are removed or none.
     *
     * @param reconciliation    Reconciliation marker
     * @param groupId           ID of the security group
     * @param direction         Direction of the rules
     * @param permissions       Rules to remove
     *
     * @throws RevokeFailureException if the rules were not removed
     * @throws ReconciliationCancelledException if the call was aborted
     */
    void revoke(Reconciliation reconciliation, String groupId, RuleDirection direction, List<IpPermission> permissions);

    /**
     * Adds the rules. Either all rules are added or none. Rules which already exist are rejected.
     *
     * @param reconciliation    Reconciliation marker
     * @param groupId           ID of the security group
     * @param direction         Direction of the rules
     * @param permissions       Rules to add
     *
     * @throws GrantFailureException if the rules were not added
     * @throws ReconciliationCancelledException if the call was aborted
     */
    void grant(Reconciliation reconciliation, String groupId, RuleDirection direction, List<IpPermission> permissions);
}
