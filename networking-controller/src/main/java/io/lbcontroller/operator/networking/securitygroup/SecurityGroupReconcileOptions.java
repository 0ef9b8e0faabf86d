/*
 * Copyright lb-controller authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.lbcontroller.operator.networking.securitygroup;

import io.lbcontroller.operator.common.model.LabelPredicate;

import java.util.Objects;

/**
 * Options of a security group reconciliation.
 *
 * @param permissionSelector    Selects the observed rules managed by the reconciliation. Only the selected rules can
 *                              be revoked. Rules which are not selected are never altered or removed. Selects every
 *                              rule by default.
 */
public record SecurityGroupReconcileOptions(LabelPredicate permissionSelector) {
    /**
     * Options with the default values
     */
    public static final SecurityGroupReconcileOptions DEFAULT = new SecurityGroupReconcileOptions(LabelPredicate.EVERYTHING);

    /**
     * Constructor
     *
     * @param permissionSelector    Selector of the managed rules
     */
    public SecurityGroupReconcileOptions {
        Objects.requireNonNull(permissionSelector, "permissionSelector");
    }

    /**
     * @param selector  Selector of the managed rules
     *
     * @return  Copy of these options with a different selector
     */
    public SecurityGroupReconcileOptions withPermissionSelector(LabelPredicate selector) {
        return new SecurityGroupReconcileOptions(selector);
    }
}
