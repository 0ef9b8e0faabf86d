/*
 * Copyright lb-controller authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.lbcontroller.operator.networking.targetgroup;

import io.lbcontroller.operator.networking.reconcile.EqualityPolicy;

import java.util.Objects;

/**
 * Targets are the same when they have the same ID and port. The availability zone is informational.
 */
public final class TargetEquality implements EqualityPolicy<Target> {
    /**
     * Shared instance
     */
    public static final TargetEquality INSTANCE = new TargetEquality();

    private TargetEquality() { }

    @Override
    public boolean equivalent(Target a, Target b) {
        if (a == b) {
            return true;
        } else if (a == null || b == null) {
            return false;
        }

        return a.id().equals(b.id()) && Objects.equals(a.port(), b.port());
    }
}
