/*
 * Copyright lb-controller authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.lbcontroller.operator.networking.reconcile;

import io.lbcontroller.operator.common.Reconciliation;
import io.lbcontroller.operator.common.ReconciliationCancelledException;
import io.lbcontroller.operator.common.ReconciliationLogger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.function.Predicate;

/**
 * The mutations needed to converge the observed entries of one resource towards the desired entries. Entries are
 * always revoked before new entries are granted, and the grant is skipped when the revoke failed, so the stale and
 * the new entries never coexist because of a half-applied plan.
 *
 * @param <T>   Type of the entries
 */
public final class ReconcilePlan<T> {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(ReconcilePlan.class);

    private final List<T> toRevoke;
    private final List<T> toGrant;

    private ReconcilePlan(List<T> toRevoke, List<T> toGrant) {
        this.toRevoke = List.copyOf(toRevoke);
        this.toGrant = List.copyOf(toGrant);
    }

    /**
     * Computes the plan. Observed entries missing from the desired entries are revoked only when the
     * {@code revocable} predicate accepts them. All desired entries missing from the observed entries are granted.
     * Equivalent duplicates are planned only once.
     *
     * @param observed      Entries currently present on the resource
     * @param desired       Entries which should be present on the resource
     * @param policy        Equality policy of the entries
     * @param revocable     Selects the observed entries this plan is allowed to revoke
     *
     * @param <T>   Type of the entries
     *
     * @return  The reconcile plan
     */
    public static <T> ReconcilePlan<T> compute(Collection<? extends T> observed, Collection<? extends T> desired,
                                               EqualityPolicy<? super T> policy, Predicate<? super T> revocable) {
        List<T> toRevoke = new ArrayList<>();
        for (T extra : SetDiff.<T>diff(observed, desired, policy)) {
            if (revocable.test(extra)) {
                toRevoke.add(extra);
            }
        }

        return new ReconcilePlan<>(distinct(toRevoke, policy), distinct(SetDiff.<T>diff(desired, observed, policy), policy));
    }

    private static <T> List<T> distinct(List<T> entries, EqualityPolicy<? super T> policy) {
        List<T> distinct = new ArrayList<>(entries.size());

        for (T entry : entries) {
            if (SetDiff.<T>diff(List.of(entry), distinct, policy).size() == 1) {
                distinct.add(entry);
            }
        }

        return distinct;
    }

    /**
     * @return  Entries which will be revoked
     */
    public List<T> toRevoke() {
        return toRevoke;
    }

    /**
     * @return  Entries which will be granted
     */
    public List<T> toGrant() {
        return toGrant;
    }

    /**
     * @return  True if the plan does not need any mutation
     */
    public boolean isEmpty() {
        return toRevoke.isEmpty() && toGrant.isEmpty();
    }

    /**
     * Applies the plan. No mutation is called with an empty list. Failures of the mutations are propagated unchanged.
     *
     * @param reconciliation    Reconciliation marker
     * @param revoke            Mutation removing entries
     * @param grant             Mutation adding entries
     *
     * @throws ReconciliationCancelledException if the reconciling thread was interrupted before the revoke, or before
     *                                          a pending grant. A revoke-only plan whose revoke succeeded is complete.
     */
    public void execute(Reconciliation reconciliation, Mutation<T> revoke, Mutation<T> grant) {
        throwIfCancelled(reconciliation, "revoke");

        if (!toRevoke.isEmpty()) {
            LOGGER.debugCr(reconciliation, "Revoking {} entries: {}", toRevoke.size(), toRevoke);

            try {
                revoke.apply(toRevoke);
            } catch (RuntimeException e) {
                if (!toGrant.isEmpty()) {
                    LOGGER.warnCr(reconciliation, "Revoke failed, skipping grant of {} entries", toGrant.size());
                }
                throw e;
            }
        }

        if (!toGrant.isEmpty()) {
            throwIfCancelled(reconciliation, "grant");
            LOGGER.debugCr(reconciliation, "Granting {} entries: {}", toGrant.size(), toGrant);
            grant.apply(toGrant);
        }
    }

    /**
     * Cancellation point of a reconciliation. The interrupt flag of the thread is kept.
     *
     * @param reconciliation    Reconciliation marker
     * @param step              The step which would follow
     *
     * @throws ReconciliationCancelledException if the current thread was interrupted
     */
    public static void throwIfCancelled(Reconciliation reconciliation, String step) {
        if (Thread.currentThread().isInterrupted()) {
            throw new ReconciliationCancelledException(reconciliation + " was cancelled before " + step);
        }
    }

    @Override
    public String toString() {
        return "ReconcilePlan(toRevoke=" + toRevoke + ", toGrant=" + toGrant + ")";
    }

    /**
     * Mutation applied to a resource
     *
     * @param <T>   Type of the entries
     */
    @FunctionalInterface
    public interface Mutation<T> {
        /**
         * @param entries   Non-empty list of entries
         */
        void apply(List<T> entries);
    }
}
