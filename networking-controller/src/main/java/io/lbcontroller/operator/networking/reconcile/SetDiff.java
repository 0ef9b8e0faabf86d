/*
 * Copyright lb-controller authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.lbcontroller.operator.networking.reconcile;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Set difference under an {@link EqualityPolicy}
 */
public final class SetDiff {
    private SetDiff() { }

    /**
     * Computes {@code source - target}: every element of the source for which no element of the target is equivalent.
     * The inputs are never modified. Null collections are handled as empty. The order of the result follows the
     * source, but callers should not depend on it.
     *
     * @param source    Collection from which the elements are taken
     * @param target    Collection of the elements which should be subtracted
     * @param policy    Equality policy
     *
     * @param <T>       Type of the elements
     *
     * @return  New list with the elements of the source not present in the target
     */
    public static <T> List<T> diff(Collection<? extends T> source, Collection<? extends T> target, EqualityPolicy<? super T> policy) {
        List<T> result = new ArrayList<>();

        if (source == null) {
            return result;
        }

        for (T s : source) {
            boolean found = false;

            if (target != null) {
                for (T t : target) {
                    if (policy.equivalent(s, t)) {
                        found = true;
                        break;
                    }
                }
            }

            if (!found) {
                result.add(s);
            }
        }

        return result;
    }
}
