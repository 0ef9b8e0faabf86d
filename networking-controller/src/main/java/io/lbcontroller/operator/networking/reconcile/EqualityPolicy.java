/*
 * Copyright lb-controller authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.lbcontroller.operator.networking.reconcile;

/**
 * Decides whether two entries denote the same cloud-side object. Implementations compare only the fields which are
 * semantically part of the object and never the ownership labels. The relation has to be reflexive and symmetric.
 *
 * @param <T>   Type of the compared entries
 */
@FunctionalInterface
public interface EqualityPolicy<T> {
    /**
     * @param a     First entry
     * @param b     Second entry
     *
     * @return  True if both entries denote the same object
     */
    boolean equivalent(T a, T b);
}
