/*
 * Copyright lb-controller authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.lbcontroller.operator.networking.reconcile;

/**
 * Another reconciliation held the resource for too long. Nothing was read or modified and the pass should be retried.
 */
public class ResourceLockedException extends ResourceOperationException {
    /**
     * Constructor
     *
     * @param resourceId    ID of the resource
     * @param message       Error message
     */
    public ResourceLockedException(String resourceId, String message) {
        super(resourceId, message, null);
    }
}
