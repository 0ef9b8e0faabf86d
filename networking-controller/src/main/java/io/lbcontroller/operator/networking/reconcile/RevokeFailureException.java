/*
 * Copyright lb-controller authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.lbcontroller.operator.networking.reconcile;

/**
 * Removing entries from a resource failed. None of the entries was removed.
 */
public class RevokeFailureException extends ResourceOperationException {
    /**
     * Constructor
     *
     * @param resourceId    ID of the resource
     * @param message       Error message
     */
    public RevokeFailureException(String resourceId, String message) {
        super(resourceId, message, null);
    }

    /**
     * Constructor
     *
     * @param resourceId    ID of the resource
     * @param message       Error message
     * @param cause         Error raised by the cloud provider
     */
    public RevokeFailureException(String resourceId, String message, Throwable cause) {
        super(resourceId, message, cause);
    }
}
