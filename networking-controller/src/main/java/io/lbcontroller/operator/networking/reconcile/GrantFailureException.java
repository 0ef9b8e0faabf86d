/*
 * Copyright lb-controller authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.lbcontroller.operator.networking.reconcile;

/**
 * Adding entries to a resource failed. None of the entries was added.
 */
public class GrantFailureException extends ResourceOperationException {
    /**
     * Constructor
     *
     * @param resourceId    ID of the resource
     * @param message       Error message
     */
    public GrantFailureException(String resourceId, String message) {
        super(resourceId, message, null);
    }

    /**
     * Constructor
     *
     * @param resourceId    ID of the resource
     * @param message       Error message
     * @param cause         Error raised by the cloud provider
     */
    public GrantFailureException(String resourceId, String message, Throwable cause) {
        super(resourceId, message, cause);
    }
}
