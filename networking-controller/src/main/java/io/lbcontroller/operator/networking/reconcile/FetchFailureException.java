/*
 * Copyright lb-controller authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.lbcontroller.operator.networking.reconcile;

/**
 * The observed state of a resource could not be read. Nothing was modified.
 */
public class FetchFailureException extends ResourceOperationException {
    /**
     * Constructor
     *
     * @param resourceId    ID of the resource
     * @param message       Error message
     */
    public FetchFailureException(String resourceId, String message) {
        super(resourceId, message, null);
    }

    /**
     * Constructor
     *
     * @param resourceId    ID of the resource
     * @param message       Error message
     * @param cause         Error raised by the cloud provider
     */
    public FetchFailureException(String resourceId, String message, Throwable cause) {
        super(resourceId, message, cause);
    }
}
