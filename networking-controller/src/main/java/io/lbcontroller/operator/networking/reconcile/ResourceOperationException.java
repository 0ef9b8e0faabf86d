/*
 * Copyright lb-controller authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.lbcontroller.operator.networking.reconcile;

/**
 * Failure of an operation on a cloud resource
 */
public abstract class ResourceOperationException extends RuntimeException {
    private final String resourceId;

    protected ResourceOperationException(String resourceId, String message, Throwable cause) {
        super(message, cause);
        this.resourceId = resourceId;
    }

    /**
     * @return  ID of the resource (security group ID, target group ARN, ...)
     */
    public String resourceId() {
        return resourceId;
    }
}
