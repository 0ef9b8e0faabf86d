/*
 * Copyright lb-controller authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.lbcontroller.operator.common;

/**
 * Thrown when a reconciliation was aborted because of an external cancellation (interruption of the reconciling
 * thread) or because a deadline of an external call expired. It is not an anomaly: the reconciliation can be safely
 * scheduled again.
 */
public class ReconciliationCancelledException extends RuntimeException {
    /**
     * Constructor
     *
     * @param message   Message describing where the reconciliation was cancelled
     */
    public ReconciliationCancelledException(String message) {
        super(message);
    }

    /**
     * Constructor
     *
     * @param message   Message describing where the reconciliation was cancelled
     * @param cause     Exception raised by the aborted call
     */
    public ReconciliationCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
