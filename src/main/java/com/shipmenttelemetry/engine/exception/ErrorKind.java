package com.shipmenttelemetry.engine.exception;

/**
 * Closed set of failure kinds the pipeline surfaces to its callers.
 *
 * Callers branch on the kind rather than on exception classes, so batch results and
 * REST responses can carry it as plain data.
 */
public enum ErrorKind {
    MALFORMED_TELEMETRY(false),
    TOKEN_VALIDATION(false),
    RELATION_VALIDATION(true),
    INVALID_STATE_TRANSITION(false),
    TOKEN_NOT_FOUND(false),
    PERSISTENCE(true),
    GEOFENCE_CATALOG_UNAVAILABLE(true),
    INTERNAL(false);

    private final boolean retryable;

    ErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    /**
     * Whether resubmitting the same input unchanged may succeed later.
     */
    public boolean isRetryable() {
        return retryable;
    }
}
