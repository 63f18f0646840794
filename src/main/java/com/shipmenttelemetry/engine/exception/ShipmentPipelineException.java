package com.shipmenttelemetry.engine.exception;

/**
 * Base type of every typed error raised by the telemetry and token pipeline.
 */
public abstract class ShipmentPipelineException extends RuntimeException {

    private final ErrorKind kind;

    protected ShipmentPipelineException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected ShipmentPipelineException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }
}
