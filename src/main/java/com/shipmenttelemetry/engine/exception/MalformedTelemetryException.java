package com.shipmenttelemetry.engine.exception;

/**
 * A raw sample is missing a required positional field or carries a physically invalid value.
 * The sample is dropped; it is never repaired.
 */
public class MalformedTelemetryException extends ShipmentPipelineException {

    public MalformedTelemetryException(String message) {
        super(ErrorKind.MALFORMED_TELEMETRY, message);
    }

    public MalformedTelemetryException(String message, Throwable cause) {
        super(ErrorKind.MALFORMED_TELEMETRY, message, cause);
    }
}
