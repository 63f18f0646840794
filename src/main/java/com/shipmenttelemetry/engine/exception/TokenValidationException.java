package com.shipmenttelemetry.engine.exception;

/**
 * Token metadata is missing or ill-typed, or the token type is unknown.
 */
public class TokenValidationException extends ShipmentPipelineException {

    public TokenValidationException(String message) {
        super(ErrorKind.TOKEN_VALIDATION, message);
    }

    public TokenValidationException(String message, Throwable cause) {
        super(ErrorKind.TOKEN_VALIDATION, message, cause);
    }
}
