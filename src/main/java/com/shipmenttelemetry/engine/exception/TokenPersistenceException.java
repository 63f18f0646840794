package com.shipmenttelemetry.engine.exception;

/**
 * Storage failed while persisting or loading a token. Transient: the caller retries with
 * the same token, which is safe because persistence is an upsert by token id.
 */
public class TokenPersistenceException extends ShipmentPipelineException {

    public TokenPersistenceException(String message, Throwable cause) {
        super(ErrorKind.PERSISTENCE, message, cause);
    }
}
