package com.shipmenttelemetry.engine.exception;

public class TokenNotFoundException extends ShipmentPipelineException {

    public TokenNotFoundException(String tokenId) {
        super(ErrorKind.TOKEN_NOT_FOUND, "Token not found: " + tokenId);
    }
}
