package com.shipmenttelemetry.engine.exception;

import com.shipmenttelemetry.engine.token.TokenState;

public class InvalidStateTransitionException extends ShipmentPipelineException {

    public InvalidStateTransitionException(String tokenId, TokenState from, TokenState to) {
        super(ErrorKind.INVALID_STATE_TRANSITION,
            String.format("Token %s cannot transition from %s to %s", tokenId, from, to));
    }
}
