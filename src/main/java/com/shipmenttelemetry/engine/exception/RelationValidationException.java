package com.shipmenttelemetry.engine.exception;

/**
 * A required relation is missing, or a relation points at a token that does not exist yet,
 * has the wrong type, or belongs to another shipment.
 *
 * Retryable: the referenced token may simply not have been created yet.
 */
public class RelationValidationException extends ShipmentPipelineException {

    private final String role;

    public RelationValidationException(String role, String message) {
        super(ErrorKind.RELATION_VALIDATION, message);
        this.role = role;
    }

    public String getRole() {
        return role;
    }
}
