package com.shipmenttelemetry.engine.token;

/**
 * Lifecycle tags across all token types. Which transitions are legal is declared per type in
 * {@link TokenSchema}.
 */
public enum TokenState {
    CREATED,
    // shipment root
    DISPATCHED,
    IN_TRANSIT,
    ARRIVED,
    DELIVERED,
    SETTLED,
    CANCELLED,
    // attestation
    SIGNED,
    PROOF_ATTACHED,
    VERIFIED,
    REJECTED,
    FINALIZED,
    // commercial
    ACCEPTED,
    EXPIRED,
    ISSUED,
    PAID,
    PENDING,
    COMPLETE,
    FAILED
}
