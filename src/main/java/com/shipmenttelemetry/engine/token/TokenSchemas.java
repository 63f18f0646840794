package com.shipmenttelemetry.engine.token;

import java.util.EnumSet;

import static com.shipmenttelemetry.engine.token.TokenState.ACCEPTED;
import static com.shipmenttelemetry.engine.token.TokenState.ARRIVED;
import static com.shipmenttelemetry.engine.token.TokenState.CANCELLED;
import static com.shipmenttelemetry.engine.token.TokenState.COMPLETE;
import static com.shipmenttelemetry.engine.token.TokenState.CREATED;
import static com.shipmenttelemetry.engine.token.TokenState.DELIVERED;
import static com.shipmenttelemetry.engine.token.TokenState.DISPATCHED;
import static com.shipmenttelemetry.engine.token.TokenState.EXPIRED;
import static com.shipmenttelemetry.engine.token.TokenState.FAILED;
import static com.shipmenttelemetry.engine.token.TokenState.FINALIZED;
import static com.shipmenttelemetry.engine.token.TokenState.IN_TRANSIT;
import static com.shipmenttelemetry.engine.token.TokenState.ISSUED;
import static com.shipmenttelemetry.engine.token.TokenState.PAID;
import static com.shipmenttelemetry.engine.token.TokenState.PENDING;
import static com.shipmenttelemetry.engine.token.TokenState.PROOF_ATTACHED;
import static com.shipmenttelemetry.engine.token.TokenState.REJECTED;
import static com.shipmenttelemetry.engine.token.TokenState.SETTLED;
import static com.shipmenttelemetry.engine.token.TokenState.SIGNED;
import static com.shipmenttelemetry.engine.token.TokenState.VERIFIED;

/**
 * Schemas of every token type, plus the relation role names they use.
 */
public final class TokenSchemas {

    public static final String ST01_ID = "st01_id";
    public static final String MT01_ID = "mt01_id";
    public static final String QT01_ID = "qt01_id";
    public static final String IT01_ID = "it01_id";

    static final TokenSchema SHIPMENT = TokenSchema.builder()
        .requiredField("origin", FieldType.STRING)
        .requiredField("destination", FieldType.STRING)
        .requiredField("carrier_id", FieldType.STRING)
        .transition(CREATED, EnumSet.of(DISPATCHED, CANCELLED))
        .transition(DISPATCHED, EnumSet.of(IN_TRANSIT, CANCELLED))
        .transition(IN_TRANSIT, EnumSet.of(ARRIVED))
        .transition(ARRIVED, EnumSet.of(DELIVERED))
        .transition(DELIVERED, EnumSet.of(SETTLED))
        .build();

    static final TokenSchema MILESTONE = TokenSchema.builder()
        .requiredField("milestone_type", FieldType.STRING)
        .requiredField("timestamp", FieldType.TIMESTAMP)
        .requiredField("location", FieldType.OBJECT)
        .requiredRelation(ST01_ID, TokenType.ST_01)
        .transition(CREATED, EnumSet.of(SIGNED))
        .transition(SIGNED, EnumSet.of(FINALIZED))
        .build();

    static final TokenSchema ACCESSORIAL = TokenSchema.builder()
        .requiredField("accessorial_type", FieldType.STRING)
        .requiredField("amount", FieldType.DECIMAL)
        .requiredField("timestamp", FieldType.TIMESTAMP)
        .requiredField("currency", FieldType.CURRENCY)
        .requiredRelation(MT01_ID, TokenType.MT_01)
        .transition(CREATED, EnumSet.of(PROOF_ATTACHED, REJECTED))
        .transition(PROOF_ATTACHED, EnumSet.of(VERIFIED, REJECTED))
        .transition(VERIFIED, EnumSet.of(FINALIZED))
        .build();

    static final TokenSchema QUOTE = TokenSchema.builder()
        .requiredField("rate_amount", FieldType.DECIMAL)
        .requiredField("rate_currency", FieldType.CURRENCY)
        .requiredField("equipment_type", FieldType.STRING)
        .requiredRelation(ST01_ID, TokenType.ST_01)
        .transition(CREATED, EnumSet.of(ACCEPTED, EXPIRED))
        .transition(ACCEPTED, EnumSet.of(FINALIZED))
        .build();

    static final TokenSchema INVOICE = TokenSchema.builder()
        .requiredField("invoice_number", FieldType.STRING)
        .requiredField("currency", FieldType.CURRENCY)
        .requiredField("total", FieldType.DECIMAL)
        .requiredField("line_items", FieldType.LIST)
        .requiredField("due_date", FieldType.DATE)
        .requiredRelation(QT01_ID, TokenType.QT_01)
        .transition(CREATED, EnumSet.of(ISSUED))
        .transition(ISSUED, EnumSet.of(PAID))
        .transition(PAID, EnumSet.of(FINALIZED))
        .build();

    static final TokenSchema PAYMENT = TokenSchema.builder()
        .requiredField("payment_reference", FieldType.STRING)
        .requiredField("currency", FieldType.CURRENCY)
        .requiredField("amount", FieldType.DECIMAL)
        .requiredField("escrow_account", FieldType.STRING)
        .requiredRelation(IT01_ID, TokenType.IT_01)
        .transition(CREATED, EnumSet.of(PENDING))
        .transition(PENDING, EnumSet.of(COMPLETE, FAILED))
        .build();

    private TokenSchemas() {
    }
}
