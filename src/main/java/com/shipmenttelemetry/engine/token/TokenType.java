package com.shipmenttelemetry.engine.token;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * Closed set of token variants. Adding a variant means adding a constant and a schema case.
 */
public enum TokenType {
    ST_01("ST-01"),
    MT_01("MT-01"),
    AT_02("AT-02"),
    QT_01("QT-01"),
    IT_01("IT-01"),
    PT_01("PT-01");

    private final String code;

    TokenType(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public TokenSchema schema() {
        return switch (this) {
            case ST_01 -> TokenSchemas.SHIPMENT;
            case MT_01 -> TokenSchemas.MILESTONE;
            case AT_02 -> TokenSchemas.ACCESSORIAL;
            case QT_01 -> TokenSchemas.QUOTE;
            case IT_01 -> TokenSchemas.INVOICE;
            case PT_01 -> TokenSchemas.PAYMENT;
        };
    }

    public static Optional<TokenType> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        for (TokenType type : values()) {
            if (type.code.equals(code)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return code;
    }
}
