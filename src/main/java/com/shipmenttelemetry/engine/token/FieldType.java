package com.shipmenttelemetry.engine.token;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Semantic type of a metadata value, checked against the value's canonical JSON form.
 */
public enum FieldType {
    STRING("non-blank string"),
    DECIMAL("number"),
    CURRENCY("ISO-4217 currency code"),
    TIMESTAMP("ISO-8601 timestamp with offset"),
    DATE("ISO-8601 date or timestamp"),
    LIST("list"),
    OBJECT("object"),
    BOOLEAN("boolean");

    private static final Pattern CURRENCY_CODE = Pattern.compile("[A-Z]{3}");

    private final String description;

    FieldType(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }

    public boolean accepts(Object value) {
        if (value == null) {
            return false;
        }
        return switch (this) {
            case STRING -> value instanceof String text && !text.isBlank();
            case DECIMAL -> isFiniteNumber(value);
            case CURRENCY -> value instanceof String text && CURRENCY_CODE.matcher(text).matches();
            case TIMESTAMP -> value instanceof String text && isTimestamp(text);
            case DATE -> value instanceof String text && (isDate(text) || isTimestamp(text));
            case LIST -> value instanceof List<?>;
            case OBJECT -> value instanceof Map<?, ?>;
            case BOOLEAN -> value instanceof Boolean;
        };
    }

    private static boolean isFiniteNumber(Object value) {
        if (value instanceof BigDecimal || value instanceof BigInteger
            || value instanceof Integer || value instanceof Long) {
            return true;
        }
        return value instanceof Number number && Double.isFinite(number.doubleValue());
    }

    private static boolean isTimestamp(String text) {
        try {
            OffsetDateTime.parse(text);
            return true;
        } catch (DateTimeParseException e) {
            return false;
        }
    }

    private static boolean isDate(String text) {
        try {
            LocalDate.parse(text);
            return true;
        } catch (DateTimeParseException e) {
            return false;
        }
    }
}
