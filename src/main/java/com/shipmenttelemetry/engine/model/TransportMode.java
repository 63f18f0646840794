package com.shipmenttelemetry.engine.model;

import java.util.Locale;
import java.util.Optional;

public enum TransportMode {
    ROAD,
    RAIL,
    OCEAN,
    AIR;

    public static Optional<TransportMode> parse(String label) {
        if (label == null || label.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(label.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
