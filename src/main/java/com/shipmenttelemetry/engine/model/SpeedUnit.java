package com.shipmenttelemetry.engine.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Units a device may report speed in, with their factor to meters per second.
 */
public enum SpeedUnit {
    MPH(0.44704),
    KPH(1.0 / 3.6),
    MPS(1.0),
    KNOTS(0.514444);

    public static final double METERS_PER_SECOND_PER_MPH = 0.44704;

    private final double metersPerSecondFactor;

    SpeedUnit(double metersPerSecondFactor) {
        this.metersPerSecondFactor = metersPerSecondFactor;
    }

    public double toMetersPerSecond(double value) {
        return value * metersPerSecondFactor;
    }

    public static double metersPerSecondToMph(double metersPerSecond) {
        return metersPerSecond / METERS_PER_SECOND_PER_MPH;
    }

    /**
     * Parses a unit label case-insensitively. "KMH" and "KM/H" are accepted as KPH.
     */
    public static Optional<SpeedUnit> parse(String label) {
        if (label == null || label.isBlank()) {
            return Optional.empty();
        }
        String normalized = label.trim().toUpperCase(Locale.ROOT);
        if (normalized.equals("KMH") || normalized.equals("KM/H")) {
            return Optional.of(KPH);
        }
        try {
            return Optional.of(valueOf(normalized));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
