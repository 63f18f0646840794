package com.shipmenttelemetry.engine.model;

/**
 * Reasons the consistency engine flags a transition between two telemetry records.
 */
public enum FlagCode {
    /** Implied speed between the two fixes exceeds the transport mode's ceiling. */
    IMPOSSIBLE_SPEED,
    /** Same event time, different position. */
    TIMESTAMP_DUPLICATE,
    /** New record is older than the last accepted one. */
    TIMESTAMP_REVERSED,
    /** Device clock disagrees with the ingestion clock beyond the allowed skew. */
    STALE_DEVICE_CLOCK,
    /** Battery voltage is falling faster than a healthy device drains. */
    BATTERY_DEPLETION
}
