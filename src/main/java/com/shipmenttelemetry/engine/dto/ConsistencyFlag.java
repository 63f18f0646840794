package com.shipmenttelemetry.engine.dto;

import com.shipmenttelemetry.engine.model.FlagCode;
import com.shipmenttelemetry.engine.model.FlagSeverity;

/**
 * Advisory signal that the transition between two records of the same stream is implausible.
 *
 * Flags never block processing. Downstream risk and audit services decide what to do with them.
 *
 * @param code          Why the transition was flagged
 * @param severity      How strongly the transition contradicts physics
 * @param previous      Last accepted record for the stream
 * @param current       Record that triggered the flag
 * @param observedValue Measured delta (mph, meters, seconds or volts per hour depending on code)
 * @param threshold     Configured limit the delta was compared to
 * @param detail        Human-readable explanation
 */
public record ConsistencyFlag(
    FlagCode code,
    FlagSeverity severity,
    NormalizedTelemetryRecord previous,
    NormalizedTelemetryRecord current,
    double observedValue,
    double threshold,
    String detail
) {

    public String toLogString() {
        return String.format("Flag[%s/%s, device=%s, shipment=%s, observed=%.2f, threshold=%.2f]",
            code, severity, current.deviceId(), current.shipmentId(), observedValue, threshold);
    }
}
