package com.shipmenttelemetry.engine.dto;

import com.shipmenttelemetry.engine.model.SpeedUnit;
import com.shipmenttelemetry.engine.model.TrackingKey;
import com.shipmenttelemetry.engine.model.TransportMode;
import lombok.Builder;

import java.time.Instant;

/**
 * Canonical telemetry record: UTC event time, speed in meters per second, heading in [0, 360).
 *
 * Immutable once produced by the normalizer. The consistency and geofence engines only ever
 * see this shape.
 */
@Builder(toBuilder = true)
public record NormalizedTelemetryRecord(
    String deviceId,
    String shipmentId,
    Instant eventTime,
    double latitude,
    double longitude,
    double speedMps,
    double heading,
    String engineState,
    long idleTimeSeconds,
    boolean ignition,
    Double batteryVoltage,
    TransportMode transportMode,
    Double positionAccuracyM,
    Double temperatureCelsius,
    String doorState,
    boolean shockDetected,
    Instant receivedAt
) {

    public double speedMph() {
        return SpeedUnit.metersPerSecondToMph(speedMps);
    }

    public TrackingKey trackingKey() {
        return new TrackingKey(deviceId, shipmentId);
    }

    public String toLogString() {
        return String.format("Telemetry[device=%s, shipment=%s, lat=%.6f, lon=%.6f, mph=%.1f, ignition=%s, time=%s]",
            deviceId, shipmentId, latitude, longitude, speedMph(), ignition, eventTime);
    }
}
