package com.shipmenttelemetry.engine.dto;

import lombok.Builder;

/**
 * A telemetry sample exactly as a tracking device reported it.
 *
 * Nothing is validated here; the normalizer decides what is acceptable. Fields are boxed so
 * an omitted value stays distinguishable from a reported zero.
 *
 * @param deviceId            Tracking device identifier
 * @param shipmentId          Shipment the device is attached to (the ST-01 root id)
 * @param timestamp           ISO-8601 with offset, ISO-8601 local date-time, or epoch milliseconds
 * @param latitude            WGS84 latitude in decimal degrees
 * @param longitude           WGS84 longitude in decimal degrees
 * @param speed               Speed in {@code speedUnit}
 * @param speedUnit           MPH, KPH, MPS or KNOTS (MPH when omitted)
 * @param heading             Degrees clockwise from north
 * @param engineState         Free-form engine state label (RUNNING, IDLE, OFF, ...)
 * @param ignition            Ignition line state
 * @param idleTimeSeconds     Seconds the engine has been idling
 * @param batteryVoltage      Device battery voltage
 * @param positionAccuracyM   Reported GPS accuracy in meters
 * @param temperatureCelsius  Cargo temperature
 * @param doorState           OPEN or CLOSED
 * @param shockDetected       Whether the accelerometer registered a shock
 * @param transportMode       ROAD, RAIL, OCEAN or AIR (ROAD when omitted)
 */
@Builder(toBuilder = true)
public record RawTelemetry(
    String deviceId,
    String shipmentId,
    String timestamp,
    Double latitude,
    Double longitude,
    Double speed,
    String speedUnit,
    Double heading,
    String engineState,
    Boolean ignition,
    Long idleTimeSeconds,
    Double batteryVoltage,
    Double positionAccuracyM,
    Double temperatureCelsius,
    String doorState,
    Boolean shockDetected,
    String transportMode
) {

    public String toLogString() {
        return String.format("RawTelemetry[device=%s, shipment=%s, time=%s, lat=%s, lon=%s]",
            deviceId, shipmentId, timestamp, latitude, longitude);
    }
}
