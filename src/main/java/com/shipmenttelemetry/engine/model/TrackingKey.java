package com.shipmenttelemetry.engine.model;

import java.util.Objects;

/**
 * Identity of a telemetry stream: one device reporting for one shipment.
 */
public record TrackingKey(String deviceId, String shipmentId) {

    public TrackingKey {
        Objects.requireNonNull(deviceId, "deviceId");
        Objects.requireNonNull(shipmentId, "shipmentId");
    }

    @Override
    public String toString() {
        return deviceId + "/" + shipmentId;
    }
}
