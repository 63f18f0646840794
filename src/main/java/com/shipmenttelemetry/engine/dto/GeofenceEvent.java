package com.shipmenttelemetry.engine.dto;

import com.shipmenttelemetry.engine.model.GeofenceEventType;
import com.shipmenttelemetry.engine.model.GeofenceKind;

import java.time.Instant;

/**
 * A device crossed a geofence boundary. Transient: produced per sample, never persisted here.
 */
public record GeofenceEvent(
    String geofenceId,
    String geofenceName,
    GeofenceKind kind,
    GeofenceEventType eventType,
    Instant timestamp,
    String deviceId,
    String shipmentId,
    double latitude,
    double longitude
) {

    public static GeofenceEvent of(GeofenceDefinition definition, GeofenceEventType eventType,
                                   NormalizedTelemetryRecord record) {
        return new GeofenceEvent(
            definition.id(),
            definition.name(),
            definition.kind(),
            eventType,
            record.eventTime(),
            record.deviceId(),
            record.shipmentId(),
            record.latitude(),
            record.longitude()
        );
    }

    public boolean is(GeofenceKind expectedKind, GeofenceEventType expectedType) {
        return kind == expectedKind && eventType == expectedType;
    }

    public String toLogString() {
        return String.format("Geofence[%s %s %s(%s), device=%s]",
            eventType, kind, geofenceName, geofenceId, deviceId);
    }
}
