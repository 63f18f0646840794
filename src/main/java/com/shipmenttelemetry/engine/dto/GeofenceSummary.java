package com.shipmenttelemetry.engine.dto;

import com.shipmenttelemetry.engine.model.GeofenceKind;

/**
 * JSON view of a geofence definition.
 *
 * @param radiusMeters Set for circular geofences, whose {@code wkt} is the center point
 */
public record GeofenceSummary(
    String id,
    String name,
    GeofenceKind kind,
    String wkt,
    Double radiusMeters
) {
}
