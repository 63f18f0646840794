package com.shipmenttelemetry.engine.dto;

import com.shipmenttelemetry.engine.geo.CircleBoundary;
import com.shipmenttelemetry.engine.geo.GeofenceBoundary;
import com.shipmenttelemetry.engine.geo.PolygonBoundary;
import com.shipmenttelemetry.engine.model.GeofenceKind;

import java.util.Objects;

/**
 * Read-only geofence as the pipeline sees it, detached from its JPA entity and cache form.
 *
 * @param id       Catalogue identifier
 * @param name     Human-readable name
 * @param kind     Role of the geofence in the route
 * @param boundary Polygon or circle
 */
public record GeofenceDefinition(
    String id,
    String name,
    GeofenceKind kind,
    GeofenceBoundary boundary
) {

    public GeofenceDefinition {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(boundary, "boundary");
    }

    public static GeofenceDefinition polygon(String id, String name, GeofenceKind kind, String wkt) {
        return new GeofenceDefinition(id, name, kind, PolygonBoundary.fromWkt(wkt));
    }

    public static GeofenceDefinition circle(String id, String name, GeofenceKind kind,
                                            double latitude, double longitude, double radiusMeters) {
        return new GeofenceDefinition(id, name, kind, new CircleBoundary(latitude, longitude, radiusMeters));
    }

    public boolean covers(double latitude, double longitude) {
        return boundary.covers(latitude, longitude);
    }

    public GeofenceSummary toSummary() {
        Double radius = boundary instanceof CircleBoundary circle ? circle.radiusMeters() : null;
        return new GeofenceSummary(id, name, kind, boundary.toWkt(), radius);
    }

    public String toLogString() {
        return String.format("Geofence[id=%s, name=%s, kind=%s]", id, name, kind);
    }
}
