package com.shipmenttelemetry.engine.geo;

/**
 * Point geofence with a radius, measured along the great circle.
 */
public record CircleBoundary(double centerLatitude, double centerLongitude, double radiusMeters)
    implements GeofenceBoundary {

    public CircleBoundary {
        if (radiusMeters <= 0 || !Double.isFinite(radiusMeters)) {
            throw new IllegalArgumentException("radiusMeters must be positive: " + radiusMeters);
        }
    }

    @Override
    public boolean covers(double latitude, double longitude) {
        return GeoDistance.haversineMeters(centerLatitude, centerLongitude, latitude, longitude) <= radiusMeters;
    }

    @Override
    public String toWkt() {
        return String.format("POINT (%s %s)", centerLongitude, centerLatitude);
    }
}
