package com.shipmenttelemetry.engine.geo;

/**
 * Geometry of a geofence. Points exactly on the boundary count as inside.
 */
public interface GeofenceBoundary {

    boolean covers(double latitude, double longitude);

    /**
     * Well-Known Text of the boundary (the center point for circular geofences).
     */
    String toWkt();
}
