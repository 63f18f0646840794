package com.shipmenttelemetry.engine.model;

/**
 * Role a geofence plays in a shipment's route.
 */
public enum GeofenceKind {
    SHIPPER_PICKUP,
    CONSIGNEE,
    TERMINAL,
    PORT,
    BORDER,
    CUSTOM
}
