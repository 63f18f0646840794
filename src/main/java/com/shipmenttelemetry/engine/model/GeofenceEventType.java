package com.shipmenttelemetry.engine.model;

public enum GeofenceEventType {
    ENTER,
    EXIT
}
