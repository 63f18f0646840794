package com.shipmenttelemetry.engine.exception;

/**
 * Neither the cache nor the database could provide geofence definitions. Transient.
 */
public class GeofenceCatalogUnavailableException extends ShipmentPipelineException {

    public GeofenceCatalogUnavailableException(String message, Throwable cause) {
        super(ErrorKind.GEOFENCE_CATALOG_UNAVAILABLE, message, cause);
    }
}
