package com.shipmenttelemetry.engine.repository;

import com.shipmenttelemetry.engine.entity.GeofenceZone;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Geofence catalogue with PostGIS lookups.
 *
 * PostGIS takes points as (X, Y) = (longitude, latitude).
 */
@Repository
public interface GeofenceZoneRepository extends JpaRepository<GeofenceZone, Long> {

    /**
     * Source of the catalogue cache.
     */
    List<GeofenceZone> findByActiveTrue();

    long countByActiveTrue();

    /**
     * Active zones whose boundary covers the point, edges included. Polygon zones use
     * ST_Covers; circular zones compare geography distance to their radius.
     */
    @Query(value = """
        SELECT * FROM geofence_zones
        WHERE active = true
        AND (
            (geometry IS NOT NULL
             AND ST_Covers(geometry, ST_SetSRID(ST_MakePoint(:longitude, :latitude), 4326)))
            OR
            (geometry IS NULL AND radius_meters IS NOT NULL
             AND ST_DWithin(
                 ST_SetSRID(ST_MakePoint(center_longitude, center_latitude), 4326)::geography,
                 ST_SetSRID(ST_MakePoint(:longitude, :latitude), 4326)::geography,
                 radius_meters))
        )
        """, nativeQuery = true)
    List<GeofenceZone> findActiveZonesCoveringPoint(
        @Param("longitude") double longitude,
        @Param("latitude") double latitude
    );
}
