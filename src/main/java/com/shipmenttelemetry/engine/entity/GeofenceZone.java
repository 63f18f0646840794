package com.shipmenttelemetry.engine.entity;

import com.shipmenttelemetry.engine.dto.GeofenceDefinition;
import com.shipmenttelemetry.engine.geo.CircleBoundary;
import com.shipmenttelemetry.engine.geo.PolygonBoundary;
import com.shipmenttelemetry.engine.model.GeofenceKind;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;
import org.locationtech.jts.geom.Polygon;

import java.time.LocalDateTime;

/**
 * Registered geofence: pickup yard, consignee dock, terminal, port or border crossing.
 *
 * A zone has either a polygon boundary (PostGIS geometry, SRID 4326) or a center point with a
 * radius. Zones are deactivated rather than deleted.
 */
@Entity
@Table(name = "geofence_zones", indexes = {
    @Index(name = "idx_geofence_active", columnList = "active"),
    @Index(name = "idx_geofence_kind", columnList = "kind")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GeofenceZone {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 255)
    private String name;

    @Column(length = 1000)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private GeofenceKind kind;

    /**
     * Polygon boundary in (longitude, latitude) order. Null for circular zones.
     */
    @Column(name = "geometry", columnDefinition = "geometry(Polygon,4326)")
    private Polygon geometry;

    @Column(name = "center_latitude")
    private Double centerLatitude;

    @Column(name = "center_longitude")
    private Double centerLongitude;

    @Column(name = "radius_meters")
    private Double radiusMeters;

    @Column(nullable = false)
    @Builder.Default
    private Boolean active = true;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public boolean isCircular() {
        return geometry == null && centerLatitude != null && centerLongitude != null && radiusMeters != null;
    }

    /**
     * Detaches this zone into the immutable form the pipeline evaluates.
     *
     * @throws IllegalStateException when the zone has neither a polygon nor a complete circle
     */
    public GeofenceDefinition toDefinition() {
        if (geometry != null) {
            return new GeofenceDefinition(String.valueOf(id), name, kind, new PolygonBoundary(geometry));
        }
        if (isCircular()) {
            return new GeofenceDefinition(String.valueOf(id), name, kind,
                new CircleBoundary(centerLatitude, centerLongitude, radiusMeters));
        }
        throw new IllegalStateException("Geofence zone " + id + " has no boundary");
    }
}
