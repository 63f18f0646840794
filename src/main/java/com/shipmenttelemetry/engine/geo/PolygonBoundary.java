package com.shipmenttelemetry.engine.geo;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.geom.PrecisionModel;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.WKTReader;
import org.locationtech.jts.io.WKTWriter;

import java.util.Objects;

/**
 * Polygon geofence backed by a JTS geometry in (longitude, latitude) axis order, SRID 4326.
 *
 * Uses {@link Polygon#covers} rather than {@code contains} so a fix lying exactly on an edge
 * or vertex is inside.
 */
public record PolygonBoundary(Polygon polygon) implements GeofenceBoundary {

    public static final int WGS84_SRID = 4326;

    private static final GeometryFactory GEOMETRY_FACTORY = new GeometryFactory(new PrecisionModel(), WGS84_SRID);

    public PolygonBoundary {
        Objects.requireNonNull(polygon, "polygon");
    }

    /**
     * Parses a {@code POLYGON((lon lat, ...))} WKT string.
     */
    public static PolygonBoundary fromWkt(String wkt) {
        try {
            return new PolygonBoundary((Polygon) new WKTReader(GEOMETRY_FACTORY).read(wkt));
        } catch (ParseException | ClassCastException e) {
            throw new IllegalArgumentException("Not a polygon WKT: " + wkt, e);
        }
    }

    @Override
    public boolean covers(double latitude, double longitude) {
        Point point = GEOMETRY_FACTORY.createPoint(new Coordinate(longitude, latitude));
        return polygon.covers(point);
    }

    @Override
    public String toWkt() {
        return new WKTWriter().write(polygon);
    }
}
