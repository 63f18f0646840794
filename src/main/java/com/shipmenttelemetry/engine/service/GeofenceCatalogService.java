package com.shipmenttelemetry.engine.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.shipmenttelemetry.engine.dto.GeofenceDefinition;
import com.shipmenttelemetry.engine.entity.GeofenceZone;
import com.shipmenttelemetry.engine.exception.GeofenceCatalogUnavailableException;
import com.shipmenttelemetry.engine.geo.CircleBoundary;
import com.shipmenttelemetry.engine.geo.PolygonBoundary;
import com.shipmenttelemetry.engine.model.GeofenceKind;
import com.shipmenttelemetry.engine.repository.GeofenceZoneRepository;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.WKTReader;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Catalogue of active geofences for the pipeline.
 *
 * PostGIS is the source of truth. Definitions are shared across instances through Redis as
 * WKT plus a small JSON metadata document, and each instance evaluates against an immutable
 * in-memory snapshot so no sample waits on I/O.
 *
 * Redis layout:
 * - "geofence:geometry:{id}": polygon WKT, or the center POINT for circular zones
 * - "geofence:metadata:{id}": {"id", "name", "kind", "radiusMeters"}
 * - "geofences:active": set of cached ids
 *
 * Cache failures are logged and fall back to the database; they never reach the pipeline.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GeofenceCatalogService {

    static final String GEOMETRY_KEY_PREFIX = "geofence:geometry:";
    static final String METADATA_KEY_PREFIX = "geofence:metadata:";
    static final String ACTIVE_GEOFENCES_KEY = "geofences:active";

    private final GeofenceZoneRepository zoneRepository;
    private final StringRedisTemplate stringRedisTemplate;
    private final ObjectMapper objectMapper;

    private final AtomicReference<List<GeofenceDefinition>> snapshot = new AtomicReference<>();

    @Value("${shipment.geofence.cache.ttl-minutes:60}")
    private long cacheTtlMinutes = 60;

    /**
     * Loads the snapshot before the first sample arrives: from Redis when another instance
     * already populated it, from the database otherwise.
     */
    @PostConstruct
    public void warmUp() {
        log.info("Starting geofence catalogue warm-up...");
        long startTime = System.currentTimeMillis();
        try {
            List<GeofenceDefinition> cached = readCache();
            if (cached.isEmpty()) {
                refresh();
            } else {
                snapshot.set(cached);
            }
            log.info("Geofence catalogue warm-up completed: {} geofences in {}ms",
                definitions().size(), System.currentTimeMillis() - startTime);
        } catch (Exception e) {
            log.error("Geofence catalogue warm-up failed, definitions will load on first use", e);
        }
    }

    @Scheduled(fixedRateString = "${shipment.geofence.cache.refresh-interval-minutes:30}",
               timeUnit = TimeUnit.MINUTES,
               initialDelayString = "${shipment.geofence.cache.refresh-interval-minutes:30}")
    public void scheduledRefresh() {
        try {
            int count = refresh();
            log.info("Scheduled geofence refresh completed: {} geofences", count);
        } catch (Exception e) {
            log.error("Scheduled geofence refresh failed, keeping the previous snapshot", e);
        }
    }

    /**
     * Snapshot the pipeline evaluates against, in catalogue id order.
     *
     * @throws GeofenceCatalogUnavailableException when no snapshot exists yet and the database
     *                                             cannot be read
     */
    public List<GeofenceDefinition> definitions() {
        List<GeofenceDefinition> current = snapshot.get();
        if (current != null) {
            return current;
        }
        synchronized (snapshot) {
            if (snapshot.get() == null) {
                List<GeofenceDefinition> cached = readCache();
                if (cached.isEmpty()) {
                    log.warn("No geofences found in cache, falling back to database");
                    try {
                        refresh();
                    } catch (DataAccessException e) {
                        throw new GeofenceCatalogUnavailableException("Geofence catalogue could not be loaded", e);
                    }
                } else {
                    snapshot.set(cached);
                }
            }
            return snapshot.get();
        }
    }

    /**
     * Reloads active zones from the database, replaces the snapshot and rewrites the cache.
     *
     * @return number of geofences in the new snapshot
     */
    public int refresh() {
        List<GeofenceDefinition> definitions = new ArrayList<>();
        for (GeofenceZone zone : zoneRepository.findByActiveTrue()) {
            try {
                definitions.add(zone.toDefinition());
            } catch (RuntimeException e) {
                log.error("Skipping geofence zone {}: {}", zone.getId(), e.getMessage());
            }
        }
        definitions.sort(Comparator.comparing(GeofenceCatalogService::sortKey));
        List<GeofenceDefinition> loaded = List.copyOf(definitions);
        snapshot.set(loaded);
        writeCache(loaded);
        log.info("Loaded {} active geofences", loaded.size());
        return loaded.size();
    }

    /**
     * Active geofences covering a point, answered by PostGIS directly.
     */
    public List<GeofenceDefinition> findCovering(double latitude, double longitude) {
        return zoneRepository.findActiveZonesCoveringPoint(longitude, latitude).stream()
            .map(GeofenceZone::toDefinition)
            .toList();
    }

    private void writeCache(List<GeofenceDefinition> definitions) {
        try {
            stringRedisTemplate.delete(ACTIVE_GEOFENCES_KEY);
            List<String> ids = new ArrayList<>();
            for (GeofenceDefinition definition : definitions) {
                cacheDefinition(definition);
                ids.add(definition.id());
            }
            if (!ids.isEmpty()) {
                stringRedisTemplate.opsForSet().add(ACTIVE_GEOFENCES_KEY, ids.toArray(new String[0]));
                stringRedisTemplate.expire(ACTIVE_GEOFENCES_KEY, cacheTtlMinutes, TimeUnit.MINUTES);
            }
            log.debug("Cached {} geofences in Redis", ids.size());
        } catch (Exception e) {
            log.error("Failed to write geofences to Redis, serving from memory only", e);
        }
    }

    private void cacheDefinition(GeofenceDefinition definition) throws JsonProcessingException {
        Double radius = definition.boundary() instanceof CircleBoundary circle ? circle.radiusMeters() : null;
        String metadata = objectMapper.writeValueAsString(
            new CachedGeofence(definition.id(), definition.name(), definition.kind(), radius));

        stringRedisTemplate.opsForValue().set(GEOMETRY_KEY_PREFIX + definition.id(),
            definition.boundary().toWkt(), cacheTtlMinutes, TimeUnit.MINUTES);
        stringRedisTemplate.opsForValue().set(METADATA_KEY_PREFIX + definition.id(),
            metadata, cacheTtlMinutes, TimeUnit.MINUTES);
    }

    private List<GeofenceDefinition> readCache() {
        try {
            Set<String> ids = stringRedisTemplate.opsForSet().members(ACTIVE_GEOFENCES_KEY);
            if (ids == null || ids.isEmpty()) {
                return List.of();
            }
            List<GeofenceDefinition> definitions = new ArrayList<>();
            for (String id : ids) {
                GeofenceDefinition definition = readCachedDefinition(id);
                if (definition != null) {
                    definitions.add(definition);
                }
            }
            definitions.sort(Comparator.comparing(GeofenceCatalogService::sortKey));
            return List.copyOf(definitions);
        } catch (Exception e) {
            log.error("Failed to read geofences from Redis", e);
            return List.of();
        }
    }

    /**
     * Reads one cached geofence, or null when either key expired or cannot be parsed.
     */
    GeofenceDefinition readCachedDefinition(String id) {
        String wkt = stringRedisTemplate.opsForValue().get(GEOMETRY_KEY_PREFIX + id);
        String metadataJson = stringRedisTemplate.opsForValue().get(METADATA_KEY_PREFIX + id);
        if (wkt == null || metadataJson == null) {
            log.debug("Geofence {} not found in cache", id);
            return null;
        }
        try {
            CachedGeofence metadata = objectMapper.readValue(metadataJson, CachedGeofence.class);
            Geometry geometry = new WKTReader().read(wkt);
            if (metadata.radiusMeters() != null && geometry instanceof Point center) {
                return new GeofenceDefinition(id, metadata.name(), metadata.kind(),
                    new CircleBoundary(center.getY(), center.getX(), metadata.radiusMeters()));
            }
            if (geometry instanceof Polygon polygon) {
                polygon.setSRID(4326);
                return new GeofenceDefinition(id, metadata.name(), metadata.kind(), new PolygonBoundary(polygon));
            }
            log.warn("Cached geofence {} has unsupported geometry {}", id, geometry.getGeometryType());
            return null;
        } catch (JsonProcessingException | ParseException | IllegalArgumentException e) {
            log.error("Failed to parse cached geofence: {}", id, e);
            return null;
        }
    }

    /**
     * Removes one geofence from Redis. The in-memory snapshot changes on the next refresh.
     */
    public void invalidate(String geofenceId) {
        stringRedisTemplate.delete(GEOMETRY_KEY_PREFIX + geofenceId);
        stringRedisTemplate.delete(METADATA_KEY_PREFIX + geofenceId);
        stringRedisTemplate.opsForSet().remove(ACTIVE_GEOFENCES_KEY, geofenceId);
        log.info("Invalidated cached geofence: {}", geofenceId);
    }

    public void clearCache() {
        Set<String> ids = stringRedisTemplate.opsForSet().members(ACTIVE_GEOFENCES_KEY);
        if (ids != null) {
            ids.forEach(this::invalidate);
        }
        stringRedisTemplate.delete(ACTIVE_GEOFENCES_KEY);
        log.info("Cleared all cached geofences");
    }

    public CacheStats getCacheStats() {
        Set<String> ids = stringRedisTemplate.opsForSet().members(ACTIVE_GEOFENCES_KEY);
        int cachedCount = ids != null ? ids.size() : 0;
        int databaseCount = (int) zoneRepository.countByActiveTrue();
        List<GeofenceDefinition> current = snapshot.get();
        return new CacheStats(cachedCount, databaseCount, current != null ? current.size() : 0);
    }

    private static String sortKey(GeofenceDefinition definition) {
        String id = definition.id();
        return !id.isEmpty() && id.length() < 19 && id.chars().allMatch(Character::isDigit) ? String.format("%020d", Long.parseLong(id)) : id;
    }

    public record CachedGeofence(String id, String name, GeofenceKind kind, Double radiusMeters) {
    }

    public record CacheStats(int cachedCount, int databaseCount, int snapshotCount) {

        public boolean isCacheHealthy() {
            return cachedCount > 0 && cachedCount == databaseCount;
        }
    }
}
