package com.shipmenttelemetry.engine.controller;

import com.shipmenttelemetry.engine.dto.GeofenceDefinition;
import com.shipmenttelemetry.engine.dto.GeofenceSummary;
import com.shipmenttelemetry.engine.service.GeofenceCatalogService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Read access to the geofence catalogue and control of its Redis cache.
 */
@RestController
@RequestMapping("/api/geofences")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Geofences", description = "Geofence catalogue and cache management")
public class GeofenceController {

    private final GeofenceCatalogService catalogService;

    @Operation(summary = "Active geofences the pipeline evaluates against")
    @GetMapping
    public ResponseEntity<List<GeofenceSummary>> list() {
        return ResponseEntity.ok(catalogService.definitions().stream()
            .map(GeofenceDefinition::toSummary)
            .toList());
    }

    @Operation(summary = "Active geofences covering a point", description = "Answered by PostGIS, bypassing the cache.")
    @GetMapping("/covering")
    public ResponseEntity<List<GeofenceSummary>> covering(
            @Parameter(description = "Latitude", example = "41.8781") @RequestParam double lat,
            @Parameter(description = "Longitude", example = "-87.6298") @RequestParam double lon) {
        return ResponseEntity.ok(catalogService.findCovering(lat, lon).stream()
            .map(GeofenceDefinition::toSummary)
            .toList());
    }

    @Operation(summary = "Reload the catalogue from the database")
    @PostMapping("/cache/refresh")
    public ResponseEntity<Map<String, Object>> refreshCache() {
        log.info("Manual geofence cache refresh requested");
        int count = catalogService.refresh();
        return ResponseEntity.ok(Map.of(
            "status", "OK",
            "geofencesLoaded", count
        ));
    }

    @GetMapping("/cache/stats")
    public ResponseEntity<GeofenceCatalogService.CacheStats> cacheStats() {
        return ResponseEntity.ok(catalogService.getCacheStats());
    }

    @DeleteMapping("/cache/{geofenceId}")
    public ResponseEntity<Map<String, Object>> invalidate(@PathVariable String geofenceId) {
        catalogService.invalidate(geofenceId);
        return ResponseEntity.ok(Map.of(
            "status", "OK",
            "invalidated", geofenceId
        ));
    }
}
