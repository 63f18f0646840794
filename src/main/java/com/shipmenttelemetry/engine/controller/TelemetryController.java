package com.shipmenttelemetry.engine.controller;

import com.shipmenttelemetry.engine.dto.ProcessingResult;
import com.shipmenttelemetry.engine.dto.RawTelemetry;
import com.shipmenttelemetry.engine.service.ShipmentTelemetryPipeline;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Telemetry ingestion.
 *
 * A single sample answers with the HTTP status of its outcome. A batch always answers 200
 * with one result per sample, in input order.
 */
@RestController
@RequestMapping("/api/telemetry")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Telemetry", description = "Telemetry ingestion and milestone derivation")
public class TelemetryController {

    private final ShipmentTelemetryPipeline pipeline;

    @Operation(
            summary = "Ingest one telemetry sample",
            description = "Normalizes the sample, flags implausible transitions, detects geofence " +
                    "transitions and derives MT-01 milestone tokens."
    )
    @PostMapping("/ingest")
    public ResponseEntity<ProcessingResult> ingest(
            @io.swagger.v3.oas.annotations.parameters.RequestBody(
                    description = "Raw device sample",
                    required = true,
                    content = @Content(
                            schema = @Schema(implementation = RawTelemetry.class),
                            examples = @ExampleObject(
                                    value = "{\"deviceId\":\"TRK-001\",\"shipmentId\":\"SHP-1001\"," +
                                            "\"timestamp\":\"2024-03-01T14:05:00Z\",\"latitude\":41.8781," +
                                            "\"longitude\":-87.6298,\"speed\":8,\"speedUnit\":\"MPH\"," +
                                            "\"heading\":90,\"engineState\":\"RUNNING\",\"ignition\":true}"
                            )
                    )
            )
            @RequestBody RawTelemetry raw) {
        log.debug("Received {}", raw.toLogString());
        ProcessingResult result = pipeline.process(raw);
        if (result.success()) {
            return ResponseEntity.ok(result);
        }
        return ResponseEntity.status(ApiExceptionHandler.statusFor(result.errorKind())).body(result);
    }

    @Operation(
            summary = "Ingest a batch of telemetry samples",
            description = "Each sample is processed independently; a bad sample never fails the batch."
    )
    @PostMapping("/ingest/batch")
    public ResponseEntity<Map<String, Object>> ingestBatch(@RequestBody List<RawTelemetry> samples) {
        List<ProcessingResult> results = pipeline.processBatch(samples);
        long failed = results.stream().filter(result -> !result.success()).count();

        return ResponseEntity.ok(Map.of(
            "processed", results.size(),
            "failed", failed,
            "results", results
        ));
    }
}
