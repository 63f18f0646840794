package com.shipmenttelemetry.engine;

import com.shipmenttelemetry.engine.config.TelemetryProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Entry point of the Shipment Telemetry Engine.
 *
 * - @EnableConfigurationProperties: binds shipment.telemetry.* into {@link TelemetryProperties}
 * - @EnableScheduling: geofence catalogue refresh and idle state eviction
 *
 * Flow per telemetry sample:
 * 1. Normalize units, time zone and device defaults
 * 2. Flag implausible transitions against the stream's previous record
 * 3. Detect geofence ENTER/EXIT against the cached catalogue
 * 4. Derive MT-01 milestone tokens
 * 5. Persist tokens into the shipment's lineage
 */
@SpringBootApplication
@EnableConfigurationProperties(TelemetryProperties.class)
@EnableScheduling
public class ShipmentTelemetryApplication {

    public static void main(String[] args) {
        SpringApplication.run(ShipmentTelemetryApplication.class, args);
    }
}
