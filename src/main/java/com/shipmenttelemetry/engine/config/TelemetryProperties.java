package com.shipmenttelemetry.engine.config;

import com.shipmenttelemetry.engine.model.TransportMode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Thresholds of the telemetry pipeline, bound from {@code shipment.telemetry.*}.
 */
@Validated
@ConfigurationProperties(prefix = "shipment.telemetry")
public record TelemetryProperties(
    @Valid @NotNull Consistency consistency,
    @Valid @NotNull Milestone milestone,
    @Valid @NotNull Retention retention,
    @Valid @NotNull Persistence persistence
) {

    /**
     * Values used when nothing is configured, mirrored in application.yml.
     */
    public static TelemetryProperties defaults() {
        Map<TransportMode, Double> maxSpeedMph = new EnumMap<>(TransportMode.class);
        maxSpeedMph.put(TransportMode.ROAD, 90.0);
        maxSpeedMph.put(TransportMode.RAIL, 150.0);
        maxSpeedMph.put(TransportMode.OCEAN, 45.0);
        maxSpeedMph.put(TransportMode.AIR, 700.0);
        return new TelemetryProperties(
            new Consistency(maxSpeedMph, 1.25, 25.0, Duration.ofMinutes(10), 0.5),
            new Milestone(1.0),
            new Retention(Duration.ofHours(24), 5),
            new Persistence(3)
        );
    }

    /**
     * @param maxSpeedMph                Fastest plausible speed per transport mode
     * @param safetyMargin               Multiplier applied to the mode ceiling before flagging
     * @param gpsNoiseEpsilonMeters      Position jitter tolerated between simultaneous fixes
     * @param maxClockSkew               Allowed gap between device event time and ingestion time
     * @param maxBatteryDropVoltsPerHour Fastest plausible battery drain
     */
    public record Consistency(
        @NotEmpty Map<TransportMode, Double> maxSpeedMph,
        @Positive double safetyMargin,
        @PositiveOrZero double gpsNoiseEpsilonMeters,
        @NotNull Duration maxClockSkew,
        @Positive double maxBatteryDropVoltsPerHour
    ) {

        public double speedCeilingMph(TransportMode mode) {
            Double max = maxSpeedMph.get(mode);
            if (max == null) {
                max = maxSpeedMph.get(TransportMode.ROAD);
            }
            return max * safetyMargin;
        }
    }

    /**
     * @param stationarySpeedMph At or below this speed a vehicle counts as stopped
     */
    public record Milestone(@PositiveOrZero double stationarySpeedMph) {
    }

    /**
     * @param idleTtl              Per-key state untouched for this long is evicted
     * @param sweepIntervalMinutes How often the eviction sweep runs
     */
    public record Retention(@NotNull Duration idleTtl, @Min(1) long sweepIntervalMinutes) {
    }

    /**
     * @param maxAttempts Persist attempts per token before the sample fails
     */
    public record Persistence(@Min(1) int maxAttempts) {
    }
}
