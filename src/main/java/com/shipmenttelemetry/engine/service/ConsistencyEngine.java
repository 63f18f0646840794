package com.shipmenttelemetry.engine.service;

import com.shipmenttelemetry.engine.config.TelemetryProperties;
import com.shipmenttelemetry.engine.dto.ConsistencyFlag;
import com.shipmenttelemetry.engine.dto.NormalizedTelemetryRecord;
import com.shipmenttelemetry.engine.geo.GeoDistance;
import com.shipmenttelemetry.engine.model.FlagCode;
import com.shipmenttelemetry.engine.model.FlagSeverity;
import com.shipmenttelemetry.engine.model.SpeedUnit;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Checks each record against the previous record of the same (device, shipment) stream for
 * physically implausible transitions.
 *
 * Checks performed:
 * - IMPOSSIBLE_SPEED: implied speed above the transport mode's ceiling times the safety margin
 * - TIMESTAMP_DUPLICATE: same event time, different position beyond GPS noise
 * - TIMESTAMP_REVERSED: event time earlier than the stored one
 * - STALE_DEVICE_CLOCK: device clock too far from ingestion time
 * - BATTERY_DEPLETION: battery draining faster than hardware allows
 *
 * Flags are advisory. The new record replaces the stored one whatever the outcome, so a single
 * bad fix never blocks the stream.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConsistencyEngine {

    private static final double MILLIS_PER_HOUR = 3_600_000.0;

    private final ConsistencyStateStore stateStore;
    private final TelemetryProperties properties;

    public List<ConsistencyFlag> evaluate(NormalizedTelemetryRecord record) {
        Optional<NormalizedTelemetryRecord> previous = stateStore.advance(record);
        if (previous.isEmpty()) {
            log.debug("First record for {}, nothing to compare", record.trackingKey());
            return List.of();
        }

        List<ConsistencyFlag> flags = compare(previous.get(), record);
        flags.forEach(flag -> log.warn("Consistency flag raised: {}", flag.toLogString()));
        return flags;
    }

    /**
     * Pure comparison of two consecutive records of one stream.
     */
    List<ConsistencyFlag> compare(NormalizedTelemetryRecord previous, NormalizedTelemetryRecord current) {
        TelemetryProperties.Consistency limits = properties.consistency();
        List<ConsistencyFlag> flags = new ArrayList<>();

        long deltaMillis = Duration.between(previous.eventTime(), current.eventTime()).toMillis();
        double distanceMeters = GeoDistance.haversineMeters(
            previous.latitude(), previous.longitude(), current.latitude(), current.longitude());

        if (deltaMillis > 0) {
            double impliedMph = SpeedUnit.metersPerSecondToMph(distanceMeters / (deltaMillis / 1000.0));
            double ceilingMph = limits.speedCeilingMph(current.transportMode());
            if (impliedMph > ceilingMph) {
                flags.add(new ConsistencyFlag(FlagCode.IMPOSSIBLE_SPEED, FlagSeverity.CRITICAL, previous, current,
                    impliedMph, ceilingMph, String.format("%.0f m in %d ms implies %.1f mph, ceiling for %s is %.1f mph",
                    distanceMeters, deltaMillis, impliedMph, current.transportMode(), ceilingMph)));
            }
        } else if (deltaMillis == 0) {
            if (distanceMeters > limits.gpsNoiseEpsilonMeters()) {
                flags.add(new ConsistencyFlag(FlagCode.TIMESTAMP_DUPLICATE, FlagSeverity.WARNING, previous, current,
                    distanceMeters, limits.gpsNoiseEpsilonMeters(),
                    String.format("Two positions %.0f m apart share event time %s", distanceMeters, current.eventTime())));
            }
        } else {
            flags.add(new ConsistencyFlag(FlagCode.TIMESTAMP_REVERSED, FlagSeverity.WARNING, previous, current,
                deltaMillis / 1000.0, 0.0,
                String.format("Event time %s precedes stored %s", current.eventTime(), previous.eventTime())));
        }

        if (current.receivedAt() != null) {
            Duration skew = Duration.between(current.eventTime(), current.receivedAt()).abs();
            if (skew.compareTo(limits.maxClockSkew()) > 0) {
                flags.add(new ConsistencyFlag(FlagCode.STALE_DEVICE_CLOCK, FlagSeverity.WARNING, previous, current,
                    skew.toMillis() / 1000.0, limits.maxClockSkew().toMillis() / 1000.0,
                    String.format("Device clock is %s away from ingestion time", skew)));
            }
        }

        if (deltaMillis > 0 && previous.batteryVoltage() != null && current.batteryVoltage() != null) {
            double dropPerHour = (previous.batteryVoltage() - current.batteryVoltage()) / (deltaMillis / MILLIS_PER_HOUR);
            if (dropPerHour > limits.maxBatteryDropVoltsPerHour()) {
                flags.add(new ConsistencyFlag(FlagCode.BATTERY_DEPLETION, FlagSeverity.WARNING, previous, current,
                    dropPerHour, limits.maxBatteryDropVoltsPerHour(),
                    String.format("Battery fell from %.2f V to %.2f V", previous.batteryVoltage(),
                        current.batteryVoltage())));
            }
        }

        return flags;
    }
}
