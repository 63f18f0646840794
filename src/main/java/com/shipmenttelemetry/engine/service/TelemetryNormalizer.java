package com.shipmenttelemetry.engine.service;

import com.shipmenttelemetry.engine.dto.DeviceState;
import com.shipmenttelemetry.engine.dto.NormalizedTelemetryRecord;
import com.shipmenttelemetry.engine.dto.RawTelemetry;
import com.shipmenttelemetry.engine.exception.MalformedTelemetryException;
import com.shipmenttelemetry.engine.model.SpeedUnit;
import com.shipmenttelemetry.engine.model.TransportMode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Locale;
import java.util.Set;

/**
 * Turns a raw device sample into a {@link NormalizedTelemetryRecord}.
 *
 * Normalization:
 * - Timestamps become UTC instants. Local date-times are read in the device's zone.
 * - Speed is converted to meters per second from the reported unit (MPH when omitted).
 * - Heading wraps into [0, 360).
 * - Battery voltage, engine state and ignition fall back to the last known device state.
 *
 * Samples that cannot be normalized are rejected, never repaired.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TelemetryNormalizer {

    static final String UNKNOWN_ENGINE_STATE = "UNKNOWN";

    private static final Set<String> RUNNING_ENGINE_STATES = Set.of("RUNNING", "IDLE", "IDLING", "ON");

    private final Clock clock;

    /**
     * @throws MalformedTelemetryException when a required field is missing or out of range
     */
    public NormalizedTelemetryRecord normalize(RawTelemetry raw, DeviceState deviceState) {
        if (raw == null) {
            throw new MalformedTelemetryException("Telemetry sample is null");
        }
        DeviceState state = deviceState == null ? DeviceState.unknown() : deviceState;

        String deviceId = requireText(raw.deviceId(), "device_id");
        String shipmentId = requireText(raw.shipmentId(), "shipment_id");
        Instant eventTime = parseTimestamp(raw.timestamp(), state);
        double latitude = requireCoordinate(raw.latitude(), "latitude", 90.0);
        double longitude = requireCoordinate(raw.longitude(), "longitude", 180.0);

        SpeedUnit unit = resolveSpeedUnit(raw.speedUnit());
        double speed = requireNonNegative(raw.speed(), "speed");
        long idleTime = raw.idleTimeSeconds() == null ? 0L : raw.idleTimeSeconds();
        if (idleTime < 0) {
            throw new MalformedTelemetryException("idle_time_seconds must not be negative: " + idleTime);
        }

        String engineState = resolveEngineState(raw.engineState(), state);

        NormalizedTelemetryRecord record = NormalizedTelemetryRecord.builder()
            .deviceId(deviceId)
            .shipmentId(shipmentId)
            .eventTime(eventTime)
            .latitude(latitude)
            .longitude(longitude)
            .speedMps(unit.toMetersPerSecond(speed))
            .heading(normalizeHeading(raw.heading()))
            .engineState(engineState)
            .idleTimeSeconds(idleTime)
            .ignition(resolveIgnition(raw, state, engineState))
            .batteryVoltage(raw.batteryVoltage() != null ? raw.batteryVoltage() : state.batteryVoltage())
            .transportMode(resolveTransportMode(raw.transportMode()))
            .positionAccuracyM(raw.positionAccuracyM())
            .temperatureCelsius(raw.temperatureCelsius())
            .doorState(raw.doorState() == null ? null : raw.doorState().trim().toUpperCase(Locale.ROOT))
            .shockDetected(Boolean.TRUE.equals(raw.shockDetected()))
            .receivedAt(clock.instant())
            .build();

        log.debug("Normalized {}", record.toLogString());
        return record;
    }

    private String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new MalformedTelemetryException(field + " is required");
        }
        return value.trim();
    }

    private double requireCoordinate(Double value, String field, double limit) {
        if (value == null) {
            throw new MalformedTelemetryException(field + " is required");
        }
        if (!Double.isFinite(value) || Math.abs(value) > limit) {
            throw new MalformedTelemetryException(field + " out of range: " + value);
        }
        return value;
    }

    private double requireNonNegative(Double value, String field) {
        if (value == null) {
            throw new MalformedTelemetryException(field + " is required");
        }
        if (!Double.isFinite(value) || value < 0) {
            throw new MalformedTelemetryException(field + " must be a non-negative number: " + value);
        }
        return value;
    }

    /**
     * Accepts epoch milliseconds, ISO-8601 with offset or zone, or ISO-8601 local date-time.
     */
    Instant parseTimestamp(String timestamp, DeviceState state) {
        if (timestamp == null || timestamp.isBlank()) {
            throw new MalformedTelemetryException("timestamp is required");
        }
        String text = timestamp.trim();
        try {
            if (text.chars().allMatch(Character::isDigit)) {
                return Instant.ofEpochMilli(Long.parseLong(text));
            }
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(text,
                ZonedDateTime::from, LocalDateTime::from);
            if (parsed instanceof ZonedDateTime zoned) {
                return zoned.toInstant();
            }
            return ((LocalDateTime) parsed).atZone(state.zoneId()).toInstant();
        } catch (DateTimeParseException | NumberFormatException e) {
            throw new MalformedTelemetryException("Unparseable timestamp: " + text, e);
        }
    }

    private SpeedUnit resolveSpeedUnit(String label) {
        if (label == null || label.isBlank()) {
            return SpeedUnit.MPH;
        }
        return SpeedUnit.parse(label)
            .orElseThrow(() -> new MalformedTelemetryException("Unknown speed unit: " + label));
    }

    private TransportMode resolveTransportMode(String label) {
        if (label == null || label.isBlank()) {
            return TransportMode.ROAD;
        }
        return TransportMode.parse(label)
            .orElseThrow(() -> new MalformedTelemetryException("Unknown transport mode: " + label));
    }

    private double normalizeHeading(Double heading) {
        if (heading == null) {
            return 0.0;
        }
        if (!Double.isFinite(heading)) {
            throw new MalformedTelemetryException("heading must be finite: " + heading);
        }
        double wrapped = heading % 360.0;
        return wrapped < 0 ? wrapped + 360.0 : wrapped;
    }

    private String resolveEngineState(String reported, DeviceState state) {
        if (reported != null && !reported.isBlank()) {
            return reported.trim().toUpperCase(Locale.ROOT);
        }
        if (state.engineState() != null && !state.engineState().isBlank()) {
            return state.engineState();
        }
        return UNKNOWN_ENGINE_STATE;
    }

    /**
     * Reported ignition wins. A reported engine state is fresher than the remembered
     * ignition, which in turn beats an engine state inherited from the device state.
     */
    private boolean resolveIgnition(RawTelemetry raw, DeviceState state, String engineState) {
        if (raw.ignition() != null) {
            return raw.ignition();
        }
        boolean engineReported = raw.engineState() != null && !raw.engineState().isBlank();
        if (!engineReported && state.ignition() != null) {
            return state.ignition();
        }
        return RUNNING_ENGINE_STATES.contains(engineState);
    }
}
