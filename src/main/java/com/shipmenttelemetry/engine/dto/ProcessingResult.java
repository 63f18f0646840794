package com.shipmenttelemetry.engine.dto;

import com.shipmenttelemetry.engine.exception.ErrorKind;
import com.shipmenttelemetry.engine.token.Token;

import java.util.List;

/**
 * Outcome of running one telemetry sample through the pipeline.
 *
 * A failed sample carries its {@link ErrorKind} so batch callers can decide per sample whether
 * to retry. Tokens derived before a persistence failure are still listed.
 *
 * @param deviceId   Device of the sample, when it could be read
 * @param shipmentId Shipment of the sample, when it could be read
 * @param record     Normalized record, null when normalization failed
 * @param flags      Advisory consistency flags
 * @param events     Geofence transitions caused by the sample
 * @param tokens     Milestone tokens derived from the sample
 * @param errorKind  Null on success
 * @param message    Error description, null on success
 */
public record ProcessingResult(
    String deviceId,
    String shipmentId,
    NormalizedTelemetryRecord record,
    List<ConsistencyFlag> flags,
    List<GeofenceEvent> events,
    List<Token> tokens,
    ErrorKind errorKind,
    String message
) {

    public ProcessingResult {
        flags = flags == null ? List.of() : List.copyOf(flags);
        events = events == null ? List.of() : List.copyOf(events);
        tokens = tokens == null ? List.of() : List.copyOf(tokens);
    }

    public static ProcessingResult success(NormalizedTelemetryRecord record, List<ConsistencyFlag> flags,
                                           List<GeofenceEvent> events, List<Token> tokens) {
        return new ProcessingResult(record.deviceId(), record.shipmentId(), record, flags, events, tokens, null, null);
    }

    public static ProcessingResult failure(RawTelemetry raw, ErrorKind errorKind, String message) {
        return new ProcessingResult(raw == null ? null : raw.deviceId(), raw == null ? null : raw.shipmentId(),
            null, List.of(), List.of(), List.of(), errorKind, message);
    }

    public static ProcessingResult failure(NormalizedTelemetryRecord record, List<ConsistencyFlag> flags,
                                           List<GeofenceEvent> events, List<Token> tokens,
                                           ErrorKind errorKind, String message) {
        return new ProcessingResult(record.deviceId(), record.shipmentId(), record, flags, events, tokens,
            errorKind, message);
    }

    public boolean success() {
        return errorKind == null;
    }

    public boolean retryable() {
        return errorKind != null && errorKind.isRetryable();
    }

    public String toLogString() {
        return String.format("Result[device=%s, shipment=%s, flags=%d, events=%d, tokens=%d, error=%s]",
            deviceId, shipmentId, flags.size(), events.size(), tokens.size(), errorKind);
    }
}
