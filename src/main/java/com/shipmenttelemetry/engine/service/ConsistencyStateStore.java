package com.shipmenttelemetry.engine.service;

import com.shipmenttelemetry.engine.dto.NormalizedTelemetryRecord;
import com.shipmenttelemetry.engine.model.TrackingKey;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Last accepted record per (device, shipment) stream.
 *
 * Each key is updated atomically through {@link ConcurrentHashMap#compute}, so two samples of
 * the same stream can never both see the same predecessor. Distinct keys do not contend.
 */
@Component
public class ConsistencyStateStore {

    private final ConcurrentHashMap<TrackingKey, NormalizedTelemetryRecord> lastKnown = new ConcurrentHashMap<>();

    /**
     * Stores {@code record} as the last known record of its stream and returns the one it
     * replaced.
     */
    public Optional<NormalizedTelemetryRecord> advance(NormalizedTelemetryRecord record) {
        AtomicReference<NormalizedTelemetryRecord> previous = new AtomicReference<>();
        lastKnown.compute(record.trackingKey(), (key, current) -> {
            previous.set(current);
            return record;
        });
        return Optional.ofNullable(previous.get());
    }

    public Optional<NormalizedTelemetryRecord> lastKnown(TrackingKey key) {
        return Optional.ofNullable(lastKnown.get(key));
    }

    /**
     * Drops streams whose last record was received before {@code cutoff}.
     *
     * @return number of streams evicted
     */
    public int evictIdleSince(Instant cutoff) {
        AtomicInteger evicted = new AtomicInteger();
        lastKnown.keySet().forEach(key -> lastKnown.computeIfPresent(key, (k, record) -> {
            if (record.receivedAt() != null && record.receivedAt().isBefore(cutoff)) {
                evicted.incrementAndGet();
                return null;
            }
            return record;
        }));
        return evicted.get();
    }

    public int size() {
        return lastKnown.size();
    }
}
