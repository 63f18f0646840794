package com.shipmenttelemetry.engine.service;

import com.shipmenttelemetry.engine.dto.GeofenceDefinition;
import com.shipmenttelemetry.engine.dto.GeofenceEvent;
import com.shipmenttelemetry.engine.dto.NormalizedTelemetryRecord;
import com.shipmenttelemetry.engine.model.GeofenceEventType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Detects boundary crossings by comparing each record's position with the device's previous
 * membership of every geofence.
 *
 * ENTER on outside to inside, EXIT on inside to outside, nothing while membership is steady.
 * A point on the boundary counts as inside. Events come out in definition order.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GeofenceEngine {

    private final GeofenceMembershipStore membershipStore;

    public List<GeofenceEvent> evaluate(NormalizedTelemetryRecord record, List<GeofenceDefinition> definitions) {
        Instant seenAt = record.receivedAt() != null ? record.receivedAt() : record.eventTime();
        List<GeofenceEvent> events = new ArrayList<>();

        for (GeofenceDefinition definition : definitions) {
            boolean inside = definition.covers(record.latitude(), record.longitude());
            boolean wasInside = membershipStore.update(record.deviceId(), definition.id(), inside, seenAt);

            if (inside && !wasInside) {
                events.add(GeofenceEvent.of(definition, GeofenceEventType.ENTER, record));
            } else if (!inside && wasInside) {
                events.add(GeofenceEvent.of(definition, GeofenceEventType.EXIT, record));
            }
        }

        events.forEach(event -> log.info("Geofence transition: {}", event.toLogString()));
        return events;
    }
}
