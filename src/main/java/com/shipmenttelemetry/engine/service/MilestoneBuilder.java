package com.shipmenttelemetry.engine.service;

import com.shipmenttelemetry.engine.config.TelemetryProperties;
import com.shipmenttelemetry.engine.dto.GeofenceEvent;
import com.shipmenttelemetry.engine.dto.NormalizedTelemetryRecord;
import com.shipmenttelemetry.engine.model.GeofenceEventType;
import com.shipmenttelemetry.engine.model.MilestoneType;
import com.shipmenttelemetry.engine.token.Token;
import com.shipmenttelemetry.engine.token.TokenFactory;
import com.shipmenttelemetry.engine.token.TokenSchemas;
import com.shipmenttelemetry.engine.token.TokenType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Derives MT-01 milestone tokens from one normalized record and the geofence events it caused.
 *
 * Rules, applied per event in order:
 * - SHIPPER_PICKUP ENTER: PICKUP_ARRIVED
 * - SHIPPER_PICKUP EXIT while moving with ignition on: IN_TRANSIT
 * - CONSIGNEE ENTER while stopped with ignition off: DELIVERED
 * - TERMINAL or PORT ENTER / EXIT: TERMINAL_ARRIVED / TERMINAL_DEPARTED
 * - BORDER ENTER / EXIT: CHECKPOINT_ARRIVED / CHECKPOINT_DEPARTED
 *
 * With no events at all, a moving vehicle with ignition on and no idle time re-affirms
 * IN_TRANSIT once IN_TRANSIT has fired and DELIVERED has not.
 *
 * Deterministic: token ids are derived from the shipment, the milestone and the event time.
 * The builder never persists, registers or changes the context; the caller does so once a
 * token is stored.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MilestoneBuilder {

    static final String REAFFIRMED_FIELD = "reaffirmed";

    private final TokenFactory tokenFactory;
    private final TelemetryProperties properties;

    public List<Token> build(MilestoneContext context, NormalizedTelemetryRecord record, List<GeofenceEvent> events) {
        double stationaryMph = properties.milestone().stationarySpeedMph();
        boolean moving = record.speedMph() > stationaryMph;

        List<Token> milestones = new ArrayList<>();
        Set<String> derivedKeys = new HashSet<>();

        for (GeofenceEvent event : events) {
            MilestoneType type = milestoneFor(event, moving, record.ignition());
            if (type == null) {
                continue;
            }
            if (context.hasFired(type, event.geofenceId()) || !derivedKeys.add(type.firingKey(event.geofenceId()))) {
                log.debug("Milestone {} already fired for shipment {}", type, context.st01Id());
                continue;
            }
            milestones.add(createMilestone(context, record, type, event, false));
        }

        if (events.isEmpty() && moving && record.ignition() && record.idleTimeSeconds() == 0
            && context.hasFired(MilestoneType.IN_TRANSIT) && !context.hasFired(MilestoneType.DELIVERED)) {
            milestones.add(createMilestone(context, record, MilestoneType.IN_TRANSIT, null, true));
        }

        return milestones;
    }

    private MilestoneType milestoneFor(GeofenceEvent event, boolean moving, boolean ignition) {
        boolean enter = event.eventType() == GeofenceEventType.ENTER;
        return switch (event.kind()) {
            case SHIPPER_PICKUP -> enter ? MilestoneType.PICKUP_ARRIVED
                : (moving && ignition ? MilestoneType.IN_TRANSIT : null);
            case CONSIGNEE -> enter && !moving && !ignition ? MilestoneType.DELIVERED : null;
            case TERMINAL, PORT -> enter ? MilestoneType.TERMINAL_ARRIVED : MilestoneType.TERMINAL_DEPARTED;
            case BORDER -> enter ? MilestoneType.CHECKPOINT_ARRIVED : MilestoneType.CHECKPOINT_DEPARTED;
            case CUSTOM -> null;
        };
    }

    private Token createMilestone(MilestoneContext context, NormalizedTelemetryRecord record, MilestoneType type,
                                  GeofenceEvent event, boolean reaffirmed) {
        Map<String, Object> location = new LinkedHashMap<>();
        location.put("lat", record.latitude());
        location.put("lon", record.longitude());

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("milestone_type", type.name());
        metadata.put("timestamp", record.eventTime().toString());
        metadata.put("location", location);
        metadata.put("device_id", record.deviceId());
        metadata.put("speed_mph", Math.round(record.speedMph() * 100.0) / 100.0);
        metadata.put("ignition", record.ignition());
        if (event != null) {
            metadata.put(MilestoneContextRegistry.GEOFENCE_ID_FIELD, event.geofenceId());
            metadata.put("geofence_name", event.geofenceName());
            metadata.put("geofence_kind", event.kind().name());
        }
        if (reaffirmed) {
            metadata.put(REAFFIRMED_FIELD, true);
        }

        String tokenId = milestoneTokenId(context.st01Id(), type, record, event, reaffirmed);
        Token token = tokenFactory.build(TokenType.MT_01, tokenId, context.st01Id(), metadata,
            Map.of(TokenSchemas.ST01_ID, context.st01Id()));
        log.info("Derived milestone {} for shipment {} from {}", type, context.st01Id(), record.toLogString());
        return token;
    }

    static String milestoneTokenId(String st01Id, MilestoneType type, NormalizedTelemetryRecord record,
                                   GeofenceEvent event, boolean reaffirmed) {
        String seed = String.join("|", st01Id, type.name(), String.valueOf(record.eventTime().toEpochMilli()),
            event == null ? "" : event.geofenceId(), reaffirmed ? REAFFIRMED_FIELD : "");
        return UUID.nameUUIDFromBytes(seed.getBytes(StandardCharsets.UTF_8)).toString();
    }
}
