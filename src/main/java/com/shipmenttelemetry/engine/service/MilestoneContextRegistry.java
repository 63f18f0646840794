package com.shipmenttelemetry.engine.service;

import com.shipmenttelemetry.engine.model.MilestoneType;
import com.shipmenttelemetry.engine.token.Token;
import com.shipmenttelemetry.engine.token.TokenStore;
import com.shipmenttelemetry.engine.token.TokenType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One {@link MilestoneContext} per shipment for callers that do not keep their own.
 *
 * A context is rebuilt from the shipment's persisted MT-01 tokens the first time it is asked
 * for, so a restarted instance does not fire milestones twice.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MilestoneContextRegistry {

    static final String GEOFENCE_ID_FIELD = "geofence_id";

    private final TokenStore tokenStore;
    private final ConcurrentHashMap<String, MilestoneContext> contexts = new ConcurrentHashMap<>();

    public MilestoneContext forShipment(String st01Id) {
        return contexts.computeIfAbsent(st01Id, this::hydrate);
    }

    private MilestoneContext hydrate(String st01Id) {
        MilestoneContext context = new MilestoneContext(st01Id);
        for (Token token : tokenStore.loadLineage(st01Id, TokenType.MT_01)) {
            MilestoneType.parse(token.metadata().get("milestone_type"))
                .ifPresent(type -> context.record(type, token.metadataString(GEOFENCE_ID_FIELD)));
        }
        log.debug("Hydrated {}", context);
        return context;
    }

    /**
     * Drops contexts not used since {@code cutoff}, together with any milestones still waiting
     * to be derived again.
     *
     * @return number of contexts evicted
     */
    public int evictIdleSince(Instant cutoff) {
        AtomicInteger evicted = new AtomicInteger();
        contexts.keySet().forEach(id -> contexts.computeIfPresent(id, (key, context) -> {
            if (context.lastActivity().isBefore(cutoff)) {
                evicted.incrementAndGet();
                return null;
            }
            return context;
        }));
        return evicted.get();
    }

    public int size() {
        return contexts.size();
    }
}
