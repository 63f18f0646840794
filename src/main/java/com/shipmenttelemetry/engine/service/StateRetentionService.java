package com.shipmenttelemetry.engine.service;

import com.shipmenttelemetry.engine.config.TelemetryProperties;
import com.shipmenttelemetry.engine.token.TokenRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.TimeUnit;

/**
 * Evicts per-stream state that has not seen a sample within the configured idle TTL, and
 * cached tokens of shipments nobody touched within it. Evicted tokens are reloaded from
 * storage on demand.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StateRetentionService {

    private final ConsistencyStateStore consistencyStateStore;
    private final GeofenceMembershipStore membershipStore;
    private final MilestoneContextRegistry contextRegistry;
    private final TokenRegistry tokenRegistry;
    private final TelemetryProperties properties;
    private final Clock clock;

    @Scheduled(fixedRateString = "${shipment.telemetry.retention.sweep-interval-minutes:5}",
               initialDelayString = "${shipment.telemetry.retention.sweep-interval-minutes:5}",
               timeUnit = TimeUnit.MINUTES)
    public void scheduledSweep() {
        sweep();
    }

    /**
     * @return total number of entries evicted across the state stores
     */
    public int sweep() {
        Instant cutoff = Instant.now(clock).minus(properties.retention().idleTtl());
        int streams = consistencyStateStore.evictIdleSince(cutoff);
        int memberships = membershipStore.evictIdleSince(cutoff);
        int contexts = contextRegistry.evictIdleSince(cutoff);
        int tokens = tokenRegistry.evictIdleSince(cutoff);
        int total = streams + memberships + contexts + tokens;
        if (total > 0) {
            log.info("Evicted idle state older than {}: streams={}, memberships={}, contexts={}, tokens={}",
                cutoff, streams, memberships, contexts, tokens);
        }
        log.debug("Retained state: streams={}, memberships={}, contexts={}, tokens={}",
            consistencyStateStore.size(), membershipStore.size(), contextRegistry.size(), tokenRegistry.size());
        return total;
    }
}
