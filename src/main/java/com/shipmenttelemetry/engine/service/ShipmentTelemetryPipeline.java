package com.shipmenttelemetry.engine.service;

import com.shipmenttelemetry.engine.config.TelemetryProperties;
import com.shipmenttelemetry.engine.dto.ConsistencyFlag;
import com.shipmenttelemetry.engine.dto.DeviceState;
import com.shipmenttelemetry.engine.dto.GeofenceDefinition;
import com.shipmenttelemetry.engine.dto.GeofenceEvent;
import com.shipmenttelemetry.engine.dto.NormalizedTelemetryRecord;
import com.shipmenttelemetry.engine.dto.ProcessingResult;
import com.shipmenttelemetry.engine.dto.RawTelemetry;
import com.shipmenttelemetry.engine.exception.ErrorKind;
import com.shipmenttelemetry.engine.exception.InvalidStateTransitionException;
import com.shipmenttelemetry.engine.exception.ShipmentPipelineException;
import com.shipmenttelemetry.engine.exception.TokenPersistenceException;
import com.shipmenttelemetry.engine.model.GeofenceEventType;
import com.shipmenttelemetry.engine.model.GeofenceKind;
import com.shipmenttelemetry.engine.model.MilestoneType;
import com.shipmenttelemetry.engine.model.TrackingKey;
import com.shipmenttelemetry.engine.token.Token;
import com.shipmenttelemetry.engine.token.TokenLifecycleService;
import com.shipmenttelemetry.engine.token.TokenRegistry;
import com.shipmenttelemetry.engine.token.TokenState;
import com.shipmenttelemetry.engine.token.TokenStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Runs telemetry samples through normalization, consistency checks, geofence evaluation,
 * milestone derivation and token persistence.
 *
 * Samples of one shipment are processed one at a time by locking the shipment's
 * {@link MilestoneContext}; different shipments proceed in parallel. A failing sample produces
 * a failed {@link ProcessingResult}, never an exception, so one bad sample cannot fail a batch.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ShipmentTelemetryPipeline {

    private final TelemetryNormalizer normalizer;
    private final ConsistencyEngine consistencyEngine;
    private final ConsistencyStateStore consistencyStateStore;
    private final GeofenceEngine geofenceEngine;
    private final MilestoneBuilder milestoneBuilder;
    private final MilestoneContextRegistry contextRegistry;
    private final GeofenceCatalogService catalogService;
    private final TokenStore tokenStore;
    private final TokenRegistry tokenRegistry;
    private final TokenLifecycleService lifecycleService;
    private final TelemetryProperties properties;
    private final Clock clock;

    /**
     * Processes one sample against the current geofence catalogue, filling omitted device
     * fields from the stream's last accepted record.
     */
    public ProcessingResult process(RawTelemetry raw) {
        List<GeofenceDefinition> definitions;
        try {
            definitions = catalogService.definitions();
        } catch (ShipmentPipelineException e) {
            log.error("No geofence catalogue for {}: {}", raw == null ? null : raw.toLogString(), e.getMessage());
            return ProcessingResult.failure(raw, e.getKind(), e.getMessage());
        }
        return process(raw, lastKnownDeviceState(raw), definitions);
    }

    public ProcessingResult process(RawTelemetry raw, DeviceState deviceState,
                                    List<GeofenceDefinition> definitions) {
        NormalizedTelemetryRecord record;
        try {
            record = normalizer.normalize(raw, deviceState);
        } catch (ShipmentPipelineException e) {
            log.warn("Rejected telemetry sample {}: {}", raw == null ? null : raw.toLogString(), e.getMessage());
            return ProcessingResult.failure(raw, e.getKind(), e.getMessage());
        }

        MilestoneContext context;
        try {
            context = contextRegistry.forShipment(record.shipmentId());
        } catch (ShipmentPipelineException e) {
            log.error("Could not load milestone context for shipment {}: {}", record.shipmentId(), e.getMessage());
            return ProcessingResult.failure(record, List.of(), List.of(), List.of(), e.getKind(), e.getMessage());
        }
        return process(record, context, definitions);
    }

    /**
     * Runs an already normalized record with a caller-owned context.
     *
     * Milestones still deferred from earlier samples of the shipment are derived first. When
     * this sample fails with a retryable error, its geofence events are deferred in turn.
     */
    public ProcessingResult process(NormalizedTelemetryRecord record, MilestoneContext context,
                                    List<GeofenceDefinition> definitions) {
        synchronized (context) {
            context.touch(clock.instant());
            List<ConsistencyFlag> flags = consistencyEngine.evaluate(record);
            List<GeofenceEvent> events = geofenceEngine.evaluate(record, definitions);

            List<Token> tokens = new ArrayList<>();
            try {
                replayDeferred(context, tokens);
                derive(context, record, events, tokens);
            } catch (ShipmentPipelineException e) {
                log.error("Failed to derive milestones from {}: {}", record.toLogString(), e.getMessage());
                if (e.isRetryable() && !events.isEmpty()) {
                    context.defer(record, events);
                }
                return ProcessingResult.failure(record, flags, events, tokens, e.getKind(), e.getMessage());
            }

            ProcessingResult result = ProcessingResult.success(record, flags, events, tokens);
            log.debug("Processed {}", result.toLogString());
            return result;
        }
    }

    /**
     * Processes every sample independently, returning one result per input in input order.
     */
    public List<ProcessingResult> processBatch(List<RawTelemetry> samples) {
        List<GeofenceDefinition> definitions = null;
        List<ProcessingResult> results = new ArrayList<>(samples.size());
        for (RawTelemetry raw : samples) {
            try {
                if (definitions == null) {
                    definitions = catalogService.definitions();
                }
                results.add(process(raw, lastKnownDeviceState(raw), definitions));
            } catch (ShipmentPipelineException e) {
                log.error("Could not process {}: {}", raw == null ? null : raw.toLogString(), e.getMessage());
                results.add(ProcessingResult.failure(raw, e.getKind(), e.getMessage()));
            } catch (RuntimeException e) {
                log.error("Unexpected failure processing {}", raw == null ? null : raw.toLogString(), e);
                results.add(ProcessingResult.failure(raw, ErrorKind.INTERNAL, e.getMessage()));
            }
        }
        long failed = results.stream().filter(result -> !result.success()).count();
        log.info("Processed batch of {} samples, {} failed", samples.size(), failed);
        return results;
    }

    private void replayDeferred(MilestoneContext context, List<Token> tokens) {
        if (!context.hasDeferred()) {
            return;
        }
        for (MilestoneContext.DeferredDerivation deferred : context.deferred()) {
            try {
                derive(context, deferred.record(), deferred.events(), tokens);
                log.info("Derived deferred milestones of {}", deferred.record().toLogString());
            } catch (ShipmentPipelineException e) {
                if (e.isRetryable()) {
                    throw e;
                }
                log.error("Giving up on deferred milestones of {}: {}", deferred.record().toLogString(), e.getMessage());
            }
            context.resolve(deferred);
        }
    }

    private void derive(MilestoneContext context, NormalizedTelemetryRecord record, List<GeofenceEvent> events,
                        List<Token> tokens) {
        if (!events.isEmpty() || context.hasFired(MilestoneType.IN_TRANSIT)) {
            ensureRootLoaded(context.st01Id());
        }
        List<Token> milestones = milestoneBuilder.build(context, record, events);
        for (Token token : milestones) {
            tokens.add(token);
            withRetry(token.tokenId(), () -> tokenStore.persist(token));
            tokenRegistry.register(token);
            MilestoneType.parse(token.metadata().get("milestone_type")).ifPresent(type ->
                context.record(type, token.metadataString(MilestoneContextRegistry.GEOFENCE_ID_FIELD)));
        }
        advanceShipment(context.st01Id(), events, tokens);
    }

    /**
     * Moves the shipment's ST-01 along with its geofence events: leaving the pickup site puts a
     * dispatched shipment in transit, entering the consignee site marks it arrived. Events that
     * do not match the shipment's current state change nothing.
     */
    private void advanceShipment(String st01Id, List<GeofenceEvent> events, List<Token> tokens) {
        for (GeofenceEvent event : events) {
            Optional<ShipmentTransition> transition = ShipmentTransition.forEvent(event);
            Optional<Token> root = tokenRegistry.find(st01Id);
            if (transition.isEmpty() || root.isEmpty() || root.get().state() != transition.get().from()) {
                continue;
            }
            TokenState target = transition.get().to();
            try {
                tokens.add(withRetry(st01Id, () -> lifecycleService.transition(st01Id, target)));
                log.info("Shipment {} moved to {} on {}", st01Id, target, event.toLogString());
            } catch (InvalidStateTransitionException e) {
                log.info("Shipment {} was moved concurrently, not applying {}: {}", st01Id, target, e.getMessage());
            }
        }
    }

    /**
     * Makes the shipment's ST-01 resolvable for relation checks, loading it from storage when
     * this instance has not seen it yet or has evicted it.
     */
    private void ensureRootLoaded(String st01Id) {
        if (tokenRegistry.find(st01Id).isPresent()) {
            return;
        }
        Optional<Token> root = tokenStore.find(st01Id);
        if (root.isEmpty()) {
            log.warn("Shipment {} has no stored ST-01 token yet", st01Id);
        }
    }

    private <T> T withRetry(String tokenId, Supplier<T> write) {
        int maxAttempts = properties.persistence().maxAttempts();
        for (int attempt = 1; ; attempt++) {
            try {
                return write.get();
            } catch (TokenPersistenceException e) {
                if (attempt >= maxAttempts) {
                    throw e;
                }
                log.warn("Persisting token {} failed (attempt {}/{}), retrying", tokenId, attempt, maxAttempts);
            }
        }
    }

    private record ShipmentTransition(TokenState from, TokenState to) {

        static Optional<ShipmentTransition> forEvent(GeofenceEvent event) {
            if (event.kind() == GeofenceKind.SHIPPER_PICKUP && event.eventType() == GeofenceEventType.EXIT) {
                return Optional.of(new ShipmentTransition(TokenState.DISPATCHED, TokenState.IN_TRANSIT));
            }
            if (event.kind() == GeofenceKind.CONSIGNEE && event.eventType() == GeofenceEventType.ENTER) {
                return Optional.of(new ShipmentTransition(TokenState.IN_TRANSIT, TokenState.ARRIVED));
            }
            return Optional.empty();
        }
    }

    private DeviceState lastKnownDeviceState(RawTelemetry raw) {
        if (raw == null || raw.deviceId() == null || raw.shipmentId() == null) {
            return DeviceState.unknown();
        }
        return consistencyStateStore.lastKnown(new TrackingKey(raw.deviceId().trim(), raw.shipmentId().trim()))
            .map(DeviceState::fromLastKnown)
            .orElseGet(DeviceState::unknown);
    }
}
