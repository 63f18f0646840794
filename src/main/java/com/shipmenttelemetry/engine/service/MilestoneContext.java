package com.shipmenttelemetry.engine.service;

import com.shipmenttelemetry.engine.dto.GeofenceEvent;
import com.shipmenttelemetry.engine.dto.NormalizedTelemetryRecord;
import com.shipmenttelemetry.engine.model.MilestoneType;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Milestones already fired for one shipment.
 *
 * The milestone builder only reads a context; the caller records a milestone once its token
 * has been persisted. Samples whose geofence events could not be turned into stored tokens are
 * kept as deferred derivations and replayed with the shipment's next sample, since membership
 * has already moved on and the events will not be seen again. The pipeline also uses the
 * instance as the per-shipment lock.
 */
@Slf4j
public class MilestoneContext {

    static final int MAX_DEFERRED = 64;

    private final String st01Id;
    private final Deque<DeferredDerivation> deferred = new ArrayDeque<>();
    private final Set<MilestoneType> firedTypes = EnumSet.noneOf(MilestoneType.class);
    private final Set<String> firingKeys = new HashSet<>();
    private volatile Instant lastActivity;

    public MilestoneContext(String st01Id) {
        this.st01Id = Objects.requireNonNull(st01Id, "st01Id");
        this.lastActivity = Instant.EPOCH;
    }

    public String st01Id() {
        return st01Id;
    }

    public synchronized boolean hasFired(MilestoneType type) {
        return firedTypes.contains(type);
    }

    /**
     * Whether the milestone was fired for this geofence, or at all for once-per-shipment types.
     */
    public synchronized boolean hasFired(MilestoneType type, String geofenceId) {
        return firingKeys.contains(type.firingKey(geofenceId));
    }

    public synchronized void record(MilestoneType type, String geofenceId) {
        firedTypes.add(type);
        firingKeys.add(type.firingKey(geofenceId));
    }

    public synchronized Set<MilestoneType> firedMilestones() {
        return firedTypes.isEmpty() ? EnumSet.noneOf(MilestoneType.class) : EnumSet.copyOf(firedTypes);
    }

    /**
     * Keeps a sample's geofence events for a later attempt. The oldest entry is dropped once
     * {@link #MAX_DEFERRED} are waiting.
     */
    public synchronized void defer(NormalizedTelemetryRecord record, List<GeofenceEvent> events) {
        if (deferred.size() >= MAX_DEFERRED) {
            DeferredDerivation dropped = deferred.removeFirst();
            log.error("Dropping deferred milestones of {} for shipment {}", dropped.record().toLogString(), st01Id);
        }
        deferred.addLast(new DeferredDerivation(record, List.copyOf(events)));
    }

    public synchronized List<DeferredDerivation> deferred() {
        return List.copyOf(deferred);
    }

    public synchronized void resolve(DeferredDerivation derivation) {
        deferred.remove(derivation);
    }

    public synchronized boolean hasDeferred() {
        return !deferred.isEmpty();
    }

    public Instant lastActivity() {
        return lastActivity;
    }

    public void touch(Instant at) {
        this.lastActivity = at;
    }

    @Override
    public synchronized String toString() {
        return "MilestoneContext[" + st01Id + ", fired=" + firedTypes + ", deferred=" + deferred.size() + "]";
    }

    /**
     * A sample and the geofence events it caused, waiting to be derived again.
     */
    public record DeferredDerivation(NormalizedTelemetryRecord record, List<GeofenceEvent> events) {
    }
}
