package com.shipmenttelemetry.engine.service;

import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Whether a device was last seen inside a geofence, per (device, geofence) pair.
 * A pair never seen counts as outside.
 */
@Component
public class GeofenceMembershipStore {

    private final ConcurrentHashMap<MembershipKey, Membership> memberships = new ConcurrentHashMap<>();

    /**
     * Records the current membership and returns the previous one, atomically per pair.
     */
    public boolean update(String deviceId, String geofenceId, boolean inside, Instant seenAt) {
        AtomicBoolean wasInside = new AtomicBoolean(false);
        memberships.compute(new MembershipKey(deviceId, geofenceId), (key, current) -> {
            wasInside.set(current != null && current.inside());
            return new Membership(inside, seenAt);
        });
        return wasInside.get();
    }

    public boolean isInside(String deviceId, String geofenceId) {
        Membership membership = memberships.get(new MembershipKey(deviceId, geofenceId));
        return membership != null && membership.inside();
    }

    public int evictIdleSince(Instant cutoff) {
        AtomicInteger evicted = new AtomicInteger();
        memberships.keySet().forEach(key -> memberships.computeIfPresent(key, (k, membership) -> {
            if (membership.lastSeen().isBefore(cutoff)) {
                evicted.incrementAndGet();
                return null;
            }
            return membership;
        }));
        return evicted.get();
    }

    public int size() {
        return memberships.size();
    }

    private record MembershipKey(String deviceId, String geofenceId) {
    }

    private record Membership(boolean inside, Instant lastSeen) {
    }
}
