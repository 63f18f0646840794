package com.shipmenttelemetry.engine.model;

import java.util.Optional;

/**
 * Discrete shipment lifecycle events carried by MT-01 tokens as {@code milestone_type}.
 */
public enum MilestoneType {
    PICKUP_ARRIVED(true),
    IN_TRANSIT(true),
    TERMINAL_ARRIVED(false),
    TERMINAL_DEPARTED(false),
    CHECKPOINT_ARRIVED(false),
    CHECKPOINT_DEPARTED(false),
    DELIVERED(true);

    private final boolean oncePerShipment;

    MilestoneType(boolean oncePerShipment) {
        this.oncePerShipment = oncePerShipment;
    }

    /**
     * Whether the milestone fires at most once per shipment. The others fire once per
     * geofence, since a route may pass several terminals or borders.
     */
    public boolean isOncePerShipment() {
        return oncePerShipment;
    }

    /**
     * Key under which a fired milestone is remembered.
     */
    public String firingKey(String geofenceId) {
        return oncePerShipment || geofenceId == null ? name() : name() + "@" + geofenceId;
    }

    public static Optional<MilestoneType> parse(Object value) {
        if (!(value instanceof String text)) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(text));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
