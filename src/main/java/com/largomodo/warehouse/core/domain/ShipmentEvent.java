package com.largomodo.warehouse.core.domain;

import java.time.Instant;
import java.util.OptionalInt;

/**
 * Immutable record of one state-changing action, handed to the shipment log.
 * <p>
 * Truck events carry no bin; {@code binId} is null for them.
 * </p>
 *
 * @param trackingId Tracking id of the parcel involved
 * @param binId      Bin the parcel was stored in, or null
 * @param status     What happened
 * @param timestamp  When it happened
 */
public record ShipmentEvent(String trackingId, Integer binId, ShipmentStatus status, Instant timestamp) {

    public ShipmentEvent {
        if (trackingId == null || trackingId.isBlank()) {
            throw new IllegalArgumentException("trackingId must not be null or blank");
        }
        if (status == null || timestamp == null) {
            throw new IllegalArgumentException("status and timestamp must not be null");
        }
    }

    public OptionalInt bin() {
        return binId == null ? OptionalInt.empty() : OptionalInt.of(binId);
    }
}
