package com.largomodo.warehouse.core.domain;

/**
 * Immutable description of a package moving through the warehouse.
 * <p>
 * Named {@code Parcel} rather than {@code Package} so it never shadows {@link java.lang.Package}.
 * The destination is carried through allocation and truck loading but plays no part in either
 * decision.
 * </p>
 *
 * @param trackingId  Tracking id, unique within a run
 * @param size        Space the parcel occupies (must be > 0)
 * @param destination Opaque destination label
 */
public record Parcel(String trackingId, int size, String destination) {
    /**
     * Compact constructor that validates tracking id and size.
     *
     * @throws IllegalArgumentException if trackingId is blank or size is not positive
     */
    public Parcel {
        if (trackingId == null || trackingId.isBlank()) {
            throw new IllegalArgumentException("trackingId must not be null or blank");
        }
        if (size <= 0) {
            throw new IllegalArgumentException(
                "size must be positive, got: " + size + " (" + trackingId + ")"
            );
        }
        if (destination == null) {
            destination = "";
        }
    }
}
