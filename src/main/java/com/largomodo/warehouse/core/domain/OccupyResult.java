package com.largomodo.warehouse.core.domain;

/**
 * Outcome of claiming space in a {@link StorageUnit}.
 */
public sealed interface OccupyResult permits OccupyResult.Occupied, OccupyResult.CapacityExceeded {

    int binId();

    default boolean isSuccess() {
        return this instanceof Occupied;
    }

    /**
     * Space was claimed.
     *
     * @param binId     bin that was mutated
     * @param usedSpace used space after the claim
     */
    record Occupied(int binId, int usedSpace) implements OccupyResult {}

    /**
     * Claim rejected, the bin is unchanged.
     *
     * @param binId     bin that was asked
     * @param requested space that was requested
     * @param available space that was left at the time
     */
    record CapacityExceeded(int binId, int requested, int available) implements OccupyResult {}
}
