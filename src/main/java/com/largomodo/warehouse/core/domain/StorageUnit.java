package com.largomodo.warehouse.core.domain;

/**
 * Capability of anything that can hold parcels up to a fixed capacity.
 * <p>
 * StorageBin is the only implementation today. New kinds of storage implement this interface
 * directly rather than extending a base class.
 */
public interface StorageUnit {

    /**
     * Claims {@code amount} units of space.
     * <p>
     * Overflow is reported through the returned value, never thrown. A
     * {@link OccupyResult.CapacityExceeded} result leaves the unit untouched.
     *
     * @param amount space to claim, must not be negative
     * @return {@link OccupyResult.Occupied} with the new usage, or {@link OccupyResult.CapacityExceeded}
     * @throws IllegalArgumentException if amount is negative
     */
    OccupyResult occupySpace(int amount);

    /**
     * @return capacity minus used space, never negative
     */
    int availableSpace();
}
