package com.largomodo.warehouse.core.domain;

import java.util.Comparator;

/**
 * Storage location with a fixed capacity and mutable used space.
 * <p>
 * Capacity and id never change after construction, which is what lets the registry sort once per
 * load and skip re-sorting after allocations. Used space only grows, through
 * {@link #occupySpace(int)}.
 * <p>
 * Not thread-safe.
 */
public final class StorageBin implements StorageUnit, Comparable<StorageBin> {

    /**
     * Capacity ascending, ties by bin id ascending.
     */
    public static final Comparator<StorageBin> BY_CAPACITY =
            Comparator.comparingInt(StorageBin::getCapacity).thenComparingInt(StorageBin::getBinId);

    private final int binId;
    private final int capacity;
    private final String locationCode;
    private int usedSpace;

    public StorageBin(int binId, int capacity, String locationCode) {
        this(binId, capacity, 0, locationCode);
    }

    /**
     * @throws IllegalArgumentException if capacity is not positive or usedSpace is outside [0, capacity]
     */
    public StorageBin(int binId, int capacity, int usedSpace, String locationCode) {
        if (capacity <= 0) {
            throw new IllegalArgumentException(
                    "capacity must be positive, got: " + capacity + " (bin " + binId + ")");
        }
        if (usedSpace < 0 || usedSpace > capacity) {
            throw new IllegalArgumentException(
                    "usedSpace must be within [0, " + capacity + "], got: " + usedSpace + " (bin " + binId + ")");
        }
        this.binId = binId;
        this.capacity = capacity;
        this.usedSpace = usedSpace;
        this.locationCode = locationCode == null ? "" : locationCode;
    }

    @Override
    public OccupyResult occupySpace(int amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("amount must not be negative, got: " + amount);
        }
        // long arithmetic: usedSpace + amount may overflow int
        if ((long) usedSpace + amount > capacity) {
            return new OccupyResult.CapacityExceeded(binId, amount, availableSpace());
        }
        usedSpace += amount;
        return new OccupyResult.Occupied(binId, usedSpace);
    }

    @Override
    public int availableSpace() {
        return capacity - usedSpace;
    }

    /**
     * Checks both halves of the best-fit predicate: capacity large enough and enough room left.
     */
    public boolean canHold(int size) {
        return capacity >= size && availableSpace() >= size;
    }

    @Override
    public int compareTo(StorageBin other) {
        return BY_CAPACITY.compare(this, other);
    }

    public int getBinId() {
        return binId;
    }

    public int getCapacity() {
        return capacity;
    }

    public int getUsedSpace() {
        return usedSpace;
    }

    public String getLocationCode() {
        return locationCode;
    }

    @Override
    public String toString() {
        return "StorageBin{id=" + binId + ", capacity=" + capacity + ", used=" + usedSpace
                + ", location=" + locationCode + "}";
    }
}
