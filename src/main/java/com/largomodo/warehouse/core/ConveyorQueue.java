package com.largomodo.warehouse.core;

import com.largomodo.warehouse.core.domain.Parcel;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * FIFO line of parcels waiting for allocation.
 * <p>
 * Not thread-safe.
 */
public class ConveyorQueue {

    private final Deque<Parcel> pending = new ArrayDeque<>();

    public void add(Parcel parcel) {
        if (parcel == null) {
            throw new IllegalArgumentException("Parcel cannot be null");
        }
        pending.addLast(parcel);
    }

    public void addAll(List<Parcel> parcels) {
        if (parcels == null) {
            throw new IllegalArgumentException("Parcels list cannot be null");
        }
        parcels.forEach(this::add);
    }

    /**
     * @return the oldest parcel, or empty when the conveyor is idle
     */
    public Optional<Parcel> poll() {
        return Optional.ofNullable(pending.pollFirst());
    }

    public int size() {
        return pending.size();
    }

    public boolean isEmpty() {
        return pending.isEmpty();
    }
}
