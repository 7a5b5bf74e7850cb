package com.largomodo.warehouse.core;

import com.largomodo.warehouse.core.domain.Parcel;
import com.largomodo.warehouse.core.domain.ShipmentStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Parcels on the truck in physical load order; the top is the most recently loaded.
 * <p>
 * Only {@link #push(Parcel)} and {@link #pop()} mutate the stack, so undo always reverses the
 * latest load. Every change is recorded as a LOADED or REMOVED event.
 * <p>
 * Not thread-safe.
 */
public class TruckLoadStack {

    private static final Logger log = LoggerFactory.getLogger(TruckLoadStack.class);

    private final List<Parcel> loaded = new ArrayList<>();
    private final ShipmentRecorder recorder;

    public TruckLoadStack(ShipmentRecorder recorder) {
        if (recorder == null) {
            throw new IllegalArgumentException("Recorder must not be null");
        }
        this.recorder = recorder;
    }

    public void push(Parcel parcel) {
        if (parcel == null) {
            throw new IllegalArgumentException("Parcel cannot be null");
        }
        loaded.add(parcel);
        recorder.record(parcel.trackingId(), null, ShipmentStatus.LOADED);
        log.info("Loaded {} onto truck", parcel.trackingId());
    }

    /**
     * Removes the most recently loaded parcel.
     *
     * @return the removed parcel, or empty if the truck is empty (no event is recorded then)
     */
    public Optional<Parcel> pop() {
        if (loaded.isEmpty()) {
            log.info("Truck is empty, nothing to undo");
            return Optional.empty();
        }
        Parcel parcel = loaded.remove(loaded.size() - 1);
        recorder.record(parcel.trackingId(), null, ShipmentStatus.REMOVED);
        log.info("Undo: removed {} from truck", parcel.trackingId());
        return Optional.of(parcel);
    }

    public Optional<Parcel> peek() {
        return loaded.isEmpty() ? Optional.empty() : Optional.of(loaded.get(loaded.size() - 1));
    }

    public int size() {
        return loaded.size();
    }

    public boolean isEmpty() {
        return loaded.isEmpty();
    }

    /**
     * @return unmodifiable snapshot, bottom of the stack first
     */
    public List<Parcel> contents() {
        return Collections.unmodifiableList(new ArrayList<>(loaded));
    }

    public long totalSize() {
        long total = 0;
        for (Parcel parcel : loaded) {
            total += parcel.size();
        }
        return total;
    }
}
