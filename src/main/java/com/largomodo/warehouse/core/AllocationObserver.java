package com.largomodo.warehouse.core;

import com.largomodo.warehouse.core.domain.AllocationOutcome;
import com.largomodo.warehouse.core.domain.Parcel;

/**
 * Observer interface for conveyor allocation events.
 * <p>
 * All methods have default no-op implementations, so consumers override only the callbacks they
 * need.
 * </p>
 * <pre>{@code
 * AllocationObserver observer = new AllocationObserver() {
 *     @Override
 *     public void onRejected(AllocationOutcome.Rejected rejected) {
 *         failures.add(rejected.parcel().trackingId());
 *     }
 * };
 * }</pre>
 *
 * @see InboundProcessor
 */
public interface AllocationObserver {

    /**
     * Called before the allocator looks at a parcel.
     */
    default void onStart(Parcel parcel) {}

    /**
     * Called after a parcel was placed and its bin usage updated.
     */
    default void onStored(AllocationOutcome.Stored stored) {}

    /**
     * Called when a parcel could not be placed. Processing continues with the next parcel.
     */
    default void onRejected(AllocationOutcome.Rejected rejected) {}
}
