package com.largomodo.warehouse.core.domain;

/**
 * Result of running one parcel through the allocator.
 */
public sealed interface AllocationOutcome permits AllocationOutcome.Stored, AllocationOutcome.Rejected {

    Parcel parcel();

    /**
     * Parcel placed.
     *
     * @param parcel    the parcel
     * @param binId     bin it went into
     * @param usedSpace bin usage after placement
     */
    record Stored(Parcel parcel, int binId, int usedSpace) implements AllocationOutcome {}

    /**
     * Parcel left unplaced; no bin was modified.
     *
     * @param parcel the parcel
     * @param reason why it was not placed
     */
    record Rejected(Parcel parcel, RejectionReason reason) implements AllocationOutcome {}

    enum RejectionReason {
        /** No bin satisfied both capacity and availability. */
        NO_SUITABLE_BIN,
        /** The selected bin refused the claim. */
        CAPACITY_EXCEEDED
    }
}
