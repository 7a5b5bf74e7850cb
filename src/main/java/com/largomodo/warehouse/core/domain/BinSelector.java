package com.largomodo.warehouse.core.domain;

import java.util.List;
import java.util.Optional;

/**
 * Strategy interface for choosing the storage bin a parcel goes into.
 */
public interface BinSelector {
    /**
     * Selects a bin for the parcel without mutating anything.
     * <p>
     * A returned bin always satisfies {@link StorageBin#canHold(int)} for the parcel size.
     *
     * @param sortedBins bins ordered by {@link StorageBin#BY_CAPACITY}, must not be null
     * @param parcel     parcel to place, must not be null
     * @return the chosen bin, or empty when no bin qualifies
     */
    Optional<StorageBin> select(List<StorageBin> sortedBins, Parcel parcel);
}
