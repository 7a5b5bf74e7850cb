package com.largomodo.warehouse.core.domain;

import java.util.List;
import java.util.Optional;

/**
 * Best-fit selector using binary search over capacity-ordered bins.
 * <p>
 * Every inspected bin is accepted only if it satisfies both capacity &gt;= size and
 * available &gt;= size. An accepted bin becomes the best fit so far and the search moves left
 * toward smaller capacities; a rejected bin moves the search right.
 * <p>
 * Exact when availability grows with capacity (for example, all bins empty). Availability is not
 * monotonic in general, so in some layouts a smaller qualifying bin that is never inspected gets
 * skipped, and a qualifying bin can be missed entirely. Among equal capacities the result is the
 * leftmost qualifying bin the narrowing reaches, not the least used one.
 * <p>
 * O(log n) comparisons, no allocation.
 */
public class BinarySearchBinSelector implements BinSelector {

    @Override
    public Optional<StorageBin> select(List<StorageBin> sortedBins, Parcel parcel) {
        if (sortedBins == null || parcel == null) {
            throw new IllegalArgumentException("sortedBins and parcel must not be null");
        }

        int size = parcel.size();
        int low = 0;
        int high = sortedBins.size() - 1;
        StorageBin bestFit = null;

        while (low <= high) {
            int mid = (low + high) >>> 1;
            StorageBin candidate = sortedBins.get(mid);

            if (candidate.canHold(size)) {
                bestFit = candidate;
                high = mid - 1;
            } else {
                low = mid + 1;
            }
        }

        return Optional.ofNullable(bestFit);
    }
}
