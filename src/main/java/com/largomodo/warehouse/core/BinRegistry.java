package com.largomodo.warehouse.core;

import com.largomodo.warehouse.core.domain.BinSelector;
import com.largomodo.warehouse.core.domain.OccupyResult;
import com.largomodo.warehouse.core.domain.Parcel;
import com.largomodo.warehouse.core.domain.StorageBin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * In-memory set of storage bins, kept in {@link StorageBin#BY_CAPACITY} order.
 * <p>
 * Ordering invariant: bins are sorted once, on {@link #load(List)}. {@link #occupy(StorageBin, int)}
 * changes used space only, and capacity is immutable, so the order stays valid without re-sorting
 * until the next load.
 * <p>
 * Successful claims are forwarded to the {@link UsageSink}. A sink failure is logged and does not
 * undo the claim.
 * <p>
 * Not thread-safe.
 */
public class BinRegistry {

    private static final Logger log = LoggerFactory.getLogger(BinRegistry.class);

    private final BinSource binSource;
    private final UsageSink usageSink;
    private final BinSelector selector;
    private List<StorageBin> bins = List.of();

    public BinRegistry(BinSource binSource, UsageSink usageSink, BinSelector selector) {
        if (binSource == null || usageSink == null || selector == null) {
            throw new IllegalArgumentException("All dependencies must not be null");
        }
        this.binSource = binSource;
        this.usageSink = usageSink;
        this.selector = selector;
    }

    /**
     * Replaces the in-memory bin set and sorts it.
     *
     * @throws IllegalArgumentException if bins is null or contains duplicate ids
     */
    public void load(List<StorageBin> newBins) {
        if (newBins == null) {
            throw new IllegalArgumentException("Bins list cannot be null");
        }
        List<StorageBin> sorted = new ArrayList<>(newBins);
        sorted.sort(StorageBin.BY_CAPACITY);

        Set<Integer> ids = new HashSet<>();
        for (StorageBin bin : sorted) {
            if (!ids.add(bin.getBinId())) {
                throw new IllegalArgumentException("Duplicate bin id: " + bin.getBinId());
            }
        }

        this.bins = sorted;
        log.debug("Loaded {} bins", sorted.size());
    }

    /**
     * Reloads every bin from the bin source.
     *
     * @throws IOException if the source cannot be read
     */
    public void reload() throws IOException {
        load(binSource.loadBins());
    }

    public Optional<StorageBin> findBestFit(Parcel parcel) {
        return selector.select(bins, parcel);
    }

    /**
     * Claims space in a bin and persists the new usage.
     *
     * @return {@link OccupyResult.CapacityExceeded} without side effects if the bin is too full
     * @throws IllegalArgumentException if the bin is not part of this registry or amount is negative
     */
    public OccupyResult occupy(StorageBin bin, int amount) {
        if (bin == null || !containsInstance(bin)) {
            throw new IllegalArgumentException("Bin is not registered: " + bin);
        }

        OccupyResult result = bin.occupySpace(amount);
        if (result instanceof OccupyResult.Occupied occupied) {
            try {
                usageSink.updateUsage(occupied.binId(), occupied.usedSpace());
            } catch (IOException | RuntimeException e) {
                log.error("Failed to persist usage {} for bin {}: {}",
                        occupied.usedSpace(), occupied.binId(), e.getMessage(), e);
            }
        }
        return result;
    }

    public Optional<StorageBin> findById(int binId) {
        for (StorageBin bin : bins) {
            if (bin.getBinId() == binId) {
                return Optional.of(bin);
            }
        }
        return Optional.empty();
    }

    /**
     * @return unmodifiable view in capacity order
     */
    public List<StorageBin> bins() {
        return Collections.unmodifiableList(bins);
    }

    public int size() {
        return bins.size();
    }

    private boolean containsInstance(StorageBin bin) {
        for (StorageBin candidate : bins) {
            if (candidate == bin) {
                return true;
            }
        }
        return false;
    }
}
