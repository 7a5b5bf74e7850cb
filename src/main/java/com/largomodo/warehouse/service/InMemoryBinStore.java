package com.largomodo.warehouse.service;

import com.largomodo.warehouse.core.BinSource;
import com.largomodo.warehouse.core.UsageSink;
import com.largomodo.warehouse.core.domain.StorageBin;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Bin store held in memory.
 * <p>
 * Keeps its own bin copies: {@link #loadBins()} hands out fresh {@link StorageBin} instances and
 * usage only changes here through {@link #updateUsage(int, int)}, the same way a database row
 * would.
 */
public class InMemoryBinStore implements BinSource, UsageSink {

    private final Map<Integer, StorageBin> rows = new LinkedHashMap<>();

    public InMemoryBinStore() {
    }

    public InMemoryBinStore(List<StorageBin> bins) {
        bins.forEach(this::put);
    }

    /**
     * Seeds a store from another source, for example the bundled seed resource.
     */
    public static InMemoryBinStore copyOf(BinSource source) throws IOException {
        return new InMemoryBinStore(source.loadBins());
    }

    /**
     * Inserts or replaces a bin row.
     */
    public void put(StorageBin bin) {
        if (bin == null) {
            throw new IllegalArgumentException("Bin cannot be null");
        }
        rows.put(bin.getBinId(), copy(bin, bin.getUsedSpace()));
    }

    @Override
    public List<StorageBin> loadBins() {
        List<StorageBin> bins = new ArrayList<>(rows.size());
        for (StorageBin row : rows.values()) {
            bins.add(copy(row, row.getUsedSpace()));
        }
        return bins;
    }

    /**
     * @throws IOException if the bin id is unknown or usage does not fit the stored capacity
     */
    @Override
    public void updateUsage(int binId, int usedSpace) throws IOException {
        StorageBin row = rows.get(binId);
        if (row == null) {
            throw new IOException("Unknown bin id: " + binId);
        }
        try {
            rows.put(binId, copy(row, usedSpace));
        } catch (IllegalArgumentException e) {
            throw new IOException("Rejected usage update for bin " + binId + ": " + e.getMessage(), e);
        }
    }

    public Optional<Integer> usageOf(int binId) {
        StorageBin row = rows.get(binId);
        return row == null ? Optional.empty() : Optional.of(row.getUsedSpace());
    }

    private static StorageBin copy(StorageBin bin, int usedSpace) {
        return new StorageBin(bin.getBinId(), bin.getCapacity(), usedSpace, bin.getLocationCode());
    }
}
