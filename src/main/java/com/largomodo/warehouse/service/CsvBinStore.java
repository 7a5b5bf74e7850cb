package com.largomodo.warehouse.service;

import com.largomodo.warehouse.core.BinSource;
import com.largomodo.warehouse.core.UsageSink;
import com.largomodo.warehouse.core.domain.StorageBin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * Bin store backed by a CSV file ({@code bin_id,capacity,current_usage,location_code}).
 * <p>
 * Every usage update rewrites the whole file: rows are written to a sibling temp file which then
 * replaces the original, so a crash mid-write leaves the previous contents intact.
 * Intended for warehouse-sized files (hundreds of bins), not for high update rates.
 */
public class CsvBinStore implements BinSource, UsageSink {

    private static final Logger log = LoggerFactory.getLogger(CsvBinStore.class);

    private final Path file;

    public CsvBinStore(Path file) {
        if (file == null) {
            throw new IllegalArgumentException("File must not be null");
        }
        this.file = file;
    }

    /**
     * Creates the file from the given bins, replacing any existing content.
     */
    public static CsvBinStore create(Path file, List<StorageBin> bins) throws IOException {
        CsvBinStore store = new CsvBinStore(file);
        store.writeAll(bins);
        return store;
    }

    @Override
    public List<StorageBin> loadBins() throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new IOException("Bin file does not exist: " + file);
        }
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return BinCsvFormat.parse(reader, file.getFileName().toString());
        } catch (IOException e) {
            throw new IOException("Cannot read bin file " + file + ": " + e.getMessage(), e);
        }
    }

    /**
     * @throws IOException if the bin id is not in the file, the usage is invalid, or writing fails
     */
    @Override
    public void updateUsage(int binId, int usedSpace) throws IOException {
        List<StorageBin> bins = loadBins();
        boolean found = false;
        for (int i = 0; i < bins.size(); i++) {
            StorageBin bin = bins.get(i);
            if (bin.getBinId() == binId) {
                try {
                    bins.set(i, new StorageBin(binId, bin.getCapacity(), usedSpace, bin.getLocationCode()));
                } catch (IllegalArgumentException e) {
                    throw new IOException("Rejected usage update for bin " + binId + ": " + e.getMessage(), e);
                }
                found = true;
                break;
            }
        }
        if (!found) {
            throw new IOException("Unknown bin id: " + binId + " in " + file);
        }
        writeAll(bins);
        log.debug("Persisted usage {} for bin {} to {}", usedSpace, binId, file.getFileName());
    }

    private void writeAll(List<StorageBin> bins) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path temp = Files.createTempFile(parent, file.getFileName().toString(), ".tmp");
        try {
            try (Writer writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
                BinCsvFormat.write(writer, bins);
            }
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }
}
