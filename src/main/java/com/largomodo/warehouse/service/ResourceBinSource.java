package com.largomodo.warehouse.service;

import com.largomodo.warehouse.core.BinSource;
import com.largomodo.warehouse.core.domain.StorageBin;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Loads bin definitions bundled on the classpath.
 * <p>
 * Each call opens a fresh stream, so the same instance can seed several registries.
 */
public class ResourceBinSource implements BinSource {

    /**
     * Five empty bins from 50 to 500 units, locations A1 to C1.
     */
    public static final String SEED_RESOURCE = "/warehouse/seed-bins.csv";

    private final String resourcePath;

    public ResourceBinSource() {
        this(SEED_RESOURCE);
    }

    /**
     * @param resourcePath absolute classpath reference (leading slash required)
     */
    public ResourceBinSource(String resourcePath) {
        if (resourcePath == null || !resourcePath.startsWith("/")) {
            throw new IllegalArgumentException("resourcePath must be absolute: " + resourcePath);
        }
        this.resourcePath = resourcePath;
    }

    @Override
    public List<StorageBin> loadBins() throws IOException {
        try (InputStream stream = getClass().getResourceAsStream(resourcePath)) {
            if (stream == null) {
                throw new IOException("Internal resource " + resourcePath +
                        " not found. Ensure application is built correctly.");
            }
            try (Reader reader = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
                return BinCsvFormat.parse(reader, resourcePath);
            }
        }
    }
}
