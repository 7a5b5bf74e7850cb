package com.largomodo.warehouse.core;

import com.largomodo.warehouse.core.domain.StorageBin;

import java.io.IOException;
import java.util.List;

/**
 * Supplies the full bin set when the registry is (re)loaded.
 */
public interface BinSource {

    /**
     * @return every known bin with its current usage, in any order
     * @throws IOException if the backing store cannot be read
     */
    List<StorageBin> loadBins() throws IOException;
}
