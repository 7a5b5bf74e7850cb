package com.largomodo.warehouse.core;

import java.io.IOException;

/**
 * Receives bin usage after every successful allocation, for durable persistence.
 */
public interface UsageSink {

    /**
     * @param binId     bin whose usage changed
     * @param usedSpace new used space
     * @throws IOException if the new usage cannot be persisted
     */
    void updateUsage(int binId, int usedSpace) throws IOException;

    /**
     * Sink that persists nothing.
     */
    static UsageSink discarding() {
        return (binId, usedSpace) -> {};
    }
}
