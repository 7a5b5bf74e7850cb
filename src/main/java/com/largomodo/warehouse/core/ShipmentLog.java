package com.largomodo.warehouse.core;

import com.largomodo.warehouse.core.domain.ShipmentEvent;

import java.io.IOException;

/**
 * Durable record of stored, loaded and removed parcels.
 * <p>
 * Callers go through {@link ShipmentRecorder}, which never lets a logging failure reach the
 * operation that produced the event.
 */
public interface ShipmentLog {

    /**
     * @param event event to append
     * @throws IOException if the event cannot be written
     */
    void record(ShipmentEvent event) throws IOException;
}
