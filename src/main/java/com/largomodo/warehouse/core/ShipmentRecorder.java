package com.largomodo.warehouse.core;

import com.largomodo.warehouse.core.domain.ShipmentEvent;
import com.largomodo.warehouse.core.domain.ShipmentStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Stamps events with the current time and hands them to the shipment log.
 * <p>
 * Failures while writing are logged and swallowed. The in-memory change that produced the event
 * has already happened and is never rolled back.
 */
public class ShipmentRecorder {

    private static final Logger log = LoggerFactory.getLogger(ShipmentRecorder.class);

    private final ShipmentLog shipmentLog;
    private final Clock clock;

    public ShipmentRecorder(ShipmentLog shipmentLog) {
        this(shipmentLog, Clock.systemUTC());
    }

    public ShipmentRecorder(ShipmentLog shipmentLog, Clock clock) {
        if (shipmentLog == null || clock == null) {
            throw new IllegalArgumentException("All dependencies must not be null");
        }
        this.shipmentLog = shipmentLog;
        this.clock = clock;
    }

    /**
     * @param binId bin involved, or null for truck events
     * @return true if the log accepted the event
     */
    public boolean record(String trackingId, Integer binId, ShipmentStatus status) {
        ShipmentEvent event = new ShipmentEvent(trackingId, binId, status, clock.instant());
        try {
            shipmentLog.record(event);
            return true;
        } catch (Exception e) {
            log.warn("Shipment logging failed for {} ({}): {}", trackingId, status, e.getMessage(), e);
            return false;
        }
    }
}
