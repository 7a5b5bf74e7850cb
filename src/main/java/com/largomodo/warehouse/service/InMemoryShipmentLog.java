package com.largomodo.warehouse.service;

import com.largomodo.warehouse.core.ShipmentLog;
import com.largomodo.warehouse.core.domain.ShipmentEvent;
import com.largomodo.warehouse.core.domain.ShipmentStatus;

import java.util.ArrayList;
import java.util.List;

/**
 * Shipment log kept in a list, in recording order.
 */
public class InMemoryShipmentLog implements ShipmentLog {

    private final List<ShipmentEvent> events = new ArrayList<>();

    @Override
    public void record(ShipmentEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("Event cannot be null");
        }
        events.add(event);
    }

    public List<ShipmentEvent> events() {
        return List.copyOf(events);
    }

    public List<ShipmentEvent> eventsWithStatus(ShipmentStatus status) {
        return events.stream().filter(e -> e.status() == status).toList();
    }

    public int size() {
        return events.size();
    }
}
