package com.largomodo.warehouse.core;

import com.largomodo.warehouse.core.domain.Parcel;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ConveyorQueueTest {

    @Test
    void testPollReturnsArrivalOrder() {
        ConveyorQueue conveyor = new ConveyorQueue();
        Parcel first = new Parcel("P1", 10, "NY");
        Parcel second = new Parcel("P2", 20, "CA");
        conveyor.addAll(List.of(first, second));
        conveyor.add(new Parcel("P3", 30, "TX"));

        assertEquals(3, conveyor.size());
        assertEquals(Optional.of(first), conveyor.poll());
        assertEquals(Optional.of(second), conveyor.poll());
        assertEquals("P3", conveyor.poll().orElseThrow().trackingId());
        assertTrue(conveyor.poll().isEmpty());
        assertTrue(conveyor.isEmpty());
    }

    @Test
    void testNullRejected() {
        ConveyorQueue conveyor = new ConveyorQueue();

        assertThrows(IllegalArgumentException.class, () -> conveyor.add(null));
        assertThrows(IllegalArgumentException.class, () -> conveyor.addAll(null));
    }
}
