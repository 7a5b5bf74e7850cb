package com.largomodo.warehouse.core;

import com.largomodo.warehouse.core.domain.AllocationOutcome;

import java.util.List;

/**
 * Summary of one conveyor run.
 *
 * @param outcomes per-parcel results in processing (arrival) order
 */
public record ConveyorReport(List<AllocationOutcome> outcomes) {

    public ConveyorReport {
        outcomes = List.copyOf(outcomes);
    }

    public long storedCount() {
        return outcomes.stream().filter(AllocationOutcome.Stored.class::isInstance).count();
    }

    public long rejectedCount() {
        return outcomes.stream().filter(AllocationOutcome.Rejected.class::isInstance).count();
    }

    public List<AllocationOutcome.Rejected> rejections() {
        return outcomes.stream()
                .filter(AllocationOutcome.Rejected.class::isInstance)
                .map(AllocationOutcome.Rejected.class::cast)
                .toList();
    }
}
