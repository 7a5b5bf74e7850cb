package com.largomodo.warehouse.core;

import com.largomodo.warehouse.core.domain.AllocationOutcome;
import com.largomodo.warehouse.core.domain.AllocationOutcome.RejectionReason;
import com.largomodo.warehouse.core.domain.OccupyResult;
import com.largomodo.warehouse.core.domain.Parcel;
import com.largomodo.warehouse.core.domain.ShipmentStatus;
import com.largomodo.warehouse.core.domain.StorageBin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Drains the conveyor into the bin registry.
 * <p>
 * Parcels are handled strictly in arrival order, one at a time:
 * 1. Ask the registry for the best-fit bin
 * 2. Claim the parcel's size in that bin (persisted by the registry)
 * 3. Record a STORED event
 * <p>
 * A parcel that cannot be placed is reported as rejected, leaves every bin untouched and never
 * stops the batch. The tracking id is exposed to log output through the MDC key {@code parcel}
 * while a parcel is being handled.
 */
public class InboundProcessor {

    private static final Logger log = LoggerFactory.getLogger(InboundProcessor.class);

    static final String MDC_KEY = "parcel";

    private final BinRegistry registry;
    private final ShipmentRecorder recorder;

    public InboundProcessor(BinRegistry registry, ShipmentRecorder recorder) {
        if (registry == null || recorder == null) {
            throw new IllegalArgumentException("All dependencies must not be null");
        }
        this.registry = registry;
        this.recorder = recorder;
    }

    public ConveyorReport drain(ConveyorQueue conveyor) {
        return drain(conveyor, new AllocationObserver() {});
    }

    /**
     * Processes every parcel currently on the conveyor.
     *
     * @return outcomes in processing order
     */
    public ConveyorReport drain(ConveyorQueue conveyor, AllocationObserver observer) {
        if (conveyor == null || observer == null) {
            throw new IllegalArgumentException("Conveyor and observer must not be null");
        }

        log.info("Processing {} parcel(s) from the conveyor", conveyor.size());
        List<AllocationOutcome> outcomes = new ArrayList<>();

        Optional<Parcel> next;
        while ((next = conveyor.poll()).isPresent()) {
            Parcel parcel = next.get();
            try {
                MDC.put(MDC_KEY, parcel.trackingId());
                observer.onStart(parcel);

                AllocationOutcome outcome = allocate(parcel);
                outcomes.add(outcome);

                if (outcome instanceof AllocationOutcome.Stored stored) {
                    observer.onStored(stored);
                } else {
                    observer.onRejected((AllocationOutcome.Rejected) outcome);
                }
            } finally {
                MDC.remove(MDC_KEY);
            }
        }

        ConveyorReport report = new ConveyorReport(outcomes);
        log.info("Conveyor complete: {} stored, {} rejected", report.storedCount(), report.rejectedCount());
        return report;
    }

    /**
     * Places a single parcel without going through the conveyor.
     */
    public AllocationOutcome allocate(Parcel parcel) {
        Optional<StorageBin> target = registry.findBestFit(parcel);
        if (target.isEmpty()) {
            log.warn("REJECTED: No suitable bin for {} (size {})", parcel.trackingId(), parcel.size());
            return new AllocationOutcome.Rejected(parcel, RejectionReason.NO_SUITABLE_BIN);
        }

        StorageBin bin = target.get();
        OccupyResult result = registry.occupy(bin, parcel.size());

        if (result instanceof OccupyResult.CapacityExceeded exceeded) {
            log.warn("REJECTED: Bin {} cannot take {} (size {}, available {})",
                    exceeded.binId(), parcel.trackingId(), exceeded.requested(), exceeded.available());
            return new AllocationOutcome.Rejected(parcel, RejectionReason.CAPACITY_EXCEEDED);
        }

        OccupyResult.Occupied occupied = (OccupyResult.Occupied) result;
        recorder.record(parcel.trackingId(), occupied.binId(), ShipmentStatus.STORED);
        log.info("Stored {} (size {}) in bin {} [{}]",
                parcel.trackingId(), parcel.size(), bin.getBinId(), bin.getLocationCode());
        return new AllocationOutcome.Stored(parcel, occupied.binId(), occupied.usedSpace());
    }
}
