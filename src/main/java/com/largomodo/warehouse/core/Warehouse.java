package com.largomodo.warehouse.core;

import com.largomodo.warehouse.core.domain.Parcel;
import com.largomodo.warehouse.core.domain.TruckLoadOptimizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Inbound and outbound operations of a single warehouse.
 * <p>
 * Inbound: parcels are queued on the conveyor and placed into bins by best fit.
 * Outbound: a truck load is chosen by the optimizer, loaded parcel by parcel, and can be undone
 * one parcel at a time.
 * <p>
 * Instances are constructed explicitly and handed to callers; there is no shared global state.
 * Not thread-safe.
 */
public class Warehouse {

    private static final Logger log = LoggerFactory.getLogger(Warehouse.class);

    private final BinRegistry registry;
    private final ConveyorQueue conveyor;
    private final InboundProcessor inboundProcessor;
    private final TruckLoadOptimizer optimizer;
    private final TruckLoadStack truck;

    public Warehouse(BinRegistry registry, TruckLoadOptimizer optimizer, ShipmentRecorder recorder) {
        this(registry, new ConveyorQueue(), new InboundProcessor(registry, recorder), optimizer,
                new TruckLoadStack(recorder));
    }

    public Warehouse(BinRegistry registry, ConveyorQueue conveyor, InboundProcessor inboundProcessor,
                     TruckLoadOptimizer optimizer, TruckLoadStack truck) {
        if (registry == null || conveyor == null || inboundProcessor == null || optimizer == null || truck == null) {
            throw new IllegalArgumentException("All dependencies must not be null");
        }
        this.registry = registry;
        this.conveyor = conveyor;
        this.inboundProcessor = inboundProcessor;
        this.optimizer = optimizer;
        this.truck = truck;
    }

    /**
     * Refreshes the bin registry from its source.
     *
     * @throws IOException if the bin source cannot be read
     */
    public void reloadInventory() throws IOException {
        registry.reload();
        log.info("Inventory loaded: {} bins", registry.size());
    }

    public void addToConveyor(Parcel parcel) {
        conveyor.add(parcel);
    }

    public ConveyorReport runConveyor() {
        return inboundProcessor.drain(conveyor);
    }

    public ConveyorReport runConveyor(AllocationObserver observer) {
        return inboundProcessor.drain(conveyor, observer);
    }

    /**
     * Chooses the fullest load for the given capacity without touching the truck.
     */
    public List<Parcel> optimizeTruckSpace(List<Parcel> candidates, int maxCapacity) {
        List<Parcel> best = optimizer.optimize(candidates, maxCapacity);
        log.info("Best combination for capacity {}: {} of {} parcel(s), total {}",
                maxCapacity, best.size(), candidates.size(),
                best.stream().mapToLong(Parcel::size).sum());
        return best;
    }

    public void loadTruck(Parcel parcel) {
        truck.push(parcel);
    }

    /**
     * Loads parcels in list order, so the last one ends up on top.
     */
    public void loadTruck(List<Parcel> parcels) {
        if (parcels == null) {
            throw new IllegalArgumentException("Parcels list cannot be null");
        }
        parcels.forEach(truck::push);
    }

    public Optional<Parcel> undoLastLoad() {
        return truck.pop();
    }

    public BinRegistry registry() {
        return registry;
    }

    public ConveyorQueue conveyor() {
        return conveyor;
    }

    public TruckLoadStack truck() {
        return truck;
    }
}
