package com.largomodo.warehouse.core.domain;

import java.util.List;

/**
 * Strategy interface for picking which candidate parcels go onto a truck.
 */
public interface TruckLoadOptimizer {
    /**
     * Chooses a subset of candidates whose total size fits within maxCapacity.
     *
     * @param candidates  parcels available for loading, must not be null
     * @param maxCapacity truck capacity, must not be negative
     * @return chosen parcels in their input order, empty if nothing fits
     * @throws IllegalArgumentException if candidates is null or maxCapacity is negative
     */
    List<Parcel> optimize(List<Parcel> candidates, int maxCapacity);
}
