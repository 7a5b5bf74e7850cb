package com.largomodo.warehouse.core.domain;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Exhaustive include/exclude search for the fullest truck load.
 * <p>
 * Explores candidates in input order, depth-first, trying "include" before "skip". Inclusion is
 * only attempted while the running total stays within capacity. A combination becomes the new
 * best only when its total is strictly greater than the best so far, so among equal totals the
 * first subset reached by the traversal wins.
 * <p>
 * Exponential: up to 2^n nodes with no bound-based pruning. Callers with long candidate lists
 * should bound their input or configure a node limit. Once the limit is reached the search stops
 * and returns the best subset found up to that point, which may not be optimal.
 */
public class BacktrackingLoadOptimizer implements TruckLoadOptimizer {

    private static final Logger log = LoggerFactory.getLogger(BacktrackingLoadOptimizer.class);

    /**
     * Explores the whole search tree.
     */
    public static final long UNLIMITED = Long.MAX_VALUE;

    private final long maxExploredNodes;

    public BacktrackingLoadOptimizer() {
        this(UNLIMITED);
    }

    /**
     * @param maxExploredNodes upper bound on visited search nodes, must be positive
     * @throws IllegalArgumentException if maxExploredNodes is not positive
     */
    public BacktrackingLoadOptimizer(long maxExploredNodes) {
        if (maxExploredNodes <= 0) {
            throw new IllegalArgumentException("maxExploredNodes must be positive, got: " + maxExploredNodes);
        }
        this.maxExploredNodes = maxExploredNodes;
    }

    @Override
    public List<Parcel> optimize(List<Parcel> candidates, int maxCapacity) {
        if (candidates == null) {
            throw new IllegalArgumentException("Candidates list cannot be null");
        }
        if (maxCapacity < 0) {
            throw new IllegalArgumentException("maxCapacity must not be negative, got: " + maxCapacity);
        }

        List<Parcel> input = List.copyOf(candidates);
        SearchBudget budget = new SearchBudget(maxExploredNodes);

        Selection best = search(input, 0, new ArrayList<>(), 0L, Selection.EMPTY, maxCapacity, budget);

        if (budget.exhausted) {
            log.warn("Truck load search stopped after {} nodes; returning best total {} of capacity {}",
                    budget.visited, best.total(), maxCapacity);
        } else {
            log.debug("Truck load search visited {} nodes for {} candidates; best total {} of capacity {}",
                    budget.visited, input.size(), best.total(), maxCapacity);
        }
        return best.parcels();
    }

    /**
     * Visits one node of the include/skip tree and returns the best selection known afterwards.
     *
     * @param chosen working combination for the current path; restored before returning
     */
    private Selection search(List<Parcel> candidates, int index, List<Parcel> chosen, long total,
                             Selection best, int maxCapacity, SearchBudget budget) {
        if (!budget.tryVisit()) {
            return best;
        }

        if (total > best.total()) {
            best = new Selection(List.copyOf(chosen), total);
        }

        if (index == candidates.size()) {
            return best;
        }

        Parcel next = candidates.get(index);

        if (total + next.size() <= maxCapacity) {
            chosen.add(next);
            best = search(candidates, index + 1, chosen, total + next.size(), best, maxCapacity, budget);
            chosen.remove(chosen.size() - 1);
        }

        return search(candidates, index + 1, chosen, total, best, maxCapacity, budget);
    }

    private record Selection(List<Parcel> parcels, long total) {
        static final Selection EMPTY = new Selection(List.of(), 0L);
    }

    private static final class SearchBudget {
        private final long limit;
        private long visited;
        private boolean exhausted;

        SearchBudget(long limit) {
            this.limit = limit;
        }

        boolean tryVisit() {
            if (visited >= limit) {
                exhausted = true;
                return false;
            }
            visited++;
            return true;
        }
    }
}
