package com.largomodo.warehouse.core.domain;

import net.jqwik.api.*;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BacktrackingLoadOptimizerTest {

    // Field initializer rather than @BeforeEach: jqwik properties do not run Jupiter lifecycle methods
    private final BacktrackingLoadOptimizer optimizer = new BacktrackingLoadOptimizer();

    private static Parcel box(String id, int size) {
        return new Parcel(id, size, "NY");
    }

    @Test
    void testExactFillBeatsPartialFill() {
        Parcel a = box("BOX_A", 50);
        Parcel b = box("BOX_B", 60);
        Parcel c = box("BOX_C", 40);

        List<Parcel> result = optimizer.optimize(List.of(a, b, c), 100);

        // 50+60 exceeds the limit, 50+40 = 90, 60+40 = 100
        assertEquals(List.of(b, c), result);
    }

    @Test
    void testEmptyInput() {
        assertTrue(optimizer.optimize(new ArrayList<>(), 100).isEmpty(),
                "Empty input should return empty list");
    }

    @Test
    void testZeroCapacity() {
        assertTrue(optimizer.optimize(List.of(box("A", 1)), 0).isEmpty());
    }

    @Test
    void testNothingFits() {
        assertTrue(optimizer.optimize(List.of(box("A", 120), box("B", 101)), 100).isEmpty());
    }

    @Test
    void testEverythingFits() {
        List<Parcel> input = List.of(box("A", 10), box("B", 20), box("C", 30));

        assertEquals(input, optimizer.optimize(input, 100));
    }

    @Test
    void testTieGoesToFirstSubsetReachedDepthFirst() {
        Parcel x = box("X", 30);
        Parcel y = box("Y", 70);
        Parcel z = box("Z", 70);

        List<Parcel> result = optimizer.optimize(List.of(x, y, z), 100);

        assertEquals(List.of(x, y), result, "X+Y and X+Z both total 100; include-first reaches X+Y first");
    }

    @Test
    void testTieBetweenPairAndSingleParcel() {
        Parcel a = box("A", 40);
        Parcel b = box("B", 60);
        Parcel c = box("C", 100);

        assertEquals(List.of(a, b), optimizer.optimize(List.of(a, b, c), 100));
    }

    @Test
    void testResultPreservesInputOrder() {
        Parcel a = box("A", 5);
        Parcel b = box("B", 90);
        Parcel c = box("C", 5);

        assertEquals(List.of(a, b, c), optimizer.optimize(List.of(a, b, c), 100));
    }

    @Test
    void testInputListNotModified() {
        List<Parcel> input = new ArrayList<>(List.of(box("A", 50), box("B", 60), box("C", 40)));
        List<Parcel> copy = List.copyOf(input);

        optimizer.optimize(input, 100);

        assertEquals(copy, input);
    }

    @Test
    void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> optimizer.optimize(null, 100));
        assertThrows(IllegalArgumentException.class, () -> optimizer.optimize(List.of(), -1));
        assertThrows(IllegalArgumentException.class, () -> new BacktrackingLoadOptimizer(0));
    }

    @Test
    void testNodeLimitReturnsBestFoundSoFar() {
        Parcel a = box("BOX_A", 50);
        Parcel b = box("BOX_B", 60);
        Parcel c = box("BOX_C", 40);

        // Root plus the "include BOX_A" node
        BacktrackingLoadOptimizer limited = new BacktrackingLoadOptimizer(2);

        assertEquals(List.of(a), limited.optimize(List.of(a, b, c), 100));
    }

    @Test
    void testNodeLimitOfOneVisitsOnlyRoot() {
        BacktrackingLoadOptimizer limited = new BacktrackingLoadOptimizer(1);

        assertTrue(limited.optimize(List.of(box("A", 10)), 100).isEmpty());
    }

    @Test
    void testLargeEnoughLimitMatchesExhaustiveSearch() {
        List<Parcel> input = List.of(box("A", 50), box("B", 60), box("C", 40), box("D", 25));

        assertEquals(optimizer.optimize(input, 100), new BacktrackingLoadOptimizer(1_000).optimize(input, 100));
    }

    @Property
    void resultNeverExceedsCapacity(@ForAll("candidateLists") List<Parcel> candidates,
                                    @ForAll("capacities") int capacity) {
        long total = optimizer.optimize(candidates, capacity).stream().mapToLong(Parcel::size).sum();

        assertTrue(total <= capacity, "Total " + total + " exceeds capacity " + capacity);
    }

    @Property
    void resultMatchesBruteForceOptimum(@ForAll("candidateLists") List<Parcel> candidates,
                                        @ForAll("capacities") int capacity) {
        long total = optimizer.optimize(candidates, capacity).stream().mapToLong(Parcel::size).sum();

        assertEquals(bruteForceBest(candidates, capacity), total);
    }

    @Property
    void resultIsSubsequenceOfInput(@ForAll("candidateLists") List<Parcel> candidates,
                                    @ForAll("capacities") int capacity) {
        List<Parcel> result = optimizer.optimize(candidates, capacity);

        int cursor = 0;
        for (Parcel chosen : result) {
            while (cursor < candidates.size() && candidates.get(cursor) != chosen) {
                cursor++;
            }
            assertTrue(cursor < candidates.size(), "Result must keep input order: " + result);
            cursor++;
        }
    }

    @Provide
    Arbitrary<List<Parcel>> candidateLists() {
        return Arbitraries.integers().between(1, 60).list().ofMaxSize(12).map(sizes -> {
            List<Parcel> parcels = new ArrayList<>();
            for (int i = 0; i < sizes.size(); i++) {
                parcels.add(box("P" + i, sizes.get(i)));
            }
            return parcels;
        });
    }

    @Provide
    Arbitrary<Integer> capacities() {
        return Arbitraries.integers().between(0, 250);
    }

    private static long bruteForceBest(List<Parcel> candidates, int capacity) {
        long best = 0;
        for (int mask = 0; mask < (1 << candidates.size()); mask++) {
            long total = 0;
            for (int i = 0; i < candidates.size(); i++) {
                if ((mask & (1 << i)) != 0) {
                    total += candidates.get(i).size();
                }
            }
            if (total <= capacity && total > best) {
                best = total;
            }
        }
        return best;
    }
}
