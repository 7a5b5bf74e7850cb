package com.largomodo.warehouse.core;

import com.largomodo.warehouse.core.domain.BinSelector;
import com.largomodo.warehouse.core.domain.BinarySearchBinSelector;
import com.largomodo.warehouse.core.domain.OccupyResult;
import com.largomodo.warehouse.core.domain.Parcel;
import com.largomodo.warehouse.core.domain.StorageBin;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for BinRegistry with mocked collaborators.
 * <p>
 * Tests verify:
 * - Capacity ordering on load and its stability across allocations
 * - Persistence of usage through the UsageSink
 * - CapacityExceeded leaves bins and the sink untouched
 */
class BinRegistryTest {

    private BinSource mockSource;
    private UsageSink mockSink;
    private BinRegistry registry;

    @BeforeEach
    void setUp() {
        mockSource = mock(BinSource.class);
        mockSink = mock(UsageSink.class);
        registry = new BinRegistry(mockSource, mockSink, new BinarySearchBinSelector());
    }

    private static List<Integer> ids(List<StorageBin> bins) {
        return bins.stream().map(StorageBin::getBinId).toList();
    }

    @Test
    void testConstructorRejectsNullDependencies() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () ->
                new BinRegistry(null, mockSink, new BinarySearchBinSelector()));
        assertEquals("All dependencies must not be null", ex.getMessage());

        assertThrows(IllegalArgumentException.class, () ->
                new BinRegistry(mockSource, null, new BinarySearchBinSelector()));
        assertThrows(IllegalArgumentException.class, () ->
                new BinRegistry(mockSource, mockSink, null));
    }

    @Test
    void testLoadSortsByCapacityThenId() {
        registry.load(List.of(
                new StorageBin(3, 100, "B1"),
                new StorageBin(1, 100, "A1"),
                new StorageBin(4, 500, "C1"),
                new StorageBin(2, 50, "A2")
        ));

        assertEquals(List.of(2, 1, 3, 4), ids(registry.bins()));
    }

    @Test
    void testLoadReplacesPreviousBins() {
        registry.load(List.of(new StorageBin(1, 50, "A1")));
        registry.load(List.of(new StorageBin(7, 70, "G1"), new StorageBin(8, 80, "H1")));

        assertEquals(List.of(7, 8), ids(registry.bins()));
        assertTrue(registry.findById(1).isEmpty());
    }

    @Test
    void testLoadRejectsDuplicateIds() {
        assertThrows(IllegalArgumentException.class, () -> registry.load(List.of(
                new StorageBin(1, 50, "A1"),
                new StorageBin(1, 100, "A2")
        )));
        assertThrows(IllegalArgumentException.class, () -> registry.load(null));
    }

    @Test
    void testReloadReadsFromSource() throws IOException {
        when(mockSource.loadBins()).thenReturn(List.of(new StorageBin(2, 100, 20, "A2")));

        registry.reload();

        verify(mockSource).loadBins();
        assertEquals(1, registry.size());
        assertEquals(20, registry.findById(2).orElseThrow().getUsedSpace());
    }

    @Test
    void testReloadPropagatesSourceFailure() throws IOException {
        when(mockSource.loadBins()).thenThrow(new IOException("store offline"));

        assertThrows(IOException.class, () -> registry.reload());
    }

    @Test
    void testOccupyPersistsNewUsage() throws IOException {
        registry.load(List.of(new StorageBin(1, 50, "A1")));
        StorageBin bin = registry.findById(1).orElseThrow();

        OccupyResult result = registry.occupy(bin, 45);

        assertEquals(new OccupyResult.Occupied(1, 45), result);
        verify(mockSink).updateUsage(1, 45);
    }

    @Test
    void testOccupyOverflowDoesNotTouchSink() {
        registry.load(List.of(new StorageBin(1, 50, 45, "A1")));
        StorageBin bin = registry.findById(1).orElseThrow();

        OccupyResult result = registry.occupy(bin, 30);

        assertInstanceOf(OccupyResult.CapacityExceeded.class, result);
        assertEquals(45, bin.getUsedSpace());
        verifyNoInteractions(mockSink);
    }

    @Test
    void testSinkFailureKeepsAllocation() throws IOException {
        doThrow(new IOException("disk full")).when(mockSink).updateUsage(anyInt(), anyInt());
        registry.load(List.of(new StorageBin(1, 50, "A1")));
        StorageBin bin = registry.findById(1).orElseThrow();

        OccupyResult result = registry.occupy(bin, 20);

        assertTrue(result.isSuccess(), "In-memory claim stands even when persistence fails");
        assertEquals(20, bin.getUsedSpace());
    }

    @Test
    void testOccupyRejectsForeignBin() {
        registry.load(List.of(new StorageBin(1, 50, "A1")));
        StorageBin lookalike = new StorageBin(1, 50, "A1");

        assertThrows(IllegalArgumentException.class, () -> registry.occupy(lookalike, 10));
        assertThrows(IllegalArgumentException.class, () -> registry.occupy(null, 10));
    }

    @Test
    void testOrderUnchangedAfterAllocations() {
        registry.load(List.of(
                new StorageBin(1, 50, "A1"),
                new StorageBin(2, 100, "A2"),
                new StorageBin(3, 150, "B1")
        ));
        List<Integer> before = ids(registry.bins());

        // Fill the smallest bin completely and the largest partly
        registry.occupy(registry.findById(1).orElseThrow(), 50);
        registry.occupy(registry.findById(3).orElseThrow(), 140);

        assertEquals(before, ids(registry.bins()), "Usage changes must not reorder bins");
        for (StorageBin bin : registry.bins()) {
            assertTrue(bin.getUsedSpace() <= bin.getCapacity());
        }
    }

    @Test
    void testFindBestFitDelegatesToSelector() {
        BinSelector selector = mock(BinSelector.class);
        BinRegistry delegating = new BinRegistry(mockSource, mockSink, selector);
        delegating.load(List.of(new StorageBin(1, 50, "A1")));
        Parcel parcel = new Parcel("PKG", 10, "NY");
        when(selector.select(anyList(), eq(parcel))).thenReturn(Optional.empty());

        assertTrue(delegating.findBestFit(parcel).isEmpty());
        verify(selector).select(delegating.bins(), parcel);
    }

    @Test
    void testBinsViewIsUnmodifiable() {
        registry.load(List.of(new StorageBin(1, 50, "A1")));

        assertThrows(UnsupportedOperationException.class, () -> registry.bins().clear());
    }
}
