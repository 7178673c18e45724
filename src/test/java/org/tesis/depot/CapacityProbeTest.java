package org.tesis.depot;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CapacityProbe Tests")
class CapacityProbeTest extends PackingTestSupport {

    private final CapacityProbe probe = new CapacityProbe(100, 100, DepotParameters.STANDARD_BUS);

    @Nested
    @DisplayName("Generic count")
    class GenericCountTests {

        @Test
        @DisplayName("Strips stop at the 21st item")
        void stripsStopAtTwentyOne() {
            CapacityProbe.Result result = CapacityProbe.countMax(() -> new Bin(20, 20, false), () -> Area.plain(20, 1));
            assertEquals(20, result.count());
            assertEquals(Boolean.TRUE, result.bin().feasible());
            assertEquals(20, result.bin().items().size());
        }

        @Test
        @DisplayName("Nothing fits when the first item is too large")
        void nothingFits() {
            CapacityProbe.Result result = CapacityProbe.countMax(() -> new Bin(5, 5, false), () -> Area.plain(6, 1));
            assertEquals(0, result.count());
            assertFalse(result.fitsAny());
            assertTrue(result.bin().items().isEmpty());
        }

        @Test
        @DisplayName("Removing one item from a maximal packing keeps it feasible")
        void monotonicity() {
            CapacityProbe.Result result = CapacityProbe.countMax(() -> new Bin(17, 13, false), () -> Area.plain(4, 3));
            int n = result.count();
            assertTrue(n > 0);
            for (int k = n; k >= 1; k--) {
                Bin bin = new Bin(17, 13, false);
                for (int i = 0; i < k; i++) bin.items().add(Area.plain(4, 3));
                bin.pack();
                assertEquals(Boolean.TRUE, bin.feasible(), k + " items should fit");
            }
            Bin over = new Bin(17, 13, false);
            for (int i = 0; i <= n; i++) over.items().add(Area.plain(4, 3));
            over.pack();
            assertEquals(Boolean.FALSE, over.feasible());
        }
    }

    @Nested
    @DisplayName("Depot area types")
    class AreaTypeTests {

        @Test
        @DisplayName("Largest line area in a 100 by 100 depot")
        void largestLine() {
            // 19.25 clearance below and above: 38.5 + 12.5 * 4 <= 100 < 38.5 + 12.5 * 5
            assertEquals(Integer.valueOf(4), probe.capacityMax(AreaType.LINE, 2));
        }

        @Test
        @DisplayName("Largest capacity fits and the next one does not")
        void capacityMaxIsTight() {
            Integer capacity = probe.capacityMax(AreaType.DIRECT_SINGLE_ROW, 1);
            assertNotNull(capacity);
            assertNotNull(probe.newDepot().tryPut(AreaType.DIRECT_SINGLE_ROW.create(capacity, DepotParameters.STANDARD_BUS)));
            assertNull(probe.newDepot().tryPut(AreaType.DIRECT_SINGLE_ROW.create(capacity + 1, DepotParameters.STANDARD_BUS)));
        }

        @Test
        @DisplayName("No capacity when the minimum does not fit")
        void minimumDoesNotFit() {
            CapacityProbe small = new CapacityProbe(20, 20, DepotParameters.STANDARD_BUS);
            assertNull(small.capacityMax(AreaType.LINE, 2));
            assertFalse(small.countMaxWithCapacityMax(AreaType.LINE, 2).fitsAny());
        }

        @Test
        @DisplayName("Search limit is a usage error")
        void searchLimit() {
            CapacityProbe huge = new CapacityProbe(1000, 1000, DepotParameters.STANDARD_BUS);
            assertThrows(IllegalStateException.class, () -> huge.capacityMax(AreaType.LINE, 2, 10));
        }

        @ParameterizedTest
        @EnumSource(AreaType.class)
        @DisplayName("Count with minimum capacity returns a feasible packing")
        void countWithMinimumCapacity(AreaType type) {
            CapacityProbe.Result result = probe.countMaxWithCapacityMin(type, type.capacityMin());
            assertTrue(result.fitsAny());
            assertEquals(Boolean.TRUE, result.bin().feasible());
            assertEquals(result.count(), result.bin().packedItems().size());
            assertEquals(result.count() * type.capacityMin(), result.bin().countInner());
            assertDistancesHold((BinWithDistances) result.bin());
        }

        @Test
        @DisplayName("Count with maximum capacity")
        void countWithMaximumCapacity() {
            CapacityProbe.Result result = probe.countMaxWithCapacityMax(AreaType.LINE, 2);
            assertTrue(result.fitsAny());
            for (Area p : result.bin().packedItems()) {
                assertEquals(4, p.countInner());
            }
        }
    }
}
