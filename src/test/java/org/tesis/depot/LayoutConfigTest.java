package org.tesis.depot;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Layout configuration Tests")
class LayoutConfigTest extends PackingTestSupport {

    private static final String HEADER =
            "entity_type,entity_id,a,b,area_type,capacity,qty,angle,edge_left,edge_bottom,edge_right,edge_top\n";

    private static List<AreaRow> rows(String body) throws IOException {
        byte[] bytes = (HEADER + body).getBytes(StandardCharsets.UTF_8);
        return AreaConfigReader.readCsv(new ByteArrayInputStream(bytes), "test.csv");
    }

    @Nested
    @DisplayName("CSV reader")
    class ReaderTests {

        @Test
        @DisplayName("Skips blank and comment lines")
        void skipsBlankAndComments(@TempDir Path dir) throws IOException {
            Path csv = dir.resolve("depot.csv");
            Files.write(csv, (HEADER
                    + "# comment\n"
                    + "DEPOT,d,150,120,,,,,,,,\n"
                    + "\n"
                    + "AREA,a1,,,L,4,2,,,,,\n").getBytes(StandardCharsets.UTF_8));

            List<AreaRow> rows = AreaConfigReader.readCsv(csv.toString());
            assertEquals(2, rows.size());
            assertTrue(rows.get(0).isDepot());
            assertEquals(150.0, rows.get(0).a);
            assertNull(rows.get(0).edgeLeft);
            assertTrue(rows.get(1).isArea());
            assertEquals(Integer.valueOf(2), rows.get(1).qty);
        }

        @Test
        @DisplayName("Header order and case do not matter")
        void headerOrderAndCase() throws IOException {
            byte[] bytes = ("CAPACITY,Entity_Type,AREA_TYPE\n4,AREA,DDR\n").getBytes(StandardCharsets.UTF_8);
            List<AreaRow> rows = AreaConfigReader.readCsv(new ByteArrayInputStream(bytes), "test.csv");
            assertEquals(Integer.valueOf(4), rows.get(0).capacity);
            assertEquals("DDR", rows.get(0).areaType);
            assertNull(rows.get(0).qty);
        }

        @Test
        @DisplayName("Empty file is an IO error")
        void emptyFile() {
            assertThrows(IOException.class,
                    () -> AreaConfigReader.readCsv(new ByteArrayInputStream(new byte[0]), "empty.csv"));
        }

        @Test
        @DisplayName("Invalid numbers are rejected")
        void invalidNumbers() {
            assertThrows(IllegalArgumentException.class, () -> rows("AREA,a1,,,L,four,1,,,,,\n"));
            assertThrows(IllegalArgumentException.class, () -> rows("DEPOT,d,wide,120,,,,,,,,\n"));
        }

        @Test
        @DisplayName("Missing entity type column is rejected")
        void missingEntityType() {
            byte[] bytes = ("a,b\n1,2\n").getBytes(StandardCharsets.UTF_8);
            assertThrows(IllegalArgumentException.class,
                    () -> AreaConfigReader.readCsv(new ByteArrayInputStream(bytes), "bad.csv"));
        }
    }

    @Nested
    @DisplayName("Depot and areas")
    class BuildTests {

        @Test
        @DisplayName("Depot takes preset clearances for empty cells")
        void depotPresetClearances() throws IOException {
            BinWithDistances depot = LayoutConfig.buildDepot(rows("DEPOT,d,150,120,,,,,,5,,\n"),
                    DepotParameters.STANDARD_BUS);
            assertDec(150, depot.a());
            assertDec(120, depot.b());
            assertDec(8, depot.edgeDistance(BufferSide.LEFT));
            assertDec(5, depot.edgeDistance(BufferSide.BOTTOM));
            assertDec(15, depot.edgeDistance(BufferSide.TOP));
        }

        @Test
        @DisplayName("Depot row is required exactly once")
        void depotRowRequired() throws IOException {
            List<AreaRow> none = rows("AREA,a1,,,L,4,1,,,,,\n");
            assertThrows(IllegalArgumentException.class, () -> LayoutConfig.buildDepot(none, DepotParameters.STANDARD_BUS));
            List<AreaRow> two = rows("DEPOT,d1,10,10,,,,,,,,\nDEPOT,d2,10,10,,,,,,,,\n");
            assertThrows(IllegalArgumentException.class, () -> LayoutConfig.buildDepot(two, DepotParameters.STANDARD_BUS));
            List<AreaRow> noSize = rows("DEPOT,d1,,10,,,,,,,,\n");
            assertThrows(IllegalArgumentException.class, () -> LayoutConfig.buildDepot(noSize, DepotParameters.STANDARD_BUS));
        }

        @Test
        @DisplayName("Areas are expanded by quantity with their angle override")
        void areasExpanded() throws IOException {
            List<Area> areas = LayoutConfig.buildAreas(rows(
                    "DEPOT,d,150,120,,,,,,,,\n"
                    + "AREA,lines,,,L,4,2,,,,,\n"
                    + "AREA,right,,,DSR_90,3,,30,,,,\n"
                    + "AREA,,,,DDR,6,1,,,,,\n"), DepotParameters.STANDARD_BUS);

            assertEquals(4, areas.size());
            assertEquals("lines", areas.get(0).label());
            assertEquals("lines", areas.get(1).label());
            assertNotSame(areas.get(0), areas.get(1));
            assertEquals(-30, areas.get(2).angleInner());
            assertEquals("DDR 6", areas.get(3).label());
        }

        @Test
        @DisplayName("Area rows need a type and a capacity")
        void areaRowsNeedTypeAndCapacity() throws IOException {
            List<AreaRow> noType = rows("AREA,a,,,,4,1,,,,,\n");
            assertThrows(IllegalArgumentException.class, () -> LayoutConfig.buildAreas(noType, DepotParameters.STANDARD_BUS));
            List<AreaRow> noCapacity = rows("AREA,a,,,L,,1,,,,,\n");
            assertThrows(IllegalArgumentException.class, () -> LayoutConfig.buildAreas(noCapacity, DepotParameters.STANDARD_BUS));
        }

        @Test
        @DisplayName("Configuration map builds a packable depot")
        void fromConfig() {
            Map<AreaType, Map<Integer, Integer>> config = new EnumMap<>(AreaType.class);
            Map<Integer, Integer> lines = new TreeMap<>();
            lines.put(4, 2);
            lines.put(3, 1);
            config.put(AreaType.LINE, lines);
            Map<Integer, Integer> doubles = new TreeMap<>();
            doubles.put(6, 1);
            config.put(AreaType.DIRECT_DOUBLE_ROW, doubles);

            BinWithDistances depot = LayoutConfig.fromConfig(config, 150, 120, DepotParameters.STANDARD_BUS);
            assertEquals(4, depot.items().size());
            depot.pack();

            assertEquals(Boolean.TRUE, depot.feasible());
            assertEquals(4 + 4 + 3 + 6, depot.countInner());
            assertDistancesHold(depot);
        }
    }
}
