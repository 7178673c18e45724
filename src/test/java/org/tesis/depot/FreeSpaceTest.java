package org.tesis.depot;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FreeSpace Tests")
class FreeSpaceTest extends PackingTestSupport {

    private static final Rectangle AV = Rectangle.of(10, 10, 0, 0);

    @Test
    @DisplayName("Item at the origin of a larger free rectangle")
    void itemAtOrigin() {
        assertEquals(0b1111, FreeSpace.signature(AV, Rectangle.of(5, 5, 0, 0)));
    }

    @Test
    @DisplayName("Item strictly inside a free rectangle")
    void itemStrictlyInside() {
        assertEquals(FreeSpace.ITEM_INSIDE, FreeSpace.signature(AV, Rectangle.of(5, 5, 2, 2)));
    }

    @Test
    @DisplayName("Item covering the whole free rectangle")
    void itemCoveringFreeRectangle() {
        assertEquals(FreeSpace.COVERED, FreeSpace.signature(AV, Rectangle.of(12, 12, -1, -1)));
        assertEquals(FreeSpace.COVERED, FreeSpace.signature(AV, Rectangle.of(10, 10, 0, 0)));
    }

    @Test
    @DisplayName("Both unreachable signatures have no table entry")
    void unreachableEntries() {
        assertNull(FreeSpace.tableEntry(FreeSpace.ITEM_INSIDE));
        assertNull(FreeSpace.tableEntry(FreeSpace.COVERED));
        assertEquals("0011", FreeSpace.bits(FreeSpace.ITEM_INSIDE));
        assertEquals("1100", FreeSpace.bits(FreeSpace.COVERED));
    }

    @ParameterizedTest
    @ValueSource(ints = { 0, 1, 2, 4, 5, 6, 7, 8, 9, 10, 11, 13, 14, 15 })
    @DisplayName("Table entries follow the side rule")
    void tableFollowsSideRule(int code) {
        List<FreeSpace.Piece> expected = new ArrayList<>();
        if ((code & 0b0100) == 0) expected.add(FreeSpace.Piece.BELOW);
        if ((code & 0b0001) != 0) expected.add(FreeSpace.Piece.ABOVE);
        if ((code & 0b1000) == 0) expected.add(FreeSpace.Piece.LEFT);
        if ((code & 0b0010) != 0) expected.add(FreeSpace.Piece.RIGHT);
        assertEquals(expected, Arrays.asList(FreeSpace.tableEntry(code)));
    }

    @Test
    @DisplayName("Pieces around an inner item")
    void piecesAroundInnerItem() {
        Rectangle item = Rectangle.of(5, 5, 2, 2);

        Rectangle below = FreeSpace.Piece.BELOW.cut(AV, item);
        assertDec(10, below.a());
        assertDec(2, below.b());
        assertDec(0, below.y());

        Rectangle above = FreeSpace.Piece.ABOVE.cut(AV, item);
        assertDec(10, above.a());
        assertDec(3, above.b());
        assertDec(7, above.y());

        Rectangle left = FreeSpace.Piece.LEFT.cut(AV, item);
        assertDec(2, left.a());
        assertDec(10, left.b());

        Rectangle right = FreeSpace.Piece.RIGHT.cut(AV, item);
        assertDec(3, right.a());
        assertDec(7, right.x());

        for (Rectangle piece : Arrays.asList(below, above, left, right)) {
            assertFalse(RectUtils.intersect(piece, item));
            assertTrue(RectUtils.contains(AV, piece));
        }
    }

    @Test
    @DisplayName("Pruning drops enclosed and duplicated rectangles")
    void pruningDropsEnclosed() {
        List<Rectangle> avs = new ArrayList<>(Arrays.asList(
                Rectangle.of(5, 5, 0, 0),
                Rectangle.of(10, 10, 0, 0),
                Rectangle.of(3, 3, 20, 20),
                Rectangle.of(3, 3, 20, 20)));
        FreeSpace.pruneEnclosed(avs);
        assertEquals(2, avs.size());
        assertDec(10, avs.get(0).a());
        assertDec(3, avs.get(1).a());
    }

    @Test
    @DisplayName("Plain bin rejects an item strictly inside a free rectangle")
    void plainBinRejectsInnerItem() {
        Bin bin = new Bin(10, 10);
        assertThrows(PackingInvariantException.class,
                () -> bin.splitPieces(FreeSpace.ITEM_INSIDE, AV, Rectangle.of(5, 5, 2, 2)));
        assertThrows(PackingInvariantException.class,
                () -> bin.splitPieces(FreeSpace.COVERED, AV, Rectangle.of(10, 10, 0, 0)));
    }

    @Test
    @DisplayName("Distance bin splits an inner item into four pieces")
    void distanceBinSplitsInnerItem() {
        BinWithDistances bin = new BinWithDistances(10, 10, 0, 0, 0, 0);
        assertArrayEquals(FreeSpace.ALL_SIDES,
                bin.splitPieces(FreeSpace.ITEM_INSIDE, AV, Rectangle.of(5, 5, 2, 2)));
    }
}
