package org.tesis.depot;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Shared helpers for the packing tests: decimal comparisons and the
 * invariant checks every successful packing must satisfy.
 */
abstract class PackingTestSupport {

    static BigDecimal d(double v) {
        return RectUtils.dec(v);
    }

    static void assertDec(double expected, BigDecimal actual) {
        assertEquals(0, d(expected).compareTo(actual),
                () -> "expected " + expected + " but was " + actual.toPlainString());
    }

    static void assertClose(double expected, BigDecimal actual) {
        assertEquals(expected, actual.doubleValue(), 1e-9);
    }

    static void assertNoOverlap(Bin bin) {
        List<Area> packed = bin.packedItems();
        for (int i = 0; i < packed.size(); i++) {
            for (int j = i + 1; j < packed.size(); j++) {
                assertFalse(RectUtils.intersect(packed.get(i).bounds(), packed.get(j).bounds()),
                        "overlap between " + packed.get(i) + " and " + packed.get(j));
            }
        }
    }

    static void assertFreeSpaceSound(Bin bin) {
        List<Rectangle> avs = bin.availables();
        for (Rectangle av : avs) {
            assertTrue(av.a().signum() > 0 && av.b().signum() > 0, "degenerate free rectangle " + av);
            assertTrue(RectUtils.contains(bin.bounds(), av), "free rectangle outside bin " + av);
            for (Area p : bin.packedItems()) {
                assertFalse(RectUtils.intersect(av, p.bounds()), av + " intersects " + p);
            }
        }
        for (int i = 0; i < avs.size(); i++) {
            for (int j = 0; j < avs.size(); j++) {
                if (i != j) {
                    assertFalse(RectUtils.contains(avs.get(i), avs.get(j)), avs.get(j) + " enclosed by " + avs.get(i));
                }
            }
        }
    }

    // facing pairs keep at least the larger buffer depth between them; edges keep their clearance
    static void assertDistancesHold(BinWithDistances bin) {
        List<Area> packed = bin.packedItems();
        for (Area p : packed) {
            Rectangle r = p.bounds();
            BigDecimal minX = RectUtils.max(p.depth(BufferSide.LEFT), bin.edgeDistance(BufferSide.LEFT));
            BigDecimal minY = RectUtils.max(p.depth(BufferSide.BOTTOM), bin.edgeDistance(BufferSide.BOTTOM));
            BigDecimal maxX = bin.a().subtract(RectUtils.max(p.depth(BufferSide.RIGHT), bin.edgeDistance(BufferSide.RIGHT)));
            BigDecimal maxY = bin.b().subtract(RectUtils.max(p.depth(BufferSide.TOP), bin.edgeDistance(BufferSide.TOP)));
            assertTrue(r.xLeft().compareTo(minX) >= 0, "left clearance violated by " + p);
            assertTrue(r.yBottom().compareTo(minY) >= 0, "bottom clearance violated by " + p);
            assertTrue(r.xRight().compareTo(maxX) <= 0, "right clearance violated by " + p);
            assertTrue(r.yTop().compareTo(maxY) <= 0, "top clearance violated by " + p);
        }
        for (Area p : packed) {
            for (Area q : packed) {
                if (p == q) continue;
                Rectangle rp = p.bounds();
                Rectangle rq = q.bounds();
                if (RectUtils.yIntersect(rp, rq) && rq.xLeft().compareTo(rp.xRight()) >= 0) {
                    BigDecimal gap = rq.xLeft().subtract(rp.xRight());
                    BigDecimal need = RectUtils.max(p.depth(BufferSide.RIGHT), q.depth(BufferSide.LEFT));
                    assertTrue(gap.compareTo(need) >= 0, "horizontal gap " + gap + " < " + need + " between " + p + " and " + q);
                }
                if (RectUtils.xIntersect(rp, rq) && rq.yBottom().compareTo(rp.yTop()) >= 0) {
                    BigDecimal gap = rq.yBottom().subtract(rp.yTop());
                    BigDecimal need = RectUtils.max(p.depth(BufferSide.TOP), q.depth(BufferSide.BOTTOM));
                    assertTrue(gap.compareTo(need) >= 0, "vertical gap " + gap + " < " + need + " between " + p + " and " + q);
                }
            }
        }
    }
}
