package org.tesis.depot;

import java.math.BigDecimal;

// punto con coordenadas exactas (esquinas, anclas de plazas)
public final class Point {
    final BigDecimal x, y;

    public Point(BigDecimal x, BigDecimal y) { this.x = x; this.y = y; }

    public BigDecimal x() { return x; }
    public BigDecimal y() { return y; }

    @Override
    public String toString() {
        return "(" + x.toPlainString() + ", " + y.toPlainString() + ")";
    }
}
