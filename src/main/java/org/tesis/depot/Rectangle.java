package org.tesis.depot;

import java.math.BigDecimal;

/**
 * Rectángulo sin rotar con aritmética decimal exacta.
 * a y b: ancho y alto. x e y: esquina inferior izquierda.
 * angle solo se usa para dibujar, nunca para colisiones.
 */
public final class Rectangle {
    private final BigDecimal a;
    private final BigDecimal b;
    private final int angle;
    private final BigDecimal x;
    private final BigDecimal y;

    public Rectangle(BigDecimal a, BigDecimal b, int angle, BigDecimal x, BigDecimal y) {
        this.a = a;
        this.b = b;
        this.angle = angle;
        this.x = x;
        this.y = y;
    }

    public Rectangle(BigDecimal a, BigDecimal b, BigDecimal x, BigDecimal y) {
        this(a, b, 0, x, y);
    }

    // atajo para tests y demos con valores double (se convierten vía su representación decimal)
    public static Rectangle of(double a, double b, double x, double y) {
        return new Rectangle(RectUtils.dec(a), RectUtils.dec(b), RectUtils.dec(x), RectUtils.dec(y));
    }

    public BigDecimal a() { return a; }
    public BigDecimal b() { return b; }
    public int angle()    { return angle; }
    public BigDecimal x() { return x; }
    public BigDecimal y() { return y; }

    public BigDecimal area() {
        return a.multiply(b);
    }

    public BigDecimal xLeft()   { return x; }
    public BigDecimal xRight()  { return x.add(a); }
    public BigDecimal yBottom() { return y; }
    public BigDecimal yTop()    { return y.add(b); }

    public BigDecimal xCenter() { return x.add(a.divide(RectUtils.TWO, RectUtils.MC)); }
    public BigDecimal yCenter() { return y.add(b.divide(RectUtils.TWO, RectUtils.MC)); }

    // esquinas en orden antihorario empezando abajo a la izquierda
    public Point[] corners() {
        return new Point[] {
                new Point(xLeft(), yBottom()),
                new Point(xRight(), yBottom()),
                new Point(xRight(), yTop()),
                new Point(xLeft(), yTop())
        };
    }

    @Override
    public String toString() {
        return "{Rectangle} a=" + a.toPlainString() + ", b=" + b.toPlainString()
                + ", x=" + x.toPlainString() + ", y=" + y.toPlainString()
                + ", A=" + area().toPlainString();
    }
}
