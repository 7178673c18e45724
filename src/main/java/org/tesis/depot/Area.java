package org.tesis.depot;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Área del depósito a empaquetar: caja envolvente de un grupo de plazas
 * idénticas (m × n) más cuatro distancias de seguridad opcionales.
 *
 * Solo se guarda la posición (x, y); todo lo demás (plazas, rectángulos de
 * distancia, caja) se calcula al leerlo, así nada queda desincronizado al
 * mover el área durante la búsqueda de lugar.
 */
public class Area {

    private final AreaShape shape;
    private final BigDecimal m;
    private final BigDecimal n;
    private final int countInner;
    private final int angleInner;
    private final int conflictCategory;
    private final BigDecimal[] depths;   // indexado por BufferSide.ordinal()
    private final String label;
    private final ShapeGeometry geometry;

    private BigDecimal x = BigDecimal.ZERO;
    private BigDecimal y = BigDecimal.ZERO;

    public Area(AreaShape shape, BigDecimal m, BigDecimal n, int countInner, int angleInner,
                int conflictCategory, BigDecimal dLeft, BigDecimal dBottom, BigDecimal dRight, BigDecimal dTop,
                String label) {
        this.geometry = ShapeGeometry.of(shape, m, n, countInner, angleInner);
        this.shape = shape;
        this.m = m;
        this.n = n;
        this.countInner = countInner;
        this.angleInner = geometry.angle;
        this.conflictCategory = conflictCategory;
        this.depths = new BigDecimal[] { dLeft, dBottom, dRight, dTop };
        for (BigDecimal d : depths) {
            if (d == null || d.signum() < 0) {
                throw new IllegalArgumentException("Las distancias deben ser >= 0: " + d);
            }
        }
        this.label = (label == null) ? "" : label;
    }

    // ---------- fábricas ----------

    public static Area stacked(double m, double n, int count) {
        return new Area(AreaShape.STACKED, RectUtils.dec(m), RectUtils.dec(n), count, 0, 0,
                BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, "");
    }

    public static Area rotatableRow(double m, double n, int count, int angle) {
        return new Area(AreaShape.ROTATABLE_ROW, RectUtils.dec(m), RectUtils.dec(n), count, angle, 0,
                BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, "");
    }

    public static Area rotatedDoubleRow(double m, double n, int count) {
        return new Area(AreaShape.ROTATED_DOUBLE_ROW, RectUtils.dec(m), RectUtils.dec(n), count,
                ShapeGeometry.DOUBLE_ROW_LEFT_ANGLE, 0,
                BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, "");
    }

    // rectángulo simple a × b (una sola plaza)
    public static Area plain(double a, double b) {
        return stacked(a, b, 1);
    }

    // copias con otro parámetro (la posición vuelve a (0, 0))
    public Area withBuffers(double left, double bottom, double right, double top) {
        return new Area(shape, m, n, countInner, angleInner, conflictCategory,
                RectUtils.dec(left), RectUtils.dec(bottom), RectUtils.dec(right), RectUtils.dec(top), label);
    }

    public Area withConflictCategory(int category) {
        return new Area(shape, m, n, countInner, angleInner, category,
                depths[0], depths[1], depths[2], depths[3], label);
    }

    public Area withLabel(String text) {
        return new Area(shape, m, n, countInner, angleInner, conflictCategory,
                depths[0], depths[1], depths[2], depths[3], text);
    }

    // ---------- parámetros ----------

    public AreaShape shape()      { return shape; }
    public BigDecimal m()         { return m; }
    public BigDecimal n()         { return n; }
    public int countInner()       { return countInner; }
    public int angleInner()       { return angleInner; }
    public int conflictCategory() { return conflictCategory; }
    public String label()         { return label; }

    public BigDecimal depth(BufferSide side) {
        return depths[side.ordinal()];
    }

    // ---------- posición ----------

    public BigDecimal x() { return x; }
    public BigDecimal y() { return y; }

    public void setX(BigDecimal value) { this.x = value; }
    public void setY(BigDecimal value) { this.y = value; }

    public void moveTo(BigDecimal newX, BigDecimal newY) {
        this.x = newX;
        this.y = newY;
    }

    // ---------- geometría derivada ----------

    public BigDecimal a() { return geometry.a; }
    public BigDecimal b() { return geometry.b; }

    public BigDecimal area() {
        return geometry.a.multiply(geometry.b);
    }

    public Rectangle bounds() {
        return new Rectangle(geometry.a, geometry.b, x, y);
    }

    // avance vertical entre plazas de una misma columna
    public BigDecimal pitch() {
        return geometry.pitch;
    }

    public Point slotPosition(int index) {
        checkSlot(index);
        return geometry.slotPosition(index, x, y);
    }

    public int slotAngle(int index) {
        checkSlot(index);
        return geometry.slotAngle(index);
    }

    // plazas como rectángulos (posición = punto de giro, angle = rotación de dibujo)
    public List<Rectangle> slots() {
        List<Rectangle> out = new ArrayList<>(countInner);
        for (int i = 0; i < countInner; i++) {
            Point p = geometry.slotPosition(i, x, y);
            out.add(new Rectangle(m, n, geometry.slotAngle(i), p.x, p.y));
        }
        return out;
    }

    private void checkSlot(int index) {
        if (index < 0 || index >= countInner) {
            throw new IndexOutOfBoundsException("Plaza " + index + " fuera de rango [0, " + countInner + ")");
        }
    }

    public BigDecimal innerArea() {
        return m.multiply(n).multiply(BigDecimal.valueOf(countInner));
    }

    // superficie de plazas / superficie de la caja (solo informativo)
    public BigDecimal utilRate() {
        return innerArea().divide(area(), RectUtils.MC);
    }

    // rectángulo de distancia pegado al lado indicado, siempre calculado desde la posición actual
    public Rectangle buffer(BufferSide side) {
        BigDecimal d = depth(side);
        switch (side) {
            case LEFT:
                return new Rectangle(d, geometry.b, x.subtract(d), y);
            case BOTTOM:
                return new Rectangle(geometry.a, d, x, y.subtract(d));
            case RIGHT:
                return new Rectangle(d, geometry.b, x.add(geometry.a), y);
            case TOP:
                return new Rectangle(geometry.a, d, x, y.add(geometry.b));
            default:
                throw new IllegalArgumentException("Lado desconocido: " + side);
        }
    }

    public BigDecimal aWithDistances() {
        return depth(BufferSide.LEFT).add(geometry.a).add(depth(BufferSide.RIGHT));
    }

    public BigDecimal bWithDistances() {
        return depth(BufferSide.BOTTOM).add(geometry.b).add(depth(BufferSide.TOP));
    }

    public BigDecimal areaDistances() {
        BigDecimal sum = BigDecimal.ZERO;
        for (BufferSide side : BufferSide.values()) sum = sum.add(buffer(side).area());
        return sum;
    }

    public BigDecimal areaWithDistances() {
        return area().add(areaDistances());
    }

    public BigDecimal utilRateWithDistances() {
        return innerArea().divide(areaWithDistances(), RectUtils.MC);
    }

    @Override
    public String toString() {
        return "{" + shape + (label.isEmpty() ? "" : " " + label) + "} a=" + a().toPlainString()
                + ", b=" + b().toPlainString() + ", x=" + x.toPlainString() + ", y=" + y.toPlainString()
                + ", count=" + countInner;
    }
}
