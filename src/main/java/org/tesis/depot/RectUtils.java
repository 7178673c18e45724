package org.tesis.depot;

import java.math.BigDecimal;
import java.math.MathContext;

/**
 * Predicados entre rectángulos sin rotar y helpers de aritmética decimal.
 * Son las únicas primitivas de colisión del empaquetador: las plazas rotadas
 * nunca se chequean directamente, solo su caja envolvente.
 */
public final class RectUtils {

    // contexto para divisiones (las sumas y productos son exactos)
    static final MathContext MC = MathContext.DECIMAL128;
    static final BigDecimal TWO = BigDecimal.valueOf(2);
    static final BigDecimal HALF = new BigDecimal("0.5");

    private RectUtils() {}

    // convierte un double a decimal usando su representación textual (0.1 -> "0.1", no 0.1000000000000000055...)
    public static BigDecimal dec(double v) {
        return BigDecimal.valueOf(v);
    }

    public static BigDecimal dec(String v) {
        return new BigDecimal(v.trim());
    }

    // seno y coseno de un ángulo en grados, llevados a decimal igual que cualquier otro double
    static BigDecimal sinDeg(int deg) {
        return dec(Math.sin(Math.toRadians(deg)));
    }

    static BigDecimal cosDeg(int deg) {
        return dec(Math.cos(Math.toRadians(deg)));
    }

    static BigDecimal max(BigDecimal v1, BigDecimal v2) {
        return v1.compareTo(v2) >= 0 ? v1 : v2;
    }

    // r1 es menor o igual que r2 en ambas dimensiones
    public static boolean fitsInto(Rectangle r1, Rectangle r2) {
        return r1.a().compareTo(r2.a()) <= 0 && r1.b().compareTo(r2.b()) <= 0;
    }

    // solapan en x; tocarse no cuenta como intersección
    public static boolean xIntersect(Rectangle r1, Rectangle r2) {
        return r1.xLeft().compareTo(r2.xRight()) < 0 && r1.xRight().compareTo(r2.xLeft()) > 0;
    }

    // solapan en y; tocarse no cuenta como intersección
    public static boolean yIntersect(Rectangle r1, Rectangle r2) {
        return r1.yBottom().compareTo(r2.yTop()) < 0 && r1.yTop().compareTo(r2.yBottom()) > 0;
    }

    public static boolean intersect(Rectangle r1, Rectangle r2) {
        return xIntersect(r1, r2) && yIntersect(r1, r2);
    }

    // r1 encierra completamente a r2 (bordes incluidos)
    public static boolean contains(Rectangle r1, Rectangle r2) {
        return r1.xLeft().compareTo(r2.xLeft()) <= 0
                && r1.yBottom().compareTo(r2.yBottom()) <= 0
                && r1.xRight().compareTo(r2.xRight()) >= 0
                && r1.yTop().compareTo(r2.yTop()) >= 0;
    }

    public static boolean containsPoint(Rectangle r, Point p) {
        return r.xLeft().compareTo(p.x) <= 0 && p.x.compareTo(r.xRight()) <= 0
                && r.yBottom().compareTo(p.y) <= 0 && p.y.compareTo(r.yTop()) <= 0;
    }
}
