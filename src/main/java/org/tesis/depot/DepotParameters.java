package org.tesis.depot;

import java.math.BigDecimal;

/**
 * Parámetros constantes del layout de depósito (metros, salvo el ángulo).
 * Slot = plaza con margen de seguridad. "A" son distancias laterales (eje x),
 * "B" distancias de frente/fondo (eje y).
 */
public final class DepotParameters {

    // bus estándar de 12 m
    public static final DepotParameters STANDARD_BUS = new DepotParameters(
            "SB", 3.55, 12.5, 45,
            8, 0,
            0, 19.25,
            8, 15);

    // bus articulado de 18 m
    public static final DepotParameters ARTICULATED_BUS = new DepotParameters(
            "AB", 3.55, 18.5, 45,
            10, 0,
            0, 19.25,
            8, 15);

    private final String code;
    private final BigDecimal widthSafe;
    private final BigDecimal lengthSafe;
    private final int angleDirect;
    private final BigDecimal directDistanceA;
    private final BigDecimal directDistanceB;
    private final BigDecimal lineDistanceA;
    private final BigDecimal lineDistanceB;
    private final BigDecimal edgeDistanceA;
    private final BigDecimal edgeDistanceB;

    public DepotParameters(String code, double widthSafe, double lengthSafe, int angleDirect,
                           double directDistanceA, double directDistanceB,
                           double lineDistanceA, double lineDistanceB,
                           double edgeDistanceA, double edgeDistanceB) {
        if (widthSafe <= 0 || lengthSafe <= 0) {
            throw new IllegalArgumentException("Las plazas requieren ancho y largo > 0");
        }
        if (!ShapeGeometry.angleInRange(angleDirect)) {
            throw new IllegalArgumentException("angleDirect fuera de [-75, 75]: " + angleDirect);
        }
        if (directDistanceA < 0 || directDistanceB < 0 || lineDistanceA < 0 || lineDistanceB < 0
                || edgeDistanceA < 0 || edgeDistanceB < 0) {
            throw new IllegalArgumentException("Las distancias deben ser >= 0");
        }
        this.code = code;
        this.widthSafe = RectUtils.dec(widthSafe);
        this.lengthSafe = RectUtils.dec(lengthSafe);
        this.angleDirect = angleDirect;
        this.directDistanceA = RectUtils.dec(directDistanceA);
        this.directDistanceB = RectUtils.dec(directDistanceB);
        this.lineDistanceA = RectUtils.dec(lineDistanceA);
        this.lineDistanceB = RectUtils.dec(lineDistanceB);
        this.edgeDistanceA = RectUtils.dec(edgeDistanceA);
        this.edgeDistanceB = RectUtils.dec(edgeDistanceB);
    }

    // preset por código (SB | AB)
    public static DepotParameters byCode(String code) {
        if (STANDARD_BUS.code.equalsIgnoreCase(code)) return STANDARD_BUS;
        if (ARTICULATED_BUS.code.equalsIgnoreCase(code)) return ARTICULATED_BUS;
        throw new IllegalArgumentException("Preset de depósito desconocido: " + code);
    }

    public String code()                { return code; }
    public BigDecimal widthSafe()       { return widthSafe; }
    public BigDecimal lengthSafe()      { return lengthSafe; }
    public int angleDirect()            { return angleDirect; }
    public BigDecimal directDistanceA() { return directDistanceA; }
    public BigDecimal directDistanceB() { return directDistanceB; }
    public BigDecimal lineDistanceA()   { return lineDistanceA; }
    public BigDecimal lineDistanceB()   { return lineDistanceB; }
    public BigDecimal edgeDistanceA()   { return edgeDistanceA; }
    public BigDecimal edgeDistanceB()   { return edgeDistanceB; }
}
