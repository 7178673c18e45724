package org.tesis.depot;

import java.math.BigDecimal;

/**
 * Tipos de área del depósito. La categoría de conflicto ordena el
 * empaquetado (mayor = se coloca antes) y refleja qué formas cuestan más
 * ubicar.
 */
public enum AreaType {
    // línea: plazas en fila una detrás de otra
    LINE("L", AreaShape.STACKED, 2, 2),
    // directa de una fila, plazas inclinadas hacia la izquierda
    DIRECT_SINGLE_ROW("DSR", AreaShape.ROTATABLE_ROW, 3, 1),
    // directa de una fila espejada (ángulo negativo)
    DIRECT_SINGLE_ROW_90("DSR_90", AreaShape.ROTATABLE_ROW, 1, 1),
    // directa de doble fila a 45°
    DIRECT_DOUBLE_ROW("DDR", AreaShape.ROTATED_DOUBLE_ROW, 4, 2);

    private final String code;
    private final AreaShape shape;
    private final int conflictCategory;
    private final int capacityMin;

    AreaType(String code, AreaShape shape, int conflictCategory, int capacityMin) {
        this.code = code;
        this.shape = shape;
        this.conflictCategory = conflictCategory;
        this.capacityMin = capacityMin;
    }

    public String code()          { return code; }
    public AreaShape shape()      { return shape; }
    public int conflictCategory() { return conflictCategory; }
    public int capacityMin()      { return capacityMin; }

    public static AreaType byCode(String code) {
        for (AreaType t : values()) {
            if (t.code.equalsIgnoreCase(code) || t.name().equalsIgnoreCase(code)) return t;
        }
        throw new IllegalArgumentException("Tipo de área desconocido: " + code);
    }

    public Area create(int capacity, DepotParameters p) {
        return create(capacity, p, p.angleDirect());
    }

    // angle solo se usa en las filas directas simples (DSR usa +angle, DSR_90 usa -angle)
    public Area create(int capacity, DepotParameters p, int angle) {
        if (capacity < capacityMin) {
            throw new IllegalArgumentException("Capacidad " + capacity + " menor al mínimo " + capacityMin
                    + " de " + code);
        }
        if (!ShapeGeometry.angleInRange(angle)) {
            throw new IllegalArgumentException("Ángulo " + angle + " fuera de [-" + ShapeGeometry.MAX_ANGLE
                    + ", " + ShapeGeometry.MAX_ANGLE + "] para " + code);
        }
        BigDecimal zero = BigDecimal.ZERO;
        String label = code + " " + capacity;
        switch (this) {
            case LINE:
                return new Area(shape, p.widthSafe(), p.lengthSafe(), capacity, 0, conflictCategory,
                        p.lineDistanceA(), p.lineDistanceB(), p.lineDistanceA(), p.lineDistanceB(), label);
            case DIRECT_SINGLE_ROW:
                return new Area(shape, p.lengthSafe(), p.widthSafe(), capacity, Math.abs(angle), conflictCategory,
                        p.directDistanceA(), p.directDistanceB(), zero, p.directDistanceB(), label);
            case DIRECT_SINGLE_ROW_90:
                return new Area(shape, p.lengthSafe(), p.widthSafe(), capacity, -Math.abs(angle), conflictCategory,
                        zero, p.directDistanceB(), p.directDistanceA(), p.directDistanceB(), label);
            case DIRECT_DOUBLE_ROW:
                return new Area(shape, p.lengthSafe(), p.widthSafe(), capacity,
                        ShapeGeometry.DOUBLE_ROW_LEFT_ANGLE, conflictCategory,
                        p.directDistanceA(), p.directDistanceB(), p.directDistanceA(), p.directDistanceB(), label);
            default:
                throw new IllegalArgumentException("Tipo de área desconocido: " + this);
        }
    }
}
