package org.tesis.depot;

import java.math.BigDecimal;

/**
 * Geometría derivada de una forma de área: tamaño exterior (a, b) y offsets
 * de las plazas relativos a la esquina inferior izquierda de la caja.
 * Es función pura de (forma, m, n, cantidad, ángulo); la posición del área
 * no se guarda acá, se pasa en cada consulta.
 *
 * Nombres PA, AQ, PD, DS: proyecciones de los lados de la plaza rotada
 * (PA = n·sin θ, AQ = m·cos θ, PD = n·cos θ, DS = m·sin θ).
 */
final class ShapeGeometry {

    static final int MAX_ANGLE = 75;
    static final int DOUBLE_ROW_LEFT_ANGLE = 45;
    static final int DOUBLE_ROW_RIGHT_ANGLE = 135;

    final AreaShape shape;
    final BigDecimal a;
    final BigDecimal b;
    final BigDecimal pitch;      // avance en y entre plazas consecutivas de una misma columna
    final BigDecimal innerDx;    // offset de la plaza 0 (columna izquierda)
    final BigDecimal innerDy;
    final BigDecimal rightDx;    // offset de la plaza 1 (columna derecha, solo doble fila)
    final BigDecimal rightDy;
    final int angle;

    private ShapeGeometry(AreaShape shape, BigDecimal a, BigDecimal b, BigDecimal pitch,
                          BigDecimal innerDx, BigDecimal innerDy,
                          BigDecimal rightDx, BigDecimal rightDy, int angle) {
        this.shape = shape;
        this.a = a;
        this.b = b;
        this.pitch = pitch;
        this.innerDx = innerDx;
        this.innerDy = innerDy;
        this.rightDx = rightDx;
        this.rightDy = rightDy;
        this.angle = angle;
    }

    // valida parámetros y despacha según la forma
    static ShapeGeometry of(AreaShape shape, BigDecimal m, BigDecimal n, int count, int angle) {
        if (m.signum() <= 0 || n.signum() <= 0) {
            throw new IllegalArgumentException("Las plazas requieren m y n > 0 (m=" + m + ", n=" + n + ")");
        }
        if (count < shape.minCount) {
            throw new IllegalArgumentException("count_inner debe ser un natural >= " + shape.minCount
                    + " para " + shape + " (recibido " + count + ")");
        }
        switch (shape) {
            case STACKED:
                return stacked(m, n, count);
            case ROTATABLE_ROW:
                return rotatableRow(m, n, count, angle);
            case ROTATED_DOUBLE_ROW:
                return rotatedDoubleRow(m, n, count);
            default:
                throw new IllegalArgumentException("Forma desconocida: " + shape);
        }
    }

    // plazas apiladas en y, sin rotación
    static ShapeGeometry stacked(BigDecimal m, BigDecimal n, int count) {
        BigDecimal zero = BigDecimal.ZERO;
        return new ShapeGeometry(AreaShape.STACKED, m, n.multiply(BigDecimal.valueOf(count)), n,
                zero, zero, zero, zero, 0);
    }

    // rango cerrado [-MAX_ANGLE, MAX_ANGLE]
    static boolean angleInRange(int angle) {
        return angle >= -MAX_ANGLE && angle <= MAX_ANGLE;
    }

    // una fila de plazas rotadas en θ; θ >= 0 inclina hacia la izquierda, θ < 0 hacia la derecha
    static ShapeGeometry rotatableRow(BigDecimal m, BigDecimal n, int count, int angle) {
        if (!angleInRange(angle)) {
            throw new IllegalArgumentException("angle_inner debe estar entre -" + MAX_ANGLE
                    + " y " + MAX_ANGLE + " (recibido " + angle + ")");
        }
        BigDecimal sin = RectUtils.sinDeg(angle);
        BigDecimal cos = RectUtils.cosDeg(angle);
        BigDecimal pa = n.multiply(sin);
        BigDecimal aq = m.multiply(cos);
        BigDecimal pd = n.multiply(cos);
        BigDecimal ds = m.multiply(sin);
        BigDecimal h = n.divide(cos, RectUtils.MC);
        BigDecimal rows = BigDecimal.valueOf(count - 1L).multiply(h);

        BigDecimal a, b, dx, dy;
        if (angle < 0) {
            a = aq.subtract(pa);
            b = pd.subtract(ds).add(rows);
            dx = BigDecimal.ZERO;
            dy = ds.negate();
        } else {
            a = pa.add(aq);
            b = pd.add(ds).add(rows);
            dx = pa;
            dy = BigDecimal.ZERO;
        }
        return new ShapeGeometry(AreaShape.ROTATABLE_ROW, a, b, h, dx, dy, dx, dy, angle);
    }

    // dos columnas intercaladas a ±45°: índices pares a la izquierda (45°), impares a la derecha (135°)
    static ShapeGeometry rotatedDoubleRow(BigDecimal m, BigDecimal n, int count) {
        BigDecimal sin = RectUtils.sinDeg(DOUBLE_ROW_LEFT_ANGLE);
        BigDecimal cos = RectUtils.cosDeg(DOUBLE_ROW_LEFT_ANGLE);
        BigDecimal pa = n.multiply(sin);
        BigDecimal abx = m.multiply(cos);
        BigDecimal pd = n.multiply(cos);
        BigDecimal ds = m.multiply(sin);
        BigDecimal h = n.divide(cos, RectUtils.MC);

        int uneven = count % 2;
        BigDecimal slotsLeft = BigDecimal.valueOf(count).divide(RectUtils.TWO, RectUtils.MC);
        if (uneven == 0) slotsLeft = slotsLeft.add(RectUtils.HALF);

        BigDecimal a = pa.add(abx.multiply(RectUtils.TWO));
        BigDecimal b = pd.add(ds)
                .add(slotsLeft.subtract(BigDecimal.ONE).multiply(h));
        if (uneven == 1) b = b.add(h.divide(RectUtils.TWO, RectUtils.MC));

        return new ShapeGeometry(AreaShape.ROTATED_DOUBLE_ROW, a, b, h,
                pa, BigDecimal.ZERO, a, h, DOUBLE_ROW_LEFT_ANGLE);
    }

    // ancla (punto de giro) de la plaza i para un área ubicada en (x, y)
    Point slotPosition(int i, BigDecimal x, BigDecimal y) {
        if (shape == AreaShape.ROTATED_DOUBLE_ROW) {
            if (i % 2 == 1) {
                BigDecimal k = BigDecimal.valueOf((i - 1) / 2);
                return new Point(x.add(rightDx), y.add(rightDy).add(k.multiply(pitch)));
            }
            BigDecimal k = BigDecimal.valueOf(i / 2);
            return new Point(x.add(innerDx), y.add(innerDy).add(k.multiply(pitch)));
        }
        BigDecimal k = BigDecimal.valueOf(i);
        return new Point(x.add(innerDx), y.add(innerDy).add(k.multiply(pitch)));
    }

    // ángulo de dibujo de la plaza i
    int slotAngle(int i) {
        if (shape == AreaShape.ROTATED_DOUBLE_ROW) {
            return (i % 2 == 1) ? DOUBLE_ROW_RIGHT_ANGLE : DOUBLE_ROW_LEFT_ANGLE;
        }
        return angle;
    }
}
