package org.tesis.depot;

import java.math.BigDecimal;

/**
 * Bin con distancias de seguridad: entre áreas (según las distancias propias
 * de cada una) y entre áreas y los bordes del bin (franjas fijas por lado).
 *
 * Para cada libre candidato el área se ubica en su origen y se corre hacia la
 * derecha y hacia arriba hasta resolver los conflictos de la izquierda y de
 * abajo. Derecha y arriba solo se validan, porque la búsqueda nunca retrocede.
 */
public class BinWithDistances extends Bin {

    // tope de vueltas del ciclo de resolución; el corrimiento es monótono, así que superarlo es un defecto
    static final int MAX_RESOLVE_ITERATIONS = 50;

    private final BigDecimal[] edges;   // franja de borde por BufferSide.ordinal()

    // franjas de borde por defecto del depósito estándar
    public BinWithDistances(double a, double b) {
        this(a, b, true);
    }

    public BinWithDistances(double a, double b, boolean recordHistory) {
        this(RectUtils.dec(a), RectUtils.dec(b), DepotParameters.STANDARD_BUS, recordHistory);
    }

    public BinWithDistances(BigDecimal a, BigDecimal b, DepotParameters params, boolean recordHistory) {
        this(a, b, params.edgeDistanceA(), params.edgeDistanceB(), params.edgeDistanceA(), params.edgeDistanceB(),
                recordHistory);
    }

    public BinWithDistances(double a, double b, double edgeLeft, double edgeBottom, double edgeRight, double edgeTop) {
        this(RectUtils.dec(a), RectUtils.dec(b), RectUtils.dec(edgeLeft), RectUtils.dec(edgeBottom),
                RectUtils.dec(edgeRight), RectUtils.dec(edgeTop), true);
    }

    public BinWithDistances(BigDecimal a, BigDecimal b, BigDecimal edgeLeft, BigDecimal edgeBottom,
                            BigDecimal edgeRight, BigDecimal edgeTop, boolean recordHistory) {
        super(a, b, recordHistory);
        this.edges = new BigDecimal[] { edgeLeft, edgeBottom, edgeRight, edgeTop };
        for (BigDecimal e : edges) {
            if (e == null || e.signum() < 0) {
                throw new IllegalArgumentException("Las distancias de borde deben ser >= 0: " + e);
            }
        }
    }

    public BigDecimal edgeDistance(BufferSide side) {
        return edges[side.ordinal()];
    }

    // franja de seguridad interior pegada al borde indicado
    public Rectangle edgeZone(BufferSide side) {
        BigDecimal d = edgeDistance(side);
        BigDecimal zero = BigDecimal.ZERO;
        switch (side) {
            case LEFT:
                return new Rectangle(d, b, zero, zero);
            case BOTTOM:
                return new Rectangle(a, d, zero, zero);
            case RIGHT:
                return new Rectangle(d, b, a.subtract(d), zero);
            case TOP:
                return new Rectangle(a, d, zero, b.subtract(d));
            default:
                throw new IllegalArgumentException("Lado desconocido: " + side);
        }
    }

    @Override
    protected Rectangle tryPut(Area item) {
        for (Rectangle av : availables) {
            if (av.a().compareTo(item.a()) >= 0 && av.b().compareTo(item.b()) >= 0) {
                if (placeWithDistances(item, av)) return av;
            }
        }
        return null;
    }

    // busca dentro de av una posición que respete todas las distancias; false si no hay
    private boolean placeWithDistances(Area item, Rectangle av) {
        item.moveTo(av.x(), av.y());

        // borde izquierdo
        if (item.buffer(BufferSide.LEFT).xLeft().signum() < 0
                || RectUtils.intersect(item.bounds(), edgeZone(BufferSide.LEFT))) {
            BigDecimal distance = RectUtils.max(item.depth(BufferSide.LEFT), edgeDistance(BufferSide.LEFT));
            shiftX(item, distance);
            if (!RectUtils.contains(av, item.bounds())) return false;
        }

        // borde inferior
        if (item.buffer(BufferSide.BOTTOM).yBottom().signum() < 0
                || RectUtils.intersect(item.bounds(), edgeZone(BufferSide.BOTTOM))) {
            BigDecimal distance = RectUtils.max(item.depth(BufferSide.BOTTOM), edgeDistance(BufferSide.BOTTOM));
            shiftY(item, distance);
            if (!RectUtils.contains(av, item.bounds())) return false;
        }

        // correr a la derecha y hacia arriba hasta que no queden conflictos a la izquierda ni abajo
        boolean leftOk = false;
        boolean bottomOk = false;
        int iteration = -1;
        while (!(leftOk && bottomOk)) {
            iteration++;
            if (iteration > MAX_RESOLVE_ITERATIONS) {
                throw new PackingInvariantException("La resolución de distancias no converge para " + item
                        + " en " + av);
            }

            // un lado queda resuelto recién tras una pasada sin corrimientos
            boolean shifted = false;
            for (Area p : packedItems) {
                if (RectUtils.intersect(item.buffer(BufferSide.LEFT), p.bounds())
                        || RectUtils.intersect(item.bounds(), p.buffer(BufferSide.RIGHT))) {
                    BigDecimal distance = RectUtils.max(item.depth(BufferSide.LEFT), p.depth(BufferSide.RIGHT));
                    shiftX(item, p.bounds().xRight().add(distance));
                    shifted = true;
                    bottomOk = false;
                }
            }
            if (!RectUtils.contains(av, item.bounds())) return false;
            leftOk = !shifted;

            if (!bottomOk) {
                shifted = false;
                for (Area p : packedItems) {
                    if (RectUtils.intersect(item.buffer(BufferSide.BOTTOM), p.bounds())
                            || RectUtils.intersect(item.bounds(), p.buffer(BufferSide.TOP))) {
                        BigDecimal distance = RectUtils.max(item.depth(BufferSide.BOTTOM), p.depth(BufferSide.TOP));
                        shiftY(item, p.bounds().yTop().add(distance));
                        shifted = true;
                        leftOk = false;
                    }
                }
                if (!RectUtils.contains(av, item.bounds())) return false;
                bottomOk = !shifted;
            }
        }

        Rectangle ib = item.bounds();
        for (Area p : packedItems) {
            if (RectUtils.intersect(ib, p.bounds())) return false;
        }

        // borde derecho y vecinos a la derecha
        if (item.buffer(BufferSide.RIGHT).xRight().compareTo(a) > 0
                || RectUtils.intersect(ib, edgeZone(BufferSide.RIGHT))) {
            return false;
        }
        for (Area p : packedItems) {
            if (RectUtils.intersect(item.buffer(BufferSide.RIGHT), p.bounds())
                    || RectUtils.intersect(ib, p.buffer(BufferSide.LEFT))) {
                return false;
            }
        }

        // borde superior y vecinos arriba
        if (item.buffer(BufferSide.TOP).yTop().compareTo(b) > 0
                || RectUtils.intersect(ib, edgeZone(BufferSide.TOP))) {
            return false;
        }
        for (Area p : packedItems) {
            if (RectUtils.intersect(item.buffer(BufferSide.TOP), p.bounds())
                    || RectUtils.intersect(ib, p.buffer(BufferSide.BOTTOM))) {
                return false;
            }
        }
        return true;
    }

    // los corrimientos solo avanzan; uno hacia atrás es un defecto
    static void shiftX(Area item, BigDecimal newX) {
        if (newX.compareTo(item.x()) < 0) {
            throw new PackingInvariantException("Corrimiento en x hacia atrás: " + item.x() + " -> " + newX);
        }
        item.setX(newX);
    }

    static void shiftY(Area item, BigDecimal newY) {
        if (newY.compareTo(item.y()) < 0) {
            throw new PackingInvariantException("Corrimiento en y hacia atrás: " + item.y() + " -> " + newY);
        }
        item.setY(newY);
    }

    // el área puede quedar corrida dentro del libre, así que la firma 0011 es legítima acá
    @Override
    protected FreeSpace.Piece[] splitPieces(int code, Rectangle av, Rectangle item) {
        if (code == FreeSpace.ITEM_INSIDE) return FreeSpace.ALL_SIDES;
        return super.splitPieces(code, av, item);
    }
}
