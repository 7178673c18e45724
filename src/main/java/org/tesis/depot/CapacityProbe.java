package org.tesis.depot;

import java.math.BigDecimal;
import java.util.List;
import java.util.function.Supplier;

/**
 * Sondeo de capacidad: cuántas plazas entran por área y cuántas áreas de un
 * mismo tipo entran en el depósito. Se agregan áreas de a una y se re-empaqueta
 * hasta la primera infactible.
 */
public final class CapacityProbe {

    static final int DEFAULT_CAPACITY_LIMIT = 200;

    private final BigDecimal depotA;
    private final BigDecimal depotB;
    private final DepotParameters params;

    public CapacityProbe(double depotA, double depotB, DepotParameters params) {
        this.depotA = RectUtils.dec(depotA);
        this.depotB = RectUtils.dec(depotB);
        this.params = params;
    }

    // resultado: cantidad máxima (0 = ni una entra) y el bin empaquetado con esa cantidad
    public static final class Result {
        final int count;
        final Bin bin;

        Result(int count, Bin bin) {
            this.count = count;
            this.bin = bin;
        }

        public int count() { return count; }
        public Bin bin()   { return bin; }

        public boolean fitsAny() {
            return count > 0;
        }
    }

    /**
     * Agrega áreas de areaFactory al bin hasta que deja de ser factible.
     * El bin devuelto queda re-empaquetado con la cantidad máxima encontrada.
     */
    public static Result countMax(Supplier<? extends Bin> binFactory, Supplier<Area> areaFactory) {
        Bin bin = binFactory.get();
        List<Area> items = bin.items();
        Area item = areaFactory.get();
        items.add(item);
        bin.pack();
        while (Boolean.TRUE.equals(bin.feasible())) {
            item = areaFactory.get();
            items.add(item);
            bin.repack();
        }

        // la última no entró
        items.remove(item);
        if (items.isEmpty()) {
            return new Result(0, bin);
        }
        // con áreas idénticas las primeras n-1 se colocan igual que antes, así que vuelve a ser factible
        bin.repack();
        return new Result(items.size(), bin);
    }

    public Result countMax(AreaType type, int capacity) {
        return countMax(this::newDepot, () -> type.create(capacity, params));
    }

    // capacidad máxima de un área sola en el depósito vacío; null si ni el mínimo entra
    public Integer capacityMax(AreaType type, int capacityMin) {
        return capacityMax(type, capacityMin, DEFAULT_CAPACITY_LIMIT);
    }

    public Integer capacityMax(AreaType type, int capacityMin, int limit) {
        BinWithDistances depot = newDepot();
        for (int c = capacityMin; c <= limit; c++) {
            Area candidate = type.create(c, params);
            if (depot.tryPut(candidate) == null) {
                return (c == capacityMin) ? null : c - 1;
            }
        }
        throw new IllegalStateException("La búsqueda de capacidad máxima para " + type.code()
                + " superó el límite de " + limit);
    }

    // cantidad máxima de áreas con capacidad máxima (el tipo más "largo")
    public Result countMaxWithCapacityMax(AreaType type, int capacityMin) {
        Integer capacity = capacityMax(type, capacityMin);
        if (capacity == null) {
            return new Result(0, newDepot());
        }
        return countMax(type, capacity);
    }

    // cantidad máxima de áreas con capacidad mínima
    public Result countMaxWithCapacityMin(AreaType type, int capacityMin) {
        return countMax(type, capacityMin);
    }

    BinWithDistances newDepot() {
        return new BinWithDistances(depotA, depotB, params, false);
    }
}
