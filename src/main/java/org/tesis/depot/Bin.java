package org.tesis.depot;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Contenedor rectangular con heurística first-fit-decreasing.
 *
 * Uso: agregar áreas a {@link #items()}, llamar {@link #pack()} una vez y leer
 * {@link #feasible()}, {@link #utilRate()} y {@link #countInner()}. Para volver
 * a probar con otra lista de áreas se usa {@link #repack()}.
 *
 * Sin backtracking: si un área no entra en ningún libre el resultado es
 * infactible y no se intenta con las restantes.
 */
public class Bin {

    // orden de empaquetado: categoría de conflicto, luego a, luego b (todo descendente)
    static final Comparator<Area> PACKING_ORDER = Comparator
            .comparingInt(Area::conflictCategory)
            .thenComparing(Area::a)
            .thenComparing(Area::b)
            .reversed();

    // orden de los libres tras cada actualización: por b y a ascendentes
    static final Comparator<Rectangle> AVAILABLE_ORDER = Comparator
            .comparing(Rectangle::b)
            .thenComparing(Rectangle::a);

    protected final BigDecimal a;
    protected final BigDecimal b;

    protected final List<Area> items = new ArrayList<>();
    protected final List<Rectangle> availables = new ArrayList<>();
    protected final List<Area> packedItems = new ArrayList<>();

    private final boolean recordHistory;
    private final PackingHistory history = new PackingHistory();

    private Boolean feasible;
    private Boolean precheckPassed;
    private String precheckReason;

    protected PackingLog log;   // null = sin log

    public Bin(double a, double b) {
        this(RectUtils.dec(a), RectUtils.dec(b), true);
    }

    public Bin(double a, double b, boolean recordHistory) {
        this(RectUtils.dec(a), RectUtils.dec(b), recordHistory);
    }

    public Bin(BigDecimal a, BigDecimal b, boolean recordHistory) {
        if (a.signum() <= 0 || b.signum() <= 0) {
            throw new IllegalArgumentException("El bin requiere a y b > 0 (a=" + a + ", b=" + b + ")");
        }
        this.a = a;
        this.b = b;
        this.recordHistory = recordHistory;
        availables.add(new Rectangle(a, b, BigDecimal.ZERO, BigDecimal.ZERO));
    }

    // ===================== Accesos =====================

    public BigDecimal a() { return a; }
    public BigDecimal b() { return b; }

    public Rectangle bounds() {
        return new Rectangle(a, b, BigDecimal.ZERO, BigDecimal.ZERO);
    }

    public BigDecimal area() {
        return a.multiply(b);
    }

    // lista de entrada, modificable por quien llama (p. ej. el sondeo de capacidad)
    public List<Area> items() {
        return items;
    }

    public List<Area> packedItems() {
        return Collections.unmodifiableList(packedItems);
    }

    public List<Rectangle> availables() {
        return Collections.unmodifiableList(availables);
    }

    public PackingHistory history() {
        return history;
    }

    public boolean recordsHistory() {
        return recordHistory;
    }

    public void setLog(PackingLog log) {
        this.log = log;
    }

    /** Resultado del intento: null hasta llamar a pack(). */
    public Boolean feasible() {
        return feasible;
    }

    public Boolean precheckPassed() {
        return precheckPassed;
    }

    // motivo del rechazo en el precheck (null si pasó o no se corrió)
    public String precheckReason() {
        return precheckReason;
    }

    // fracción del bin ocupada por las áreas colocadas
    public BigDecimal utilRate() {
        BigDecimal used = BigDecimal.ZERO;
        for (Area p : packedItems) used = used.add(p.area());
        return used.divide(area(), RectUtils.MC);
    }

    // total de plazas de las áreas colocadas
    public int countInner() {
        int sum = 0;
        for (Area p : packedItems) sum += p.countInner();
        return sum;
    }

    // superficie total de las áreas de entrada, sin distancias
    public BigDecimal itemsArea() {
        BigDecimal sum = BigDecimal.ZERO;
        for (Area item : items) sum = sum.add(item.area());
        return sum;
    }

    // ninguna pareja de áreas colocadas se solapa
    public boolean isValid() {
        for (int i = 0; i < packedItems.size(); i++) {
            for (int j = i + 1; j < packedItems.size(); j++) {
                if (RectUtils.intersect(packedItems.get(i).bounds(), packedItems.get(j).bounds())) {
                    return false;
                }
            }
        }
        return true;
    }

    // ===================== Empaquetado =====================

    // chequeos rápidos de condición necesaria antes de colocar
    public void precheck() {
        Set<Area> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Area item : items) {
            if (!seen.add(item)) {
                throw new IllegalStateException("La misma instancia de área aparece dos veces: " + item);
            }
        }
        for (Area item : items) {
            if (item.a().compareTo(a) > 0) {
                rejectPrecheck("lado a de " + item + " mayor que el bin (" + a.toPlainString() + ")");
                return;
            }
            if (item.b().compareTo(b) > 0) {
                rejectPrecheck("lado b de " + item + " mayor que el bin (" + b.toPlainString() + ")");
                return;
            }
        }
        if (itemsArea().compareTo(area()) > 0) {
            rejectPrecheck("suma de superficies " + itemsArea().toPlainString()
                    + " > superficie del bin " + area().toPlainString());
            return;
        }
        precheckPassed = true;
        precheckReason = null;
    }

    private void rejectPrecheck(String reason) {
        precheckPassed = false;
        precheckReason = reason;
    }

    /**
     * Intenta distribuir todas las áreas sin solapes. Deja el resultado en
     * {@link #feasible()}; la infactibilidad no lanza excepción.
     *
     * @throws IllegalStateException si ya se empaquetó sin repack() o la lista está vacía
     * @throws PackingInvariantException ante un defecto interno
     */
    public void pack() {
        if (feasible != null) {
            throw new IllegalStateException("No se puede empaquetar de nuevo sin repack()");
        }
        if (items.isEmpty()) {
            throw new IllegalStateException("No se puede empaquetar: la lista de áreas está vacía");
        }
        if (log != null) log.logf("==== %s %sx%s | START | áreas=%d ====",
                getClass().getSimpleName(), a.toPlainString(), b.toPlainString(), items.size());

        precheck();
        if (!precheckPassed) {
            feasible = false;
            if (log != null) log.log("Precheck fallido: " + precheckReason);
            return;
        }

        items.sort(PACKING_ORDER);
        snapshot();

        for (Area item : items) {
            if (!put(item)) {
                feasible = false;
                if (log != null) log.logf("Aviso: no se pudo colocar %s (%d/%d colocadas)",
                        item, packedItems.size(), items.size());
                return;
            }
            if (log != null) log.logf("Colocada %s en (%s, %s)",
                    item.label().isEmpty() ? item.shape().toString() : item.label(),
                    item.x().toPlainString(), item.y().toPlainString());
            snapshot();
        }

        if (!isValid()) {
            throw new PackingInvariantException("Solape entre áreas colocadas tras empaquetar " + packedItems);
        }
        feasible = true;
        if (log != null) log.logf("Factible | util=%.3f%% | plazas=%d",
                utilRate().doubleValue() * 100.0, countInner());
    }

    // descarta todo el estado de empaquetado (la lista items se conserva)
    public void reset() {
        availables.clear();
        packedItems.clear();
        history.clear();
        feasible = null;
        precheckPassed = null;
        precheckReason = null;
        availables.add(new Rectangle(a, b, BigDecimal.ZERO, BigDecimal.ZERO));
    }

    public void repack() {
        reset();
        pack();
    }

    // coloca item si hay lugar válido y actualiza los libres
    protected boolean put(Area item) {
        Rectangle av = tryPut(item);
        if (av == null) return false;
        packedItems.add(item);
        updateAvailables(item);
        return true;
    }

    /**
     * Busca el primer libre donde entra item y lo posiciona en su origen.
     * Devuelve ese libre o null. La posición de item puede cambiar aunque no entre.
     */
    protected Rectangle tryPut(Area item) {
        for (Rectangle av : availables) {
            if (av.a().compareTo(item.a()) >= 0 && av.b().compareTo(item.b()) >= 0) {
                item.moveTo(av.x(), av.y());
                return av;
            }
        }
        return null;
    }

    // parte los libres que tocan al área nueva, poda los redundantes y valida
    protected void updateAvailables(Area item) {
        Rectangle ib = item.bounds();
        List<Rectangle> kept = new ArrayList<>();
        List<Rectangle> created = new ArrayList<>();
        for (Rectangle av : availables) {
            if (!RectUtils.intersect(av, ib)) {
                kept.add(av);
                continue;
            }
            // libre totalmente cubierto: desaparece sin resto
            if (RectUtils.contains(ib, av)) continue;

            int code = FreeSpace.signature(av, ib);
            for (FreeSpace.Piece piece : splitPieces(code, av, ib)) {
                created.add(piece.cut(av, ib));
            }
        }
        kept.addAll(created);
        FreeSpace.pruneEnclosed(kept);
        kept.sort(AVAILABLE_ORDER);

        availables.clear();
        availables.addAll(kept);
        validateFreeSpace();
    }

    // entrada de la tabla de división para la firma dada
    protected FreeSpace.Piece[] splitPieces(int code, Rectangle av, Rectangle item) {
        FreeSpace.Piece[] pieces = FreeSpace.tableEntry(code);
        if (pieces == null) {
            throw new PackingInvariantException("Firma de división inalcanzable " + FreeSpace.bits(code)
                    + " | av=" + av + " | item=" + item);
        }
        return pieces;
    }

    // invariantes de los libres: no degenerados, sin solape con colocadas, ninguno dentro de otro
    protected void validateFreeSpace() {
        for (Rectangle av : availables) {
            if (av.a().signum() <= 0 || av.b().signum() <= 0) {
                throw new PackingInvariantException("Libre degenerado: " + av);
            }
            for (Area p : packedItems) {
                if (RectUtils.intersect(av, p.bounds())) {
                    throw new PackingInvariantException("Libre " + av + " solapa el área colocada " + p);
                }
            }
        }
        for (int i = 0; i < availables.size(); i++) {
            for (int j = 0; j < availables.size(); j++) {
                if (i != j && RectUtils.contains(availables.get(i), availables.get(j))) {
                    throw new PackingInvariantException("Libre " + availables.get(j)
                            + " encerrado por " + availables.get(i));
                }
            }
        }
    }

    private void snapshot() {
        if (recordHistory) history.record(packedItems, availables);
    }

    @Override
    public String toString() {
        return "{" + getClass().getSimpleName() + "} a=" + a.toPlainString() + ", b=" + b.toPlainString()
                + ", items=" + items.size() + ", packed=" + packedItems.size() + ", feasible=" + feasible;
    }
}
