package org.tesis.depot;

import java.util.ArrayList;
import java.util.List;

/**
 * Convierte un bin (o un paso de su historial) en figuras JTS listas para
 * exportar. Las plazas se giran alrededor de su punto de anclaje.
 */
public class LayoutRenderer {

    // función que arma las figuras del resultado final
    public static List<DrawnShape> render(Bin bin, boolean drawDistances, PlotLanguage lang) {
        List<DrawnShape> out = new ArrayList<>();
        addBinAndEdges(out, bin, drawDistances);
        addItems(out, bin.packedItems(), drawDistances, lang);
        return out;
    }

    // función que arma las figuras de un paso del historial, con sus libres
    public static List<DrawnShape> renderStep(Bin bin, int step, PlotLanguage lang) {
        if (!bin.recordsHistory()) {
            throw new IllegalStateException("El bin no guarda historial: " + bin);
        }
        PackingHistory.Step s = bin.history().get(step);
        List<DrawnShape> out = new ArrayList<>();
        addBinAndEdges(out, bin, true);

        List<Rectangle> avs = s.availables();
        for (int i = 0; i < avs.size(); i++) {
            out.add(new DrawnShape(DrawnShape.Kind.AVAILABLE, GeomUtils.toPolygon(avs.get(i)),
                    lang.availableLabel(i), 0));
        }
        addItems(out, s.packed(), true, lang);
        return out;
    }

    static void addBinAndEdges(List<DrawnShape> out, Bin bin, boolean drawDistances) {
        out.add(new DrawnShape(DrawnShape.Kind.BIN, GeomUtils.toPolygon(bin.bounds()), "", 0));
        if (drawDistances && bin instanceof BinWithDistances) {
            BinWithDistances bwd = (BinWithDistances) bin;
            for (BufferSide side : BufferSide.values()) {
                Rectangle zone = bwd.edgeZone(side);
                if (zone.area().signum() > 0) {
                    out.add(new DrawnShape(DrawnShape.Kind.EDGE_CLEARANCE, GeomUtils.toPolygon(zone),
                            side.name(), 0));
                }
            }
        }
    }

    static void addItems(List<DrawnShape> out, List<Area> items, boolean drawDistances, PlotLanguage lang) {
        for (int i = 0; i < items.size(); i++) {
            Area item = items.get(i);
            String label = item.label().isEmpty() ? lang.number() + " " + (i + 1) : item.label();
            out.add(new DrawnShape(DrawnShape.Kind.ITEM, GeomUtils.toPolygon(item.bounds()), label, 0));

            List<Rectangle> slots = item.slots();
            for (int k = 0; k < slots.size(); k++) {
                Rectangle slot = slots.get(k);
                out.add(new DrawnShape(DrawnShape.Kind.SLOT, GeomUtils.toPolygon(slot),
                        label + " / " + (k + 1), slot.angle()));
            }

            if (!drawDistances) continue;
            for (BufferSide side : BufferSide.values()) {
                Rectangle buffer = item.buffer(side);
                // solo las distancias con superficie
                if (buffer.area().signum() > 0) {
                    out.add(new DrawnShape(DrawnShape.Kind.BUFFER, GeomUtils.toPolygon(buffer),
                            label + " " + side.name().toLowerCase(), 0));
                }
            }
        }
    }
}
