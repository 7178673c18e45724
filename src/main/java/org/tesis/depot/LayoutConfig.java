package org.tesis.depot;

import java.util.*;
import java.util.stream.Collectors;

public class LayoutConfig {

    // construye el bin del depósito a partir de la fila DEPOT; bordes vacíos = preset
    static BinWithDistances buildDepot(List<AreaRow> rows, DepotParameters params) {
        List<AreaRow> depots = rows.stream().filter(AreaRow::isDepot).collect(Collectors.toList());
        if (depots.isEmpty()) throw new IllegalArgumentException("No se encontró fila DEPOT");
        if (depots.size() > 1) throw new IllegalArgumentException("Hay más de una fila DEPOT: " + depots.size());
        AreaRow d = depots.get(0);
        if (d.a == null || d.b == null) throw new IllegalArgumentException("La fila DEPOT requiere a y b");

        double edgeA = params.edgeDistanceA().doubleValue();
        double edgeB = params.edgeDistanceB().doubleValue();
        return new BinWithDistances(d.a, d.b,
                orDefault(d.edgeLeft, edgeA), orDefault(d.edgeBottom, edgeB),
                orDefault(d.edgeRight, edgeA), orDefault(d.edgeTop, edgeB));
    }

    // expande las filas AREA según qty
    static List<Area> buildAreas(List<AreaRow> rows, DepotParameters params) {
        List<Area> out = new ArrayList<>();
        for (AreaRow r : rows) {
            if (!r.isArea()) continue;
            if (r.areaType == null || r.areaType.isEmpty()) {
                throw new IllegalArgumentException("Fila AREA sin area_type: " + r.entityId);
            }
            if (r.capacity == null) {
                throw new IllegalArgumentException("Fila AREA sin capacity: " + r.entityId);
            }
            AreaType type = AreaType.byCode(r.areaType);
            int qty = (r.qty != null && r.qty > 0) ? r.qty : 1;
            int angle = (r.angle != null) ? r.angle : params.angleDirect();
            for (int i = 0; i < qty; i++) {
                Area area = type.create(r.capacity, params, angle);
                if (r.entityId != null && !r.entityId.isEmpty()) area = area.withLabel(r.entityId);
                out.add(area);
            }
        }
        return out;
    }

    /**
     * Depósito poblado desde una configuración tipo → (capacidad → cantidad de áreas).
     */
    public static BinWithDistances fromConfig(Map<AreaType, Map<Integer, Integer>> config,
                                              double a, double b, DepotParameters params) {
        BinWithDistances depot = new BinWithDistances(RectUtils.dec(a), RectUtils.dec(b), params, true);
        for (Map.Entry<AreaType, Map<Integer, Integer>> e : config.entrySet()) {
            for (Map.Entry<Integer, Integer> c : new TreeMap<>(e.getValue()).entrySet()) {
                for (int i = 0; i < c.getValue(); i++) {
                    depot.items().add(e.getKey().create(c.getKey(), params));
                }
            }
        }
        return depot;
    }

    static double orDefault(Double v, double d) {
        return v == null ? d : v;
    }
}
