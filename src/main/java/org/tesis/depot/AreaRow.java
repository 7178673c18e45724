package org.tesis.depot;

import java.util.Locale;

// una fila del CSV de configuración: DEPOT (tamaño y bordes) o AREA (tipo, capacidad, cantidad)
public class AreaRow {
    String entityType;   // DEPOT | AREA
    String entityId;

    Double a, b;                 // DEPOT
    Double edgeLeft, edgeBottom, edgeRight, edgeTop;   // DEPOT (opcionales)

    String areaType;             // AREA: L | DSR | DSR_90 | DDR
    Integer capacity;            // AREA
    Integer qty;                 // AREA
    Integer angle;               // AREA (opcional, solo filas directas simples)

    static AreaRow fromCsv(String[] h, String[] v) {
        AreaRow r = new AreaRow();
        r.entityType = get(v, idx(h, "entity_type"));
        r.entityId   = getOpt(v, h, "entity_id");

        r.a          = parseNullableDouble(getOpt(v, h, "a"));
        r.b          = parseNullableDouble(getOpt(v, h, "b"));
        r.edgeLeft   = parseNullableDouble(getOpt(v, h, "edge_left"));
        r.edgeBottom = parseNullableDouble(getOpt(v, h, "edge_bottom"));
        r.edgeRight  = parseNullableDouble(getOpt(v, h, "edge_right"));
        r.edgeTop    = parseNullableDouble(getOpt(v, h, "edge_top"));

        r.areaType   = getOpt(v, h, "area_type");
        r.capacity   = parseNullableInt(getOpt(v, h, "capacity"));
        r.qty        = parseNullableInt(getOpt(v, h, "qty"));
        r.angle      = parseNullableInt(getOpt(v, h, "angle"));
        return r;
    }

    boolean isDepot() {
        return "DEPOT".equalsIgnoreCase(entityType);
    }

    boolean isArea() {
        return "AREA".equalsIgnoreCase(entityType);
    }

    // ------------- helpers CSV -------------
    static String[] splitCsv(String s) {
        String[] raw = s.split(",", -1);
        for (int i=0;i<raw.length;i++) raw[i] = raw[i].trim();
        return raw;
    }
    static int idx(String[] h, String name) {
        for (int i=0;i<h.length;i++) if (h[i].equalsIgnoreCase(name)) return i;
        throw new IllegalArgumentException("Cabecera CSV faltante: " + name);
    }
    static int idxOpt(String[] h, String name) {
        for (int i=0;i<h.length;i++) if (h[i].equalsIgnoreCase(name)) return i;
        return -1;
    }
    static String get(String[] v, int idx) {
        if (idx < 0 || idx >= v.length) return "";
        return v[idx];
    }
    static String getOpt(String[] v, String[] h, String name) {
        int i = idxOpt(h, name);
        return i == -1 ? "" : get(v, i);
    }

    // vacío = no informado; texto inválido = error (no se adivinan valores de layout)
    static Integer parseNullableInt(String s) {
        if (s == null || s.isEmpty()) return null;
        try { return Integer.parseInt(s); }
        catch (NumberFormatException e) { throw new IllegalArgumentException("Entero inválido en CSV: " + s, e); }
    }
    static Double parseNullableDouble(String s) {
        if (s == null || s.isEmpty()) return null;
        try { return Double.parseDouble(s.toLowerCase(Locale.ROOT)); }
        catch (NumberFormatException e) { throw new IllegalArgumentException("Número inválido en CSV: " + s, e); }
    }
}
