package org.tesis.depot;

import org.locationtech.jts.geom.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

class SvgWriter {

    static String toSVG(Bin bin, List<DrawnShape> shapes, String title) {
        double w = bin.a().doubleValue(), h = bin.b().doubleValue();

        StringBuilder sb = new StringBuilder();
        sb.append("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n");
        sb.append("<svg xmlns=\"http://www.w3.org/2000/svg\" width=\"").append(fmt(w))
          .append("\" height=\"").append(fmt(h)).append("\" viewBox=\"0 0 ")
          .append(fmt(w)).append(" ").append(fmt(h)).append("\">\n");
        appendFrame(sb, shapes, title, 0.0, h);
        sb.append("</svg>\n");
        return sb.toString();
    }

    // todos los pasos del historial apilados verticalmente en un solo SVG
    static String toSVGFrames(Bin bin, PlotLanguage lang) {
        int total = bin.history().size();
        double w = bin.a().doubleValue(), h = bin.b().doubleValue();
        double gap = Math.max(1.0, h * 0.1);
        double fullH = total * h + Math.max(0, total - 1) * gap;

        StringBuilder sb = new StringBuilder();
        sb.append("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n");
        sb.append("<svg xmlns=\"http://www.w3.org/2000/svg\" width=\"").append(fmt(w))
          .append("\" height=\"").append(fmt(fullH)).append("\" viewBox=\"0 0 ")
          .append(fmt(w)).append(" ").append(fmt(fullH)).append("\">\n");
        for (int step = 0; step < total; step++) {
            List<DrawnShape> shapes = LayoutRenderer.renderStep(bin, step, lang);
            double offsetY = step * (h + gap);
            appendFrame(sb, shapes, lang.stepTitle(step, total - 1), offsetY, h);
        }
        sb.append("</svg>\n");
        return sb.toString();
    }

    // un cuadro: fondo blanco y grupo invertido en Y (SVG tiene Y hacia abajo)
    static void appendFrame(StringBuilder sb, List<DrawnShape> shapes, String title, double offsetY, double h) {
        sb.append("  <g>\n");
        if (title != null && !title.isEmpty()) {
            sb.append("    <title>").append(escape(title)).append("</title>\n");
        }
        sb.append("    <rect x=\"0\" y=\"").append(fmt(offsetY)).append("\" width=\"100%\" height=\"")
          .append(fmt(h)).append("\" fill=\"white\"/>\n");
        sb.append("    <g transform=\"translate(0,").append(fmt(offsetY + h)).append(") scale(1,-1)\">\n");

        // orden de dibujo: bin, bordes, libres, distancias, áreas, plazas
        for (DrawnShape.Kind kind : DrawnShape.Kind.values()) {
            for (DrawnShape s : byKind(shapes, kind)) {
                emitGeometryAsSvgPaths(sb, s.geometry, s);
            }
        }
        sb.append("    </g>\n  </g>\n");
    }

    static List<DrawnShape> byKind(List<DrawnShape> shapes, DrawnShape.Kind kind) {
        List<DrawnShape> out = new ArrayList<>();
        for (DrawnShape s : shapes) if (s.kind == kind) out.add(s);
        return out;
    }

    // ---------- helpers de dibujo ----------

    static void emitGeometryAsSvgPaths(StringBuilder sb, Geometry g, DrawnShape meta) {
        if (g instanceof Polygon) {
            emitPolygon(sb, (Polygon) g, meta);
        } else if (g instanceof GeometryCollection) {
            GeometryCollection gc = (GeometryCollection) g;
            for (int i = 0; i < gc.getNumGeometries(); i++) {
                emitGeometryAsSvgPaths(sb, gc.getGeometryN(i), meta);
            }
        }
    }

    static void emitPolygon(StringBuilder sb, Polygon poly, DrawnShape meta) {
        sb.append("      <path d=\"").append(pathFor(poly)).append("\" ").append(style(meta.kind)).append(">\n");
        if (meta.label != null && !meta.label.isEmpty()) {
            sb.append("        <title>").append(escape(meta.label));
            if (meta.angleDeg != 0) sb.append(" | θ=").append(meta.angleDeg).append("°");
            sb.append("</title>\n");
        }
        sb.append("      </path>\n");
    }

    static String style(DrawnShape.Kind kind) {
        switch (kind) {
            case BIN:
                return "fill=\"#f0f0f0\" stroke=\"#333\" stroke-width=\"0.5\"";
            case EDGE_CLEARANCE:
                return "fill=\"#d9d9d9\" fill-opacity=\"0.6\" stroke=\"none\"";
            case AVAILABLE:
                return "fill=\"none\" stroke=\"#31a354\" stroke-width=\"0.3\" stroke-dasharray=\"1,1\"";
            case BUFFER:
                return "fill=\"#fdd0a2\" fill-opacity=\"0.5\" stroke=\"#fd8d3c\" stroke-width=\"0.2\"";
            case ITEM:
                return "fill=\"#6baed6\" fill-opacity=\"0.35\" stroke=\"#111\" stroke-width=\"0.4\"";
            case SLOT:
                return "fill=\"#9ecae1\" fill-opacity=\"0.85\" stroke=\"#111\" stroke-width=\"0.2\"";
            default:
                throw new IllegalArgumentException("Tipo de figura desconocido: " + kind);
        }
    }

    // Genera el atributo "d" de un path SVG a partir de un Polygon (exterior + huecos)
    static String pathFor(Polygon poly) {
        StringBuilder sb = new StringBuilder();
        appendLineString(sb, poly.getExteriorRing());
        for (int i = 0; i < poly.getNumInteriorRing(); i++) {
            appendLineString(sb, poly.getInteriorRingN(i));
        }
        return sb.toString();
    }

    // Agrega comandos M/L/Z para una LineString cerrada
    static void appendLineString(StringBuilder sb, LineString ls) {
        Coordinate[] c = ls.getCoordinates();
        if (c.length == 0) return;
        sb.append("M ").append(fmt(c[0].x)).append(" ").append(fmt(c[0].y)).append(" ");
        for (int i = 1; i < c.length; i++) {
            sb.append("L ").append(fmt(c[i].x)).append(" ").append(fmt(c[i].y)).append(" ");
        }
        sb.append("Z ");
    }

    static String escape(String s) {
        return s.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
    }

    static String fmt(double d) {
        return String.format(Locale.US, "%.3f", d);
    }
}
