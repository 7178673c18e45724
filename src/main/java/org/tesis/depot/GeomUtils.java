package org.tesis.depot;

import org.locationtech.jts.geom.*;
import org.locationtech.jts.geom.util.AffineTransformation;

import java.util.List;

public class GeomUtils {

    static final GeometryFactory GF = new GeometryFactory(new PrecisionModel(PrecisionModel.FLOATING), 0);

    // construye el polígono de un rectángulo; si tiene ángulo, gira alrededor de su esquina (x, y)
    static Polygon toPolygon(Rectangle r, GeometryFactory gf) {
        double x = r.x().doubleValue();
        double y = r.y().doubleValue();
        double w = r.a().doubleValue();
        double h = r.b().doubleValue();
        Coordinate[] c = {
                new Coordinate(x, y),
                new Coordinate(x + w, y),
                new Coordinate(x + w, y + h),
                new Coordinate(x, y + h),
                new Coordinate(x, y)
        };
        Polygon box = gf.createPolygon(gf.createLinearRing(c));
        if (r.angle() % 360 == 0) return box;
        return (Polygon) rotate(box, r.angle(), x, y);
    }

    static Polygon toPolygon(Rectangle r) {
        return toPolygon(r, GF);
    }

    // aplica una rotación antihoraria en grados alrededor de (x, y)
    static Geometry rotate(Geometry g, int angleDeg, double x, double y) {
        AffineTransformation at = AffineTransformation.rotationInstance(Math.toRadians(angleDeg), x, y);
        return at.transform(g);
    }

    // une las plazas de un área en una sola geometría (para chequear que queden dentro de la caja)
    static Geometry slotsUnion(Area area) {
        List<Rectangle> slots = area.slots();
        Polygon[] polys = new Polygon[slots.size()];
        for (int i = 0; i < polys.length; i++) polys[i] = toPolygon(slots.get(i));
        return GF.createMultiPolygon(polys).union();
    }
}
