package org.tesis.depot;

import org.locationtech.jts.geom.Geometry;

// figura lista para dibujar
public class DrawnShape {

    enum Kind { BIN, ITEM, SLOT, BUFFER, EDGE_CLEARANCE, AVAILABLE }

    Kind     kind;
    Geometry geometry;   // Polygon, rotado en el caso de las plazas
    String   label;
    int      angleDeg;

    DrawnShape(Kind kind, Geometry geometry, String label, int angleDeg) {
        this.kind = kind;
        this.geometry = geometry;
        this.label = label;
        this.angleDeg = angleDeg;
    }
}
