package org.tesis.depot;

// forma interna de un área: cómo se ordenan sus plazas dentro de la caja envolvente
public enum AreaShape {
    STACKED(1),
    ROTATABLE_ROW(1),
    ROTATED_DOUBLE_ROW(2);

    final int minCount;

    AreaShape(int minCount) {
        this.minCount = minCount;
    }

    public int minCount() {
        return minCount;
    }
}
