package org.tesis.depot;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

// fotos del estado del bin tras cada colocación (la 0 es el bin vacío)
public final class PackingHistory {

    public static final class Step {
        final List<Area> packed;
        final List<Rectangle> availables;

        Step(List<Area> packed, List<Rectangle> availables) {
            this.packed = Collections.unmodifiableList(new ArrayList<>(packed));
            this.availables = Collections.unmodifiableList(new ArrayList<>(availables));
        }

        public List<Area> packed()          { return packed; }
        public List<Rectangle> availables() { return availables; }
    }

    private final List<Step> steps = new ArrayList<>();

    void record(List<Area> packed, List<Rectangle> availables) {
        steps.add(new Step(packed, availables));
    }

    void clear() {
        steps.clear();
    }

    public List<Step> steps() {
        return Collections.unmodifiableList(steps);
    }

    public int size() {
        return steps.size();
    }

    public boolean isEmpty() {
        return steps.isEmpty();
    }

    public Step get(int index) {
        return steps.get(index);
    }
}
