package org.tesis.depot;

// textos de los dibujos; el idioma se pasa explícito a cada llamada
public enum PlotLanguage {
    EN("Step", "av", "no."),
    DE("Schritt", "V", "Nr.");

    private final String step;
    private final String available;
    private final String number;

    PlotLanguage(String step, String available, String number) {
        this.step = step;
        this.available = available;
        this.number = number;
    }

    public String step()      { return step; }
    public String available() { return available; }
    public String number()    { return number; }

    public String stepTitle(int step, int total) {
        return this.step + " " + step + "/" + total;
    }

    // etiqueta de un libre, p. ej. "av 3"
    public String availableLabel(int index) {
        return available + " " + index;
    }
}
