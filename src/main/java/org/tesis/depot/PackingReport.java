package org.tesis.depot;

import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/* Resultado mínimo para el resumen de un empaquetado. */
public final class PackingReport {
    String binType;
    int areasAColocar;
    int areasColocadas;
    int plazas;
    double areaColocada;
    double areaBin;
    double areaDesperdiciada;
    Boolean feasible;
    long tiempoMs;

    // función que arma el resumen a partir de un bin ya empaquetado
    public static PackingReport of(Bin bin, long tiempoMs) {
        PackingReport r = new PackingReport();
        r.binType = bin.getClass().getSimpleName();
        r.areasAColocar = bin.items().size();
        r.areasColocadas = bin.packedItems().size();
        r.plazas = bin.countInner();
        double used = 0.0;
        for (Area p : bin.packedItems()) used += p.area().doubleValue();
        r.areaColocada = used;
        r.areaBin = bin.area().doubleValue();
        r.areaDesperdiciada = r.areaBin - used;
        r.feasible = bin.feasible();
        r.tiempoMs = tiempoMs;
        return r;
    }

    public int areasAColocar()   { return areasAColocar; }
    public int areasColocadas()  { return areasColocadas; }
    public int plazas()          { return plazas; }
    public double areaColocada() { return areaColocada; }
    public double areaBin()      { return areaBin; }
    public Boolean feasible()    { return feasible; }

    public double utilPct() {
        return (areaBin > 0) ? (areaColocada / areaBin) * 100.0 : 0.0;
    }

    public String formatResumen() {
        // Números con miles y 3 decimales, estilo 1,468,792.762
        DecimalFormatSymbols sym = new DecimalFormatSymbols(Locale.US);
        DecimalFormat f3 = new DecimalFormat("#,##0.000", sym);
        DecimalFormat f0 = new DecimalFormat("#,##0", sym);

        String tiempoMsFmt = f0.format(tiempoMs);
        String tiempoSegFmt = f3.format(tiempoMs / 1000.0);
        String factible = (feasible == null) ? "sin empaquetar" : (feasible ? "sí" : "no");

        DateTimeFormatter fmt = DateTimeFormatter.ofPattern("HH:mm:ss.SSS");
        String now = "[" + LocalTime.now().format(fmt) + "] ";
        StringBuilder sb = new StringBuilder();
        sb.append(now).append("------------------------------\n");
        sb.append(now).append("RESUMEN FINAL (").append(binType).append(")\n");
        sb.append(now).append("Áreas a posicionar : ").append(areasAColocar).append("\n");
        sb.append(now).append("Áreas colocadas    : ").append(areasColocadas).append("\n");
        sb.append(now).append("Factible           : ").append(factible).append("\n");
        sb.append(now).append("Plazas             : ").append(plazas).append("\n");
        sb.append(now).append("% aprovechamiento  : ").append(f3.format(utilPct())).append(" %\n");
        sb.append(now).append("Área colocada      : ").append(f3.format(areaColocada)).append("\n");
        sb.append(now).append("Área bin           : ").append(f3.format(areaBin)).append("\n");
        sb.append(now).append("Área desperdiciada : ").append(f3.format(areaDesperdiciada)).append("\n");
        sb.append(now).append("Tiempo total       : ").append(tiempoMsFmt).append(" ms (").append(tiempoSegFmt).append(" s)\n");
        sb.append(now).append("------------------------------");
        return sb.toString();
    }
}
