package org.tesis.depot;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.List;


public class DepotPacking {

    public static void main(String[] args) throws Exception {
        //Acá se puede cambiar el nombre del svg resultante.
        String inputCsv  = "input/depot.csv";
        String outputDir = "out";
        String outputSvg = outputDir + "/salidaDepot.svg";
        String preset    = "SB";

        if (args.length >= 1) inputCsv = args[0];
        if (args.length >= 2) outputSvg = args[1];
        if (args.length >= 3) preset = args[2];

        new File(outputDir).mkdirs();
        DepotParameters params = DepotParameters.byCode(preset);

        // 1) Leer CSV
        List<AreaRow> rows = AreaConfigReader.readCsv(inputCsv);

        // 2) Armar depósito y áreas
        BinWithDistances depot = LayoutConfig.buildDepot(rows, params);
        List<Area> areas = LayoutConfig.buildAreas(rows, params);
        if (areas.isEmpty()) throw new IllegalStateException("No se encontraron AREA en " + inputCsv);
        depot.items().addAll(areas);

        // 3) Empaquetar con log
        PackingReport report;
        try (PackingLog log = PackingLog.toFile(outputDir + "/LogDepotPacking.log")) {
            depot.setLog(log);
            long t0 = System.currentTimeMillis();
            depot.pack();
            report = PackingReport.of(depot, System.currentTimeMillis() - t0);
            log.log(report.formatResumen());
        }

        // 4) Exportar SVG
        String svg = SvgWriter.toSVG(depot, LayoutRenderer.render(depot, true, PlotLanguage.EN),
                "Depot " + depot.a().toPlainString() + " x " + depot.b().toPlainString());
        File parent = new File(outputSvg).getAbsoluteFile().getParentFile();
        if (parent != null) parent.mkdirs();
        try (Writer w = new OutputStreamWriter(new FileOutputStream(outputSvg), StandardCharsets.UTF_8)) {
            w.write(svg);
        }
        System.out.println(report.formatResumen());
        System.err.println("SVG generado en: " + outputSvg);
    }
}
