package org.tesis.depot;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

public class AreaConfigReader {

    // función para leer un CSV de configuración y devolver sus filas
    static List<AreaRow> readCsv(String path) throws IOException {
        try (InputStream in = new FileInputStream(path)) {
            return readCsv(in, path);
        }
    }

    static List<AreaRow> readCsv(InputStream in, String name) throws IOException {
        List<AreaRow> out = new ArrayList<>();
        BufferedReader br = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        String header = br.readLine();
        if (header == null) throw new IOException("CSV vacío: " + name);
        String[] h = AreaRow.splitCsv(header);
        String line;
        while ((line = br.readLine()) != null) {
            if (line.trim().isEmpty() || line.trim().startsWith("#")) continue;
            String[] v = AreaRow.splitCsv(line);
            out.add(AreaRow.fromCsv(h, v));
        }
        return out;
    }
}
