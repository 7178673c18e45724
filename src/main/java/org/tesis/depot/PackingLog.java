package org.tesis.depot;

import java.io.File;
import java.io.FileOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/** Logger con timestamp tipo [HH:mm:ss.SSS] */
public final class PackingLog implements AutoCloseable {
    private final PrintStream out;
    private final boolean ownsStream;
    private final DateTimeFormatter fmt = DateTimeFormatter.ofPattern("HH:mm:ss.SSS");

    private PackingLog(PrintStream out, boolean ownsStream) {
        this.out = out;
        this.ownsStream = ownsStream;
    }

    // escribe en un stream ajeno (p. ej. System.out); close() no lo cierra
    public static PackingLog to(PrintStream out) {
        return new PackingLog(out, false);
    }

    public static PackingLog toFile(String path) {
        try {
            File f = new File(path);
            File dir = f.getParentFile();
            if (dir != null) dir.mkdirs();
            PrintStream ps = new PrintStream(new FileOutputStream(f, /*append*/false), true, StandardCharsets.UTF_8);
            return new PackingLog(ps, true);
        } catch (Exception e) {
            throw new RuntimeException("No se pudo abrir el log " + path, e);
        }
    }

    public void log(String msg) {
        String t = "[" + LocalTime.now().format(fmt) + "] ";
        out.println(t + msg);
    }

    public void logf(String pattern, Object... args) {
        log(String.format(Locale.US, pattern, args));
    }

    @Override public void close() {
        out.flush();
        if (ownsStream) out.close();
    }
}
