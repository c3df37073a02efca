package com.deckscript.debug;

import java.io.PrintStream;

/**
 * Writes debug records as single lines to a print stream (stderr for the CLI).
 * Records below the configured level are dropped.
 */
public final class ConsoleDebugSink implements DebugSink {

    private final PrintStream out;
    private final DebugLevel minLevel;

    public ConsoleDebugSink(PrintStream out, DebugLevel minLevel) {
        if (out == null) throw new IllegalArgumentException("out is null");
        this.out = out;
        this.minLevel = (minLevel == null) ? DebugLevel.INFO : minLevel;
    }

    @Override
    public void log(DebugLevel level, String tag, String message, Throwable error) {
        if (level.ordinal() < minLevel.ordinal()) return;
        out.println("[" + level + "][" + tag + "] " + message);
        if (error != null) {
            out.println("    " + error);
        }
    }
}
