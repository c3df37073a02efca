package com.deckscript.debug;

/** Pluggable debug output target (stderr, host logger, test collector, etc.). */
public interface DebugSink {
    void log(DebugLevel level, String tag, String message, Throwable error);
}
