package com.deckscript.debug;

/** Severity attached to every debug record. */
public enum DebugLevel {
    TRACE,
    DEBUG,
    INFO,
    WARN,
    ERROR
}
