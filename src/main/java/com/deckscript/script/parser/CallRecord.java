package com.deckscript.script.parser;

import java.util.Collections;
import java.util.List;

/**
 * One extracted, not yet dispatched whitelisted call: its qualified name, the raw top-level
 * argument texts and the frozen environment active where the call appeared.
 */
public final class CallRecord {
    private final String operationName;
    private final List<String> rawArguments;
    private final Environment environment;

    public CallRecord(String operationName, List<String> rawArguments, Environment environment) {
        if (operationName == null) throw new IllegalArgumentException("operationName is null");
        if (environment == null || !environment.isFrozen()) {
            throw new IllegalArgumentException("call records require a frozen environment snapshot");
        }
        this.operationName = operationName;
        this.rawArguments = List.copyOf(rawArguments == null ? Collections.<String>emptyList() : rawArguments);
        this.environment = environment;
    }

    public String operationName() { return operationName; }
    public List<String> rawArguments() { return rawArguments; }
    public Environment environment() { return environment; }

    @Override
    public String toString() {
        return operationName + rawArguments;
    }
}
