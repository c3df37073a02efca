package com.deckscript.script.parser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Variable bindings for one snippet.
 *
 * One root environment is created per snippet. Every loop iteration runs in a private child copy
 * ({@link #childScope(Map)}); after the iteration the parent folds back the child's changes to
 * enclosing variables ({@link #mergeFrom(Environment)}). Loop variables and names declared with
 * let/const/var inside the body stay in the child.
 *
 * Call records hold frozen copies ({@link #snapshot()}) so later statements cannot change what an
 * already-extracted call sees.
 */
public final class Environment {

    private final Map<String, Value> vars;

    // Names owned by this scope only: loop bindings plus body-local declarations.
    private final Set<String> locals = new LinkedHashSet<>();

    private final boolean frozen;

    public Environment() {
        this(new LinkedHashMap<>(), false);
    }

    public Environment(Map<String, Value> initial) {
        this(new LinkedHashMap<>(), false);
        if (initial != null) vars.putAll(initial);
    }

    private Environment(Map<String, Value> vars, boolean frozen) {
        this.vars = vars;
        this.frozen = frozen;
    }

    // -------------------------
    // Vars API
    // -------------------------

    /** let/const/var declaration. Inside a child scope the name becomes local to that scope. */
    public void define(String name, Value value) {
        checkWritable();
        vars.put(name, value);
        locals.add(name);
    }

    /** Plain assignment; an unknown name is created. */
    public void assign(String name, Value value) {
        checkWritable();
        vars.put(name, value);
    }

    /** Returns the bound value, or undefined for an unknown name. */
    public Value get(String name) {
        Value v = vars.get(name);
        return (v == null) ? Value.undefined() : v;
    }

    public boolean exists(String name) {
        return vars.containsKey(name);
    }

    public boolean isFrozen() {
        return frozen;
    }

    // -------------------------
    // Loop scoping
    // -------------------------

    /** Private copy for one loop iteration, with the loop variables bound on top. */
    public Environment childScope(Map<String, Value> loopBindings) {
        Environment child = new Environment(new LinkedHashMap<>(vars), false);
        if (loopBindings != null) {
            for (Map.Entry<String, Value> e : loopBindings.entrySet()) {
                child.define(e.getKey(), e.getValue());
            }
        }
        return child;
    }

    /**
     * Folds a finished iteration back into this scope: every name that already existed here and
     * is not local to the child takes the child's value.
     */
    public void mergeFrom(Environment child) {
        checkWritable();
        for (Map.Entry<String, Value> e : child.vars.entrySet()) {
            String name = e.getKey();
            if (child.locals.contains(name)) continue;
            if (!vars.containsKey(name)) continue;
            vars.put(name, e.getValue());
        }
    }

    /** Frozen copy of the current bindings. */
    public Environment snapshot() {
        return new Environment(new LinkedHashMap<>(vars), true);
    }

    /** Read-only view of the bindings. */
    public Map<String, Value> asMap() {
        return Collections.unmodifiableMap(vars);
    }

    private void checkWritable() {
        if (frozen) throw new IllegalStateException("Environment snapshot is read-only");
    }
}
