package com.deckscript.script.deck;

/** Shapes a snippet may draw. Anything else is skipped by the dispatcher. */
public enum ShapeType {
    RECT("rect"),
    ROUND_RECT("roundRect"),
    ELLIPSE("ellipse"),
    LINE("line");

    private final String backendName;

    ShapeType(String backendName) {
        this.backendName = backendName;
    }

    public String backendName() {
        return backendName;
    }

    /** Exact backend-name lookup; null when the name is not an allowed shape. */
    public static ShapeType fromName(String name) {
        if (name == null) return null;
        for (ShapeType t : values()) {
            if (t.backendName.equals(name)) return t;
        }
        return null;
    }
}
