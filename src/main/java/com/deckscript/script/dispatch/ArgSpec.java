package com.deckscript.script.dispatch;

/** Expected shape of one positional argument of a whitelisted operation. */
public final class ArgSpec {

    public enum Kind {
        /** A plain object literal; arrays and null are refused. */
        OBJECT_REQUIRED,
        /** An object literal, or nothing. */
        OBJECT_OPTIONAL,
        /** Any evaluated value. */
        ANY,
        /** A backend constant name such as pptx.ChartType.bar. */
        ENUMERATED
    }

    private final Kind kind;
    private final boolean required;

    private ArgSpec(Kind kind, boolean required) {
        this.kind = kind;
        this.required = required;
    }

    public static ArgSpec objectRequired() { return new ArgSpec(Kind.OBJECT_REQUIRED, true); }
    public static ArgSpec objectOptional() { return new ArgSpec(Kind.OBJECT_OPTIONAL, false); }
    public static ArgSpec any() { return new ArgSpec(Kind.ANY, true); }
    public static ArgSpec anyOptional() { return new ArgSpec(Kind.ANY, false); }
    public static ArgSpec enumerated() { return new ArgSpec(Kind.ENUMERATED, true); }

    public Kind kind() { return kind; }
    public boolean isRequired() { return required; }

    @Override
    public String toString() {
        return kind + (required ? "" : "?");
    }
}
