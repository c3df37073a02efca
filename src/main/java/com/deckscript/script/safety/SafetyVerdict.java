package com.deckscript.script.safety;

/** Outcome of the static safety check: safe, or rejected with a reason. */
public final class SafetyVerdict {

    private static final SafetyVerdict OK = new SafetyVerdict(true, null);

    private final boolean safe;
    private final String reason;

    private SafetyVerdict(boolean safe, String reason) {
        this.safe = safe;
        this.reason = reason;
    }

    public static SafetyVerdict ok() {
        return OK;
    }

    public static SafetyVerdict reject(String reason) {
        return new SafetyVerdict(false, (reason == null) ? "Unsafe code detected" : reason);
    }

    public boolean isSafe() { return safe; }

    /** Null for a safe verdict. */
    public String reason() { return reason; }

    @Override
    public String toString() {
        return safe ? "safe" : "unsafe: " + reason;
    }
}
