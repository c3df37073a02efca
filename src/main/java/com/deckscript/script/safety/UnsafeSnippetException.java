package com.deckscript.script.safety;

/** Thrown when a snippet fails the static safety check. */
public class UnsafeSnippetException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final SafetyVerdict verdict;

    public UnsafeSnippetException(SafetyVerdict verdict) {
        super("Unsafe code detected: " + verdict.reason());
        this.verdict = verdict;
    }

    public SafetyVerdict verdict() {
        return verdict;
    }
}
