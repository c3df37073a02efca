package com.deckscript.script.dispatch;

/** A call that failed during dispatch: which call, and why. */
public final class DispatchDiagnostic {
    private final int callIndex;
    private final String operation;
    private final String message;

    public DispatchDiagnostic(int callIndex, String operation, String message) {
        this.callIndex = callIndex;
        this.operation = operation;
        this.message = message;
    }

    /** Position of the call record in extraction order. */
    public int callIndex() { return callIndex; }
    public String operation() { return operation; }
    public String message() { return message; }

    @Override
    public String toString() {
        return "#" + callIndex + " " + operation + ": " + message;
    }
}
