package com.deckscript.script;

import java.util.Collections;
import java.util.List;

import com.deckscript.script.dispatch.DispatchDiagnostic;
import com.deckscript.script.safety.SafetyVerdict;

/** Outcome of running one snippet. */
public class RunResult {
    private final SafetyVerdict verdict;
    private final int callCount;
    private final List<DispatchDiagnostic> diagnostics;
    private final String error;

    private RunResult(SafetyVerdict verdict, int callCount, List<DispatchDiagnostic> diagnostics, String error) {
        this.verdict = verdict;
        this.callCount = callCount;
        this.diagnostics = diagnostics;
        this.error = error;
    }

    static RunResult completed(SafetyVerdict verdict, int callCount, List<DispatchDiagnostic> diagnostics) {
        return new RunResult(verdict, callCount, List.copyOf(diagnostics), null);
    }

    /** Snippet replaced by an error slide. */
    static RunResult failed(SafetyVerdict verdict, String error) {
        return new RunResult(verdict, 0, Collections.<DispatchDiagnostic>emptyList(), error);
    }

    /** Null when the snippet failed before the safety check ran. */
    public SafetyVerdict verdict() { return verdict; }

    /** Extracted call records, dispatched or not. */
    public int callCount() { return callCount; }

    public List<DispatchDiagnostic> diagnostics() { return diagnostics; }

    public boolean failed() { return error != null; }

    public String error() { return error; }

    @Override
    public String toString() {
        if (failed()) return "RunResult[failed: " + error + "]";
        return "RunResult[calls=" + callCount + ", diagnostics=" + diagnostics.size() + "]";
    }
}
