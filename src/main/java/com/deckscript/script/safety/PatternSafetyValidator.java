package com.deckscript.script.safety;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Fallback check for when no JavaScript parser is available: rejects a snippet if any dangerous
 * pattern appears anywhere in its text, comments and strings included.
 */
public final class PatternSafetyValidator implements SafetyValidator {

    private static final List<Pattern> PATTERNS = List.of(
            Pattern.compile("fetch\\s*\\(", Pattern.CASE_INSENSITIVE),
            Pattern.compile("XMLHttpRequest", Pattern.CASE_INSENSITIVE),
            Pattern.compile("localStorage", Pattern.CASE_INSENSITIVE),
            Pattern.compile("sessionStorage", Pattern.CASE_INSENSITIVE),
            Pattern.compile("indexedDB", Pattern.CASE_INSENSITIVE),
            Pattern.compile("chrome\\.storage", Pattern.CASE_INSENSITIVE),
            Pattern.compile("document\\.cookie", Pattern.CASE_INSENSITIVE),
            Pattern.compile("navigator\\.clipboard", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\beval\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("new\\s+Function", Pattern.CASE_INSENSITIVE),
            // case-sensitive: "function (" callbacks are fine
            Pattern.compile("\\bFunction\\s*\\("),
            Pattern.compile("importScripts", Pattern.CASE_INSENSITIVE),
            Pattern.compile("WebSocket", Pattern.CASE_INSENSITIVE));

    @Override
    public SafetyVerdict check(String code) {
        String text = (code == null) ? "" : code;
        for (Pattern p : PATTERNS) {
            if (p.matcher(text).find()) return SafetyVerdict.reject("Disallowed pattern: " + p.pattern());
        }
        return SafetyVerdict.ok();
    }
}
