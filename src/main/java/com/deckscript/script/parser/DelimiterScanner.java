package com.deckscript.script.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Bracket and argument-list scanning over raw snippet text.
 *
 * All routines honor quoted strings ('...', "...", `...`) with backslash escapes, so delimiters
 * and commas inside string literals never count. Malformed input fails closed with a
 * {@link SnippetSyntaxException} instead of returning a span that crosses an unmatched quote or
 * bracket.
 */
public final class DelimiterScanner {

    private DelimiterScanner() {}

    /** Region between an opening delimiter and its matching closer. */
    public static final class Span {
        /** Index of the opening delimiter. */
        public final int open;
        /** Index of the matching closing delimiter. */
        public final int close;
        /** Text strictly between the two delimiters. */
        public final String content;

        Span(int open, int close, String content) {
            this.open = open;
            this.close = close;
            this.content = content;
        }
    }

    /**
     * Finds the closer matching the delimiter at {@code openIndex}. Only delimiters of the same
     * kind are counted for nesting.
     */
    public static Span readEnclosed(String source, int openIndex) {
        if (source == null || openIndex < 0 || openIndex >= source.length()) {
            throw SnippetSyntaxException.unbalanced("no opening delimiter at index " + openIndex);
        }
        char open = source.charAt(openIndex);
        char close = closerFor(open);
        if (close == 0) {
            throw SnippetSyntaxException.unbalanced("'" + open + "' is not an opening delimiter");
        }

        int depth = 0;
        for (int i = openIndex; i < source.length(); i++) {
            char ch = source.charAt(i);
            if (isQuote(ch)) {
                i = skipString(source, i);
                continue;
            }
            if (ch == open) {
                depth++;
            } else if (ch == close) {
                depth--;
                if (depth == 0) {
                    return new Span(openIndex, i, source.substring(openIndex + 1, i));
                }
            }
        }
        throw SnippetSyntaxException.unbalanced("missing '" + close + "' for '" + open + "' at index " + openIndex);
    }

    /**
     * Splits {@code text} on separators that are not nested in strings, brackets, braces or
     * parentheses. Items are trimmed; a trailing empty item is dropped.
     */
    public static List<String> splitTopLevel(String text, char separator) {
        List<String> out = new ArrayList<>();
        if (text == null) return out;

        int depth = 0;
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (isQuote(ch)) {
                i = skipString(text, i);
                continue;
            }
            if (ch == '(' || ch == '[' || ch == '{') {
                depth++;
            } else if (ch == ')' || ch == ']' || ch == '}') {
                depth--;
                if (depth < 0) throw SnippetSyntaxException.unbalanced("unexpected '" + ch + "' at index " + i);
            } else if (ch == separator && depth == 0) {
                out.add(text.substring(start, i).trim());
                start = i + 1;
            }
        }
        if (depth != 0) throw SnippetSyntaxException.unbalanced("unclosed bracket in argument list");

        String last = text.substring(start).trim();
        if (!last.isEmpty()) out.add(last);
        return out;
    }

    /**
     * Index of the first occurrence of {@code target} at nesting depth zero, starting at
     * {@code from}, or -1. Scanning stops (returning -1) when a closer drops below depth zero.
     */
    public static int findTopLevel(String text, int from, char target) {
        int depth = 0;
        for (int i = Math.max(0, from); i < text.length(); i++) {
            char ch = text.charAt(i);
            if (depth == 0 && ch == target) return i;
            if (isQuote(ch)) {
                i = skipString(text, i);
                continue;
            }
            if (ch == '(' || ch == '[' || ch == '{') {
                depth++;
            } else if (ch == ')' || ch == ']' || ch == '}') {
                depth--;
                if (depth < 0) return -1;
            }
        }
        return -1;
    }

    /** Returns the index of the quote closing the string literal opened at {@code quoteIndex}. */
    public static int skipString(String text, int quoteIndex) {
        char quote = text.charAt(quoteIndex);
        boolean escaped = false;
        for (int i = quoteIndex + 1; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (escaped) {
                escaped = false;
            } else if (ch == '\\') {
                escaped = true;
            } else if (ch == quote) {
                return i;
            }
        }
        throw SnippetSyntaxException.unbalanced("unterminated string starting at index " + quoteIndex);
    }

    /** True when {@code index} falls inside (or on the opening quote of) a string literal. */
    public static boolean isInsideString(String text, int index) {
        for (int i = 0; i < text.length() && i <= index; i++) {
            if (isQuote(text.charAt(i))) {
                int end;
                try {
                    end = skipString(text, i);
                } catch (SnippetSyntaxException e) {
                    return true;
                }
                if (index <= end) return true;
                i = end;
            }
        }
        return false;
    }

    /** True when the whole of {@code text} is exactly one string literal. */
    public static boolean isSingleStringLiteral(String text) {
        if (text.length() < 2 || !isQuote(text.charAt(0))) return false;
        try {
            return skipString(text, 0) == text.length() - 1;
        } catch (SnippetSyntaxException e) {
            return false;
        }
    }

    /** True when the delimiter at index 0 is closed exactly at the last character. */
    public static boolean isWhollyEnclosed(String text) {
        if (text.isEmpty() || closerFor(text.charAt(0)) == 0) return false;
        try {
            return readEnclosed(text, 0).close == text.length() - 1;
        } catch (SnippetSyntaxException e) {
            return false;
        }
    }

    static boolean isQuote(char ch) {
        return ch == '"' || ch == '\'' || ch == '`';
    }

    private static char closerFor(char open) {
        switch (open) {
            case '(': return ')';
            case '[': return ']';
            case '{': return '}';
            default: return 0;
        }
    }
}
