package com.deckscript.script.parser;

/**
 * Raised by the delimiter scanner and the expression evaluator when snippet text is malformed
 * ("Unbalanced delimiters") or outside the supported grammar ("Unsupported expression").
 *
 * Statement-level callers catch it and skip the offending statement.
 */
public class SnippetSyntaxException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public SnippetSyntaxException(String message) {
        super(message);
    }

    public SnippetSyntaxException(String message, Throwable cause) {
        super(message, cause);
    }

    public static SnippetSyntaxException unsupported(String text) {
        return new SnippetSyntaxException("Unsupported expression: " + text);
    }

    public static SnippetSyntaxException unbalanced(String detail) {
        return new SnippetSyntaxException("Unbalanced delimiters: " + detail);
    }
}
