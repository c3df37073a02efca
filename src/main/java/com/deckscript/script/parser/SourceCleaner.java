package com.deckscript.script.parser;

/**
 * Strips comments and carriage returns from snippet text before extraction.
 *
 * String literals are copied verbatim, so "https://..." inside quotes survives. A line comment
 * is replaced by the newline that ends it; an unterminated block comment swallows the rest of
 * the text.
 */
public final class SourceCleaner {

    private SourceCleaner() {}

    public static String clean(String source) {
        return stripComments(source).replace("\r", "");
    }

    public static String stripComments(String source) {
        if (source == null) return "";
        StringBuilder out = new StringBuilder(source.length());
        char quote = 0;
        boolean escaped = false;

        for (int i = 0; i < source.length(); i++) {
            char ch = source.charAt(i);
            char next = (i + 1 < source.length()) ? source.charAt(i + 1) : '\0';

            if (quote != 0) {
                out.append(ch);
                if (escaped) {
                    escaped = false;
                } else if (ch == '\\') {
                    escaped = true;
                } else if (ch == quote) {
                    quote = 0;
                }
                continue;
            }

            if (DelimiterScanner.isQuote(ch)) {
                quote = ch;
                out.append(ch);
                continue;
            }
            if (ch == '/' && next == '*') {
                int end = source.indexOf("*/", i + 2);
                if (end < 0) break;
                i = end + 1;
                continue;
            }
            if (ch == '/' && next == '/') {
                int end = source.indexOf('\n', i + 2);
                if (end < 0) break;
                out.append('\n');
                i = end;
                continue;
            }
            out.append(ch);
        }
        return out.toString();
    }
}
