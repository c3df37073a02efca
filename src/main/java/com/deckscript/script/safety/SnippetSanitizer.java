package com.deckscript.script.safety;

import java.util.regex.Pattern;

/**
 * Line pre-filter applied to generated snippets: drops lines that construct the presentation or
 * write it out, since the host owns both.
 */
public final class SnippetSanitizer {

    private static final Pattern CONSTRUCTION = Pattern.compile("new\\s+PptxGenJS\\b");
    private static final Pattern WRITE = Pattern.compile("pptx\\.write(File)?\\b");

    private SnippetSanitizer() {}

    public static String stripConstructionLines(String code) {
        if (code == null) return "";
        StringBuilder out = new StringBuilder(code.length());
        boolean first = true;
        for (String line : code.split("\n", -1)) {
            String t = line.trim();
            if (CONSTRUCTION.matcher(t).find() || WRITE.matcher(t).find()) continue;
            if (!first) out.append('\n');
            out.append(line);
            first = false;
        }
        return out.toString();
    }
}
