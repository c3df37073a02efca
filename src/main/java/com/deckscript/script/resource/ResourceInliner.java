package com.deckscript.script.resource;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Replaces literal {@code chrome.runtime.getURL('path?color=..')} calls in snippet text with quoted
 * data URLs, so the snippet no longer mentions chrome.* by the time it is validated.
 */
public final class ResourceInliner {

    private static final Pattern GET_URL =
            Pattern.compile("chrome\\.runtime\\.getURL\\(\\s*(['\"])([^'\"\\)]+)\\1\\s*\\)");

    private final IconLoader icons;

    public ResourceInliner(IconLoader icons) {
        if (icons == null) throw new IllegalArgumentException("icons is null");
        this.icons = icons;
    }

    public String inline(String code) {
        if (code == null) return "";
        Matcher m = GET_URL.matcher(code);
        StringBuilder out = new StringBuilder(code.length());
        int last = 0;
        while (m.find()) {
            out.append(code, last, m.start());
            String replacement = icons.inlineIcon(m.group(2));
            if (replacement == null) {
                out.append(m.group());
            } else {
                out.append('\'').append(replacement.replace("\\", "\\\\").replace("'", "\\'")).append('\'');
            }
            last = m.end();
        }
        out.append(code, last, code.length());
        return out.toString();
    }
}
