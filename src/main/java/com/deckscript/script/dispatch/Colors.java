package com.deckscript.script.dispatch;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Color normalization to the backend's upper-case 6-digit hex form.
 *
 * Accepts #RRGGBB, RRGGBB, #RGB, RGB, rgb(r,g,b) and rgba(r,g,b,a). The alpha channel is
 * discarded and channels are clamped to 0..255. Normalizing an already normalized color returns it
 * unchanged.
 */
public final class Colors {

    private static final Pattern HEX3 = Pattern.compile("^[0-9a-fA-F]{3}$");
    private static final Pattern HEX6 = Pattern.compile("^[0-9a-fA-F]{6}$");
    private static final Pattern RGB =
            Pattern.compile("^rgba?\\((\\d+),\\s*(\\d+),\\s*(\\d+)(?:,\\s*([\\d.]+))?\\)$", Pattern.CASE_INSENSITIVE);

    private Colors() {}

    /** Normalized hex, or null when {@code color} is not a recognizable color string. */
    public static String normalize(String color) {
        if (color == null) return null;
        String s = color.trim();
        if (s.startsWith("#")) s = s.substring(1);
        if (HEX3.matcher(s).matches()) {
            StringBuilder sb = new StringBuilder(6);
            for (char ch : s.toCharArray()) sb.append(ch).append(ch);
            s = sb.toString();
        }
        Matcher rgb = RGB.matcher(s);
        if (rgb.matches()) {
            s = channel(rgb.group(1)) + channel(rgb.group(2)) + channel(rgb.group(3));
        }
        return HEX6.matcher(s).matches() ? s.toUpperCase(Locale.ROOT) : null;
    }

    /** Non-string nodes are not colors. */
    public static String normalize(JsonNode color) {
        if (color == null || !color.isTextual()) return null;
        return normalize(color.asText());
    }

    public static String normalizeOrDefault(JsonNode color, String fallback) {
        String c = normalize(color);
        return (c == null) ? fallback : c;
    }

    public static String normalizeOrDefault(String color, String fallback) {
        String c = normalize(color);
        return (c == null) ? fallback : c;
    }

    private static String channel(String digits) {
        int n;
        try {
            n = Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            n = 255;
        }
        n = Math.max(0, Math.min(255, n));
        return String.format(Locale.ROOT, "%02x", n);
    }
}
