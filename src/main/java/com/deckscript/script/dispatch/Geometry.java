package com.deckscript.script.dispatch;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Converts x / y / w / h to absolute inches. Numbers and numeric strings pass through; "NN%" is
 * taken relative to the slide width (x, w) or height (y, h). A field that cannot be read as a
 * number is removed. Boxes may extend beyond the slide.
 */
public final class Geometry {

    private static final Pattern LEADING_NUMBER = Pattern.compile("^[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private Geometry() {}

    public static void normalizeBox(ObjectNode opts, double slideW, double slideH) {
        if (opts == null) return;
        normalizeField(opts, "x", slideW);
        normalizeField(opts, "y", slideH);
        normalizeField(opts, "w", slideW);
        normalizeField(opts, "h", slideH);
    }

    private static void normalizeField(ObjectNode opts, String key, double axis) {
        if (!opts.has(key)) return;
        Double inches = toInches(opts.get(key), axis);
        if (inches == null) opts.remove(key);
        else opts.put(key, inches);
    }

    /** Inches for one geometry value, or null when it is not numeric. */
    public static Double toInches(JsonNode v, double axis) {
        if (v == null) return null;
        if (v.isNumber()) {
            double d = v.asDouble();
            return Double.isFinite(d) ? d : null;
        }
        if (!v.isTextual()) return null;

        String s = v.asText().trim();
        if (s.endsWith("%")) {
            Matcher m = LEADING_NUMBER.matcher(s);
            if (!m.find()) return null;
            return Double.parseDouble(m.group()) / 100.0 * axis;
        }
        // Whole-string match only: Java spellings such as "1d" or "0x1p3" are not numerals here.
        Matcher m = LEADING_NUMBER.matcher(s);
        if (!m.find() || m.end() != s.length()) return null;
        double d = Double.parseDouble(s);
        return Double.isFinite(d) ? d : null;
    }
}
