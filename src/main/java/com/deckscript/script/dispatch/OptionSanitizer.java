package com.deckscript.script.dispatch;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Per-operation cleanup of option objects before they reach the backend: default fonts, color
 * normalization, and removal of partial fill / line objects the backend would choke on.
 * All methods mutate the given nodes in place.
 */
public final class OptionSanitizer {

    private static final String[] GRID_LINES = { "gridLine", "catGridLine", "valGridLine" };
    private static final String[] CHART_COLOR_PROPS = {
            "fill", "catAxisLabelColor", "catAxisLineColor", "valAxisLabelColor",
            "valAxisLineColor", "valAxisTitleColor", "dataLabelColor"
    };

    private final String defaultFontFace;

    public OptionSanitizer(String defaultFontFace) {
        this.defaultFontFace = defaultFontFace;
    }

    public String defaultFontFace() {
        return defaultFontFace;
    }

    // -------------------------
    // Text
    // -------------------------

    public void textOptions(ObjectNode opts) {
        if (opts == null) return;
        defaultFont(opts, "fontFace");
        if (opts.has("color")) {
            opts.put("color", Colors.normalizeOrDefault(opts.get("color"), "000000"));
        }
        JsonNode fill = opts.get("fill");
        if (fill instanceof ObjectNode && fill.has("color")) {
            ((ObjectNode) fill).put("color", Colors.normalizeOrDefault(fill.get("color"), "FFFFFF"));
        }
    }

    /** Text-run arrays: every run's options get the same treatment as top-level text options. */
    public void textRuns(JsonNode text) {
        if (text == null || !text.isArray()) return;
        for (JsonNode run : text) {
            JsonNode options = run.get("options");
            if (options instanceof ObjectNode) textOptions((ObjectNode) options);
        }
    }

    // -------------------------
    // Shapes
    // -------------------------

    public void shapeOptions(ObjectNode opts) {
        if (opts == null) return;
        JsonNode fill = opts.get("fill");
        if (fill instanceof ObjectNode) {
            if (fill.has("color")) {
                ((ObjectNode) fill).put("color", Colors.normalizeOrDefault(fill.get("color"), "FFFFFF"));
            } else {
                opts.remove("fill");
            }
        }
        JsonNode line = opts.get("line");
        if (line instanceof ObjectNode) {
            if (line.has("color")) {
                ((ObjectNode) line).put("color", Colors.normalizeOrDefault(line.get("color"), "000000"));
            } else if (!line.has("width")) {
                opts.remove("line");
            }
        }
    }

    // -------------------------
    // Tables
    // -------------------------

    /** Copy of {@code rows} with null cells replaced by empty text cells. Non-arrays are returned as is. */
    public JsonNode tableRows(JsonNode rows) {
        if (rows == null || !rows.isArray()) return rows;
        JsonNodeFactory nodes = JsonNodeFactory.instance;
        ArrayNode out = nodes.arrayNode();
        for (JsonNode row : rows) {
            if (!row.isArray()) {
                out.add(row.deepCopy());
                continue;
            }
            ArrayNode cells = out.addArray();
            for (JsonNode cell : row) {
                if (cell.isNull()) {
                    ObjectNode empty = cells.addObject();
                    empty.put("text", "");
                    empty.putObject("options");
                } else {
                    cells.add(cell.deepCopy());
                }
            }
        }
        return out;
    }

    public void tableOptions(ObjectNode opts) {
        if (opts == null) return;
        defaultFont(opts, "fontFace");
    }

    // -------------------------
    // Charts
    // -------------------------

    public void chartOptions(ObjectNode opts) {
        if (opts == null) return;
        defaultFont(opts, "titleFontFace");
        defaultFont(opts, "legendFontFace");

        for (String key : GRID_LINES) {
            JsonNode grid = opts.get(key);
            if (!(grid instanceof ObjectNode)) continue;
            ObjectNode g = (ObjectNode) grid;
            JsonNode size = g.get("size");
            if (size != null && size.isNumber() && size.asDouble() <= 0) g.put("size", 0.1);
            if (isTruthy(g.get("color"))) g.put("color", Colors.normalizeOrDefault(g.get("color"), "CCCCCC"));
        }

        JsonNode chartColors = opts.get("chartColors");
        if (chartColors != null && chartColors.isArray()) {
            ArrayNode normalized = opts.putArray("chartColors");
            for (JsonNode c : chartColors) normalized.add(Colors.normalizeOrDefault(c, "000000"));
        }

        for (String key : CHART_COLOR_PROPS) colorProp(opts, key);
        JsonNode chartArea = opts.get("chartArea");
        if (chartArea instanceof ObjectNode) colorProp((ObjectNode) chartArea, "fill");
    }

    // A {color} object with nothing else collapses to the color string; unparseable colors are dropped.
    private static void colorProp(ObjectNode owner, String key) {
        JsonNode val = owner.get(key);
        if (!isTruthy(val)) return;
        if (val instanceof ObjectNode && val.has("color")) {
            ObjectNode obj = (ObjectNode) val;
            String c = Colors.normalize(obj.get("color"));
            boolean single = obj.size() == 1;
            if (c != null) {
                if (single) owner.put(key, c);
                else obj.put("color", c);
            } else {
                if (single) owner.remove(key);
                else obj.remove("color");
            }
        } else if (val.isTextual()) {
            String c = Colors.normalize(val);
            if (c != null) owner.put(key, c);
            else owner.remove(key);
        }
    }

    // -------------------------
    // Color strings
    // -------------------------

    /**
     * Coerces every non-string value stored under a key containing "color" (case-insensitive) to
     * its string form, recursing through nested objects and arrays.
     */
    public static void ensureColorStrings(JsonNode node) {
        if (node == null) return;
        if (node.isArray()) {
            stringifyItems((ArrayNode) node);
            return;
        }
        if (!node.isObject()) return;

        ObjectNode obj = (ObjectNode) node;
        List<String> keys = new ArrayList<>();
        for (Iterator<String> it = obj.fieldNames(); it.hasNext();) keys.add(it.next());
        for (String k : keys) {
            JsonNode v = obj.get(k);
            if (k.toLowerCase(Locale.ROOT).contains("color")) {
                if (v.isArray()) {
                    stringifyItems((ArrayNode) v);
                } else if (!v.isNull() && !v.isTextual() && !v.isContainerNode()) {
                    obj.put(k, v.asText());
                } else if (v.isObject()) {
                    obj.put(k, "[object Object]");
                }
            } else if (v.isContainerNode()) {
                ensureColorStrings(v);
            }
        }
    }

    private static void stringifyItems(ArrayNode arr) {
        for (int i = 0; i < arr.size(); i++) {
            JsonNode item = arr.get(i);
            if (item.isContainerNode()) {
                ensureColorStrings(item);
            } else if (!item.isNull() && !item.isTextual()) {
                arr.set(i, JsonNodeFactory.instance.textNode(item.asText()));
            }
        }
    }

    // -------------------------
    // Helpers
    // -------------------------

    private void defaultFont(ObjectNode opts, String key) {
        if (defaultFontFace != null && !isTruthy(opts.get(key))) opts.put(key, defaultFontFace);
    }

    /** JavaScript truthiness for a JSON node; a missing node is falsy. */
    static boolean isTruthy(JsonNode v) {
        if (v == null || v.isNull() || v.isMissingNode()) return false;
        if (v.isBoolean()) return v.asBoolean();
        if (v.isNumber()) {
            double d = v.asDouble();
            return d != 0 && !Double.isNaN(d);
        }
        if (v.isTextual()) return !v.asText().isEmpty();
        return true;
    }
}
