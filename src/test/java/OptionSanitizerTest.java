import com.deckscript.script.dispatch.OptionSanitizer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class OptionSanitizerTest {

    private static final ObjectMapper om = new ObjectMapper();

    private final OptionSanitizer sanitizer = new OptionSanitizer("Rakuten Sans JP");

    private static ObjectNode obj(String json) throws Exception {
        return (ObjectNode) om.readTree(json);
    }

    @Test
    public void text_options_default_font_and_colors() throws Exception {
        ObjectNode opts = obj("{\"color\":\"#f00\",\"fill\":{\"color\":\"bad\"}}");

        sanitizer.textOptions(opts);

        assertEquals("Rakuten Sans JP", opts.get("fontFace").asText());
        assertEquals("FF0000", opts.get("color").asText());
        assertEquals("FFFFFF", opts.get("fill").get("color").asText());
    }

    @Test
    public void text_options_keep_explicit_font_and_bad_color_becomes_black() throws Exception {
        ObjectNode opts = obj("{\"fontFace\":\"Arial\",\"color\":\"nope\"}");

        sanitizer.textOptions(opts);

        assertEquals("Arial", opts.get("fontFace").asText());
        assertEquals("000000", opts.get("color").asText());
    }

    @Test
    public void text_runs_sanitize_each_run() throws Exception {
        JsonNode runs = om.readTree("[{\"text\":\"a\",\"options\":{\"color\":\"0f0\"}},{\"text\":\"b\"}]");

        sanitizer.textRuns(runs);

        assertEquals("00FF00", runs.get(0).get("options").get("color").asText());
        assertEquals("Rakuten Sans JP", runs.get(0).get("options").get("fontFace").asText());
        assertFalse(runs.get(1).has("options"));
    }

    @Test
    public void shape_options_drop_incomplete_fill_and_line() throws Exception {
        ObjectNode opts = obj("{\"fill\":{\"transparency\":50},\"line\":{\"dashType\":\"dash\"}}");
        sanitizer.shapeOptions(opts);
        assertFalse(opts.has("fill"));
        assertFalse(opts.has("line"));

        ObjectNode widthOnly = obj("{\"line\":{\"width\":2}}");
        sanitizer.shapeOptions(widthOnly);
        assertEquals(2, widthOnly.get("line").get("width").asInt());

        ObjectNode colored = obj("{\"fill\":{\"color\":\"zzz\"},\"line\":{\"color\":\"abc\"}}");
        sanitizer.shapeOptions(colored);
        assertEquals("FFFFFF", colored.get("fill").get("color").asText());
        assertEquals("AABBCC", colored.get("line").get("color").asText());
    }

    @Test
    public void table_rows_replace_null_cells() throws Exception {
        JsonNode rows = sanitizer.tableRows(om.readTree("[[null,\"a\"],[\"b\",null]]"));

        assertEquals("", rows.get(0).get(0).get("text").asText());
        assertTrue(rows.get(0).get(0).get("options").isObject());
        assertEquals("a", rows.get(0).get(1).asText());
        assertEquals("", rows.get(1).get(1).get("text").asText());
    }

    @Test
    public void chart_options_normalize_colors_and_grid_lines() throws Exception {
        ObjectNode opts = obj("{"
                + "\"valGridLine\":{\"size\":0,\"color\":\"nope\"},"
                + "\"chartColors\":[\"#f00\",\"zzz\"],"
                + "\"catAxisLabelColor\":\"#0f0\","
                + "\"dataLabelColor\":\"nope\","
                + "\"fill\":{\"color\":\"#00f\"},"
                + "\"chartArea\":{\"fill\":{\"color\":\"#fff\",\"transparency\":10}}"
                + "}");

        sanitizer.chartOptions(opts);

        assertEquals(0.1, opts.get("valGridLine").get("size").asDouble(), 0.0);
        assertEquals("CCCCCC", opts.get("valGridLine").get("color").asText());
        assertEquals("FF0000", opts.get("chartColors").get(0).asText());
        assertEquals("000000", opts.get("chartColors").get(1).asText());
        assertEquals("00FF00", opts.get("catAxisLabelColor").asText());
        assertFalse(opts.has("dataLabelColor"));
        assertEquals("0000FF", opts.get("fill").asText());
        assertEquals("FFFFFF", opts.get("chartArea").get("fill").get("color").asText());
        assertEquals(10, opts.get("chartArea").get("fill").get("transparency").asInt());
        assertEquals("Rakuten Sans JP", opts.get("titleFontFace").asText());
        assertEquals("Rakuten Sans JP", opts.get("legendFontFace").asText());
    }

    @Test
    public void ensure_color_strings_coerces_color_values_at_any_depth() throws Exception {
        ObjectNode opts = obj("{\"color\":255,\"line\":{\"color\":true},\"chartColors\":[1,\"A\"],\"other\":5}");

        OptionSanitizer.ensureColorStrings(opts);

        assertTrue(opts.get("color").isTextual());
        assertEquals("255", opts.get("color").asText());
        assertEquals("true", opts.get("line").get("color").asText());
        assertEquals("1", opts.get("chartColors").get(0).asText());
        assertTrue(opts.get("chartColors").get(0).isTextual());
        assertTrue(opts.get("other").isNumber());
    }
}
