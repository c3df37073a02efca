import com.deckscript.script.dispatch.Geometry;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class GeometryTest {

    private static final ObjectMapper om = new ObjectMapper();

    @Test
    public void percentages_are_relative_to_the_matching_axis() throws Exception {
        ObjectNode opts = (ObjectNode) om.readTree("{\"x\":\"50%\",\"y\":\"10%\",\"w\":\"25%\",\"h\":\"100%\"}");

        Geometry.normalizeBox(opts, 13.33, 7.5);

        assertEquals(6.665, opts.get("x").asDouble(), 1e-9);
        assertEquals(0.75, opts.get("y").asDouble(), 1e-9);
        assertEquals(3.3325, opts.get("w").asDouble(), 1e-9);
        assertEquals(7.5, opts.get("h").asDouble(), 1e-9);
    }

    @Test
    public void numbers_and_numeric_strings_pass_through_unreadable_fields_are_removed() throws Exception {
        ObjectNode opts = (ObjectNode) om.readTree("{\"x\":2,\"y\":\"1.5\",\"w\":\"abc\",\"h\":true,\"color\":\"FF0000\"}");

        Geometry.normalizeBox(opts, 13.33, 7.5);

        assertEquals(2.0, opts.get("x").asDouble(), 0.0);
        assertEquals(1.5, opts.get("y").asDouble(), 0.0);
        assertFalse(opts.has("w"));
        assertFalse(opts.has("h"));
        assertEquals("FF0000", opts.get("color").asText());
    }

    @Test
    public void boxes_may_extend_beyond_the_slide() throws Exception {
        ObjectNode opts = (ObjectNode) om.readTree("{\"x\":-1,\"w\":\"150%\"}");

        Geometry.normalizeBox(opts, 10, 5);

        assertEquals(-1.0, opts.get("x").asDouble(), 0.0);
        assertEquals(15.0, opts.get("w").asDouble(), 1e-9);
        assertFalse(opts.has("y"));
    }

    @Test
    public void only_plain_numerals_count_as_geometry() throws Exception {
        ObjectNode opts = (ObjectNode) om.readTree("{\"x\":\"1d\",\"y\":\"2f\",\"w\":\"0x1p3\",\"h\":\"Infinity\"}");

        Geometry.normalizeBox(opts, 13.33, 7.5);

        assertFalse(opts.has("x"));
        assertFalse(opts.has("y"));
        assertFalse(opts.has("w"));
        assertFalse(opts.has("h"));

        ObjectNode plain = (ObjectNode) om.readTree("{\"x\":\"-.5\",\"y\":\" 2. \",\"w\":\"1e1\",\"h\":\"+3\"}");

        Geometry.normalizeBox(plain, 13.33, 7.5);

        assertEquals(-0.5, plain.get("x").asDouble(), 0.0);
        assertEquals(2.0, plain.get("y").asDouble(), 0.0);
        assertEquals(10.0, plain.get("w").asDouble(), 0.0);
        assertEquals(3.0, plain.get("h").asDouble(), 0.0);
    }
}
