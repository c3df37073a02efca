import com.deckscript.script.deck.RecordingPresentation;
import com.deckscript.script.dispatch.CallDispatcher;
import com.deckscript.script.dispatch.DispatchDiagnostic;
import com.deckscript.script.dispatch.ImagePathPolicy;
import com.deckscript.script.dispatch.Operation;
import com.deckscript.script.dispatch.OptionSanitizer;
import com.deckscript.script.parser.CallRecord;
import com.deckscript.script.parser.Environment;
import com.deckscript.script.parser.ExpressionEvaluator;
import com.deckscript.script.parser.LayoutHelpers;
import com.deckscript.script.parser.StatementExtractor;
import com.deckscript.script.resource.FetchedResource;
import com.deckscript.script.resource.IconLoader;
import com.deckscript.script.resource.PrefixResourceResolver;
import com.deckscript.script.resource.ResourceFetcher;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.io.FileNotFoundException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CallDispatcherTest {

    private static final String SVG = "<svg xmlns=\"http://www.w3.org/2000/svg\"><path d=\"M0 0\"/></svg>";

    private final RecordingPresentation deck = new RecordingPresentation();

    private ResourceFetcher fetcher = locator -> new FetchedResource(SVG.getBytes(StandardCharsets.UTF_8), "image/svg+xml");

    private List<DispatchDiagnostic> run(String snippet) {
        return run(snippet, null);
    }

    private List<DispatchDiagnostic> run(String snippet, String defaultMaster) {
        PrefixResourceResolver resolver = new PrefixResourceResolver();
        ExpressionEvaluator evaluator = new ExpressionEvaluator(LayoutHelpers.create(13.33, 7.5), resolver, "chrome-extension:");
        List<CallRecord> records = new StatementExtractor(evaluator, Operation.names(), 1000).extract(snippet, new Environment());
        IconLoader icons = new IconLoader(resolver, fetcher, "icon/solid/square.svg");
        CallDispatcher dispatcher = new CallDispatcher(
                deck,
                evaluator,
                new OptionSanitizer("Rakuten Sans JP"),
                new ImagePathPolicy(resolver, "chrome-extension:", icons),
                13.33,
                7.5,
                defaultMaster);
        return dispatcher.dispatchAll(records);
    }

    private ObjectNode onlyObject() {
        assertEquals(1, deck.slides().size());
        assertEquals(1, deck.slides().get(0).objects().size());
        return deck.slides().get(0).objects().get(0);
    }

    @Test
    public void slide_operation_before_add_slide_creates_a_slide_first() {
        List<DispatchDiagnostic> diags = run("slide.addText('Hi', {x: '10%', y: 1, w: 2, h: 1, color: '#f00'});");

        assertTrue(diags.isEmpty());
        assertEquals(List.of("addSlide", "addText"), deck.calls());
        ObjectNode text = onlyObject();
        assertEquals("Hi", text.get("text").asText());
        JsonNode opts = text.get("options");
        assertEquals(1.333, opts.get("x").asDouble(), 1e-9);
        assertEquals("FF0000", opts.get("color").asText());
        assertEquals("Rakuten Sans JP", opts.get("fontFace").asText());
    }

    @Test
    public void add_slide_string_argument_names_the_master() {
        run("pptx.addSlide('TITLE');");
        assertEquals("TITLE", deck.slides().get(0).options().get("masterName").asText());
    }

    @Test
    public void add_slide_default_master_applies_when_none_is_named() {
        run("pptx.addSlide({});\npptx.addSlide({ masterName: 'OTHER' });", "BRAND");

        assertEquals("BRAND", deck.slides().get(0).options().get("masterName").asText());
        assertEquals("OTHER", deck.slides().get(1).options().get("masterName").asText());
    }

    @Test
    public void calls_run_on_the_most_recent_slide() {
        run(""
                + "const s1 = pptx.addSlide();\n"
                + "s1.addText('ignored', {});\n"
                + "slide.addText('one', {});\n"
                + "pptx.addSlide();\n"
                + "slide.addText('two', {});\n");

        assertEquals(2, deck.slides().size());
        assertEquals(1, deck.slides().get(0).objects().size());
        assertEquals("two", deck.slides().get(1).objects().get(0).get("text").asText());
    }

    @Test
    public void unknown_shape_is_skipped_without_diagnostic() {
        List<DispatchDiagnostic> diags = run(""
                + "const slide = pptx.addSlide();\n"
                + "slide.addShape('star', {x: 1, y: 1, w: 1, h: 1});\n"
                + "slide.addShape(pptx.ShapeType.rect, {x: 1, y: 1, w: 1, h: 1, fill: {color: 'abc'}});\n");

        assertTrue(diags.isEmpty());
        assertEquals(List.of("addSlide", "addShape"), deck.calls());
        ObjectNode shape = onlyObject();
        assertEquals("rect", shape.get("shape").asText());
        assertEquals("AABBCC", shape.get("options").get("fill").get("color").asText());
    }

    @Test
    public void failing_call_is_recorded_and_later_calls_still_run() {
        List<DispatchDiagnostic> diags = run(""
                + "slide.addText('a');\n"
                + "slide.addText('b', [1]);\n"
                + "slide.addText('c', {});\n");

        assertEquals(2, diags.size());
        assertEquals(0, diags.get(0).callIndex());
        assertEquals("slide.addText", diags.get(0).operation());
        assertTrue(diags.get(0).message().startsWith("Not enough arguments"), diags.get(0).message());
        assertTrue(diags.get(1).message().startsWith("Object required"), diags.get(1).message());

        assertEquals(List.of("addSlide", "addText"), deck.calls());
        assertEquals("c", onlyObject().get("text").asText());
    }

    @Test
    public void external_image_paths_are_rejected() {
        List<DispatchDiagnostic> diags = run("slide.addImage({path: 'https://evil.example/x.png', x: 0, y: 0, w: 1, h: 1});");

        assertEquals(1, diags.size());
        assertEquals("External image paths are not allowed", diags.get(0).message());
        assertEquals(List.of("addSlide"), deck.calls());
    }

    @Test
    public void data_image_paths_pass_through() {
        run("slide.addImage({path: 'data:image/png;base64,AAAA', x: 0, y: 0, w: 1, h: 1});");
        assertEquals("data:image/png;base64,AAAA", onlyObject().get("options").get("path").asText());
    }

    @Test
    public void internal_icon_with_color_is_inlined_as_tinted_svg() {
        run("slide.addImage({path: 'icon/solid/star.svg?color=FF0000', x: 0, y: 0, w: 1, h: 1});");

        String path = onlyObject().get("options").get("path").asText();
        String prefix = "data:image/svg+xml;base64,";
        assertTrue(path.startsWith(prefix), path);
        String svg = new String(Base64.getDecoder().decode(path.substring(prefix.length())), StandardCharsets.UTF_8);
        assertTrue(svg.contains("fill=\"#FF0000\""), svg);
    }

    @Test
    public void unavailable_internal_image_falls_back_to_the_fallback_icon() {
        fetcher = locator -> {
            throw new FileNotFoundException(locator);
        };

        run("slide.addImage({path: 'icon/solid/missing.svg?color=FF0000', x: 0, y: 0, w: 1, h: 1});");

        assertEquals("chrome-extension://deckscript/icon/solid/square.svg",
                onlyObject().get("options").get("path").asText());
    }

    @Test
    public void table_null_cells_and_default_font() {
        run("slide.addTable([[null, 'a']], {x: 1, y: 1, w: 4});");

        ObjectNode table = onlyObject();
        assertEquals("", table.get("rows").get(0).get(0).get("text").asText());
        assertEquals("a", table.get("rows").get(0).get(1).asText());
        assertEquals("Rakuten Sans JP", table.get("options").get("fontFace").asText());
    }

    @Test
    public void chart_type_and_options() {
        List<DispatchDiagnostic> diags = run(""
                + "const data = [{name: 'S', labels: ['a', 'b'], values: [1, 2]}];\n"
                + "slide.addChart(pptx.ChartType.bar, data, {x: 1, y: 1, w: 4, h: 3, chartColors: ['#f00']});\n");

        assertTrue(diags.isEmpty());
        ObjectNode chart = onlyObject();
        assertEquals("bar", chart.get("chartType").asText());
        assertEquals(2, chart.get("data").get(0).get("values").size());
        assertEquals("FF0000", chart.get("options").get("chartColors").get(0).asText());
        assertEquals("Rakuten Sans JP", chart.get("options").get("titleFontFace").asText());
    }

    @Test
    public void chart_unknown_type_is_a_diagnostic() {
        List<DispatchDiagnostic> diags = run("slide.addChart('pizza', [], {});");

        assertEquals(1, diags.size());
        assertEquals("Invalid ChartType: pizza", diags.get(0).message());
        assertFalse(deck.calls().contains("addChart"));
    }

    @Test
    public void write_file_is_a_no_op() {
        List<DispatchDiagnostic> diags = run("pptx.writeFile({fileName: 'x.pptx'});");

        assertTrue(diags.isEmpty());
        assertEquals(0, deck.backendCallCount());
    }

    @Test
    public void calls_are_dispatched_once_in_source_order() {
        run("slide.addText('1', {});\nslide.addText('2', {});\nslide.addText('3', {});");

        List<ObjectNode> objects = deck.slides().get(0).objects();
        assertEquals(3, objects.size());
        for (int i = 0; i < 3; i++) {
            assertEquals(String.valueOf(i + 1), objects.get(i).get("text").asText());
        }
    }
}
