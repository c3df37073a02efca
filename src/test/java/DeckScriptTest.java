import com.deckscript.debug.Debug;
import com.deckscript.script.DeckScript;
import com.deckscript.script.RunResult;
import com.deckscript.script.deck.RecordingPresentation;
import com.deckscript.script.parser.CallRecord;
import com.deckscript.script.safety.PatternSafetyValidator;
import com.deckscript.script.safety.UnsafeSnippetException;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class DeckScriptTest {

    private static final String ONE_SLIDE = ""
            + "const slide = pptx.addSlide();\n"
            + "slide.addText('One', { x: 1, y: 1, w: 4, h: 1 });\n";

    private final DeckScript engine = new DeckScript();
    private final RecordingPresentation deck = new RecordingPresentation();

    @Test
    public void counted_loop_snippet_places_one_shape_per_iteration() {
        String src = ""
                + "let n = 3;\n"
                + "for (let i = 0; i < n; i++) {\n"
                + "  slide.addShape(\"rect\", {x: i, y: 0, w: 1, h: 1});\n"
                + "}\n";

        List<CallRecord> records = engine.extract(src);
        assertEquals(3, records.size());

        RunResult result = engine.run(src, deck);

        assertFalse(result.failed());
        assertTrue(result.verdict().isSafe());
        assertEquals(3, result.callCount());
        assertEquals(List.of("addSlide", "addShape", "addShape", "addShape"), deck.calls());
        List<ObjectNode> shapes = deck.slides().get(0).objects();
        for (int i = 0; i < 3; i++) {
            assertEquals(i, shapes.get(i).get("options").get("x").asDouble(), 0.0);
        }
    }

    @Test
    public void file_writing_snippet_is_rejected_before_any_backend_call() {
        String src = ""
                + "const fs = require('fs');\n"
                + "fs.writeFileSync('/tmp/deck.pptx', 'x');\n"
                + "slide.addText('hi', {});\n";

        assertFalse(engine.check(src).isSafe());
        assertTrue(engine.extract(src).isEmpty());
        UnsafeSnippetException e = assertThrows(UnsafeSnippetException.class, () -> engine.run(src, deck));
        assertTrue(e.getMessage().startsWith("Unsafe code detected"), e.getMessage());
        assertEquals(0, deck.backendCallCount());
    }

    @Test
    public void generate_replaces_an_unsafe_snippet_with_an_error_slide() {
        RunResult result = engine.generate("fetch('https://evil.example');\nslide.addText('hi', {});", deck);

        assertTrue(result.failed());
        assertFalse(result.verdict().isSafe());
        assertTrue(result.error().contains("Unsafe code detected"), result.error());
        assertEquals(List.of("addSlide", "addText", "addText"), deck.calls());

        List<ObjectNode> objects = deck.slides().get(0).objects();
        assertEquals(DeckScript.ERROR_HEADLINE, objects.get(0).get("text").asText());
        assertEquals("FF0000", objects.get(0).get("options").get("color").asText());
        assertEquals(result.error(), objects.get(1).get("text").asText());
    }

    @Test
    public void generate_all_keeps_going_past_a_failing_snippet() {
        List<RunResult> results = engine.generateAll(List.of(ONE_SLIDE, "eval('1');", ONE_SLIDE), deck);

        assertEquals(3, results.size());
        assertFalse(results.get(0).failed());
        assertTrue(results.get(1).failed());
        assertFalse(results.get(2).failed());
        assertEquals(3, deck.slides().size());
        assertEquals("One", deck.slides().get(2).objects().get(0).get("text").asText());
    }

    @Test
    public void generate_strips_construction_and_write_lines() {
        String src = ""
                + "const pptx = new PptxGenJS();\n"
                + ONE_SLIDE
                + "pptx.writeFile({ fileName: 'deck.pptx' });\n";

        assertThrows(UnsafeSnippetException.class, () -> engine.run(src, new RecordingPresentation()));

        RunResult result = engine.generate(src, deck);

        assertFalse(result.failed(), result.error());
        assertEquals(List.of("addSlide", "addText"), deck.calls());
    }

    @Test
    public void generate_inlines_bundled_icons() {
        String src = ""
                + "const slide = pptx.addSlide();\n"
                + "slide.addImage({ path: chrome.runtime.getURL('icon/solid/square.svg?color=00FF00'), x: 1, y: 1, w: 1, h: 1 });\n";

        RunResult result = engine.generate(src, deck);

        assertFalse(result.failed(), result.error());
        assertTrue(result.diagnostics().isEmpty());
        String path = deck.slides().get(0).objects().get(0).get("options").get("path").asText();
        String prefix = "data:image/svg+xml;base64,";
        assertTrue(path.startsWith(prefix), path);
        String svg = new String(Base64.getDecoder().decode(path.substring(prefix.length())), StandardCharsets.UTF_8);
        assertTrue(svg.contains("fill=\"#00FF00\""), svg);
    }

    @Test
    public void default_master_name_applies_to_implicit_and_explicit_slides() {
        engine.setDefaultMasterName("MASTER");

        engine.run("pptx.addSlide();\nslide.addText('x', {});", deck);
        engine.run("slide.addText('y', {});", deck);

        assertEquals(2, deck.slides().size());
        assertEquals("MASTER", deck.slides().get(0).options().get("masterName").asText());
        assertEquals("MASTER", deck.slides().get(1).options().get("masterName").asText());
    }

    @Test
    public void max_loop_iterations_caps_extraction() {
        engine.setMaxLoopIterations(5);

        List<CallRecord> records = engine.extract(""
                + "const xs = [1, 2, 3, 4, 5, 6, 7, 8];\n"
                + "xs.forEach((x) => { slide.addText('t', {}); });\n");

        assertEquals(5, records.size());
        assertThrows(IllegalArgumentException.class, () -> engine.setMaxLoopIterations(-1));
    }

    @Test
    public void dispatch_failures_are_reported_not_thrown() {
        RunResult result = engine.run(""
                + "slide.addChart('pizza', [], {});\n"
                + "slide.addText('still here', {});\n", deck);

        assertFalse(result.failed());
        assertEquals(2, result.callCount());
        assertEquals(1, result.diagnostics().size());
        assertEquals("slide.addChart", result.diagnostics().get(0).operation());
        assertEquals("still here", deck.slides().get(0).objects().get(0).get("text").asText());
    }

    @Test
    public void slide_size_is_visible_to_snippets() {
        engine.setSlideSize(10, 5.625);

        engine.run("slide.addText('x', { x: SLIDE_W - 1, y: SLIDE_H / 2, w: 1, h: 1 });", deck);

        ObjectNode opts = (ObjectNode) deck.slides().get(0).objects().get(0).get("options");
        assertEquals(9.0, opts.get("x").asDouble(), 1e-9);
        assertEquals(2.8125, opts.get("y").asDouble(), 1e-9);
    }

    @Test
    public void layout_helpers_are_callable_from_snippets() {
        engine.run(""
                + "for (let i = 0; i < 2; i++) {\n"
                + "  slide.addText('c', { x: centerX(4), y: evenY(i, 2, 1), w: 4, h: 1 });\n"
                + "}\n", deck);

        List<ObjectNode> objects = deck.slides().get(0).objects();
        assertEquals(2, objects.size());
        double gap = (7.5 - 2) / 3;
        assertEquals((13.33 - 4) / 2, objects.get(0).get("options").get("x").asDouble(), 1e-9);
        assertEquals(gap, objects.get(0).get("options").get("y").asDouble(), 1e-9);
        assertEquals(2 * gap + 1, objects.get(1).get("options").get("y").asDouble(), 1e-9);
    }

    @Test
    public void pattern_strategy_can_be_selected() {
        engine.setSafetyValidator(new PatternSafetyValidator());

        // the pattern check has no call whitelist; the extractor still ignores unknown calls
        RunResult result = engine.run("console.log('x');\nslide.addText('ok', {});", deck);

        assertEquals(1, result.callCount());
        assertEquals(List.of("addSlide", "addText"), deck.calls());
    }

    @Test
    public void null_arguments_are_rejected() {
        assertThrows(IllegalArgumentException.class, () -> engine.check(null));
        assertThrows(IllegalArgumentException.class, () -> engine.run(ONE_SLIDE, null));
    }

    @Test
    public void allowed_calls_cover_operations_and_helpers() {
        assertTrue(engine.allowedCalls().contains("slide.addChart"));
        assertTrue(engine.allowedCalls().contains("gridXY"));
        assertTrue(engine.allowedCalls().contains("Math.round"));
        assertFalse(engine.allowedCalls().contains("console.log"));
    }

    @Test
    public void run_without_a_debug_sink_continues_past_a_failed_call() {
        Debug.get().setSink(null);
        assertNotNull(Debug.get().getSink());

        RunResult result = engine.run(""
                + "pptx.addSlide();\n"
                + "slide.addChart('pizza', [], {});\n"
                + "slide.addText('ok', { x: 1, y: 1, w: 2, h: 1 });\n", deck);

        assertFalse(result.failed());
        assertEquals(3, result.callCount());
        assertEquals(1, result.diagnostics().size());
        assertEquals(List.of("addSlide", "addText"), deck.calls());
        assertEquals("ok", deck.slides().get(0).objects().get(0).get("text").asText());
    }

    @Test
    public void generate_without_a_debug_sink_still_adds_the_error_slide() {
        Debug.get().setSink(null);

        RunResult result = engine.generate("eval('1');\nslide.addText('hi', {});", deck);

        assertTrue(result.failed());
        assertEquals(DeckScript.ERROR_HEADLINE, deck.slides().get(0).objects().get(0).get("text").asText());
    }

    @Test
    public void pattern_strategy_survives_deeply_nested_unary_operators() {
        engine.setSafetyValidator(new PatternSafetyValidator());
        String src = "let a = " + "-".repeat(200000) + "1;\nslide.addText('ok', {});\n";

        RunResult result = assertDoesNotThrow(() -> engine.generate(src, deck));

        assertFalse(result.failed(), result.error());
        assertEquals(List.of("addSlide", "addText"), deck.calls());
        assertEquals("ok", deck.slides().get(0).objects().get(0).get("text").asText());
    }

    @Test
    public void pattern_strategy_survives_deeply_nested_loops() {
        engine.setSafetyValidator(new PatternSafetyValidator());
        String src = "for (const a of [1]) {".repeat(20000) + "}".repeat(20000)
                + "\nslide.addText('after', {});\n";

        RunResult result = assertDoesNotThrow(() -> engine.generate(src, deck));

        assertFalse(result.failed(), result.error());
        assertEquals(1, result.callCount());
        assertEquals("after", deck.slides().get(0).objects().get(0).get("text").asText());
    }
}
