import com.deckscript.script.DeckScript;
import com.deckscript.script.safety.AstSafetyValidator;
import com.deckscript.script.safety.PatternSafetyValidator;
import com.deckscript.script.safety.SafetyValidator;
import com.deckscript.script.safety.SafetyValidators;
import com.deckscript.script.safety.SafetyVerdict;
import com.deckscript.script.safety.SnippetSanitizer;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class SafetyValidatorTest {

    private final SafetyValidator ast = new AstSafetyValidator(new DeckScript().allowedCalls());
    private final SafetyValidator patterns = new PatternSafetyValidator();

    private static void assertRejected(SafetyValidator v, String code, String reasonFragment) {
        SafetyVerdict verdict = v.check(code);
        assertFalse(verdict.isSafe(), "expected rejection of: " + code);
        assertTrue(verdict.reason().contains(reasonFragment), verdict.reason());
    }

    @Test
    public void ast_accepts_plain_slide_code() {
        String code = ""
                + "const slide = pptx.addSlide();\n"
                + "slide.addText('Hello', { x: 1, y: 1, w: 5, h: 1, color: '333333' });\n"
                + "slide.addShape(pptx.ShapeType.rect, { x: 0, y: 0, w: SLIDE_W, h: 0.2 });\n";

        assertTrue(ast.check(code).isSafe(), ast.check(code).reason());
    }

    @Test
    public void ast_accepts_loops_and_helpers() {
        String code = ""
                + "const items = ['a', 'b'];\n"
                + "items.forEach((item, i) => {\n"
                + "  slide.addText(item, { x: evenX(i, 2, 3), y: Math.max(1, i), w: 3, h: 1 });\n"
                + "});\n"
                + "for (let i = 0; i < items.length; i++) {\n"
                + "  slide.addText(items[i], { x: centerX(2), y: 3 });\n"
                + "}\n";

        SafetyVerdict v = ast.check(code);
        assertTrue(v.isSafe(), v.reason());
    }

    @Test
    public void ast_rejects_banned_capabilities() {
        assertRejected(ast, "fetch('https://evil.example');", "fetch");
        assertRejected(ast, "const d = document.cookie;", "document");
        assertRejected(ast, "window.open('x');", "window");
        assertRejected(ast, "const s = localStorage;", "localStorage");
        assertRejected(ast, "const f = new Function('return 1');", "Function");
        assertRejected(ast, "eval('1');", "eval");
        assertRejected(ast, "chrome.storage.local.get('k');", "chrome");
    }

    @Test
    public void ast_rejects_raw_file_writes() {
        assertRejected(ast, "const fs = require('fs');", "require");
        assertRejected(ast, "fs.writeFileSync('/tmp/deck.pptx', 'data');", "fs.writeFileSync");
    }

    @Test
    public void ast_rejects_calls_outside_the_operation_table() {
        assertRejected(ast, "console.log('x');", "console.log");
        assertRejected(ast, "const p = new PptxGenJS();", "PptxGenJS");
        assertRejected(ast, "slide['addText']('x', {});", "computed callee");
    }

    @Test
    public void ast_rejects_unparseable_code() {
        assertRejected(ast, "slide.addText('x', {", "Parse error");
    }

    @Test
    public void patterns_reject_dangerous_text() {
        assertRejected(patterns, "fetch ('x')", "fetch");
        assertRejected(patterns, "const s = sessionStorage;", "sessionStorage");
        assertRejected(patterns, "new Function('x')", "Function");
        assertRejected(patterns, "EVAL('1')", "eval");
        assertRejected(patterns, "const c = document.cookie;", "cookie");
    }

    @Test
    public void patterns_accept_function_callbacks() {
        String code = "items.forEach(function (x) { slide.addText(x, {}); });";
        assertTrue(patterns.check(code).isSafe());
    }

    @Test
    public void preferred_strategy_is_the_tree_walk_when_rhino_is_present() {
        assertTrue(SafetyValidators.treeParserAvailable());
        assertTrue(SafetyValidators.preferred(new DeckScript().allowedCalls()) instanceof AstSafetyValidator);
    }

    @Test
    public void sanitizer_drops_construction_and_write_lines_only() {
        String code = ""
                + "const pptx = new PptxGenJS();\n"
                + "const slide = pptx.addSlide();\n"
                + "\n"
                + "slide.addText('x', {});\n"
                + "pptx.writeFile({ fileName: 'deck.pptx' });";

        String out = SnippetSanitizer.stripConstructionLines(code);

        assertEquals("const slide = pptx.addSlide();\n\nslide.addText('x', {});", out);
    }

    @Test
    public void extract_returns_nothing_for_unsafe_snippets() {
        DeckScript engine = new DeckScript();
        String code = "slide.addText('a', {});\nfetch('https://evil.example');";
        assertTrue(engine.extract(code).isEmpty());
    }
}
