import com.deckscript.script.parser.DelimiterScanner;
import com.deckscript.script.parser.SnippetSyntaxException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class DelimiterScannerTest {

    @Test
    public void split_top_level_ignores_commas_in_strings_and_brackets() {
        String src = "f(a, \"b,c\", [1,2])";
        DelimiterScanner.Span call = DelimiterScanner.readEnclosed(src, 1);

        List<String> args = DelimiterScanner.splitTopLevel(call.content, ',');

        assertEquals(3, args.size());
        assertEquals("a", args.get(0));
        assertEquals("\"b,c\"", args.get(1));
        assertEquals("[1,2]", args.get(2));
    }

    @Test
    public void split_top_level_keeps_nested_objects_together_and_drops_trailing_comma() {
        List<String> args = DelimiterScanner.splitTopLevel("'x', { a: 1, b: [2, 3] }, fn(4, 5),", ',');
        assertEquals(List.of("'x'", "{ a: 1, b: [2, 3] }", "fn(4, 5)"), args);
    }

    @Test
    public void read_enclosed_finds_matching_closer_past_nested_and_quoted_delimiters() {
        String src = "slide.addText('a)b', { x: (1 + 2) });";
        int open = src.indexOf('(');

        DelimiterScanner.Span span = DelimiterScanner.readEnclosed(src, open);

        assertEquals(src.length() - 2, span.close);
        assertEquals("'a)b', { x: (1 + 2) }", span.content);
    }

    @Test
    public void read_enclosed_handles_escaped_quotes_and_templates() {
        String src = "('it\\'s', `a ${b} )`)";
        DelimiterScanner.Span span = DelimiterScanner.readEnclosed(src, 0);
        assertEquals(src.length() - 1, span.close);
    }

    @Test
    public void read_enclosed_fails_closed_on_unbalanced_input() {
        assertThrows(SnippetSyntaxException.class, () -> DelimiterScanner.readEnclosed("f(a, b", 1));
        assertThrows(SnippetSyntaxException.class, () -> DelimiterScanner.readEnclosed("(\"abc)", 0));
        assertThrows(SnippetSyntaxException.class, () -> DelimiterScanner.readEnclosed("abc", 0));

        SnippetSyntaxException e = assertThrows(SnippetSyntaxException.class,
                () -> DelimiterScanner.readEnclosed("{ a: [1, 2]", 0));
        assertTrue(e.getMessage().startsWith("Unbalanced delimiters"), e.getMessage());
    }

    @Test
    public void split_top_level_rejects_stray_closers() {
        assertThrows(SnippetSyntaxException.class, () -> DelimiterScanner.splitTopLevel("a), b", ','));
        assertThrows(SnippetSyntaxException.class, () -> DelimiterScanner.splitTopLevel("[a, b", ','));
    }

    @Test
    public void find_top_level_skips_nested_occurrences() {
        assertEquals(1, DelimiterScanner.findTopLevel("a: {b: 1}", 0, ':'));
        assertEquals(-1, DelimiterScanner.findTopLevel("{b: 1}", 0, ':'));
        assertEquals(9, DelimiterScanner.findTopLevel("'a:b' + c: d", 0, ':'));
    }

    @Test
    public void string_helpers() {
        String src = "x = 'a(b'";
        assertTrue(DelimiterScanner.isInsideString(src, 6));
        assertFalse(DelimiterScanner.isInsideString(src, 0));

        assertTrue(DelimiterScanner.isSingleStringLiteral("'abc'"));
        assertFalse(DelimiterScanner.isSingleStringLiteral("'a' + 'b'"));
        assertTrue(DelimiterScanner.isWhollyEnclosed("{ a: 1 }"));
        assertFalse(DelimiterScanner.isWhollyEnclosed("(a) + (b)"));
    }
}
