package com.deckscript.script.parser;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.deckscript.debug.Debug;

/**
 * Walks snippet text and turns it into an ordered list of {@link CallRecord}s.
 *
 * Between loops the text is scanned as a sequence of assignments and whitelisted calls. Loops
 * ({@code for...of}, counted {@code for}, {@code .forEach}) extract their body once per element
 * in a child scope of the current environment. Statements that do not evaluate are logged and
 * skipped; nothing here ever touches the presentation.
 */
public class StatementExtractor {

    private static final String TAG = "StatementExtractor";

    private static final Pattern LOOP_HEAD =
            Pattern.compile("([A-Za-z_$][\\w$.]*?)\\s*\\.\\s*forEach\\s*\\(|\\bfor\\s*\\(");

    private static final Pattern ASSIGN = Pattern.compile(
            "(?:\\b(let|const|var)\\s+)?\\b([A-Za-z_$][\\w$]*)\\s*(?:([+\\-*/])?=(?![=>])|(\\+\\+|--))");

    private static final Pattern FOR_OF =
            Pattern.compile("^(?:let|const|var)?\\s*([A-Za-z_$][\\w$]*)\\s+of\\s+([\\s\\S]+)$");

    private static final Pattern COUNTED = Pattern.compile(
            "^(?:let|var)\\s+([A-Za-z_$][\\w$]*)\\s*=\\s*(\\d+)\\s*;\\s*\\1\\s*<\\s*([A-Za-z_$][\\w$]*(?:\\.length)?|\\d+)\\s*;\\s*\\1\\s*(?:\\+\\+|\\+=\\s*1)\\s*$");

    private static final Pattern ARROW_CALLBACK = Pattern.compile(
            "^(?:async\\s+)?(?:\\(([^)]*)\\)|([A-Za-z_$][\\w$]*))\\s*=>\\s*([\\s\\S]*)$");

    private static final Pattern FUNCTION_CALLBACK = Pattern.compile(
            "^function\\s*(?:[A-Za-z_$][\\w$]*)?\\s*\\(([^)]*)\\)\\s*(\\{[\\s\\S]*\\})$");

    private static final Pattern IDENT = Pattern.compile("[A-Za-z_$][\\w$]*");

    /** Loops nested deeper than this are skipped. */
    public static final int MAX_LOOP_DEPTH = 32;

    private final ExpressionEvaluator evaluator;
    private final Pattern callPattern;
    private final int maxIterations;
    private int loopDepth = 0;

    public StatementExtractor(ExpressionEvaluator evaluator, Set<String> callNames, int maxIterations) {
        if (evaluator == null) throw new IllegalArgumentException("evaluator is null");
        if (callNames == null || callNames.isEmpty()) throw new IllegalArgumentException("no call names");
        if (maxIterations < 0) throw new IllegalArgumentException("maxIterations < 0");
        this.evaluator = evaluator;
        this.callPattern = buildCallPattern(callNames);
        this.maxIterations = maxIterations;
    }

    private static Pattern buildCallPattern(Set<String> names) {
        StringBuilder alt = new StringBuilder();
        for (String name : names) {
            if (alt.length() > 0) alt.append('|');
            String[] parts = name.split("\\.");
            for (int i = 0; i < parts.length; i++) {
                if (i > 0) alt.append("\\s*\\.\\s*");
                alt.append(Pattern.quote(parts[i]));
            }
        }
        return Pattern.compile("\\b(" + alt + ")\\s*\\(");
    }

    /** Cleans {@code source} and extracts its call records in source order. */
    public List<CallRecord> extract(String source, Environment env) {
        List<CallRecord> out = new ArrayList<>();
        extractBlock(SourceCleaner.clean(source), env, out);
        return out;
    }

    private void extractBlock(String src, Environment env, List<CallRecord> out) {
        Matcher m = LOOP_HEAD.matcher(src);
        int last = 0;
        int from = 0;
        while (from < src.length() && m.find(from)) {
            if (m.start() < last || DelimiterScanner.isInsideString(src, m.start()) || precededByDot(src, m.start())) {
                from = m.start() + 1;
                continue;
            }
            plainSegment(src.substring(last, m.start()), env, out);
            try {
                last = (m.group(1) != null) ? forEachLoop(src, m, env, out) : forLoop(src, m, env, out);
            } catch (SnippetSyntaxException e) {
                Debug.get().w(TAG, "Loop at offset " + m.start() + " is malformed; remaining text ignored", e);
                return;
            }
            from = last;
        }
        plainSegment(src.substring(last), env, out);
    }

    // -------------------------
    // Loops
    // -------------------------

    private int forEachLoop(String src, Matcher m, Environment env, List<CallRecord> out) {
        String path = m.group(1);
        DelimiterScanner.Span args = DelimiterScanner.readEnclosed(src, m.end() - 1);
        int end = args.close + 1;

        String callback = args.content.trim();
        List<String> params;
        String body;
        Matcher arrow = ARROW_CALLBACK.matcher(callback);
        Matcher fn = FUNCTION_CALLBACK.matcher(callback);
        if (arrow.matches()) {
            params = parameters(arrow.group(1) != null ? arrow.group(1) : arrow.group(2));
            body = blockBody(arrow.group(3).trim());
        } else if (fn.matches()) {
            params = parameters(fn.group(1));
            body = blockBody(fn.group(2).trim());
        } else {
            Debug.get().d(TAG, "Unsupported forEach callback on " + path);
            return end;
        }
        if (params == null) {
            Debug.get().d(TAG, "Unsupported forEach parameters on " + path);
            return end;
        }
        if (tooDeep(path + ".forEach")) return end;

        Value items;
        try {
            items = evaluator.resolvePath(path, env);
        } catch (SnippetSyntaxException e) {
            Debug.get().d(TAG, "forEach target " + path + " did not resolve: " + e.getMessage());
            return end;
        }
        if (!items.isArray()) {
            Debug.get().d(TAG, "forEach target " + path + " is not an array");
            return end;
        }

        List<Value> list = items.asArray();
        int count = cap(list.size(), path);
        for (int i = 0; i < count; i++) {
            Map<String, Value> bindings = new LinkedHashMap<>();
            if (params.size() > 0) bindings.put(params.get(0), list.get(i));
            if (params.size() > 1) bindings.put(params.get(1), Value.number(i));
            if (params.size() > 2) bindings.put(params.get(2), items);
            iterate(body, env, bindings, out);
        }
        return end;
    }

    private int forLoop(String src, Matcher m, Environment env, List<CallRecord> out) {
        DelimiterScanner.Span head = DelimiterScanner.readEnclosed(src, m.end() - 1);
        int pos = head.close + 1;
        while (pos < src.length() && Character.isWhitespace(src.charAt(pos))) pos++;

        String body;
        int end;
        if (pos < src.length() && src.charAt(pos) == '{') {
            DelimiterScanner.Span block = DelimiterScanner.readEnclosed(src, pos);
            body = block.content;
            end = block.close + 1;
        } else {
            end = statementEnd(src, pos);
            body = src.substring(pos, end);
            if (end < src.length()) end++;
        }

        String header = head.content.trim();
        if (tooDeep("for (" + header + ")")) return end;
        Matcher forOf = FOR_OF.matcher(header);
        if (forOf.matches()) {
            forOfLoop(forOf.group(1), forOf.group(2).trim(), body, env, out);
            return end;
        }
        Matcher counted = COUNTED.matcher(header);
        if (counted.matches()) {
            countedLoop(counted.group(1), Integer.parseInt(counted.group(2)), counted.group(3), body, env, out);
            return end;
        }
        Debug.get().d(TAG, "Unsupported loop header: " + header);
        return end;
    }

    private void forOfLoop(String var, String iterable, String body, Environment env, List<CallRecord> out) {
        Value items;
        try {
            items = evaluator.evaluate(iterable, env);
        } catch (SnippetSyntaxException e) {
            Debug.get().d(TAG, "for...of source " + iterable + " did not evaluate: " + e.getMessage());
            return;
        }
        if (!items.isArray()) {
            Debug.get().d(TAG, "for...of source " + iterable + " is not an array");
            return;
        }
        List<Value> list = items.asArray();
        int count = cap(list.size(), iterable);
        for (int i = 0; i < count; i++) {
            Map<String, Value> bindings = new LinkedHashMap<>();
            bindings.put(var, list.get(i));
            iterate(body, env, bindings, out);
        }
    }

    private void countedLoop(String var, int start, String boundText, String body, Environment env, List<CallRecord> out) {
        double bound;
        if (Character.isDigit(boundText.charAt(0))) {
            bound = Double.parseDouble(boundText);
        } else {
            Value v;
            try {
                v = evaluator.resolvePath(boundText, env);
            } catch (SnippetSyntaxException e) {
                Debug.get().d(TAG, "Loop bound " + boundText + " did not resolve: " + e.getMessage());
                return;
            }
            if (!v.isNumber()) {
                Debug.get().d(TAG, "Loop bound " + boundText + " is not a number");
                return;
            }
            bound = v.asNumber();
        }
        if (bound <= start) return;

        int count = cap((int) Math.min(Math.ceil(bound - start), Integer.MAX_VALUE), boundText);
        for (int k = 0; k < count; k++) {
            Map<String, Value> bindings = new LinkedHashMap<>();
            bindings.put(var, Value.number(start + k));
            iterate(body, env, bindings, out);
        }
    }

    private void iterate(String body, Environment env, Map<String, Value> bindings, List<CallRecord> out) {
        Environment child = env.childScope(bindings);
        loopDepth++;
        try {
            extractBlock(body, child, out);
        } finally {
            loopDepth--;
        }
        env.mergeFrom(child);
    }

    private boolean tooDeep(String loop) {
        if (loopDepth < MAX_LOOP_DEPTH) return false;
        String head = loop.length() > 40 ? loop.substring(0, 40) + "..." : loop;
        Debug.get().w(TAG, "Loop " + head + " nested deeper than " + MAX_LOOP_DEPTH + " levels; skipped");
        return true;
    }

    private int cap(int length, String source) {
        if (length > maxIterations) {
            Debug.get().w(TAG, "Loop over " + source + " truncated to " + maxIterations + " iterations");
            return maxIterations;
        }
        return length;
    }

    private static List<String> parameters(String text) {
        List<String> out = new ArrayList<>();
        for (String p : text.split(",")) {
            String name = p.trim();
            if (name.isEmpty()) continue;
            if (!IDENT.matcher(name).matches()) return null;
            out.add(name);
        }
        return out;
    }

    private static String blockBody(String body) {
        if (body.startsWith("{") && DelimiterScanner.isWhollyEnclosed(body)) {
            return body.substring(1, body.length() - 1);
        }
        return body;
    }

    // -------------------------
    // Plain statements
    // -------------------------

    private void plainSegment(String s, Environment env, List<CallRecord> out) {
        Matcher am = ASSIGN.matcher(s);
        Matcher cm = callPattern.matcher(s);
        int index = 0;
        while (index < s.length()) {
            int ai = nextMatch(am, s, index);
            int ci = nextMatch(cm, s, index);
            if (ai < 0 && ci < 0) break;
            if (ai >= 0 && (ci < 0 || ai < ci)) {
                index = assignment(s, am, env);
            } else {
                index = call(s, cm, env, out);
            }
        }
    }

    private static int nextMatch(Matcher m, String s, int from) {
        int pos = from;
        while (pos < s.length() && m.find(pos)) {
            if (!DelimiterScanner.isInsideString(s, m.start()) && !precededByDot(s, m.start())) {
                return m.start();
            }
            pos = m.start() + 1;
        }
        return -1;
    }

    private int assignment(String s, Matcher am, Environment env) {
        String keyword = am.group(1);
        String name = am.group(2);
        String op = am.group(3);
        String step = am.group(4);

        if (step != null) {
            Value current = env.get(name);
            if (current.isNumber()) {
                env.assign(name, Value.number(current.asNumber() + (step.equals("++") ? 1 : -1)));
            } else {
                Debug.get().d(TAG, "Skipped " + name + step + " on a non-number");
            }
            return skipTerminator(s, am.end());
        }

        int rhsStart = am.end();
        while (rhsStart < s.length() && Character.isWhitespace(s.charAt(rhsStart))) rhsStart++;

        // const slide = pptx.addSlide(); emits the call itself
        Matcher call = callPattern.matcher(s);
        call.region(rhsStart, s.length());
        if (op == null && call.lookingAt()) {
            bind(env, keyword, name, Value.undefined());
            return rhsStart;
        }

        int end = statementEnd(s, rhsStart);
        String rhs = s.substring(rhsStart, end);
        try {
            Value val = evaluator.evaluate(rhs, env);
            if (op != null) val = combine(op, env.get(name), val);
            bind(env, keyword, name, val);
        } catch (SnippetSyntaxException e) {
            Debug.get().d(TAG, "Skipped assignment to " + name + ": " + e.getMessage());
        }
        return end + 1;
    }

    private static void bind(Environment env, String keyword, String name, Value val) {
        if (keyword != null) env.define(name, val);
        else env.assign(name, val);
    }

    private static Value combine(String op, Value current, Value rhs) {
        if (op.equals("+") && (current.isString() || rhs.isString())) {
            return Value.string(current.toDisplayString() + rhs.toDisplayString());
        }
        if (current.isMissing() || rhs.isMissing()) return Value.nan();
        double a = ExpressionParser.toNumber(current);
        double b = ExpressionParser.toNumber(rhs);
        switch (op) {
            case "+": return Value.number(a + b);
            case "-": return Value.number(a - b);
            case "*": return Value.number(a * b);
            default: return Value.number(a / b);
        }
    }

    private int call(String s, Matcher cm, Environment env, List<CallRecord> out) {
        String name = cm.group(1).replaceAll("\\s+", "");
        int open = cm.end() - 1;
        DelimiterScanner.Span span;
        try {
            span = DelimiterScanner.readEnclosed(s, open);
        } catch (SnippetSyntaxException e) {
            Debug.get().w(TAG, "Unbalanced call to " + name + "; rest of statement block ignored", e);
            return s.length();
        }
        try {
            List<String> args = DelimiterScanner.splitTopLevel(span.content, ',');
            out.add(new CallRecord(name, args, env.snapshot()));
        } catch (SnippetSyntaxException e) {
            Debug.get().d(TAG, "Skipped call to " + name + ": " + e.getMessage());
        }
        return span.close + 1;
    }

    // -------------------------
    // Statement boundaries
    // -------------------------

    /**
     * End of the statement starting at {@code from}: the first top-level ';', or a top-level line
     * break where the expression is complete on both sides. Returns the length when neither occurs.
     */
    static int statementEnd(String s, int from) {
        int depth = 0;
        for (int i = from; i < s.length(); i++) {
            char ch = s.charAt(i);
            if (DelimiterScanner.isQuote(ch)) {
                try {
                    i = DelimiterScanner.skipString(s, i);
                } catch (SnippetSyntaxException e) {
                    return s.length();
                }
                continue;
            }
            if (ch == '(' || ch == '[' || ch == '{') {
                depth++;
            } else if (ch == ')' || ch == ']' || ch == '}') {
                if (--depth < 0) return i;
            } else if (depth == 0 && ch == ';') {
                return i;
            } else if (depth == 0 && ch == '\n' && lineBreakEndsStatement(s, from, i)) {
                return i;
            }
        }
        return s.length();
    }

    private static boolean lineBreakEndsStatement(String s, int from, int newline) {
        int p = newline - 1;
        while (p >= from && Character.isWhitespace(s.charAt(p))) p--;
        if (p < from) return false;
        if ("+-*/%=&|?:,([{<>!".indexOf(s.charAt(p)) >= 0) return false;

        int n = newline + 1;
        while (n < s.length() && Character.isWhitespace(s.charAt(n))) n++;
        if (n >= s.length()) return true;
        return "+-*/%&|?:.,)]}<>=".indexOf(s.charAt(n)) < 0;
    }

    private static int skipTerminator(String s, int from) {
        int i = from;
        while (i < s.length() && Character.isWhitespace(s.charAt(i)) && s.charAt(i) != '\n') i++;
        return (i < s.length() && s.charAt(i) == ';') ? i + 1 : from;
    }

    private static boolean precededByDot(String s, int index) {
        int p = index - 1;
        while (p >= 0 && Character.isWhitespace(s.charAt(p))) p--;
        return p >= 0 && s.charAt(p) == '.';
    }
}
