package com.deckscript.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.deckscript.script.DeckScript.BuiltinFunction;
import com.deckscript.script.resource.ResourceResolver;

/**
 * Evaluates one expression text of the snippet dialect against an {@link Environment}.
 *
 * Forms are tried in a fixed order: literals, ternary, chrome.runtime.getURL, whole helper calls,
 * template strings, object and array literals, pptx enum constants, identifier paths and finally
 * arithmetic. Text that fits none of them raises {@link SnippetSyntaxException}. Nothing is ever
 * executed; helper calls go to the closed registry handed in by the engine.
 */
public class ExpressionEvaluator {

    private static final int MAX_DEPTH = 200;

    private static final Pattern NUMBER = Pattern.compile("-?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");
    private static final Pattern CALLEE = Pattern.compile("^([A-Za-z_$][\\w$]*(?:\\s*\\.\\s*[A-Za-z_$][\\w$]*)*)\\s*\\(");
    private static final Pattern GET_URL = Pattern.compile("^chrome\\s*\\.\\s*runtime\\s*\\.\\s*getURL$");
    private static final Pattern ENUM_CONSTANT = Pattern.compile("^pptx\\s*\\.\\s*(ShapeType|ChartType)\\s*\\.\\s*([A-Za-z_$][\\w$]*)$");
    private static final Pattern IDENT = Pattern.compile("[A-Za-z_$][\\w$]*");
    private static final Pattern URL_SCHEME = Pattern.compile("^[A-Za-z][A-Za-z0-9+.\\-]*:");

    private final Map<String, BuiltinFunction> helpers;
    private final ResourceResolver resolver;
    private final String resourceScheme;
    private int depth = 0;

    public ExpressionEvaluator(Map<String, BuiltinFunction> helpers, ResourceResolver resolver, String resourceScheme) {
        this.helpers = (helpers == null) ? Collections.<String, BuiltinFunction>emptyMap() : helpers;
        this.resolver = resolver;
        this.resourceScheme = (resourceScheme == null) ? "chrome-extension:" : resourceScheme;
    }

    public boolean isHelper(String name) {
        return helpers.containsKey(name);
    }

    public Value evaluate(String text, Environment env) {
        if (text == null) throw SnippetSyntaxException.unsupported("<null>");
        if (++depth > MAX_DEPTH) {
            depth--;
            throw SnippetSyntaxException.unsupported("expression nested too deeply");
        }
        try {
            return evaluateTrimmed(text.trim(), env);
        } finally {
            depth--;
        }
    }

    private Value evaluateTrimmed(String t, Environment env) {
        if (t.isEmpty()) throw SnippetSyntaxException.unsupported("<empty>");

        // 1. literals
        if (DelimiterScanner.isSingleStringLiteral(t) && t.charAt(0) != '`') {
            return Value.string(ExpressionLexer.decodeString(t));
        }
        if (NUMBER.matcher(t).matches()) return Value.number(Double.parseDouble(t));
        switch (t) {
            case "true": return Value.bool(true);
            case "false": return Value.bool(false);
            case "null": return Value.nil();
            case "undefined": return Value.undefined();
            default: break;
        }

        // 2. ternary
        int question = findTernaryQuestion(t);
        if (question >= 0) {
            int colon = findTernaryColon(t, question + 1);
            if (colon < 0) throw SnippetSyntaxException.unsupported(t);
            Value cond = evaluate(t.substring(0, question), env);
            return cond.truthy()
                    ? evaluate(t.substring(question + 1, colon), env)
                    : evaluate(t.substring(colon + 1), env);
        }

        // 3. whole calls: getURL, helpers
        Matcher callee = CALLEE.matcher(t);
        if (callee.find()) {
            int open = callee.end() - 1;
            DelimiterScanner.Span args = DelimiterScanner.readEnclosed(t, open);
            if (args.close == t.length() - 1) {
                String name = callee.group(1).replaceAll("\\s+", "");
                if (GET_URL.matcher(name).matches()) return getUrl(args.content, env);
                return callHelper(name, args.content, env, t);
            }
        }
        if (t.startsWith("chrome.") || t.equals("chrome")) {
            throw new SnippetSyntaxException("chrome.* calls are not allowed");
        }

        // 4. template strings
        if (t.charAt(0) == '`' && DelimiterScanner.isSingleStringLiteral(t)) {
            return template(t, env);
        }

        // 5. object and array literals
        if (t.charAt(0) == '{' && DelimiterScanner.isWhollyEnclosed(t)) return object(t, env);
        if (t.charAt(0) == '[' && DelimiterScanner.isWhollyEnclosed(t)) return array(t, env);

        // 6. backend constants
        Matcher constant = ENUM_CONSTANT.matcher(t);
        if (constant.matches()) return Value.string(constant.group(2));

        // 7. identifier paths
        if (isPath(t)) return resolvePath(t, env);

        // 8. arithmetic
        List<Token> tokens = new ExpressionLexer(t).tokenize();
        return new ExpressionParser(tokens, this, env).parse();
    }

    // -------------------------
    // Calls
    // -------------------------

    private Value callHelper(String name, String argText, Environment env, String whole) {
        String target = name;
        if (!helpers.containsKey(target)) {
            Value bound = env.exists(name) ? env.get(name) : Value.undefined();
            if (bound.getType() == Value.Type.FUNC && helpers.containsKey(bound.asFunc())) {
                target = bound.asFunc();
            } else if (name.startsWith("chrome.")) {
                throw new SnippetSyntaxException("chrome.* calls are not allowed");
            } else {
                throw SnippetSyntaxException.unsupported(whole);
            }
        }

        List<Value> args = new ArrayList<>();
        for (String arg : DelimiterScanner.splitTopLevel(argText, ',')) {
            args.add(evaluate(arg, env));
        }
        try {
            Value result = helpers.get(target).call(args);
            return (result == null) ? Value.undefined() : result;
        } catch (SnippetSyntaxException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SnippetSyntaxException("Helper " + target + " failed: " + e.getMessage(), e);
        }
    }

    private Value getUrl(String argText, Environment env) {
        List<String> args = DelimiterScanner.splitTopLevel(argText, ',');
        if (args.size() != 1) throw new SnippetSyntaxException("Invalid getURL path");
        Value rel = evaluate(args.get(0), env);
        if (!rel.isString() || rel.asString().isEmpty() || URL_SCHEME.matcher(rel.asString()).find()) {
            throw new SnippetSyntaxException("Invalid getURL path");
        }
        if (resolver == null) throw new SnippetSyntaxException("chrome.runtime.getURL unavailable");
        String url = resolver.resolve(rel.asString());
        if (url == null || !url.startsWith(resourceScheme)) {
            throw new SnippetSyntaxException("Invalid getURL result");
        }
        return Value.string(url);
    }

    // -------------------------
    // Templates and literals
    // -------------------------

    private Value template(String t, Environment env) {
        String body = t.substring(1, t.length() - 1);
        StringBuilder out = new StringBuilder();
        int i = 0;
        while (i < body.length()) {
            char ch = body.charAt(i);
            if (ch == '\\' && i + 1 < body.length()) {
                out.append(ExpressionLexer.decodeString("'" + body.substring(i, i + 2) + "'"));
                i += 2;
                continue;
            }
            if (ch == '$' && i + 1 < body.length() && body.charAt(i + 1) == '{') {
                DelimiterScanner.Span span = DelimiterScanner.readEnclosed(body, i + 1);
                Value v = evaluate(span.content, env);
                if (!v.isNullish() && v.getType() != Value.Type.FUNC) out.append(v.toDisplayString());
                i = span.close + 1;
                continue;
            }
            out.append(ch);
            i++;
        }
        return Value.string(out.toString());
    }

    private Value object(String t, Environment env) {
        Map<String, Value> out = new LinkedHashMap<>();
        String inner = t.substring(1, t.length() - 1);
        for (String entry : DelimiterScanner.splitTopLevel(inner, ',')) {
            if (entry.isEmpty()) continue;
            int colon = DelimiterScanner.findTopLevel(entry, 0, ':');
            String key;
            String valueText;
            if (colon < 0) {
                if (!IDENT.matcher(entry).matches()) continue;
                key = entry;
                valueText = entry;
            } else {
                key = objectKey(entry.substring(0, colon).trim(), env);
                valueText = entry.substring(colon + 1);
                if (key == null) continue;
            }
            Value v = evaluateEntry(valueText, env);
            if (v != null) out.put(key, v);
        }
        return Value.map(out);
    }

    private String objectKey(String raw, Environment env) {
        if (DelimiterScanner.isSingleStringLiteral(raw) && raw.charAt(0) != '`') {
            return ExpressionLexer.decodeString(raw);
        }
        if (IDENT.matcher(raw).matches()) return raw;
        if (NUMBER.matcher(raw).matches()) return Value.formatNumber(Double.parseDouble(raw));
        if (raw.startsWith("[") && DelimiterScanner.isWhollyEnclosed(raw)) {
            Value computed = evaluateEntry(raw.substring(1, raw.length() - 1), env);
            return (computed == null) ? null : computed.toDisplayString();
        }
        return null;
    }

    private Value array(String t, Environment env) {
        List<Value> out = new ArrayList<>();
        for (String item : DelimiterScanner.splitTopLevel(t.substring(1, t.length() - 1), ',')) {
            if (item.isEmpty()) continue;
            Value v = evaluateEntry(item, env);
            if (v != null) out.add(v);
        }
        return Value.array(out);
    }

    // Literal entries are dropped, not fatal, when they fail or produce no value.
    private Value evaluateEntry(String text, Environment env) {
        try {
            Value v = evaluate(text, env);
            return v.isMissing() ? null : v;
        } catch (SnippetSyntaxException e) {
            return null;
        }
    }

    // -------------------------
    // Paths
    // -------------------------

    static boolean isPath(String t) {
        if (t.isEmpty() || !ExpressionLexer.isAlpha(t.charAt(0))) return false;
        int i = 1;
        while (i < t.length() && ExpressionLexer.isAlphaNumeric(t.charAt(i))) i++;
        while (i < t.length()) {
            char ch = t.charAt(i);
            if (ch == '.' && i + 1 < t.length() && ExpressionLexer.isAlpha(t.charAt(i + 1))) {
                i += 2;
                while (i < t.length() && ExpressionLexer.isAlphaNumeric(t.charAt(i))) i++;
            } else if (ch == '[') {
                try {
                    i = DelimiterScanner.readEnclosed(t, i).close + 1;
                } catch (SnippetSyntaxException e) {
                    return false;
                }
            } else {
                return false;
            }
        }
        return true;
    }

    /**
     * Resolves a dotted / indexed identifier path. Any segment that does not exist yields
     * undefined; {@code .length} works on arrays and strings.
     */
    public Value resolvePath(String path, Environment env) {
        String t = path.trim();
        if (!isPath(t)) throw SnippetSyntaxException.unsupported(t);

        int i = 0;
        while (i < t.length() && ExpressionLexer.isAlphaNumeric(t.charAt(i))) i++;
        String head = t.substring(0, i);
        Value current;
        if (env.exists(head)) current = env.get(head);
        else if (helpers.containsKey(head)) current = Value.func(head);
        else current = Value.undefined();

        while (i < t.length()) {
            if (t.charAt(i) == '.') {
                int start = ++i;
                while (i < t.length() && ExpressionLexer.isAlphaNumeric(t.charAt(i))) i++;
                current = member(current, t.substring(start, i));
            } else {
                DelimiterScanner.Span span = DelimiterScanner.readEnclosed(t, i);
                current = index(current, evaluate(span.content, env));
                i = span.close + 1;
            }
        }
        return current;
    }

    private static Value member(Value target, String name) {
        if (target.isMap()) {
            Value v = target.asMap().get(name);
            return (v == null) ? Value.undefined() : v;
        }
        if (name.equals("length")) {
            if (target.isArray()) return Value.number(target.asArray().size());
            if (target.isString()) return Value.number(target.asString().length());
        }
        return Value.undefined();
    }

    private static Value index(Value target, Value key) {
        if (key.isMissing() || key.isNullish()) return Value.undefined();
        if (target.isArray() || target.isString()) {
            if (!key.isNumber()) return member(target, key.toDisplayString());
            double d = key.asNumber();
            if (d != Math.rint(d) || d < 0) return Value.undefined();
            int idx = (int) d;
            if (target.isArray()) {
                List<Value> items = target.asArray();
                return idx < items.size() ? items.get(idx) : Value.undefined();
            }
            String s = target.asString();
            return idx < s.length() ? Value.string(String.valueOf(s.charAt(idx))) : Value.undefined();
        }
        if (target.isMap()) return member(target, key.toDisplayString());
        return Value.undefined();
    }

    // -------------------------
    // Ternary scanning
    // -------------------------

    private static int findTernaryQuestion(String t) {
        int depth = 0;
        for (int i = 0; i < t.length(); i++) {
            char ch = t.charAt(i);
            if (DelimiterScanner.isQuote(ch)) {
                i = DelimiterScanner.skipString(t, i);
                continue;
            }
            if (ch == '(' || ch == '[' || ch == '{') depth++;
            else if (ch == ')' || ch == ']' || ch == '}') depth--;
            else if (ch == '?' && depth == 0) {
                char next = (i + 1 < t.length()) ? t.charAt(i + 1) : '\0';
                if (next == '?') {
                    i++;
                    continue;
                }
                if (next == '.') continue;
                return i;
            }
        }
        return -1;
    }

    private static int findTernaryColon(String t, int from) {
        int depth = 0;
        int nested = 0;
        for (int i = from; i < t.length(); i++) {
            char ch = t.charAt(i);
            if (DelimiterScanner.isQuote(ch)) {
                i = DelimiterScanner.skipString(t, i);
                continue;
            }
            if (ch == '(' || ch == '[' || ch == '{') depth++;
            else if (ch == ')' || ch == ']' || ch == '}') depth--;
            else if (depth == 0 && ch == '?') {
                char next = (i + 1 < t.length()) ? t.charAt(i + 1) : '\0';
                if (next == '?') {
                    i++;
                } else if (next != '.') {
                    nested++;
                }
            } else if (depth == 0 && ch == ':') {
                if (nested == 0) return i;
                nested--;
            }
        }
        return -1;
    }
}
