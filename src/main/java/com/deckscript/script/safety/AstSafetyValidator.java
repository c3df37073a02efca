package com.deckscript.script.safety;

import java.util.Set;

import org.mozilla.javascript.CompilerEnvirons;
import org.mozilla.javascript.Context;
import org.mozilla.javascript.Parser;
import org.mozilla.javascript.RhinoException;
import org.mozilla.javascript.ast.AstNode;
import org.mozilla.javascript.ast.AstRoot;
import org.mozilla.javascript.ast.FunctionCall;
import org.mozilla.javascript.ast.Name;
import org.mozilla.javascript.ast.NodeVisitor;
import org.mozilla.javascript.ast.PropertyGet;

import com.deckscript.debug.Debug;

/**
 * Syntax-tree check built on Mozilla Rhino's parser. The snippet is parsed (never compiled or
 * run) and every node is visited:
 *
 * - any name equal to a banned capability rejects the snippet, wherever it appears;
 * - any call or {@code new} whose callee is not a plain dotted name in the allowed set rejects it,
 *   except {@code <anything>.forEach(...)}.
 *
 * Code Rhino cannot parse is rejected.
 */
public final class AstSafetyValidator implements SafetyValidator {

    private static final String TAG = "SafetyValidator";

    public static final Set<String> BANNED_NAMES = Set.of(
            "fetch", "XMLHttpRequest", "localStorage", "sessionStorage", "indexedDB",
            "chrome", "document", "window", "navigator", "globalThis",
            "eval", "Function", "importScripts", "WebSocket");

    private final Set<String> allowedCalls;

    public AstSafetyValidator(Set<String> allowedCalls) {
        if (allowedCalls == null) throw new IllegalArgumentException("allowedCalls is null");
        this.allowedCalls = Set.copyOf(allowedCalls);
    }

    @Override
    public SafetyVerdict check(String code) {
        AstRoot root;
        try {
            CompilerEnvirons env = new CompilerEnvirons();
            env.setLanguageVersion(Context.VERSION_ES6);
            env.setRecordingComments(false);
            root = new Parser(env).parse(code == null ? "" : code, "<snippet>", 1);
        } catch (RhinoException e) {
            Debug.get().d(TAG, "parse error: " + e.getMessage());
            return SafetyVerdict.reject("Parse error: " + e.details());
        } catch (RuntimeException e) {
            Debug.get().d(TAG, "parse failure: " + e);
            return SafetyVerdict.reject("Parse error: " + e.getMessage());
        }

        Walker walker = new Walker();
        root.visit(walker);
        return walker.verdict;
    }

    private final class Walker implements NodeVisitor {
        SafetyVerdict verdict = SafetyVerdict.ok();

        @Override
        public boolean visit(AstNode node) {
            if (!verdict.isSafe()) return false;

            if (node instanceof Name) {
                String id = ((Name) node).getIdentifier();
                if (BANNED_NAMES.contains(id)) {
                    verdict = SafetyVerdict.reject("Banned identifier: " + id);
                    return false;
                }
            } else if (node instanceof FunctionCall) {
                // NewExpression is a FunctionCall too
                String callee = memberName(((FunctionCall) node).getTarget());
                if (callee.isEmpty()) {
                    verdict = SafetyVerdict.reject("Call through a computed callee");
                    return false;
                }
                if (!callee.endsWith(".forEach") && !allowedCalls.contains(callee)) {
                    verdict = SafetyVerdict.reject("Call not allowed: " + callee);
                    return false;
                }
            }
            return true;
        }
    }

    /** "a.b.c" for a chain of plain property reads, "" for anything computed. */
    static String memberName(AstNode node) {
        if (node instanceof Name) return ((Name) node).getIdentifier();
        if (node instanceof PropertyGet) {
            PropertyGet pg = (PropertyGet) node;
            String target = memberName(pg.getTarget());
            String prop = memberName(pg.getProperty());
            return (target.isEmpty() || prop.isEmpty()) ? "" : target + "." + prop;
        }
        return "";
    }
}
