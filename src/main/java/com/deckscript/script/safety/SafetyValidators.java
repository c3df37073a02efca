package com.deckscript.script.safety;

import java.util.Set;

import com.deckscript.debug.Debug;

/** Picks the safety strategy: the syntax-tree walk when Rhino is on the class path, else patterns. */
public final class SafetyValidators {

    private static final String RHINO_PARSER = "org.mozilla.javascript.Parser";

    private SafetyValidators() {}

    public static boolean treeParserAvailable() {
        try {
            Class.forName(RHINO_PARSER, false, SafetyValidators.class.getClassLoader());
            return true;
        } catch (ClassNotFoundException | LinkageError e) {
            return false;
        }
    }

    public static SafetyValidator preferred(Set<String> allowedCalls) {
        if (treeParserAvailable()) return new AstSafetyValidator(allowedCalls);
        Debug.get().w("SafetyValidator", "Rhino parser not found; using pattern checks");
        return new PatternSafetyValidator();
    }
}
