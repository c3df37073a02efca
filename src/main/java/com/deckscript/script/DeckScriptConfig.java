package com.deckscript.script;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import com.deckscript.script.resource.ClasspathResourceFetcher;
import com.deckscript.script.resource.PrefixResourceResolver;
import com.deckscript.script.safety.PatternSafetyValidator;
import com.deckscript.script.safety.SafetyValidators;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * JSON engine configuration. Every field is optional; absent fields keep the engine default.
 *
 * <pre>
 * {
 *   "maxLoopIterations": 500,
 *   "slideWidth": 10, "slideHeight": 5.625,
 *   "defaultFontFace": "Arial",
 *   "defaultMasterName": "MASTER_SLIDE",
 *   "resourceBase": "chrome-extension://deckscript/",
 *   "resourceRoot": "deck-resources/",
 *   "resourceScheme": "chrome-extension:",
 *   "fallbackIconPath": "icon/solid/square.svg",
 *   "safety": "auto" | "ast" | "pattern"
 * }
 * </pre>
 */
public class DeckScriptConfig {

    private static final ObjectMapper om = new ObjectMapper();

    public Integer maxLoopIterations;
    public Double slideWidth;
    public Double slideHeight;
    public String defaultFontFace;
    public String defaultMasterName;
    public String resourceBase;
    public String resourceRoot;
    public String resourceScheme;
    public String fallbackIconPath;
    public String safety;

    public static DeckScriptConfig load(Path path) throws IOException {
        return parse(Files.readString(path));
    }

    public static DeckScriptConfig parse(String json) throws IOException {
        return om.readValue(json, DeckScriptConfig.class);
    }

    public DeckScript applyTo(DeckScript engine) {
        if (maxLoopIterations != null) engine.setMaxLoopIterations(maxLoopIterations);
        if (slideWidth != null || slideHeight != null) {
            engine.setSlideSize(
                    slideWidth != null ? slideWidth : engine.getSlideWidth(),
                    slideHeight != null ? slideHeight : engine.getSlideHeight());
        }
        if (defaultFontFace != null) engine.setDefaultFontFace(defaultFontFace);
        if (defaultMasterName != null) engine.setDefaultMasterName(defaultMasterName);
        if (resourceScheme != null) engine.setResourceScheme(resourceScheme);
        if (fallbackIconPath != null) engine.setFallbackIconPath(fallbackIconPath);

        if (resourceBase != null || resourceRoot != null) {
            String base = (resourceBase != null) ? resourceBase : PrefixResourceResolver.DEFAULT_BASE;
            String root = (resourceRoot != null) ? resourceRoot : ClasspathResourceFetcher.DEFAULT_ROOT;
            PrefixResourceResolver resolver = new PrefixResourceResolver(base);
            engine.setResourceResolver(resolver);
            engine.setResourceFetcher(new ClasspathResourceFetcher(resolver.base(), root));
        }

        if (safety != null) {
            switch (safety) {
                case "pattern":
                    engine.setSafetyValidator(new PatternSafetyValidator());
                    break;
                case "ast":
                    if (!SafetyValidators.treeParserAvailable()) {
                        throw new IllegalArgumentException("safety=ast but the Rhino parser is not available");
                    }
                    engine.setSafetyValidator(null);
                    break;
                case "auto":
                    engine.setSafetyValidator(null);
                    break;
                default:
                    throw new IllegalArgumentException("Unknown safety strategy: " + safety);
            }
        }
        return engine;
    }
}
