package com.deckscript.script;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.deckscript.debug.Debug;
import com.deckscript.script.deck.PresentationBuilder;
import com.deckscript.script.dispatch.CallDispatcher;
import com.deckscript.script.dispatch.DispatchDiagnostic;
import com.deckscript.script.dispatch.ImagePathPolicy;
import com.deckscript.script.dispatch.JsonValues;
import com.deckscript.script.dispatch.Operation;
import com.deckscript.script.dispatch.OptionSanitizer;
import com.deckscript.script.parser.CallRecord;
import com.deckscript.script.parser.Environment;
import com.deckscript.script.parser.ExpressionEvaluator;
import com.deckscript.script.parser.LayoutHelpers;
import com.deckscript.script.parser.StatementExtractor;
import com.deckscript.script.parser.Value;
import com.deckscript.script.resource.ClasspathResourceFetcher;
import com.deckscript.script.resource.IconLoader;
import com.deckscript.script.resource.PrefixResourceResolver;
import com.deckscript.script.resource.ResourceFetcher;
import com.deckscript.script.resource.ResourceInliner;
import com.deckscript.script.resource.ResourceResolver;
import com.deckscript.script.safety.SafetyValidator;
import com.deckscript.script.safety.SafetyValidators;
import com.deckscript.script.safety.SafetyVerdict;
import com.deckscript.script.safety.SnippetSanitizer;
import com.deckscript.script.safety.UnsafeSnippetException;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Core DeckScript engine.
 *
 * - Input: PptxGenJS-style snippets (pptx.addSlide(), slide.addText(...), slide.addChart(...), ...)
 * - Sandboxed: snippets are never executed; calls are extracted as text and replayed against a
 *   {@link PresentationBuilder} through a closed operation table
 * - Supported statements: let / const / var declarations, assignments (= += -= *= /= ++ --),
 *   for...of, counted for, array.forEach
 * - Safety: a static check runs before anything is extracted; unsafe snippets touch nothing
 *
 * The engine only holds configuration and can be reused for many snippets, one at a time.
 */
public class DeckScript {

    /** Functional interface for helper functions callable from expressions. */
    public interface BuiltinFunction {
        Value call(List<Value> args);
    }

    private static final String TAG = "DeckScript";

    public static final int DEFAULT_MAX_LOOP_ITERATIONS = 1000;
    public static final double DEFAULT_SLIDE_WIDTH = 13.33;
    public static final double DEFAULT_SLIDE_HEIGHT = 7.5;
    public static final String DEFAULT_FONT_FACE = "Rakuten Sans JP";
    public static final String DEFAULT_RESOURCE_SCHEME = "chrome-extension:";
    public static final String DEFAULT_FALLBACK_ICON = "icon/solid/square.svg";

    public static final String ERROR_HEADLINE = "An error occurred and this slide could not be generated.";

    private static final String NESTING_MESSAGE = "Snippet is nested too deeply";

    private int maxLoopIterations = DEFAULT_MAX_LOOP_ITERATIONS;
    private double slideWidth = DEFAULT_SLIDE_WIDTH;
    private double slideHeight = DEFAULT_SLIDE_HEIGHT;
    private String defaultFontFace = DEFAULT_FONT_FACE;
    private String defaultMasterName = null;
    private SafetyValidator safetyValidator = null;
    private ResourceResolver resourceResolver = new PrefixResourceResolver();
    private ResourceFetcher resourceFetcher = new ClasspathResourceFetcher();
    private String resourceScheme = DEFAULT_RESOURCE_SCHEME;
    private String fallbackIconPath = DEFAULT_FALLBACK_ICON;

    // rebuilt whenever one of its inputs changes
    private IconLoader iconLoader;

    public DeckScript() {}

    // ===================== CONFIGURATION =====================

    public void setMaxLoopIterations(int max) {
        if (max < 0) throw new IllegalArgumentException("maxLoopIterations < 0");
        this.maxLoopIterations = max;
    }

    public int getMaxLoopIterations() { return maxLoopIterations; }

    public void setSlideSize(double width, double height) {
        if (!(width > 0) || !(height > 0)) throw new IllegalArgumentException("slide size must be positive");
        this.slideWidth = width;
        this.slideHeight = height;
    }

    public double getSlideWidth() { return slideWidth; }
    public double getSlideHeight() { return slideHeight; }

    public void setDefaultFontFace(String fontFace) { this.defaultFontFace = fontFace; }
    public String getDefaultFontFace() { return defaultFontFace; }

    /** Master slide applied by pptx.addSlide() when the snippet names none. Null disables it. */
    public void setDefaultMasterName(String masterName) {
        this.defaultMasterName = (masterName == null || masterName.trim().isEmpty()) ? null : masterName.trim();
    }

    public String getDefaultMasterName() { return defaultMasterName; }

    /** Null restores the preferred strategy. */
    public void setSafetyValidator(SafetyValidator validator) { this.safetyValidator = validator; }

    public SafetyValidator getSafetyValidator() {
        if (safetyValidator == null) safetyValidator = SafetyValidators.preferred(allowedCalls());
        return safetyValidator;
    }

    public void setResourceResolver(ResourceResolver resolver) {
        this.resourceResolver = resolver;
        this.iconLoader = null;
    }

    public ResourceResolver getResourceResolver() { return resourceResolver; }

    public void setResourceFetcher(ResourceFetcher fetcher) {
        if (fetcher == null) throw new IllegalArgumentException("fetcher is null");
        this.resourceFetcher = fetcher;
        this.iconLoader = null;
    }

    public ResourceFetcher getResourceFetcher() { return resourceFetcher; }

    public void setResourceScheme(String scheme) {
        if (scheme == null || scheme.isEmpty()) throw new IllegalArgumentException("scheme is empty");
        this.resourceScheme = scheme;
    }

    public String getResourceScheme() { return resourceScheme; }

    public void setFallbackIconPath(String path) {
        this.fallbackIconPath = path;
        this.iconLoader = null;
    }

    public String getFallbackIconPath() { return fallbackIconPath; }

    /** Names a snippet may call: the operation table plus the expression helpers. */
    public Set<String> allowedCalls() {
        Set<String> names = new LinkedHashSet<>(Operation.names());
        names.addAll(helpers().keySet());
        return Collections.unmodifiableSet(names);
    }

    // ===================== ENGINE PUBLIC API =====================

    public SafetyVerdict check(String snippet) {
        if (snippet == null) throw new IllegalArgumentException("snippet is null");
        return getSafetyValidator().check(snippet);
    }

    /** Call records for a snippet, in source order. Unsafe snippets yield an empty list. */
    public List<CallRecord> extract(String snippet) {
        SafetyVerdict verdict = check(snippet);
        if (!verdict.isSafe()) {
            Debug.get().w(TAG, "Snippet rejected: " + verdict.reason());
            return Collections.emptyList();
        }
        return extractor(newEvaluator()).extract(snippet, rootEnvironment());
    }

    /**
     * Checks, extracts and dispatches one snippet.
     *
     * @throws UnsafeSnippetException when the safety check fails; the builder is then untouched
     */
    public RunResult run(String snippet, PresentationBuilder builder) {
        if (builder == null) throw new IllegalArgumentException("builder is null");
        SafetyVerdict verdict = check(snippet);
        if (!verdict.isSafe()) {
            Debug.get().w(TAG, "Snippet rejected: " + verdict.reason());
            throw new UnsafeSnippetException(verdict);
        }

        ExpressionEvaluator evaluator = newEvaluator();
        List<CallRecord> records = extractor(evaluator).extract(snippet, rootEnvironment());
        Debug.get().d(TAG, "Extracted " + records.size() + " calls");

        CallDispatcher dispatcher = new CallDispatcher(
                builder,
                evaluator,
                new OptionSanitizer(defaultFontFace),
                new ImagePathPolicy(resourceResolver, resourceScheme, iconLoader()),
                slideWidth,
                slideHeight,
                defaultMasterName);
        List<DispatchDiagnostic> diagnostics = dispatcher.dispatchAll(records);
        return RunResult.completed(verdict, records.size(), diagnostics);
    }

    /**
     * Host flow for one generated snippet: drops construction / write lines, inlines internal
     * icons, then runs it. Any snippet-level failure, an unsafe snippet included, is replaced by a
     * visible error slide instead of being thrown.
     */
    public RunResult generate(String snippet, PresentationBuilder builder) {
        if (builder == null) throw new IllegalArgumentException("builder is null");
        try {
            String prepared = inlineResources(SnippetSanitizer.stripConstructionLines(snippet));
            return run(prepared, builder);
        } catch (UnsafeSnippetException e) {
            Debug.get().e(TAG, "snippet error", e);
            addErrorSlide(builder, e.getMessage());
            return RunResult.failed(e.verdict(), e.getMessage());
        } catch (RuntimeException e) {
            Debug.get().e(TAG, "snippet error", e);
            String message = (e.getMessage() == null) ? e.toString() : e.getMessage();
            addErrorSlide(builder, message);
            return RunResult.failed(null, message);
        } catch (StackOverflowError e) {
            Debug.get().e(TAG, "snippet nested too deeply", e);
            addErrorSlide(builder, NESTING_MESSAGE);
            return RunResult.failed(null, NESTING_MESSAGE);
        }
    }

    /** {@link #generate} for each snippet in turn; one failing snippet does not stop the rest. */
    public List<RunResult> generateAll(List<String> snippets, PresentationBuilder builder) {
        List<RunResult> out = new ArrayList<>();
        if (snippets == null) return out;
        for (String s : snippets) out.add(generate(s, builder));
        return out;
    }

    /** Replaces literal chrome.runtime.getURL('...') calls with inlined data URLs. */
    public String inlineResources(String code) {
        return new ResourceInliner(iconLoader()).inline(code);
    }

    // ===================== INTERNALS =====================

    private Map<String, BuiltinFunction> helpers() {
        return LayoutHelpers.create(slideWidth, slideHeight);
    }

    private ExpressionEvaluator newEvaluator() {
        return new ExpressionEvaluator(helpers(), resourceResolver, resourceScheme);
    }

    private StatementExtractor extractor(ExpressionEvaluator evaluator) {
        return new StatementExtractor(evaluator, Operation.names(), maxLoopIterations);
    }

    private Environment rootEnvironment() {
        Environment env = new Environment();
        env.define("SLIDE_W", Value.number(slideWidth));
        env.define("SLIDE_H", Value.number(slideHeight));
        return env;
    }

    private IconLoader iconLoader() {
        if (iconLoader == null) {
            ResourceResolver resolver = (resourceResolver != null) ? resourceResolver : new PrefixResourceResolver();
            iconLoader = new IconLoader(resolver, resourceFetcher, fallbackIconPath);
        }
        return iconLoader;
    }

    private void addErrorSlide(PresentationBuilder builder, String message) {
        try {
            ObjectNode slideOpts = JsonValues.newObject();
            if (defaultMasterName != null) slideOpts.put("masterName", defaultMasterName);
            PresentationBuilder.Slide slide = builder.addSlide(slideOpts);

            ObjectNode headline = JsonValues.newObject();
            headline.put("x", 0.5);
            headline.put("y", 0.5);
            headline.put("w", slideWidth - 1);
            headline.put("h", 1);
            if (defaultFontFace != null) headline.put("fontFace", defaultFontFace);
            headline.put("fontSize", 18);
            headline.put("color", "FF0000");
            headline.put("bold", true);
            slide.addText(JsonValues.toJson(Value.string(ERROR_HEADLINE)), headline);

            ObjectNode detail = JsonValues.newObject();
            detail.put("x", 0.5);
            detail.put("y", 1.5);
            detail.put("w", slideWidth - 1);
            detail.put("h", slideHeight - 2);
            if (defaultFontFace != null) detail.put("fontFace", defaultFontFace);
            detail.put("fontSize", 14);
            detail.put("color", "000000");
            slide.addText(JsonValues.toJson(Value.string(message == null ? "" : message)), detail);
        } catch (RuntimeException e2) {
            Debug.get().e(TAG, "failed to add error slide", e2);
        }
    }
}
