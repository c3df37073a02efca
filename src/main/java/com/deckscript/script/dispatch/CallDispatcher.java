package com.deckscript.script.dispatch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.deckscript.debug.Debug;
import com.deckscript.script.deck.ChartType;
import com.deckscript.script.deck.PresentationBuilder;
import com.deckscript.script.deck.ShapeType;
import com.deckscript.script.parser.CallRecord;
import com.deckscript.script.parser.ExpressionEvaluator;
import com.deckscript.script.parser.Value;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Executes extracted call records against a {@link PresentationBuilder}, in order, exactly once
 * each.
 *
 * One dispatcher serves one snippet: it owns the current-slide cursor, and slide operations
 * issued before any pptx.addSlide() create a slide first. A failing call is logged, recorded as a
 * {@link DispatchDiagnostic} and does not stop the calls after it.
 */
public class CallDispatcher {

    private static final String TAG = "CallDispatcher";

    private final PresentationBuilder builder;
    private final ArgumentBinder binder;
    private final OptionSanitizer sanitizer;
    private final ImagePathPolicy images;
    private final double slideW;
    private final double slideH;
    private final String defaultMasterName;

    private final List<DispatchDiagnostic> diagnostics = new ArrayList<>();
    private PresentationBuilder.Slide slide;
    private int dispatched = 0;

    public CallDispatcher(PresentationBuilder builder, ExpressionEvaluator evaluator, OptionSanitizer sanitizer,
                          ImagePathPolicy images, double slideW, double slideH, String defaultMasterName) {
        if (builder == null) throw new IllegalArgumentException("builder is null");
        if (sanitizer == null) throw new IllegalArgumentException("sanitizer is null");
        if (images == null) throw new IllegalArgumentException("images is null");
        this.builder = builder;
        this.binder = new ArgumentBinder(evaluator);
        this.sanitizer = sanitizer;
        this.images = images;
        this.slideW = slideW;
        this.slideH = slideH;
        this.defaultMasterName = defaultMasterName;
    }

    public List<DispatchDiagnostic> dispatchAll(List<CallRecord> records) {
        for (CallRecord r : records) dispatch(r);
        return diagnostics();
    }

    /** Returns false when the call failed; the failure is in {@link #diagnostics()}. */
    public boolean dispatch(CallRecord record) {
        int index = dispatched++;
        Operation op = Operation.fromName(record.operationName());
        if (op == null) {
            fail(index, record.operationName(), "Not allowed call: " + record.operationName(), null);
            return false;
        }
        try {
            execute(op, record);
            return true;
        } catch (RuntimeException e) {
            fail(index, op.qualifiedName(), e.getMessage(), e);
            return false;
        }
    }

    public List<DispatchDiagnostic> diagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    private void fail(int index, String operation, String message, Throwable cause) {
        String msg = (message == null) ? "call failed" : message;
        Debug.get().w(TAG, "generation error in " + operation + ": " + msg, cause);
        diagnostics.add(new DispatchDiagnostic(index, operation, msg));
    }

    private void execute(Operation op, CallRecord record) {
        switch (op) {
            case ADD_SLIDE: {
                List<Value> args = binder.bind(op, record);
                slide = builder.addSlide(slideOptions(args.get(0)));
                break;
            }
            case ADD_TEXT: {
                ensureSlide();
                List<Value> args = binder.bind(op, record);
                JsonNode text = JsonValues.toJson(args.get(0));
                ObjectNode opts = JsonValues.toObject(args.get(1));
                Geometry.normalizeBox(opts, slideW, slideH);
                sanitizer.textOptions(opts);
                sanitizer.textRuns(text);
                OptionSanitizer.ensureColorStrings(opts);
                OptionSanitizer.ensureColorStrings(text);
                slide.addText(text, opts);
                break;
            }
            case ADD_SHAPE: {
                ensureSlide();
                List<Value> args = binder.bind(op, record);
                Value shapeName = args.get(0);
                ShapeType shape = shapeName.isString() ? ShapeType.fromName(shapeName.asString()) : null;
                ObjectNode opts = JsonValues.toObject(args.get(1));
                Geometry.normalizeBox(opts, slideW, slideH);
                sanitizer.shapeOptions(opts);
                if (shape == null) {
                    Debug.get().d(TAG, "Skipped shape " + shapeName.toDisplayString());
                    break;
                }
                OptionSanitizer.ensureColorStrings(opts);
                slide.addShape(shape, opts);
                break;
            }
            case ADD_IMAGE: {
                ensureSlide();
                List<Value> args = binder.bind(op, record);
                ObjectNode opts = JsonValues.toObject(args.get(0));
                Geometry.normalizeBox(opts, slideW, slideH);
                images.apply(opts);
                OptionSanitizer.ensureColorStrings(opts);
                slide.addImage(opts);
                break;
            }
            case ADD_TABLE: {
                ensureSlide();
                List<Value> args = binder.bind(op, record);
                JsonNode rows = sanitizer.tableRows(JsonValues.toJson(args.get(0)));
                ObjectNode opts = JsonValues.toObject(args.get(1));
                if (args.get(1).isMap()) {
                    if (opts.hasNonNull("x")) Geometry.normalizeBox(opts, slideW, slideH);
                    sanitizer.tableOptions(opts);
                }
                OptionSanitizer.ensureColorStrings(opts);
                slide.addTable(rows, opts);
                break;
            }
            case ADD_CHART: {
                ensureSlide();
                List<Value> args = binder.bind(op, record);
                String typeName = args.get(0).asString();
                ChartType type = ChartType.fromName(typeName);
                if (type == null) throw new IllegalArgumentException("Invalid ChartType: " + typeName);
                JsonNode data = JsonValues.toJson(args.get(1));
                ObjectNode opts = JsonValues.toObject(args.get(2));
                if (args.get(2).isMap()) {
                    Geometry.normalizeBox(opts, slideW, slideH);
                    sanitizer.chartOptions(opts);
                }
                OptionSanitizer.ensureColorStrings(opts);
                slide.addChart(type, data, opts);
                break;
            }
            case WRITE_FILE:
                // serialization belongs to the host
                break;
            default:
                throw new IllegalStateException("Unhandled operation " + op);
        }
    }

    private void ensureSlide() {
        if (slide == null) slide = builder.addSlide(slideOptions(Value.undefined()));
    }

    // A string argument names the master slide.
    private ObjectNode slideOptions(Value arg) {
        ObjectNode opts;
        if (arg.isString()) {
            opts = JsonValues.newObject();
            opts.put("masterName", arg.asString());
        } else {
            opts = JsonValues.toObject(arg);
        }
        if (defaultMasterName != null && !opts.hasNonNull("masterName")) {
            opts.put("masterName", defaultMasterName);
        }
        return opts;
    }
}
