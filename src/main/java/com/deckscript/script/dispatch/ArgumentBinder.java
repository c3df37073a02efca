package com.deckscript.script.dispatch;

import java.util.ArrayList;
import java.util.List;

import com.deckscript.script.parser.CallRecord;
import com.deckscript.script.parser.ExpressionEvaluator;
import com.deckscript.script.parser.Value;

/**
 * Evaluates a call record's raw argument texts against its captured environment and checks them
 * against the operation's {@link ArgSpec}s. Missing optional arguments come back as undefined;
 * surplus arguments are ignored.
 */
public final class ArgumentBinder {

    private final ExpressionEvaluator evaluator;

    public ArgumentBinder(ExpressionEvaluator evaluator) {
        if (evaluator == null) throw new IllegalArgumentException("evaluator is null");
        this.evaluator = evaluator;
    }

    public List<Value> bind(Operation op, CallRecord record) {
        List<String> raw = record.rawArguments();
        List<ArgSpec> specs = op.args();
        if (raw.size() < op.minArgs()) {
            throw new IllegalArgumentException("Not enough arguments: " + op.qualifiedName()
                    + " expects " + op.minArgs() + ", got " + raw.size());
        }

        List<Value> out = new ArrayList<>(specs.size());
        for (int i = 0; i < specs.size(); i++) {
            if (i >= raw.size()) {
                out.add(Value.undefined());
                continue;
            }
            ArgSpec spec = specs.get(i);
            Value v = evaluator.evaluate(raw.get(i), record.environment());
            switch (spec.kind()) {
                case OBJECT_REQUIRED:
                    if (!v.isMap()) throw new IllegalArgumentException("Object required for argument " + (i + 1));
                    break;
                case OBJECT_OPTIONAL:
                    if (!v.isMap() && !v.isNullish()) {
                        throw new IllegalArgumentException("Object expected for argument " + (i + 1));
                    }
                    break;
                case ENUMERATED:
                    if (!v.isString()) throw new IllegalArgumentException("Invalid constant: " + raw.get(i));
                    break;
                default:
                    break;
            }
            out.add(v);
        }
        return out;
    }
}
