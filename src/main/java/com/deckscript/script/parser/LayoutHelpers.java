package com.deckscript.script.parser;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.deckscript.script.DeckScript.BuiltinFunction;

/**
 * LayoutHelpers
 *
 * The closed set of functions a snippet may call inside expressions: spacing helpers for laying
 * out items on the slide plus a handful of Math.* functions.
 *
 * Usage:
 *   Map&lt;String, BuiltinFunction&gt; helpers = LayoutHelpers.create(13.33, 7.5);
 *
 * Then in snippets:
 *   const x = evenX(i, 3, 2.5);
 *   const pos = gridXY(i, items.length, 2, 4, 1.5);
 *   const left = centerX(6);
 *
 * Trailing arguments may be omitted; end positions default to the slide size.
 */
public final class LayoutHelpers {

    private LayoutHelpers() {}

    public static Map<String, BuiltinFunction> create(double slideW, double slideH) {
        Map<String, BuiltinFunction> fns = new LinkedHashMap<>();

        fns.put("evenX", args -> {
            requireArgs("evenX", args, 2);
            return Value.number(even(num(args, 0, 0), num(args, 1, 0), num(args, 2, 0), num(args, 3, 0), num(args, 4, slideW)));
        });

        fns.put("evenY", args -> {
            requireArgs("evenY", args, 2);
            return Value.number(even(num(args, 0, 0), num(args, 1, 0), num(args, 2, 0), num(args, 3, 0), num(args, 4, slideH)));
        });

        fns.put("gridXY", args -> {
            requireArgs("gridXY", args, 3);
            double index = num(args, 0, 0);
            double total = num(args, 1, 0);
            double cols = num(args, 2, 0);
            double rows = Math.ceil(total / cols);
            double row = Math.floor(index / cols);
            double col = index % cols;
            Map<String, Value> pos = new LinkedHashMap<>();
            pos.put("x", Value.number(even(col, cols, num(args, 3, 0), num(args, 5, 0), num(args, 7, slideW))));
            pos.put("y", Value.number(even(row, rows, num(args, 4, 0), num(args, 6, 0), num(args, 8, slideH))));
            return Value.map(pos);
        });

        fns.put("centerX", args -> Value.number(center(num(args, 0, 0), num(args, 1, 0), num(args, 2, slideW))));
        fns.put("centerY", args -> Value.number(center(num(args, 0, 0), num(args, 1, 0), num(args, 2, slideH))));

        fns.put("Math.floor", args -> Value.number(Math.floor(num(args, 0, Double.NaN))));
        fns.put("Math.ceil", args -> Value.number(Math.ceil(num(args, 0, Double.NaN))));
        fns.put("Math.round", args -> Value.number(Math.floor(num(args, 0, Double.NaN) + 0.5)));
        fns.put("Math.abs", args -> Value.number(Math.abs(num(args, 0, Double.NaN))));
        fns.put("Math.sqrt", args -> Value.number(Math.sqrt(num(args, 0, Double.NaN))));
        fns.put("Math.pow", args -> Value.number(Math.pow(num(args, 0, Double.NaN), num(args, 1, Double.NaN))));

        fns.put("Math.min", args -> {
            double out = Double.POSITIVE_INFINITY;
            for (int i = 0; i < args.size(); i++) {
                double v = num(args, i, Double.NaN);
                if (Double.isNaN(v)) return Value.nan();
                out = Math.min(out, v);
            }
            return Value.number(out);
        });

        fns.put("Math.max", args -> {
            double out = Double.NEGATIVE_INFINITY;
            for (int i = 0; i < args.size(); i++) {
                double v = num(args, i, Double.NaN);
                if (Double.isNaN(v)) return Value.nan();
                out = Math.max(out, v);
            }
            return Value.number(out);
        });

        return fns;
    }

    // start + gap + index * (item + gap), with the free space split into total + 1 gaps
    static double even(double index, double total, double item, double start, double end) {
        double free = end - start - item * total;
        double gap = free / (total + 1);
        return start + gap + index * (item + gap);
    }

    static double center(double item, double start, double end) {
        return start + (end - start - item) / 2;
    }

    private static void requireArgs(String name, List<Value> args, int count) {
        if (args.size() < count) {
            throw new RuntimeException(name + "() expects at least " + count + " arguments, got " + args.size());
        }
    }

    private static double num(List<Value> args, int idx, double fallback) {
        if (idx >= args.size()) return fallback;
        Value v = args.get(idx);
        if (v.getType() == Value.Type.UNDEFINED) return fallback;
        return ExpressionParser.toNumber(v);
    }
}
