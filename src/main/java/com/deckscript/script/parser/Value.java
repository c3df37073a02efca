package com.deckscript.script.parser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runtime value produced by the expression evaluator.
 *
 * Arrays and maps are wrapped read-only so that environment snapshots captured by call records
 * can share them safely.
 */
public class Value {
    public enum Type { NUMBER, BOOL, STRING, FUNC, ARRAY, MAP, NULL, UNDEFINED }

    private static final Value NIL = new Value(Type.NULL, null);
    private static final Value UNDEFINED = new Value(Type.UNDEFINED, null);
    private static final Value TRUE = new Value(Type.BOOL, Boolean.TRUE);
    private static final Value FALSE = new Value(Type.BOOL, Boolean.FALSE);

    public final Type type;
    public final Object value;

    private Value(Type type, Object value) {
        this.type = type;
        this.value = value;
    }

    /** FUNC values carry the name of a registered helper. */
    public static Value func(String name) { return new Value(Type.FUNC, name); }
    public static Value number(double d) { return new Value(Type.NUMBER, d); }
    public static Value bool(boolean b) { return b ? TRUE : FALSE; }
    public static Value string(String s) { return new Value(Type.STRING, s); }
    public static Value array(List<Value> a) { return new Value(Type.ARRAY, Collections.unmodifiableList(a)); }
    public static Value map(Map<String, Value> m) {
        return new Value(Type.MAP, Collections.unmodifiableMap(new LinkedHashMap<>(m)));
    }
    public static Value nil() { return NIL; }
    public static Value undefined() { return UNDEFINED; }
    public static Value nan() { return new Value(Type.NUMBER, Double.NaN); }

    public Type getType() { return type; }

    public String asFunc() {
        if (type != Type.FUNC) throw new RuntimeException("Expected function, got " + type);
        return (String) value;
    }

    public double asNumber() {
        if (type != Type.NUMBER) throw new RuntimeException("Expected number, got " + type);
        return (double) value;
    }

    public boolean asBool() {
        if (type != Type.BOOL) throw new RuntimeException("Expected bool, got " + type);
        return (boolean) value;
    }

    public String asString() {
        if (type != Type.STRING) throw new RuntimeException("Expected string, got " + type);
        return (String) value;
    }

    @SuppressWarnings("unchecked")
    public List<Value> asArray() {
        if (type != Type.ARRAY) throw new RuntimeException("Expected array, got " + type);
        return (List<Value>) value;
    }

    @SuppressWarnings("unchecked")
    public Map<String, Value> asMap() {
        if (type != Type.MAP) throw new RuntimeException("Expected map, got " + type);
        return (Map<String, Value>) value;
    }

    public boolean isNumber() { return type == Type.NUMBER && !Double.isNaN((double) value); }
    public boolean isString() { return type == Type.STRING; }
    public boolean isArray() { return type == Type.ARRAY; }
    public boolean isMap() { return type == Type.MAP; }
    public boolean isNullish() { return type == Type.NULL || type == Type.UNDEFINED; }

    /** "No value": undefined, or a NaN left behind by a failed arithmetic resolution. */
    public boolean isMissing() {
        return type == Type.UNDEFINED || (type == Type.NUMBER && Double.isNaN((double) value));
    }

    /** JavaScript truthiness. */
    public boolean truthy() {
        switch (type) {
            case BOOL:
                return asBool();
            case NUMBER: {
                double d = asNumber();
                return d != 0 && !Double.isNaN(d);
            }
            case STRING:
                return !asString().isEmpty();
            case NULL:
            case UNDEFINED:
                return false;
            default:
                return true;
        }
    }

    /** JavaScript String(v) conversion, used by template interpolation and concatenation. */
    public String toDisplayString() {
        switch (type) {
            case NUMBER:
                return formatNumber(asNumber());
            case BOOL:
                return Boolean.toString(asBool());
            case STRING:
                return asString();
            case FUNC:
                return "function " + asFunc();
            case ARRAY: {
                StringBuilder sb = new StringBuilder();
                List<Value> items = asArray();
                for (int i = 0; i < items.size(); i++) {
                    if (i > 0) sb.append(',');
                    Value item = items.get(i);
                    if (!item.isNullish()) sb.append(item.toDisplayString());
                }
                return sb.toString();
            }
            case MAP:
                return "[object Object]";
            case NULL:
                return "null";
            default:
                return "undefined";
        }
    }

    static String formatNumber(double d) {
        if (Double.isNaN(d)) return "NaN";
        if (Double.isInfinite(d)) return d > 0 ? "Infinity" : "-Infinity";
        if (d == Math.rint(d) && Math.abs(d) < 1e15) return Long.toString((long) d);
        return Double.toString(d);
    }

    @Override
    public String toString() {
        switch (type) {
            case STRING:
                return '"' + asString() + '"';
            case ARRAY:
                return asArray().toString();
            case MAP:
                return asMap().toString();
            default:
                return toDisplayString();
        }
    }
}
