package com.deckscript.script.dispatch;

import java.util.Map;

import com.deckscript.script.parser.Value;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Converts evaluated values to Jackson trees for the backend.
 *
 * Object properties without a value (undefined, NaN, functions) are left out; inside arrays they
 * become null.
 */
public final class JsonValues {

    private static final ObjectMapper om = new ObjectMapper();
    private static final JsonNodeFactory nodes = om.getNodeFactory();

    private JsonValues() {}

    public static ObjectNode newObject() {
        return om.createObjectNode();
    }

    public static JsonNode toJson(Value v) {
        if (v == null || isAbsent(v)) return nodes.nullNode();
        switch (v.getType()) {
            case NUMBER: {
                double d = v.asNumber();
                if (Double.isInfinite(d)) return nodes.nullNode();
                if (d == Math.rint(d) && Math.abs(d) <= Integer.MAX_VALUE) return nodes.numberNode((int) d);
                return nodes.numberNode(d);
            }
            case BOOL:
                return nodes.booleanNode(v.asBool());
            case STRING:
                return nodes.textNode(v.asString());
            case ARRAY: {
                ArrayNode arr = nodes.arrayNode();
                for (Value item : v.asArray()) arr.add(toJson(item));
                return arr;
            }
            case MAP:
                return toObject(v);
            default:
                return nodes.nullNode();
        }
    }

    /** Object conversion; anything that is not a map gives an empty object. */
    public static ObjectNode toObject(Value v) {
        ObjectNode obj = nodes.objectNode();
        if (v == null || !v.isMap()) return obj;
        for (Map.Entry<String, Value> e : v.asMap().entrySet()) {
            if (isAbsent(e.getValue())) continue;
            obj.set(e.getKey(), toJson(e.getValue()));
        }
        return obj;
    }

    private static boolean isAbsent(Value v) {
        return v.isMissing() || v.getType() == Value.Type.FUNC;
    }
}
