package com.soorj.script;

import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.soorj.script.parser.Value;

/**
 * JSON view of a set of bindings, for inspecting session state.
 *
 * number -> JSON number, string -> string, boolean -> boolean, null -> null,
 * function -> its canonical string form.
 */
public final class EnvironmentJson {

    private static final ObjectMapper om = new ObjectMapper();

    private EnvironmentJson() {}

    public static ObjectNode toJson(Map<String, Value> bindings, boolean includeFunctions) {
        ObjectNode node = om.createObjectNode();
        for (Map.Entry<String, Value> e : bindings.entrySet()) {
            Value v = e.getValue();
            switch (v.getType()) {
                case NUMBER:
                    node.put(e.getKey(), v.asNumber());
                    break;
                case BOOL:
                    node.put(e.getKey(), v.asBool());
                    break;
                case STRING:
                    node.put(e.getKey(), v.asString());
                    break;
                case NULL:
                    node.putNull(e.getKey());
                    break;
                case FUNC:
                    if (includeFunctions) node.put(e.getKey(), v.display());
                    break;
                default:
                    throw new IllegalStateException("Unsupported Value type: " + v.getType());
            }
        }
        return node;
    }

    public static String pretty(Map<String, Value> bindings, boolean includeFunctions) {
        try {
            return om.writerWithDefaultPrettyPrinter().writeValueAsString(toJson(bindings, includeFunctions));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render bindings as JSON", e);
        }
    }
}
