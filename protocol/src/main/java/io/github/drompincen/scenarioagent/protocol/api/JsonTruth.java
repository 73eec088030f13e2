package io.github.drompincen.scenarioagent.protocol.api;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Loose truthiness for flags that callers send as booleans, numbers or strings.
 */
public final class JsonTruth {

    private JsonTruth() {}

    public static boolean isTruthy(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) return false;
        if (node.isBoolean()) return node.booleanValue();
        if (node.isNumber()) return node.doubleValue() != 0.0;
        if (node.isTextual()) return !node.textValue().isEmpty();
        if (node.isContainerNode()) return node.size() > 0;
        return true;
    }

    /** Text of a scalar node; {@code fallback} when the node is absent or null. */
    public static String text(JsonNode node, String fallback) {
        if (node == null || node.isNull() || node.isMissingNode()) return fallback;
        return node.isTextual() ? node.textValue() : node.toString();
    }
}
