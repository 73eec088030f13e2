package io.github.drompincen.scenarioagent.protocol.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record InboundMessage(List<JsonNode> parts, JsonNode metadata) {

    /** Text of the first part that has a {@code text} field, or an empty string. */
    public String firstText() {
        if (parts == null) return "";
        for (JsonNode part : parts) {
            if (part != null && part.isObject() && part.has("text")) {
                return JsonTruth.text(part.get("text"), "");
            }
        }
        return "";
    }

    public boolean planModeEnabled() {
        return metadata != null && JsonTruth.isTruthy(metadata.get("plan_mode_enabled"));
    }
}
