package io.github.drompincen.scenarioagent.protocol.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

@JsonIgnoreProperties(ignoreUnknown = true)
public record MessageSendParams(
        String sessionId,
        String workflowId,
        InboundMessage message,
        JsonNode metadata
) {
    /**
     * Plan mode is on when either {@code message.metadata.plan_mode_enabled} or
     * {@code params.metadata.planMode} is truthy. Neither location takes precedence.
     */
    public boolean planModeRequested() {
        boolean fromMessage = message != null && message.planModeEnabled();
        boolean fromParams = metadata != null && JsonTruth.isTruthy(metadata.get("planMode"));
        return fromMessage || fromParams;
    }

    public String messageText() {
        return message != null ? message.firstText() : "";
    }
}
