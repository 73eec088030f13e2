package io.github.drompincen.scenarioagent.protocol.payload;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

@JsonPropertyOrder({"type"})
public record DiscoveryResult(
        String workflowId,
        String discoveryId,
        String discoveryType,
        List<DiscoveredItem> items,
        String message
) implements WorkflowPayload {

    @Override
    @JsonProperty("type")
    public String type() {
        return DISCOVERY_RESULT;
    }
}
