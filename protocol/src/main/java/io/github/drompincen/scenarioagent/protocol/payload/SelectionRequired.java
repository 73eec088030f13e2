package io.github.drompincen.scenarioagent.protocol.payload;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

@JsonPropertyOrder({"type"})
public record SelectionRequired(
        String workflowId,
        String selectionId,
        List<DiscoveredItem> items,
        int minSelect,
        int maxSelect,
        String message
) implements WorkflowPayload {

    @Override
    @JsonProperty("type")
    public String type() {
        return SELECTION_REQUIRED;
    }
}
