package io.github.drompincen.scenarioagent.protocol.payload;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

@JsonPropertyOrder({"type"})
public record PreviewReady(
        String workflowId,
        String planId,
        String title,
        String summary,
        List<PlanStep> steps,
        List<String> searchKeywords,
        List<String> hashtags,
        boolean requiresApproval,
        String message
) implements WorkflowPayload {

    @Override
    @JsonProperty("type")
    public String type() {
        return PREVIEW_READY;
    }
}
