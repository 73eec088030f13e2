package io.github.drompincen.scenarioagent.protocol.payload;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Questions the agent needs answered before it can continue. {@code timeoutMs} is omitted when null.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"type"})
public record ClarificationNeeded(
        String workflowId,
        String clarificationId,
        List<ClarificationQuestion> questions,
        String message,
        Long timeoutMs
) implements WorkflowPayload {

    @Override
    @JsonProperty("type")
    public String type() {
        return CLARIFICATION_NEEDED;
    }
}
