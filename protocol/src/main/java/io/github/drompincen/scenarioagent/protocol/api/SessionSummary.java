package io.github.drompincen.scenarioagent.protocol.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Diagnostic view of one session. {@code createdAt} is epoch seconds with a fractional part.
 */
public record SessionSummary(
        @JsonProperty("session_id") String sessionId,
        @JsonProperty("workflow_id") String workflowId,
        @JsonProperty("current_phase") WorkflowPhase currentPhase,
        @JsonProperty("created_at") double createdAt
) {}
