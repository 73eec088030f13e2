package io.github.drompincen.scenarioagent.protocol.api;

import com.fasterxml.jackson.annotation.JsonProperty;

public record HealthResponse(
        String status,
        @JsonProperty("agent_id") String agentId,
        String scenario
) {
    public static HealthResponse healthy(String agentId, String scenario) {
        return new HealthResponse("healthy", agentId, scenario);
    }
}
