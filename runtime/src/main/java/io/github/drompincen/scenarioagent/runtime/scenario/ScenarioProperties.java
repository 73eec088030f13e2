package io.github.drompincen.scenarioagent.runtime.scenario;

import java.time.Duration;

/**
 * Process-level settings, read once at startup.
 *
 * @param scenario   name of the active scenario; unknown names run {@code direct_execution}
 * @param agentId    identifier reported by the health endpoint
 * @param eventDelay pause inserted after each paced frame
 * @param stall      how long {@code timeout_scenario} holds the stream open
 */
public record ScenarioProperties(String scenario, String agentId, Duration eventDelay, Duration stall) {

    public static final String DEFAULT_SCENARIO = "full_plan_mode";
    public static final String DEFAULT_AGENT_ID = "test-workflow-agent";
    public static final Duration DEFAULT_EVENT_DELAY = Duration.ofMillis(50);
    public static final Duration DEFAULT_STALL = Duration.ofMinutes(10);

    public ScenarioProperties {
        if (scenario == null || scenario.isBlank()) scenario = DEFAULT_SCENARIO;
        if (agentId == null || agentId.isBlank()) agentId = DEFAULT_AGENT_ID;
        if (eventDelay == null) eventDelay = DEFAULT_EVENT_DELAY;
        if (eventDelay.isNegative()) eventDelay = Duration.ZERO;
        if (stall == null || stall.isNegative()) stall = DEFAULT_STALL;
    }
}
