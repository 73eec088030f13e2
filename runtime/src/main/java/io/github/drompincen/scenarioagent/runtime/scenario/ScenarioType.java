package io.github.drompincen.scenarioagent.runtime.scenario;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

public enum ScenarioType {
    FULL_PLAN_MODE("full_plan_mode"),
    DIRECT_EXECUTION("direct_execution"),
    ERROR_MID_EXECUTION("error_mid_execution"),
    MULTI_CLARIFICATION("multi_clarification"),
    TIMEOUT_SCENARIO("timeout_scenario");

    private final String scenarioName;

    ScenarioType(String scenarioName) {
        this.scenarioName = scenarioName;
    }

    public String scenarioName() {
        return scenarioName;
    }

    public static Optional<ScenarioType> fromName(String name) {
        if (name == null) return Optional.empty();
        return Arrays.stream(values()).filter(t -> t.scenarioName.equals(name)).findFirst();
    }

    public static List<String> names() {
        return Arrays.stream(values()).map(ScenarioType::scenarioName).toList();
    }
}
