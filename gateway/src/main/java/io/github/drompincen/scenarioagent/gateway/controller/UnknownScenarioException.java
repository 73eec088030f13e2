package io.github.drompincen.scenarioagent.gateway.controller;

/**
 * A per-request {@code ?scenario=} override named no known scenario.
 */
public class UnknownScenarioException extends RuntimeException {

    private final String scenario;

    public UnknownScenarioException(String scenario) {
        super("Unknown scenario: " + scenario);
        this.scenario = scenario;
    }

    public String getScenario() {
        return scenario;
    }
}
