package io.github.drompincen.scenarioagent.protocol.api;

public record PlanApproval(String planId, boolean approved) implements Answer {

    @Override
    public String promptId() {
        return planId;
    }
}
