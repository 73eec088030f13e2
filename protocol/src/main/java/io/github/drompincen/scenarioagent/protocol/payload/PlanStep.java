package io.github.drompincen.scenarioagent.protocol.payload;

public record PlanStep(String id, String description, String status) {

    public static PlanStep pending(String id, String description) {
        return new PlanStep(id, description, "pending");
    }
}
