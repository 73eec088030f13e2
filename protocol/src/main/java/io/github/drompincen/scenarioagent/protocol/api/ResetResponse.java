package io.github.drompincen.scenarioagent.protocol.api;

public record ResetResponse(boolean ok, String message) {

    public static ResetResponse done() {
        return new ResetResponse(true, "State reset");
    }
}
