package io.github.drompincen.scenarioagent.protocol.event;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TaskState {
    WORKING("working"),
    INPUT_REQUIRED("input-required"),
    FAILED("failed");

    private final String wireName;

    TaskState(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
