package io.github.drompincen.scenarioagent.protocol.api;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Where a session's scripted conversation currently stands. Declaration order is the forward
 * path; {@link #ERROR} is absorbing.
 */
public enum WorkflowPhase {
    INITIAL("initial"),
    CLARIFICATION("clarification"),
    DISCOVERY("discovery"),
    SELECTION("selection"),
    PREVIEW("preview"),
    EXECUTING("executing"),
    COMPLETED("completed"),
    ERROR("error");

    private final String wireName;

    WorkflowPhase(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
