package io.github.drompincen.scenarioagent.protocol.event;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * A transient or final server state: {@code working}, {@code input-required} or {@code failed}.
 */
@JsonPropertyOrder({"kind", "sessionId", "status"})
public record StatusUpdateEvent(String sessionId, TaskStatus status) implements StreamResult {

    @Override
    @JsonProperty("kind")
    public String kind() {
        return KIND_STATUS_UPDATE;
    }

    public static StatusUpdateEvent working(String sessionId, String text, EventMetadata metadata) {
        return new StatusUpdateEvent(sessionId,
                new TaskStatus(TaskState.WORKING, AgentMessage.assistant(MessagePart.text(text), metadata)));
    }

    public static StatusUpdateEvent working(String sessionId, String text) {
        return working(sessionId, text, null);
    }

    /** A {@code working} status carrying structured data, e.g. a created file. */
    public static StatusUpdateEvent workingData(String sessionId, Object data) {
        return new StatusUpdateEvent(sessionId,
                new TaskStatus(TaskState.WORKING, AgentMessage.assistant(MessagePart.data(data))));
    }

    public static StatusUpdateEvent inputRequired(String sessionId, Object data) {
        return new StatusUpdateEvent(sessionId,
                new TaskStatus(TaskState.INPUT_REQUIRED, AgentMessage.assistant(MessagePart.data(data))));
    }

    public static StatusUpdateEvent failed(String sessionId, String text) {
        return new StatusUpdateEvent(sessionId,
                new TaskStatus(TaskState.FAILED, AgentMessage.assistant(MessagePart.text(text))));
    }
}
