package io.github.drompincen.scenarioagent.protocol.event;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * A final conversational reply. No further transitions follow it in the same stream.
 */
@JsonPropertyOrder({"kind", "sessionId", "parts"})
public record MessageEvent(String sessionId, List<MessagePart> parts) implements StreamResult {

    @Override
    @JsonProperty("kind")
    public String kind() {
        return KIND_MESSAGE;
    }

    public static MessageEvent text(String sessionId, String text) {
        return new MessageEvent(sessionId, List.of(MessagePart.text(text)));
    }
}
