package io.github.drompincen.scenarioagent.protocol.event;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record MessagePart(String text, Object data) {

    public static MessagePart text(String text) {
        return new MessagePart(text, null);
    }

    public static MessagePart data(Object data) {
        return new MessagePart(null, data);
    }
}
