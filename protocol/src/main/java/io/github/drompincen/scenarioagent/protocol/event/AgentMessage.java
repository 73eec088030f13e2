package io.github.drompincen.scenarioagent.protocol.event;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AgentMessage(
        String role,
        List<MessagePart> parts,
        EventMetadata metadata
) {
    public static AgentMessage assistant(MessagePart part, EventMetadata metadata) {
        return new AgentMessage("assistant", List.of(part), metadata);
    }

    public static AgentMessage assistant(MessagePart part) {
        return assistant(part, null);
    }
}
