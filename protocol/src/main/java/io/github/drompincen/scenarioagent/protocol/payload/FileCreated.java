package io.github.drompincen.scenarioagent.protocol.payload;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({"type"})
public record FileCreated(
        String path,
        String name,
        String format,
        long size,
        String summary
) implements WorkflowPayload {

    @Override
    @JsonProperty("type")
    public String type() {
        return FILE_CREATED;
    }
}
