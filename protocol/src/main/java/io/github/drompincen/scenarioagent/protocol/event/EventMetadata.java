package io.github.drompincen.scenarioagent.protocol.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record EventMetadata(
        @JsonProperty("event_type") String eventType,
        Integer step,
        Integer total
) {
    public static EventMetadata of(String eventType) {
        return new EventMetadata(eventType, null, null);
    }

    public static EventMetadata step(String eventType, int step, int total) {
        return new EventMetadata(eventType, step, total);
    }
}
