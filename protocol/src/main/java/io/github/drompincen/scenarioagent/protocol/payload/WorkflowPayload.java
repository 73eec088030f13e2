package io.github.drompincen.scenarioagent.protocol.payload;

/**
 * Structured data carried in {@code status.message.parts[].data}, discriminated by {@link #type()}.
 */
public interface WorkflowPayload {

    String CLARIFICATION_NEEDED = "clarification_needed";
    String DISCOVERY_RESULT = "discovery_result";
    String SELECTION_REQUIRED = "selection_required";
    String PREVIEW_READY = "preview_ready";
    String FILE_CREATED = "file_created";

    String type();
}
