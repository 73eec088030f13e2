package io.github.drompincen.scenarioagent.protocol.event;

/**
 * The {@code result} of one streamed JSON-RPC frame.
 */
public interface StreamResult {

    String KIND_STATUS_UPDATE = "status-update";
    String KIND_MESSAGE = "message";

    String kind();

    String sessionId();
}
