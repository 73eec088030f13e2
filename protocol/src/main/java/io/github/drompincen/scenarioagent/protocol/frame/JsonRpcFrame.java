package io.github.drompincen.scenarioagent.protocol.frame;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.scenarioagent.protocol.event.StreamResult;

public record JsonRpcFrame(String jsonrpc, JsonNode id, StreamResult result) {

    public static final String VERSION = "2.0";

    public static JsonRpcFrame of(JsonNode id, StreamResult result) {
        return new JsonRpcFrame(VERSION, id, result);
    }
}
