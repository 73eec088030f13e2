package io.github.drompincen.scenarioagent.protocol.api;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * JSON-RPC envelope posted to {@code /}. {@code id} is kept as a node so the reply echoes the
 * caller's type, string or number.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MessageSendRequest(
        String jsonrpc,
        String method,
        JsonNode id,
        MessageSendParams params
) {}
