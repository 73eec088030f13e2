package io.github.drompincen.scenarioagent.protocol.frame;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.scenarioagent.protocol.event.StreamResult;

/**
 * Serializes stream results into the two wire framings of the streaming endpoints:
 * <ul>
 *   <li>{@code data: {"jsonrpc":"2.0","id":<id>,"result":<result>}\n\n}</li>
 *   <li>{@code data: [DONE]\n\n}, the end-of-stream sentinel</li>
 * </ul>
 * Stateless apart from the mapper; safe to share.
 */
public class FrameCodec {

    public static final String DONE_FRAME = "data: [DONE]\n\n";

    private static final String DATA_PREFIX = "data: ";
    private static final String FRAME_END = "\n\n";

    private final ObjectMapper objectMapper;

    public FrameCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String encode(JsonNode requestId, StreamResult result) {
        try {
            return DATA_PREFIX + objectMapper.writeValueAsString(JsonRpcFrame.of(requestId, result)) + FRAME_END;
        } catch (JsonProcessingException e) {
            throw new FrameEncodingException("Failed to encode " + result.kind() + " frame", e);
        }
    }

    public String done() {
        return DONE_FRAME;
    }
}
