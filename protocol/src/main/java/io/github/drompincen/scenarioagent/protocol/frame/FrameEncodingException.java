package io.github.drompincen.scenarioagent.protocol.frame;

public class FrameEncodingException extends RuntimeException {

    public FrameEncodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
