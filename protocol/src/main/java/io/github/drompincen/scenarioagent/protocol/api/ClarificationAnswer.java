package io.github.drompincen.scenarioagent.protocol.api;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

public record ClarificationAnswer(String clarificationId, Map<String, JsonNode> answers) implements Answer {

    @Override
    public String promptId() {
        return clarificationId;
    }

    public String answerText(String questionId, String fallback) {
        return JsonTruth.text(answers.get(questionId), fallback);
    }
}
