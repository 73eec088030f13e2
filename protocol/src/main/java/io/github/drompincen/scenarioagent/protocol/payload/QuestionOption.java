package io.github.drompincen.scenarioagent.protocol.payload;

public record QuestionOption(String id, String label, String description) {}
