package io.github.drompincen.scenarioagent.protocol.event;

public record TaskStatus(TaskState state, AgentMessage message) {}
