package io.github.drompincen.scenarioagent.protocol.payload;

public record DiscoveredItem(String id, String name, String description, long memberCount) {}
