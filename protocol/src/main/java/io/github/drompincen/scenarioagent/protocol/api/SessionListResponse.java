package io.github.drompincen.scenarioagent.protocol.api;

import java.util.List;

public record SessionListResponse(List<SessionSummary> sessions) {}
