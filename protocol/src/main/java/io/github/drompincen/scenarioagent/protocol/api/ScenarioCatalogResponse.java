package io.github.drompincen.scenarioagent.protocol.api;

import java.util.List;

public record ScenarioCatalogResponse(String active, List<String> available) {}
