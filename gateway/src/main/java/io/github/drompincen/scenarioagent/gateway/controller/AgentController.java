package io.github.drompincen.scenarioagent.gateway.controller;

import io.github.drompincen.scenarioagent.protocol.api.HealthResponse;
import io.github.drompincen.scenarioagent.protocol.api.ResetResponse;
import io.github.drompincen.scenarioagent.protocol.api.ScenarioCatalogResponse;
import io.github.drompincen.scenarioagent.protocol.api.SessionListResponse;
import io.github.drompincen.scenarioagent.runtime.scenario.ScenarioCatalog;
import io.github.drompincen.scenarioagent.runtime.scenario.ScenarioProperties;
import io.github.drompincen.scenarioagent.runtime.session.SessionStore;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class AgentController {

    private final SessionStore sessionStore;
    private final ScenarioCatalog catalog;
    private final ScenarioProperties properties;

    public AgentController(SessionStore sessionStore, ScenarioCatalog catalog, ScenarioProperties properties) {
        this.sessionStore = sessionStore;
        this.catalog = catalog;
        this.properties = properties;
    }

    @GetMapping("/health")
    public HealthResponse health() {
        return HealthResponse.healthy(properties.agentId(), properties.scenario());
    }

    /** Clears every session; used between test runs. */
    @PostMapping("/reset")
    public ResetResponse reset() {
        sessionStore.reset();
        return ResetResponse.done();
    }

    @GetMapping("/sessions")
    public SessionListResponse sessions() {
        return new SessionListResponse(sessionStore.list());
    }

    @GetMapping("/scenarios")
    public ScenarioCatalogResponse scenarios() {
        return new ScenarioCatalogResponse(catalog.activeName(), catalog.names());
    }
}
