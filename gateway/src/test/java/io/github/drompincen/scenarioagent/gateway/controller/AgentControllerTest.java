package io.github.drompincen.scenarioagent.gateway.controller;

import io.github.drompincen.scenarioagent.protocol.api.HealthResponse;
import io.github.drompincen.scenarioagent.protocol.api.ResetResponse;
import io.github.drompincen.scenarioagent.protocol.api.ScenarioCatalogResponse;
import io.github.drompincen.scenarioagent.protocol.api.SessionListResponse;
import io.github.drompincen.scenarioagent.protocol.api.SessionSummary;
import io.github.drompincen.scenarioagent.protocol.api.WorkflowPhase;
import io.github.drompincen.scenarioagent.runtime.scenario.ScenarioCatalog;
import io.github.drompincen.scenarioagent.runtime.scenario.ScenarioProperties;
import io.github.drompincen.scenarioagent.runtime.session.SessionStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AgentControllerTest {

    @Mock private SessionStore sessionStore;
    @Mock private ScenarioCatalog catalog;

    private AgentController controller;

    @BeforeEach
    void setUp() {
        controller = new AgentController(sessionStore, catalog,
                new ScenarioProperties("multi_clarification", null, null, null));
    }

    @Test
    void healthReportsAgentAndScenario() {
        HealthResponse health = controller.health();

        assertThat(health.status()).isEqualTo("healthy");
        assertThat(health.agentId()).isEqualTo("test-workflow-agent");
        assertThat(health.scenario()).isEqualTo("multi_clarification");
    }

    @Test
    void resetClearsStore() {
        when(sessionStore.reset()).thenReturn(3);

        ResetResponse response = controller.reset();

        assertThat(response.ok()).isTrue();
        assertThat(response.message()).isEqualTo("State reset");
        verify(sessionStore).reset();
    }

    @Test
    void sessionsWrapsSummaries() {
        SessionSummary summary = new SessionSummary("s1", "w1", WorkflowPhase.PREVIEW, 1_700_000_000.5);
        when(sessionStore.list()).thenReturn(List.of(summary));

        SessionListResponse response = controller.sessions();

        assertThat(response.sessions()).containsExactly(summary);
    }

    @Test
    void scenariosListsActiveAndAvailable() {
        when(catalog.activeName()).thenReturn("multi_clarification");
        when(catalog.names()).thenReturn(List.of("full_plan_mode", "multi_clarification"));

        ScenarioCatalogResponse response = controller.scenarios();

        assertThat(response.active()).isEqualTo("multi_clarification");
        assertThat(response.available()).containsExactly("full_plan_mode", "multi_clarification");
    }
}
