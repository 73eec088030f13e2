package io.github.drompincen.scenarioagent.runtime.scenario;

import io.github.drompincen.scenarioagent.protocol.api.WorkflowPhase;
import io.github.drompincen.scenarioagent.protocol.event.MessageEvent;
import io.github.drompincen.scenarioagent.protocol.event.StatusUpdateEvent;
import io.github.drompincen.scenarioagent.protocol.event.StreamResult;
import io.github.drompincen.scenarioagent.protocol.event.TaskState;
import io.github.drompincen.scenarioagent.runtime.session.SessionStore;
import io.github.drompincen.scenarioagent.runtime.session.WorkflowSession;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FullPlanModeScenarioTest {

    private ScenarioFixtures fixtures;
    private WorkflowSession session;

    @BeforeEach
    void setUp() {
        fixtures = ScenarioFixtures.forScenario("full_plan_mode");
        session = new SessionStore().getOrCreate("s1", "w1");
    }

    @Test
    void planModeStartsClarification() {
        List<StreamResult> results = fixtures.fullPlanMode.onMessage(session, "Analyze reddit", true)
                .collectList().block();

        assertThat(results).last().satisfies(last ->
                assertThat(((StatusUpdateEvent) last).status().state()).isEqualTo(TaskState.INPUT_REQUIRED));
        assertThat(session.getCurrentPhase()).isEqualTo(WorkflowPhase.CLARIFICATION);
    }

    @Test
    void withoutPlanModeRepliesDirectly() {
        List<StreamResult> results = fixtures.fullPlanMode.onMessage(session, "hello", false)
                .collectList().block();

        assertThat(results).hasSize(2);
        assertThat(((StatusUpdateEvent) results.get(0)).status().message().metadata().eventType())
                .isEqualTo("processing");
        assertThat(((MessageEvent) results.get(1)).parts().get(0).text())
                .isEqualTo("I received your message: 'hello'\n\nThis is a direct execution response without plan mode.");
        assertThat(session.getCurrentPhase()).isEqualTo(WorkflowPhase.COMPLETED);
    }

    @Test
    void directExecutionIgnoresPlanModeFlag() {
        List<StreamResult> results = fixtures.directExecution.onMessage(session, "hello", true)
                .collectList().block();

        assertThat(results).hasSize(2);
        assertThat(results.get(1)).isInstanceOf(MessageEvent.class);
        assertThat(session.getCurrentPhase()).isEqualTo(WorkflowPhase.COMPLETED);
    }
}
