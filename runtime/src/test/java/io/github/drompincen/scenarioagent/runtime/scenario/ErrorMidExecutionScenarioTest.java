package io.github.drompincen.scenarioagent.runtime.scenario;

import io.github.drompincen.scenarioagent.protocol.api.WorkflowPhase;
import io.github.drompincen.scenarioagent.protocol.event.StatusUpdateEvent;
import io.github.drompincen.scenarioagent.protocol.event.StreamResult;
import io.github.drompincen.scenarioagent.protocol.event.TaskState;
import io.github.drompincen.scenarioagent.runtime.session.SessionStore;
import io.github.drompincen.scenarioagent.runtime.session.WorkflowSession;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.github.drompincen.scenarioagent.runtime.scenario.PlanModeFlowTest.text;
import static org.assertj.core.api.Assertions.assertThat;

class ErrorMidExecutionScenarioTest {

    @Test
    void failsAfterFirstStep() {
        ErrorMidExecutionScenario scenario = ScenarioFixtures.forScenario("error_mid_execution").errorMidExecution;
        WorkflowSession session = new SessionStore().getOrCreate("s1", "w1");

        List<StreamResult> results = scenario.onMessage(session, "go", true).collectList().block();

        assertThat(results).hasSize(3);
        assertThat(text(results.get(0))).isEqualTo("Starting execution...");
        StatusUpdateEvent step = (StatusUpdateEvent) results.get(1);
        assertThat(step.status().message().metadata().step()).isEqualTo(1);
        assertThat(step.status().message().metadata().total()).isEqualTo(3);

        StatusUpdateEvent failure = (StatusUpdateEvent) results.get(2);
        assertThat(failure.status().state()).isEqualTo(TaskState.FAILED);
        assertThat(text(failure)).isEqualTo(ErrorMidExecutionScenario.FAILURE_TEXT);
        assertThat(session.getCurrentPhase()).isEqualTo(WorkflowPhase.ERROR);
    }
}
