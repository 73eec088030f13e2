package io.github.drompincen.scenarioagent.runtime.scenario;

import io.github.drompincen.scenarioagent.protocol.api.Answer;
import io.github.drompincen.scenarioagent.protocol.api.WorkflowPhase;
import io.github.drompincen.scenarioagent.protocol.event.EventMetadata;
import io.github.drompincen.scenarioagent.protocol.event.StatusUpdateEvent;
import io.github.drompincen.scenarioagent.protocol.event.StreamResult;
import io.github.drompincen.scenarioagent.runtime.session.WorkflowSession;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

/**
 * Starts executing, reports the first of three steps, then fails. The session ends in the
 * {@code error} phase.
 */
@Component
public class ErrorMidExecutionScenario implements Scenario {

    static final String FAILURE_TEXT = "Error: Connection to external API timed out after 30 seconds";

    private final ScriptFactory scripts;
    private final PlanModeFlow planModeFlow;

    public ErrorMidExecutionScenario(ScriptFactory scripts, PlanModeFlow planModeFlow) {
        this.scripts = scripts;
        this.planModeFlow = planModeFlow;
    }

    @Override
    public ScenarioType type() {
        return ScenarioType.ERROR_MID_EXECUTION;
    }

    @Override
    public Flux<StreamResult> onMessage(WorkflowSession session, String text, boolean planMode) {
        String sessionId = session.getSessionId();
        return scripts.script()
                .emit(() -> StatusUpdateEvent.working(sessionId, "Starting execution...",
                        EventMetadata.of("executing")))
                .emit(() -> StatusUpdateEvent.working(sessionId, "Processing step 1 of 3...",
                        EventMetadata.step("executing", 1, 3)))
                .emitNow(() -> {
                    session.setCurrentPhase(WorkflowPhase.ERROR);
                    return StatusUpdateEvent.failed(sessionId, FAILURE_TEXT);
                })
                .toFlux();
    }

    @Override
    public Flux<StreamResult> onAnswer(WorkflowSession session, Answer answer) {
        return planModeFlow.resume(session, answer);
    }
}
