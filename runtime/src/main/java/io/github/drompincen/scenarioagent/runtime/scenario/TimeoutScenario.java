package io.github.drompincen.scenarioagent.runtime.scenario;

import io.github.drompincen.scenarioagent.protocol.api.Answer;
import io.github.drompincen.scenarioagent.protocol.event.StatusUpdateEvent;
import io.github.drompincen.scenarioagent.protocol.event.StreamResult;
import io.github.drompincen.scenarioagent.runtime.session.WorkflowSession;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

/**
 * Announces a long operation and then goes quiet for the configured stall, well past any sane
 * client timeout. Never completes the session.
 */
@Component
public class TimeoutScenario implements Scenario {

    private final ScriptFactory scripts;
    private final PlanModeFlow planModeFlow;

    public TimeoutScenario(ScriptFactory scripts, PlanModeFlow planModeFlow) {
        this.scripts = scripts;
        this.planModeFlow = planModeFlow;
    }

    @Override
    public ScenarioType type() {
        return ScenarioType.TIMEOUT_SCENARIO;
    }

    @Override
    public Flux<StreamResult> onMessage(WorkflowSession session, String text, boolean planMode) {
        String sessionId = session.getSessionId();
        return scripts.script()
                .emitNow(() -> StatusUpdateEvent.working(sessionId, "Starting long operation..."))
                .pause(scripts.stall())
                .toFlux();
    }

    @Override
    public Flux<StreamResult> onAnswer(WorkflowSession session, Answer answer) {
        return planModeFlow.resume(session, answer);
    }
}
