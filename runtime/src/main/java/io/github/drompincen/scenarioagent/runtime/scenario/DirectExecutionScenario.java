package io.github.drompincen.scenarioagent.runtime.scenario;

import io.github.drompincen.scenarioagent.protocol.api.Answer;
import io.github.drompincen.scenarioagent.protocol.api.WorkflowPhase;
import io.github.drompincen.scenarioagent.protocol.event.EventMetadata;
import io.github.drompincen.scenarioagent.protocol.event.MessageEvent;
import io.github.drompincen.scenarioagent.protocol.event.StatusUpdateEvent;
import io.github.drompincen.scenarioagent.protocol.event.StreamResult;
import io.github.drompincen.scenarioagent.runtime.session.WorkflowSession;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

/**
 * Answers straight away without plan mode: one working frame, then the reply.
 */
@Component
public class DirectExecutionScenario implements Scenario {

    private final ScriptFactory scripts;
    private final PlanModeFlow planModeFlow;

    public DirectExecutionScenario(ScriptFactory scripts, PlanModeFlow planModeFlow) {
        this.scripts = scripts;
        this.planModeFlow = planModeFlow;
    }

    @Override
    public ScenarioType type() {
        return ScenarioType.DIRECT_EXECUTION;
    }

    @Override
    public Flux<StreamResult> onMessage(WorkflowSession session, String text, boolean planMode) {
        return reply(session, text);
    }

    @Override
    public Flux<StreamResult> onAnswer(WorkflowSession session, Answer answer) {
        return planModeFlow.resume(session, answer);
    }

    public Flux<StreamResult> reply(WorkflowSession session, String text) {
        String sessionId = session.getSessionId();
        return scripts.script()
                .emit(() -> StatusUpdateEvent.working(sessionId, "Processing your request...",
                        EventMetadata.of("processing")))
                .emitNow(() -> {
                    session.setCurrentPhase(WorkflowPhase.COMPLETED);
                    return MessageEvent.text(sessionId, replyText(text));
                })
                .toFlux();
    }

    static String replyText(String text) {
        return "I received your message: '" + text + "'\n\nThis is a direct execution response without plan mode.";
    }
}
