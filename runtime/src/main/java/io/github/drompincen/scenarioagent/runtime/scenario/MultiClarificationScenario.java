package io.github.drompincen.scenarioagent.runtime.scenario;

import io.github.drompincen.scenarioagent.protocol.api.Answer;
import io.github.drompincen.scenarioagent.protocol.api.ClarificationAnswer;
import io.github.drompincen.scenarioagent.protocol.api.WorkflowPhase;
import io.github.drompincen.scenarioagent.protocol.event.StatusUpdateEvent;
import io.github.drompincen.scenarioagent.protocol.event.StreamResult;
import io.github.drompincen.scenarioagent.protocol.payload.ClarificationNeeded;
import io.github.drompincen.scenarioagent.protocol.payload.ClarificationQuestion;
import io.github.drompincen.scenarioagent.protocol.payload.QuestionOption;
import io.github.drompincen.scenarioagent.runtime.session.WorkflowSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

import java.util.List;

/**
 * Two clarification rounds before answering. The round is decided by whether the session has
 * recorded any clarification answers yet, not by its stored phase.
 */
@Component
public class MultiClarificationScenario implements Scenario {

    private static final Logger log = LoggerFactory.getLogger(MultiClarificationScenario.class);

    static final String FINAL_TEXT = "Final response";

    private final ScriptFactory scripts;
    private final PlanModeFlow planModeFlow;
    private final DirectExecutionScenario directExecution;

    public MultiClarificationScenario(ScriptFactory scripts, PlanModeFlow planModeFlow,
                                      DirectExecutionScenario directExecution) {
        this.scripts = scripts;
        this.planModeFlow = planModeFlow;
        this.directExecution = directExecution;
    }

    @Override
    public ScenarioType type() {
        return ScenarioType.MULTI_CLARIFICATION;
    }

    @Override
    public Flux<StreamResult> onMessage(WorkflowSession session, String text, boolean planMode) {
        String sessionId = session.getSessionId();
        return scripts.script()
                .emitNow(() -> {
                    session.setCurrentPhase(WorkflowPhase.CLARIFICATION);
                    return StatusUpdateEvent.inputRequired(sessionId, categoryQuestion(session.getWorkflowId()));
                })
                .toFlux();
    }

    @Override
    public Flux<StreamResult> onAnswer(WorkflowSession session, Answer answer) {
        if (!(answer instanceof ClarificationAnswer clarification)) {
            return planModeFlow.resume(session, answer);
        }
        // Decided when the answer arrives, before this round records anything.
        if (session.hasClarificationResponses()) {
            log.debug("[Scenario] Session {} answered both rounds, completing", session.getSessionId());
            return directExecution.reply(session, FINAL_TEXT);
        }
        return secondRound(session, clarification);
    }

    private Flux<StreamResult> secondRound(WorkflowSession session, ClarificationAnswer answer) {
        String sessionId = session.getSessionId();
        return scripts.script()
                .run(() -> session.recordClarification(answer.answers()))
                .emit(() -> StatusUpdateEvent.working(sessionId, "Great! I have one more question..."))
                .emitNow(() -> StatusUpdateEvent.inputRequired(sessionId, timeframeQuestion(session.getWorkflowId())))
                .toFlux();
    }

    static ClarificationNeeded categoryQuestion(String workflowId) {
        return new ClarificationNeeded(workflowId, PlanModeFlow.newId(), List.of(
                ClarificationQuestion.singleChoice("category", "What category are you interested in?", "Category",
                        new QuestionOption("news", "News", "Current events"),
                        new QuestionOption("entertainment", "Entertainment", "Movies, TV, etc."))),
                "First, let me understand your category preference.", null);
    }

    static ClarificationNeeded timeframeQuestion(String workflowId) {
        return new ClarificationNeeded(workflowId, PlanModeFlow.newId(), List.of(
                ClarificationQuestion.singleChoice("timeframe", "What timeframe should I analyze?", "Timeframe",
                        new QuestionOption("day", "Last 24 hours", "Recent content"),
                        new QuestionOption("week", "Last week", "Weekly trends"),
                        new QuestionOption("month", "Last month", "Monthly overview"))),
                "One more detail - what timeframe?", null);
    }
}
