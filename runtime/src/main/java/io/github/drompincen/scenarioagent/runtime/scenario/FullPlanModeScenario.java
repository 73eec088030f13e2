package io.github.drompincen.scenarioagent.runtime.scenario;

import io.github.drompincen.scenarioagent.protocol.api.Answer;
import io.github.drompincen.scenarioagent.protocol.event.StreamResult;
import io.github.drompincen.scenarioagent.runtime.session.WorkflowSession;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

/**
 * Runs the whole plan-mode conversation when the caller asks for plan mode, otherwise behaves
 * like {@link DirectExecutionScenario}.
 */
@Component
public class FullPlanModeScenario implements Scenario {

    private final PlanModeFlow planModeFlow;
    private final DirectExecutionScenario directExecution;

    public FullPlanModeScenario(PlanModeFlow planModeFlow, DirectExecutionScenario directExecution) {
        this.planModeFlow = planModeFlow;
        this.directExecution = directExecution;
    }

    @Override
    public ScenarioType type() {
        return ScenarioType.FULL_PLAN_MODE;
    }

    @Override
    public Flux<StreamResult> onMessage(WorkflowSession session, String text, boolean planMode) {
        return planMode ? planModeFlow.start(session) : directExecution.reply(session, text);
    }

    @Override
    public Flux<StreamResult> onAnswer(WorkflowSession session, Answer answer) {
        return planModeFlow.resume(session, answer);
    }
}
