package io.github.drompincen.scenarioagent.runtime.scenario;

import io.github.drompincen.scenarioagent.protocol.api.Answer;
import io.github.drompincen.scenarioagent.protocol.event.StreamResult;
import io.github.drompincen.scenarioagent.runtime.session.WorkflowSession;
import reactor.core.publisher.Flux;

/**
 * A scripted agent behavior with two entry points: a new message and a resumption answer.
 * Each call runs until the next suspension point (an {@code input-required} frame) or a terminal
 * frame, then completes. The phase stored on the session carries the conversation between calls.
 */
public interface Scenario {

    ScenarioType type();

    Flux<StreamResult> onMessage(WorkflowSession session, String text, boolean planMode);

    Flux<StreamResult> onAnswer(WorkflowSession session, Answer answer);
}
