package io.github.drompincen.scenarioagent.runtime.scenario;

import io.github.drompincen.scenarioagent.protocol.api.Answer;
import io.github.drompincen.scenarioagent.protocol.api.ClarificationAnswer;
import io.github.drompincen.scenarioagent.protocol.api.PlanApproval;
import io.github.drompincen.scenarioagent.protocol.api.SelectionAnswer;
import io.github.drompincen.scenarioagent.protocol.api.WorkflowPhase;
import io.github.drompincen.scenarioagent.protocol.event.EventMetadata;
import io.github.drompincen.scenarioagent.protocol.event.MessageEvent;
import io.github.drompincen.scenarioagent.protocol.event.StatusUpdateEvent;
import io.github.drompincen.scenarioagent.protocol.event.StreamResult;
import io.github.drompincen.scenarioagent.protocol.payload.ClarificationNeeded;
import io.github.drompincen.scenarioagent.protocol.payload.ClarificationQuestion;
import io.github.drompincen.scenarioagent.protocol.payload.DiscoveredItem;
import io.github.drompincen.scenarioagent.protocol.payload.DiscoveryResult;
import io.github.drompincen.scenarioagent.protocol.payload.FileCreated;
import io.github.drompincen.scenarioagent.protocol.payload.PlanStep;
import io.github.drompincen.scenarioagent.protocol.payload.PreviewReady;
import io.github.drompincen.scenarioagent.protocol.payload.QuestionOption;
import io.github.drompincen.scenarioagent.protocol.payload.SelectionRequired;
import io.github.drompincen.scenarioagent.runtime.session.WorkflowSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

import java.util.List;
import java.util.UUID;

/**
 * The plan-mode conversation: clarification, discovery, selection, preview and execution.
 * {@link #start} runs up to the first question; {@link #resume} advances from whichever prompt
 * the answer belongs to.
 */
@Component
public class PlanModeFlow {

    private static final Logger log = LoggerFactory.getLogger(PlanModeFlow.class);

    static final String DEFAULT_TOPIC = "tech";
    static final long CLARIFICATION_TIMEOUT_MS = 300_000;
    static final List<String> EXECUTION_STEPS =
            List.of("Fetching posts...", "Analyzing sentiment...", "Generating report...");

    static final String CANCELLED_TEXT =
            "Analysis cancelled. Let me know if you'd like to try something different.";

    static final String COMPLETED_TEXT = """
            Analysis complete! I analyzed the selected subreddits and found:

            - **Overall Sentiment**: 67% positive
            - **Trending Topics**: AI, Climate, Gaming
            - **Peak Activity**: Weekday evenings

            The detailed report has been saved.""";

    private final ScriptFactory scripts;

    public PlanModeFlow(ScriptFactory scripts) {
        this.scripts = scripts;
    }

    public Flux<StreamResult> start(WorkflowSession session) {
        String sessionId = session.getSessionId();
        return scripts.script()
                .emit(() -> StatusUpdateEvent.working(sessionId, "Analyzing your request...",
                        EventMetadata.of("analyzing")))
                .emit(() -> {
                    session.setCurrentPhase(WorkflowPhase.CLARIFICATION);
                    return StatusUpdateEvent.inputRequired(sessionId, topicQuestions(session.getWorkflowId()));
                })
                .toFlux();
    }

    public Flux<StreamResult> resume(WorkflowSession session, Answer answer) {
        if (answer instanceof ClarificationAnswer clarification) {
            return afterClarification(session, clarification);
        }
        if (answer instanceof SelectionAnswer selection) {
            return afterSelection(session, selection);
        }
        if (answer instanceof PlanApproval approval) {
            return afterPreview(session, approval);
        }
        throw new IllegalArgumentException("Unsupported answer type: " + answer.getClass().getSimpleName());
    }

    Flux<StreamResult> afterClarification(WorkflowSession session, ClarificationAnswer answer) {
        String sessionId = session.getSessionId();
        String workflowId = session.getWorkflowId();
        String topic = answer.answerText("topic", DEFAULT_TOPIC);
        List<DiscoveredItem> items = discover(topic);

        return scripts.script()
                .run(() -> session.recordClarification(answer.answers()))
                .emit(() -> StatusUpdateEvent.working(sessionId, "Discovering " + topic + "-related subreddits...",
                        EventMetadata.of("discovering")))
                .emit(() -> {
                    session.setCurrentPhase(WorkflowPhase.DISCOVERY);
                    return StatusUpdateEvent.inputRequired(sessionId, new DiscoveryResult(
                            workflowId, newId(), "subreddits", items,
                            "I found " + items.size() + " subreddits related to " + topic + "."));
                })
                .emit(() -> {
                    session.setCurrentPhase(WorkflowPhase.SELECTION);
                    return StatusUpdateEvent.inputRequired(sessionId, new SelectionRequired(
                            workflowId, newId(), items, 1, 3, "Please select which subreddits to analyze."));
                })
                .toFlux();
    }

    Flux<StreamResult> afterSelection(WorkflowSession session, SelectionAnswer answer) {
        String sessionId = session.getSessionId();
        int selected = answer.selectedIds().size();

        return scripts.script()
                .run(() -> session.recordSelection(answer.selectionId(), answer.selectedIds()))
                .emit(() -> {
                    session.setCurrentPhase(WorkflowPhase.PREVIEW);
                    return StatusUpdateEvent.inputRequired(sessionId, analysisPlan(session.getWorkflowId(), selected));
                })
                .toFlux();
    }

    Flux<StreamResult> afterPreview(WorkflowSession session, PlanApproval approval) {
        String sessionId = session.getSessionId();
        FrameScript script = scripts.script()
                .run(() -> session.recordPreview(approval.planId(), approval.approved()));

        if (!approval.approved()) {
            return script
                    .emitNow(() -> {
                        log.info("[Scenario] Plan {} rejected for session {}", approval.planId(), sessionId);
                        session.setCurrentPhase(WorkflowPhase.COMPLETED);
                        return MessageEvent.text(sessionId, CANCELLED_TEXT);
                    })
                    .toFlux();
        }

        script.run(() -> session.setCurrentPhase(WorkflowPhase.EXECUTING));
        int total = EXECUTION_STEPS.size();
        for (int i = 0; i < total; i++) {
            String step = EXECUTION_STEPS.get(i);
            int ordinal = i + 1;
            script.emit(() -> StatusUpdateEvent.working(sessionId, step,
                    EventMetadata.step("executing", ordinal, total)));
        }
        return script
                .emit(() -> StatusUpdateEvent.workingData(sessionId, new FileCreated(
                        "/reports/analysis-report.html", "analysis-report.html", "html", 45678,
                        "Comprehensive analysis report with sentiment breakdown")))
                .emitNow(() -> {
                    session.setCurrentPhase(WorkflowPhase.COMPLETED);
                    return MessageEvent.text(sessionId, COMPLETED_TEXT);
                })
                .toFlux();
    }

    static ClarificationNeeded topicQuestions(String workflowId) {
        return new ClarificationNeeded(workflowId, newId(), List.of(
                ClarificationQuestion.singleChoice("topic", "What topic are you interested in?", "Topic",
                        new QuestionOption("tech", "Technology", "Tech news and discussions"),
                        new QuestionOption("science", "Science", "Scientific discoveries"),
                        new QuestionOption("gaming", "Gaming", "Video games and esports")),
                ClarificationQuestion.singleChoice("depth", "How deep should the analysis be?", "Depth",
                        new QuestionOption("quick", "Quick scan", "Surface-level analysis"),
                        new QuestionOption("detailed", "Detailed", "In-depth analysis"))),
                "I need a bit more information to proceed.", CLARIFICATION_TIMEOUT_MS);
    }

    static List<DiscoveredItem> discover(String topic) {
        return List.of(
                new DiscoveredItem("sub-1", "r/" + topic, "Main " + topic + " subreddit", 15_000_000),
                new DiscoveredItem("sub-2", "r/" + topic + "news", "Latest " + topic + " news", 2_500_000),
                new DiscoveredItem("sub-3", "r/ask" + topic, "Questions about " + topic, 1_800_000));
    }

    static PreviewReady analysisPlan(String workflowId, int selectedCount) {
        return new PreviewReady(workflowId, newId(), "Analysis Plan",
                "I will analyze " + selectedCount + " subreddits for trending topics and sentiment.",
                List.of(PlanStep.pending("step-1", "Fetch recent posts"),
                        PlanStep.pending("step-2", "Analyze sentiment"),
                        PlanStep.pending("step-3", "Generate report")),
                List.of("trending", "popular", "discussion"),
                List.of("#analysis", "#reddit"),
                true,
                "Here's my analysis plan. Ready to proceed?");
    }

    static String newId() {
        return UUID.randomUUID().toString();
    }
}
