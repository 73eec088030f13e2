package io.github.drompincen.scenarioagent.runtime.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.github.drompincen.scenarioagent.protocol.api.MessageSendParams;
import io.github.drompincen.scenarioagent.protocol.api.MessageSendRequest;
import io.github.drompincen.scenarioagent.protocol.api.RespondRequest;
import io.github.drompincen.scenarioagent.protocol.event.StatusUpdateEvent;
import io.github.drompincen.scenarioagent.protocol.event.StreamResult;
import io.github.drompincen.scenarioagent.protocol.frame.FrameCodec;
import io.github.drompincen.scenarioagent.runtime.scenario.Scenario;
import io.github.drompincen.scenarioagent.runtime.scenario.ScenarioCatalog;
import io.github.drompincen.scenarioagent.runtime.session.SessionStore;
import io.github.drompincen.scenarioagent.runtime.session.WorkflowSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

import java.util.UUID;

/**
 * Turns the two inbound request shapes into encoded frame streams. Every stream ends with the
 * {@code [DONE]} sentinel, whatever path produced it.
 */
@Service
public class RequestDispatcher {

    private static final Logger log = LoggerFactory.getLogger(RequestDispatcher.class);

    static final String UNKNOWN_RESPONSE_TEXT = "Unknown response type";

    private final SessionStore sessionStore;
    private final ScenarioCatalog catalog;
    private final FrameCodec codec;

    public RequestDispatcher(SessionStore sessionStore, ScenarioCatalog catalog, FrameCodec codec) {
        this.sessionStore = sessionStore;
        this.catalog = catalog;
        this.codec = codec;
    }

    /**
     * New or continuing message posted to {@code /}.
     *
     * @param scenarioName scenario to run, or null for the configured one
     */
    public Flux<String> dispatchMessage(MessageSendRequest request, String scenarioName) {
        MessageSendParams params = request.params() != null
                ? request.params()
                : new MessageSendParams(null, null, null, null);
        JsonNode requestId = isPresent(request.id()) ? request.id() : TextNode.valueOf(newId());
        String sessionId = params.sessionId() != null ? params.sessionId() : newId();
        String workflowId = params.workflowId() != null ? params.workflowId() : newId();
        String text = params.messageText();
        boolean planMode = params.planModeRequested();
        String effective = scenarioName != null ? scenarioName : catalog.activeName();

        log.info("[Dispatch] Message method={}, session={}, workflow={}, planMode={}, scenario={}",
                request.method(), sessionId, workflowId, planMode, effective);

        Scenario scenario = catalog.resolve(effective);
        Flux<StreamResult> results = Flux.defer(() -> {
            WorkflowSession session = sessionStore.getOrCreate(sessionId, workflowId);
            return scenario.onMessage(session, text, planMode);
        });
        return encode(requestId, results);
    }

    /**
     * Resumption posted to {@code /a2a/respond}. An unrecognised answer shape yields a single
     * failed frame and leaves the session untouched.
     *
     * @param scenarioName scenario to run, or null for the configured one
     */
    public Flux<String> dispatchAnswer(RespondRequest request, String scenarioName) {
        JsonNode requestId = TextNode.valueOf(newId());
        String sessionId = request.sessionId();
        String effective = scenarioName != null ? scenarioName : catalog.activeName();

        log.info("[Dispatch] Respond session={}, clarification={}, selection={}, plan={}",
                sessionId, request.clarificationId(), request.selectionId(), request.planId());

        if (!request.recognized()) {
            log.warn("[Dispatch] Unknown response type for session {}", sessionId);
            return encode(requestId, Flux.just(StatusUpdateEvent.failed(sessionId, UNKNOWN_RESPONSE_TEXT)));
        }

        String workflowId = sessionStore.find(sessionId)
                .map(WorkflowSession::getWorkflowId)
                .orElseGet(RequestDispatcher::newId);
        Scenario scenario = catalog.resolve(effective);
        Flux<StreamResult> results = Flux.defer(() -> {
            WorkflowSession session = sessionStore.getOrCreate(sessionId, workflowId);
            return scenario.onAnswer(session, request.answer());
        });
        return encode(requestId, results);
    }

    private Flux<String> encode(JsonNode requestId, Flux<StreamResult> results) {
        return results
                .map(result -> codec.encode(requestId, result))
                .concatWith(Flux.just(codec.done()));
    }

    private static boolean isPresent(JsonNode node) {
        return node != null && !node.isNull() && !node.isMissingNode();
    }

    private static String newId() {
        return UUID.randomUUID().toString();
    }
}
