package io.github.drompincen.scenarioagent.runtime.session;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.scenarioagent.protocol.api.SessionSummary;
import io.github.drompincen.scenarioagent.protocol.api.WorkflowPhase;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One logical conversation with the agent. Owned by {@link SessionStore}; handlers mutate it in
 * place while a request is being streamed.
 */
public class WorkflowSession {

    private final String sessionId;
    private final String workflowId;
    private final Instant createdAt;
    private volatile WorkflowPhase currentPhase = WorkflowPhase.INITIAL;

    private final Map<String, JsonNode> clarificationResponses = new ConcurrentHashMap<>();
    private final Map<String, List<String>> selectionResponses = new ConcurrentHashMap<>();
    private final Map<String, Boolean> previewResponses = new ConcurrentHashMap<>();

    WorkflowSession(String sessionId, String workflowId, Instant createdAt) {
        this.sessionId = sessionId;
        this.workflowId = workflowId;
        this.createdAt = createdAt;
    }

    public String getSessionId() { return sessionId; }
    public String getWorkflowId() { return workflowId; }
    public Instant getCreatedAt() { return createdAt; }

    public WorkflowPhase getCurrentPhase() { return currentPhase; }
    public void setCurrentPhase(WorkflowPhase currentPhase) { this.currentPhase = currentPhase; }

    public Map<String, JsonNode> getClarificationResponses() {
        return Collections.unmodifiableMap(clarificationResponses);
    }

    public Map<String, List<String>> getSelectionResponses() {
        return Collections.unmodifiableMap(selectionResponses);
    }

    public Map<String, Boolean> getPreviewResponses() {
        return Collections.unmodifiableMap(previewResponses);
    }

    public boolean hasClarificationResponses() {
        return !clarificationResponses.isEmpty();
    }

    public void recordClarification(Map<String, JsonNode> answers) {
        clarificationResponses.putAll(answers);
    }

    public void recordSelection(String selectionId, List<String> selectedIds) {
        selectionResponses.put(selectionId, List.copyOf(selectedIds));
    }

    public void recordPreview(String planId, boolean approved) {
        previewResponses.put(planId, approved);
    }

    public SessionSummary toSummary() {
        double epochSeconds = createdAt.getEpochSecond() + createdAt.getNano() / 1_000_000_000.0;
        return new SessionSummary(sessionId, workflowId, currentPhase, epochSeconds);
    }
}
