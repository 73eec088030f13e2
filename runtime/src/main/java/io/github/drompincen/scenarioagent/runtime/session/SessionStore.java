package io.github.drompincen.scenarioagent.runtime.session;

import io.github.drompincen.scenarioagent.protocol.api.SessionSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory sessions keyed by session id. Lives as long as the process; only {@link #reset()}
 * removes sessions.
 */
@Service
public class SessionStore {

    private static final Logger log = LoggerFactory.getLogger(SessionStore.class);

    private final ConcurrentHashMap<String, WorkflowSession> sessions = new ConcurrentHashMap<>();

    /**
     * Returns the session for {@code sessionId}, creating it in {@code initial} phase on first use.
     * Later calls return the same instance whatever {@code workflowId} they pass.
     */
    public WorkflowSession getOrCreate(String sessionId, String workflowId) {
        return sessions.computeIfAbsent(sessionId, id -> {
            log.debug("[Sessions] Created session {} for workflow {}", id, workflowId);
            return new WorkflowSession(id, workflowId, Instant.now());
        });
    }

    public Optional<WorkflowSession> find(String sessionId) {
        if (sessionId == null) return Optional.empty();
        return Optional.ofNullable(sessions.get(sessionId));
    }

    /** Discards every session and returns how many there were. */
    public int reset() {
        int count = sessions.size();
        sessions.clear();
        log.info("[Sessions] Reset store, discarded {} session(s)", count);
        return count;
    }

    public List<SessionSummary> list() {
        return sessions.values().stream()
                .sorted(Comparator.comparing(WorkflowSession::getCreatedAt))
                .map(WorkflowSession::toSummary)
                .collect(Collectors.toList());
    }
}
