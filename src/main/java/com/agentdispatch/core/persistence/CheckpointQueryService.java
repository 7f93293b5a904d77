package com.agentdispatch.core.persistence;

import com.agentdispatch.core.model.TaskStatus;
import com.agentdispatch.core.state.CheckpointCorruptException;
import com.agentdispatch.core.state.CheckpointStore;
import com.agentdispatch.core.state.DispatchCheckpoint;
import com.agentdispatch.core.state.TaskState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Optional;

/**
 * Read-side queries over the checkpoint store for the CLI history and status commands.
 */
@Service
public class CheckpointQueryService {

    private static final Logger log = LoggerFactory.getLogger(CheckpointQueryService.class);

    private final CheckpointStore store;

    public CheckpointQueryService(CheckpointStore store) {
        this.store = store;
    }

    public List<String> listSessionIds() {
        return store.sessions();
    }

    /**
     * Summaries of every stored session; unreadable sessions are logged and left out.
     */
    public List<SessionSummary> listSessions() {
        var summaries = new ArrayList<SessionSummary>();
        for (String sessionId : store.sessions()) {
            try {
                summarize(sessionId).ifPresent(summaries::add);
            } catch (CheckpointCorruptException e) {
                log.warn("Skipping session {}: {}", sessionId, e.getMessage());
            }
        }
        return summaries;
    }

    public Optional<SessionSummary> summarize(String sessionId) {
        List<DispatchCheckpoint> checkpoints = store.list(sessionId);
        if (checkpoints.isEmpty()) {
            return Optional.empty();
        }
        DispatchCheckpoint latest = checkpoints.get(checkpoints.size() - 1);
        var counts = new EnumMap<TaskStatus, Integer>(TaskStatus.class);
        for (TaskState state : latest.taskStates().values()) {
            counts.merge(state.status(), 1, Integer::sum);
        }
        return Optional.of(new SessionSummary(sessionId, checkpoints.size(), latest.checkpointId(),
                latest.reason(), latest.startedAt(), latest.createdAt(), counts, latest.taskStates().size()));
    }

    public List<DispatchCheckpoint> listCheckpoints(String sessionId) {
        return store.list(sessionId);
    }

    public Optional<DispatchCheckpoint> latestCheckpoint(String sessionId) {
        return store.latest(sessionId);
    }
}
