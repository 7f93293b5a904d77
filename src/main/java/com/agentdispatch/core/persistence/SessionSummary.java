package com.agentdispatch.core.persistence;

import com.agentdispatch.core.model.TaskStatus;

import java.time.Instant;
import java.util.Map;

/**
 * One line of dispatch history, derived from a session's latest checkpoint.
 *
 * @param lastReason what triggered the latest checkpoint ({@code final} once the dispatch ended)
 */
public record SessionSummary(
    String sessionId,
    int checkpoints,
    String lastCheckpointId,
    String lastReason,
    Instant startedAt,
    Instant updatedAt,
    Map<TaskStatus, Integer> statusCounts,
    int totalTasks
) {

    public int count(TaskStatus status) {
        return statusCounts.getOrDefault(status, 0);
    }
}
