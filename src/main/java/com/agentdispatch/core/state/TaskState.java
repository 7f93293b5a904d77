package com.agentdispatch.core.state;

import com.agentdispatch.core.model.TaskStatus;

import java.io.Serializable;
import java.time.Instant;

/**
 * Runtime state of one task, as held by the {@link StateManager} and stored in checkpoints.
 *
 * @param retryCount       failed attempts so far
 * @param assignedAgentId  agent of the current or last attempt; nullable
 * @param reason           why the task is where it is (failure message, skip cause); nullable
 * @param readySequence    arrival order in the ready queue; 0 until the task first became READY
 * @param notBefore        earliest time a retry may be scheduled; nullable
 * @param startedAt        start of the current or last attempt; nullable
 * @param finishedAt       end of the last attempt; nullable
 * @param lastDurationMs   wall time of the last finished attempt
 */
public record TaskState(
    String taskId,
    TaskStatus status,
    int retryCount,
    String assignedAgentId,
    String reason,
    long readySequence,
    Instant notBefore,
    Instant startedAt,
    Instant finishedAt,
    long lastDurationMs
) implements Serializable {

    public static TaskState initial(String taskId) {
        return new TaskState(taskId, TaskStatus.PENDING, 0, null, null, 0L, null, null, null, 0L);
    }
}
