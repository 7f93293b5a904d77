package com.agentdispatch.core.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a task inside a dispatch.
 * <pre>
 *   PENDING -> READY -> SCHEDULED -> RUNNING -> COMPLETED | FAILED | CANCELLED | SKIPPED
 *   FAILED  -> PENDING   (retry)
 * </pre>
 */
public enum TaskStatus {
    PENDING,
    READY,
    SCHEDULED,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED,
    SKIPPED;

    private static final Set<TaskStatus> IN_FLIGHT = EnumSet.of(SCHEDULED, RUNNING);

    public boolean isInFlight() {
        return IN_FLIGHT.contains(this);
    }

    /**
     * Whether {@code this -> next} is a legal edge of the state machine.
     * {@code SCHEDULED/RUNNING -> PENDING} is only used when a restored session re-queues in-flight work.
     */
    public boolean canTransitionTo(TaskStatus next) {
        return switch (this) {
            case PENDING -> next == READY || next == CANCELLED || next == SKIPPED;
            case READY -> next == SCHEDULED || next == PENDING || next == CANCELLED
                    || next == SKIPPED || next == FAILED;
            case SCHEDULED -> next == RUNNING || next == FAILED || next == CANCELLED
                    || next == PENDING || next == COMPLETED;
            case RUNNING -> next == COMPLETED || next == FAILED || next == CANCELLED || next == PENDING;
            case FAILED -> next == PENDING;
            case COMPLETED, CANCELLED, SKIPPED -> false;
        };
    }
}
