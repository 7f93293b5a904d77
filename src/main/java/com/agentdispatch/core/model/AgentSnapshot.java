package com.agentdispatch.core.model;

import java.io.Serializable;
import java.util.Set;

/**
 * Immutable view of a pooled agent.
 *
 * @param currentTaskId task the agent is bound to; null when idle
 */
public record AgentSnapshot(
    String id,
    String kind,
    Set<TaskType> capabilities,
    AgentStatus status,
    String currentTaskId
) implements Serializable {

    public AgentSnapshot {
        capabilities = capabilities == null ? Set.of() : Set.copyOf(capabilities);
    }
}
