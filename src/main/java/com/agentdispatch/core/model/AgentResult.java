package com.agentdispatch.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * What an agent reports after working on a task.
 */
public record AgentResult(
    String taskId,
    String agentId,
    boolean success,
    List<TaskArtifact> artifacts,
    String errorMessage,
    List<String> logs
) implements Serializable {

    public AgentResult {
        artifacts = artifacts == null ? List.of() : List.copyOf(artifacts);
        logs = logs == null ? List.of() : List.copyOf(logs);
    }

    public static AgentResult success(String taskId, String agentId, List<TaskArtifact> artifacts) {
        return new AgentResult(taskId, agentId, true, artifacts, null, List.of());
    }

    public static AgentResult failure(String taskId, String agentId, String errorMessage) {
        return new AgentResult(taskId, agentId, false, List.of(), errorMessage, List.of());
    }
}
