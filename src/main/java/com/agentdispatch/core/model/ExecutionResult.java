package com.agentdispatch.core.model;

import com.agentdispatch.core.graph.GraphSnapshot;

import java.io.Serializable;
import java.util.List;

/**
 * Result of dispatching a specification: returned synchronously by the dispatcher
 * and mirrored incrementally as bus events while it runs.
 */
public record ExecutionResult(
    String sessionId,
    ExecutionStatus status,
    List<TaskOutcome> tasks,
    List<TaskArtifact> artifacts,
    ExecutionMetrics metrics,
    GraphSnapshot graph,
    List<String> errors
) implements Serializable {

    public TaskOutcome task(String taskId) {
        return tasks.stream()
                .filter(t -> t.id().equals(taskId))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown task: " + taskId));
    }
}
