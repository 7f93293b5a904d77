package com.agentdispatch.core.agent;

import com.agentdispatch.core.model.TaskArtifact;

import java.util.Map;
import java.util.Optional;

/**
 * Read-only view handed to an agent for one attempt.
 *
 * @param sessionId dispatch session the task belongs to
 * @param attempt   1-based attempt number
 * @param inputs    artifacts already published under the task's declared input names
 */
public record AgentContext(String sessionId, int attempt, Map<String, TaskArtifact> inputs) {

    public AgentContext {
        inputs = inputs == null ? Map.of() : Map.copyOf(inputs);
    }

    public Optional<TaskArtifact> input(String name) {
        return Optional.ofNullable(inputs.get(name));
    }
}
