package com.agentdispatch.core.model;

import java.io.Serializable;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * An atomic unit of work with declared inputs/outputs and a capability requirement.
 *
 * @param id              unique identifier (e.g., "TASK-001")
 * @param type            capability an agent must declare to run this task
 * @param description     what this task should accomplish
 * @param inputArtifacts  artifact names this task consumes
 * @param outputArtifacts artifact names this task produces
 * @param complexity      estimated complexity, 1.0 (simple) to 5.0 (very complex)
 * @param priority        higher runs first among ready tasks
 * @param status          current lifecycle status
 * @param assignedAgentId agent currently or last bound to this task (nullable)
 * @param retryCount      failed attempts so far
 * @param optional        best-effort task: its failure neither fails the dispatch nor blocks dependents
 * @param timeout         explicit deadline; null derives one from complexity
 * @param context         free-form context handed to the agent (constraints, subject, ...)
 */
public record Task(
    String id,
    TaskType type,
    String description,
    List<String> inputArtifacts,
    List<String> outputArtifacts,
    double complexity,
    int priority,
    TaskStatus status,
    String assignedAgentId,
    int retryCount,
    boolean optional,
    Duration timeout,
    Map<String, String> context
) implements Serializable {

    public Task {
        inputArtifacts = inputArtifacts == null ? List.of() : List.copyOf(inputArtifacts);
        outputArtifacts = outputArtifacts == null ? List.of() : List.copyOf(outputArtifacts);
        context = context == null ? Map.of() : Map.copyOf(context);
        status = status == null ? TaskStatus.PENDING : status;
    }

    /** Convenience constructor for freshly decomposed tasks. */
    public Task(String id, TaskType type, String description, List<String> inputArtifacts,
                List<String> outputArtifacts, double complexity, int priority) {
        this(id, type, description, inputArtifacts, outputArtifacts, complexity, priority,
                TaskStatus.PENDING, null, 0, false, null, Map.of());
    }

    public Task withStatus(TaskStatus newStatus) {
        return new Task(id, type, description, inputArtifacts, outputArtifacts, complexity, priority,
                newStatus, assignedAgentId, retryCount, optional, timeout, context);
    }

    public Task withAssignedAgent(String agentId) {
        return new Task(id, type, description, inputArtifacts, outputArtifacts, complexity, priority,
                status, agentId, retryCount, optional, timeout, context);
    }

    public Task withRetryCount(int count) {
        return new Task(id, type, description, inputArtifacts, outputArtifacts, complexity, priority,
                status, assignedAgentId, count, optional, timeout, context);
    }

    public Task withId(String newId) {
        return new Task(newId, type, description, inputArtifacts, outputArtifacts, complexity, priority,
                status, assignedAgentId, retryCount, optional, timeout, context);
    }

    public Task asOptional(boolean bestEffort) {
        return new Task(id, type, description, inputArtifacts, outputArtifacts, complexity, priority,
                status, assignedAgentId, retryCount, bestEffort, timeout, context);
    }

    public Task withTimeout(Duration explicitTimeout) {
        return new Task(id, type, description, inputArtifacts, outputArtifacts, complexity, priority,
                status, assignedAgentId, retryCount, optional, explicitTimeout, context);
    }

    public Task withContext(Map<String, String> newContext) {
        return new Task(id, type, description, inputArtifacts, outputArtifacts, complexity, priority,
                status, assignedAgentId, retryCount, optional, timeout, newContext);
    }
}
