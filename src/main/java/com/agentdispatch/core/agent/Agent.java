package com.agentdispatch.core.agent;

import com.agentdispatch.core.model.AgentResult;
import com.agentdispatch.core.model.Task;
import com.agentdispatch.core.model.TaskType;

import java.util.Set;

/**
 * Lifecycle contract of a worker.
 * <p>
 * Agents are matched to tasks by capability-set membership only. An agent runs one task at a
 * time on a coordinator worker thread; it must observe {@link #requestStop()} and thread
 * interruption cooperatively. Exceptions thrown from {@link #execute} are converted into a
 * failed attempt by the caller.
 */
public interface Agent {

    String id();

    /** Name of the provider that created this agent. */
    String kind();

    Set<TaskType> capabilities();

    default boolean canHandle(TaskType type) {
        return capabilities().contains(type);
    }

    /**
     * Performs the task and reports its artifacts.
     *
     * @throws TaskExecutionException for an agent-detected failure
     * @throws InterruptedException   if stopped by interruption
     */
    AgentResult execute(Task task, AgentContext context) throws InterruptedException;

    /** Cooperative stop request; the running {@link #execute} should return promptly. */
    void requestStop();

    /** Clears per-task state before the agent is reused from the pool. */
    void reset();

    /** Releases resources when the agent is evicted or its pool closes. */
    default void shutdown() {
    }
}
