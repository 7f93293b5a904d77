package com.agentdispatch.core.state;

import com.agentdispatch.core.graph.GraphSnapshot;
import com.agentdispatch.core.model.AgentSnapshot;
import com.agentdispatch.core.model.TaskArtifact;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Serializable image of a session, enough to resume it without re-decomposing.
 *
 * @param checkpointId     unique per session, ordered by {@code sequence}
 * @param sequence         monotonically increasing per session
 * @param graph            frozen graph export, skip reasons included
 * @param taskStates       runtime state per task id
 * @param agentAssignments task id to agent id for every bound task
 * @param agents           pool view at checkpoint time
 * @param artifacts        artifacts published so far
 * @param startedAt        when the dispatch started
 * @param cancelRequested  whether the whole dispatch was being cancelled
 * @param reason           what triggered this checkpoint (interval, transition, final)
 */
public record DispatchCheckpoint(
    String checkpointId,
    String sessionId,
    long sequence,
    GraphSnapshot graph,
    Map<String, TaskState> taskStates,
    Map<String, String> agentAssignments,
    List<AgentSnapshot> agents,
    List<TaskArtifact> artifacts,
    Instant startedAt,
    Instant createdAt,
    boolean cancelRequested,
    String reason
) implements Serializable {

    public DispatchCheckpoint {
        taskStates = taskStates == null ? Map.of() : Map.copyOf(taskStates);
        agentAssignments = agentAssignments == null ? Map.of() : Map.copyOf(agentAssignments);
        agents = agents == null ? List.of() : List.copyOf(agents);
        artifacts = artifacts == null ? List.of() : List.copyOf(artifacts);
    }
}
