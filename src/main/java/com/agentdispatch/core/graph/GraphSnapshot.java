package com.agentdispatch.core.graph;

import com.agentdispatch.core.model.DependencyEdge;
import com.agentdispatch.core.model.Task;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

/**
 * Plain node/edge export of an {@link ExecutionGraph}, used for external visualization
 * and as the graph part of a checkpoint.
 *
 * @param tasks        nodes in topological order
 * @param edges        dependency edges sorted by endpoints
 * @param phases       maximum-parallelism waves of task ids
 * @param criticalPath task ids on the longest duration-weighted path
 * @param skipReasons  skip annotations recorded after freeze, keyed by task id
 */
public record GraphSnapshot(
    List<Task> tasks,
    List<DependencyEdge> edges,
    List<List<String>> phases,
    List<String> criticalPath,
    Map<String, String> skipReasons
) implements Serializable {

    public GraphSnapshot {
        tasks = tasks == null ? List.of() : List.copyOf(tasks);
        edges = edges == null ? List.of() : List.copyOf(edges);
        phases = phases == null ? List.of() : phases.stream().map(List::copyOf).toList();
        criticalPath = criticalPath == null ? List.of() : List.copyOf(criticalPath);
        skipReasons = skipReasons == null ? Map.of() : Map.copyOf(skipReasons);
    }
}
