package com.agentdispatch.core.graph;

import java.io.Serializable;
import java.util.List;

/**
 * Longest dependency chain by estimated duration.
 *
 * @param taskIds ordered from the first task to the last
 * @param length  summed estimated duration of the chain, in duration units
 */
public record CriticalPath(List<String> taskIds, double length) implements Serializable {

    public static final CriticalPath EMPTY = new CriticalPath(List.of(), 0.0);

    public CriticalPath {
        taskIds = List.copyOf(taskIds);
    }

    public boolean contains(String taskId) {
        return taskIds.contains(taskId);
    }
}
