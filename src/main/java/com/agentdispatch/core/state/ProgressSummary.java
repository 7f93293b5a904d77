package com.agentdispatch.core.state;

import com.agentdispatch.core.model.TaskStatus;

import java.io.Serializable;
import java.util.Map;

/**
 * Task counts per status with the share of completed tasks.
 */
public record ProgressSummary(Map<TaskStatus, Integer> counts, int total) implements Serializable {

    public ProgressSummary {
        counts = Map.copyOf(counts);
    }

    public int count(TaskStatus status) {
        return counts.getOrDefault(status, 0);
    }

    public int terminal() {
        return count(TaskStatus.COMPLETED) + count(TaskStatus.FAILED)
                + count(TaskStatus.CANCELLED) + count(TaskStatus.SKIPPED);
    }

    public double completionPercentage() {
        return total == 0 ? 0.0 : count(TaskStatus.COMPLETED) * 100.0 / total;
    }
}
