package com.agentdispatch.core.model;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

/**
 * Aggregate metrics collected over the lifetime of a dispatch.
 *
 * @param taskDurationsMs   wall time of each task's last attempt
 * @param retryCounts       failed attempts per task
 * @param agentUtilization  busy time / dispatch wall time, per agent id
 * @param queueDepth        ready-queue depth sampled once per scheduling tick
 * @param endToEndLatencyMs time from dispatch start to last terminal transition
 */
public record ExecutionMetrics(
    int totalTasks,
    int completedTasks,
    int failedTasks,
    int skippedTasks,
    int cancelledTasks,
    Map<String, Long> taskDurationsMs,
    Map<String, Integer> retryCounts,
    Map<String, Double> agentUtilization,
    List<QueueSample> queueDepth,
    long endToEndLatencyMs,
    double criticalPathLength
) implements Serializable {

    public record QueueSample(long offsetMs, int depth) implements Serializable {}

    public double completionPercentage() {
        if (totalTasks == 0) {
            return 0.0;
        }
        return completedTasks * 100.0 / totalTasks;
    }
}
