package com.agentdispatch.core.graph;

import java.io.Serializable;

/**
 * Shape summary of a built graph.
 *
 * @param theoreticalSpeedup total duration divided by critical-path length (1.0 for a chain)
 */
public record GraphStatistics(
    int taskCount,
    int edgeCount,
    int phaseCount,
    int maxPhaseWidth,
    double totalDuration,
    double criticalPathLength,
    double theoreticalSpeedup
) implements Serializable {}
