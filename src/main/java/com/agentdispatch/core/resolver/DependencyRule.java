package com.agentdispatch.core.resolver;

import com.agentdispatch.core.model.DependencyEdge;
import com.agentdispatch.core.model.Task;

import java.util.List;

/**
 * A deterministic source of dependency edges. Rules are registered by name and may be
 * supplied as plugins; their edges are authoritative over model suggestions.
 * <p>
 * Implementations must be pure: the same task list always yields the same edges.
 */
public interface DependencyRule {

    String name();

    List<DependencyEdge> apply(List<Task> tasks);
}
