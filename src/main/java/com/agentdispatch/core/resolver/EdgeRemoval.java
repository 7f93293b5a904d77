package com.agentdispatch.core.resolver;

import com.agentdispatch.core.model.DependencyEdge;

import java.io.Serializable;
import java.util.List;

/**
 * Audit record of an edge dropped to break a dependency cycle.
 *
 * @param edge  the removed edge, with its provenance
 * @param cycle task ids on the cycle at the time of removal
 */
public record EdgeRemoval(DependencyEdge edge, List<String> cycle) implements Serializable {

    public EdgeRemoval {
        cycle = List.copyOf(cycle);
    }
}
