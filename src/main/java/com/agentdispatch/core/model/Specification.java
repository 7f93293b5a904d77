package com.agentdispatch.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Finalized specification handed over by the upstream refinement pipeline.
 * Only {@code requirements} and {@code constraints} are required.
 */
public record Specification(
    String title,
    String description,
    List<String> requirements,
    List<String> constraints,
    List<String> successCriteria
) implements Serializable {

    public Specification {
        requirements = requirements == null ? List.of() : List.copyOf(requirements);
        constraints = constraints == null ? List.of() : List.copyOf(constraints);
        successCriteria = successCriteria == null ? List.of() : List.copyOf(successCriteria);
    }

    public Specification(List<String> requirements, List<String> constraints) {
        this(null, null, requirements, constraints, List.of());
    }

    /** True when there is nothing to decompose: no non-blank requirement or constraint. */
    public boolean isEmpty() {
        return requirements.stream().allMatch(r -> r == null || r.isBlank())
                && constraints.stream().allMatch(c -> c == null || c.isBlank());
    }
}
