package com.agentdispatch.core.resolver;

import java.io.Serializable;
import java.util.List;

/**
 * Structured output expected from the language model when refining dependencies.
 *
 * @param proposals suggested edge additions or removals
 * @param analysis  brief explanation of the reasoning
 */
public record DependencyProposals(
    List<Proposal> proposals,
    String analysis
) implements Serializable {

    /**
     * @param from       id of the task that must complete first
     * @param to         id of the task that depends on it
     * @param kind       "DATA", "LOGICAL" or "RESOURCE"
     * @param action     "ADD" or "REMOVE"
     * @param confidence 0.0 to 1.0
     * @param reason     why the dependency exists (or does not)
     */
    public record Proposal(
        String from,
        String to,
        String kind,
        String action,
        Double confidence,
        String reason
    ) implements Serializable {}
}
