package com.agentdispatch.core.model;

/**
 * Origin of a dependency edge. Rule edges are authoritative; model edges are suggestions.
 */
public enum EdgeProvenance {
    RULE,
    MODEL
}
