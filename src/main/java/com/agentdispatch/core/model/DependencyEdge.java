package com.agentdispatch.core.model;

import java.io.Serializable;
import java.util.Comparator;
import java.util.Objects;

/**
 * Ordering constraint: {@code from} must complete before {@code to} may start.
 *
 * @param from       upstream task id
 * @param to         downstream task id
 * @param kind       data, logical or resource dependency
 * @param confidence 0..1, 1.0 for certain edges
 * @param provenance rule-derived or model-suggested
 * @param reason     short human-readable justification, kept for audit logs
 */
public record DependencyEdge(
    String from,
    String to,
    DependencyKind kind,
    double confidence,
    EdgeProvenance provenance,
    String reason
) implements Serializable {

    public static final Comparator<DependencyEdge> BY_ENDPOINTS =
            Comparator.comparing(DependencyEdge::from).thenComparing(DependencyEdge::to);

    public DependencyEdge {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(provenance, "provenance");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0, 1]: " + confidence);
        }
    }

    public static DependencyEdge rule(String from, String to, DependencyKind kind, double confidence, String reason) {
        return new DependencyEdge(from, to, kind, confidence, EdgeProvenance.RULE, reason);
    }

    public String key() {
        return from + "->" + to;
    }

    @Override
    public String toString() {
        return key() + " [" + kind + ", " + provenance + ", " + confidence + "]";
    }
}
