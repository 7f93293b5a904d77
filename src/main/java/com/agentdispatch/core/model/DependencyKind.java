package com.agentdispatch.core.model;

/**
 * Why one task must wait for another.
 */
public enum DependencyKind {
    /** Output of the source task is an input of the target. */
    DATA(3),
    /** Both tasks write the same artifact and must not overlap. */
    RESOURCE(2),
    /** Workflow ordering, e.g. research before implementation. */
    LOGICAL(1);

    private final int precedence;

    DependencyKind(int precedence) {
        this.precedence = precedence;
    }

    public int precedence() {
        return precedence;
    }
}
