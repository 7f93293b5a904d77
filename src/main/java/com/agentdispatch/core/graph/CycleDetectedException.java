package com.agentdispatch.core.graph;

import com.agentdispatch.core.DispatchException;

import java.util.List;

/**
 * Thrown when a task/edge set contains a dependency cycle.
 */
public class CycleDetectedException extends DispatchException {

    private final List<String> involvedTaskIds;

    public CycleDetectedException(String message, List<String> involvedTaskIds) {
        super(message + ": " + involvedTaskIds);
        this.involvedTaskIds = List.copyOf(involvedTaskIds);
    }

    /** Tasks that could not be topologically ordered (the cycle plus anything downstream of it). */
    public List<String> involvedTaskIds() {
        return involvedTaskIds;
    }
}
