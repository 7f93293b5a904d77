package com.agentdispatch.core.graph;

import com.agentdispatch.core.DispatchException;

/**
 * Thrown on structural mutation of an {@link ExecutionGraph} after {@link ExecutionGraph#freeze()}.
 */
public class GraphFrozenException extends DispatchException {

    public GraphFrozenException(String operation) {
        super("Execution graph is frozen; " + operation + " is not permitted");
    }
}
