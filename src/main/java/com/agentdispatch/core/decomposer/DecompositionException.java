package com.agentdispatch.core.decomposer;

import com.agentdispatch.core.DispatchException;

/**
 * The specification could not be turned into a non-empty, valid task list.
 */
public class DecompositionException extends DispatchException {

    public DecompositionException(String message) {
        super(message);
    }

    public DecompositionException(String message, Throwable cause) {
        super(message, cause);
    }
}
