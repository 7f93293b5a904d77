package com.agentdispatch.core;

/**
 * Root of the dispatch error taxonomy. Structural subclasses abort a dispatch before
 * execution starts; per-task subclasses are recovered by the coordinator.
 */
public class DispatchException extends RuntimeException {

    public DispatchException(String message) {
        super(message);
    }

    public DispatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
