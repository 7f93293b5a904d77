package com.agentdispatch.core.state;

import com.agentdispatch.core.DispatchException;

/**
 * A checkpoint is missing, unreadable or inconsistent with itself.
 */
public class CheckpointCorruptException extends DispatchException {

    public CheckpointCorruptException(String message) {
        super(message);
    }

    public CheckpointCorruptException(String message, Throwable cause) {
        super(message, cause);
    }
}
