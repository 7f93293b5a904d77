package com.agentdispatch.core.agent;

import com.agentdispatch.core.DispatchException;

/**
 * No capable agent could be acquired for a ready task within the acquire timeout.
 */
public class ResourceExhaustedException extends DispatchException {

    public ResourceExhaustedException(String message) {
        super(message);
    }

    public ResourceExhaustedException(String message, Throwable cause) {
        super(message, cause);
    }
}
