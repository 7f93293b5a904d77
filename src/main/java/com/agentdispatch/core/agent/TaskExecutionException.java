package com.agentdispatch.core.agent;

import com.agentdispatch.core.DispatchException;

/**
 * Agent-reported failure of a single attempt. Recovered by the coordinator's retry policy.
 */
public class TaskExecutionException extends DispatchException {

    public TaskExecutionException(String message) {
        super(message);
    }

    public TaskExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
