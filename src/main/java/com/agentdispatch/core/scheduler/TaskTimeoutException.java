package com.agentdispatch.core.scheduler;

import com.agentdispatch.core.DispatchException;

import java.time.Duration;

/**
 * A task attempt ran past its deadline.
 */
public class TaskTimeoutException extends DispatchException {

    public TaskTimeoutException(String taskId, Duration deadline) {
        super("Task " + taskId + " exceeded its deadline of " + deadline);
    }

    public TaskTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
