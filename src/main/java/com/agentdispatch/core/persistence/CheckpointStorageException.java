package com.agentdispatch.core.persistence;

import com.agentdispatch.core.DispatchException;

/**
 * The checkpoint backend could not be reached or refused an operation.
 */
public class CheckpointStorageException extends DispatchException {

    public CheckpointStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
