package com.agentdispatch.core.model;

/**
 * Overall status of a dispatch.
 */
public enum ExecutionStatus {
    PLANNING,
    EXECUTING,
    COMPLETED,
    FAILED,
    CANCELLED
}
