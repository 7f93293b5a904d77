package com.agentdispatch.core.model;

/**
 * Pool-level status of an agent.
 */
public enum AgentStatus {
    IDLE,
    BUSY,
    FAILED
}
