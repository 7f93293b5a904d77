package com.agentdispatch.core.agent;

import com.agentdispatch.core.model.TaskType;

import java.util.EnumSet;
import java.util.Set;

/**
 * Base class holding identity, capabilities and the cooperative stop flag.
 */
public abstract class AbstractAgent implements Agent {

    private final String id;
    private final String kind;
    private final Set<TaskType> capabilities;
    private volatile boolean stopRequested;

    protected AbstractAgent(String id, String kind, Set<TaskType> capabilities) {
        this.id = id;
        this.kind = kind;
        this.capabilities = capabilities.isEmpty()
                ? Set.of()
                : Set.copyOf(EnumSet.copyOf(capabilities));
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public String kind() {
        return kind;
    }

    @Override
    public Set<TaskType> capabilities() {
        return capabilities;
    }

    @Override
    public void requestStop() {
        stopRequested = true;
    }

    @Override
    public void reset() {
        stopRequested = false;
    }

    protected boolean isStopRequested() {
        return stopRequested;
    }

    /**
     * Throws if a stop was requested or the worker thread was interrupted.
     */
    protected void checkStop() throws InterruptedException {
        if (stopRequested || Thread.currentThread().isInterrupted()) {
            throw new InterruptedException("Agent " + id + " stopped");
        }
    }

    @Override
    public String toString() {
        return kind + ":" + id;
    }
}
