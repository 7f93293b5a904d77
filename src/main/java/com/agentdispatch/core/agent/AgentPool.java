package com.agentdispatch.core.agent;

import com.agentdispatch.core.model.AgentSnapshot;
import com.agentdispatch.core.model.AgentStatus;
import com.agentdispatch.core.model.Task;
import com.agentdispatch.core.model.TaskType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Per-dispatch pool of agents.
 * <p>
 * Acquisition is an atomic check-and-assign: an idle agent whose capability set contains the
 * task type is bound to the task, or a new one is created if its provider is still below the
 * per-provider limit. An agent is never bound to two tasks at once. Failed agents are evicted
 * rather than returned.
 */
public class AgentPool implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AgentPool.class);

    private final AgentFactory factory;
    private final int maxPerProvider;
    private final Consumer<AgentSnapshot> listener;
    private final Map<String, Slot> slots = new LinkedHashMap<>();
    private final Map<String, Long> retiredBusyNanos = new HashMap<>();
    private boolean closed;

    private static final class Slot {
        final Agent agent;
        AgentStatus status = AgentStatus.IDLE;
        String taskId;
        long busySince;
        long busyNanos;

        Slot(Agent agent) {
            this.agent = agent;
        }

        AgentSnapshot snapshot() {
            return new AgentSnapshot(agent.id(), agent.kind(), agent.capabilities(), status, taskId);
        }
    }

    /**
     * @param maxPerProvider upper bound on live agents created by one provider
     * @param listener       notified on every agent status change, under the pool lock
     */
    public AgentPool(AgentFactory factory, int maxPerProvider, Consumer<AgentSnapshot> listener) {
        if (maxPerProvider < 1) {
            throw new IllegalArgumentException("maxPerProvider must be >= 1: " + maxPerProvider);
        }
        this.factory = factory;
        this.maxPerProvider = maxPerProvider;
        this.listener = listener == null ? s -> { } : listener;
    }

    /** Whether any provider can ever serve this type. */
    public boolean canServe(TaskType type) {
        return factory.supports(type);
    }

    /**
     * Binds an agent to {@code task}.
     *
     * @return the bound agent, or empty if every capable agent is busy and no provider has room
     */
    public synchronized Optional<Agent> acquire(Task task) {
        if (closed) {
            return Optional.empty();
        }
        for (Slot slot : slots.values()) {
            if (slot.status == AgentStatus.IDLE && slot.agent.canHandle(task.type())) {
                return Optional.of(bind(slot, task));
            }
        }
        for (AgentProvider provider : factory.providersFor(task.type())) {
            long live = slots.values().stream().filter(s -> s.agent.kind().equals(provider.name())).count();
            if (live < maxPerProvider) {
                Agent agent = factory.create(provider);
                var slot = new Slot(agent);
                slots.put(agent.id(), slot);
                return Optional.of(bind(slot, task));
            }
        }
        return Optional.empty();
    }

    /** Returns a healthy agent to the pool. */
    public synchronized void release(String agentId) {
        Slot slot = slots.get(agentId);
        if (slot == null || slot.status != AgentStatus.BUSY) {
            return;
        }
        accumulate(slot);
        slot.agent.reset();
        slot.status = AgentStatus.IDLE;
        slot.taskId = null;
        listener.accept(slot.snapshot());
    }

    /** Marks the agent FAILED, shuts it down and drops it from the pool. */
    public synchronized void evict(String agentId, String reason) {
        Slot slot = slots.remove(agentId);
        if (slot == null) {
            return;
        }
        accumulate(slot);
        retiredBusyNanos.merge(agentId, slot.busyNanos, Long::sum);
        slot.status = AgentStatus.FAILED;
        listener.accept(slot.snapshot());
        log.warn("Evicted agent {}: {}", agentId, reason);
        shutdownQuietly(slot.agent);
    }

    public synchronized Optional<Agent> agent(String agentId) {
        Slot slot = slots.get(agentId);
        return slot == null ? Optional.empty() : Optional.of(slot.agent);
    }

    public synchronized List<AgentSnapshot> snapshot() {
        return slots.values().stream().map(Slot::snapshot).toList();
    }

    public synchronized int busyCount() {
        return (int) slots.values().stream().filter(s -> s.status == AgentStatus.BUSY).count();
    }

    public synchronized int size() {
        return slots.size();
    }

    /**
     * Busy time per agent so far, including evicted agents and the running share of busy ones.
     */
    public synchronized Map<String, Long> busyMillis() {
        long now = System.nanoTime();
        var result = new LinkedHashMap<String, Long>();
        retiredBusyNanos.forEach((id, nanos) -> result.put(id, nanos / 1_000_000));
        for (Slot slot : slots.values()) {
            long nanos = slot.busyNanos;
            if (slot.status == AgentStatus.BUSY) {
                nanos += now - slot.busySince;
            }
            result.put(slot.agent.id(), nanos / 1_000_000);
        }
        return result;
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        for (Slot slot : new ArrayList<>(slots.values())) {
            shutdownQuietly(slot.agent);
        }
        log.debug("Agent pool closed ({} agents)", slots.size());
    }

    private Agent bind(Slot slot, Task task) {
        slot.status = AgentStatus.BUSY;
        slot.taskId = task.id();
        slot.busySince = System.nanoTime();
        listener.accept(slot.snapshot());
        return slot.agent;
    }

    private void accumulate(Slot slot) {
        if (slot.status == AgentStatus.BUSY) {
            slot.busyNanos += System.nanoTime() - slot.busySince;
        }
    }

    private void shutdownQuietly(Agent agent) {
        try {
            agent.shutdown();
        } catch (RuntimeException e) {
            log.warn("Agent {} failed to shut down cleanly: {}", agent.id(), e.getMessage());
        }
    }
}
