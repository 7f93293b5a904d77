package com.agentdispatch.core.state;

import com.agentdispatch.core.events.MessageBus;
import com.agentdispatch.core.events.MessagePriority;
import com.agentdispatch.core.events.Topics;
import com.agentdispatch.core.graph.CycleDetectedException;
import com.agentdispatch.core.graph.ExecutionGraph;
import com.agentdispatch.core.metrics.DispatchMetrics;
import com.agentdispatch.core.model.AgentSnapshot;
import com.agentdispatch.core.model.AgentStatus;
import com.agentdispatch.core.model.ExecutionMetrics;
import com.agentdispatch.core.model.Task;
import com.agentdispatch.core.model.TaskArtifact;
import com.agentdispatch.core.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Authoritative state of one dispatch session.
 * <p>
 * Every task transition, artifact and agent change passes through here; each mutation is
 * validated against the task state machine and announced on the {@link MessageBus}.
 * Readers only ever receive immutable snapshots. All methods are synchronized: the
 * coordinator loop is the single writer, observers may read concurrently.
 */
public class StateManager {

    private static final Logger log = LoggerFactory.getLogger(StateManager.class);

    /** Queue-depth samples kept for the final metrics; older samples are thinned out. */
    static final int MAX_QUEUE_SAMPLES = 2_000;

    private final String sessionId;
    private final ExecutionGraph graph;
    private final MessageBus bus;
    private final CheckpointStore store;
    private final DispatchMetrics metrics;
    private final Clock clock;
    private final int checkpointRetention;

    private final Map<String, TaskState> states = new LinkedHashMap<>();
    private final Map<String, TaskArtifact> artifacts = new LinkedHashMap<>();
    private final Map<String, AgentSnapshot> agents = new LinkedHashMap<>();
    private final List<ExecutionMetrics.QueueSample> queueSamples = new ArrayList<>();
    private final Instant startedAt;
    private long readySequence;
    private long checkpointSequence;
    private boolean cancelRequested;
    private Instant lastTerminalAt;

    /**
     * Fresh session: every task starts PENDING.
     *
     * @param bus     nullable; no events are published without one
     * @param store   nullable; {@link #checkpoint} is a no-op without one
     * @param metrics nullable
     */
    public StateManager(String sessionId, ExecutionGraph graph, MessageBus bus, CheckpointStore store,
                        int checkpointRetention, DispatchMetrics metrics, Clock clock) {
        this.sessionId = sessionId;
        this.graph = graph;
        this.bus = bus;
        this.store = store;
        this.checkpointRetention = checkpointRetention;
        this.metrics = metrics;
        this.clock = clock;
        this.startedAt = clock.instant();
        for (String id : graph.topologicalOrder()) {
            states.put(id, TaskState.initial(id));
        }
    }

    private StateManager(DispatchCheckpoint checkpoint, ExecutionGraph graph, MessageBus bus, CheckpointStore store,
                         int checkpointRetention, DispatchMetrics metrics, Clock clock) {
        this.sessionId = checkpoint.sessionId();
        this.graph = graph;
        this.bus = bus;
        this.store = store;
        this.checkpointRetention = checkpointRetention;
        this.metrics = metrics;
        this.clock = clock;
        this.startedAt = checkpoint.startedAt() == null ? clock.instant() : checkpoint.startedAt();
        this.checkpointSequence = checkpoint.sequence();
        this.cancelRequested = checkpoint.cancelRequested();
        for (String id : graph.topologicalOrder()) {
            states.put(id, checkpoint.taskStates().get(id));
        }
        this.readySequence = states.values().stream().mapToLong(TaskState::readySequence).max().orElse(0L);
        checkpoint.artifacts().forEach(a -> artifacts.put(a.name(), a));
        checkpoint.agents().forEach(a -> agents.put(a.id(), a));
    }

    /**
     * Rehydrates a session from its latest checkpoint, or from {@code checkpointId} when given.
     * Task states are reproduced exactly; re-queueing in-flight work is the caller's decision.
     *
     * @throws CheckpointCorruptException if the checkpoint is missing, unreadable or inconsistent
     */
    public static StateManager restore(CheckpointStore store, String sessionId, String checkpointId,
                                       double durationUnit, MessageBus bus, int checkpointRetention,
                                       DispatchMetrics metrics, Clock clock) {
        Optional<DispatchCheckpoint> found = checkpointId == null
                ? store.latest(sessionId)
                : store.load(sessionId, checkpointId);
        DispatchCheckpoint checkpoint = found.orElseThrow(() -> new CheckpointCorruptException(
                "No checkpoint " + (checkpointId == null ? "" : checkpointId + " ") + "for session " + sessionId));
        validate(checkpoint, sessionId);

        ExecutionGraph graph;
        try {
            graph = ExecutionGraph.fromSnapshot(checkpoint.graph(), durationUnit);
        } catch (CycleDetectedException | IllegalArgumentException e) {
            throw new CheckpointCorruptException("Checkpoint " + checkpoint.checkpointId()
                    + " holds an invalid graph: " + e.getMessage(), e);
        }
        for (String id : graph.topologicalOrder()) {
            if (!checkpoint.taskStates().containsKey(id)) {
                throw new CheckpointCorruptException("Checkpoint " + checkpoint.checkpointId()
                        + " has no state for task " + id);
            }
        }
        log.info("Restored session {} from checkpoint {} ({} tasks)",
                sessionId, checkpoint.checkpointId(), graph.size());
        return new StateManager(checkpoint, graph, bus, store, checkpointRetention, metrics, clock);
    }

    private static void validate(DispatchCheckpoint checkpoint, String sessionId) {
        if (!sessionId.equals(checkpoint.sessionId())) {
            throw new CheckpointCorruptException("Checkpoint " + checkpoint.checkpointId()
                    + " belongs to session " + checkpoint.sessionId() + ", not " + sessionId);
        }
        if (checkpoint.graph() == null) {
            throw new CheckpointCorruptException("Checkpoint " + checkpoint.checkpointId() + " has no graph");
        }
        for (var entry : checkpoint.taskStates().entrySet()) {
            TaskState state = entry.getValue();
            if (state == null || state.status() == null || !entry.getKey().equals(state.taskId())) {
                throw new CheckpointCorruptException("Checkpoint " + checkpoint.checkpointId()
                        + " has a malformed state for task " + entry.getKey());
            }
        }
    }

    // ── Tasks ────────────────────────────────────────────────────────────

    public String sessionId() {
        return sessionId;
    }

    public ExecutionGraph graph() {
        return graph;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public synchronized TaskState state(String taskId) {
        TaskState state = states.get(taskId);
        if (state == null) {
            throw new IllegalArgumentException("Unknown task: " + taskId);
        }
        return state;
    }

    public synchronized TaskStatus status(String taskId) {
        return state(taskId).status();
    }

    /** The graph's task with its current runtime status, retry count and agent applied. */
    public synchronized Task task(String taskId) {
        TaskState state = state(taskId);
        return graph.task(taskId)
                .withStatus(state.status())
                .withRetryCount(state.retryCount())
                .withAssignedAgent(state.assignedAgentId());
    }

    public synchronized List<Task> tasks() {
        return states.keySet().stream().map(this::task).toList();
    }

    public synchronized Map<String, TaskState> taskStates() {
        return Map.copyOf(states);
    }

    /**
     * Moves a task along the state machine.
     *
     * @param reason recorded as the task's status reason; nullable
     * @throws IllegalStateException if {@code current -> next} is not a legal transition
     */
    public synchronized TaskState transition(String taskId, TaskStatus next, String reason) {
        TaskState current = state(taskId);
        if (!current.status().canTransitionTo(next)) {
            throw new IllegalStateException("Illegal transition for " + taskId + ": "
                    + current.status() + " -> " + next);
        }
        Instant now = clock.instant();
        long seq = current.readySequence();
        Instant notBefore = current.notBefore();
        Instant started = current.startedAt();
        Instant finished = current.finishedAt();
        long duration = current.lastDurationMs();
        String agent = current.assignedAgentId();

        switch (next) {
            case READY -> seq = ++readySequence;
            case RUNNING -> {
                started = now;
                finished = null;
            }
            case PENDING -> agent = null;
            default -> { }
        }
        if ((next == TaskStatus.COMPLETED || next == TaskStatus.FAILED || next == TaskStatus.CANCELLED)
                && current.status() == TaskStatus.RUNNING && started != null) {
            finished = now;
            duration = Duration.between(started, now).toMillis();
            if (metrics != null && next != TaskStatus.CANCELLED) {
                metrics.recordTaskDuration(graph.task(taskId).type().name(), duration);
            }
        }
        if (next != TaskStatus.PENDING) {
            notBefore = next == TaskStatus.READY ? null : notBefore;
        }

        String newReason = reason != null ? reason : (next == TaskStatus.PENDING || next == TaskStatus.READY
                ? current.reason() : null);
        var updated = new TaskState(taskId, next, current.retryCount(), agent, newReason, seq,
                notBefore, started, finished, duration);
        states.put(taskId, updated);
        if (isTerminal(next)) {
            lastTerminalAt = now;
            if (metrics != null) {
                metrics.recordTaskOutcome(graph.task(taskId).type().name(), next.name().toLowerCase(Locale.ROOT));
            }
        }
        log.debug("Task {} {} -> {}{}", taskId, current.status(), next, reason == null ? "" : " (" + reason + ")");
        publishTask(updated, current.status());
        return updated;
    }

    public synchronized void assign(String taskId, String agentId) {
        TaskState s = state(taskId);
        states.put(taskId, new TaskState(taskId, s.status(), s.retryCount(), agentId, s.reason(),
                s.readySequence(), s.notBefore(), s.startedAt(), s.finishedAt(), s.lastDurationMs()));
    }

    /** @return the new retry count */
    public synchronized int incrementRetry(String taskId) {
        TaskState s = state(taskId);
        states.put(taskId, new TaskState(taskId, s.status(), s.retryCount() + 1, s.assignedAgentId(), s.reason(),
                s.readySequence(), s.notBefore(), s.startedAt(), s.finishedAt(), s.lastDurationMs()));
        return s.retryCount() + 1;
    }

    public synchronized void deferUntil(String taskId, Instant notBefore) {
        TaskState s = state(taskId);
        states.put(taskId, new TaskState(taskId, s.status(), s.retryCount(), s.assignedAgentId(), s.reason(),
                s.readySequence(), notBefore, s.startedAt(), s.finishedAt(), s.lastDurationMs()));
    }

    public synchronized boolean isCancelRequested() {
        return cancelRequested;
    }

    public synchronized void markCancelRequested() {
        cancelRequested = true;
    }

    public synchronized boolean allTerminal() {
        return states.values().stream().allMatch(s -> isTerminal(s.status()));
    }

    public synchronized ProgressSummary progress() {
        var counts = new EnumMap<TaskStatus, Integer>(TaskStatus.class);
        states.values().forEach(s -> counts.merge(s.status(), 1, Integer::sum));
        return new ProgressSummary(counts, states.size());
    }

    /**
     * COMPLETED, CANCELLED and SKIPPED never leave; FAILED is terminal once the coordinator
     * stops retrying, which is when this predicate is consulted.
     */
    public static boolean isTerminal(TaskStatus status) {
        return status == TaskStatus.COMPLETED || status == TaskStatus.FAILED
                || status == TaskStatus.CANCELLED || status == TaskStatus.SKIPPED;
    }

    // ── Artifacts ────────────────────────────────────────────────────────

    public synchronized void publishArtifacts(Collection<TaskArtifact> produced) {
        for (TaskArtifact artifact : produced) {
            artifacts.put(artifact.name(), artifact);
            if (bus != null) {
                bus.publish(Topics.task(artifact.producedBy()), Map.of(
                        "type", Topics.TASK_ARTIFACT,
                        "sessionId", sessionId,
                        "taskId", artifact.producedBy(),
                        "artifact", artifact.name(),
                        "partial", artifact.partial()));
            }
        }
    }

    /** Published artifacts among {@code names}; missing ones are simply absent. */
    public synchronized Map<String, TaskArtifact> artifacts(Collection<String> names) {
        var found = new HashMap<String, TaskArtifact>();
        for (String name : names) {
            TaskArtifact artifact = artifacts.get(name);
            if (artifact != null) {
                found.put(name, artifact);
            }
        }
        return found;
    }

    public synchronized List<TaskArtifact> allArtifacts() {
        return List.copyOf(artifacts.values());
    }

    // ── Agents ───────────────────────────────────────────────────────────

    public synchronized void agentChanged(AgentSnapshot snapshot) {
        if (snapshot.status() == AgentStatus.FAILED) {
            agents.remove(snapshot.id());
        } else {
            agents.put(snapshot.id(), snapshot);
        }
        if (bus != null) {
            var payload = new HashMap<String, Object>();
            payload.put("type", Topics.AGENT_STATUS);
            payload.put("sessionId", sessionId);
            payload.put("agentId", snapshot.id());
            payload.put("status", snapshot.status().name());
            if (snapshot.currentTaskId() != null) {
                payload.put("taskId", snapshot.currentTaskId());
            }
            bus.publish(Topics.agent(snapshot.id()), payload);
        }
    }

    public synchronized List<AgentSnapshot> agents() {
        return List.copyOf(agents.values());
    }

    // ── Metrics ──────────────────────────────────────────────────────────

    public synchronized void recordQueueDepth(int depth) {
        long offset = Duration.between(startedAt, clock.instant()).toMillis();
        if (queueSamples.size() >= MAX_QUEUE_SAMPLES) {
            // keep every other sample so the series still spans the whole run
            var thinned = new ArrayList<ExecutionMetrics.QueueSample>();
            for (int i = 0; i < queueSamples.size(); i += 2) {
                thinned.add(queueSamples.get(i));
            }
            queueSamples.clear();
            queueSamples.addAll(thinned);
        }
        queueSamples.add(new ExecutionMetrics.QueueSample(offset, depth));
        if (metrics != null) {
            metrics.recordQueueDepth(depth);
        }
    }

    /**
     * @param busyMillis busy time per agent id, from the agent pool
     */
    public synchronized ExecutionMetrics metrics(Map<String, Long> busyMillis) {
        Instant end = lastTerminalAt != null ? lastTerminalAt : clock.instant();
        long latency = Math.max(0L, Duration.between(startedAt, end).toMillis());
        var durations = new TreeMap<String, Long>();
        var retries = new TreeMap<String, Integer>();
        for (TaskState s : states.values()) {
            if (s.finishedAt() != null) {
                durations.put(s.taskId(), s.lastDurationMs());
            }
            retries.put(s.taskId(), s.retryCount());
        }
        var utilization = new TreeMap<String, Double>();
        busyMillis.forEach((agentId, busy) ->
                utilization.put(agentId, latency == 0 ? 0.0 : Math.min(1.0, busy / (double) latency)));
        ProgressSummary progress = progress();
        return new ExecutionMetrics(states.size(),
                progress.count(TaskStatus.COMPLETED), progress.count(TaskStatus.FAILED),
                progress.count(TaskStatus.SKIPPED), progress.count(TaskStatus.CANCELLED),
                durations, retries, utilization, List.copyOf(queueSamples), latency,
                graph.criticalPath().length());
    }

    // ── Checkpoints ──────────────────────────────────────────────────────

    /**
     * Captures the session and hands it to the checkpoint store, pruning beyond the retention
     * count. A store failure is logged and does not disturb the running dispatch.
     *
     * @return the checkpoint, also when persisting it failed
     */
    public synchronized DispatchCheckpoint checkpoint(String reason) {
        long start = System.currentTimeMillis();
        var assignments = new TreeMap<String, String>();
        states.values().stream()
                .filter(s -> s.status().isInFlight() && s.assignedAgentId() != null)
                .forEach(s -> assignments.put(s.taskId(), s.assignedAgentId()));
        long sequence = ++checkpointSequence;
        var checkpoint = new DispatchCheckpoint(
                String.format("%s-cp-%06d", sessionId, sequence), sessionId, sequence, graph.export(),
                states, assignments, List.copyOf(agents.values()), List.copyOf(artifacts.values()),
                startedAt, clock.instant(), cancelRequested, reason);
        if (store == null) {
            return checkpoint;
        }
        try {
            store.save(checkpoint);
            int pruned = store.prune(sessionId, checkpointRetention);
            log.debug("Checkpoint {} saved ({}), pruned {}", checkpoint.checkpointId(), reason, pruned);
            if (bus != null) {
                bus.publish(Topics.checkpoint(sessionId), Map.of(
                        "type", Topics.CHECKPOINT_SAVED,
                        "sessionId", sessionId,
                        "checkpointId", checkpoint.checkpointId(),
                        "reason", reason));
            }
        } catch (RuntimeException e) {
            log.error("Failed to persist checkpoint {} for session {}: {}",
                    checkpoint.checkpointId(), sessionId, e.getMessage(), e);
        }
        if (metrics != null) {
            metrics.recordCheckpoint(System.currentTimeMillis() - start);
        }
        return checkpoint;
    }

    // ── Events ───────────────────────────────────────────────────────────

    private void publishTask(TaskState state, TaskStatus from) {
        if (bus == null) {
            return;
        }
        var payload = new HashMap<String, Object>();
        payload.put("type", Topics.TASK_STATUS);
        payload.put("sessionId", sessionId);
        payload.put("taskId", state.taskId());
        payload.put("from", from.name());
        payload.put("to", state.status().name());
        payload.put("retryCount", state.retryCount());
        if (state.reason() != null) {
            payload.put("reason", state.reason());
        }
        if (state.assignedAgentId() != null) {
            payload.put("agentId", state.assignedAgentId());
        }
        MessagePriority priority = state.status() == TaskStatus.FAILED ? MessagePriority.HIGH : MessagePriority.NORMAL;
        bus.publish(Topics.task(state.taskId()), payload, priority, null);

        if (isTerminal(state.status())) {
            ProgressSummary progress = progress();
            bus.publish(Topics.dispatch(sessionId), Map.of(
                    "type", Topics.DISPATCH_PROGRESS,
                    "sessionId", sessionId,
                    "terminal", progress.terminal(),
                    "total", progress.total(),
                    "completionPercentage", progress.completionPercentage()));
        }
    }
}
