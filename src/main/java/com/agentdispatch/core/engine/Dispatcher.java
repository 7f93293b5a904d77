package com.agentdispatch.core.engine;

import com.agentdispatch.core.agent.AgentFactory;
import com.agentdispatch.core.config.DispatcherProperties;
import com.agentdispatch.core.decomposer.TaskDecomposer;
import com.agentdispatch.core.events.MessageBus;
import com.agentdispatch.core.events.MessagePriority;
import com.agentdispatch.core.events.Topics;
import com.agentdispatch.core.graph.ExecutionGraph;
import com.agentdispatch.core.logging.MdcContext;
import com.agentdispatch.core.metrics.DispatchMetrics;
import com.agentdispatch.core.model.DependencyEdge;
import com.agentdispatch.core.model.ExecutionResult;
import com.agentdispatch.core.model.ExecutionStatus;
import com.agentdispatch.core.model.Specification;
import com.agentdispatch.core.model.Task;
import com.agentdispatch.core.model.TaskArtifact;
import com.agentdispatch.core.model.TaskOutcome;
import com.agentdispatch.core.model.TaskStatus;
import com.agentdispatch.core.resolver.DependencyResolver;
import com.agentdispatch.core.scheduler.Coordinator;
import com.agentdispatch.core.state.CheckpointStore;
import com.agentdispatch.core.state.StateManager;
import com.agentdispatch.core.state.TaskState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point of the engine: decompose, resolve, build and freeze the graph, then run the
 * coordinator until every task is terminal and aggregate the result.
 * <p>
 * Structural failures (empty specification, cycles) propagate to the caller before any task
 * runs. Everything after the graph is frozen ends in an {@link ExecutionResult}.
 */
@Service
public class Dispatcher {

    private static final Logger log = LoggerFactory.getLogger(Dispatcher.class);
    private static final AtomicInteger SESSION_COUNTER = new AtomicInteger(0);

    private final TaskDecomposer decomposer;
    private final DependencyResolver resolver;
    private final AgentFactory agentFactory;
    private final MessageBus bus;
    private final CheckpointStore store;
    private final DispatcherProperties properties;
    private final DispatchMetrics metrics;
    private final Clock clock;
    private final Map<String, Coordinator> active = new ConcurrentHashMap<>();

    @Autowired
    public Dispatcher(TaskDecomposer decomposer, DependencyResolver resolver, AgentFactory agentFactory,
                      MessageBus bus, CheckpointStore store, DispatcherProperties properties,
                      DispatchMetrics metrics) {
        this(decomposer, resolver, agentFactory, bus, store, properties, metrics, Clock.systemUTC());
    }

    public Dispatcher(TaskDecomposer decomposer, DependencyResolver resolver, AgentFactory agentFactory,
                      MessageBus bus, CheckpointStore store, DispatcherProperties properties,
                      DispatchMetrics metrics, Clock clock) {
        this.decomposer = decomposer;
        this.resolver = resolver;
        this.agentFactory = agentFactory;
        this.bus = bus;
        this.store = store;
        this.properties = properties;
        this.metrics = metrics;
        this.clock = clock;
    }

    public ExecutionResult dispatch(Specification specification) {
        return dispatch(generateSessionId(), specification);
    }

    /**
     * Runs a specification to completion under the given session id.
     *
     * @throws com.agentdispatch.core.decomposer.DecompositionException   if nothing can be decomposed
     * @throws com.agentdispatch.core.graph.CycleDetectedException        if the resolved edges are cyclic
     */
    public ExecutionResult dispatch(String sessionId, Specification specification) {
        MdcContext.setSession(sessionId);
        long start = System.currentTimeMillis();
        try {
            log.info("Starting dispatch {}: {}", sessionId,
                    specification == null || specification.title() == null ? "(untitled)" : specification.title());
            publish(sessionId, Topics.DISPATCH_STARTED, Map.of("status", ExecutionStatus.PLANNING.name()));

            var decomposition = decomposer.decomposeWithStrategy(specification);
            List<Task> tasks = decomposition.tasks();
            List<DependencyEdge> edges = resolver.resolve(tasks);
            ExecutionGraph graph = ExecutionGraph.build(tasks, edges, properties.durationUnitSeconds());
            graph.freeze();
            log.info("Planned {} tasks with {} dependencies via {} decomposition; {} phases, critical path {}",
                    graph.size(), edges.size(), decomposition.strategy(), graph.computePhases().size(),
                    graph.criticalPath().taskIds());

            var state = new StateManager(sessionId, graph, bus, store,
                    properties.getCheckpointRetention(), metrics, clock);
            return execute(state, false, start);
        } catch (RuntimeException e) {
            log.error("Dispatch {} aborted before execution: {}", sessionId, e.getMessage());
            publish(sessionId, Topics.DISPATCH_FINISHED, Map.of(
                    "status", ExecutionStatus.FAILED.name(),
                    "error", String.valueOf(e.getMessage())));
            if (metrics != null) {
                metrics.recordDispatchResult(ExecutionStatus.FAILED.name(), System.currentTimeMillis() - start);
            }
            throw e;
        } finally {
            MdcContext.clear();
        }
    }

    public ExecutionResult resume(String sessionId) {
        return resume(sessionId, null);
    }

    /**
     * Continues a session from its latest checkpoint, or from {@code checkpointId}.
     * Tasks that were in flight are run again; finished work is kept.
     *
     * @throws com.agentdispatch.core.state.CheckpointCorruptException if the checkpoint is missing or unreadable
     * @throws IllegalStateException if the session is still running in this process
     */
    public ExecutionResult resume(String sessionId, String checkpointId) {
        if (active.containsKey(sessionId)) {
            throw new IllegalStateException("Session " + sessionId + " is still running");
        }
        MdcContext.setSession(sessionId);
        long start = System.currentTimeMillis();
        try {
            var state = StateManager.restore(store, sessionId, checkpointId, properties.durationUnitSeconds(),
                    bus, properties.getCheckpointRetention(), metrics, clock);
            log.info("Resuming dispatch {} ({})", sessionId, state.progress().counts());
            publish(sessionId, Topics.DISPATCH_STARTED, Map.of(
                    "status", ExecutionStatus.EXECUTING.name(),
                    "resumed", true));
            return execute(state, true, start);
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Cancels a running dispatch.
     *
     * @return false if no such session is running in this process
     */
    public boolean cancel(String sessionId) {
        Coordinator coordinator = active.get(sessionId);
        if (coordinator == null) {
            return false;
        }
        coordinator.cancelAll();
        return true;
    }

    /**
     * Cancels one task of a running dispatch; its dependents are skipped.
     *
     * @return false if no such session is running in this process
     */
    public boolean cancelTask(String sessionId, String taskId) {
        Coordinator coordinator = active.get(sessionId);
        if (coordinator == null) {
            return false;
        }
        coordinator.cancel(taskId);
        return true;
    }

    /**
     * Stops assigning new tasks in a running dispatch; in-flight tasks finish normally.
     *
     * @return false if no such session is running in this process
     */
    public boolean pause(String sessionId) {
        Coordinator coordinator = active.get(sessionId);
        if (coordinator == null) {
            return false;
        }
        coordinator.pause();
        return true;
    }

    /**
     * Lets a paused dispatch assign tasks again.
     *
     * @return false if no such session is running in this process
     */
    public boolean unpause(String sessionId) {
        Coordinator coordinator = active.get(sessionId);
        if (coordinator == null) {
            return false;
        }
        coordinator.unpause();
        return true;
    }

    public boolean isPaused(String sessionId) {
        Coordinator coordinator = active.get(sessionId);
        return coordinator != null && coordinator.isPaused();
    }

    public Set<String> activeSessions() {
        return Set.copyOf(active.keySet());
    }

    /**
     * Generates a session id of the form {@code DSP-YYYY-NNNN}, skipping ids the checkpoint
     * store already knows.
     */
    public String generateSessionId() {
        int year = Instant.now(clock).atZone(ZoneOffset.UTC).getYear();
        List<String> known = store.sessions();
        String id;
        do {
            id = String.format("DSP-%d-%04d", year, SESSION_COUNTER.incrementAndGet());
        } while (known.contains(id) || active.containsKey(id));
        return id;
    }

    // ── Internals ────────────────────────────────────────────────────────

    private ExecutionResult execute(StateManager state, boolean resumed, long start) {
        String sessionId = state.sessionId();
        ExecutionStatus status;
        Map<String, Long> busy;
        try (var context = DispatchContext.open(sessionId, agentFactory, properties.getAgentPoolSizePerType(),
                state::agentChanged)) {
            var coordinator = new Coordinator(state, context.pool(), context.workers(), properties, bus, metrics, clock);
            if (active.putIfAbsent(sessionId, coordinator) != null) {
                throw new IllegalStateException("Session " + sessionId + " is already running");
            }
            try {
                if (resumed) {
                    coordinator.requeueInFlight();
                } else {
                    state.checkpoint("start");
                }
                publish(sessionId, Topics.DISPATCH_PROGRESS, Map.of("status", ExecutionStatus.EXECUTING.name()));
                status = coordinator.run();
                busy = context.pool().busyMillis();
            } finally {
                active.remove(sessionId);
            }
        }
        MdcContext.setSession(sessionId);

        ExecutionResult result = aggregate(state, status, busy);
        long elapsed = System.currentTimeMillis() - start;
        if (metrics != null) {
            metrics.recordDispatchResult(status.name(), elapsed);
        }
        var payload = new HashMap<String, Object>();
        payload.put("status", status.name());
        payload.put("completed", result.metrics().completedTasks());
        payload.put("failed", result.metrics().failedTasks());
        payload.put("skipped", result.metrics().skippedTasks());
        payload.put("cancelled", result.metrics().cancelledTasks());
        publish(sessionId, Topics.DISPATCH_FINISHED, payload);
        log.info("Dispatch {} {} in {} ms ({} completed, {} failed, {} skipped, {} cancelled)",
                sessionId, status, elapsed, result.metrics().completedTasks(), result.metrics().failedTasks(),
                result.metrics().skippedTasks(), result.metrics().cancelledTasks());
        return result;
    }

    private ExecutionResult aggregate(StateManager state, ExecutionStatus status, Map<String, Long> busy) {
        var outcomes = new ArrayList<TaskOutcome>();
        var errors = new ArrayList<String>();
        ExecutionGraph graph = state.graph();
        List<TaskArtifact> artifacts = state.allArtifacts();
        var producedBy = new HashMap<String, List<String>>();
        for (TaskArtifact artifact : artifacts) {
            if (!artifact.partial()) {
                producedBy.computeIfAbsent(artifact.producedBy(), k -> new ArrayList<>()).add(artifact.name());
            }
        }
        for (String id : graph.topologicalOrder()) {
            Task task = graph.task(id);
            TaskState taskState = state.state(id);
            outcomes.add(new TaskOutcome(id, task.type(), taskState.status(),
                    List.copyOf(producedBy.getOrDefault(id, List.of())),
                    taskState.retryCount(), taskState.reason()));
            if (taskState.status() == TaskStatus.FAILED) {
                errors.add(id + (task.optional() ? " (best-effort)" : "") + ": " + taskState.reason());
            }
        }
        return new ExecutionResult(state.sessionId(), status, outcomes, artifacts,
                state.metrics(busy), graph.export(), errors);
    }

    private void publish(String sessionId, String type, Map<String, Object> fields) {
        if (bus == null) {
            return;
        }
        var payload = new HashMap<String, Object>(fields);
        payload.put("type", type);
        payload.put("sessionId", sessionId);
        MessagePriority priority = Topics.DISPATCH_FINISHED.equals(type) ? MessagePriority.HIGH : MessagePriority.NORMAL;
        bus.publish(Topics.dispatch(sessionId), payload, priority, null);
    }
}
