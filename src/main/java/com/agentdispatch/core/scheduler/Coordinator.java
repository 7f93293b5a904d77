package com.agentdispatch.core.scheduler;

import com.agentdispatch.core.agent.Agent;
import com.agentdispatch.core.agent.AgentContext;
import com.agentdispatch.core.agent.AgentPool;
import com.agentdispatch.core.agent.ResourceExhaustedException;
import com.agentdispatch.core.agent.TaskExecutionException;
import com.agentdispatch.core.config.DispatcherProperties;
import com.agentdispatch.core.events.MessageBus;
import com.agentdispatch.core.events.Topics;
import com.agentdispatch.core.graph.ExecutionGraph;
import com.agentdispatch.core.logging.MdcContext;
import com.agentdispatch.core.metrics.DispatchMetrics;
import com.agentdispatch.core.model.AgentResult;
import com.agentdispatch.core.model.ExecutionStatus;
import com.agentdispatch.core.model.Task;
import com.agentdispatch.core.model.TaskArtifact;
import com.agentdispatch.core.model.TaskStatus;
import com.agentdispatch.core.state.StateManager;
import com.agentdispatch.core.state.TaskState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Scheduling loop of one dispatch.
 * <p>
 * {@link #run()} executes on the caller's thread and is the only writer of task transitions.
 * Each tick it applies pending cancellations, collects worker completions, enforces deadlines,
 * promotes tasks whose dependencies are satisfied and hands the best-ranked ready tasks to
 * capable agents, up to {@code maxConcurrentAgents}. Agents run on the worker executor and
 * report back through a completion queue; they never touch the state directly. A task's
 * deadline counts from the moment its worker starts, not from submission.
 * <p>
 * While paused no new task is assigned; in-flight attempts still finish, time out or are
 * cancelled as usual.
 * <p>
 * {@link #cancel(String)}, {@link #cancelAll()}, {@link #pause()} and {@link #unpause()} may be
 * called from any thread.
 */
public class Coordinator {

    private static final Logger log = LoggerFactory.getLogger(Coordinator.class);

    private final StateManager state;
    private final ExecutionGraph graph;
    private final AgentPool pool;
    private final ExecutorService workers;
    private final MessageBus bus;
    private final DispatchMetrics metrics;
    private final Clock clock;
    private final RetryPolicy retryPolicy;
    private final int maxConcurrent;
    private final Duration tickInterval;
    private final Duration defaultTimeout;
    private final Duration cancelGrace;
    private final Duration acquireTimeout;
    private final Duration checkpointInterval;

    private final BlockingQueue<Completion> completions = new LinkedBlockingQueue<>();
    private final Queue<String> cancelInbox = new ConcurrentLinkedQueue<>();
    private volatile boolean cancelAllRequested;
    private volatile boolean pauseRequested;

    // coordinator thread only
    private final Map<String, Attempt> running = new LinkedHashMap<>();
    private final Map<String, Instant> waitingForAgent = new HashMap<>();
    private final Map<String, Integer> phaseOf = new HashMap<>();
    private boolean cancelAllApplied;
    private boolean pauseApplied;
    private long attemptSequence;
    private int announcedPhase = -1;
    private Instant lastCheckpoint;

    private static final class Attempt {
        final String taskId;
        final Agent agent;
        final long token;
        final Duration timeout;
        // set by the worker thread when execution actually begins
        volatile Instant startedAt;
        Future<?> future;
        boolean cancelRequested;
        Instant cancelDeadline;

        Attempt(String taskId, Agent agent, long token, Duration timeout) {
            this.taskId = taskId;
            this.agent = agent;
            this.token = token;
            this.timeout = timeout;
        }

        boolean overdue(Instant now) {
            Instant started = startedAt;
            return started != null && now.isAfter(started.plus(timeout));
        }
    }

    /**
     * What a worker reports when an attempt ends.
     *
     * @param healthy false when the agent itself misbehaved and should not be reused
     */
    record Completion(String taskId, long token, AgentResult result, String error, boolean healthy) {

        static Completion finished(String taskId, long token, AgentResult result) {
            return new Completion(taskId, token, result, null, true);
        }

        static Completion failed(String taskId, long token, String error, boolean healthy) {
            return new Completion(taskId, token, null, error, healthy);
        }
    }

    /**
     * @param bus     nullable; phase announcements are skipped without one
     * @param metrics nullable
     */
    public Coordinator(StateManager state, AgentPool pool, ExecutorService workers,
                       DispatcherProperties properties, MessageBus bus, DispatchMetrics metrics, Clock clock) {
        this.state = state;
        this.graph = state.graph();
        this.pool = pool;
        this.workers = workers;
        this.bus = bus;
        this.metrics = metrics;
        this.clock = clock;
        this.retryPolicy = new RetryPolicy(properties.getMaxRetries(),
                properties.getRetryBackoffBase(), properties.getRetryBackoffMax());
        this.maxConcurrent = properties.getMaxConcurrentAgents();
        this.tickInterval = properties.getTickInterval();
        this.defaultTimeout = properties.getTaskTimeoutDefault();
        this.cancelGrace = properties.getCancelGracePeriod();
        this.acquireTimeout = properties.getAgentAcquireTimeout();
        this.checkpointInterval = Duration.ofSeconds(properties.getCheckpointIntervalSeconds());

        List<List<String>> phases = graph.computePhases();
        for (int i = 0; i < phases.size(); i++) {
            for (String id : phases.get(i)) {
                phaseOf.put(id, i);
            }
        }
    }

    // ── Public API ───────────────────────────────────────────────────────

    /**
     * Requests cancellation of one task. Queued tasks are cancelled on the next tick; running
     * ones get a stop request and the grace period before they are interrupted.
     */
    public void cancel(String taskId) {
        if (!graph.contains(taskId)) {
            throw new IllegalArgumentException("Unknown task: " + taskId);
        }
        cancelInbox.add(taskId);
    }

    /** Cancels every task that has not finished yet. */
    public void cancelAll() {
        cancelAllRequested = true;
    }

    /** Stops assigning new tasks from the next tick on. Running attempts are left alone. */
    public void pause() {
        pauseRequested = true;
    }

    /** Lets scheduling continue after {@link #pause()}. */
    public void unpause() {
        pauseRequested = false;
    }

    public boolean isPaused() {
        return pauseRequested;
    }

    /**
     * Moves tasks that were SCHEDULED or RUNNING when a checkpoint was taken back to PENDING.
     * Their agents no longer exist, so the work has to be done again.
     *
     * @return ids of the re-queued tasks
     */
    public List<String> requeueInFlight() {
        var requeued = new ArrayList<String>();
        for (TaskState taskState : state.taskStates().values()) {
            if (taskState.status().isInFlight()) {
                state.transition(taskState.taskId(), TaskStatus.PENDING, "re-queued after restore");
                requeued.add(taskState.taskId());
            }
        }
        if (!requeued.isEmpty()) {
            log.info("Re-queued {} in-flight tasks after restore: {}", requeued.size(), requeued);
        }
        return requeued;
    }

    /**
     * Drives the dispatch until every task is terminal.
     *
     * @return overall status
     */
    public ExecutionStatus run() {
        MdcContext.setSession(state.sessionId());
        lastCheckpoint = clock.instant();
        if (state.isCancelRequested()) {
            cancelAllRequested = true;
        }
        log.info("Coordinating {} tasks in {} phases (max {} concurrent agents)",
                graph.size(), graph.computePhases().size(), maxConcurrent);
        try {
            while (true) {
                applyCancellations();
                applyPause();
                Completion done;
                while ((done = completions.poll()) != null) {
                    handle(done);
                }
                enforceDeadlines();
                if (running.isEmpty() && state.allTerminal()) {
                    break;
                }
                if (!pauseApplied) {
                    schedule();
                    if (running.isEmpty()) {
                        skipUnreachable();
                    }
                }
                maybeCheckpoint();
                if (running.isEmpty() && state.allTerminal()) {
                    break;
                }
                done = completions.poll(tickInterval.toMillis(), TimeUnit.MILLISECONDS);
                if (done != null) {
                    handle(done);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Coordinator interrupted; cancelling remaining work");
            abortAll("coordinator interrupted");
        } finally {
            MdcContext.clear();
        }
        state.checkpoint("final");
        ExecutionStatus status = overallStatus();
        log.info("Dispatch {} finished with status {}", state.sessionId(), status);
        return status;
    }

    /**
     * CANCELLED if the dispatch was cancelled, FAILED if a required task failed, otherwise COMPLETED.
     */
    public ExecutionStatus overallStatus() {
        if (state.isCancelRequested()) {
            return ExecutionStatus.CANCELLED;
        }
        boolean requiredFailed = state.taskStates().values().stream()
                .anyMatch(s -> s.status() == TaskStatus.FAILED && !graph.task(s.taskId()).optional());
        return requiredFailed ? ExecutionStatus.FAILED : ExecutionStatus.COMPLETED;
    }

    // ── Scheduling ───────────────────────────────────────────────────────

    private void schedule() {
        Instant now = clock.instant();
        for (String id : ReadySetCalculator.promotable(graph, state.taskStates(), now)) {
            state.transition(id, TaskStatus.READY, null);
        }

        Map<String, TaskState> states = state.taskStates();
        List<String> ready = states.values().stream()
                .filter(s -> s.status() == TaskStatus.READY)
                .map(TaskState::taskId)
                .collect(Collectors.toList());
        List<String> ranked = ReadySetCalculator.rank(graph, states, ready);

        int waiting = 0;
        for (String id : ranked) {
            if (running.size() >= maxConcurrent) {
                waiting++;
                continue;
            }
            Task task = state.task(id);
            if (!pool.canServe(task.type())) {
                failUnservable(task);
                continue;
            }
            Optional<Agent> agent = pool.acquire(task);
            if (agent.isPresent()) {
                waitingForAgent.remove(id);
                launch(task, agent.get(), now);
                continue;
            }
            Instant since = waitingForAgent.computeIfAbsent(id, k -> now);
            if (Duration.between(since, now).compareTo(acquireTimeout) >= 0) {
                waitingForAgent.remove(id);
                var exhausted = new ResourceExhaustedException("No " + task.type() + " agent available for "
                        + id + " within " + acquireTimeout);
                log.warn(exhausted.getMessage());
                failAttempt(id, exhausted.getMessage());
            } else {
                waiting++;
            }
        }
        state.recordQueueDepth(waiting);
        if (log.isDebugEnabled() && !ranked.isEmpty()) {
            log.debug("Tick: ready={} running={} waiting={}", ranked, running.keySet(), waiting);
        }
    }

    private void launch(Task task, Agent agent, Instant now) {
        String id = task.id();
        state.assign(id, agent.id());
        state.transition(id, TaskStatus.SCHEDULED, null);

        int attemptNumber = state.state(id).retryCount() + 1;
        var context = new AgentContext(state.sessionId(), attemptNumber, state.artifacts(task.inputArtifacts()));
        Duration timeout = deadlineFor(task);
        var attempt = new Attempt(id, agent, ++attemptSequence, timeout);
        try {
            attempt.future = workers.submit(() -> work(task, agent, context, attempt));
        } catch (RejectedExecutionException e) {
            log.error("Worker pool rejected task {}", id, e);
            pool.release(agent.id());
            failAttempt(id, "worker pool rejected the task: " + e.getMessage());
            return;
        }
        running.put(id, attempt);
        state.transition(id, TaskStatus.RUNNING, null);
        announcePhase(id);
        log.info("Started {} [{}] on {} (attempt {}, deadline {})",
                id, task.type(), agent.id(), attemptNumber, timeout);
    }

    private Duration deadlineFor(Task task) {
        if (task.timeout() != null) {
            return task.timeout();
        }
        return Duration.ofMillis(Math.round(defaultTimeout.toMillis() * task.complexity()));
    }

    private void work(Task task, Agent agent, AgentContext context, Attempt attempt) {
        attempt.startedAt = clock.instant();
        long token = attempt.token;
        MdcContext.setTask(context.sessionId(), task.id(), agent.id());
        try {
            AgentResult result = agent.execute(task, context);
            completions.add(Completion.finished(task.id(), token, result));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            completions.add(Completion.failed(task.id(), token, "interrupted: " + e.getMessage(), false));
        } catch (TaskExecutionException e) {
            completions.add(Completion.failed(task.id(), token, e.getMessage(), true));
        } catch (RuntimeException e) {
            log.error("Agent {} threw while executing {}", agent.id(), task.id(), e);
            completions.add(Completion.failed(task.id(), token,
                    e.getClass().getSimpleName() + ": " + e.getMessage(), false));
        } finally {
            MdcContext.clearTask();
        }
    }

    private void announcePhase(String taskId) {
        int phase = phaseOf.getOrDefault(taskId, 0);
        if (phase <= announcedPhase) {
            return;
        }
        announcedPhase = phase;
        List<String> members = graph.computePhases().get(phase);
        MdcContext.setPhase(state.sessionId(), String.valueOf(phase));
        if (metrics != null) {
            metrics.recordPhaseWidth(members.size());
        }
        if (bus != null) {
            bus.publish(Topics.dispatch(state.sessionId()), Map.of(
                    "type", Topics.DISPATCH_PHASE,
                    "sessionId", state.sessionId(),
                    "phase", phase,
                    "tasks", members));
        }
        log.info("Entering phase {} ({} tasks)", phase, members.size());
    }

    // ── Completions ──────────────────────────────────────────────────────

    private void handle(Completion completion) {
        Attempt attempt = running.get(completion.taskId());
        if (attempt == null || attempt.token != completion.token()) {
            log.debug("Ignoring stale completion for {}", completion.taskId());
            return;
        }
        running.remove(completion.taskId());
        String id = completion.taskId();
        Task task = graph.task(id);

        String error = completion.error();
        AgentResult result = completion.result();
        if (result != null && !result.success()) {
            error = result.errorMessage() != null ? result.errorMessage() : "agent reported failure";
        } else if (result != null) {
            Set<String> produced = result.artifacts().stream().map(TaskArtifact::name).collect(Collectors.toSet());
            List<String> missing = task.outputArtifacts().stream().filter(o -> !produced.contains(o)).toList();
            if (!missing.isEmpty()) {
                error = "agent " + attempt.agent.id() + " did not produce declared outputs " + missing;
            }
        }

        if (error == null) {
            state.publishArtifacts(result.artifacts());
            state.transition(id, TaskStatus.COMPLETED, null);
            pool.release(attempt.agent.id());
            log.info("Completed {} on {}", id, attempt.agent.id());
            checkpoint("task-completed");
            return;
        }

        if (completion.healthy()) {
            pool.release(attempt.agent.id());
        } else {
            pool.evict(attempt.agent.id(), error);
        }
        if (attempt.cancelRequested) {
            state.transition(id, TaskStatus.CANCELLED, "cancelled");
            skipDescendants(id, "Skipped: upstream task " + id + " was cancelled");
            checkpoint("task-cancelled");
            return;
        }
        failAttempt(id, error);
    }

    /**
     * Records a failed attempt of a READY or RUNNING task and either schedules a retry or
     * finalizes the failure.
     */
    private void failAttempt(String id, String reason) {
        state.transition(id, TaskStatus.FAILED, reason);
        int failures = state.incrementRetry(id);
        Task task = graph.task(id);
        if (retryPolicy.shouldRetry(failures)) {
            Duration delay = retryPolicy.backoff(failures);
            log.warn("Task {} failed (attempt {}/{}): {}; retrying in {}",
                    id, failures, retryPolicy.maxAttempts(), reason, delay);
            if (metrics != null) {
                metrics.recordRetry(task.type().name());
            }
            state.transition(id, TaskStatus.PENDING, reason);
            state.deferUntil(id, clock.instant().plus(delay));
            return;
        }
        finalizeFailure(task, reason);
    }

    private void failUnservable(Task task) {
        var exhausted = new ResourceExhaustedException("No agent provider declares capability " + task.type());
        log.error("Task {} cannot run: {}", task.id(), exhausted.getMessage());
        state.transition(task.id(), TaskStatus.FAILED, exhausted.getMessage());
        state.incrementRetry(task.id());
        finalizeFailure(task, exhausted.getMessage());
    }

    private void finalizeFailure(Task task, String reason) {
        String id = task.id();
        if (task.optional()) {
            log.warn("Best-effort task {} failed permanently: {}; dependents continue with placeholders", id, reason);
            var placeholders = task.outputArtifacts().stream()
                    .map(name -> TaskArtifact.placeholder(name, id, reason))
                    .toList();
            state.publishArtifacts(placeholders);
        } else {
            log.error("Task {} failed permanently: {}", id, reason);
            skipDescendants(id, "Skipped: upstream task " + id + " failed");
        }
        checkpoint("task-failed");
    }

    private void skipDescendants(String id, String reason) {
        int skipped = 0;
        for (String descendant : graph.propagateSkip(id, reason)) {
            TaskStatus status = state.status(descendant);
            if (status == TaskStatus.PENDING || status == TaskStatus.READY) {
                state.transition(descendant, TaskStatus.SKIPPED, reason);
                waitingForAgent.remove(descendant);
                skipped++;
            }
        }
        if (skipped > 0) {
            log.warn("Skipped {} tasks downstream of {}", skipped, id);
            if (metrics != null) {
                metrics.recordSkips(skipped);
            }
        }
    }

    /**
     * Nothing runs, nothing is ready and no retry is pending, yet tasks remain: their
     * predecessors can never complete.
     */
    private void skipUnreachable() {
        Map<String, TaskState> states = state.taskStates();
        boolean progressPossible = states.values().stream().anyMatch(s ->
                s.status() == TaskStatus.READY
                        || (s.status() == TaskStatus.PENDING && s.notBefore() != null));
        if (progressPossible || !ReadySetCalculator.promotable(graph, states, clock.instant()).isEmpty()) {
            return;
        }
        for (TaskState s : states.values()) {
            if (s.status() == TaskStatus.PENDING) {
                state.transition(s.taskId(), TaskStatus.SKIPPED, "Skipped: predecessors can no longer complete");
            }
        }
    }

    // ── Deadlines and cancellation ───────────────────────────────────────

    private void enforceDeadlines() {
        Instant now = clock.instant();
        for (Attempt attempt : new ArrayList<>(running.values())) {
            if (attempt.cancelRequested) {
                if (!now.isBefore(attempt.cancelDeadline)) {
                    forceCancel(attempt, "cancelled after grace period");
                }
            } else if (attempt.overdue(now)) {
                timeOut(attempt);
            }
        }
    }

    private void timeOut(Attempt attempt) {
        var timeout = new TaskTimeoutException(attempt.taskId, attempt.timeout);
        log.warn(timeout.getMessage());
        stopAgent(attempt);
        pool.evict(attempt.agent.id(), "timed out on " + attempt.taskId);
        if (metrics != null) {
            metrics.recordTimeout(graph.task(attempt.taskId).type().name());
        }
        failAttempt(attempt.taskId, timeout.getMessage());
    }

    private void forceCancel(Attempt attempt, String reason) {
        log.warn("Interrupting {} on {}: {}", attempt.taskId, attempt.agent.id(), reason);
        stopAgent(attempt);
        pool.evict(attempt.agent.id(), reason);
        state.transition(attempt.taskId, TaskStatus.CANCELLED, reason);
        skipDescendants(attempt.taskId, "Skipped: upstream task " + attempt.taskId + " was cancelled");
        checkpoint("task-cancelled");
    }

    private void stopAgent(Attempt attempt) {
        running.remove(attempt.taskId);
        attempt.agent.requestStop();
        if (attempt.future != null) {
            attempt.future.cancel(true);
        }
    }

    private void applyCancellations() {
        if (cancelAllRequested && !cancelAllApplied) {
            cancelAllApplied = true;
            state.markCancelRequested();
            log.warn("Cancelling dispatch {}", state.sessionId());
            // leaves first, so every unfinished task ends CANCELLED rather than SKIPPED
            List<String> order = new ArrayList<>(graph.topologicalOrder());
            for (int i = order.size() - 1; i >= 0; i--) {
                cancelTask(order.get(i));
            }
        }
        String id;
        while ((id = cancelInbox.poll()) != null) {
            cancelTask(id);
        }
    }

    private void cancelTask(String id) {
        TaskStatus status = state.status(id);
        if (status == TaskStatus.PENDING || status == TaskStatus.READY) {
            state.transition(id, TaskStatus.CANCELLED, "cancelled");
            waitingForAgent.remove(id);
            skipDescendants(id, "Skipped: upstream task " + id + " was cancelled");
            return;
        }
        Attempt attempt = running.get(id);
        if (attempt == null || attempt.cancelRequested) {
            return;
        }
        attempt.cancelRequested = true;
        attempt.cancelDeadline = clock.instant().plus(cancelGrace);
        attempt.agent.requestStop();
        log.info("Stop requested for {} on {} (grace {})", id, attempt.agent.id(), cancelGrace);
        if (cancelGrace.isZero() || cancelGrace.isNegative()) {
            forceCancel(attempt, "cancelled");
        }
    }

    private void applyPause() {
        boolean requested = pauseRequested;
        if (requested == pauseApplied) {
            return;
        }
        pauseApplied = requested;
        log.info("Dispatch {} {} ({} task(s) still running)", state.sessionId(),
                requested ? "paused" : "unpaused", running.size());
        if (bus != null) {
            bus.publish(Topics.dispatch(state.sessionId()), Map.of(
                    "type", requested ? Topics.DISPATCH_PAUSED : Topics.DISPATCH_RESUMED,
                    "sessionId", state.sessionId(),
                    "running", List.copyOf(running.keySet())));
        }
        if (requested) {
            checkpoint("paused");
        }
    }

    private void abortAll(String reason) {
        state.markCancelRequested();
        for (Attempt attempt : new ArrayList<>(running.values())) {
            forceCancel(attempt, reason);
        }
        List<String> order = new ArrayList<>(graph.topologicalOrder());
        for (int i = order.size() - 1; i >= 0; i--) {
            TaskStatus status = state.status(order.get(i));
            if (status == TaskStatus.PENDING || status == TaskStatus.READY) {
                state.transition(order.get(i), TaskStatus.CANCELLED, reason);
            }
        }
    }

    // ── Checkpoints ──────────────────────────────────────────────────────

    private void maybeCheckpoint() {
        if (checkpointInterval.isZero()) {
            return;
        }
        if (Duration.between(lastCheckpoint, clock.instant()).compareTo(checkpointInterval) >= 0) {
            checkpoint("interval");
        }
    }

    private void checkpoint(String reason) {
        state.checkpoint(reason);
        lastCheckpoint = clock.instant();
    }
}
