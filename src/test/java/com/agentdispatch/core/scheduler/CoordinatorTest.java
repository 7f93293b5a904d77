package com.agentdispatch.core.scheduler;

import com.agentdispatch.core.agent.AgentFactory;
import com.agentdispatch.core.agent.AgentPool;
import com.agentdispatch.core.agent.ScriptedAgent;
import com.agentdispatch.core.config.DispatcherProperties;
import com.agentdispatch.core.events.Message;
import com.agentdispatch.core.events.MessageBus;
import com.agentdispatch.core.events.Topics;
import com.agentdispatch.core.graph.ExecutionGraph;
import com.agentdispatch.core.metrics.DispatchMetrics;
import com.agentdispatch.core.model.DependencyEdge;
import com.agentdispatch.core.model.DependencyKind;
import com.agentdispatch.core.model.ExecutionStatus;
import com.agentdispatch.core.model.Task;
import com.agentdispatch.core.model.TaskArtifact;
import com.agentdispatch.core.model.TaskStatus;
import com.agentdispatch.core.model.TaskType;
import com.agentdispatch.core.state.StateManager;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.function.BooleanSupplier;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class CoordinatorTest {

    private DispatcherProperties properties;
    private ScriptedAgent.Script script;
    private ExecutorService workers;
    private AgentPool pool;
    private SimpleMeterRegistry registry;
    private MessageBus bus;
    private List<Message> events;

    @BeforeEach
    void setUp() {
        properties = new DispatcherProperties();
        properties.setMaxConcurrentAgents(4);
        properties.setMaxRetries(3);
        properties.setTickInterval(Duration.ofMillis(5));
        properties.setRetryBackoffBase(Duration.ofMillis(10));
        properties.setRetryBackoffMax(Duration.ofMillis(40));
        properties.setTaskTimeoutDefault(Duration.ofSeconds(10));
        properties.setCancelGracePeriod(Duration.ofSeconds(5));
        properties.setAgentAcquireTimeout(Duration.ofSeconds(5));
        properties.setCheckpointIntervalSeconds(0);
        script = new ScriptedAgent.Script();
        workers = Executors.newCachedThreadPool();
        registry = new SimpleMeterRegistry();
        events = new CopyOnWriteArrayList<>();
        bus = new MessageBus(1000, 100, 1, Runnable::run);
        bus.subscribe("dispatch.*", events::add);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        workers.shutdownNow();
        workers.awaitTermination(5, TimeUnit.SECONDS);
        if (pool != null) {
            pool.close();
        }
        bus.close();
    }

    private static Task task(String id, List<String> inputs, List<String> outputs) {
        return new Task(id, TaskType.CODE_WRITING, "Task " + id, inputs, outputs, 1.0, 5);
    }

    private static DependencyEdge edge(String from, String to) {
        return DependencyEdge.rule(from, to, DependencyKind.DATA, 1.0, "test");
    }

    /** A -> B -> C, each consuming its predecessor's output. */
    private static List<Task> chain() {
        return List.of(
                task("A", List.of(), List.of("out/A")),
                task("B", List.of("out/A"), List.of("out/B")),
                task("C", List.of("out/B"), List.of("out/C")));
    }

    private StateManager state(List<Task> tasks, List<DependencyEdge> edges) {
        var graph = ExecutionGraph.build(tasks, edges);
        graph.freeze();
        return new StateManager("DSP-TEST", graph, bus, null, 10, new DispatchMetrics(registry), Clock.systemUTC());
    }

    private static void awaitCondition(BooleanSupplier condition) throws InterruptedException {
        long end = System.currentTimeMillis() + 5_000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > end) {
                fail("condition not reached within 5s");
            }
            Thread.sleep(5);
        }
    }

    private Coordinator coordinator(StateManager state, ScriptedAgent.Provider... providers) {
        List<ScriptedAgent.Provider> list = providers.length == 0
                ? List.of(new ScriptedAgent.Provider(script))
                : List.of(providers);
        pool = new AgentPool(new AgentFactory(list), 2, state::agentChanged);
        return new Coordinator(state, pool, workers, properties, bus, new DispatchMetrics(registry), Clock.systemUTC());
    }

    @Test
    @DisplayName("a chain runs in order and hands artifacts downstream")
    void chainCompletes() {
        var state = state(chain(), List.of(edge("A", "B"), edge("B", "C")));

        ExecutionStatus status = coordinator(state).run();

        assertEquals(ExecutionStatus.COMPLETED, status);
        assertEquals(List.of("A", "B", "C"), script.started());
        assertTrue(state.allTerminal());
        assertTrue(state.taskStates().values().stream().allMatch(s -> s.status() == TaskStatus.COMPLETED));
        TaskArtifact input = script.lastContext("B").input("out/A").orElseThrow();
        assertEquals("A", input.producedBy());
        assertEquals(3, state.allArtifacts().size());
    }

    @Test
    @DisplayName("a permanently failing task skips its descendants with a reason naming it")
    void failureCascadesSkips() {
        script.on("A", ScriptedAgent.fail("compile error"));
        var state = state(chain(), List.of(edge("A", "B"), edge("B", "C")));

        ExecutionStatus status = coordinator(state).run();

        assertEquals(ExecutionStatus.FAILED, status);
        assertEquals(TaskStatus.FAILED, state.status("A"));
        assertEquals(3, state.state("A").retryCount());
        assertEquals(3, script.attempts("A"));
        assertEquals("compile error", state.state("A").reason());
        assertEquals(TaskStatus.SKIPPED, state.status("B"));
        assertEquals(TaskStatus.SKIPPED, state.status("C"));
        assertEquals("Skipped: upstream task A failed", state.state("B").reason());
        assertEquals("Skipped: upstream task A failed", state.state("C").reason());
        assertEquals(0, script.attempts("B"));
        assertEquals(2.0, registry.find("dispatch.task.retries").counter().count());
    }

    @Test
    @DisplayName("a transient failure is retried and the dispatch completes")
    void retryRecovers() {
        script.on("A", ScriptedAgent.report("flaky network"), ScriptedAgent.succeed());
        var state = state(chain(), List.of(edge("A", "B"), edge("B", "C")));

        ExecutionStatus status = coordinator(state).run();

        assertEquals(ExecutionStatus.COMPLETED, status);
        assertEquals(2, script.attempts("A"));
        assertEquals(1, state.state("A").retryCount());
        assertEquals(2, script.lastContext("A").attempt());
    }

    @Test
    @DisplayName("a crashing agent is evicted and the task retried on a fresh one")
    void crashingAgentIsEvicted() {
        script.on("A", ScriptedAgent.crash("NPE in agent"), ScriptedAgent.succeed());
        var state = state(List.of(task("A", List.of(), List.of("out/A"))), List.of());

        ExecutionStatus status = coordinator(state).run();

        assertEquals(ExecutionStatus.COMPLETED, status);
        assertEquals("scripted-2", state.state("A").assignedAgentId());
        assertTrue(pool.snapshot().stream().noneMatch(a -> a.id().equals("scripted-1")));
    }

    @Test
    @DisplayName("a best-effort failure publishes placeholders and dependents still run")
    void optionalFailurePublishesPlaceholders() {
        script.on("A", ScriptedAgent.fail("no data"));
        var tasks = List.of(
                task("A", List.of(), List.of("out/A")).asOptional(true),
                task("B", List.of("out/A"), List.of("out/B")));
        var state = state(tasks, List.of(edge("A", "B")));

        ExecutionStatus status = coordinator(state).run();

        assertEquals(ExecutionStatus.COMPLETED, status);
        assertEquals(TaskStatus.FAILED, state.status("A"));
        assertEquals(TaskStatus.COMPLETED, state.status("B"));
        TaskArtifact placeholder = script.lastContext("B").input("out/A").orElseThrow();
        assertTrue(placeholder.partial());
        assertTrue(placeholder.content().contains("no data"));
    }

    @Test
    @DisplayName("independent tasks run in parallel up to the concurrency cap")
    void concurrencyCapIsHonoured() {
        properties.setMaxConcurrentAgents(2);
        var tasks = new ArrayList<Task>();
        for (String id : List.of("A", "B", "C", "D", "E")) {
            tasks.add(task(id, List.of(), List.of("out/" + id)));
            script.on(id, ScriptedAgent.work(60));
        }
        var state = state(tasks, List.of());

        ExecutionStatus status = coordinator(state).run();

        assertEquals(ExecutionStatus.COMPLETED, status);
        assertEquals(2, script.maxConcurrent());
    }

    @Test
    @DisplayName("an attempt past its deadline times out and counts as a failure")
    void deadlineTimesOut() {
        properties.setMaxRetries(1);
        script.on("A", ScriptedAgent.work(5_000));
        var tasks = List.of(
                task("A", List.of(), List.of("out/A")).withTimeout(Duration.ofMillis(50)),
                task("B", List.of("out/A"), List.of("out/B")));
        var state = state(tasks, List.of(edge("A", "B")));

        ExecutionStatus status = coordinator(state).run();

        assertEquals(ExecutionStatus.FAILED, status);
        assertEquals(TaskStatus.FAILED, state.status("A"));
        assertTrue(state.state("A").reason().contains("exceeded its deadline"));
        assertEquals(TaskStatus.SKIPPED, state.status("B"));
        assertEquals(1.0, registry.find("dispatch.task.timeouts").counter().count());
    }

    @Test
    @DisplayName("a task no provider can serve fails without retries")
    void unservableTaskFailsImmediately() {
        var coder = new ScriptedAgent.Provider("coder", EnumSet.of(TaskType.CODE_WRITING), script);
        var tasks = List.of(
                new Task("R", TaskType.RESEARCH, "Research", List.of(), List.of("research/x"), 1.0, 5),
                task("A", List.of(), List.of("out/A")));
        var state = state(tasks, List.of());

        ExecutionStatus status = coordinator(state, coder).run();

        assertEquals(ExecutionStatus.FAILED, status);
        assertEquals(TaskStatus.FAILED, state.status("R"));
        assertEquals(1, state.state("R").retryCount());
        assertTrue(state.state("R").reason().contains("RESEARCH"));
        assertEquals(TaskStatus.COMPLETED, state.status("A"));
    }

    @Test
    @DisplayName("success without the declared outputs is a failure")
    void missingOutputsFail() {
        properties.setMaxRetries(1);
        script.on("A", ScriptedAgent.produceNothing());
        var state = state(List.of(task("A", List.of(), List.of("out/A"))), List.of());

        ExecutionStatus status = coordinator(state).run();

        assertEquals(ExecutionStatus.FAILED, status);
        assertTrue(state.state("A").reason().contains("out/A"));
    }

    @Test
    @DisplayName("cancelling one task cancels it and skips its dependents")
    void cancelSingleTask() {
        var state = state(chain(), List.of(edge("A", "B"), edge("B", "C")));
        var coordinator = coordinator(state);
        coordinator.cancel("A");

        ExecutionStatus status = coordinator.run();

        assertEquals(ExecutionStatus.COMPLETED, status);
        assertEquals(TaskStatus.CANCELLED, state.status("A"));
        assertEquals(TaskStatus.SKIPPED, state.status("B"));
        assertEquals("Skipped: upstream task A was cancelled", state.state("C").reason());
        assertTrue(script.started().isEmpty());
        assertThrows(IllegalArgumentException.class, () -> coordinator.cancel("nope"));
    }

    @Test
    @DisplayName("cancelAll stops running work and cancels everything unfinished")
    void cancelAllCancelsEverything() {
        properties.setCancelGracePeriod(Duration.ofMillis(50));
        script.on("A", ScriptedAgent.stubbornWork(10_000));
        var state = state(chain(), List.of(edge("A", "B"), edge("B", "C")));
        var coordinator = coordinator(state);
        CompletableFuture.runAsync(coordinator::cancelAll,
                CompletableFuture.delayedExecutor(100, TimeUnit.MILLISECONDS));

        ExecutionStatus status = coordinator.run();

        assertEquals(ExecutionStatus.CANCELLED, status);
        assertEquals(TaskStatus.CANCELLED, state.status("A"));
        assertEquals(TaskStatus.CANCELLED, state.status("B"));
        assertEquals(TaskStatus.CANCELLED, state.status("C"));
        assertTrue(state.isCancelRequested());
    }

    @Test
    @DisplayName("a cancelled task that finishes within the grace period counts as completed")
    void completionWithinGraceWins() {
        script.on("A", ScriptedAgent.stubbornWork(150));
        var state = state(List.of(task("A", List.of(), List.of("out/A"))), List.of());
        var coordinator = coordinator(state);
        CompletableFuture.runAsync(() -> coordinator.cancel("A"),
                CompletableFuture.delayedExecutor(30, TimeUnit.MILLISECONDS));

        ExecutionStatus status = coordinator.run();

        assertEquals(ExecutionStatus.COMPLETED, status);
        assertEquals(TaskStatus.COMPLETED, state.status("A"));
    }

    @Test
    @DisplayName("each phase is announced once, in order")
    void phasesAreAnnounced() {
        var tasks = List.of(
                task("A", List.of(), List.of("out/A")),
                task("B", List.of(), List.of("out/B")),
                task("C", List.of("out/A", "out/B"), List.of("out/C")));
        var state = state(tasks, List.of(edge("A", "C"), edge("B", "C")));

        coordinator(state).run();

        List<Object> phases = events.stream()
                .filter(m -> Topics.DISPATCH_PHASE.equals(m.type()))
                .map(m -> m.payload().get("phase"))
                .toList();
        assertEquals(List.of(0, 1), phases);
        assertEquals(2.0, registry.find("dispatch.graph.phase_width").summary().count(), 0.0);
    }

    @Test
    @DisplayName("re-queueing moves in-flight tasks back to PENDING")
    void requeueInFlight() {
        var state = state(chain(), List.of(edge("A", "B"), edge("B", "C")));
        state.transition("A", TaskStatus.READY, null);
        state.assign("A", "scripted-9");
        state.transition("A", TaskStatus.SCHEDULED, null);
        state.transition("A", TaskStatus.RUNNING, null);
        var coordinator = coordinator(state);

        assertEquals(List.of("A"), coordinator.requeueInFlight());
        assertEquals(TaskStatus.PENDING, state.status("A"));
        assertNull(state.state("A").assignedAgentId());
        assertEquals(ExecutionStatus.COMPLETED, coordinator.run());
    }

    @Test
    @DisplayName("a join task starts only after both of its branches have completed")
    void joinWaitsForBothBranches() {
        properties.setMaxConcurrentAgents(2);
        script.on("T1", ScriptedAgent.work(40));
        script.on("T2", ScriptedAgent.work(80));
        var tasks = List.of(
                task("T1", List.of(), List.of("out/T1")),
                task("T2", List.of(), List.of("out/T2")),
                task("T3", List.of("out/T1", "out/T2"), List.of("out/T3")));
        var state = state(tasks, List.of(edge("T1", "T3"), edge("T2", "T3")));

        ExecutionStatus status = coordinator(state).run();

        assertEquals(ExecutionStatus.COMPLETED, status);
        List<String> timeline = script.timeline();
        int joinStart = timeline.indexOf("start:T3");
        assertTrue(timeline.indexOf("end:T1") < joinStart, timeline.toString());
        assertTrue(timeline.indexOf("end:T2") < joinStart, timeline.toString());
        assertEquals(2, script.maxConcurrent());
        assertEquals("T1", script.lastContext("T3").input("out/T1").orElseThrow().producedBy());
        assertEquals("T2", script.lastContext("T3").input("out/T2").orElseThrow().producedBy());
    }

    @Test
    @DisplayName("no capable agent within the acquire timeout counts as an attempt and is retried")
    void acquireTimeoutIsRetried() {
        properties.setAgentAcquireTimeout(Duration.ofMillis(40));
        var coder = new ScriptedAgent.Provider("coder", EnumSet.of(TaskType.CODE_WRITING), script);
        var tasks = new ArrayList<Task>();
        for (String id : List.of("A", "B", "C")) {
            tasks.add(task(id, List.of(), List.of("out/" + id)));
            script.on(id, ScriptedAgent.work(1_000));
        }
        var state = state(tasks, List.of());

        ExecutionStatus status = coordinator(state, coder).run();

        assertEquals(ExecutionStatus.FAILED, status);
        var starved = state.taskStates().values().stream()
                .filter(s -> s.status() == TaskStatus.FAILED)
                .toList();
        assertEquals(1, starved.size());
        assertEquals(3, starved.get(0).retryCount());
        assertTrue(starved.get(0).reason().contains("No CODE_WRITING agent available"), starved.get(0).reason());
        assertEquals(0, script.attempts(starved.get(0).taskId()));
        assertEquals(2, state.taskStates().values().stream().filter(s -> s.status() == TaskStatus.COMPLETED).count());
        assertEquals(2.0, registry.find("dispatch.task.retries").counter().count());
    }

    @Test
    @DisplayName("an agent that ignores interruption does not stall the tasks behind it")
    void stuckAgentDoesNotStarveOthers() {
        properties.setMaxConcurrentAgents(1);
        properties.setMaxRetries(1);
        var release = new CountDownLatch(1);
        script.on("A", ScriptedAgent.hang(release));
        var tasks = List.of(
                new Task("A", TaskType.CODE_WRITING, "Task A", List.of(), List.of("out/A"), 1.0, 9)
                        .withTimeout(Duration.ofMillis(100)),
                task("B", List.of(), List.of("out/B")).withTimeout(Duration.ofMillis(500)));
        var state = state(tasks, List.of());

        try {
            ExecutionStatus status = coordinator(state).run();

            assertEquals(ExecutionStatus.FAILED, status);
            assertEquals(TaskStatus.FAILED, state.status("A"));
            assertTrue(state.state("A").reason().contains("exceeded its deadline"));
            assertEquals(TaskStatus.COMPLETED, state.status("B"), state.state("B").reason());
            assertEquals(List.of("A", "B"), script.started());
        } finally {
            release.countDown();
        }
    }

    @Test
    @DisplayName("pausing holds back new assignments while running work finishes")
    void pauseHoldsNewAssignments() throws InterruptedException {
        script.on("A", ScriptedAgent.work(100));
        var state = state(chain(), List.of(edge("A", "B"), edge("B", "C")));
        var coordinator = coordinator(state);
        var run = CompletableFuture.supplyAsync(coordinator::run);

        awaitCondition(() -> script.started().contains("A"));
        coordinator.pause();
        assertTrue(coordinator.isPaused());
        awaitCondition(() -> state.status("A") == TaskStatus.COMPLETED);
        Thread.sleep(100);

        assertEquals(List.of("A"), script.started());
        assertTrue(EnumSet.of(TaskStatus.PENDING, TaskStatus.READY).contains(state.status("B")));
        assertFalse(run.isDone());

        coordinator.unpause();

        assertEquals(ExecutionStatus.COMPLETED, run.join());
        assertEquals(List.of("A", "B", "C"), script.started());
        List<String> types = events.stream().map(Message::type).toList();
        assertTrue(types.indexOf(Topics.DISPATCH_PAUSED) < types.indexOf(Topics.DISPATCH_RESUMED));
    }
}
