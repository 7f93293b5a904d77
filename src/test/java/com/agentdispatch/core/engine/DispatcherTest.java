package com.agentdispatch.core.engine;

import com.agentdispatch.core.agent.AgentFactory;
import com.agentdispatch.core.agent.GenericAgent;
import com.agentdispatch.core.agent.ScriptedAgent;
import com.agentdispatch.core.config.DispatcherProperties;
import com.agentdispatch.core.decomposer.DecompositionException;
import com.agentdispatch.core.decomposer.RuleBasedDecomposer;
import com.agentdispatch.core.decomposer.TaskDecomposer;
import com.agentdispatch.core.events.Message;
import com.agentdispatch.core.events.MessageBus;
import com.agentdispatch.core.events.Topics;
import com.agentdispatch.core.graph.ExecutionGraph;
import com.agentdispatch.core.metrics.DispatchMetrics;
import com.agentdispatch.core.model.DependencyEdge;
import com.agentdispatch.core.model.DependencyKind;
import com.agentdispatch.core.model.ExecutionResult;
import com.agentdispatch.core.model.ExecutionStatus;
import com.agentdispatch.core.model.Specification;
import com.agentdispatch.core.model.Task;
import com.agentdispatch.core.model.TaskArtifact;
import com.agentdispatch.core.model.TaskStatus;
import com.agentdispatch.core.model.TaskType;
import com.agentdispatch.core.persistence.LangGraphCheckpointStore;
import com.agentdispatch.core.resolver.DependencyResolver;
import com.agentdispatch.core.state.CheckpointCorruptException;
import com.agentdispatch.core.state.DispatchCheckpoint;
import com.agentdispatch.core.state.StateManager;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.bsc.langgraph4j.checkpoint.MemorySaver;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class DispatcherTest {

    private final Clock clock = Clock.systemUTC();

    private LangGraphCheckpointStore store;
    private MessageBus bus;
    private SimpleMeterRegistry registry;
    private List<Message> events;
    private Dispatcher dispatcher;

    @BeforeEach
    void setUp() {
        var properties = new DispatcherProperties();
        properties.setTickInterval(Duration.ofMillis(5));
        properties.setCheckpointIntervalSeconds(0);
        store = new LangGraphCheckpointStore(new MemorySaver());
        bus = new MessageBus(1000, 100, 1, Runnable::run);
        events = new CopyOnWriteArrayList<>();
        bus.subscribe("dispatch.*", events::add);
        registry = new SimpleMeterRegistry();
        dispatcher = new Dispatcher(
                new TaskDecomposer(new RuleBasedDecomposer()),
                new DependencyResolver(DependencyResolver.defaultRules()),
                new AgentFactory(List.of(new GenericAgent.Provider())),
                bus, store, properties, new DispatchMetrics(registry), clock);
    }

    @AfterEach
    void tearDown() {
        bus.close();
    }

    @Test
    @DisplayName("a specification runs from decomposition to a completed result")
    void dispatchEndToEnd() {
        var spec = new Specification(List.of("Implement user login with JWT"), List.of());

        ExecutionResult result = dispatcher.dispatch("DSP-2026-0042", spec);

        assertEquals(ExecutionStatus.COMPLETED, result.status());
        assertEquals(List.of("TASK-001", "TASK-002", "TASK-003"),
                result.tasks().stream().map(t -> t.id()).toList());
        assertTrue(result.tasks().stream().allMatch(t -> t.status() == TaskStatus.COMPLETED));
        assertEquals(TaskType.CODE_WRITING, result.task("TASK-001").type());
        assertEquals(3, result.metrics().completedTasks());
        assertTrue(result.errors().isEmpty());
        assertFalse(result.artifacts().isEmpty());
        assertTrue(result.artifacts().stream().allMatch(a -> a.content().contains("# TASK-")));
        assertTrue(dispatcher.activeSessions().isEmpty());
    }

    @Test
    @DisplayName("start and finish are announced and counted")
    void lifecycleEventsAndMetrics() {
        dispatcher.dispatch("DSP-2026-0043", new Specification(List.of("Implement user login with JWT"), List.of()));

        List<String> types = events.stream().map(Message::type).toList();
        assertEquals(Topics.DISPATCH_STARTED, types.get(0));
        assertEquals(Topics.DISPATCH_FINISHED, types.get(types.size() - 1));
        assertTrue(types.contains(Topics.DISPATCH_PHASE));
        assertEquals(1.0, registry.find("dispatch.sessions.total").tag("status", "COMPLETED").counter().count());
        assertEquals("final", store.latest("DSP-2026-0043").orElseThrow().reason());
    }

    @Test
    @DisplayName("an empty specification is rejected before anything runs")
    void emptySpecificationIsRejected() {
        var empty = new Specification(List.of(" "), List.of());

        assertThrows(DecompositionException.class, () -> dispatcher.dispatch("DSP-2026-0044", empty));
        assertTrue(store.list("DSP-2026-0044").isEmpty());
        assertEquals(1.0, registry.find("dispatch.sessions.total").tag("status", "FAILED").counter().count());
    }

    @Test
    @DisplayName("resume re-runs in-flight work and keeps finished tasks")
    void resumeFromCheckpoint() {
        var graph = ExecutionGraph.build(
                List.of(new Task("A", TaskType.RESEARCH, "Research auth", List.of(), List.of("research/auth"), 1.0, 5),
                        new Task("B", TaskType.CODE_WRITING, "Write auth", List.of("research/auth"),
                                List.of("impl/auth"), 1.0, 5)),
                List.of(DependencyEdge.rule("A", "B", DependencyKind.DATA, 1.0, "consumes research/auth")));
        graph.freeze();
        var interrupted = new StateManager("DSP-2026-0050", graph, null, store, 10, null, clock);
        interrupted.transition("A", TaskStatus.READY, null);
        interrupted.transition("A", TaskStatus.SCHEDULED, null);
        interrupted.transition("A", TaskStatus.RUNNING, null);
        interrupted.transition("A", TaskStatus.COMPLETED, null);
        interrupted.publishArtifacts(List.of(TaskArtifact.of("research/auth", "A", "notes")));
        interrupted.transition("B", TaskStatus.READY, null);
        interrupted.assign("B", "generic-7");
        interrupted.transition("B", TaskStatus.SCHEDULED, null);
        interrupted.transition("B", TaskStatus.RUNNING, null);
        DispatchCheckpoint saved = interrupted.checkpoint("crash");

        ExecutionResult result = dispatcher.resume("DSP-2026-0050");

        assertEquals(ExecutionStatus.COMPLETED, result.status());
        assertEquals(TaskStatus.COMPLETED, result.task("B").status());
        assertEquals("notes", result.artifacts().stream()
                .filter(a -> a.name().equals("research/auth")).findFirst().orElseThrow().content());
        assertTrue(store.latest("DSP-2026-0050").orElseThrow().sequence() > saved.sequence());
    }

    @Test
    @DisplayName("resuming an unknown session fails")
    void resumeUnknownSession() {
        assertThrows(CheckpointCorruptException.class, () -> dispatcher.resume("DSP-2026-9999"));
    }

    @Test
    @DisplayName("cancel and pause of a session that is not running report false")
    void controlOfUnknownSession() {
        assertFalse(dispatcher.cancel("DSP-2026-0001"));
        assertFalse(dispatcher.cancelTask("DSP-2026-0001", "TASK-001"));
        assertFalse(dispatcher.pause("DSP-2026-0001"));
        assertFalse(dispatcher.unpause("DSP-2026-0001"));
        assertFalse(dispatcher.isPaused("DSP-2026-0001"));
    }

    @Test
    @DisplayName("outcomes list only the artifacts a task really produced")
    void outcomesReportProducedArtifacts() {
        var properties = new DispatcherProperties();
        properties.setTickInterval(Duration.ofMillis(5));
        properties.setCheckpointIntervalSeconds(0);
        properties.setMaxRetries(1);
        var script = new ScriptedAgent.Script().on("TASK-001", ScriptedAgent.fail("does not compile"));
        var scripted = new Dispatcher(
                new TaskDecomposer(new RuleBasedDecomposer()),
                new DependencyResolver(DependencyResolver.defaultRules()),
                new AgentFactory(List.of(new ScriptedAgent.Provider(script))),
                bus, store, properties, new DispatchMetrics(registry), clock);

        ExecutionResult result = scripted.dispatch("DSP-2026-0060",
                new Specification(List.of("Implement user login with JWT"), List.of()));

        assertEquals(ExecutionStatus.FAILED, result.status());
        assertEquals(TaskStatus.FAILED, result.task("TASK-001").status());
        assertTrue(result.task("TASK-001").outputArtifacts().isEmpty());
        assertEquals(TaskStatus.SKIPPED, result.task("TASK-002").status());
        assertTrue(result.task("TASK-002").outputArtifacts().isEmpty());
        assertTrue(result.artifacts().isEmpty());
    }

    @Test
    @DisplayName("a completed task reports the names it published")
    void completedOutcomeListsArtifacts() {
        ExecutionResult result = dispatcher.dispatch("DSP-2026-0061",
                new Specification(List.of("Implement user login with JWT"), List.of()));

        assertEquals(List.of("impl/login-jwt"), result.task("TASK-001").outputArtifacts());
    }

    @Test
    @DisplayName("generated session ids carry the year and skip known sessions")
    void sessionIds() {
        String first = dispatcher.generateSessionId();
        String second = dispatcher.generateSessionId();

        assertTrue(first.matches("DSP-\\d{4}-\\d{4}"), first);
        assertNotEquals(first, second);
        dispatcher.dispatch(second, new Specification(List.of("Write docs for the API"), List.of()));
        assertNotEquals(second, dispatcher.generateSessionId());
    }
}
