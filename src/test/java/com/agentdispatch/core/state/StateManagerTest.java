package com.agentdispatch.core.state;

import com.agentdispatch.core.events.Message;
import com.agentdispatch.core.events.MessageBus;
import com.agentdispatch.core.events.Topics;
import com.agentdispatch.core.graph.ExecutionGraph;
import com.agentdispatch.core.model.AgentSnapshot;
import com.agentdispatch.core.model.AgentStatus;
import com.agentdispatch.core.model.DependencyEdge;
import com.agentdispatch.core.model.DependencyKind;
import com.agentdispatch.core.model.ExecutionMetrics;
import com.agentdispatch.core.model.Task;
import com.agentdispatch.core.model.TaskArtifact;
import com.agentdispatch.core.model.TaskStatus;
import com.agentdispatch.core.model.TaskType;
import com.agentdispatch.core.persistence.LangGraphCheckpointStore;
import com.agentdispatch.core.scheduler.ReadySetCalculator;
import org.bsc.langgraph4j.checkpoint.MemorySaver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class StateManagerTest {

    /** Clock the test advances by hand. */
    static final class ManualClock extends Clock {
        private Instant now = Instant.parse("2026-03-01T10:00:00Z");

        void advance(Duration d) {
            now = now.plus(d);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }

    private ManualClock clock;
    private LangGraphCheckpointStore store;
    private ExecutionGraph graph;

    @BeforeEach
    void setUp() {
        clock = new ManualClock();
        store = new LangGraphCheckpointStore(new MemorySaver());
        graph = ExecutionGraph.build(
                List.of(task("A", 8), task("B", 5), task("C", 5), task("D", 1)),
                List.of(edge("A", "D"), edge("B", "D"), edge("C", "D")));
        graph.freeze();
    }

    private static Task task(String id, int priority) {
        return new Task(id, TaskType.GENERIC, "Task " + id, List.of(), List.of("out/" + id), 1.0, priority);
    }

    private static DependencyEdge edge(String from, String to) {
        return DependencyEdge.rule(from, to, DependencyKind.DATA, 1.0, "test");
    }

    private StateManager newState(MessageBus bus) {
        return new StateManager("DSP-2026-0100", graph, bus, store, 10, null, clock);
    }

    @Test
    @DisplayName("every task starts PENDING")
    void initialState() {
        var state = newState(null);

        assertEquals(4, state.taskStates().size());
        assertTrue(state.taskStates().values().stream().allMatch(s -> s.status() == TaskStatus.PENDING));
        assertFalse(state.allTerminal());
        assertEquals(0.0, state.progress().completionPercentage(), 1e-9);
    }

    @Test
    @DisplayName("illegal transitions are rejected and leave the state unchanged")
    void illegalTransitionIsRejected() {
        var state = newState(null);

        assertThrows(IllegalStateException.class, () -> state.transition("A", TaskStatus.RUNNING, null));
        assertThrows(IllegalStateException.class, () -> state.transition("A", TaskStatus.COMPLETED, null));
        assertEquals(TaskStatus.PENDING, state.status("A"));

        state.transition("A", TaskStatus.SKIPPED, "skip");
        assertThrows(IllegalStateException.class, () -> state.transition("A", TaskStatus.PENDING, null));
        assertThrows(IllegalArgumentException.class, () -> state.status("missing"));
    }

    @Test
    @DisplayName("a run records start, finish and duration")
    void runRecordsDuration() {
        var state = newState(null);
        state.transition("A", TaskStatus.READY, null);
        state.assign("A", "generic-1");
        state.transition("A", TaskStatus.SCHEDULED, null);
        state.transition("A", TaskStatus.RUNNING, null);
        clock.advance(Duration.ofMillis(1500));
        TaskState done = state.transition("A", TaskStatus.COMPLETED, null);

        assertEquals(1500, done.lastDurationMs());
        assertEquals("generic-1", done.assignedAgentId());
        assertEquals(1, done.readySequence());
        assertEquals(TaskStatus.COMPLETED, state.task("A").status());
        assertEquals("generic-1", state.task("A").assignedAgentId());
    }

    @Test
    @DisplayName("returning to PENDING clears the agent and keeps the failure reason")
    void retryPathKeepsReason() {
        var state = newState(null);
        state.transition("A", TaskStatus.READY, null);
        state.assign("A", "generic-1");
        state.transition("A", TaskStatus.SCHEDULED, null);
        state.transition("A", TaskStatus.RUNNING, null);
        state.transition("A", TaskStatus.FAILED, "boom");
        assertEquals(1, state.incrementRetry("A"));
        state.transition("A", TaskStatus.PENDING, null);
        state.deferUntil("A", clock.instant().plusSeconds(2));

        TaskState pending = state.state("A");
        assertNull(pending.assignedAgentId());
        assertEquals("boom", pending.reason());
        assertEquals(1, pending.retryCount());
        assertTrue(ReadySetCalculator.promotable(graph, state.taskStates(), clock.instant()).stream()
                .noneMatch("A"::equals));
        clock.advance(Duration.ofSeconds(3));
        assertTrue(ReadySetCalculator.promotable(graph, state.taskStates(), clock.instant()).contains("A"));
    }

    @Test
    @DisplayName("restored session yields the ready set it was saved with")
    void checkpointRestoreReproducesReadySet() {
        var state = newState(null);
        state.transition("C", TaskStatus.READY, null);
        state.transition("A", TaskStatus.READY, null);
        state.transition("B", TaskStatus.READY, null);
        state.transition("A", TaskStatus.SCHEDULED, null);
        state.transition("A", TaskStatus.RUNNING, null);
        state.transition("A", TaskStatus.COMPLETED, null);
        state.publishArtifacts(List.of(TaskArtifact.of("out/A", "A", "done")));
        List<String> before = ReadySetCalculator.readySet(graph, state.taskStates(), clock.instant());
        DispatchCheckpoint saved = state.checkpoint("test");

        var restored = StateManager.restore(store, "DSP-2026-0100", null, 1.0, null, 10, null, clock);

        assertEquals(List.of("C", "B"), before);
        assertEquals(before, ReadySetCalculator.readySet(restored.graph(), restored.taskStates(), clock.instant()));
        assertEquals(state.taskStates(), restored.taskStates());
        assertEquals(1, restored.artifacts(List.of("out/A", "out/B")).size());
        assertEquals(saved.startedAt(), restored.startedAt());
        // sequences continue after a restore
        assertEquals(saved.sequence() + 1, restored.checkpoint("after-restore").sequence());
    }

    @Test
    @DisplayName("restore fails on missing or mismatched checkpoints")
    void restoreRejectsBadCheckpoints() {
        assertThrows(CheckpointCorruptException.class,
                () -> StateManager.restore(store, "unknown", null, 1.0, null, 10, null, clock));

        DispatchCheckpoint good = newState(null).checkpoint("start");
        var foreign = new DispatchCheckpoint(good.checkpointId(), "DSP-OTHER", good.sequence(), good.graph(),
                good.taskStates(), Map.of(), List.of(), List.of(), good.startedAt(), good.createdAt(), false, "x");
        CheckpointStore wrongSession = mock(CheckpointStore.class);
        when(wrongSession.latest("DSP-2026-0100")).thenReturn(java.util.Optional.of(foreign));
        assertThrows(CheckpointCorruptException.class,
                () -> StateManager.restore(wrongSession, "DSP-2026-0100", null, 1.0, null, 10, null, clock));

        var missingState = new DispatchCheckpoint(good.checkpointId(), "DSP-2026-0100", good.sequence(),
                good.graph(), Map.of("A", good.taskStates().get("A")), Map.of(), List.of(), List.of(),
                good.startedAt(), good.createdAt(), false, "x");
        CheckpointStore partial = mock(CheckpointStore.class);
        when(partial.latest("DSP-2026-0100")).thenReturn(java.util.Optional.of(missingState));
        assertThrows(CheckpointCorruptException.class,
                () -> StateManager.restore(partial, "DSP-2026-0100", null, 1.0, null, 10, null, clock));
    }

    @Test
    @DisplayName("a failing store does not break the session")
    void storeFailureIsTolerated() {
        CheckpointStore broken = mock(CheckpointStore.class);
        doThrow(new IllegalStateException("disk full")).when(broken).save(any());
        var state = new StateManager("DSP-2026-0101", graph, null, broken, 10, null, clock);

        DispatchCheckpoint cp = assertDoesNotThrow(() -> state.checkpoint("interval"));

        assertEquals("DSP-2026-0101-cp-000001", cp.checkpointId());
        verify(broken, never()).prune(anyString(), anyInt());
    }

    @Test
    @DisplayName("transitions, artifacts and agent changes are published")
    void eventsArePublished() {
        var received = new ArrayList<Message>();
        var bus = new MessageBus(100, 100, 1, Runnable::run);
        bus.subscribe("*", received::add);
        var state = newState(bus);

        state.transition("A", TaskStatus.READY, null);
        state.publishArtifacts(List.of(TaskArtifact.of("out/A", "A", "x")));
        state.agentChanged(new AgentSnapshot("generic-1", "generic", Set.of(TaskType.GENERIC), AgentStatus.BUSY, "A"));
        state.checkpoint("manual");

        assertEquals(List.of(Topics.TASK_STATUS, Topics.TASK_ARTIFACT, Topics.AGENT_STATUS, Topics.CHECKPOINT_SAVED),
                received.stream().map(Message::type).toList());
        assertEquals("READY", received.get(0).payload().get("to"));
        assertEquals(1, state.agents().size());

        state.agentChanged(new AgentSnapshot("generic-1", "generic", Set.of(TaskType.GENERIC), AgentStatus.FAILED, null));
        assertTrue(state.agents().isEmpty());
    }

    @Test
    @DisplayName("metrics aggregate counts, durations and utilization")
    void metricsAggregate() {
        var state = newState(null);
        state.transition("A", TaskStatus.READY, null);
        state.transition("A", TaskStatus.SCHEDULED, null);
        state.transition("A", TaskStatus.RUNNING, null);
        clock.advance(Duration.ofSeconds(2));
        state.transition("A", TaskStatus.COMPLETED, null);
        state.recordQueueDepth(3);
        state.transition("B", TaskStatus.CANCELLED, "cancelled");
        state.transition("C", TaskStatus.SKIPPED, "skip");
        state.transition("D", TaskStatus.SKIPPED, "skip");

        ExecutionMetrics metrics = state.metrics(Map.of("generic-1", 1000L));

        assertEquals(4, metrics.totalTasks());
        assertEquals(1, metrics.completedTasks());
        assertEquals(1, metrics.cancelledTasks());
        assertEquals(2, metrics.skippedTasks());
        assertEquals(2000L, metrics.taskDurationsMs().get("A"));
        assertEquals(2000L, metrics.endToEndLatencyMs());
        assertEquals(0.5, metrics.agentUtilization().get("generic-1"), 1e-9);
        assertEquals(1, metrics.queueDepth().size());
        assertEquals(3, metrics.queueDepth().get(0).depth());
        assertEquals(25.0, metrics.completionPercentage(), 1e-9);
        assertTrue(state.allTerminal());
    }
}
