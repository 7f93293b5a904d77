package com.agentdispatch.core.persistence;

import com.agentdispatch.core.graph.ExecutionGraph;
import com.agentdispatch.core.model.DependencyEdge;
import com.agentdispatch.core.model.DependencyKind;
import com.agentdispatch.core.model.Task;
import com.agentdispatch.core.model.TaskArtifact;
import com.agentdispatch.core.model.TaskStatus;
import com.agentdispatch.core.model.TaskType;
import com.agentdispatch.core.state.DispatchCheckpoint;
import com.agentdispatch.core.state.StateManager;
import org.bsc.langgraph4j.checkpoint.MemorySaver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Uses {@link MemorySaver} to exercise the store without a database.
 */
class LangGraphCheckpointStoreTest {

    private LangGraphCheckpointStore store;

    @BeforeEach
    void setUp() {
        store = new LangGraphCheckpointStore(new MemorySaver());
    }

    private static StateManager session(String sessionId, LangGraphCheckpointStore store, int retention) {
        var graph = ExecutionGraph.build(
                List.of(new Task("TASK-001", TaskType.CODE_WRITING, "Implement login", List.of(),
                                List.of("impl/login"), 3.0, 5).withTimeout(Duration.ofSeconds(90)),
                        new Task("TASK-002", TaskType.TESTING, "Test login", List.of("impl/login"),
                                List.of("tests/login"), 2.0, 4).asOptional(true)),
                List.of(DependencyEdge.rule("TASK-001", "TASK-002", DependencyKind.DATA, 1.0, "consumes impl/login")));
        graph.freeze();
        return new StateManager(sessionId, graph, null, store, retention, null, Clock.systemUTC());
    }

    @Test
    @DisplayName("saved checkpoint reads back with tasks, states and artifacts intact")
    void saveAndLoad() {
        var state = session("DSP-2026-0001", store, 10);
        state.transition("TASK-001", TaskStatus.READY, null);
        state.publishArtifacts(List.of(TaskArtifact.of("impl/login", "TASK-001", "code")));
        DispatchCheckpoint saved = state.checkpoint("test");

        Optional<DispatchCheckpoint> loaded = store.load("DSP-2026-0001", saved.checkpointId());

        assertTrue(loaded.isPresent());
        DispatchCheckpoint cp = loaded.get();
        assertEquals("DSP-2026-0001-cp-000001", cp.checkpointId());
        assertEquals(1, cp.sequence());
        assertEquals("test", cp.reason());
        assertEquals(TaskStatus.READY, cp.taskStates().get("TASK-001").status());
        assertEquals(TaskStatus.PENDING, cp.taskStates().get("TASK-002").status());
        assertEquals(Duration.ofSeconds(90), cp.graph().tasks().get(0).timeout());
        assertTrue(cp.graph().tasks().get(1).optional());
        assertEquals("code", cp.artifacts().get(0).content());
        assertEquals(saved.taskStates(), cp.taskStates());
    }

    @Test
    @DisplayName("list is ordered by sequence and latest is the newest")
    void listOrderAndLatest() {
        var state = session("DSP-2026-0002", store, 10);
        state.checkpoint("first");
        state.checkpoint("second");
        state.checkpoint("third");

        List<DispatchCheckpoint> all = store.list("DSP-2026-0002");

        assertEquals(List.of(1L, 2L, 3L), all.stream().map(DispatchCheckpoint::sequence).toList());
        assertEquals("third", store.latest("DSP-2026-0002").orElseThrow().reason());
    }

    @Test
    @DisplayName("retention keeps only the newest checkpoints")
    void retentionPrunesOldest() {
        var state = session("DSP-2026-0003", store, 3);
        for (int i = 0; i < 5; i++) {
            state.checkpoint("tick-" + i);
        }

        List<DispatchCheckpoint> all = store.list("DSP-2026-0003");

        assertEquals(List.of(3L, 4L, 5L), all.stream().map(DispatchCheckpoint::sequence).toList());
        assertEquals(0, store.prune("DSP-2026-0003", 3));
        assertEquals(2, store.prune("DSP-2026-0003", 1));
        assertEquals(List.of(5L), store.list("DSP-2026-0003").stream().map(DispatchCheckpoint::sequence).toList());
    }

    @Test
    @DisplayName("sessions are listed once, sorted")
    void sessionsAreListed() {
        session("DSP-2026-0005", store, 10).checkpoint("a");
        session("DSP-2026-0004", store, 10).checkpoint("a");

        assertEquals(List.of("DSP-2026-0004", "DSP-2026-0005"), store.sessions());
    }

    @Test
    @DisplayName("unknown session yields nothing")
    void unknownSession() {
        assertTrue(store.list("nope").isEmpty());
        assertTrue(store.latest("nope").isEmpty());
        assertTrue(store.load("nope", "nope-cp-000001").isEmpty());
    }

    @Test
    @DisplayName("query service summarizes the latest checkpoint of each session")
    void querySummaries() {
        var state = session("DSP-2026-0006", store, 10);
        state.checkpoint("start");
        state.transition("TASK-001", TaskStatus.READY, null);
        state.transition("TASK-001", TaskStatus.CANCELLED, "cancelled");
        state.transition("TASK-002", TaskStatus.SKIPPED, "Skipped: upstream task TASK-001 was cancelled");
        state.checkpoint("final");
        var queries = new CheckpointQueryService(store);

        List<SessionSummary> sessions = queries.listSessions();

        assertEquals(1, sessions.size());
        SessionSummary summary = sessions.get(0);
        assertEquals(2, summary.checkpoints());
        assertEquals("final", summary.lastReason());
        assertEquals(2, summary.totalTasks());
        assertEquals(1, summary.count(TaskStatus.CANCELLED));
        assertEquals(1, summary.count(TaskStatus.SKIPPED));
        assertEquals(0, summary.count(TaskStatus.COMPLETED));
    }
}
