package com.agentdispatch.core.persistence;

import com.agentdispatch.core.graph.ExecutionGraph;
import com.agentdispatch.core.model.Task;
import com.agentdispatch.core.model.TaskStatus;
import com.agentdispatch.core.model.TaskType;
import com.agentdispatch.core.state.DispatchCheckpoint;
import com.agentdispatch.core.state.StateManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Clock;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the checkpoint store on a real PostgreSQL. Skipped when Docker is not available.
 */
@Testcontainers(disabledWithoutDocker = true)
class JdbcCheckpointSaverPostgresTest {

    @Container
    static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16-alpine")
            .withDatabaseName("dispatch")
            .withUsername("dispatch")
            .withPassword("dispatch");

    private LangGraphCheckpointStore store;

    @BeforeEach
    void setUp() {
        var dataSource = new DriverManagerDataSource(POSTGRES.getJdbcUrl(), POSTGRES.getUsername(),
                POSTGRES.getPassword());
        var saver = new JdbcCheckpointSaver(dataSource);
        saver.createSchema();
        new JdbcTemplate(dataSource).update("DELETE FROM " + JdbcCheckpointSaver.TABLE);
        store = new LangGraphCheckpointStore(saver);
    }

    private StateManager session(String sessionId, int retention) {
        var graph = ExecutionGraph.build(
                List.of(new Task("TASK-001", TaskType.CODE_WRITING, "Implement login", List.of(),
                        List.of("impl/login"), 2.0, 5)),
                List.of());
        graph.freeze();
        return new StateManager(sessionId, graph, null, store, retention, null, Clock.systemUTC());
    }

    @Test
    @DisplayName("checkpoints survive a round trip through PostgreSQL in sequence order")
    void roundTrip() {
        var state = session("DSP-2026-0101", 10);
        state.checkpoint("start");
        state.transition("TASK-001", TaskStatus.READY, null);
        DispatchCheckpoint second = state.checkpoint("interval");

        List<DispatchCheckpoint> all = store.list("DSP-2026-0101");

        assertEquals(List.of("start", "interval"), all.stream().map(DispatchCheckpoint::reason).toList());
        assertEquals(second.checkpointId(), store.latest("DSP-2026-0101").orElseThrow().checkpointId());
        assertEquals(TaskStatus.READY, store.latest("DSP-2026-0101").orElseThrow()
                .taskStates().get("TASK-001").status());
        assertTrue(store.sessions().contains("DSP-2026-0101"));
    }

    @Test
    @DisplayName("retention prunes the oldest rows in the database")
    void retentionPrunes() {
        var state = session("DSP-2026-0102", 2);
        for (int i = 0; i < 5; i++) {
            state.checkpoint("interval");
        }

        List<DispatchCheckpoint> kept = store.list("DSP-2026-0102");

        assertEquals(List.of(4L, 5L), kept.stream().map(DispatchCheckpoint::sequence).toList());
    }
}
