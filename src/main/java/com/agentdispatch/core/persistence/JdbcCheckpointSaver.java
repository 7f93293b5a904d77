package com.agentdispatch.core.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.bsc.langgraph4j.RunnableConfig;
import org.bsc.langgraph4j.checkpoint.BaseCheckpointSaver;
import org.bsc.langgraph4j.checkpoint.Checkpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Stores dispatch checkpoints in PostgreSQL, one row per checkpoint of a session.
 * <p>
 * Besides the JSON image, every row carries the checkpoint's {@code sequence} and
 * {@code reason} as columns, so ordering, "latest" lookups and retention pruning happen in
 * SQL without decoding the state. The LangGraph4j thread id is the session id.
 */
public class JdbcCheckpointSaver implements BaseCheckpointSaver {

    private static final Logger log = LoggerFactory.getLogger(JdbcCheckpointSaver.class);

    static final String TABLE = "dispatch_checkpoints";

    static final String CREATE_TABLE_SQL = "CREATE TABLE IF NOT EXISTS " + TABLE + " ("
            + " session_id VARCHAR(64) NOT NULL,"
            + " checkpoint_id VARCHAR(128) NOT NULL,"
            + " sequence BIGINT NOT NULL,"
            + " reason VARCHAR(64),"
            + " state TEXT NOT NULL,"
            + " created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP,"
            + " PRIMARY KEY (session_id, checkpoint_id))";

    static final String CREATE_INDEX_SQL = "CREATE INDEX IF NOT EXISTS " + TABLE + "_seq_idx ON "
            + TABLE + " (session_id, sequence)";

    static final String UPSERT_SQL = "INSERT INTO " + TABLE
            + " (session_id, checkpoint_id, sequence, reason, state) VALUES (?, ?, ?, ?, ?)"
            + " ON CONFLICT (session_id, checkpoint_id)"
            + " DO UPDATE SET sequence = EXCLUDED.sequence, reason = EXCLUDED.reason, state = EXCLUDED.state";

    static final String SELECT_SESSION_SQL = "SELECT checkpoint_id, reason, state FROM " + TABLE
            + " WHERE session_id = ? ORDER BY sequence";

    static final String SELECT_ONE_SQL = "SELECT checkpoint_id, reason, state FROM " + TABLE
            + " WHERE session_id = ? AND checkpoint_id = ?";

    static final String SELECT_LATEST_SQL = "SELECT checkpoint_id, reason, state FROM " + TABLE
            + " WHERE session_id = ? ORDER BY sequence DESC LIMIT 1";

    static final String DELETE_SESSION_SQL = "DELETE FROM " + TABLE + " WHERE session_id = ?";

    /** Deletes everything older than the newest {@code retain} rows of a session. */
    static final String PRUNE_SQL = "DELETE FROM " + TABLE + " WHERE session_id = ? AND sequence < ("
            + "SELECT MIN(sequence) FROM (SELECT sequence FROM " + TABLE
            + " WHERE session_id = ? ORDER BY sequence DESC LIMIT ?) newest)";

    static final String SELECT_SESSIONS_SQL = "SELECT session_id FROM " + TABLE
            + " GROUP BY session_id ORDER BY MAX(created_at) DESC, session_id";

    private final JdbcTemplate jdbc;
    private final ObjectMapper mapper = new ObjectMapper();

    public JdbcCheckpointSaver(DataSource dataSource) {
        this(new JdbcTemplate(dataSource));
    }

    JdbcCheckpointSaver(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    /** Creates the table and its sequence index when missing. */
    public void createSchema() {
        try {
            jdbc.execute(CREATE_TABLE_SQL);
            jdbc.execute(CREATE_INDEX_SQL);
        } catch (DataAccessException e) {
            throw new CheckpointStorageException("Failed to create table " + TABLE, e);
        }
        log.info("Checkpoint table '{}' ready", TABLE);
    }

    @Override
    public Collection<Checkpoint> list(RunnableConfig config) {
        String sessionId = sessionOf(config);
        try {
            return jdbc.query(SELECT_SESSION_SQL, (rs, row) -> toCheckpoint(rs), sessionId);
        } catch (DataAccessException e) {
            throw new CheckpointStorageException("Failed to list checkpoints of session " + sessionId, e);
        }
    }

    @Override
    public Optional<Checkpoint> get(RunnableConfig config) {
        String sessionId = sessionOf(config);
        Optional<String> checkpointId = config.checkPointId();
        try {
            List<Checkpoint> rows = checkpointId.isPresent()
                    ? jdbc.query(SELECT_ONE_SQL, (rs, row) -> toCheckpoint(rs), sessionId, checkpointId.get())
                    : jdbc.query(SELECT_LATEST_SQL, (rs, row) -> toCheckpoint(rs), sessionId);
            return rows.stream().findFirst();
        } catch (DataAccessException e) {
            throw new CheckpointStorageException("Failed to read checkpoint "
                    + checkpointId.orElse("latest") + " of session " + sessionId, e);
        }
    }

    @Override
    public RunnableConfig put(RunnableConfig config, Checkpoint checkpoint) {
        String sessionId = sessionOf(config);
        Map<String, Object> state = checkpoint.getState();
        long sequence = state.get("sequence") instanceof Number n ? n.longValue() : 0L;
        Object reason = state.get("reason");
        try {
            jdbc.update(UPSERT_SQL, sessionId, checkpoint.getId(), sequence,
                    reason == null ? null : reason.toString(), mapper.writeValueAsString(state));
        } catch (JsonProcessingException e) {
            throw new CheckpointStorageException("Checkpoint " + checkpoint.getId() + " is not serializable", e);
        } catch (DataAccessException e) {
            throw new CheckpointStorageException("Failed to save checkpoint " + checkpoint.getId(), e);
        }
        log.debug("Saved checkpoint {} (#{}, {}) of session {}", checkpoint.getId(), sequence, reason, sessionId);
        return RunnableConfig.builder(config).checkPointId(checkpoint.getId()).build();
    }

    @Override
    public Tag release(RunnableConfig config) {
        String sessionId = sessionOf(config);
        Collection<Checkpoint> released = list(config);
        try {
            jdbc.update(DELETE_SESSION_SQL, sessionId);
        } catch (DataAccessException e) {
            throw new CheckpointStorageException("Failed to release session " + sessionId, e);
        }
        return new Tag(sessionId, released);
    }

    /**
     * Keeps the newest {@code retain} checkpoints of a session.
     *
     * @return rows deleted
     */
    public int pruneToNewest(String sessionId, int retain) {
        try {
            int deleted = jdbc.update(PRUNE_SQL, sessionId, sessionId, retain);
            if (deleted > 0) {
                log.debug("Pruned {} checkpoints of session {}", deleted, sessionId);
            }
            return deleted;
        } catch (DataAccessException e) {
            throw new CheckpointStorageException("Failed to prune checkpoints of session " + sessionId, e);
        }
    }

    /** Every session with at least one checkpoint, most recently written first. */
    public List<String> sessionIds() {
        try {
            return jdbc.queryForList(SELECT_SESSIONS_SQL, String.class);
        } catch (DataAccessException e) {
            throw new CheckpointStorageException("Failed to list sessions", e);
        }
    }

    Checkpoint toCheckpoint(ResultSet rs) throws SQLException {
        Map<String, Object> state;
        try {
            state = mapper.readValue(rs.getString("state"), new TypeReference<>() {});
        } catch (JsonProcessingException e) {
            // decoded as empty; the store reports the checkpoint as corrupt
            log.warn("Unreadable checkpoint row {}: {}", rs.getString("checkpoint_id"), e.getOriginalMessage());
            state = Map.of();
        }
        String reason = rs.getString("reason");
        return Checkpoint.builder()
                .id(rs.getString("checkpoint_id"))
                .state(state)
                .nodeId(LangGraphCheckpointStore.NODE_ID)
                .nextNodeId(reason != null ? reason : LangGraphCheckpointStore.NODE_ID)
                .build();
    }

    private static String sessionOf(RunnableConfig config) {
        return config.threadId().orElse(THREAD_ID_DEFAULT);
    }
}
