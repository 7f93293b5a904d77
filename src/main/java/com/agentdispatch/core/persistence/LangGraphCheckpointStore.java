package com.agentdispatch.core.persistence;

import com.agentdispatch.core.state.CheckpointCorruptException;
import com.agentdispatch.core.state.CheckpointStore;
import com.agentdispatch.core.state.DispatchCheckpoint;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.bsc.langgraph4j.RunnableConfig;
import org.bsc.langgraph4j.checkpoint.BaseCheckpointSaver;
import org.bsc.langgraph4j.checkpoint.Checkpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentSkipListSet;

/**
 * {@link CheckpointStore} on top of a LangGraph4j {@link BaseCheckpointSaver}: each
 * {@link DispatchCheckpoint} becomes one LangGraph4j checkpoint whose state map is the
 * checkpoint's JSON tree, threaded by session id.
 * <p>
 * Savers disagree on listing order (the in-memory saver lists newest first, the JDBC
 * saver oldest first), so ordering always comes from {@link DispatchCheckpoint#sequence()}.
 */
@Component
public class LangGraphCheckpointStore implements CheckpointStore {

    private static final Logger log = LoggerFactory.getLogger(LangGraphCheckpointStore.class);

    static final String NODE_ID = "dispatch";

    private static final Comparator<DispatchCheckpoint> BY_SEQUENCE =
            Comparator.comparingLong(DispatchCheckpoint::sequence);

    private final BaseCheckpointSaver saver;
    private final ObjectMapper mapper;
    private final Set<String> knownSessions = new ConcurrentSkipListSet<>();

    public LangGraphCheckpointStore(BaseCheckpointSaver saver) {
        this.saver = saver;
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    @Override
    public synchronized void save(DispatchCheckpoint checkpoint) {
        Map<String, Object> state = mapper.convertValue(checkpoint, new TypeReference<>() {});
        var builder = Checkpoint.builder()
                .id(checkpoint.checkpointId())
                .state(state)
                .nodeId(NODE_ID)
                .nextNodeId(checkpoint.reason() != null ? checkpoint.reason() : NODE_ID);
        try {
            saver.put(threadConfig(checkpoint.sessionId()), builder.build());
        } catch (CheckpointStorageException e) {
            throw e;
        } catch (Exception e) {
            throw new CheckpointStorageException("Failed to save checkpoint " + checkpoint.checkpointId(), e);
        }
        knownSessions.add(checkpoint.sessionId());
    }

    @Override
    public Optional<DispatchCheckpoint> latest(String sessionId) {
        List<DispatchCheckpoint> all = list(sessionId);
        return all.isEmpty() ? Optional.empty() : Optional.of(all.get(all.size() - 1));
    }

    @Override
    public Optional<DispatchCheckpoint> load(String sessionId, String checkpointId) {
        return list(sessionId).stream()
                .filter(cp -> cp.checkpointId().equals(checkpointId))
                .findFirst();
    }

    @Override
    public List<DispatchCheckpoint> list(String sessionId) {
        var checkpoints = new ArrayList<DispatchCheckpoint>();
        for (Checkpoint raw : saver.list(threadConfig(sessionId))) {
            checkpoints.add(decode(sessionId, raw));
        }
        checkpoints.sort(BY_SEQUENCE);
        return checkpoints;
    }

    @Override
    public List<String> sessions() {
        var sessions = new TreeSet<>(knownSessions);
        if (saver instanceof JdbcCheckpointSaver jdbc) {
            sessions.addAll(jdbc.sessionIds());
        }
        return List.copyOf(sessions);
    }

    @Override
    public synchronized int prune(String sessionId, int retain) {
        if (saver instanceof JdbcCheckpointSaver jdbc) {
            return jdbc.pruneToNewest(sessionId, retain);
        }
        List<Checkpoint> raw = new ArrayList<>(saver.list(threadConfig(sessionId)));
        if (raw.size() <= retain) {
            return 0;
        }
        raw.sort(Comparator.comparingLong(cp -> sequenceOf(sessionId, cp)));
        List<Checkpoint> stale = raw.subList(0, raw.size() - retain);
        List<Checkpoint> kept = raw.subList(raw.size() - retain, raw.size());
        try {
            // generic savers only release whole threads
            saver.release(threadConfig(sessionId));
            for (Checkpoint checkpoint : kept) {
                saver.put(threadConfig(sessionId), checkpoint);
            }
        } catch (Exception e) {
            throw new CheckpointStorageException("Failed to prune checkpoints of session " + sessionId, e);
        }
        log.debug("Pruned {} checkpoints of session {}", stale.size(), sessionId);
        return stale.size();
    }

    private DispatchCheckpoint decode(String sessionId, Checkpoint raw) {
        try {
            DispatchCheckpoint checkpoint = mapper.convertValue(raw.getState(), DispatchCheckpoint.class);
            if (checkpoint == null || checkpoint.checkpointId() == null) {
                throw new CheckpointCorruptException("Checkpoint " + raw.getId() + " of session "
                        + sessionId + " has no content");
            }
            return checkpoint;
        } catch (IllegalArgumentException e) {
            throw new CheckpointCorruptException("Checkpoint " + raw.getId() + " of session "
                    + sessionId + " cannot be read: " + e.getMessage(), e);
        }
    }

    private long sequenceOf(String sessionId, Checkpoint raw) {
        Object sequence = raw.getState().get("sequence");
        if (sequence instanceof Number number) {
            return number.longValue();
        }
        return decode(sessionId, raw).sequence();
    }

    private static RunnableConfig threadConfig(String sessionId) {
        return RunnableConfig.builder().threadId(sessionId).build();
    }
}
