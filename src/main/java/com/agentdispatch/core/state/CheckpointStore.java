package com.agentdispatch.core.state;

import java.util.List;
import java.util.Optional;

/**
 * Durable storage for {@link DispatchCheckpoint}s, keyed by session.
 * The storage technology is not part of the engine's contract.
 */
public interface CheckpointStore {

    void save(DispatchCheckpoint checkpoint);

    /**
     * @throws CheckpointCorruptException if stored data cannot be read back
     */
    Optional<DispatchCheckpoint> latest(String sessionId);

    /**
     * @throws CheckpointCorruptException if stored data cannot be read back
     */
    Optional<DispatchCheckpoint> load(String sessionId, String checkpointId);

    /** All checkpoints of a session, oldest first. */
    List<DispatchCheckpoint> list(String sessionId);

    List<String> sessions();

    /**
     * Keeps only the newest {@code retain} checkpoints of the session.
     *
     * @return number of checkpoints removed
     */
    int prune(String sessionId, int retain);
}
