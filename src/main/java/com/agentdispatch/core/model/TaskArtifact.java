package com.agentdispatch.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * Named output produced by a task.
 *
 * @param partial true for placeholders published on behalf of a failed best-effort task
 */
public record TaskArtifact(
    String name,
    String producedBy,
    String content,
    boolean partial,
    Instant createdAt
) implements Serializable {

    public static TaskArtifact of(String name, String producedBy, String content) {
        return new TaskArtifact(name, producedBy, content, false, Instant.now());
    }

    public static TaskArtifact placeholder(String name, String producedBy, String reason) {
        return new TaskArtifact(name, producedBy, "[placeholder] " + reason, true, Instant.now());
    }
}
