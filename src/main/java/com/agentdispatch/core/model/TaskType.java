package com.agentdispatch.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of capability tags. A task declares exactly one; an agent declares the set it can handle.
 */
public enum TaskType {
    CODE_WRITING,
    RESEARCH,
    TESTING,
    REVIEW,
    DOCUMENTATION,
    GENERIC;

    /**
     * Lenient lookup used when parsing model output: accepts {@code code_writing},
     * {@code code-writing} or {@code CODE WRITING}.
     */
    public static Optional<TaskType> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (TaskType type : values()) {
            if (type.name().equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
