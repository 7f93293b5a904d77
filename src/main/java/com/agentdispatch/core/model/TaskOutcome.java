package com.agentdispatch.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Final per-task entry of an {@link ExecutionResult}.
 *
 * @param outputArtifacts names of the artifacts the task actually produced; placeholders are not listed
 * @param statusReason why the task ended where it did (failure message, skip cause); nullable
 */
public record TaskOutcome(
    String id,
    TaskType type,
    TaskStatus status,
    List<String> outputArtifacts,
    int retryCount,
    String statusReason
) implements Serializable {}
