package com.agentdispatch.core.decomposer;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

/**
 * Structured output expected from the language model when decomposing a specification.
 *
 * @param rationale short explanation of the decomposition strategy
 * @param tasks     ordered list of planned tasks
 */
public record DecompositionPlan(
    String rationale,
    List<TaskPlan> tasks
) implements Serializable {

    /**
     * A single planned task.
     *
     * @param type            one of CODE_WRITING, RESEARCH, TESTING, REVIEW, DOCUMENTATION, GENERIC
     * @param description     what the task should accomplish
     * @param complexity      1 (simple) to 5 (very complex)
     * @param priority        0 to 10, higher first
     * @param inputArtifacts  artifact names the task consumes
     * @param outputArtifacts artifact names the task produces
     * @param context         extra key-value notes for the worker
     * @param optional        true when the task is nice-to-have
     */
    public record TaskPlan(
        String type,
        String description,
        Double complexity,
        Integer priority,
        List<String> inputArtifacts,
        List<String> outputArtifacts,
        Map<String, String> context,
        Boolean optional
    ) implements Serializable {}
}
