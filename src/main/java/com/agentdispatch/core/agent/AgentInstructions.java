package com.agentdispatch.core.agent;

import com.agentdispatch.core.model.Task;
import com.agentdispatch.core.model.TaskArtifact;

import java.util.Map;

/**
 * Converts a task and its inputs into a model-readable instruction string.
 * Pure function, no Spring dependencies.
 */
public final class AgentInstructions {

    /** Input artifacts longer than this are truncated in the prompt. */
    static final int MAX_INPUT_CHARS = 4_000;

    static final String SYSTEM_PROMPT = """
            You are a specialized worker inside a task dispatch engine.
            Complete exactly the task you are given. Produce one artifact per requested output name,
            using the output name verbatim. Keep artifacts self-contained.
            """;

    private AgentInstructions() {}

    public static String build(Task task, Map<String, TaskArtifact> inputs) {
        var sb = new StringBuilder();
        sb.append("# Task: ").append(task.id()).append(" (").append(task.type()).append(")\n\n");

        sb.append("## Objective\n\n");
        sb.append(task.description()).append("\n\n");

        if (!task.context().isEmpty()) {
            sb.append("## Context\n\n");
            task.context().entrySet().stream()
                    .sorted(Map.Entry.comparingByKey())
                    .forEach(e -> sb.append("- **").append(e.getKey()).append(":** ")
                            .append(e.getValue()).append("\n"));
            sb.append("\n");
        }

        if (!inputs.isEmpty()) {
            sb.append("## Inputs\n\n");
            inputs.values().stream()
                    .sorted((a, b) -> a.name().compareTo(b.name()))
                    .forEach(artifact -> {
                        sb.append("### ").append(artifact.name());
                        if (artifact.partial()) {
                            sb.append(" (partial)");
                        }
                        sb.append("\n\n```\n").append(truncate(artifact.content())).append("\n```\n\n");
                    });
        }

        sb.append("## Outputs\n\n");
        if (task.outputArtifacts().isEmpty()) {
            sb.append("No named outputs are required; summarize what you did.\n");
        } else {
            task.outputArtifacts().forEach(name -> sb.append("- ").append(name).append("\n"));
        }
        return sb.toString();
    }

    static String truncate(String content) {
        if (content == null || content.length() <= MAX_INPUT_CHARS) {
            return content;
        }
        return content.substring(0, MAX_INPUT_CHARS)
                + "\n... [truncated " + (content.length() - MAX_INPUT_CHARS) + " chars]";
    }
}
