package com.agentdispatch.core.resolver;

import com.agentdispatch.core.llm.LanguageModelClient;
import com.agentdispatch.core.model.DependencyEdge;
import com.agentdispatch.core.model.Task;

import java.util.List;

/**
 * Asks the language model to review rule-derived dependencies and propose additions or
 * removals with a confidence.
 */
public class ModelDependencyRefiner implements DependencyRefiner {

    private static final String SYSTEM_PROMPT = """
            You analyze software development tasks and the dependencies already derived between
            them by deterministic rules.

            GUIDELINES:
            1. Propose ADD for a dependency that is missing: the source task must complete before
               the target task can start.
            2. Propose REMOVE for an existing dependency you believe is wrong.
            3. Use kind DATA when the target consumes the source's output, LOGICAL for workflow
               order, RESOURCE when both tasks contend for the same resource.
            4. Avoid unnecessary dependencies: every edge reduces parallelism.
            5. Give each proposal a confidence between 0.0 and 1.0. Only use task ids listed below.

            Respond with valid JSON matching the schema provided.
            """;

    private final LanguageModelClient client;

    public ModelDependencyRefiner(LanguageModelClient client) {
        this.client = client;
    }

    @Override
    public DependencyProposals propose(List<Task> tasks, List<DependencyEdge> ruleEdges) {
        return client.structuredCall(SYSTEM_PROMPT, buildUserPrompt(tasks, ruleEdges), DependencyProposals.class);
    }

    static String buildUserPrompt(List<Task> tasks, List<DependencyEdge> ruleEdges) {
        var sb = new StringBuilder("TASKS:\n");
        for (Task task : tasks) {
            sb.append("- ").append(task.id()).append(" [").append(task.type()).append("] ")
                    .append(task.description());
            if (!task.inputArtifacts().isEmpty()) {
                sb.append(" | inputs: ").append(String.join(", ", task.inputArtifacts()));
            }
            if (!task.outputArtifacts().isEmpty()) {
                sb.append(" | outputs: ").append(String.join(", ", task.outputArtifacts()));
            }
            sb.append("\n");
        }
        sb.append("\nEXISTING DEPENDENCIES:\n");
        if (ruleEdges.isEmpty()) {
            sb.append("(none)\n");
        }
        for (DependencyEdge edge : ruleEdges) {
            sb.append("- ").append(edge.from()).append(" -> ").append(edge.to())
                    .append(" (").append(edge.kind()).append("): ").append(edge.reason()).append("\n");
        }
        return sb.toString();
    }
}
