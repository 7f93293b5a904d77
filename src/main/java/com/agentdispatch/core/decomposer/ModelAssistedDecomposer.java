package com.agentdispatch.core.decomposer;

import com.agentdispatch.core.llm.LanguageModelClient;
import com.agentdispatch.core.llm.LlmEmptyResponseException;
import com.agentdispatch.core.model.Specification;
import com.agentdispatch.core.model.Task;
import com.agentdispatch.core.model.TaskType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Asks the language model for a {@link DecompositionPlan} and converts it into raw tasks.
 * Entries with an unknown type come back with a null type and are dropped by validation.
 * Any failure propagates; {@link TaskDecomposer} owns the fallback.
 */
public class ModelAssistedDecomposer implements DecompositionStrategy {

    private static final Logger log = LoggerFactory.getLogger(ModelAssistedDecomposer.class);

    public static final String NAME = "model";

    private static final String SYSTEM_PROMPT = """
            You are a software architect decomposing a finalized specification into atomic,
            executable tasks for a pool of specialist workers.

            GUIDELINES:
            1. Each task must be completable by a single specialist and have one clear deliverable.
            2. Use only these task types: CODE_WRITING, RESEARCH, TESTING, REVIEW, DOCUMENTATION, GENERIC.
            3. Estimate complexity from 1 (simple) to 5 (very complex) and priority from 0 to 10.
            4. Name every deliverable in outputArtifacts (e.g. "impl/user-login", "tests/user-login").
               When a task needs another task's deliverable, list that exact name in inputArtifacts.
               Dependencies are derived from these names; do not list task ids.
            5. Two tasks must never produce the same artifact name unless they must run one after the other.
            6. Mark nice-to-have tasks as optional.

            AVOID vague tasks such as "Build the frontend" or "Make it work".

            Respond with valid JSON matching the schema provided.
            """;

    private final LanguageModelClient client;

    public ModelAssistedDecomposer(LanguageModelClient client) {
        this.client = client;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<Task> decompose(Specification spec) {
        DecompositionPlan plan = client.structuredCall(SYSTEM_PROMPT, buildUserPrompt(spec), DecompositionPlan.class);
        if (plan == null || plan.tasks() == null || plan.tasks().isEmpty()) {
            throw new LlmEmptyResponseException("Model returned no tasks");
        }
        log.info("Model decomposition returned {} task(s): {}", plan.tasks().size(), plan.rationale());

        var constraints = spec.constraints().stream().filter(c -> c != null && !c.isBlank()).toList();
        var tasks = new ArrayList<Task>(plan.tasks().size());
        for (DecompositionPlan.TaskPlan entry : plan.tasks()) {
            if (entry == null) {
                continue;
            }
            TaskType type = TaskType.parse(entry.type()).orElse(null);
            var context = new LinkedHashMap<String, String>();
            if (entry.context() != null) {
                entry.context().forEach((k, v) -> {
                    if (k != null && v != null) {
                        context.put(k, v);
                    }
                });
            }
            if (!constraints.isEmpty()) {
                context.putIfAbsent("constraints", String.join("; ", constraints));
            }
            var task = new Task(null, type, entry.description(),
                    clean(entry.inputArtifacts()), clean(entry.outputArtifacts()),
                    entry.complexity() == null ? TaskValidator.DEFAULT_COMPLEXITY : entry.complexity(),
                    entry.priority() == null ? 5 : entry.priority())
                    .asOptional(Boolean.TRUE.equals(entry.optional()))
                    .withContext(context);
            tasks.add(task);
        }
        return tasks;
    }

    private static String buildUserPrompt(Specification spec) {
        var sb = new StringBuilder();
        sb.append("SPECIFICATION TO DECOMPOSE\n\n");
        if (spec.title() != null) {
            sb.append("Title: ").append(spec.title()).append("\n");
        }
        if (spec.description() != null) {
            sb.append("Description: ").append(spec.description()).append("\n");
        }
        appendList(sb, "Requirements", spec.requirements());
        appendList(sb, "Constraints", spec.constraints());
        appendList(sb, "Success criteria", spec.successCriteria());
        sb.append("\nAvailable task types: ").append(Arrays.toString(TaskType.values())).append("\n");
        return sb.toString();
    }

    private static void appendList(StringBuilder sb, String heading, List<String> items) {
        if (items.isEmpty()) {
            return;
        }
        sb.append("\n").append(heading).append(":\n");
        items.forEach(item -> sb.append("- ").append(item).append("\n"));
    }

    private static List<String> clean(List<String> names) {
        if (names == null) {
            return List.of();
        }
        return names.stream().filter(n -> n != null && !n.isBlank()).map(String::trim).distinct().toList();
    }
}
