package com.agentdispatch.core.agent;

import com.agentdispatch.core.llm.LanguageModelClient;
import com.agentdispatch.core.model.AgentResult;
import com.agentdispatch.core.model.Task;
import com.agentdispatch.core.model.TaskArtifact;
import com.agentdispatch.core.model.TaskType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Agent that delegates the task to the language model and maps the structured reply onto
 * the task's declared outputs. Every declared output must come back, otherwise the attempt
 * fails.
 */
public class LlmAgent extends AbstractAgent {

    private static final Logger log = LoggerFactory.getLogger(LlmAgent.class);

    public static final String KIND = "llm";

    static final Set<TaskType> CAPABILITIES = EnumSet.of(
            TaskType.CODE_WRITING, TaskType.RESEARCH, TaskType.TESTING,
            TaskType.REVIEW, TaskType.DOCUMENTATION);

    /**
     * Structured reply expected from the model.
     *
     * @param artifacts one draft per requested output
     * @param summary   short account of the work done
     */
    public record AgentOutput(List<ArtifactDraft> artifacts, String summary) {}

    public record ArtifactDraft(String name, String content) {}

    private final LanguageModelClient client;

    public LlmAgent(String id, LanguageModelClient client) {
        super(id, KIND, CAPABILITIES);
        this.client = client;
    }

    @Override
    public AgentResult execute(Task task, AgentContext context) throws InterruptedException {
        checkStop();
        String prompt = AgentInstructions.build(task, context.inputs());
        log.info("Agent {} sending {} to model (attempt {})", id(), task.id(), context.attempt());
        AgentOutput output = client.structuredCall(AgentInstructions.SYSTEM_PROMPT, prompt, AgentOutput.class);
        checkStop();
        if (output == null) {
            throw new TaskExecutionException("Model returned no output for " + task.id());
        }

        Map<String, String> drafts = new HashMap<>();
        if (output.artifacts() != null) {
            for (ArtifactDraft draft : output.artifacts()) {
                if (draft != null && draft.name() != null && draft.content() != null) {
                    drafts.putIfAbsent(draft.name().trim(), draft.content());
                }
            }
        }
        var artifacts = new ArrayList<TaskArtifact>();
        for (String name : task.outputArtifacts()) {
            String content = drafts.get(name);
            if (content == null || content.isBlank()) {
                throw new TaskExecutionException("Model produced no content for output '" + name + "'");
            }
            artifacts.add(TaskArtifact.of(name, task.id(), content));
        }
        var logs = output.summary() == null ? List.<String>of() : List.of(output.summary());
        return new AgentResult(task.id(), id(), true, artifacts, null, logs);
    }

    /** Provider registered under {@value #KIND} when model access is enabled. */
    public static class Provider implements AgentProvider {

        private final LanguageModelClient client;

        public Provider(LanguageModelClient client) {
            this.client = client;
        }

        @Override
        public String name() {
            return KIND;
        }

        @Override
        public Set<TaskType> capabilities() {
            return CAPABILITIES;
        }

        @Override
        public Agent create(String agentId) {
            return new LlmAgent(agentId, client);
        }
    }
}
