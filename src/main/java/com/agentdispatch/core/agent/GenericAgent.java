package com.agentdispatch.core.agent;

import com.agentdispatch.core.model.AgentResult;
import com.agentdispatch.core.model.Task;
import com.agentdispatch.core.model.TaskArtifact;
import com.agentdispatch.core.model.TaskType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Capability-agnostic agent that produces a deterministic summary artifact for each declared
 * output. Used as the default worker when no specialized provider is configured.
 */
public class GenericAgent extends AbstractAgent {

    private static final Logger log = LoggerFactory.getLogger(GenericAgent.class);

    public static final String KIND = "generic";

    public GenericAgent(String id) {
        super(id, KIND, EnumSet.allOf(TaskType.class));
    }

    @Override
    public AgentResult execute(Task task, AgentContext context) throws InterruptedException {
        checkStop();
        var artifacts = new ArrayList<TaskArtifact>();
        for (String output : task.outputArtifacts()) {
            checkStop();
            artifacts.add(TaskArtifact.of(output, task.id(), render(task, context)));
        }
        log.debug("Agent {} produced {} artifact(s) for {}", id(), artifacts.size(), task.id());
        var logs = List.of("attempt " + context.attempt() + ": " + task.type() + " " + task.description());
        return new AgentResult(task.id(), id(), true, artifacts, null, logs);
    }

    private static String render(Task task, AgentContext context) {
        var sb = new StringBuilder();
        sb.append("# ").append(task.id()).append(" (").append(task.type()).append(")\n\n");
        sb.append(task.description()).append("\n");
        if (!context.inputs().isEmpty()) {
            sb.append("\nInputs:\n");
            context.inputs().keySet().stream().sorted()
                    .forEach(name -> sb.append("- ").append(name).append("\n"));
        }
        return sb.toString();
    }

    /** Provider registered under {@value #KIND}. */
    public static class Provider implements AgentProvider {

        @Override
        public String name() {
            return KIND;
        }

        @Override
        public Set<TaskType> capabilities() {
            return EnumSet.allOf(TaskType.class);
        }

        @Override
        public Agent create(String agentId) {
            return new GenericAgent(agentId);
        }
    }
}
