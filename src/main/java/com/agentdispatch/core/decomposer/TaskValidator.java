package com.agentdispatch.core.decomposer;

import com.agentdispatch.core.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

/**
 * Cleans a raw task list: drops entries without a description or type, clamps complexity
 * to [1, 5], and renumbers ids ({@code TASK-001}, ...) when any id is missing or duplicated.
 */
public final class TaskValidator {

    private static final Logger log = LoggerFactory.getLogger(TaskValidator.class);

    static final double MIN_COMPLEXITY = 1.0;
    static final double MAX_COMPLEXITY = 5.0;
    static final double DEFAULT_COMPLEXITY = 3.0;

    private TaskValidator() {}

    public static List<Task> validate(List<Task> raw) {
        var valid = new ArrayList<Task>();
        if (raw == null) {
            return valid;
        }
        for (Task task : raw) {
            if (task == null) {
                continue;
            }
            if (task.description() == null || task.description().isBlank()) {
                log.warn("Dropping task {} with empty description", task.id());
                continue;
            }
            if (task.type() == null) {
                log.warn("Dropping task {} with unknown type: {}", task.id(), task.description());
                continue;
            }
            valid.add(clamp(task));
        }

        var seen = new HashSet<String>();
        boolean renumber = valid.stream().anyMatch(t -> t.id() == null || t.id().isBlank() || !seen.add(t.id()));
        if (renumber) {
            var renumbered = new ArrayList<Task>(valid.size());
            for (int i = 0; i < valid.size(); i++) {
                renumbered.add(valid.get(i).withId(taskId(i + 1)));
            }
            return renumbered;
        }
        return valid;
    }

    public static String taskId(int sequence) {
        return String.format("TASK-%03d", sequence);
    }

    private static Task clamp(Task task) {
        double complexity = task.complexity();
        if (Double.isNaN(complexity)) {
            complexity = DEFAULT_COMPLEXITY;
        }
        complexity = Math.max(MIN_COMPLEXITY, Math.min(MAX_COMPLEXITY, complexity));
        if (complexity == task.complexity()) {
            return task;
        }
        return new Task(task.id(), task.type(), task.description(), task.inputArtifacts(),
                task.outputArtifacts(), complexity, task.priority(), task.status(), task.assignedAgentId(),
                task.retryCount(), task.optional(), task.timeout(), task.context());
    }
}
