package com.agentdispatch.core.resolver;

import com.agentdispatch.core.decomposer.Keywords;
import com.agentdispatch.core.model.DependencyEdge;
import com.agentdispatch.core.model.DependencyKind;
import com.agentdispatch.core.model.Task;
import com.agentdispatch.core.model.TaskType;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Workflow ordering between task types on the same subject: LOGICAL, confidence 0.8.
 * <pre>
 *   RESEARCH     -> CODE_WRITING
 *   CODE_WRITING -> TESTING, REVIEW, DOCUMENTATION
 *   TESTING      -> REVIEW
 * </pre>
 * Two tasks share a subject when both carry an equal {@code subject} context entry, or
 * when their descriptions and subjects share a significant keyword. Research without a
 * subject precedes every other task.
 */
public class TypeOrderingRule implements DependencyRule {

    public static final String NAME = "type-ordering";

    static final double CONFIDENCE = 0.8;

    private static final List<TaskType[]> ORDER = List.of(
            new TaskType[] {TaskType.RESEARCH, TaskType.CODE_WRITING},
            new TaskType[] {TaskType.CODE_WRITING, TaskType.TESTING},
            new TaskType[] {TaskType.CODE_WRITING, TaskType.REVIEW},
            new TaskType[] {TaskType.CODE_WRITING, TaskType.DOCUMENTATION},
            new TaskType[] {TaskType.TESTING, TaskType.REVIEW});

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<DependencyEdge> apply(List<Task> tasks) {
        var edges = new ArrayList<DependencyEdge>();
        for (Task source : tasks) {
            if (source.type() == TaskType.RESEARCH && subject(source) == null) {
                for (Task target : tasks) {
                    if (target != source && !(target.type() == TaskType.RESEARCH && subject(target) == null)) {
                        edges.add(DependencyEdge.rule(source.id(), target.id(), DependencyKind.LOGICAL,
                                CONFIDENCE, "general research precedes " + target.type()));
                    }
                }
            }
        }
        for (TaskType[] pair : ORDER) {
            for (Task source : tasks) {
                if (source.type() != pair[0]) {
                    continue;
                }
                for (Task target : tasks) {
                    if (target.type() == pair[1] && sameSubject(source, target)) {
                        edges.add(DependencyEdge.rule(source.id(), target.id(), DependencyKind.LOGICAL,
                                CONFIDENCE, pair[0] + " precedes " + pair[1]));
                    }
                }
            }
        }
        return edges;
    }

    static boolean sameSubject(Task a, Task b) {
        String subjectA = subject(a);
        String subjectB = subject(b);
        if (subjectA != null && subjectA.equals(subjectB)) {
            return true;
        }
        Set<String> wordsA = words(a);
        Set<String> wordsB = words(b);
        wordsA.retainAll(wordsB);
        return !wordsA.isEmpty();
    }

    private static String subject(Task task) {
        String subject = task.context().get("subject");
        return subject == null || subject.isBlank() ? null : subject.trim();
    }

    private static Set<String> words(Task task) {
        var words = new HashSet<>(Keywords.significant(task.description()));
        String subject = subject(task);
        if (subject != null) {
            words.addAll(Keywords.significant(subject));
        }
        return words;
    }
}
