package com.agentdispatch.core.scheduler;

import com.agentdispatch.core.graph.CriticalPath;
import com.agentdispatch.core.graph.ExecutionGraph;
import com.agentdispatch.core.model.Task;
import com.agentdispatch.core.model.TaskStatus;
import com.agentdispatch.core.state.TaskState;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Pure functions over a graph and a task-state table: which tasks may run, and in what order.
 * Being pure, a restored state table yields exactly the ready set it was saved with.
 */
public final class ReadySetCalculator {

    private ReadySetCalculator() {
    }

    /**
     * A predecessor is satisfied once COMPLETED, or once FAILED if it is best-effort.
     */
    public static boolean isSatisfied(Task predecessor, TaskState state) {
        return state.status() == TaskStatus.COMPLETED
                || (state.status() == TaskStatus.FAILED && predecessor.optional());
    }

    /**
     * PENDING tasks whose predecessors are all satisfied and whose retry backoff has elapsed,
     * in topological order.
     */
    public static List<String> promotable(ExecutionGraph graph, Map<String, TaskState> states, Instant now) {
        var result = new ArrayList<String>();
        for (String id : graph.topologicalOrder()) {
            TaskState state = states.get(id);
            if (state == null || state.status() != TaskStatus.PENDING) {
                continue;
            }
            if (state.notBefore() != null && now.isBefore(state.notBefore())) {
                continue;
            }
            boolean satisfied = graph.predecessors(id).stream()
                    .allMatch(p -> isSatisfied(graph.task(p), states.get(p)));
            if (satisfied) {
                result.add(id);
            }
        }
        return result;
    }

    /**
     * Ready set: tasks already READY plus those {@link #promotable} now, ranked for scheduling.
     */
    public static List<String> readySet(ExecutionGraph graph, Map<String, TaskState> states, Instant now) {
        var ids = new ArrayList<String>();
        for (String id : graph.topologicalOrder()) {
            if (states.get(id).status() == TaskStatus.READY) {
                ids.add(id);
            }
        }
        ids.addAll(promotable(graph, states, now));
        return rank(graph, states, ids);
    }

    /**
     * Priority descending, then critical-path members first, then arrival order in the
     * ready queue, then id.
     */
    public static List<String> rank(ExecutionGraph graph, Map<String, TaskState> states, List<String> ids) {
        CriticalPath critical = graph.criticalPath();
        Comparator<String> order = Comparator
                .comparingInt((String id) -> -graph.task(id).priority())
                .thenComparing(id -> critical.contains(id) ? 0 : 1)
                .thenComparingLong(id -> arrival(states.get(id)))
                .thenComparing(Comparator.naturalOrder());
        var ranked = new ArrayList<>(ids);
        ranked.sort(order);
        return ranked;
    }

    // tasks not yet READY have no arrival number and queue behind those that do
    private static long arrival(TaskState state) {
        return state.status() == TaskStatus.READY && state.readySequence() > 0
                ? state.readySequence() : Long.MAX_VALUE;
    }
}
