package com.agentdispatch.core.graph;

import com.agentdispatch.core.model.DependencyEdge;
import com.agentdispatch.core.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Directed acyclic graph of tasks and their dependencies.
 * <p>
 * The graph is mutable until {@link #freeze()}; afterwards the structure is read-only and
 * the derived views (topological order, phases, critical path) are cached. The one
 * permitted post-freeze change is skip propagation via {@link #propagateSkip}, which
 * annotates descendants of a failed task without touching nodes or edges.
 * <p>
 * Ordering is deterministic everywhere: ties are broken by priority descending, then task id
 * ascending.
 */
public class ExecutionGraph {

    private static final Logger log = LoggerFactory.getLogger(ExecutionGraph.class);

    /** Priority descending, then id ascending. */
    public static final Comparator<Task> SCHEDULING_ORDER =
            Comparator.comparingInt(Task::priority).reversed().thenComparing(Task::id);

    private final double durationUnit;
    private final Map<String, Task> tasks = new LinkedHashMap<>();
    private final Map<String, DependencyEdge> edges = new LinkedHashMap<>();
    private final Map<String, Set<String>> successors = new HashMap<>();
    private final Map<String, Set<String>> predecessors = new HashMap<>();
    private final Map<String, String> skipReasons = new ConcurrentHashMap<>();

    private volatile boolean frozen;
    private List<String> frozenOrder;
    private List<List<String>> frozenPhases;
    private CriticalPath frozenCriticalPath;

    public ExecutionGraph() {
        this(1.0);
    }

    /**
     * @param durationUnit estimated duration of a task per unit of complexity
     */
    public ExecutionGraph(double durationUnit) {
        if (durationUnit <= 0) {
            throw new IllegalArgumentException("durationUnit must be positive: " + durationUnit);
        }
        this.durationUnit = durationUnit;
    }

    /**
     * Builds a validated graph.
     *
     * @throws CycleDetectedException   if the edges contain a cycle
     * @throws IllegalArgumentException on duplicate task ids or edges to unknown tasks
     */
    public static ExecutionGraph build(Collection<Task> tasks, Collection<DependencyEdge> edges) {
        return build(tasks, edges, 1.0);
    }

    public static ExecutionGraph build(Collection<Task> tasks, Collection<DependencyEdge> edges, double durationUnit) {
        var graph = new ExecutionGraph(durationUnit);
        for (Task task : tasks) {
            graph.insertTask(task);
        }
        for (DependencyEdge edge : edges) {
            graph.insertEdge(edge);
        }
        // Kahn's algorithm doubles as the cycle check
        graph.computeTopologicalOrder();
        log.debug("Built execution graph: {} tasks, {} edges", graph.tasks.size(), graph.edges.size());
        return graph;
    }

    /**
     * Rebuilds a frozen graph from an exported snapshot, including recorded skip reasons.
     */
    public static ExecutionGraph fromSnapshot(GraphSnapshot snapshot, double durationUnit) {
        var graph = build(snapshot.tasks(), snapshot.edges(), durationUnit);
        graph.freeze();
        graph.skipReasons.putAll(snapshot.skipReasons());
        return graph;
    }

    // ── Structural mutation (pre-freeze only) ────────────────────────────

    public synchronized void addTask(Task task) {
        requireMutable("addTask");
        insertTask(task);
    }

    /**
     * Adds an edge, rejecting it if it would close a cycle.
     */
    public synchronized void addEdge(DependencyEdge edge) {
        requireMutable("addEdge");
        requireKnown(edge);
        if (edge.from().equals(edge.to()) || reachable(edge.to(), edge.from())) {
            throw new CycleDetectedException("Edge " + edge.key() + " would create a cycle",
                    List.of(edge.from(), edge.to()));
        }
        insertEdge(edge);
    }

    /**
     * Removes a task and every edge touching it.
     *
     * @return true if the task existed
     */
    public synchronized boolean removeTask(String taskId) {
        requireMutable("removeTask");
        if (tasks.remove(taskId) == null) {
            return false;
        }
        edges.values().removeIf(e -> e.from().equals(taskId) || e.to().equals(taskId));
        for (String succ : successors.getOrDefault(taskId, Set.of())) {
            predecessors.get(succ).remove(taskId);
        }
        for (String pred : predecessors.getOrDefault(taskId, Set.of())) {
            successors.get(pred).remove(taskId);
        }
        successors.remove(taskId);
        predecessors.remove(taskId);
        return true;
    }

    /**
     * Makes the structure immutable and caches the derived views.
     */
    public synchronized void freeze() {
        if (frozen) {
            return;
        }
        frozenOrder = List.copyOf(computeTopologicalOrder());
        frozenPhases = computePhasesInternal();
        frozenCriticalPath = computeCriticalPath();
        frozen = true;
        log.info("Execution graph frozen: {} tasks, {} edges, {} phases, critical path {}",
                tasks.size(), edges.size(), frozenPhases.size(), frozenCriticalPath.taskIds());
    }

    public boolean isFrozen() {
        return frozen;
    }

    // ── Post-freeze annotation ───────────────────────────────────────────

    /**
     * Records a skip reason on every descendant of {@code failedTaskId} that has none yet.
     *
     * @return all descendants, in topological order
     */
    public synchronized List<String> propagateSkip(String failedTaskId, String reason) {
        var descendants = descendants(failedTaskId);
        for (String id : descendants) {
            skipReasons.putIfAbsent(id, reason);
        }
        return descendants;
    }

    public Map<String, String> skipReasons() {
        return Collections.unmodifiableMap(skipReasons);
    }

    // ── Queries ──────────────────────────────────────────────────────────

    public Task task(String taskId) {
        Task task = tasks.get(taskId);
        if (task == null) {
            throw new IllegalArgumentException("Unknown task: " + taskId);
        }
        return task;
    }

    public boolean contains(String taskId) {
        return tasks.containsKey(taskId);
    }

    public List<Task> tasks() {
        return List.copyOf(tasks.values());
    }

    public List<DependencyEdge> edges() {
        var sorted = new ArrayList<>(edges.values());
        sorted.sort(DependencyEdge.BY_ENDPOINTS);
        return sorted;
    }

    public int size() {
        return tasks.size();
    }

    public Set<String> predecessors(String taskId) {
        return Collections.unmodifiableSet(predecessors.getOrDefault(taskId, Set.of()));
    }

    public Set<String> successors(String taskId) {
        return Collections.unmodifiableSet(successors.getOrDefault(taskId, Set.of()));
    }

    /**
     * All tasks reachable from {@code taskId}, excluding itself, in topological order.
     */
    public List<String> descendants(String taskId) {
        task(taskId);
        var seen = new LinkedHashSet<String>();
        var queue = new ArrayDeque<>(successors.getOrDefault(taskId, Set.of()));
        while (!queue.isEmpty()) {
            String next = queue.poll();
            if (seen.add(next)) {
                queue.addAll(successors.getOrDefault(next, Set.of()));
            }
        }
        var order = topologicalOrder();
        return order.stream().filter(seen::contains).toList();
    }

    /**
     * Deterministic topological order.
     */
    public List<String> topologicalOrder() {
        if (frozen) {
            return frozenOrder;
        }
        synchronized (this) {
            return List.copyOf(computeTopologicalOrder());
        }
    }

    /**
     * Partitions tasks into waves: phase {@code i} holds every task whose predecessors all lie
     * in phases {@code < i}. This is the maximum-parallelism decomposition.
     */
    public List<List<String>> computePhases() {
        if (frozen) {
            return frozenPhases;
        }
        synchronized (this) {
            return computePhasesInternal();
        }
    }

    /**
     * Longest path weighted by estimated duration.
     */
    public CriticalPath criticalPath() {
        if (frozen) {
            return frozenCriticalPath;
        }
        synchronized (this) {
            return computeCriticalPath();
        }
    }

    public double estimatedDuration(String taskId) {
        return task(taskId).complexity() * durationUnit;
    }

    public GraphStatistics statistics() {
        var phases = computePhases();
        var critical = criticalPath();
        double total = tasks.values().stream().mapToDouble(t -> t.complexity() * durationUnit).sum();
        int widest = phases.stream().mapToInt(List::size).max().orElse(0);
        double speedup = critical.length() > 0 ? total / critical.length() : 0.0;
        return new GraphStatistics(tasks.size(), edges.size(), phases.size(), widest,
                total, critical.length(), speedup);
    }

    public GraphSnapshot export() {
        var order = topologicalOrder();
        var nodes = order.stream().map(tasks::get).toList();
        return new GraphSnapshot(nodes, edges(), computePhases(), criticalPath().taskIds(),
                new HashMap<>(skipReasons));
    }

    // ── Internals ────────────────────────────────────────────────────────

    private void insertTask(Task task) {
        if (tasks.containsKey(task.id())) {
            throw new IllegalArgumentException("Duplicate task id: " + task.id());
        }
        tasks.put(task.id(), task);
        successors.put(task.id(), new TreeSet<>());
        predecessors.put(task.id(), new TreeSet<>());
    }

    private void insertEdge(DependencyEdge edge) {
        requireKnown(edge);
        if (edge.from().equals(edge.to())) {
            throw new CycleDetectedException("Self-dependency", List.of(edge.from()));
        }
        edges.put(edge.key(), edge);
        successors.get(edge.from()).add(edge.to());
        predecessors.get(edge.to()).add(edge.from());
    }

    private void requireKnown(DependencyEdge edge) {
        if (!tasks.containsKey(edge.from()) || !tasks.containsKey(edge.to())) {
            throw new IllegalArgumentException("Edge " + edge.key() + " references an unknown task");
        }
    }

    private void requireMutable(String operation) {
        if (frozen) {
            throw new GraphFrozenException(operation);
        }
    }

    private boolean reachable(String source, String target) {
        var seen = new HashSet<String>();
        var stack = new ArrayDeque<String>();
        stack.push(source);
        while (!stack.isEmpty()) {
            String current = stack.pop();
            if (current.equals(target)) {
                return true;
            }
            if (seen.add(current)) {
                successors.getOrDefault(current, Set.of()).forEach(stack::push);
            }
        }
        return false;
    }

    private List<String> computeTopologicalOrder() {
        var inDegree = new HashMap<String, Integer>();
        for (String id : tasks.keySet()) {
            inDegree.put(id, predecessors.get(id).size());
        }
        var ready = new PriorityQueue<>(SCHEDULING_ORDER);
        for (Task task : tasks.values()) {
            if (inDegree.get(task.id()) == 0) {
                ready.add(task);
            }
        }
        var order = new ArrayList<String>(tasks.size());
        while (!ready.isEmpty()) {
            Task next = ready.poll();
            order.add(next.id());
            for (String succ : successors.get(next.id())) {
                int remaining = inDegree.merge(succ, -1, Integer::sum);
                if (remaining == 0) {
                    ready.add(tasks.get(succ));
                }
            }
        }
        if (order.size() < tasks.size()) {
            var stuck = tasks.keySet().stream()
                    .filter(id -> !order.contains(id))
                    .sorted()
                    .toList();
            throw new CycleDetectedException("Dependency cycle detected", stuck);
        }
        return order;
    }

    private List<List<String>> computePhasesInternal() {
        var order = computeTopologicalOrder();
        var level = new HashMap<String, Integer>();
        int maxLevel = -1;
        for (String id : order) {
            int lvl = 0;
            for (String pred : predecessors.get(id)) {
                lvl = Math.max(lvl, level.get(pred) + 1);
            }
            level.put(id, lvl);
            maxLevel = Math.max(maxLevel, lvl);
        }
        var phases = new ArrayList<List<String>>();
        for (int i = 0; i <= maxLevel; i++) {
            phases.add(new ArrayList<>());
        }
        for (String id : order) {
            phases.get(level.get(id)).add(id);
        }
        return phases.stream().map(List::copyOf).toList();
    }

    private CriticalPath computeCriticalPath() {
        if (tasks.isEmpty()) {
            return CriticalPath.EMPTY;
        }
        var order = computeTopologicalOrder();
        var distance = new HashMap<String, Double>();
        var via = new HashMap<String, String>();
        String end = null;
        for (String id : order) {
            double best = 0.0;
            String bestPred = null;
            for (String pred : predecessors.get(id)) {
                double d = distance.get(pred);
                if (bestPred == null || d > best) {
                    best = d;
                    bestPred = pred;
                }
            }
            double total = best + tasks.get(id).complexity() * durationUnit;
            distance.put(id, total);
            if (bestPred != null) {
                via.put(id, bestPred);
            }
            if (end == null || total > distance.get(end)) {
                end = id;
            }
        }
        var path = new ArrayList<String>();
        for (String cursor = end; cursor != null; cursor = via.get(cursor)) {
            path.add(cursor);
        }
        Collections.reverse(path);
        return new CriticalPath(path, distance.get(end));
    }
}
