package com.agentdispatch.core.resolver;

import com.agentdispatch.core.llm.ModelCalls;
import com.agentdispatch.core.metrics.DispatchMetrics;
import com.agentdispatch.core.model.DependencyEdge;
import com.agentdispatch.core.model.DependencyKind;
import com.agentdispatch.core.model.EdgeProvenance;
import com.agentdispatch.core.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.TimeoutException;

/**
 * Derives the dependency edges of a task list.
 * <ol>
 *   <li>Every registered {@link DependencyRule} contributes edges; duplicates collapse to one,
 *       preferring DATA over RESOURCE over LOGICAL, then higher confidence.</li>
 *   <li>An optional {@link DependencyRefiner} proposes extra or contradicting edges. Rule edges
 *       are authoritative: the model can only add edges, and only at or above the confidence
 *       threshold, and never one that would close a cycle. Any refiner failure degrades to
 *       rule-only output.</li>
 *   <li>Surviving cycles are broken by removing the weakest edge on each cycle, model edges
 *       first.</li>
 *   <li>Transitive reduction removes redundant edges.</li>
 * </ol>
 * Output is sorted by (from, to); with the refiner disabled it is a pure function of the input.
 */
public class DependencyResolver {

    private static final Logger log = LoggerFactory.getLogger(DependencyResolver.class);

    /** Preferred edge when two candidates share endpoints. */
    static final Comparator<DependencyEdge> STRENGTH =
            Comparator.comparingInt((DependencyEdge e) -> e.kind().precedence())
                    .thenComparingDouble(DependencyEdge::confidence)
                    .thenComparing(e -> e.provenance() == EdgeProvenance.RULE);

    /** First element is removed first when breaking a cycle. Model edges always go before rule edges. */
    static final Comparator<DependencyEdge> REMOVAL_ORDER =
            Comparator.comparing((DependencyEdge e) -> e.provenance() == EdgeProvenance.RULE)
                    .thenComparingDouble(DependencyEdge::confidence)
                    .thenComparing(DependencyEdge::key);

    /**
     * Full resolver output.
     *
     * @param edges          final edges, sorted by endpoints
     * @param removals       edges dropped to break cycles
     * @param ruleEdges      rule edges after deduplication
     * @param modelEdges     model edges accepted by the merge
     * @param refinerFailure why refinement was abandoned; null if it ran or was disabled
     */
    public record Resolution(
        List<DependencyEdge> edges,
        List<EdgeRemoval> removals,
        int ruleEdges,
        int modelEdges,
        String refinerFailure
    ) {}

    private final List<DependencyRule> rules;
    private final DependencyRefiner refiner;
    private final double confidenceThreshold;
    private final Duration refinerTimeout;
    private final DispatchMetrics metrics;

    public DependencyResolver(List<DependencyRule> rules) {
        this(rules, null, 0.6, Duration.ofSeconds(60), null);
    }

    /**
     * @param refiner             nullable; null disables the model pass
     * @param confidenceThreshold minimum confidence for a model edge to be kept
     * @param metrics             nullable
     */
    public DependencyResolver(List<DependencyRule> rules, DependencyRefiner refiner, double confidenceThreshold,
                              Duration refinerTimeout, DispatchMetrics metrics) {
        this.rules = List.copyOf(rules);
        this.refiner = refiner;
        this.confidenceThreshold = confidenceThreshold;
        this.refinerTimeout = refinerTimeout;
        this.metrics = metrics;
    }

    public static List<DependencyRule> defaultRules() {
        return List.of(new ArtifactRule(), new TypeOrderingRule(), new ResourceContentionRule(),
                new WorkflowPatternRule());
    }

    public List<DependencyEdge> resolve(List<Task> tasks) {
        return resolveDetailed(tasks).edges();
    }

    public Resolution resolveDetailed(List<Task> tasks) {
        long start = System.currentTimeMillis();
        var ids = new HashSet<String>();
        tasks.forEach(t -> ids.add(t.id()));

        Map<String, DependencyEdge> merged = new TreeMap<>();
        for (DependencyRule rule : rules) {
            List<DependencyEdge> produced;
            try {
                produced = rule.apply(tasks);
            } catch (RuntimeException e) {
                log.warn("Dependency rule '{}' failed and was skipped: {}", rule.name(), e.getMessage(), e);
                continue;
            }
            int kept = 0;
            for (DependencyEdge edge : produced) {
                if (accept(edge, ids, rule.name())) {
                    merged.merge(edge.key(), edge, DependencyResolver::stronger);
                    kept++;
                }
            }
            log.debug("Rule '{}' contributed {} edge(s)", rule.name(), kept);
        }
        int ruleEdges = merged.size();

        int modelEdges = 0;
        String refinerFailure = null;
        if (refiner != null && tasks.size() > 1) {
            try {
                modelEdges = mergeProposals(merged, callRefiner(tasks, List.copyOf(merged.values())), ids);
            } catch (RuntimeException e) {
                refinerFailure = e.getClass().getSimpleName() + ": " + e.getMessage();
                log.warn("Model dependency refinement failed ({}); using rule edges only", refinerFailure);
                merged.values().removeIf(edge -> edge.provenance() == EdgeProvenance.MODEL);
                modelEdges = 0;
                if (metrics != null) {
                    metrics.recordFallback("refinement");
                }
            }
        }

        var removals = breakCycles(merged, tasks);
        var reduced = transitiveReduction(merged.values());
        reduced.sort(DependencyEdge.BY_ENDPOINTS);

        if (metrics != null) {
            metrics.recordResolutionDuration(System.currentTimeMillis() - start);
        }
        log.info("Resolved {} edge(s) for {} task(s): {} rule, {} model, {} removed to break cycles, {} redundant",
                reduced.size(), tasks.size(), ruleEdges, modelEdges, removals.size(),
                merged.size() - reduced.size());
        return new Resolution(List.copyOf(reduced), removals, ruleEdges, modelEdges, refinerFailure);
    }

    /**
     * Human-readable edge list grouped by kind, e.g. for review before execution.
     */
    public static Map<DependencyKind, List<String>> explain(List<Task> tasks, List<DependencyEdge> edges) {
        var byId = new HashMap<String, Task>();
        tasks.forEach(t -> byId.put(t.id(), t));
        var explanation = new LinkedHashMap<DependencyKind, List<String>>();
        for (DependencyEdge edge : edges) {
            Task from = byId.get(edge.from());
            Task to = byId.get(edge.to());
            if (from == null || to == null) {
                continue;
            }
            explanation.computeIfAbsent(edge.kind(), k -> new ArrayList<>())
                    .add(from.description() + " -> " + to.description() + " (" + edge.reason() + ")");
        }
        return explanation;
    }

    // ── Merge ────────────────────────────────────────────────────────────

    private static boolean accept(DependencyEdge edge, Set<String> ids, String source) {
        if (edge.from().equals(edge.to())) {
            log.debug("Discarding self-loop {} from {}", edge.key(), source);
            return false;
        }
        if (!ids.contains(edge.from()) || !ids.contains(edge.to())) {
            log.debug("Discarding edge {} from {}: unknown task id", edge.key(), source);
            return false;
        }
        return true;
    }

    private static DependencyEdge stronger(DependencyEdge a, DependencyEdge b) {
        return STRENGTH.compare(b, a) > 0 ? b : a;
    }

    private DependencyProposals callRefiner(List<Task> tasks, List<DependencyEdge> ruleEdges) {
        try {
            return ModelCalls.callWithTimeout("refinement", () -> refiner.propose(tasks, ruleEdges), refinerTimeout);
        } catch (TimeoutException e) {
            throw new IllegalStateException("Dependency refinement timed out after " + refinerTimeout, e);
        }
    }

    private int mergeProposals(Map<String, DependencyEdge> merged, DependencyProposals proposals, Set<String> ids) {
        if (proposals == null || proposals.proposals() == null) {
            return 0;
        }
        int added = 0;
        for (DependencyProposals.Proposal proposal : proposals.proposals()) {
            if (proposal == null || proposal.from() == null || proposal.to() == null) {
                continue;
            }
            String action = proposal.action() == null ? "ADD" : proposal.action().trim().toUpperCase(Locale.ROOT);
            String key = proposal.from() + "->" + proposal.to();
            double confidence = proposal.confidence() == null ? 0.0 : proposal.confidence();

            if ("REMOVE".equals(action)) {
                if (merged.containsKey(key)) {
                    log.info("Ignoring model request to remove rule edge {} (confidence {}): {}",
                            key, confidence, proposal.reason());
                }
                continue;
            }
            if (confidence < confidenceThreshold || confidence > 1.0) {
                log.debug("Ignoring model edge {} below threshold ({} < {})", key, confidence, confidenceThreshold);
                continue;
            }
            DependencyEdge edge = new DependencyEdge(proposal.from(), proposal.to(), parseKind(proposal.kind()),
                    confidence, EdgeProvenance.MODEL, proposal.reason() == null ? "model" : proposal.reason());
            if (!accept(edge, ids, "model")) {
                continue;
            }
            if (merged.containsKey(key)) {
                continue;
            }
            DependencyEdge reverse = merged.get(proposal.to() + "->" + proposal.from());
            if (reverse != null && reverse.provenance() == EdgeProvenance.RULE) {
                log.info("Ignoring model edge {} contradicting rule edge {}", key, reverse);
                continue;
            }
            if (reaches(merged.values(), proposal.to(), proposal.from())) {
                log.info("Ignoring model edge {}: {} already depends on {}", key, proposal.from(), proposal.to());
                continue;
            }
            merged.put(key, edge);
            added++;
        }
        return added;
    }

    /** True when {@code target} is reachable from {@code source} over {@code edges}. */
    static boolean reaches(Iterable<DependencyEdge> edges, String source, String target) {
        Map<String, Set<String>> adjacency = new HashMap<>();
        for (DependencyEdge edge : edges) {
            adjacency.computeIfAbsent(edge.from(), k -> new HashSet<>()).add(edge.to());
        }
        var seen = new HashSet<String>();
        var stack = new ArrayList<String>();
        stack.add(source);
        while (!stack.isEmpty()) {
            String node = stack.remove(stack.size() - 1);
            if (node.equals(target)) {
                return true;
            }
            if (seen.add(node)) {
                stack.addAll(adjacency.getOrDefault(node, Set.of()));
            }
        }
        return false;
    }

    private static DependencyKind parseKind(String raw) {
        if (raw == null) {
            return DependencyKind.LOGICAL;
        }
        try {
            return DependencyKind.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return DependencyKind.LOGICAL;
        }
    }

    // ── Cycle breaking ───────────────────────────────────────────────────

    private List<EdgeRemoval> breakCycles(Map<String, DependencyEdge> edges, List<Task> tasks) {
        var removals = new ArrayList<EdgeRemoval>();
        List<String> cycle;
        while ((cycle = findCycle(edges.values(), tasks)) != null) {
            var onCycle = new ArrayList<DependencyEdge>();
            for (int i = 0; i < cycle.size(); i++) {
                String from = cycle.get(i);
                String to = cycle.get((i + 1) % cycle.size());
                onCycle.add(edges.get(from + "->" + to));
            }
            DependencyEdge victim = onCycle.stream().min(REMOVAL_ORDER).orElseThrow();
            edges.remove(victim.key());
            removals.add(new EdgeRemoval(victim, cycle));
            log.warn("Removed {} edge {} ({}, confidence {}) to break cycle {}",
                    victim.provenance(), victim.key(), victim.kind(), victim.confidence(), cycle);
            if (metrics != null) {
                metrics.recordEdgeRemoval(victim.provenance().name());
            }
        }
        return removals;
    }

    /**
     * Depth-first search in id order; returns the nodes of the first cycle found, or null.
     */
    static List<String> findCycle(Iterable<DependencyEdge> edges, List<Task> tasks) {
        Map<String, Set<String>> adjacency = new TreeMap<>();
        tasks.forEach(t -> adjacency.put(t.id(), new TreeSet<>()));
        for (DependencyEdge edge : edges) {
            adjacency.computeIfAbsent(edge.from(), k -> new TreeSet<>()).add(edge.to());
        }
        var state = new HashMap<String, Integer>();
        var path = new ArrayList<String>();
        for (String start : adjacency.keySet()) {
            if (!state.containsKey(start)) {
                List<String> cycle = visit(start, adjacency, state, path);
                if (cycle != null) {
                    return cycle;
                }
            }
        }
        return null;
    }

    private static List<String> visit(String node, Map<String, Set<String>> adjacency,
                                      Map<String, Integer> state, List<String> path) {
        state.put(node, 1);
        path.add(node);
        for (String next : adjacency.getOrDefault(node, Set.of())) {
            Integer s = state.get(next);
            if (s == null) {
                List<String> cycle = visit(next, adjacency, state, path);
                if (cycle != null) {
                    return cycle;
                }
            } else if (s == 1) {
                return List.copyOf(path.subList(path.indexOf(next), path.size()));
            }
        }
        path.remove(path.size() - 1);
        state.put(node, 2);
        return null;
    }

    // ── Transitive reduction ─────────────────────────────────────────────

    /**
     * Drops every edge u->v for which v is also reachable from u through another successor.
     * The input must be acyclic.
     */
    static List<DependencyEdge> transitiveReduction(Iterable<DependencyEdge> edges) {
        Map<String, Set<String>> adjacency = new HashMap<>();
        var all = new ArrayList<DependencyEdge>();
        for (DependencyEdge edge : edges) {
            adjacency.computeIfAbsent(edge.from(), k -> new HashSet<>()).add(edge.to());
            all.add(edge);
        }
        var reachCache = new HashMap<String, Set<String>>();
        var kept = new ArrayList<DependencyEdge>();
        for (DependencyEdge edge : all) {
            boolean redundant = false;
            for (String via : adjacency.getOrDefault(edge.from(), Set.of())) {
                if (!via.equals(edge.to()) && reachable(via, adjacency, reachCache).contains(edge.to())) {
                    redundant = true;
                    break;
                }
            }
            if (redundant) {
                log.debug("Dropping redundant edge {}", edge.key());
            } else {
                kept.add(edge);
            }
        }
        return kept;
    }

    private static Set<String> reachable(String node, Map<String, Set<String>> adjacency,
                                         Map<String, Set<String>> cache) {
        Set<String> cached = cache.get(node);
        if (cached != null) {
            return cached;
        }
        var result = new HashSet<String>();
        for (String next : adjacency.getOrDefault(node, Set.of())) {
            result.add(next);
            result.addAll(reachable(next, adjacency, cache));
        }
        cache.put(node, result);
        return result;
    }
}
