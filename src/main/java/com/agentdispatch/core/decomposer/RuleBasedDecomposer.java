package com.agentdispatch.core.decomposer;

import com.agentdispatch.core.model.Specification;
import com.agentdispatch.core.model.Task;
import com.agentdispatch.core.model.TaskType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Deterministic keyword-driven decomposition.
 * <p>
 * Each requirement is classified into an archetype by the earliest keyword it contains.
 * Implementation requirements get a paired testing task; complex specifications get an
 * initial research task; every non-trivial specification ends with a review task. Artifact
 * names are wired so the dependency resolver can derive data edges. Never returns an empty
 * list: a specification with nothing to classify yields a single {@link TaskType#GENERIC} task.
 */
public class RuleBasedDecomposer implements DecompositionStrategy {

    private static final Logger log = LoggerFactory.getLogger(RuleBasedDecomposer.class);

    public static final String NAME = "rules";

    /** Specifications scoring above this get an initial research task. */
    static final double RESEARCH_THRESHOLD = 6.0;

    private static final Map<TaskType, Set<String>> ARCHETYPES = new EnumMap<>(TaskType.class);

    static {
        ARCHETYPES.put(TaskType.DOCUMENTATION, Set.of("document", "docs", "readme", "guide", "manual", "tutorial"));
        ARCHETYPES.put(TaskType.TESTING, Set.of("test", "verify", "validate", "qa ", "coverage", "benchmark"));
        ARCHETYPES.put(TaskType.REVIEW, Set.of("review", "audit", "inspect", "assess"));
        ARCHETYPES.put(TaskType.RESEARCH, Set.of("research", "investigate", "evaluate", "analyze", "analyse",
                "explore", "compare", "study", "survey"));
        ARCHETYPES.put(TaskType.CODE_WRITING, Set.of("implement", "build", "create", "develop", "add", "integrate",
                "refactor", "fix", "migrate", "api", "endpoint", "service", "database", "schema", "ui",
                "page", "form", "component", "login", "authentication", "store", "persist", "expose",
                "generate", "parse", "handle", "process", "support"));
    }

    private static final List<String> COMPLEX_FEATURES = List.of(
            "authentication", "real-time", "scalability", "performance",
            "integration", "api", "database", "security", "testing");

    private static final Set<String> DOC_MENTIONS = Set.of("documentation", "document", "docs", "readme");

    private static final Map<TaskType, String> OUTPUT_PREFIX = Map.of(
            TaskType.CODE_WRITING, "impl/",
            TaskType.RESEARCH, "research/",
            TaskType.TESTING, "tests/",
            TaskType.REVIEW, "review/",
            TaskType.DOCUMENTATION, "docs/",
            TaskType.GENERIC, "result/");

    private static final Map<TaskType, Integer> PRIORITY = Map.of(
            TaskType.RESEARCH, 8,
            TaskType.CODE_WRITING, 5,
            TaskType.GENERIC, 5,
            TaskType.TESTING, 4,
            TaskType.REVIEW, 3,
            TaskType.DOCUMENTATION, 2);

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<Task> decompose(Specification spec) {
        var requirements = nonBlank(spec == null ? List.of() : spec.requirements());
        var constraints = nonBlank(spec == null ? List.of() : spec.constraints());
        Map<String, String> baseContext = new LinkedHashMap<>();
        if (!constraints.isEmpty()) {
            baseContext.put("constraints", String.join("; ", constraints));
        }

        if (requirements.isEmpty()) {
            var fallback = new Task(null, TaskType.GENERIC, genericDescription(spec, constraints),
                    List.of(), List.of("result/specification"), 1.0, 5).withContext(baseContext);
            log.info("Rule-based decomposition: nothing to classify, produced 1 generic task");
            return List.of(fallback);
        }

        String specText = fullText(spec);
        double score = complexityScore(requirements.size(), specText);
        var tasks = new ArrayList<Task>();
        var slugs = new HashSet<String>();

        if (score > RESEARCH_THRESHOLD) {
            tasks.add(new Task(null, TaskType.RESEARCH,
                    "Research technical requirements and architecture patterns",
                    List.of(), List.of("research/overview"), 2.0, 10)
                    .withContext(with(baseContext, Map.of("phase", "initial-research"))));
        }

        var implOutputs = new ArrayList<String>();
        var deliverables = new ArrayList<String>();
        boolean hasDocumentation = false;
        for (String requirement : requirements) {
            TaskType type = classify(requirement);
            String slug = uniqueSlug(Keywords.slug(requirement, 4), slugs);
            String output = OUTPUT_PREFIX.get(type) + slug;
            double complexity = estimateComplexity(type, requirement);
            var context = with(baseContext, Map.of("subject", slug, "requirement", requirement));

            tasks.add(new Task(null, type, requirement, List.of(), List.of(output),
                    complexity, PRIORITY.get(type)).withContext(context));
            deliverables.add(output);
            hasDocumentation |= type == TaskType.DOCUMENTATION;

            if (type == TaskType.CODE_WRITING) {
                implOutputs.add(output);
                String testOutput = "tests/" + slug;
                tasks.add(new Task(null, TaskType.TESTING, "Write tests for: " + requirement,
                        List.of(output), List.of(testOutput),
                        Math.max(1.0, complexity - 1.0), PRIORITY.get(TaskType.TESTING)).withContext(context));
                deliverables.add(testOutput);
            }
        }

        if (!hasDocumentation && mentionsDocumentation(specText)) {
            tasks.add(new Task(null, TaskType.DOCUMENTATION, "Document the delivered functionality",
                    implOutputs, List.of("docs/overview"), 2.0, PRIORITY.get(TaskType.DOCUMENTATION))
                    .withContext(baseContext));
            deliverables.add("docs/overview");
        }

        var reviewContext = new LinkedHashMap<>(baseContext);
        if (spec != null && !spec.successCriteria().isEmpty()) {
            reviewContext.put("successCriteria", String.join("; ", nonBlank(spec.successCriteria())));
        }
        tasks.add(new Task(null, TaskType.REVIEW, "Review all deliverables against the success criteria",
                deliverables, List.of("review/final"), 2.0, 1).withContext(reviewContext));

        log.info("Rule-based decomposition: {} requirement(s) -> {} task(s) (complexity score {})",
                requirements.size(), tasks.size(), score);
        return tasks;
    }

    /**
     * Archetype whose keyword appears first in the requirement; GENERIC when none does.
     */
    static TaskType classify(String requirement) {
        String lower = requirement.toLowerCase(Locale.ROOT) + " ";
        TaskType best = TaskType.GENERIC;
        int bestIndex = -1;
        for (var entry : ARCHETYPES.entrySet()) {
            int idx = Keywords.earliest(lower, entry.getValue());
            if (idx >= 0 && (bestIndex < 0 || idx < bestIndex)) {
                bestIndex = idx;
                best = entry.getKey();
            }
        }
        return best;
    }

    /**
     * Overall score on a 1-10 scale: base 3, plus half a point per requirement (capped at 3),
     * plus half a point per complex feature mentioned.
     */
    static double complexityScore(int requirementCount, String specText) {
        double score = 3.0 + Math.min(requirementCount * 0.5, 3.0);
        for (String feature : COMPLEX_FEATURES) {
            if (specText.contains(feature)) {
                score += 0.5;
            }
        }
        return Math.min(score, 10.0);
    }

    private static double estimateComplexity(TaskType type, String requirement) {
        String lower = requirement.toLowerCase(Locale.ROOT);
        double base = switch (type) {
            case CODE_WRITING -> 3.0;
            case TESTING, GENERIC -> 2.5;
            case RESEARCH, REVIEW -> 2.0;
            case DOCUMENTATION -> 1.5;
        };
        for (String feature : COMPLEX_FEATURES) {
            if (lower.contains(feature)) {
                base += 0.5;
            }
        }
        return Math.min(base, TaskValidator.MAX_COMPLEXITY);
    }

    private static boolean mentionsDocumentation(String specText) {
        return Keywords.earliest(specText, DOC_MENTIONS) >= 0;
    }

    private static String uniqueSlug(String slug, Set<String> used) {
        String candidate = slug;
        for (int n = 2; !used.add(candidate); n++) {
            candidate = slug + "-" + n;
        }
        return candidate;
    }

    private static String genericDescription(Specification spec, List<String> constraints) {
        if (spec != null && spec.title() != null && !spec.title().isBlank()) {
            return "Fulfil the specification: " + spec.title().trim();
        }
        if (spec != null && spec.description() != null && !spec.description().isBlank()) {
            return "Fulfil the specification: " + spec.description().trim();
        }
        if (!constraints.isEmpty()) {
            return "Deliver a result that satisfies: " + String.join("; ", constraints);
        }
        return "Fulfil the specification";
    }

    private static String fullText(Specification spec) {
        var sb = new StringBuilder();
        if (spec.title() != null) {
            sb.append(spec.title()).append(' ');
        }
        if (spec.description() != null) {
            sb.append(spec.description()).append(' ');
        }
        spec.requirements().forEach(r -> sb.append(r).append(' '));
        spec.constraints().forEach(c -> sb.append(c).append(' '));
        spec.successCriteria().forEach(c -> sb.append(c).append(' '));
        return sb.toString().toLowerCase(Locale.ROOT);
    }

    private static List<String> nonBlank(List<String> values) {
        return values.stream().filter(v -> v != null && !v.isBlank()).map(String::trim).toList();
    }

    private static Map<String, String> with(Map<String, String> base, Map<String, String> extra) {
        var merged = new LinkedHashMap<>(base);
        merged.putAll(extra);
        return merged;
    }
}
