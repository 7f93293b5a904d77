package com.agentdispatch.core.resolver;

import com.agentdispatch.core.model.DependencyEdge;
import com.agentdispatch.core.model.DependencyKind;
import com.agentdispatch.core.model.Task;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Description-pattern heuristics for common engineering workflows (schema before data
 * access, authentication before protected features, ...). A pair matching in both directions
 * is ambiguous and produces no edge.
 */
public class WorkflowPatternRule implements DependencyRule {

    public static final String NAME = "workflow-patterns";

    /**
     * @param source matched against the upstream task's description and outputs
     * @param target matched against the downstream task's description and inputs
     */
    record WorkflowPattern(String name, Pattern source, Pattern target, double confidence) {

        static WorkflowPattern of(String name, String source, String target, double confidence) {
            return new WorkflowPattern(name,
                    Pattern.compile(source, Pattern.CASE_INSENSITIVE),
                    Pattern.compile(target, Pattern.CASE_INSENSITIVE),
                    confidence);
        }
    }

    static final List<WorkflowPattern> PATTERNS = List.of(
            WorkflowPattern.of("design-before-implementation",
                    "\\b(design|architect|wireframe)", "\\b(implement|build|code)", 0.9),
            WorkflowPattern.of("schema-before-data-access",
                    "\\bschema|database.*design|table.*create", "data.*access|\\brepositor|\\bdao\\b|\\borm\\b", 0.9),
            WorkflowPattern.of("api-before-client",
                    "api.*design|endpoint.*design|service.*interface", "\\bclient|frontend|ui.*integration", 0.8),
            WorkflowPattern.of("auth-before-protected",
                    "authentication|auth.*system|\\blogin", "\\bprotected|\\bsecure|\\bauthorized|user.*profile", 0.8),
            WorkflowPattern.of("components-before-pages",
                    "component.*library|ui.*components|design.*system", "\\bpage|\\bscreen|dashboard", 0.7),
            WorkflowPattern.of("unit-before-integration-tests",
                    "unit.*test|component.*test", "integration.*test|e2e.*test|system.*test", 0.8));

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<DependencyEdge> apply(List<Task> tasks) {
        var edges = new ArrayList<DependencyEdge>();
        for (WorkflowPattern pattern : PATTERNS) {
            for (Task source : tasks) {
                if (!pattern.source().matcher(sourceText(source)).find()) {
                    continue;
                }
                for (Task target : tasks) {
                    if (source == target || !pattern.target().matcher(targetText(target)).find()) {
                        continue;
                    }
                    boolean reverse = pattern.source().matcher(sourceText(target)).find()
                            && pattern.target().matcher(targetText(source)).find();
                    if (!reverse) {
                        edges.add(DependencyEdge.rule(source.id(), target.id(), DependencyKind.LOGICAL,
                                pattern.confidence(), pattern.name()));
                    }
                }
            }
        }
        return edges;
    }

    private static String sourceText(Task task) {
        return task.description() + " " + String.join(" ", task.outputArtifacts());
    }

    private static String targetText(Task task) {
        return task.description() + " " + String.join(" ", task.inputArtifacts());
    }
}
