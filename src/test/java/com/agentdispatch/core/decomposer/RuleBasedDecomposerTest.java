package com.agentdispatch.core.decomposer;

import com.agentdispatch.core.model.Specification;
import com.agentdispatch.core.model.Task;
import com.agentdispatch.core.model.TaskType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RuleBasedDecomposerTest {

    private final RuleBasedDecomposer decomposer = new RuleBasedDecomposer();

    @Test
    @DisplayName("an empty specification still yields one GENERIC task")
    void emptySpecificationYieldsGenericTask() {
        List<Task> tasks = decomposer.decompose(new Specification(List.of(), List.of()));

        assertEquals(1, tasks.size());
        assertEquals(TaskType.GENERIC, tasks.get(0).type());
        assertFalse(tasks.get(0).description().isBlank());
    }

    @Test
    @DisplayName("constraints without requirements yield a single GENERIC task")
    void constraintsOnlyYieldGenericTask() {
        var spec = new Specification(List.of(), List.of("Must run on JDK 17"));

        List<Task> tasks = decomposer.decompose(spec);

        assertEquals(1, tasks.size());
        Task only = tasks.get(0);
        assertEquals(TaskType.GENERIC, only.type());
        assertTrue(only.description().contains("Must run on JDK 17"));
        assertEquals("Must run on JDK 17", only.context().get("constraints"));
        assertEquals(List.of("result/specification"), only.outputArtifacts());
    }

    @Test
    @DisplayName("a code requirement gets a test task and a final review")
    void codeRequirementExpandsIntoImplementTestReview() {
        var spec = new Specification(List.of("Implement user login with JWT"), List.of());

        List<Task> tasks = decomposer.decompose(spec);

        assertEquals(3, tasks.size());
        Task impl = tasks.get(0);
        Task test = tasks.get(1);
        Task review = tasks.get(2);

        assertEquals(TaskType.CODE_WRITING, impl.type());
        assertEquals(List.of("impl/login-jwt"), impl.outputArtifacts());
        assertEquals("login-jwt", impl.context().get("subject"));

        assertEquals(TaskType.TESTING, test.type());
        assertEquals(List.of("impl/login-jwt"), test.inputArtifacts());
        assertEquals(List.of("tests/login-jwt"), test.outputArtifacts());
        assertTrue(test.complexity() < impl.complexity());

        assertEquals(TaskType.REVIEW, review.type());
        assertEquals(List.of("impl/login-jwt", "tests/login-jwt"), review.inputArtifacts());
        assertEquals(List.of("review/final"), review.outputArtifacts());
    }

    @Test
    @DisplayName("classify picks the archetype whose keyword appears first")
    void classifyUsesEarliestKeyword() {
        assertEquals(TaskType.DOCUMENTATION, RuleBasedDecomposer.classify("Write documentation for the API"));
        assertEquals(TaskType.RESEARCH, RuleBasedDecomposer.classify("Evaluate caching libraries"));
        assertEquals(TaskType.TESTING, RuleBasedDecomposer.classify("Verify checkout flow"));
        assertEquals(TaskType.REVIEW, RuleBasedDecomposer.classify("Audit the access logs"));
        assertEquals(TaskType.CODE_WRITING, RuleBasedDecomposer.classify("Build a REST endpoint"));
        assertEquals(TaskType.GENERIC, RuleBasedDecomposer.classify("Keep the lights on"));
    }

    @Test
    @DisplayName("complex specifications start with a research task")
    void complexSpecificationAddsResearch() {
        var spec = new Specification(List.of(
                "Implement authentication API",
                "Build database schema",
                "Add real-time notifications"), List.of());

        List<Task> tasks = decomposer.decompose(spec);

        Task first = tasks.get(0);
        assertEquals(TaskType.RESEARCH, first.type());
        assertEquals(10, first.priority());
        assertEquals(List.of("research/overview"), first.outputArtifacts());
    }

    @Test
    @DisplayName("complexity score adds per requirement and per feature, capped at 10")
    void complexityScore() {
        assertEquals(3.5, RuleBasedDecomposer.complexityScore(1, "plain text"), 1e-9);
        assertEquals(5.0, RuleBasedDecomposer.complexityScore(2, "api and database"), 1e-9);
        assertEquals(6.0, RuleBasedDecomposer.complexityScore(20, ""), 1e-9);
        assertEquals(10.0, RuleBasedDecomposer.complexityScore(20,
                "authentication real-time scalability performance integration api database security testing"), 1e-9);
    }

    @Test
    @DisplayName("documentation task is added when the description mentions docs without a doc requirement")
    void documentationMentionAddsDocTask() {
        var spec = new Specification("Payments", "Ship it with docs", List.of("Implement refund endpoint"),
                List.of(), List.of());

        List<Task> tasks = decomposer.decompose(spec);

        Task docs = tasks.stream().filter(t -> t.type() == TaskType.DOCUMENTATION).findFirst().orElseThrow();
        assertEquals(List.of("docs/overview"), docs.outputArtifacts());
        assertEquals(List.of("impl/refund-endpoint"), docs.inputArtifacts());
    }

    @Test
    @DisplayName("duplicate slugs are made unique")
    void duplicateSlugsAreSuffixed() {
        var spec = new Specification(List.of("Implement login", "Implement login"), List.of());

        List<Task> tasks = decomposer.decompose(spec);

        assertEquals(List.of("impl/login"), tasks.get(0).outputArtifacts());
        assertEquals(List.of("impl/login-2"), tasks.get(2).outputArtifacts());
    }
}
