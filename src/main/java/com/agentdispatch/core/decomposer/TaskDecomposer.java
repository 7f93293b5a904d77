package com.agentdispatch.core.decomposer;

import com.agentdispatch.core.llm.ModelCalls;
import com.agentdispatch.core.metrics.DispatchMetrics;
import com.agentdispatch.core.model.Specification;
import com.agentdispatch.core.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Turns a specification into a validated, non-empty task list.
 * <p>
 * The model-assisted strategy is preferred when configured, but never load-bearing: a call
 * failure, a timeout, or output that is empty after validation falls back to the
 * {@link RuleBasedDecomposer}.
 */
public class TaskDecomposer {

    private static final Logger log = LoggerFactory.getLogger(TaskDecomposer.class);

    /**
     * Validated tasks plus the strategy that produced them.
     *
     * @param fallbackReason why the model path was abandoned; null if it was not tried or succeeded
     */
    public record Decomposition(List<Task> tasks, String strategy, String fallbackReason) {}

    private final RuleBasedDecomposer rules;
    private final DecompositionStrategy model;
    private final Duration modelTimeout;
    private final DispatchMetrics metrics;

    public TaskDecomposer(RuleBasedDecomposer rules) {
        this(rules, null, Duration.ofSeconds(60), null);
    }

    /**
     * @param model        model-assisted strategy; null disables the model path
     * @param modelTimeout upper bound on the model call
     * @param metrics      nullable
     */
    public TaskDecomposer(RuleBasedDecomposer rules, DecompositionStrategy model,
                          Duration modelTimeout, DispatchMetrics metrics) {
        this.rules = rules;
        this.model = model;
        this.modelTimeout = modelTimeout;
        this.metrics = metrics;
    }

    /**
     * @throws DecompositionException if the specification is null or empty, or no valid task survives
     */
    public List<Task> decompose(Specification spec) {
        return decomposeWithStrategy(spec).tasks();
    }

    public Decomposition decomposeWithStrategy(Specification spec) {
        if (spec == null || spec.isEmpty()) {
            throw new DecompositionException("Specification has no requirements or constraints");
        }
        long start = System.currentTimeMillis();
        String fallbackReason = null;

        if (model != null) {
            try {
                List<Task> tasks = TaskValidator.validate(callModel(spec));
                if (!tasks.isEmpty()) {
                    record(model.name(), start);
                    log.info("Decomposed specification into {} task(s) via {}", tasks.size(), model.name());
                    return new Decomposition(tasks, model.name(), null);
                }
                fallbackReason = "model output contained no valid task";
            } catch (RuntimeException e) {
                fallbackReason = describe(e);
            }
            log.warn("Model-assisted decomposition failed ({}); falling back to rules", fallbackReason);
            if (metrics != null) {
                metrics.recordFallback("decomposition");
            }
        }

        List<Task> tasks = TaskValidator.validate(rules.decompose(spec));
        if (tasks.isEmpty()) {
            throw new DecompositionException("Decomposition produced no valid task");
        }
        record(rules.name(), start);
        log.info("Decomposed specification into {} task(s) via {}", tasks.size(), rules.name());
        return new Decomposition(tasks, rules.name(), fallbackReason);
    }

    private List<Task> callModel(Specification spec) {
        try {
            return ModelCalls.callWithTimeout("decomposition", () -> model.decompose(spec), modelTimeout);
        } catch (TimeoutException e) {
            throw new DecompositionException("Model decomposition timed out after " + modelTimeout, e);
        }
    }

    private static String describe(RuntimeException e) {
        return e.getClass().getSimpleName() + ": " + e.getMessage();
    }

    private void record(String strategy, long start) {
        if (metrics != null) {
            metrics.recordDecompositionDuration(strategy, System.currentTimeMillis() - start);
        }
    }
}
