package com.agentdispatch.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for dispatch execution.
 */
@Service
public class DispatchMetrics {

    private final MeterRegistry registry;

    public DispatchMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordDecompositionDuration(String strategy, long ms) {
        Timer.builder("dispatch.decomposition.duration")
                .tag("strategy", strategy)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordResolutionDuration(long ms) {
        Timer.builder("dispatch.resolution.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordTaskDuration(String taskType, long ms) {
        Timer.builder("dispatch.task.duration")
                .tag("type", taskType)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * @param outcome terminal task status, lower-cased
     */
    public void recordTaskOutcome(String taskType, String outcome) {
        Counter.builder("dispatch.tasks.total")
                .tag("type", taskType)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordRetry(String taskType) {
        Counter.builder("dispatch.task.retries")
                .tag("type", taskType)
                .register(registry)
                .increment();
    }

    public void recordTimeout(String taskType) {
        Counter.builder("dispatch.task.timeouts")
                .tag("type", taskType)
                .register(registry)
                .increment();
    }

    public void recordSkips(int count) {
        Counter.builder("dispatch.tasks.skipped")
                .description("Tasks skipped because an upstream task failed or was cancelled")
                .register(registry)
                .increment(count);
    }

    /**
     * Records a degraded model-assisted step.
     *
     * @param stage "decomposition" or "refinement"
     */
    public void recordFallback(String stage) {
        Counter.builder("dispatch.model.fallbacks")
                .description("Model-assisted steps that fell back to the deterministic path")
                .tag("stage", stage)
                .register(registry)
                .increment();
    }

    public void recordEdgeRemoval(String provenance) {
        Counter.builder("dispatch.resolver.cycle_edge_removals")
                .tag("provenance", provenance)
                .register(registry)
                .increment();
    }

    public void recordBusDrop() {
        Counter.builder("dispatch.bus.dropped")
                .description("Messages dropped because a subscriber queue was full")
                .register(registry)
                .increment();
    }

    public void recordQueueDepth(int depth) {
        DistributionSummary.builder("dispatch.ready_queue.depth")
                .description("Ready-queue depth sampled once per scheduling tick")
                .register(registry)
                .record(depth);
    }

    public void recordPhaseWidth(int width) {
        DistributionSummary.builder("dispatch.graph.phase_width")
                .description("Number of tasks per execution phase")
                .register(registry)
                .record(width);
    }

    public void recordCheckpoint(long ms) {
        Timer.builder("dispatch.checkpoint.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordDispatchResult(String status, long ms) {
        Counter.builder("dispatch.sessions.total")
                .tag("status", status)
                .register(registry)
                .increment();
        Timer.builder("dispatch.latency")
                .tag("status", status)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }
}
