package com.agentdispatch.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Engine configuration bound from {@code dispatcher.*}.
 */
@Component
@ConfigurationProperties(prefix = "dispatcher")
public class DispatcherProperties {

    private int maxConcurrentAgents = 4;
    /** Upper bound on attempts per task, the first one included. */
    private int maxRetries = 3;
    private Duration taskTimeoutDefault = Duration.ofMinutes(5);
    private double dependencyConfidenceThreshold = 0.6;
    private int checkpointIntervalSeconds = 30;
    private int agentPoolSizePerType = 2;
    private Duration tickInterval = Duration.ofMillis(100);
    private Duration cancelGracePeriod = Duration.ofSeconds(30);
    private Duration agentAcquireTimeout = Duration.ofSeconds(60);
    private Duration retryBackoffBase = Duration.ofSeconds(1);
    private Duration retryBackoffMax = Duration.ofSeconds(30);
    private int checkpointRetention = 10;
    /** Estimated duration of one unit of task complexity. */
    private Duration durationUnit = Duration.ofMinutes(1);

    private Bus bus = new Bus();
    private Llm llm = new Llm();
    private Plugins plugins = new Plugins();

    public int getMaxConcurrentAgents() { return maxConcurrentAgents; }
    public void setMaxConcurrentAgents(int maxConcurrentAgents) { this.maxConcurrentAgents = maxConcurrentAgents; }
    public int getMaxRetries() { return maxRetries; }
    public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
    public Duration getTaskTimeoutDefault() { return taskTimeoutDefault; }
    public void setTaskTimeoutDefault(Duration taskTimeoutDefault) { this.taskTimeoutDefault = taskTimeoutDefault; }
    public double getDependencyConfidenceThreshold() { return dependencyConfidenceThreshold; }
    public void setDependencyConfidenceThreshold(double threshold) { this.dependencyConfidenceThreshold = threshold; }
    public int getCheckpointIntervalSeconds() { return checkpointIntervalSeconds; }
    public void setCheckpointIntervalSeconds(int checkpointIntervalSeconds) { this.checkpointIntervalSeconds = checkpointIntervalSeconds; }
    public int getAgentPoolSizePerType() { return agentPoolSizePerType; }
    public void setAgentPoolSizePerType(int agentPoolSizePerType) { this.agentPoolSizePerType = agentPoolSizePerType; }
    public Duration getTickInterval() { return tickInterval; }
    public void setTickInterval(Duration tickInterval) { this.tickInterval = tickInterval; }
    public Duration getCancelGracePeriod() { return cancelGracePeriod; }
    public void setCancelGracePeriod(Duration cancelGracePeriod) { this.cancelGracePeriod = cancelGracePeriod; }
    public Duration getAgentAcquireTimeout() { return agentAcquireTimeout; }
    public void setAgentAcquireTimeout(Duration agentAcquireTimeout) { this.agentAcquireTimeout = agentAcquireTimeout; }
    public Duration getRetryBackoffBase() { return retryBackoffBase; }
    public void setRetryBackoffBase(Duration retryBackoffBase) { this.retryBackoffBase = retryBackoffBase; }
    public Duration getRetryBackoffMax() { return retryBackoffMax; }
    public void setRetryBackoffMax(Duration retryBackoffMax) { this.retryBackoffMax = retryBackoffMax; }
    public int getCheckpointRetention() { return checkpointRetention; }
    public void setCheckpointRetention(int checkpointRetention) { this.checkpointRetention = checkpointRetention; }
    public Duration getDurationUnit() { return durationUnit; }
    public void setDurationUnit(Duration durationUnit) { this.durationUnit = durationUnit; }

    /** Complexity weight used by the execution graph, in seconds per unit. */
    public double durationUnitSeconds() {
        return durationUnit.toMillis() / 1000.0;
    }

    public Bus getBus() { return bus; }
    public void setBus(Bus bus) { this.bus = bus; }
    public Llm getLlm() { return llm; }
    public void setLlm(Llm llm) { this.llm = llm; }
    public Plugins getPlugins() { return plugins; }
    public void setPlugins(Plugins plugins) { this.plugins = plugins; }

    public static class Bus {
        private int queueBound = 1024;
        private int historySize = 1000;
        private int maxDeliveryAttempts = 3;

        public int getQueueBound() { return queueBound; }
        public void setQueueBound(int queueBound) { this.queueBound = queueBound; }
        public int getHistorySize() { return historySize; }
        public void setHistorySize(int historySize) { this.historySize = historySize; }
        public int getMaxDeliveryAttempts() { return maxDeliveryAttempts; }
        public void setMaxDeliveryAttempts(int maxDeliveryAttempts) { this.maxDeliveryAttempts = maxDeliveryAttempts; }
    }

    public static class Llm {
        private boolean enabled = false;
        private Duration timeout = Duration.ofSeconds(60);

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
    }

    /**
     * External plugins, name to fully-qualified class name.
     */
    public static class Plugins {
        private Map<String, String> agents = new LinkedHashMap<>();
        private Map<String, String> rules = new LinkedHashMap<>();

        public Map<String, String> getAgents() { return agents; }
        public void setAgents(Map<String, String> agents) { this.agents = agents; }
        public Map<String, String> getRules() { return rules; }
        public void setRules(Map<String, String> rules) { this.rules = rules; }
    }
}
