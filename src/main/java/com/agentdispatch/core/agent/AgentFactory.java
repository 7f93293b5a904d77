package com.agentdispatch.core.agent;

import com.agentdispatch.core.model.TaskType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Creates agents on demand from the registered providers.
 * <p>
 * Providers are consulted most-specialized first (smallest capability set), registration
 * order breaking ties, so a dedicated provider wins over the generic one for its types.
 */
public class AgentFactory {

    private static final Logger log = LoggerFactory.getLogger(AgentFactory.class);

    private final List<AgentProvider> providers;
    private final AtomicInteger sequence = new AtomicInteger();

    public AgentFactory(Collection<? extends AgentProvider> providers) {
        var sorted = new ArrayList<AgentProvider>(providers);
        sorted.sort(Comparator.comparingInt(p -> p.capabilities().size()));
        this.providers = List.copyOf(sorted);
        log.info("Agent factory initialized with providers {}",
                this.providers.stream().map(AgentProvider::name).toList());
    }

    public List<AgentProvider> providers() {
        return providers;
    }

    public List<AgentProvider> providersFor(TaskType type) {
        return providers.stream().filter(p -> p.capabilities().contains(type)).toList();
    }

    public boolean supports(TaskType type) {
        return providers.stream().anyMatch(p -> p.capabilities().contains(type));
    }

    public Agent create(AgentProvider provider) {
        String id = provider.name() + "-" + sequence.incrementAndGet();
        Agent agent = provider.create(id);
        log.debug("Created agent {} with capabilities {}", id, agent.capabilities());
        return agent;
    }
}
