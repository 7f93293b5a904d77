package com.agentdispatch.core.config;

import com.agentdispatch.core.agent.AgentFactory;
import com.agentdispatch.core.agent.AgentProvider;
import com.agentdispatch.core.agent.GenericAgent;
import com.agentdispatch.core.agent.LlmAgent;
import com.agentdispatch.core.decomposer.ModelAssistedDecomposer;
import com.agentdispatch.core.decomposer.RuleBasedDecomposer;
import com.agentdispatch.core.decomposer.TaskDecomposer;
import com.agentdispatch.core.events.MessageBus;
import com.agentdispatch.core.llm.LanguageModelClient;
import com.agentdispatch.core.llm.LlmService;
import com.agentdispatch.core.metrics.DispatchMetrics;
import com.agentdispatch.core.plugin.PluginRegistry;
import com.agentdispatch.core.resolver.ArtifactRule;
import com.agentdispatch.core.resolver.DependencyResolver;
import com.agentdispatch.core.resolver.DependencyRule;
import com.agentdispatch.core.resolver.ModelDependencyRefiner;
import com.agentdispatch.core.resolver.ResourceContentionRule;
import com.agentdispatch.core.resolver.TypeOrderingRule;
import com.agentdispatch.core.resolver.WorkflowPatternRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the engine components from {@link DispatcherProperties}.
 * <p>
 * Model-assisted decomposition, dependency refinement and the LLM agent are only present
 * when {@code dispatcher.llm.enabled=true}; otherwise every path is deterministic.
 * Plugin agents and rules named under {@code dispatcher.plugins} are loaded once here.
 */
@Configuration
public class DispatchConfig {

    private static final Logger log = LoggerFactory.getLogger(DispatchConfig.class);

    @Bean
    @ConditionalOnProperty(prefix = "dispatcher.llm", name = "enabled", havingValue = "true")
    public LanguageModelClient languageModelClient(ChatClient.Builder builder,
                                                   @Value("${spring.ai.openai.base-url:NOT_SET}") String baseUrl) {
        return new LlmService(builder, baseUrl);
    }

    @Bean
    public PluginRegistry<AgentProvider> agentProviderRegistry(DispatcherProperties properties,
                                                              ObjectProvider<LanguageModelClient> llm) {
        var registry = new PluginRegistry<>("agent", AgentProvider.class);
        registry.register(GenericAgent.KIND, GenericAgent.Provider::new);
        llm.ifAvailable(client -> registry.register(LlmAgent.KIND, () -> new LlmAgent.Provider(client)));
        registry.loadAll(properties.getPlugins().getAgents());
        return registry;
    }

    @Bean
    public PluginRegistry<DependencyRule> dependencyRuleRegistry(DispatcherProperties properties) {
        var registry = new PluginRegistry<>("rule", DependencyRule.class);
        registry.register(ArtifactRule.NAME, ArtifactRule::new);
        registry.register(TypeOrderingRule.NAME, TypeOrderingRule::new);
        registry.register(ResourceContentionRule.NAME, ResourceContentionRule::new);
        registry.register(WorkflowPatternRule.NAME, WorkflowPatternRule::new);
        registry.loadAll(properties.getPlugins().getRules());
        return registry;
    }

    @Bean
    public AgentFactory agentFactory(PluginRegistry<AgentProvider> agentProviderRegistry) {
        return new AgentFactory(agentProviderRegistry.createAll());
    }

    @Bean
    public MessageBus messageBus(DispatcherProperties properties, DispatchMetrics metrics) {
        var busProperties = properties.getBus();
        var bus = new MessageBus(busProperties.getQueueBound(), busProperties.getHistorySize(),
                busProperties.getMaxDeliveryAttempts());
        bus.onDrop(topic -> metrics.recordBusDrop());
        return bus;
    }

    @Bean
    public TaskDecomposer taskDecomposer(DispatcherProperties properties, ObjectProvider<LanguageModelClient> llm,
                                         DispatchMetrics metrics) {
        LanguageModelClient client = llm.getIfAvailable();
        var model = client == null ? null : new ModelAssistedDecomposer(client);
        log.info("Task decomposition: {}", model == null ? "rule-based" : "model-assisted with rule-based fallback");
        return new TaskDecomposer(new RuleBasedDecomposer(), model, properties.getLlm().getTimeout(), metrics);
    }

    @Bean
    public DependencyResolver dependencyResolver(PluginRegistry<DependencyRule> dependencyRuleRegistry,
                                                 DispatcherProperties properties,
                                                 ObjectProvider<LanguageModelClient> llm,
                                                 DispatchMetrics metrics) {
        LanguageModelClient client = llm.getIfAvailable();
        var refiner = client == null ? null : new ModelDependencyRefiner(client);
        return new DependencyResolver(dependencyRuleRegistry.createAll(), refiner,
                properties.getDependencyConfidenceThreshold(), properties.getLlm().getTimeout(), metrics);
    }
}
