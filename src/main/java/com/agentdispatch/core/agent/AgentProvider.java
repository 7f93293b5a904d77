package com.agentdispatch.core.agent;

import com.agentdispatch.core.model.TaskType;

import java.util.Set;

/**
 * Factory for one kind of agent. Providers are the unit of agent pluggability: external
 * implementations are registered by class name and need a public no-arg constructor.
 */
public interface AgentProvider {

    String name();

    Set<TaskType> capabilities();

    Agent create(String agentId);
}
