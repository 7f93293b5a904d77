package com.agentdispatch.core.resolver;

import com.agentdispatch.core.model.DependencyEdge;
import com.agentdispatch.core.model.Task;

import java.util.List;

/**
 * Optional second opinion on the rule-derived edges.
 */
public interface DependencyRefiner {

    DependencyProposals propose(List<Task> tasks, List<DependencyEdge> ruleEdges);
}
