package com.agentdispatch.core.resolver;

import com.agentdispatch.core.model.DependencyEdge;
import com.agentdispatch.core.model.DependencyKind;
import com.agentdispatch.core.model.Task;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tasks writing the same artifact are serialized in list order: RESOURCE, confidence 0.9.
 */
public class ResourceContentionRule implements DependencyRule {

    public static final String NAME = "resource-contention";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<DependencyEdge> apply(List<Task> tasks) {
        Map<String, List<String>> writers = new LinkedHashMap<>();
        for (Task task : tasks) {
            for (String output : task.outputArtifacts()) {
                List<String> ids = writers.computeIfAbsent(output, k -> new ArrayList<>());
                if (!ids.contains(task.id())) {
                    ids.add(task.id());
                }
            }
        }
        var edges = new ArrayList<DependencyEdge>();
        writers.forEach((artifact, ids) -> {
            for (int i = 1; i < ids.size(); i++) {
                edges.add(DependencyEdge.rule(ids.get(i - 1), ids.get(i), DependencyKind.RESOURCE, 0.9,
                        "both write " + artifact));
            }
        });
        return edges;
    }
}
