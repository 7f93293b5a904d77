package com.agentdispatch.core.resolver;

import com.agentdispatch.core.model.DependencyEdge;
import com.agentdispatch.core.model.DependencyKind;
import com.agentdispatch.core.model.Task;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * B consumes an artifact A produces: A -> B, DATA, confidence 1.0.
 */
public class ArtifactRule implements DependencyRule {

    public static final String NAME = "artifact";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<DependencyEdge> apply(List<Task> tasks) {
        Map<String, List<String>> producers = new LinkedHashMap<>();
        for (Task task : tasks) {
            for (String output : task.outputArtifacts()) {
                producers.computeIfAbsent(output, k -> new ArrayList<>()).add(task.id());
            }
        }
        var edges = new ArrayList<DependencyEdge>();
        for (Task consumer : tasks) {
            for (String input : consumer.inputArtifacts()) {
                for (String producer : producers.getOrDefault(input, List.of())) {
                    if (!producer.equals(consumer.id())) {
                        edges.add(DependencyEdge.rule(producer, consumer.id(), DependencyKind.DATA, 1.0,
                                "consumes " + input));
                    }
                }
            }
        }
        return edges;
    }
}
