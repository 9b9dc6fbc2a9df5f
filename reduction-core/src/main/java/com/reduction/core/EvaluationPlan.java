package com.reduction.core;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Evaluation order of a reduction set. Every node appears after all of its dependencies.
 *
 * @param dependencies node name to the names it reads from
 * @param dependents   node name to the names reading from it
 */
public record EvaluationPlan(
    List<String> order,
    Map<String, List<String>> dependencies,
    Map<String, List<String>> dependents
) {
    public EvaluationPlan {
        order = List.copyOf(Objects.requireNonNull(order, "order"));
        dependencies = Map.copyOf(Objects.requireNonNull(dependencies, "dependencies"));
        dependents = Map.copyOf(Objects.requireNonNull(dependents, "dependents"));
    }

    public List<String> dependenciesOf(String node) {
        return dependencies.getOrDefault(node, List.of());
    }

    public List<String> dependentsOf(String node) {
        return dependents.getOrDefault(node, List.of());
    }

    public int size() {
        return order.size();
    }
}
