package com.reduction.core;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * Orders the nodes of a reduction set so that each one follows its source.
 *
 * <p>Among nodes that are ready at the same time, the one declared first goes first, so the
 * same set always produces the same order.
 */
public final class DependencyResolver {
    private DependencyResolver() {}

    public static EvaluationPlan plan(ReductionSet set) {
        return plan(set, List.of());
    }

    /**
     * Plans {@code targets} and everything they transitively read from; an empty collection plans
     * the whole set.
     *
     * @throws UnknownSourceException when a source or target names no node of the set
     * @throws CycleException        when sources form a loop
     */
    public static EvaluationPlan plan(ReductionSet set, Collection<String> targets) {
        for (ReductionNode node : set.nodes()) {
            if (node.source() != null && !set.contains(node.source())) {
                throw new UnknownSourceException(node.name(), node.source());
            }
        }
        for (String target : targets) {
            if (!set.contains(target)) throw new UnknownSourceException(null, target);
        }

        Set<String> included = targets.isEmpty() ? new HashSet<>(set.names()) : closure(set, targets);
        Map<String, Integer> declared = new HashMap<>();
        Map<String, List<String>> dependencies = new LinkedHashMap<>();
        Map<String, List<String>> dependents = new LinkedHashMap<>();
        for (ReductionNode node : set.nodes()) {
            if (!included.contains(node.name())) continue;
            declared.put(node.name(), declared.size());
            dependencies.put(node.name(), new ArrayList<>());
            dependents.put(node.name(), new ArrayList<>());
        }
        for (ReductionNode node : set.nodes()) {
            if (!included.contains(node.name()) || node.source() == null) continue;
            dependencies.get(node.name()).add(node.source());
            dependents.get(node.source()).add(node.name());
        }

        Map<String, Integer> pending = new HashMap<>();
        PriorityQueue<String> ready = new PriorityQueue<>((a, b) -> Integer.compare(declared.get(a), declared.get(b)));
        for (Map.Entry<String, List<String>> entry : dependencies.entrySet()) {
            pending.put(entry.getKey(), entry.getValue().size());
            if (entry.getValue().isEmpty()) ready.add(entry.getKey());
        }
        List<String> order = new ArrayList<>(declared.size());
        while (!ready.isEmpty()) {
            String next = ready.poll();
            order.add(next);
            for (String dependent : dependents.get(next)) {
                if (pending.merge(dependent, -1, Integer::sum) == 0) ready.add(dependent);
            }
        }
        if (order.size() < declared.size()) {
            throw new CycleException(findCycle(set, pending));
        }
        return new EvaluationPlan(order, dependencies, dependents);
    }

    private static Set<String> closure(ReductionSet set, Collection<String> targets) {
        Set<String> included = new LinkedHashSet<>();
        Deque<String> todo = new ArrayDeque<>(targets);
        while (!todo.isEmpty()) {
            String name = todo.pop();
            if (!included.add(name)) continue;
            String source = set.get(name).map(ReductionNode::source).orElse(null);
            if (source != null) todo.push(source);
        }
        return included;
    }

    // Every unplaced node has one source, so following sources from any of them reaches a loop.
    private static List<String> findCycle(ReductionSet set, Map<String, Integer> pending) {
        String start = null;
        for (ReductionNode node : set.nodes()) {
            Integer left = pending.get(node.name());
            if (left != null && left > 0) {
                start = node.name();
                break;
            }
        }
        List<String> path = new ArrayList<>();
        Map<String, Integer> position = new HashMap<>();
        String current = start;
        while (current != null && !position.containsKey(current)) {
            position.put(current, path.size());
            path.add(current);
            current = set.get(current).map(ReductionNode::source).orElse(null);
        }
        List<String> loop = current == null ? path : path.subList(position.get(current), path.size());
        // Report in edge order, a node before the node it feeds.
        List<String> cycle = new ArrayList<>(loop);
        Collections.reverse(cycle);
        return cycle;
    }
}
