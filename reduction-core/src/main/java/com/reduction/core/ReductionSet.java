package com.reduction.core;

import com.reduction.core.step.StepType;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/** Validated, declaration-ordered mapping of node name to node. */
public final class ReductionSet {
    private final Map<String, ReductionNode> nodes;

    private ReductionSet(Map<String, ReductionNode> nodes) {
        this.nodes = Collections.unmodifiableMap(nodes);
    }

    public static ReductionSet of(Collection<ReductionNode> nodes) {
        Objects.requireNonNull(nodes, "nodes");
        Map<String, ReductionNode> byName = new LinkedHashMap<>();
        for (ReductionNode node : nodes) {
            Objects.requireNonNull(node, "node");
            if (byName.putIfAbsent(node.name(), node) != null) {
                throw new DefinitionException("Duplicate definition with name '" + node.name() + "'");
            }
        }
        return new ReductionSet(byName);
    }

    public static ReductionSet of(ReductionNode... nodes) {
        return of(List.of(nodes));
    }

    public Optional<ReductionNode> get(String name) {
        return Optional.ofNullable(nodes.get(name));
    }

    public boolean contains(String name) {
        return nodes.containsKey(name);
    }

    /** Nodes in declaration order. */
    public Collection<ReductionNode> nodes() {
        return nodes.values();
    }

    public List<String> names() {
        return List.copyOf(nodes.keySet());
    }

    public List<ReductionNode> analyses() {
        List<ReductionNode> analyses = new ArrayList<>();
        for (ReductionNode node : nodes.values()) {
            if (node.type() == StepType.ANALYSIS) analyses.add(node);
        }
        return analyses;
    }

    public int size() {
        return nodes.size();
    }
}
