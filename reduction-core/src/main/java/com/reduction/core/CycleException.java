package com.reduction.core;

import java.util.List;

public final class CycleException extends DefinitionException {
    private final List<String> nodes;

    public CycleException(List<String> nodes) {
        super("Cycle detected between reductions: " + String.join(" -> ", nodes) + " -> " + nodes.get(0));
        this.nodes = List.copyOf(nodes);
    }

    /** The nodes participating in the cycle, in edge order. */
    public List<String> nodes() {
        return nodes;
    }
}
