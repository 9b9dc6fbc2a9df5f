package com.reduction.core;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of reducing one archive.
 *
 * @param outcomes    every planned node, in evaluation order
 * @param conclusions conclusions produced or reused by this run, in declaration order
 * @param levelCounts result entries of abnormal conclusions per level
 */
public record ReductionRun(
    String archiveId,
    List<NodeOutcome> outcomes,
    List<Conclusion> conclusions,
    Map<Level, Integer> levelCounts,
    List<Finding> findings,
    long totalNanos
) {
    public ReductionRun {
        archiveId = Objects.requireNonNull(archiveId, "archiveId");
        outcomes = List.copyOf(Objects.requireNonNull(outcomes, "outcomes"));
        conclusions = List.copyOf(Objects.requireNonNull(conclusions, "conclusions"));
        Map<Level, Integer> counts = new EnumMap<>(Level.class);
        counts.putAll(Objects.requireNonNull(levelCounts, "levelCounts"));
        levelCounts = Collections.unmodifiableMap(counts);
        findings = List.copyOf(Objects.requireNonNull(findings, "findings"));
    }

    public Optional<NodeOutcome> outcome(String name) {
        for (NodeOutcome outcome : outcomes) {
            if (outcome.name().equals(name)) return Optional.of(outcome);
        }
        return Optional.empty();
    }

    /** State of {@code name}; fails when the node was not part of this run. */
    public NodeState state(String name) {
        return outcome(name)
            .map(NodeOutcome::state)
            .orElseThrow(() -> new IllegalArgumentException("Node '" + name + "' was not part of this run"));
    }

    public Optional<Conclusion> conclusion(String name) {
        return conclusions.stream().filter(c -> c.name().equals(name)).findFirst();
    }

    public int count(Level level) {
        return levelCounts.getOrDefault(level, 0);
    }

    public boolean hasFailures() {
        return outcomes.stream().anyMatch(NodeOutcome::failed);
    }
}
