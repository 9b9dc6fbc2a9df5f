package com.reduction.core;

import com.reduction.core.step.Step;
import com.reduction.core.step.StepType;

import java.util.Objects;

/**
 * One named unit of work. {@code source} names the upstream node whose artifact is the input;
 * it is null for {@code exec} nodes, which read the archive's files directory instead.
 */
public record ReductionNode(String name, String source, Step step) {
    public ReductionNode {
        name = Objects.requireNonNull(name, "name");
        step = Objects.requireNonNull(step, "step");
        if (name.isBlank()) throw new IllegalArgumentException("name must not be blank");
        if (step.type().consumesSource() && source == null) {
            throw new IllegalArgumentException("Reduction '" + name + "' of type '" + step.type().id() + "' requires a source");
        }
        if (!step.type().consumesSource() && source != null) {
            throw new IllegalArgumentException("Reduction '" + name + "' of type '" + step.type().id() + "' cannot have a source");
        }
    }

    public StepType type() {
        return step.type();
    }
}
