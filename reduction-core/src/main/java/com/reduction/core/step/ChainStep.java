package com.reduction.core.step;

import java.util.List;
import java.util.Objects;

/** Sub-steps piped in order; the first one reads the chain node's source. */
public record ChainStep(List<Step> steps) implements Step {
    public ChainStep {
        steps = List.copyOf(Objects.requireNonNull(steps, "steps"));
        if (steps.isEmpty()) throw new IllegalArgumentException("chain requires at least one entry");
        for (Step step : steps) {
            if (!step.type().consumesSource() || step.type() == StepType.ANALYSIS) {
                throw new IllegalArgumentException("chain entries cannot be of type '" + step.type().id() + "'");
            }
        }
    }

    @Override
    public StepType type() {
        return StepType.CHAIN;
    }
}
