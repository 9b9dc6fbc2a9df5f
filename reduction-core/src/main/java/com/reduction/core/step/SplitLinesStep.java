package com.reduction.core.step;

public record SplitLinesStep() implements Step {
    @Override
    public StepType type() {
        return StepType.SPLITLINES;
    }
}
