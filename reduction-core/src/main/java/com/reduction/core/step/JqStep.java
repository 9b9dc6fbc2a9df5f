package com.reduction.core.step;

import com.reduction.core.jq.JqFilter;

import java.util.Objects;

public record JqStep(JqFilter filter) implements Step {
    public JqStep {
        filter = Objects.requireNonNull(filter, "filter");
    }

    @Override
    public StepType type() {
        return StepType.JQ;
    }
}
