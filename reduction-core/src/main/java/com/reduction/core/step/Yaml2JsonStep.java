package com.reduction.core.step;

public record Yaml2JsonStep() implements Step {
    @Override
    public StepType type() {
        return StepType.YAML2JSON;
    }
}
