package com.reduction.core.step;

/** Type-specific parameters of a reduction node, one record per {@link StepType}. */
public sealed interface Step permits ExecStep, Yaml2JsonStep, JqStep, SplitLinesStep, ChainStep, AnalysisStep {
    StepType type();
}
