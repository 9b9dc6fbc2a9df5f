package com.reduction.core.step;

import com.reduction.core.Level;

import java.util.Map;
import java.util.Objects;

/**
 * Wraps the source artifact into a conclusion.
 *
 * @param details placeholder name to detail key, for description tokens whose detail entry is
 *                published under another name; unbound placeholders use their own name
 */
public record AnalysisStep(Level level, String summary, String description, Map<String, String> details) implements Step {
    public AnalysisStep {
        level = Objects.requireNonNull(level, "level");
        summary = Objects.requireNonNull(summary, "summary");
        description = Objects.requireNonNull(description, "description");
        details = Map.copyOf(Objects.requireNonNull(details, "details"));
    }

    @Override
    public StepType type() {
        return StepType.ANALYSIS;
    }
}
