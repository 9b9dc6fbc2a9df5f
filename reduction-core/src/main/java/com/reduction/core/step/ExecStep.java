package com.reduction.core.step;

import java.util.List;
import java.util.Objects;

/**
 * Runs {@code command} with {@code params}; both may carry {@code {filesdir}}, {@code {workdir}} and
 * {@code {archive}} placeholders.
 */
public record ExecStep(String command, List<String> params) implements Step {
    public ExecStep {
        command = Objects.requireNonNull(command, "command");
        if (command.isBlank()) throw new IllegalArgumentException("command must not be blank");
        params = List.copyOf(Objects.requireNonNull(params, "params"));
    }

    @Override
    public StepType type() {
        return StepType.EXEC;
    }
}
