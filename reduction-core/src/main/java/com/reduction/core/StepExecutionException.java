package com.reduction.core;

import java.util.Objects;

/** A step failed for one node; never escapes the orchestrator. */
public class StepExecutionException extends Exception {
    private final FailureKind kind;

    public StepExecutionException(FailureKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public StepExecutionException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public FailureKind kind() {
        return kind;
    }
}
