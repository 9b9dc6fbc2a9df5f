package com.reduction.core;

import java.util.Objects;

/**
 * Terminal state of one node in one run.
 *
 * @param failureKind set only for {@link NodeState#FAILED}
 * @param message     failure reason, or the failed upstream node for skipped dependents
 */
public record NodeOutcome(
    String name,
    NodeState state,
    FailureKind failureKind,
    String message,
    long elapsedNanos
) {
    public NodeOutcome {
        name = Objects.requireNonNull(name, "name");
        state = Objects.requireNonNull(state, "state");
        if (state == NodeState.FAILED && failureKind == null) {
            throw new IllegalArgumentException("failed outcome of '" + name + "' requires a failure kind");
        }
        message = message == null ? "" : message;
    }

    public static NodeOutcome success(String name, long elapsedNanos) {
        return new NodeOutcome(name, NodeState.SUCCESS, null, "", elapsedNanos);
    }

    public static NodeOutcome cached(String name) {
        return new NodeOutcome(name, NodeState.SKIPPED_CACHED, null, "", 0L);
    }

    public static NodeOutcome failed(String name, FailureKind kind, String message, long elapsedNanos) {
        return new NodeOutcome(name, NodeState.FAILED, kind, message, elapsedNanos);
    }

    public static NodeOutcome upstreamFailed(String name, String upstream) {
        return new NodeOutcome(name, NodeState.SKIPPED_UPSTREAM_FAILED, null, "upstream '" + upstream + "' did not succeed", 0L);
    }

    public boolean failed() {
        return state == NodeState.FAILED;
    }
}
