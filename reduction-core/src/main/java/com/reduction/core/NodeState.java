package com.reduction.core;

/** Terminal state of one node in one run. */
public enum NodeState {
    SUCCESS,
    FAILED,
    SKIPPED_CACHED,
    SKIPPED_UPSTREAM_FAILED;

    public boolean producedArtifact() {
        return this == SUCCESS || this == SKIPPED_CACHED;
    }
}
