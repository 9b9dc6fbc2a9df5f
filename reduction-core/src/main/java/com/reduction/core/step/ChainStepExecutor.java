package com.reduction.core.step;

import com.reduction.core.ArchiveContext;
import com.reduction.core.StepExecutionException;
import com.reduction.core.cache.Artifact;

import java.util.List;
import java.util.Objects;

/** Pipes each entry's output into the next; the first failing entry fails the chain. */
public final class ChainStepExecutor implements StepExecutor<ChainStep> {
    private final StepExecutors executors;

    public ChainStepExecutor(StepExecutors executors) {
        this.executors = Objects.requireNonNull(executors, "executors");
    }

    @Override
    public Artifact execute(String nodeName, ChainStep step, Artifact input, ArchiveContext archive)
        throws StepExecutionException {
        List<Step> entries = step.steps();
        Artifact current = input;
        for (int i = 0; i < entries.size(); i++) {
            Step entry = entries.get(i);
            try {
                current = executors.execute(nodeName, entry, current, archive);
            } catch (StepExecutionException entryFailure) {
                throw new StepExecutionException(entryFailure.kind(),
                    "chain entry " + i + " (" + entry.type().id() + "): " + entryFailure.getMessage(), entryFailure);
            }
        }
        return current.withNode(nodeName);
    }
}
