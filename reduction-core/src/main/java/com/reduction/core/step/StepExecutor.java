package com.reduction.core.step;

import com.reduction.core.ArchiveContext;
import com.reduction.core.StepExecutionException;
import com.reduction.core.cache.Artifact;

/**
 * Executes one step type.
 *
 * @param <S> the step record this executor handles
 */
@FunctionalInterface
public interface StepExecutor<S extends Step> {
    /**
     * @param nodeName the node the produced artifact belongs to
     * @param input    the resolved source artifact, or null for steps without a source
     */
    Artifact execute(String nodeName, S step, Artifact input, ArchiveContext archive) throws StepExecutionException;
}
