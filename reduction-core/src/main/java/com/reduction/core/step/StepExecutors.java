package com.reduction.core.step;

import com.reduction.core.ArchiveContext;
import com.reduction.core.StepExecutionException;
import com.reduction.core.cache.Artifact;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/** Executor per step type. */
public final class StepExecutors {
    private final Map<StepType, StepExecutor<?>> executors = new ConcurrentHashMap<>();

    /** A registry holding the built-in executor of every step type. */
    public static StepExecutors defaults(Duration execTimeout) {
        StepExecutors registry = new StepExecutors();
        registry.register(StepType.EXEC, new ExecStepExecutor(execTimeout));
        registry.register(StepType.YAML2JSON, new Yaml2JsonStepExecutor());
        registry.register(StepType.JQ, new JqStepExecutor());
        registry.register(StepType.SPLITLINES, new SplitLinesStepExecutor());
        registry.register(StepType.CHAIN, new ChainStepExecutor(registry));
        registry.register(StepType.ANALYSIS, new AnalysisStepExecutor());
        return registry;
    }

    public static StepExecutors defaults() {
        return defaults(Duration.ZERO);
    }

    /** Replaces the executor for {@code type}. */
    public <S extends Step> void register(StepType type, StepExecutor<S> executor) {
        executors.put(Objects.requireNonNull(type, "type"), Objects.requireNonNull(executor, "executor"));
    }

    public boolean has(StepType type) {
        return executors.containsKey(type);
    }

    public StepExecutor<?> get(StepType type) {
        StepExecutor<?> executor = executors.get(type);
        if (executor == null) throw new IllegalArgumentException("No executor registered for step type: " + type.id());
        return executor;
    }

    public Artifact execute(String nodeName, Step step, Artifact input, ArchiveContext archive)
        throws StepExecutionException {
        @SuppressWarnings("unchecked") StepExecutor<Step> executor = (StepExecutor<Step>) get(step.type());
        return executor.execute(nodeName, step, input, archive);
    }
}
