package com.reduction.config;

import com.reduction.core.ArchiveContext;
import com.reduction.core.ReductionEngine;
import com.reduction.core.ReductionOrchestrator;
import com.reduction.core.ReductionSet;
import com.reduction.core.cache.ArtifactCache;
import com.reduction.core.cache.FileArtifactCache;
import com.reduction.core.step.StepExecutors;
import com.reduction.metrics.Metrics;
import com.reduction.metrics.MetricsRecorder;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/** Wires an engine, its executors and its durable cache from {@link EngineSettings}. */
public final class ReductionEngineFactory {
    private final EngineSettings settings;
    private final ArtifactCache cache;
    private final MetricsRecorder metrics;

    public ReductionEngineFactory(EngineSettings settings) {
        this(settings, Metrics.recorder());
    }

    public ReductionEngineFactory(EngineSettings settings, MetricsRecorder metrics) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.cache = new FileArtifactCache(settings.cacheRoot());
    }

    public static ReductionEngineFactory fromFile(Path settingsFile) throws IOException {
        return new ReductionEngineFactory(EngineSettings.load(settingsFile));
    }

    public EngineSettings settings() {
        return settings;
    }

    public ArtifactCache cache() {
        return cache;
    }

    /** An engine over the definitions found at {@link EngineSettings#reductions()}. */
    public ReductionEngine create() throws IOException {
        return create(ReductionDefinitionLoader.load(settings.reductions()));
    }

    public ReductionEngine create(ReductionSet reductions) {
        StepExecutors executors = StepExecutors.defaults(settings.execTimeout());
        return new ReductionEngine(reductions, new ReductionOrchestrator(executors, metrics), settings.threads());
    }

    /** Context for an extracted archive, backed by this factory's cache. */
    public ArchiveContext archive(String archiveId, Path filesDir) {
        return ArchiveContext.of(archiveId, filesDir, cache);
    }
}
