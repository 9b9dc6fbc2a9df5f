package com.reduction.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.reduction.core.cache.Artifact;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Entry point for callers that reduce archives with one loaded reduction set: runs the set and
 * reads back the conclusions a previous run left in the archive's cache.
 */
public final class ReductionEngine {
    private static final Logger log = LoggerFactory.getLogger(ReductionEngine.class);

    private final ReductionSet reductions;
    private final ReductionOrchestrator orchestrator;
    private final int defaultThreads;

    public ReductionEngine(ReductionSet reductions, ReductionOrchestrator orchestrator) {
        this(reductions, orchestrator, 1);
    }

    public ReductionEngine(ReductionSet reductions, ReductionOrchestrator orchestrator, int defaultThreads) {
        this.reductions = Objects.requireNonNull(reductions, "reductions");
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
        if (defaultThreads < 1) throw new IllegalArgumentException("defaultThreads must be >= 1");
        this.defaultThreads = defaultThreads;
    }

    public ReductionSet reductions() {
        return reductions;
    }

    public ReductionRun run(ArchiveContext archive) {
        return run(archive, false, defaultThreads, List.of());
    }

    public ReductionRun run(ArchiveContext archive, boolean force, int threads, Collection<String> nodeFilter) {
        return orchestrator.run(archive, reductions, force, threads, nodeFilter);
    }

    /** Conclusions cached for {@code archive}, in declaration order; analyses never run are left out. */
    public List<Conclusion> conclusions(ArchiveContext archive) {
        List<Conclusion> conclusions = new ArrayList<>();
        for (ReductionNode node : reductions.analyses()) {
            read(archive, node.name()).ifPresent(conclusions::add);
        }
        return conclusions;
    }

    public Map<Level, Integer> levelCounts(ArchiveContext archive) {
        return Conclusions.levelCounts(conclusions(archive));
    }

    private static Optional<Conclusion> read(ArchiveContext archive, String name) {
        Optional<Artifact> artifact;
        try {
            artifact = archive.cache().get(archive.archiveId(), name);
        } catch (IOException readError) {
            log.warn("Cannot read conclusion '{}' archive={}: {}", name, archive.archiveId(), readError.getMessage());
            return Optional.empty();
        }
        if (artifact.isEmpty() || !artifact.get().isValue()) return Optional.empty();
        try {
            return Optional.of(Conclusions.fromValue(artifact.get().value()));
        } catch (JsonProcessingException unreadable) {
            log.warn("Cached '{}' archive={} is not a conclusion: {}", name, archive.archiveId(), unreadable.getOriginalMessage());
            return Optional.empty();
        }
    }
}
