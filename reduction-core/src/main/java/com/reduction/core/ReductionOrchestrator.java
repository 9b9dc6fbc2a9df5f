package com.reduction.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.reduction.core.cache.Artifact;
import com.reduction.core.cache.ArtifactCache;
import com.reduction.core.step.StepExecutors;
import com.reduction.core.step.StepType;
import com.reduction.metrics.Metrics;
import com.reduction.metrics.MetricsRecorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Evaluates a reduction set against one archive.
 *
 * <p>Nodes run in plan order. A node whose artifact is cached is not executed again unless the
 * run is forced; a failed node leaves a failure marker in the cache and every node reading from
 * it is skipped, losing whatever an earlier run cached for it. A failure never stops unrelated nodes. With a concurrency above one, a node is
 * submitted to a bounded pool once all its dependencies have reached a terminal state.
 */
public final class ReductionOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(ReductionOrchestrator.class);

    private final StepExecutors executors;
    private final MetricsRecorder metrics;

    public ReductionOrchestrator(StepExecutors executors) {
        this(executors, Metrics.recorder());
    }

    public ReductionOrchestrator(StepExecutors executors, MetricsRecorder metrics) {
        this.executors = Objects.requireNonNull(executors, "executors");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    public ReductionRun run(ArchiveContext archive, ReductionSet set, boolean force, int concurrency) {
        return run(archive, set, force, concurrency, List.of());
    }

    /**
     * @param nodeFilter nodes to evaluate along with their dependencies; empty evaluates all
     * @throws UnknownSourceException when a source or filtered name is unknown, before any node runs
     * @throws CycleException         when the set has a cycle, before any node runs
     */
    public ReductionRun run(ArchiveContext archive, ReductionSet set, boolean force, int concurrency,
                            Collection<String> nodeFilter) {
        Objects.requireNonNull(archive, "archive");
        Objects.requireNonNull(set, "set");
        EvaluationPlan plan = DependencyResolver.plan(set, nodeFilter == null ? List.of() : nodeFilter);

        log.info("Reducing archive={} nodes={} force={} concurrency={}", archive.archiveId(), plan.size(), force, concurrency);
        long t0 = System.nanoTime();
        Map<String, NodeOutcome> outcomes = new ConcurrentHashMap<>();
        Map<String, Artifact> produced = new ConcurrentHashMap<>();
        RunState state = new RunState(archive, set, force, outcomes, produced);

        if (concurrency <= 1 || plan.size() <= 1) {
            for (String name : plan.order()) evaluate(state, name);
        } else {
            runConcurrently(state, plan, concurrency);
        }

        List<NodeOutcome> ordered = new ArrayList<>(plan.size());
        for (String name : plan.order()) ordered.add(outcomes.get(name));
        List<Conclusion> conclusions = collectConclusions(set, produced);
        long totalNanos = System.nanoTime() - t0;
        metrics.onRunComplete(archive.archiveId(), totalNanos);

        ReductionRun run = new ReductionRun(archive.archiveId(), ordered, conclusions,
            Conclusions.levelCounts(conclusions), Conclusions.findings(conclusions), totalNanos);
        log.info("Reduced archive={} in {} ms: failed={} counts={}", archive.archiveId(), totalNanos / 1_000_000,
            ordered.stream().filter(NodeOutcome::failed).count(), run.levelCounts());
        return run;
    }

    private void runConcurrently(RunState state, EvaluationPlan plan, int concurrency) {
        AtomicInteger threadId = new AtomicInteger();
        String prefix = "reduction-" + state.archive.archiveId() + "-";
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(concurrency, plan.size()), r -> {
            Thread t = new Thread(r, prefix + threadId.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        try {
            Map<String, CompletableFuture<Void>> done = new ConcurrentHashMap<>();
            for (String name : plan.order()) {
                CompletableFuture<?>[] upstream = plan.dependenciesOf(name).stream()
                    .map(done::get)
                    .toArray(CompletableFuture[]::new);
                done.put(name, CompletableFuture.allOf(upstream).thenRunAsync(() -> evaluate(state, name), pool));
            }
            CompletableFuture.allOf(done.values().toArray(new CompletableFuture[0])).join();
        } finally {
            pool.shutdownNow();
        }
    }

    private void evaluate(RunState state, String name) {
        ReductionNode node = state.set.get(name).orElseThrow();
        String archiveId = state.archive.archiveId();
        NodeOutcome outcome;
        try {
            outcome = evaluateNode(state, node);
        } catch (RuntimeException unexpected) {
            log.warn("Reduction '{}' archive={} failed unexpectedly", name, archiveId, unexpected);
            String message = String.valueOf(unexpected.getMessage());
            writeCache(state.archive.cache(), archiveId, name, Artifact.failure(name, FailureKind.EXEC_FAILED, message));
            outcome = NodeOutcome.failed(name, FailureKind.EXEC_FAILED, message, 0L);
        }
        state.outcomes.put(name, outcome);

        switch (outcome.state()) {
            case SUCCESS -> metrics.onNodeSuccess(archiveId, name, outcome.elapsedNanos());
            case FAILED -> metrics.onNodeFailure(archiveId, name, outcome.failureKind());
            default -> metrics.onNodeSkipped(archiveId, name, outcome.state());
        }
    }

    private NodeOutcome evaluateNode(RunState state, ReductionNode node) {
        String name = node.name();
        String archiveId = state.archive.archiveId();
        ArtifactCache cache = state.archive.cache();

        Artifact input = null;
        if (node.source() != null) {
            NodeOutcome upstream = state.outcomes.get(node.source());
            input = state.produced.get(node.source());
            if (upstream == null || !upstream.state().producedArtifact() || input == null) {
                log.debug("Skipping '{}' archive={}: upstream '{}' did not succeed", name, archiveId, node.source());
                // An artifact left from an earlier run no longer derives from this run's inputs.
                invalidateCache(cache, archiveId, name);
                return NodeOutcome.upstreamFailed(name, node.source());
            }
        }

        if (!state.force) {
            Optional<Artifact> cached = readCache(cache, archiveId, name);
            if (cached.isPresent() && !cached.get().isFailure()) {
                log.debug("Reusing cached '{}' archive={}", name, archiveId);
                state.produced.put(name, cached.get());
                return NodeOutcome.cached(name);
            }
            cached.ifPresent(marker -> log.debug("Retrying '{}' archive={} after cached failure: {}", name, archiveId, marker.message()));
        }

        log.debug("Executing '{}' ({}) archive={}", name, node.type().id(), archiveId);
        long t0 = System.nanoTime();
        Artifact artifact;
        try {
            artifact = executors.execute(name, node.step(), input, state.archive);
        } catch (StepExecutionException stepError) {
            long elapsed = System.nanoTime() - t0;
            log.warn("Reduction '{}' archive={} failed ({}): {}", name, archiveId, stepError.kind(), stepError.getMessage());
            writeCache(cache, archiveId, name, Artifact.failure(name, stepError.kind(), stepError.getMessage()));
            return NodeOutcome.failed(name, stepError.kind(), stepError.getMessage(), elapsed);
        }
        long elapsed = System.nanoTime() - t0;
        state.produced.put(name, artifact);
        writeCache(cache, archiveId, name, artifact);
        log.debug("Finished '{}' archive={} in {} ms", name, archiveId, elapsed / 1_000_000);
        return NodeOutcome.success(name, elapsed);
    }

    private static Optional<Artifact> readCache(ArtifactCache cache, String archiveId, String name) {
        try {
            return cache.get(archiveId, name);
        } catch (IOException readError) {
            log.warn("Cannot read cached '{}' archive={}, recomputing: {}", name, archiveId, readError.getMessage());
            return Optional.empty();
        }
    }

    private static void writeCache(ArtifactCache cache, String archiveId, String name, Artifact artifact) {
        try {
            cache.put(archiveId, name, artifact);
        } catch (IOException writeError) {
            log.warn("Cannot cache '{}' archive={}: {}", name, archiveId, writeError.getMessage());
        }
    }

    private static void invalidateCache(ArtifactCache cache, String archiveId, String name) {
        try {
            cache.invalidate(archiveId, name);
        } catch (IOException deleteError) {
            log.warn("Cannot drop stale cached '{}' archive={}: {}", name, archiveId, deleteError.getMessage());
        }
    }

    private static List<Conclusion> collectConclusions(ReductionSet set, Map<String, Artifact> produced) {
        List<Conclusion> conclusions = new ArrayList<>();
        for (ReductionNode node : set.nodes()) {
            if (node.type() != StepType.ANALYSIS) continue;
            Artifact artifact = produced.get(node.name());
            if (artifact == null || !artifact.isValue()) continue;
            try {
                conclusions.add(Conclusions.fromValue(artifact.value()));
            } catch (JsonProcessingException unreadable) {
                log.warn("Artifact of '{}' is not a conclusion: {}", node.name(), unreadable.getOriginalMessage());
            }
        }
        return conclusions;
    }

    private static final class RunState {
        final ArchiveContext archive;
        final ReductionSet set;
        final boolean force;
        final Map<String, NodeOutcome> outcomes;
        final Map<String, Artifact> produced;

        RunState(ArchiveContext archive, ReductionSet set, boolean force,
                 Map<String, NodeOutcome> outcomes, Map<String, Artifact> produced) {
            this.archive = archive;
            this.set = set;
            this.force = force;
            this.outcomes = outcomes;
            this.produced = produced;
        }
    }
}
