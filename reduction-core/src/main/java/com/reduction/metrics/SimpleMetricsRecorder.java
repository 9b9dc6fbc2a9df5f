package com.reduction.metrics;

import com.reduction.core.FailureKind;
import com.reduction.core.NodeState;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.Locale;
import java.util.concurrent.TimeUnit;

public final class SimpleMetricsRecorder implements MetricsRecorder {
    private final MeterRegistry registry;

    public SimpleMetricsRecorder() {
        this.registry = new SimpleMeterRegistry();
    }

    public SimpleMetricsRecorder(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void onNodeSuccess(String archiveId, String nodeName, long nanos) {
        Timer.builder(metric(archiveId, nodeName, "duration"))
                .register(registry)
                .record(nanos, TimeUnit.NANOSECONDS);
    }

    @Override
    public void onNodeFailure(String archiveId, String nodeName, FailureKind kind) {
        Counter.builder(metric(archiveId, nodeName, "errors"))
                .tag("kind", kind.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    @Override
    public void onNodeSkipped(String archiveId, String nodeName, NodeState state) {
        String name = state == NodeState.SKIPPED_CACHED ? "cache_hits" : "upstream_skips";
        Counter.builder(metric(archiveId, nodeName, name)).register(registry).increment();
    }

    @Override
    public void onRunComplete(String archiveId, long nanos) {
        Timer.builder("reduction." + archiveId + ".run.duration")
                .register(registry)
                .record(nanos, TimeUnit.NANOSECONDS);
    }

    @Override
    public MeterRegistry registry() {
        return registry;
    }

    private static String metric(String archiveId, String nodeName, String name) {
        return "reduction." + archiveId + ".node." + nodeName + "." + name;
    }
}
