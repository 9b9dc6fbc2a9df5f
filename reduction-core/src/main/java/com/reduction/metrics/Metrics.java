package com.reduction.metrics;

import java.util.Objects;

/** Process-wide recorder picked up by orchestrators and factories built without one. */
public final class Metrics {
    private static volatile MetricsRecorder recorder = new SimpleMetricsRecorder();

    private Metrics() {}

    public static MetricsRecorder recorder() {
        return recorder;
    }

    public static void setRecorder(MetricsRecorder r) {
        recorder = Objects.requireNonNull(r, "recorder");
    }
}
