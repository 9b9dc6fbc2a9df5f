package com.reduction.metrics;

import com.reduction.core.FailureKind;
import com.reduction.core.NodeState;
import io.micrometer.core.instrument.MeterRegistry;

public interface MetricsRecorder {
    void onNodeSuccess(String archiveId, String nodeName, long nanos);
    void onNodeFailure(String archiveId, String nodeName, FailureKind kind);
    void onNodeSkipped(String archiveId, String nodeName, NodeState state);
    void onRunComplete(String archiveId, long nanos);
    MeterRegistry registry();
}
