package com.reduction.core;

public enum FailureKind {
    EXEC_FAILED,
    DECODE_FAILED,
    FILTER_FAILED,
    CANCELLED
}
