package com.reduction.core;

/** One result entry of an abnormal conclusion, flattened for listings. */
public record Finding(String conclusion, Level level, String summary, String text) {}
