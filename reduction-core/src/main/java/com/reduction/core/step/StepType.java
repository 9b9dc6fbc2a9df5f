package com.reduction.core.step;

import java.util.Locale;
import java.util.Optional;

public enum StepType {
    EXEC("exec"),
    YAML2JSON("yaml2json"),
    JQ("jq"),
    SPLITLINES("splitlines"),
    CHAIN("chain"),
    ANALYSIS("analysis");

    private final String id;

    StepType(String id) {
        this.id = id;
    }

    /** The value of the {@code type} field in a reduction definition. */
    public String id() {
        return id;
    }

    public static Optional<StepType> fromId(String id) {
        if (id == null) return Optional.empty();
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        for (StepType type : values()) {
            if (type.id.equals(normalized)) return Optional.of(type);
        }
        return Optional.empty();
    }

    /** Whether a node of this type reads an upstream artifact through {@code source}. */
    public boolean consumesSource() {
        return this != EXEC;
    }
}
