package com.reduction.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Severity of a conclusion, most severe first. */
public enum Level {
    CRITICAL,
    ERROR,
    WARNING,
    INFO,
    DEBUG;

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Level fromId(String id) {
        if (id == null) throw new IllegalArgumentException("level must not be null");
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        for (Level level : values()) {
            if (level.id().equals(normalized)) return level;
        }
        throw new IllegalArgumentException("invalid level: '" + id + "'");
    }
}
