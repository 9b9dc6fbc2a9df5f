package com.reduction.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Objects;

/**
 * Engine configuration.
 *
 * @param cacheRoot   directory holding one artifact directory per archive
 * @param threads     default worker count for a run
 * @param execTimeout limit for one external command; zero waits indefinitely
 * @param reductions  definition file, or directory of definition files
 */
public record EngineSettings(Path cacheRoot, int threads, Duration execTimeout, Path reductions) {
    private static final ObjectMapper OBJECT_MAPPER = new YAMLMapper();

    public static final Duration DEFAULT_EXEC_TIMEOUT = Duration.ofMinutes(10);

    public EngineSettings {
        cacheRoot = Objects.requireNonNull(cacheRoot, "cacheRoot");
        execTimeout = Objects.requireNonNull(execTimeout, "execTimeout");
        reductions = Objects.requireNonNull(reductions, "reductions");
        if (threads < 1) throw new IllegalArgumentException("threads must be >= 1");
        if (execTimeout.isNegative()) throw new IllegalArgumentException("execTimeout must not be negative");
    }

    public static EngineSettings defaults() {
        return new EngineSettings(
            Path.of(System.getProperty("java.io.tmpdir"), "sos-reduction"),
            Math.max(1, Runtime.getRuntime().availableProcessors()),
            DEFAULT_EXEC_TIMEOUT,
            Path.of("reductions"));
    }

    /**
     * Reads settings from a YAML or JSON file; absent keys keep their default and relative paths
     * resolve against the file's directory.
     */
    public static EngineSettings load(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        JsonNode root;
        try (InputStream in = Files.newInputStream(file)) {
            root = OBJECT_MAPPER.readTree(in);
        }
        Path base = file.toAbsolutePath().getParent();
        return fromTree(root, base == null ? Path.of("") : base);
    }

    static EngineSettings fromTree(JsonNode root, Path base) throws IOException {
        EngineSettings defaults = defaults();
        if (root == null || root.isNull() || root.isMissingNode()) return defaults;
        if (!root.isObject()) throw new IOException("Engine settings must be a record");

        Path cacheRoot = root.hasNonNull("cacheRoot") ? base.resolve(root.get("cacheRoot").asText()) : defaults.cacheRoot();
        Path reductions = root.hasNonNull("reductions") ? base.resolve(root.get("reductions").asText()) : defaults.reductions();
        int threads = defaults.threads();
        if (root.hasNonNull("threads")) {
            JsonNode value = root.get("threads");
            if (!value.canConvertToInt() || value.asInt() < 1) throw new IOException("threads must be a positive integer, got " + value);
            threads = value.asInt();
        }
        Duration execTimeout = root.hasNonNull("execTimeout") ? duration(root.get("execTimeout")) : defaults.execTimeout();
        return new EngineSettings(cacheRoot, threads, execTimeout, reductions);
    }

    // Whole seconds, or an ISO-8601 duration such as PT90S.
    private static Duration duration(JsonNode value) throws IOException {
        if (value.isIntegralNumber()) {
            if (value.asLong() < 0) throw new IOException("execTimeout must not be negative, got " + value);
            return Duration.ofSeconds(value.asLong());
        }
        try {
            Duration parsed = Duration.parse(value.asText().trim());
            if (parsed.isNegative()) throw new IOException("execTimeout must not be negative, got " + value);
            return parsed;
        } catch (DateTimeParseException invalid) {
            throw new IOException("execTimeout must be seconds or an ISO-8601 duration, got " + value, invalid);
        }
    }

    public EngineSettings withCacheRoot(Path root) {
        return new EngineSettings(root, threads, execTimeout, reductions);
    }

    public EngineSettings withReductions(Path path) {
        return new EngineSettings(cacheRoot, threads, execTimeout, path);
    }
}
