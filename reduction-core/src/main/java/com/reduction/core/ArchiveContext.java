package com.reduction.core;

import com.reduction.core.cache.ArtifactCache;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Everything a run needs to know about one archive. Passed explicitly to every step so several
 * archives can be reduced concurrently in one process.
 *
 * @param filesDir the extracted archive content
 * @param workDir  per-archive scratch location, exposed to commands as {@code {workdir}}
 */
public record ArchiveContext(String archiveId, Path filesDir, Path workDir, ArtifactCache cache) {
    public ArchiveContext {
        archiveId = Objects.requireNonNull(archiveId, "archiveId");
        filesDir = Objects.requireNonNull(filesDir, "filesDir");
        workDir = Objects.requireNonNull(workDir, "workDir");
        cache = Objects.requireNonNull(cache, "cache");
        if (archiveId.isBlank()) throw new IllegalArgumentException("archiveId must not be blank");
    }

    /** Context whose work directory is the parent of {@code filesDir}. */
    public static ArchiveContext of(String archiveId, Path filesDir, ArtifactCache cache) {
        Path parent = filesDir.toAbsolutePath().getParent();
        return new ArchiveContext(archiveId, filesDir, parent == null ? filesDir : parent, cache);
    }

    /** Values for command template placeholders. */
    public Map<String, String> placeholders() {
        return Map.of(
            "filesdir", filesDir.toString(),
            "workdir", workDir.toString(),
            "archive", archiveId);
    }
}
