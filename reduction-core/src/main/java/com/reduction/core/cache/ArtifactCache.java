package com.reduction.core.cache;

import java.io.IOException;
import java.util.Optional;

/**
 * Per-archive store of node artifacts. Keys never cross archives. A {@link #put} is atomic:
 * readers see either the previous artifact or the new one, never a partial write.
 */
public interface ArtifactCache {
    Optional<Artifact> get(String archiveId, String nodeName) throws IOException;

    void put(String archiveId, String nodeName, Artifact artifact) throws IOException;

    void invalidate(String archiveId, String nodeName) throws IOException;
}
