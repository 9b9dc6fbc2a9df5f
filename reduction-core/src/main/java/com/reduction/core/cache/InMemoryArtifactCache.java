package com.reduction.core.cache;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/** Process-local cache, for dry runs and tests. */
public final class InMemoryArtifactCache implements ArtifactCache {
    private record Key(String archiveId, String nodeName) {}

    private final ConcurrentMap<Key, Artifact> artifacts = new ConcurrentHashMap<>();

    @Override
    public Optional<Artifact> get(String archiveId, String nodeName) {
        return Optional.ofNullable(artifacts.get(key(archiveId, nodeName)));
    }

    @Override
    public void put(String archiveId, String nodeName, Artifact artifact) {
        artifacts.put(key(archiveId, nodeName), Objects.requireNonNull(artifact, "artifact"));
    }

    @Override
    public void invalidate(String archiveId, String nodeName) {
        artifacts.remove(key(archiveId, nodeName));
    }

    public int size() {
        return artifacts.size();
    }

    private static Key key(String archiveId, String nodeName) {
        return new Key(Objects.requireNonNull(archiveId, "archiveId"), Objects.requireNonNull(nodeName, "nodeName"));
    }
}
