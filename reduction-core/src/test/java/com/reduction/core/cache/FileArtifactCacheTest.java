package com.reduction.core.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.reduction.core.FailureKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

final class FileArtifactCacheTest {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    @TempDir
    Path root;

    @Test
    void absentKeyIsEmpty() throws IOException {
        assertTrue(new FileArtifactCache(root).get("sos1", "nothing").isEmpty());
    }

    @Test
    void blobSurvivesANewCacheInstance() throws IOException {
        new FileArtifactCache(root).put("sos1", "hotsos.yaml", Artifact.ofText("hotsos.yaml", "a: 1\n"));

        Optional<Artifact> read = new FileArtifactCache(root).get("sos1", "hotsos.yaml");

        assertTrue(read.isPresent());
        assertTrue(read.get().isBytes());
        assertEquals("a: 1\n", read.get().text());
        assertEquals("hotsos.yaml", read.get().node());
    }

    @Test
    void structuredValueIsStoredAsJson() throws IOException {
        FileArtifactCache cache = new FileArtifactCache(root);
        cache.put("sos1", "lines", Artifact.ofValue("lines", OBJECT_MAPPER.readTree("[\"a\",\"b\"]")));

        Artifact read = cache.get("sos1", "lines").orElseThrow();

        assertTrue(read.isValue());
        assertEquals(OBJECT_MAPPER.readTree("[\"a\",\"b\"]"), read.value());
    }

    @Test
    void failureMarkerIsDistinctFromAbsence() throws IOException {
        FileArtifactCache cache = new FileArtifactCache(root);
        cache.put("sos1", "A", Artifact.failure("A", FailureKind.EXEC_FAILED, "exit 127"));

        Artifact marker = cache.get("sos1", "A").orElseThrow();

        assertTrue(marker.isFailure());
        assertEquals(FailureKind.EXEC_FAILED, marker.failureKind());
        assertEquals("exit 127", marker.message());
    }

    @Test
    void keysAreScopedPerArchive() throws IOException {
        FileArtifactCache cache = new FileArtifactCache(root);
        cache.put("sos1", "A", Artifact.ofText("A", "one"));
        cache.put("sos2", "A", Artifact.ofText("A", "two"));

        assertEquals("one", cache.get("sos1", "A").orElseThrow().text());
        assertEquals("two", cache.get("sos2", "A").orElseThrow().text());
    }

    @Test
    void lastWriterWinsAndNoTemporaryFilesRemain() throws IOException {
        FileArtifactCache cache = new FileArtifactCache(root);
        cache.put("sos1", "A", Artifact.ofText("A", "first"));
        cache.put("sos1", "A", Artifact.ofText("A", "second"));

        assertEquals("second", cache.get("sos1", "A").orElseThrow().text());
        try (Stream<Path> files = Files.list(root.resolve("sos1"))) {
            assertEquals(1, files.count());
        }
    }

    @Test
    void invalidateRemovesArtifact() throws IOException {
        FileArtifactCache cache = new FileArtifactCache(root);
        cache.put("sos1", "A", Artifact.ofText("A", "x"));
        cache.invalidate("sos1", "A");
        cache.invalidate("sos1", "never-written");

        assertTrue(cache.get("sos1", "A").isEmpty());
    }

    @Test
    void nodeNamesAreEncodedIntoOneFile() throws IOException {
        FileArtifactCache cache = new FileArtifactCache(root);
        cache.put("sos1", "../escape/me", Artifact.ofText("../escape/me", "x"));

        assertEquals(root.resolve("sos1"), cache.path("sos1", "../escape/me").getParent());
        assertEquals("x", cache.get("sos1", "../escape/me").orElseThrow().text());
    }

    @Test
    void archiveIdMustNotLeaveTheRoot() {
        FileArtifactCache cache = new FileArtifactCache(root);
        assertThrows(IllegalArgumentException.class, () -> cache.get("..", "A"));
        assertThrows(IllegalArgumentException.class, () -> cache.put("a/b", "A", Artifact.ofText("A", "x")));
    }

    @Test
    void corruptFileIsAnIoError() throws IOException {
        FileArtifactCache cache = new FileArtifactCache(root);
        Path file = cache.path("sos1", "A");
        Files.createDirectories(file.getParent());
        Files.write(file, "no header here".getBytes(StandardCharsets.UTF_8));

        assertThrows(IOException.class, () -> cache.get("sos1", "A"));
    }

    @Test
    void inMemoryCacheFollowsTheSameContract() {
        InMemoryArtifactCache cache = new InMemoryArtifactCache();
        cache.put("sos1", "A", Artifact.ofText("A", "x"));
        cache.put("sos2", "A", Artifact.ofText("A", "y"));

        assertEquals("x", cache.get("sos1", "A").orElseThrow().text());
        assertEquals(2, cache.size());
        cache.invalidate("sos1", "A");
        assertTrue(cache.get("sos1", "A").isEmpty());
    }
}
