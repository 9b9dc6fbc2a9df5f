package com.reduction.core.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.reduction.core.FailureKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Durable cache with one file per node under {@code <root>/<archiveId>/}.
 *
 * <p>Each file is a one-line JSON header (the completion marker: node, status, payload format,
 * failure kind and message) followed by the raw payload. Files are written to a temporary
 * sibling and renamed into place, so a present file is always complete.
 */
public final class FileArtifactCache implements ArtifactCache {
    private static final Logger log = LoggerFactory.getLogger(FileArtifactCache.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final String SUFFIX = ".artifact";

    private final Path root;
    private final ConcurrentMap<Path, Object> keyLocks = new ConcurrentHashMap<>();

    public FileArtifactCache(Path root) {
        this.root = Objects.requireNonNull(root, "root").toAbsolutePath().normalize();
    }

    public Path root() {
        return root;
    }

    /** Location of the file backing {@code (archiveId, nodeName)}. */
    public Path path(String archiveId, String nodeName) {
        return archiveDir(archiveId).resolve(URLEncoder.encode(Objects.requireNonNull(nodeName, "nodeName"), StandardCharsets.UTF_8) + SUFFIX);
    }

    @Override
    public Optional<Artifact> get(String archiveId, String nodeName) throws IOException {
        Path file = path(archiveId, nodeName);
        byte[] content;
        try {
            content = Files.readAllBytes(file);
        } catch (NoSuchFileException absent) {
            return Optional.empty();
        }
        return Optional.of(decode(file, nodeName, content));
    }

    @Override
    public void put(String archiveId, String nodeName, Artifact artifact) throws IOException {
        Objects.requireNonNull(artifact, "artifact");
        Path file = path(archiveId, nodeName);
        byte[] encoded = encode(nodeName, artifact);
        synchronized (lockFor(file)) {
            Files.createDirectories(file.getParent());
            Path tmp = Files.createTempFile(file.getParent(), ".tmp-", SUFFIX);
            try {
                Files.write(tmp, encoded);
                moveIntoPlace(tmp, file);
            } finally {
                Files.deleteIfExists(tmp);
            }
        }
        log.debug("cached {} for archive={} at {}", artifact, archiveId, file);
    }

    @Override
    public void invalidate(String archiveId, String nodeName) throws IOException {
        Path file = path(archiveId, nodeName);
        synchronized (lockFor(file)) {
            Files.deleteIfExists(file);
        }
    }

    private Object lockFor(Path file) {
        return keyLocks.computeIfAbsent(file, ignored -> new Object());
    }

    private Path archiveDir(String archiveId) {
        Objects.requireNonNull(archiveId, "archiveId");
        if (archiveId.isBlank() || archiveId.equals(".") || archiveId.equals("..")
            || archiveId.contains("/") || archiveId.contains("\\")) {
            throw new IllegalArgumentException("Invalid archive id: '" + archiveId + "'");
        }
        return root.resolve(archiveId);
    }

    private static void moveIntoPlace(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException notAtomic) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static byte[] encode(String nodeName, Artifact artifact) throws IOException {
        ObjectNode header = OBJECT_MAPPER.createObjectNode();
        header.put("node", nodeName);
        header.put("status", artifact.status().name().toLowerCase());
        byte[] payload = new byte[0];
        if (artifact.isFailure()) {
            header.put("failure", artifact.failureKind().name());
            header.put("message", artifact.message());
        } else if (artifact.isBytes()) {
            header.put("format", "bytes");
            payload = artifact.bytes();
        } else {
            header.put("format", "json");
            payload = OBJECT_MAPPER.writeValueAsBytes(artifact.value());
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream(payload.length + 128);
        out.write(OBJECT_MAPPER.writeValueAsBytes(header));
        out.write('\n');
        out.write(payload);
        return out.toByteArray();
    }

    private static Artifact decode(Path file, String nodeName, byte[] content) throws IOException {
        int newline = indexOf(content, (byte) '\n');
        if (newline < 0) throw new IOException("Corrupt artifact file, missing header: " + file);
        JsonNode header = OBJECT_MAPPER.readTree(Arrays.copyOfRange(content, 0, newline));
        if (header == null || !header.isObject()) throw new IOException("Corrupt artifact header: " + file);
        byte[] payload = Arrays.copyOfRange(content, newline + 1, content.length);

        String status = header.path("status").asText("");
        if ("failed".equals(status)) {
            FailureKind kind;
            try {
                kind = FailureKind.valueOf(header.path("failure").asText(""));
            } catch (IllegalArgumentException unknownKind) {
                throw new IOException("Corrupt artifact failure kind in " + file, unknownKind);
            }
            return Artifact.failure(nodeName, kind, header.path("message").asText(""));
        }
        if (!"success".equals(status)) throw new IOException("Corrupt artifact status '" + status + "': " + file);

        String format = header.path("format").asText("");
        return switch (format) {
            case "bytes" -> Artifact.ofBytes(nodeName, payload);
            case "json" -> Artifact.ofValue(nodeName, OBJECT_MAPPER.readTree(payload));
            default -> throw new IOException("Corrupt artifact format '" + format + "': " + file);
        };
    }

    private static int indexOf(byte[] content, byte b) {
        for (int i = 0; i < content.length; i++) {
            if (content[i] == b) return i;
        }
        return -1;
    }
}
