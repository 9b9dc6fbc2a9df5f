package com.reduction.core.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.reduction.core.FailureKind;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Output of one node for one archive: a byte blob, a structured value, or a failure marker.
 *
 * <p>Artifacts are treated as immutable; a recomputation replaces the cached artifact instead of
 * changing it.
 */
public final class Artifact {
    public enum Status {
        SUCCESS,
        FAILED
    }

    private final String node;
    private final Status status;
    private final byte[] bytes;
    private final JsonNode value;
    private final FailureKind failureKind;
    private final String message;

    private Artifact(String node, Status status, byte[] bytes, JsonNode value, FailureKind failureKind, String message) {
        this.node = Objects.requireNonNull(node, "node");
        this.status = status;
        this.bytes = bytes;
        this.value = value;
        this.failureKind = failureKind;
        this.message = message;
    }

    public static Artifact ofBytes(String node, byte[] bytes) {
        return new Artifact(node, Status.SUCCESS, Objects.requireNonNull(bytes, "bytes").clone(), null, null, null);
    }

    public static Artifact ofText(String node, String text) {
        return ofBytes(node, Objects.requireNonNull(text, "text").getBytes(StandardCharsets.UTF_8));
    }

    public static Artifact ofValue(String node, JsonNode value) {
        return new Artifact(node, Status.SUCCESS, null, Objects.requireNonNull(value, "value"), null, null);
    }

    public static Artifact failure(String node, FailureKind kind, String message) {
        return new Artifact(node, Status.FAILED, null, null, Objects.requireNonNull(kind, "kind"),
            message == null ? "" : message);
    }

    /** The same content attributed to another node. */
    public Artifact withNode(String otherNode) {
        return new Artifact(otherNode, status, bytes, value, failureKind, message);
    }

    public String node() { return node; }
    public Status status() { return status; }
    public boolean isFailure() { return status == Status.FAILED; }
    public boolean isBytes() { return bytes != null; }
    public boolean isValue() { return value != null; }

    public byte[] bytes() {
        if (bytes == null) throw new IllegalStateException("Artifact '" + node + "' holds no bytes");
        return bytes.clone();
    }

    /** The blob decoded as UTF-8. */
    public String text() {
        if (bytes == null) throw new IllegalStateException("Artifact '" + node + "' holds no bytes");
        return new String(bytes, StandardCharsets.UTF_8);
    }

    public JsonNode value() {
        if (value == null) throw new IllegalStateException("Artifact '" + node + "' holds no structured value");
        return value;
    }

    public FailureKind failureKind() { return failureKind; }
    public String message() { return message; }

    @Override
    public String toString() {
        if (isFailure()) return "Artifact[" + node + ", FAILED " + failureKind + ": " + message + "]";
        if (isBytes()) return "Artifact[" + node + ", " + bytes.length + " bytes]";
        return "Artifact[" + node + ", " + value.getNodeType().name().toLowerCase() + "]";
    }
}
