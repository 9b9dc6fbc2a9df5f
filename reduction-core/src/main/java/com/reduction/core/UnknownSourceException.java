package com.reduction.core;

public final class UnknownSourceException extends DefinitionException {
    private final String node;
    private final String source;

    public UnknownSourceException(String node, String source) {
        super(node == null
            ? "Unknown reduction: " + source
            : "Reduction '" + node + "' has unknown source '" + source + "'");
        this.node = node;
        this.source = source;
    }

    /** The referencing node, or null when the reference came from a run filter. */
    public String node() {
        return node;
    }

    public String source() {
        return source;
    }
}
