package com.reduction.core;

/** A reduction set is structurally unsound; nothing is built or executed from it. */
public class DefinitionException extends RuntimeException {
    public DefinitionException(String message) {
        super(message);
    }

    public DefinitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
