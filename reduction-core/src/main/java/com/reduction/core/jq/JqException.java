package com.reduction.core.jq;

/** Raised for filters that do not compile and for runtime filter errors. */
public final class JqException extends Exception {
    public JqException(String message) {
        super(message);
    }
}
