package com.chromatrace.core.model;

/**
 * Lifecycle status of an enumeration session.
 */
public enum SessionStatus {
    INIT,
    GENERATE,
    SOLVE,
    PARSE,
    FILTER,
    DONE,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED || this == CANCELLED;
    }
}
