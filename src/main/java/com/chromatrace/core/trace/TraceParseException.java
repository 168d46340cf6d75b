package com.chromatrace.core.trace;

/**
 * Thrown when a trace file does not follow the KTest record grammar.
 * Recovered by {@link TraceParser}: the offending file is dropped.
 */
public class TraceParseException extends RuntimeException {
    public TraceParseException(String message) {
        super(message);
    }

    public TraceParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
