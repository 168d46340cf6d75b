package com.chromatrace.solver;

/**
 * Base type for toolchain and solver failures. Every subtype ends the session it occurs in.
 */
public class SolverException extends RuntimeException {
    public SolverException(String message) {
        super(message);
    }

    public SolverException(String message, Throwable cause) {
        super(message, cause);
    }
}
