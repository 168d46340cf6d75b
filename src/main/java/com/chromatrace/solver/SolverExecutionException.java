package com.chromatrace.solver;

/**
 * Thrown when the solver exits with a failure status or leaves no output directory.
 */
public class SolverExecutionException extends SolverException {
    public SolverExecutionException(String message) {
        super(message);
    }

    public SolverExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
