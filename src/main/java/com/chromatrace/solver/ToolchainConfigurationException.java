package com.chromatrace.solver;

/**
 * Thrown when the compiler, the solver or the KLEE headers cannot be located.
 * Raised once, when the driver is constructed.
 */
public class ToolchainConfigurationException extends SolverException {
    public ToolchainConfigurationException(String message) {
        super(message);
    }
}
