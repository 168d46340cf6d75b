package com.chromatrace.solver;

/**
 * Thrown when a toolchain step runs past its time budget. The child process has been
 * destroyed by the time this is raised.
 */
public class SolverTimeoutException extends SolverExecutionException {

    private final int timeoutSeconds;

    public SolverTimeoutException(String step, int timeoutSeconds) {
        super(step + " did not finish within " + timeoutSeconds + "s");
        this.timeoutSeconds = timeoutSeconds;
    }

    public int getTimeoutSeconds() {
        return timeoutSeconds;
    }
}
