package com.chromatrace.solver;

/**
 * One solver invocation.
 *
 * @param sessionId      owning session; names the session's exclusive working directory
 * @param iteration      1-based iteration number within the session, for diagnostics
 * @param sourceText     the generated C program
 * @param timeoutSeconds budget for each toolchain step, {@code <= 0} for none
 */
public record SolverRequest(
    String sessionId,
    int iteration,
    String sourceText,
    int timeoutSeconds
) {}
