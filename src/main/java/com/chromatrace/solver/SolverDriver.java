package com.chromatrace.solver;

import com.chromatrace.core.concurrent.CancellationToken;

import java.util.Map;

/**
 * Abstraction over the external toolchain that decides a generated program.
 * Implementation: {@link KleeSolverDriver} (clang + KLEE).
 */
public interface SolverDriver {

    /**
     * Compiles and solves one program. Blocks until the solver exits, the timeout expires,
     * or {@code cancellation} is raised; a raised token terminates the child process.
     *
     * @return the run's artifacts, or a cancelled outcome
     * @throws ProgramCompileException  if the program does not compile
     * @throws SolverTimeoutException   if a step exceeds {@link SolverRequest#timeoutSeconds()}
     * @throws SolverExecutionException if the solver fails or leaves no output
     */
    SolverOutcome run(SolverRequest request, CancellationToken cancellation);

    /**
     * Describes the resolved toolchain, for health reporting.
     */
    default Map<String, String> describe() {
        return Map.of();
    }
}
