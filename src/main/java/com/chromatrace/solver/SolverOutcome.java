package com.chromatrace.solver;

/**
 * Result of {@link SolverDriver#run}: either the run's artifacts, or notice that the run was
 * cancelled (in which case nothing is left on disk).
 *
 * @param status   how the run ended
 * @param artifact the run's files when {@code COMPLETED}, otherwise null
 */
public record SolverOutcome(Status status, RunArtifact artifact) {

    public enum Status { COMPLETED, CANCELLED }

    public static SolverOutcome completed(RunArtifact artifact) {
        return new SolverOutcome(Status.COMPLETED, artifact);
    }

    public static SolverOutcome cancelled() {
        return new SolverOutcome(Status.CANCELLED, null);
    }

    public boolean isCancelled() {
        return status == Status.CANCELLED;
    }
}
