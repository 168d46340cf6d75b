package com.chromatrace.core.engine;

import com.chromatrace.core.concurrent.CancellationToken;
import com.chromatrace.core.model.Assignment;
import com.chromatrace.core.model.ExclusionSet;
import com.chromatrace.core.model.ProblemSpec;
import com.chromatrace.core.model.SessionStatus;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * One run of the enumeration loop for a fixed problem, from {@code INIT} to a terminal
 * status. Owns its cancellation token, its exclusion set and its results; nothing is shared
 * with other sessions.
 *
 * <p>Only the session thread mutates state. Other threads may read the status, the
 * solution snapshot and the search progress, and may call {@link #cancel()}.
 */
public class EnumerationSession {

    private final String id;
    private final ProblemSpec problem;
    private final CancellationToken cancellation = new CancellationToken();
    private final ExclusionSet exclusions = ExclusionSet.empty();
    private final List<Assignment> solutions = new CopyOnWriteArrayList<>();
    private final SearchProgress progress;
    private final CompletableFuture<SessionResult> completion = new CompletableFuture<>();

    private volatile SessionStatus status = SessionStatus.INIT;
    private volatile int iterations;
    private volatile Thread worker;

    EnumerationSession(String id, ProblemSpec problem) {
        this.id = id;
        this.problem = problem;
        this.progress = new SearchProgress(problem.k());
    }

    public String id() {
        return id;
    }

    public ProblemSpec problem() {
        return problem;
    }

    public SessionStatus status() {
        return status;
    }

    public int iterations() {
        return iterations;
    }

    /** Solutions emitted so far, in discovery order. */
    public List<Assignment> solutions() {
        return List.copyOf(solutions);
    }

    public SearchProgress progress() {
        return progress;
    }

    /**
     * Requests cancellation. Any running solver process is terminated; the session then ends
     * with {@code CANCELLED} unless it had already reached another terminal status.
     *
     * @return true if this call raised the signal
     */
    public boolean cancel() {
        return cancellation.cancel();
    }

    public boolean isCancellationRequested() {
        return cancellation.isCancelled();
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    /** Completes with the final result once the session reaches a terminal status. */
    public CompletableFuture<SessionResult> completion() {
        return completion.copy();
    }

    /**
     * Blocks until the session ends.
     *
     * @throws TimeoutException if it is still running after {@code timeout}
     */
    public SessionResult await(Duration timeout) throws InterruptedException, TimeoutException {
        try {
            return completion.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Session " + id + " completed exceptionally", e.getCause());
        }
    }

    // -- session-thread API --------------------------------------------------

    CancellationToken cancellation() {
        return cancellation;
    }

    ExclusionSet exclusions() {
        return exclusions;
    }

    void transition(SessionStatus next) {
        status = next;
    }

    int startIteration() {
        return ++iterations;
    }

    SearchProgress.LeafCoordinates accept(Assignment assignment) {
        exclusions.add(assignment);
        solutions.add(assignment);
        return progress.markViable(assignment).orElse(null);
    }

    void bindWorker(Thread thread) {
        worker = thread;
    }

    boolean isRunningOn(Thread thread) {
        return worker == thread && !isFinished();
    }

    boolean isFinished() {
        return completion.isDone();
    }

    SessionResult finish(SessionStatus terminal, String failureMessage) {
        status = terminal;
        var result = new SessionResult(id, terminal, solutions, iterations, failureMessage);
        completion.complete(result);
        return result;
    }
}
