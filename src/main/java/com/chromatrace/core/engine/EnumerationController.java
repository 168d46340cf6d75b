package com.chromatrace.core.engine;

import com.chromatrace.ChromatraceProperties;
import com.chromatrace.core.events.ChromatraceEvent;
import com.chromatrace.core.events.EventBus;
import com.chromatrace.core.logging.MdcContext;
import com.chromatrace.core.metrics.ChromatraceMetrics;
import com.chromatrace.core.model.Assignment;
import com.chromatrace.core.model.ProblemSpec;
import com.chromatrace.core.model.SessionStatus;
import com.chromatrace.core.program.ProgramGenerator;
import com.chromatrace.core.trace.TraceFile;
import com.chromatrace.core.trace.TraceParser;
import com.chromatrace.solver.RunArtifact;
import com.chromatrace.solver.SolverDriver;
import com.chromatrace.solver.SolverException;
import com.chromatrace.solver.SolverOutcome;
import com.chromatrace.solver.SolverRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Drives enumeration sessions: generate a program from the current exclusions, solve it,
 * decode the traces, keep the new valid assignments, and repeat until an iteration finds
 * nothing new.
 * <p>
 * Each session runs on its own background thread and never has more than one solver
 * process in flight. At most one session is active; starting another cancels the previous
 * one and waits for it to end, so working-directory state never carries over.
 * Results reach consumers only through {@link EventBus} events.
 */
@Service
public class EnumerationController {

    private static final Logger log = LoggerFactory.getLogger(EnumerationController.class);
    private static final AtomicInteger SESSION_COUNTER = new AtomicInteger(0);

    private final ProgramGenerator programGenerator;
    private final SolverDriver solverDriver;
    private final TraceParser traceParser;
    private final EventBus eventBus;
    private final ChromatraceMetrics metrics;
    private final ChromatraceProperties properties;

    private final Object sessionLock = new Object();
    private volatile EnumerationSession activeSession;

    public EnumerationController(ProgramGenerator programGenerator,
                                 SolverDriver solverDriver,
                                 TraceParser traceParser,
                                 EventBus eventBus,
                                 ChromatraceMetrics metrics,
                                 ChromatraceProperties properties) {
        this.programGenerator = programGenerator;
        this.solverDriver = solverDriver;
        this.traceParser = traceParser;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.properties = properties;
    }

    /**
     * Starts a background session, replacing any session still running.
     */
    public EnumerationSession startSession(ProblemSpec problem) {
        return startSession(problem, null);
    }

    /**
     * Starts a background session with {@code subscriber} attached before the first event,
     * replacing any session still running.
     * <p>
     * Safe to call from a subscriber of the running session: the old session is cancelled
     * but not awaited, and it ends once the callback returns.
     *
     * @param subscriber receives every event of the new session; may be null
     */
    public EnumerationSession startSession(ProblemSpec problem, Consumer<ChromatraceEvent> subscriber) {
        var session = open(problem, subscriber);
        ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "chromatrace-session-" + session.id());
            t.setDaemon(true);
            return t;
        });
        executor.execute(() -> {
            try {
                execute(session);
            } finally {
                executor.shutdown();
            }
        });
        return session;
    }

    /**
     * Runs a session to completion on the calling thread. It becomes the active session, so
     * a background session still running is cancelled first.
     */
    public SessionResult runSession(ProblemSpec problem) {
        return runSession(problem, null);
    }

    public SessionResult runSession(ProblemSpec problem, Consumer<ChromatraceEvent> subscriber) {
        return execute(open(problem, subscriber));
    }

    public Optional<EnumerationSession> activeSession() {
        return Optional.ofNullable(activeSession);
    }

    /**
     * Requests cancellation of the active session, if one is running. May be called from a
     * subscriber of that session.
     *
     * @return true if a running session was signalled
     */
    public boolean cancelActiveSession() {
        EnumerationSession session = activeSession;
        return session != null && !session.isTerminal() && session.cancel();
    }

    /**
     * The program the first iteration would hand to the solver.
     */
    public String previewProgram(ProblemSpec problem) {
        return programGenerator.preview(problem);
    }

    /**
     * Generates a unique session ID in the format CHRM-YYYY-NNNN.
     */
    public String generateSessionId() {
        int count = SESSION_COUNTER.incrementAndGet();
        int year = Instant.now().atZone(ZoneOffset.UTC).getYear();
        return String.format("CHRM-%d-%04d", year, count);
    }

    /**
     * Makes a new session the active one, then cancels the one it replaces and waits for it
     * to end. The wait happens outside {@code sessionLock}, so subscribers of the old session
     * can still call back into the controller.
     */
    private EnumerationSession open(ProblemSpec problem, Consumer<ChromatraceEvent> subscriber) {
        var session = new EnumerationSession(generateSessionId(), problem);
        if (subscriber != null) {
            eventBus.subscribe(session.id(), subscriber);
        }
        EnumerationSession previous;
        synchronized (sessionLock) {
            previous = activeSession;
            activeSession = session;
        }
        if (previous != null && !previous.isFinished()) {
            log.info("Cancelling session {} to start {}", previous.id(), session.id());
            previous.cancel();
            if (previous.isRunningOn(Thread.currentThread())) {
                log.debug("Session {} replaced from its own thread, not waiting", previous.id());
            } else {
                previous.completion().join();
            }
        }
        return session;
    }

    // -- session loop --------------------------------------------------------

    SessionResult execute(EnumerationSession session) {
        String sessionId = session.id();
        ProblemSpec problem = session.problem();
        session.bindWorker(Thread.currentThread());
        MdcContext.setSession(sessionId);
        try {
            log.info("Starting session {}: n={}, k={}, {} pairs", sessionId, problem.n(), problem.k(), problem.pairs().size());
            publish(ChromatraceEvent.SESSION_STARTED, sessionId, Map.of(
                    "n", problem.n(), "k", problem.k(), "pairs", problem.pairs()));

            if (problem.n() == 0) {
                // the empty vector is the only assignment and satisfies every (absent) pair
                emitSolution(session, Assignment.EMPTY);
                return session.isCancellationRequested() ? finishCancelled(session) : finishDone(session);
            }

            while (true) {
                if (session.isCancellationRequested()) {
                    return finishCancelled(session);
                }
                int iteration = session.startIteration();
                MdcContext.setIteration(sessionId, iteration);
                long startMs = System.currentTimeMillis();

                session.transition(SessionStatus.GENERATE);
                String source = programGenerator.generate(problem, session.exclusions());

                session.transition(SessionStatus.SOLVE);
                SolverOutcome outcome = solverDriver.run(
                        new SolverRequest(sessionId, iteration, source, properties.getSolver().getTimeoutSeconds()),
                        session.cancellation());
                if (outcome.isCancelled()) {
                    return finishCancelled(session);
                }

                List<Assignment> accepted;
                int candidateCount;
                try (RunArtifact artifact = outcome.artifact()) {
                    session.transition(SessionStatus.PARSE);
                    List<TraceFile> traces = traceParser.parseFiles(artifact.traceFiles());
                    int dropped = artifact.traceFiles().size() - traces.size();
                    if (dropped > 0) {
                        metrics.recordDroppedTraces(dropped);
                    }
                    List<Assignment> candidates = traceParser.extractAssignments(traces, problem.n());
                    candidateCount = candidates.size();

                    session.transition(SessionStatus.FILTER);
                    accepted = filter(session, candidates);
                }

                if (session.isCancellationRequested()) {
                    return finishCancelled(session);
                }
                for (Assignment assignment : accepted) {
                    if (session.isCancellationRequested()) {
                        return finishCancelled(session);
                    }
                    emitSolution(session, assignment);
                }

                long elapsedMs = System.currentTimeMillis() - startMs;
                metrics.recordIterationDuration(elapsedMs);
                log.info("Iteration {} finished in {}ms: {} candidates, {} new", iteration, elapsedMs,
                        candidateCount, accepted.size());
                publish(ChromatraceEvent.ITERATION_COMPLETED, sessionId, Map.of(
                        "iteration", iteration,
                        "candidates", candidateCount,
                        "accepted", accepted.size(),
                        "elapsedMs", elapsedMs));

                if (accepted.isEmpty()) {
                    return finishDone(session);
                }
            }
        } catch (SolverException e) {
            log.error("Session {} failed in {}: {}", sessionId, session.status(), e.getMessage(), e);
            return finishFailed(session, describe(e));
        } catch (RuntimeException e) {
            log.error("Session {} failed unexpectedly in {}", sessionId, session.status(), e);
            return finishFailed(session, "Unexpected error: " + describe(e));
        } finally {
            if (!session.isFinished()) {
                // an Error escaped the loop; still release anyone waiting on the session
                session.finish(SessionStatus.FAILED, "Session aborted");
            }
            eventBus.release(sessionId);
            MdcContext.clear();
        }
    }

    /**
     * Keeps candidates that fit the domain, satisfy every pair, and are neither already
     * excluded nor repeated within this batch. Order of first appearance is preserved.
     */
    List<Assignment> filter(EnumerationSession session, List<Assignment> candidates) {
        ProblemSpec problem = session.problem();
        var fresh = new LinkedHashSet<Assignment>();
        int rejected = 0;
        for (Assignment candidate : candidates) {
            if (!candidate.satisfies(problem)) {
                rejected++;
                log.warn("Solver returned invalid assignment {}, discarding", candidate);
                continue;
            }
            if (!session.exclusions().contains(candidate)) {
                fresh.add(candidate);
            }
        }
        if (rejected > 0) {
            metrics.recordRejectedCandidates(rejected);
        }
        return new ArrayList<>(fresh);
    }

    private void emitSolution(EnumerationSession session, Assignment assignment) {
        var coordinates = session.accept(assignment);
        var payload = new HashMap<String, Object>();
        payload.put("assignment", assignment);
        if (coordinates != null) {
            payload.put("leafIndex", coordinates.leafIndex());
            payload.put("leafNodeId", coordinates.leafNodeId());
            payload.put("path", coordinates.pathIds());
        }
        log.debug("Found {}", assignment);
        publish(ChromatraceEvent.SOLUTION_FOUND, session.id(), payload);
    }

    // terminal events go out before the completion future fires, so anyone awaiting the
    // session has already seen them

    private SessionResult finishDone(EnumerationSession session) {
        List<Assignment> solutions = session.solutions();
        metrics.recordSolutions(solutions.size());
        metrics.recordSessionResult(SessionStatus.DONE.name(), session.iterations());
        log.info("Session {} done: {} solutions in {} iterations",
                session.id(), solutions.size(), session.iterations());
        session.transition(SessionStatus.DONE);
        publish(ChromatraceEvent.SESSION_FINISHED, session.id(), Map.of(
                "solutions", solutions,
                "iterations", session.iterations()));
        return session.finish(SessionStatus.DONE, null);
    }

    private SessionResult finishCancelled(EnumerationSession session) {
        metrics.recordSessionResult(SessionStatus.CANCELLED.name(), session.iterations());
        log.info("Session {} cancelled after {} iterations", session.id(), session.iterations());
        session.transition(SessionStatus.CANCELLED);
        publish(ChromatraceEvent.SESSION_CANCELLED, session.id(), Map.of());
        return session.finish(SessionStatus.CANCELLED, null);
    }

    private SessionResult finishFailed(EnumerationSession session, String message) {
        metrics.recordSessionResult(SessionStatus.FAILED.name(), session.iterations());
        session.transition(SessionStatus.FAILED);
        publish(ChromatraceEvent.SESSION_FAILED, session.id(), Map.of("message", message));
        return session.finish(SessionStatus.FAILED, message);
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private void publish(String eventType, String sessionId, Map<String, Object> payload) {
        eventBus.publish(ChromatraceEvent.of(eventType, sessionId, payload));
    }
}
