package com.chromatrace.core.engine;

import com.chromatrace.core.model.Assignment;
import com.chromatrace.core.model.SessionStatus;

import java.util.List;

/**
 * Final state of a session.
 *
 * @param sessionId      the session
 * @param status         {@code DONE}, {@code FAILED} or {@code CANCELLED}
 * @param solutions      every assignment emitted, in discovery order
 * @param iterations     solver iterations started
 * @param failureMessage diagnostic when {@code FAILED}, otherwise null
 */
public record SessionResult(
    String sessionId,
    SessionStatus status,
    List<Assignment> solutions,
    int iterations,
    String failureMessage
) {
    public SessionResult {
        solutions = List.copyOf(solutions);
    }
}
