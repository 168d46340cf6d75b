package com.chromatrace.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted by an enumeration session, consumed by the tree renderer and any other
 * observer.
 *
 * @param eventType one of the {@code *} constants below (e.g. "solution.found")
 * @param sessionId the session this event belongs to
 * @param payload   immutable event data; see each constant for its keys
 * @param timestamp when the event occurred
 */
public record ChromatraceEvent(
    String eventType,
    String sessionId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    /** Keys: {@code n}, {@code k}, {@code pairs}. */
    public static final String SESSION_STARTED = "session.started";
    /** Keys: {@code iteration}, {@code candidates}, {@code accepted}, {@code elapsedMs}. */
    public static final String ITERATION_COMPLETED = "iteration.completed";
    /** Keys: {@code assignment}, {@code leafIndex}, {@code leafNodeId}, {@code path}. */
    public static final String SOLUTION_FOUND = "solution.found";
    /** Keys: {@code solutions}, {@code iterations}. */
    public static final String SESSION_FINISHED = "session.finished";
    /** Keys: {@code message}. */
    public static final String SESSION_FAILED = "session.failed";
    /** No keys. */
    public static final String SESSION_CANCELLED = "session.cancelled";

    public ChromatraceEvent {
        payload = payload == null ? Map.of() : Map.copyOf(payload);
    }

    public static ChromatraceEvent of(String eventType, String sessionId, Map<String, Object> payload) {
        return new ChromatraceEvent(eventType, sessionId, payload, Instant.now());
    }
}
