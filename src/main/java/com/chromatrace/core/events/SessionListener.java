package com.chromatrace.core.events;

import com.chromatrace.core.model.Assignment;

import java.util.List;
import java.util.function.Consumer;

/**
 * Typed view of the four outcome events of a session, for consumers that prefer callbacks
 * over raw {@link ChromatraceEvent}s. Bind one with
 * {@code eventBus.subscribe(sessionId, SessionListener.adapter(listener))}.
 */
public interface SessionListener {

    default void solutionFound(Assignment assignment) {}

    default void sessionFinished(List<Assignment> solutions) {}

    default void sessionFailed(String message) {}

    default void sessionCancelled() {}

    @SuppressWarnings("unchecked")
    static Consumer<ChromatraceEvent> adapter(SessionListener listener) {
        return event -> {
            switch (event.eventType()) {
                case ChromatraceEvent.SOLUTION_FOUND ->
                        listener.solutionFound((Assignment) event.payload().get("assignment"));
                case ChromatraceEvent.SESSION_FINISHED ->
                        listener.sessionFinished((List<Assignment>) event.payload().get("solutions"));
                case ChromatraceEvent.SESSION_FAILED ->
                        listener.sessionFailed((String) event.payload().get("message"));
                case ChromatraceEvent.SESSION_CANCELLED -> listener.sessionCancelled();
                default -> {
                    // progress events have no typed callback
                }
            }
        };
    }
}
