package com.chromatrace.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Routes session events to subscribers.
 * <p>
 * A subscriber either follows one session or, through {@link #subscribeAll}, every session.
 * Delivery is synchronous on the session thread, session subscribers first. Subscribers may
 * call back into the controller, for example to cancel. A subscriber that throws is logged
 * and skipped; the session and the remaining subscribers are unaffected.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final Map<String, List<Consumer<ChromatraceEvent>>> bySession = new ConcurrentHashMap<>();
    private final List<Consumer<ChromatraceEvent>> everySession = new CopyOnWriteArrayList<>();

    public void publish(ChromatraceEvent event) {
        log.debug("{} -> {}", event.sessionId(), event.eventType());
        deliver(bySession.getOrDefault(event.sessionId(), List.of()), event);
        deliver(everySession, event);
    }

    /**
     * Follows a single session until it is released.
     *
     * @return handle that removes this subscriber again
     */
    public Subscription subscribe(String sessionId, Consumer<ChromatraceEvent> subscriber) {
        bySession.compute(sessionId, (id, subscribers) -> {
            var list = subscribers != null ? subscribers : new CopyOnWriteArrayList<Consumer<ChromatraceEvent>>();
            list.add(subscriber);
            return list;
        });
        return () -> bySession.computeIfPresent(sessionId, (id, subscribers) -> {
            subscribers.remove(subscriber);
            return subscribers.isEmpty() ? null : subscribers;
        });
    }

    /**
     * Follows every session, present and future.
     */
    public Subscription subscribeAll(Consumer<ChromatraceEvent> subscriber) {
        everySession.add(subscriber);
        return () -> everySession.remove(subscriber);
    }

    /**
     * Forgets the subscribers of a session that has ended. Global subscribers stay.
     */
    public void release(String sessionId) {
        var dropped = bySession.remove(sessionId);
        if (dropped != null) {
            log.debug("Released {} subscriber(s) of session {}", dropped.size(), sessionId);
        }
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private static void deliver(List<Consumer<ChromatraceEvent>> subscribers, ChromatraceEvent event) {
        for (Consumer<ChromatraceEvent> subscriber : subscribers) {
            try {
                subscriber.accept(event);
            } catch (RuntimeException e) {
                log.warn("Subscriber failed on {} of session {}: {}",
                        event.eventType(), event.sessionId(), e.getMessage(), e);
            }
        }
    }
}
