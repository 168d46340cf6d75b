package com.chromatrace.core.concurrent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * One-shot cooperative cancellation signal owned by a session.
 *
 * <p>{@link #cancel()} may be called from any thread. Callbacks registered with
 * {@link #onCancel(Runnable)} run exactly once: on the cancelling thread, or right away on
 * the registering thread if the token was already cancelled.
 */
public class CancellationToken {

    private static final Logger log = LoggerFactory.getLogger(CancellationToken.class);

    private final Object lock = new Object();
    private final List<Runnable> callbacks = new ArrayList<>();
    private volatile boolean cancelled;

    /**
     * Handle for removing a callback once the guarded work is over.
     */
    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * Raises the signal.
     *
     * @return true if this call cancelled the token, false if it was already cancelled
     */
    public boolean cancel() {
        List<Runnable> toRun;
        synchronized (lock) {
            if (cancelled) {
                return false;
            }
            cancelled = true;
            toRun = new ArrayList<>(callbacks);
            callbacks.clear();
        }
        toRun.forEach(this::runSafely);
        return true;
    }

    public Registration onCancel(Runnable callback) {
        synchronized (lock) {
            if (!cancelled) {
                callbacks.add(callback);
                return () -> {
                    synchronized (lock) {
                        callbacks.remove(callback);
                    }
                };
            }
        }
        runSafely(callback);
        return () -> {};
    }

    private void runSafely(Runnable callback) {
        try {
            callback.run();
        } catch (Exception e) {
            log.warn("Cancellation callback threw: {}", e.getMessage(), e);
        }
    }
}
