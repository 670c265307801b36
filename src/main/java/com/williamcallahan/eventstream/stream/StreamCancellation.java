package com.williamcallahan.eventstream.stream;

import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Request-scoped cancellation signal.
 *
 * <p>{@link #cancel()} runs every registered callback exactly once on the cancelling thread.
 * A callback registered after cancellation runs immediately on the registering thread.</p>
 */
public final class StreamCancellation {
    private static final Logger log = LoggerFactory.getLogger(StreamCancellation.class);

    private final Object monitor = new Object();
    private final List<Runnable> callbacks = new ArrayList<>();
    private volatile boolean cancelled;

    /** Signals cancellation. Only the first call has any effect. */
    public void cancel() {
        List<Runnable> toRun;
        synchronized (monitor) {
            if (cancelled) {
                return;
            }
            cancelled = true;
            toRun = new ArrayList<>(callbacks);
            callbacks.clear();
        }
        toRun.forEach(StreamCancellation::runCallback);
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /** Registers work to run on cancellation. */
    public void onCancel(Runnable callback) {
        synchronized (monitor) {
            if (!cancelled) {
                callbacks.add(callback);
                return;
            }
        }
        runCallback(callback);
    }

    private static void runCallback(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException callbackFailure) {
            log.warn("Cancellation callback failed", callbackFailure);
        }
    }
}
