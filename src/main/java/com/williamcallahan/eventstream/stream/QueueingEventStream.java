package com.williamcallahan.eventstream.stream;

import com.williamcallahan.eventstream.domain.event.GenerationEvent;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link EventStream} fed by a producer thread through a {@link BoundedEventQueue}.
 *
 * <p>Providers push with {@link #emit(GenerationEvent)} and signal the end with
 * {@link #complete()}. Closing from the consumer side aborts the queue, which releases a
 * producer blocked in {@code emit}, and then runs the close hooks so the provider can
 * cancel its upstream call.</p>
 */
public class QueueingEventStream implements EventStream {
    private static final Logger log = LoggerFactory.getLogger(QueueingEventStream.class);

    private final BoundedEventQueue<GenerationEvent> queue;
    private final AtomicBoolean closed = new AtomicBoolean();
    private final CopyOnWriteArrayList<Runnable> closeHooks = new CopyOnWriteArrayList<>();

    public QueueingEventStream(int capacity) {
        this.queue = new BoundedEventQueue<>(capacity);
    }

    /**
     * Publishes an event, waiting for space when the consumer lags.
     *
     * @return false once the consumer has closed the stream
     * @throws InterruptedException if the producer is interrupted while waiting
     */
    public boolean emit(GenerationEvent event) throws InterruptedException {
        return queue.put(event);
    }

    /** Marks the end of production; queued events are still delivered. */
    public void complete() {
        queue.close();
    }

    /**
     * Registers a hook run once when the consumer closes the stream.
     * A hook registered after close runs immediately.
     */
    public void onClose(Runnable hook) {
        closeHooks.add(hook);
        if (closed.get() && closeHooks.remove(hook)) {
            runHook(hook);
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public Optional<GenerationEvent> next() throws InterruptedException {
        return queue.take();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        queue.abort();
        for (Runnable hook : closeHooks) {
            if (closeHooks.remove(hook)) {
                runHook(hook);
            }
        }
    }

    private void runHook(Runnable hook) {
        try {
            hook.run();
        } catch (RuntimeException hookFailure) {
            log.warn("Event stream close hook failed", hookFailure);
        }
    }
}
