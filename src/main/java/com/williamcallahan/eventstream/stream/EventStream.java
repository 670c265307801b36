package com.williamcallahan.eventstream.stream;

import com.williamcallahan.eventstream.domain.event.GenerationEvent;
import java.util.Optional;

/**
 * Ordered, closable source of generation events.
 *
 * <p>{@link #next()} blocks until an event is available and returns empty once the source
 * is exhausted or closed. {@link #close()} must unblock a pending {@code next()}, stop the
 * producer, and be safe to call more than once.</p>
 */
public interface EventStream extends AutoCloseable {

    /**
     * Waits for the next event.
     *
     * @return the next event, or empty when the stream has ended
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    Optional<GenerationEvent> next() throws InterruptedException;

    /** Releases the producer. Idempotent. */
    @Override
    void close();
}
