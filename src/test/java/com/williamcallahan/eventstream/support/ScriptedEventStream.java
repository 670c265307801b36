package com.williamcallahan.eventstream.support;

import com.williamcallahan.eventstream.domain.event.GenerationEvent;
import com.williamcallahan.eventstream.stream.EventStream;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Event source that replays a fixed script. When held open it blocks after the script
 * until closed, like a provider waiting on a slow upstream.
 */
public final class ScriptedEventStream implements EventStream {

    private final Deque<GenerationEvent> remaining;
    private final boolean holdOpen;
    private final CountDownLatch closed = new CountDownLatch(1);
    private final AtomicInteger closeCalls = new AtomicInteger();

    private ScriptedEventStream(List<GenerationEvent> events, boolean holdOpen) {
        this.remaining = new ArrayDeque<>(events);
        this.holdOpen = holdOpen;
    }

    public static ScriptedEventStream of(GenerationEvent... events) {
        return new ScriptedEventStream(List.of(events), false);
    }

    public static ScriptedEventStream of(List<GenerationEvent> events) {
        return new ScriptedEventStream(events, false);
    }

    public static ScriptedEventStream heldOpen(GenerationEvent... events) {
        return new ScriptedEventStream(List.of(events), true);
    }

    @Override
    public synchronized Optional<GenerationEvent> next() throws InterruptedException {
        if (closed.getCount() == 0) {
            return Optional.empty();
        }
        GenerationEvent event = remaining.poll();
        if (event != null) {
            return Optional.of(event);
        }
        if (holdOpen) {
            closed.await();
        }
        return Optional.empty();
    }

    @Override
    public void close() {
        closeCalls.incrementAndGet();
        closed.countDown();
    }

    public boolean isClosed() {
        return closed.getCount() == 0;
    }

    public int closeCalls() {
        return closeCalls.get();
    }

    public boolean awaitClosed(Duration timeout) throws InterruptedException {
        return closed.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }
}
