package com.williamcallahan.eventstream.stream;

import com.williamcallahan.eventstream.domain.event.GenerationEvent;
import com.williamcallahan.eventstream.domain.wire.NormalizedEvent;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Background forwarder from a source {@link EventStream} through a {@link Normalizer} into a
 * bounded queue.
 *
 * <p>The queue decouples provider pace from network pace. When it is full the forwarding
 * task blocks, which in turn stops it reading the source. {@link #close()} aborts the queue,
 * interrupts the task and closes the source, so a forward in progress returns instead of
 * blocking forever.</p>
 */
public final class NormalizedEventPipeline implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(NormalizedEventPipeline.class);

    public static final int DEFAULT_QUEUE_CAPACITY = 100;

    private final EventStream source;
    private final Normalizer normalizer;
    private final BoundedEventQueue<NormalizedEvent> queue;
    private final ExecutorService executor;
    private final AtomicBoolean started = new AtomicBoolean();
    private final AtomicBoolean closed = new AtomicBoolean();
    private final AtomicBoolean entered = new AtomicBoolean();
    private final CountDownLatch terminated = new CountDownLatch(1);
    private volatile Future<?> forwardingTask;

    public NormalizedEventPipeline(
            EventStream source, Normalizer normalizer, ExecutorService executor, int queueCapacity) {
        this.source = Objects.requireNonNull(source, "source");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.queue = new BoundedEventQueue<>(queueCapacity);
    }

    /**
     * Submits the forwarding task. Later calls are ignored.
     *
     * @throws RejectedExecutionException if the executor refuses the task
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        if (closed.get()) {
            terminated.countDown();
            return;
        }
        try {
            forwardingTask = executor.submit(this::forward);
        } catch (RejectedExecutionException rejected) {
            terminated.countDown();
            throw rejected;
        }
        if (closed.get()) {
            cancelForwardingTask();
        }
    }

    /**
     * Waits for the next normalized event.
     *
     * @return the event, or empty once the source is exhausted or the pipeline is closed
     * @throws InterruptedException if the consumer is interrupted while waiting
     */
    public Optional<NormalizedEvent> next() throws InterruptedException {
        return queue.take();
    }

    /** Stops forwarding and closes the source. Idempotent. */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        queue.abort();
        cancelForwardingTask();
        closeSource();
        if (!started.get()) {
            terminated.countDown();
        }
    }

    /**
     * Waits for the forwarding task to finish.
     *
     * @return true if the task has finished, or was never started
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        if (!started.get() && !closed.get()) {
            return true;
        }
        return terminated.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public boolean isClosed() {
        return closed.get();
    }

    private void cancelForwardingTask() {
        Future<?> task = forwardingTask;
        // A task cancelled before it ran never reaches forward(), so release waiters here.
        if (task != null && task.cancel(true) && !entered.get()) {
            terminated.countDown();
        }
    }

    private void forward() {
        entered.set(true);
        try {
            while (!closed.get()) {
                Optional<GenerationEvent> event = source.next();
                if (event.isEmpty()) {
                    break;
                }
                if (!queue.put(normalizer.normalize(event.get()))) {
                    break;
                }
            }
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            log.debug("Pipeline forwarding interrupted (requestId={})", normalizer.metadata().requestId());
        } catch (RuntimeException sourceFailure) {
            log.warn("Event source failed (requestId={})", normalizer.metadata().requestId(), sourceFailure);
            publishFailure(sourceFailure);
        } finally {
            queue.close();
            terminated.countDown();
        }
    }

    private void publishFailure(RuntimeException sourceFailure) {
        try {
            queue.put(normalizer.normalize(new GenerationEvent.Failure(sourceFailure)));
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    private void closeSource() {
        try {
            source.close();
        } catch (RuntimeException closeFailure) {
            log.warn("Closing event source failed (requestId={})", normalizer.metadata().requestId(), closeFailure);
        }
    }
}
