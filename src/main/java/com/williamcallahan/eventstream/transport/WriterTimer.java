package com.williamcallahan.eventstream.transport;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fixed-rate timer for one writer's heartbeat or periodic flush.
 *
 * <p>The shared scheduler only times the ticks; each tick runs on the tick executor, and at
 * most one tick per writer is in flight. A tick blocked on a stalled client therefore holds
 * one tick thread and makes later ticks of the same writer skip, while the scheduler keeps
 * serving every other connection.</p>
 */
final class WriterTimer {
    private static final Logger log = LoggerFactory.getLogger(WriterTimer.class);

    private final ScheduledExecutorService scheduler;
    private final Executor tickExecutor;
    private final AtomicBoolean tickInFlight = new AtomicBoolean();

    WriterTimer(ScheduledExecutorService scheduler, Executor tickExecutor) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.tickExecutor = Objects.requireNonNull(tickExecutor, "tickExecutor");
    }

    ScheduledFuture<?> start(Duration interval, Runnable tick) {
        long intervalMs = interval.toMillis();
        return scheduler.scheduleAtFixedRate(() -> dispatch(tick), intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    private void dispatch(Runnable tick) {
        if (!tickInFlight.compareAndSet(false, true)) {
            return;
        }
        try {
            tickExecutor.execute(() -> {
                try {
                    tick.run();
                } finally {
                    tickInFlight.set(false);
                }
            });
        } catch (RejectedExecutionException rejected) {
            tickInFlight.set(false);
            log.debug("Writer tick skipped; tick executor rejected it", rejected);
        }
    }
}
