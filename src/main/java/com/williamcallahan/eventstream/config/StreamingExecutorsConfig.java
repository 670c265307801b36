package com.williamcallahan.eventstream.config;

import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.time.Clock;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Thread pools behind streaming sessions.
 *
 * <p>One pool per unit of work on a connection: the session write loop and the pipeline
 * forwarding task. Heartbeats and periodic flushes are timed by a small shared scheduler,
 * which only hands each tick to the tick pool. A tick that writes to a stalled client then
 * pins a tick thread instead of a scheduler thread, so other connections keep their timers.
 * All threads are named daemons so a stuck stream never blocks JVM shutdown.</p>
 */
@Configuration
public class StreamingExecutorsConfig implements DisposableBean {

    public static final String SESSION_EXECUTOR = "streamSessionExecutor";
    public static final String PIPELINE_EXECUTOR = "streamPipelineExecutor";
    public static final String TIMER_SCHEDULER = "streamTimerScheduler";
    public static final String TICK_EXECUTOR = "streamTickExecutor";

    private static final int SCHEDULER_THREADS = 2;
    private static final long SHUTDOWN_GRACE_SECONDS = 5;

    private final ExecutorService sessionExecutor = Executors.newCachedThreadPool(daemonThreads("stream-session-%d"));
    private final ExecutorService pipelineExecutor =
            Executors.newCachedThreadPool(daemonThreads("stream-pipeline-%d"));
    private final ScheduledThreadPoolExecutor timerScheduler = newTimerScheduler();
    private final ExecutorService tickExecutor = Executors.newCachedThreadPool(daemonThreads("stream-tick-%d"));

    @Bean(name = SESSION_EXECUTOR)
    public Executor streamSessionExecutor() {
        return sessionExecutor;
    }

    @Bean(name = PIPELINE_EXECUTOR)
    public ExecutorService streamPipelineExecutor() {
        return pipelineExecutor;
    }

    @Bean(name = TIMER_SCHEDULER)
    public ScheduledExecutorService streamTimerScheduler() {
        return timerScheduler;
    }

    @Bean(name = TICK_EXECUTOR)
    public Executor streamTickExecutor() {
        return tickExecutor;
    }

    @Bean
    public Clock streamClock() {
        return Clock.systemUTC();
    }

    @Override
    public void destroy() {
        MoreExecutors.shutdownAndAwaitTermination(sessionExecutor, SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS);
        MoreExecutors.shutdownAndAwaitTermination(pipelineExecutor, SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS);
        MoreExecutors.shutdownAndAwaitTermination(timerScheduler, SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS);
        MoreExecutors.shutdownAndAwaitTermination(tickExecutor, SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS);
    }

    private static ScheduledThreadPoolExecutor newTimerScheduler() {
        ScheduledThreadPoolExecutor scheduler =
                new ScheduledThreadPoolExecutor(SCHEDULER_THREADS, daemonThreads("stream-timer-%d"));
        // Heartbeats are cancelled when streams end; drop them from the queue right away.
        scheduler.setRemoveOnCancelPolicy(true);
        return scheduler;
    }

    private static ThreadFactory daemonThreads(String nameFormat) {
        return new ThreadFactoryBuilder().setNameFormat(nameFormat).setDaemon(true).build();
    }
}
