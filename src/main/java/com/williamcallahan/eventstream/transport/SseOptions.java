package com.williamcallahan.eventstream.transport;

import java.time.Duration;
import java.util.Objects;

/**
 * SSE writer settings.
 *
 * @param heartbeatInterval delay between {@code :keep-alive} comments
 * @param flushAfterWrite flush after every event instead of only when the buffer fills
 * @param maxRetries enables {@code retry:} hints on error events when positive
 * @param retryInterval retry hint used when an error carries no retry-after of its own
 * @param bufferSize output buffer size in bytes
 * @param includeIds write an {@code id:} line with a per-stream counter
 */
public record SseOptions(
        Duration heartbeatInterval,
        boolean flushAfterWrite,
        int maxRetries,
        Duration retryInterval,
        int bufferSize,
        boolean includeIds) {

    public static final Duration DEFAULT_HEARTBEAT_INTERVAL = Duration.ofSeconds(15);
    public static final Duration DEFAULT_RETRY_INTERVAL = Duration.ofSeconds(5);
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final int DEFAULT_BUFFER_SIZE = 4096;

    public SseOptions {
        Objects.requireNonNull(heartbeatInterval, "heartbeatInterval");
        Objects.requireNonNull(retryInterval, "retryInterval");
        if (heartbeatInterval.isZero() || heartbeatInterval.isNegative()) {
            throw new IllegalArgumentException("heartbeatInterval must be positive");
        }
        if (retryInterval.isNegative()) {
            throw new IllegalArgumentException("retryInterval cannot be negative");
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries cannot be negative");
        }
        if (bufferSize <= 0) {
            throw new IllegalArgumentException("bufferSize must be positive");
        }
    }

    public static SseOptions defaults() {
        return new SseOptions(
                DEFAULT_HEARTBEAT_INTERVAL, true, DEFAULT_MAX_RETRIES, DEFAULT_RETRY_INTERVAL, DEFAULT_BUFFER_SIZE, false);
    }

    public SseOptions withHeartbeatInterval(Duration interval) {
        return new SseOptions(interval, flushAfterWrite, maxRetries, retryInterval, bufferSize, includeIds);
    }

    public SseOptions withIncludeIds(boolean include) {
        return new SseOptions(heartbeatInterval, flushAfterWrite, maxRetries, retryInterval, bufferSize, include);
    }

    public SseOptions withMaxRetries(int retries) {
        return new SseOptions(heartbeatInterval, flushAfterWrite, retries, retryInterval, bufferSize, includeIds);
    }
}
