package com.williamcallahan.eventstream.transport;

import java.time.Duration;
import java.util.Objects;

/**
 * NDJSON writer settings.
 *
 * @param bufferSize output buffer size in bytes
 * @param flushInterval period of the background flush
 * @param compactJson compact objects; when false each object is spaced but still on one line
 * @param includeTimestamps add an epoch-millisecond {@code timestamp} field to every line
 */
public record NdjsonOptions(int bufferSize, Duration flushInterval, boolean compactJson, boolean includeTimestamps) {

    public static final int DEFAULT_BUFFER_SIZE = 8192;
    public static final Duration DEFAULT_FLUSH_INTERVAL = Duration.ofMillis(100);

    public NdjsonOptions {
        Objects.requireNonNull(flushInterval, "flushInterval");
        if (bufferSize <= 0) {
            throw new IllegalArgumentException("bufferSize must be positive");
        }
        if (flushInterval.isZero() || flushInterval.isNegative()) {
            throw new IllegalArgumentException("flushInterval must be positive");
        }
    }

    public static NdjsonOptions defaults() {
        return new NdjsonOptions(DEFAULT_BUFFER_SIZE, DEFAULT_FLUSH_INTERVAL, true, false);
    }

    public NdjsonOptions withIncludeTimestamps(boolean include) {
        return new NdjsonOptions(bufferSize, flushInterval, compactJson, include);
    }
}
