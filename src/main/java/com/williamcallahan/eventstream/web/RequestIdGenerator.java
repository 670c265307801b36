package com.williamcallahan.eventstream.web;

import java.util.concurrent.atomic.AtomicLong;
import org.springframework.stereotype.Component;

/**
 * Generates request ids of the form {@code req_<nanos>_<counter>}.
 *
 * <p>The counter keeps ids unique when two requests land on the same nanosecond reading.</p>
 */
@Component
public class RequestIdGenerator {

    static final String PREFIX = "req_";

    private final AtomicLong counter = new AtomicLong();

    public String next() {
        return PREFIX + System.nanoTime() + "_" + counter.incrementAndGet();
    }
}
