package com.williamcallahan.eventstream.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.williamcallahan.eventstream.domain.wire.NormalizedEventTypes;
import com.williamcallahan.eventstream.stream.StreamCancellation;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyEmitter;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Writes a stream as Server-Sent Events.
 *
 * <p>Frames are rendered with Spring's {@link SseEmitter#event()} builder, in its
 * {@code field:value} form. Two loops share the response: the event loop on the caller's
 * thread and a heartbeat timed by the shared scheduler. Both write whole frames under one
 * lock so frames never interleave. A heartbeat that finds a frame write in progress skips
 * its tick. Once the first body byte is written, failures are reported to the caller only;
 * nothing further is written.</p>
 *
 * <p>State moves {@code IDLE -> STREAMING -> COMPLETING | ABORTED}. The terminal event is
 * written on {@code COMPLETING} only, so cancelled and failed streams end without it.</p>
 */
public final class SseEventWriter implements StreamWriter {
    private static final Logger log = LoggerFactory.getLogger(SseEventWriter.class);

    /** Data of the normalized terminal event. */
    static final String DONE_DATA = "{\"type\":\"done\",\"finished\":true}";

    /** Sentinel closing a passthrough stream, as OpenAI clients expect. */
    static final String PASSTHROUGH_DONE_DATA = "[DONE]";

    /** Comment written by the heartbeat. */
    static final String KEEP_ALIVE_COMMENT = "keep-alive";

    private static final byte[] KEEP_ALIVE_FRAME = render(SseEmitter.event().comment(KEEP_ALIVE_COMMENT));

    private static final Counter HEARTBEAT_COUNTER = Metrics.counter("eventstream.sse.heartbeats");

    enum State {
        IDLE,
        STREAMING,
        COMPLETING,
        ABORTED
    }

    private final SseOptions options;
    private final StreamMode mode;
    private final WriterTimer heartbeatTimer;
    private final ObjectWriter jsonWriter;
    private final AtomicReference<State> state = new AtomicReference<>(State.IDLE);
    private final ReentrantLock writeLock = new ReentrantLock();
    private final AtomicLong eventIds = new AtomicLong();
    private final AtomicReference<IOException> heartbeatFailure = new AtomicReference<>();
    private volatile OutputStream out;

    public SseEventWriter(
            SseOptions options,
            StreamMode mode,
            ScheduledExecutorService scheduler,
            Executor tickExecutor,
            ObjectMapper objectMapper) {
        this.options = Objects.requireNonNull(options, "options");
        this.mode = Objects.requireNonNull(mode, "mode");
        this.heartbeatTimer = new WriterTimer(scheduler, tickExecutor);
        this.jsonWriter = objectMapper.writer();
    }

    @Override
    public void write(FrameSource frames, ResponseChannel channel, StreamCancellation cancellation)
            throws IOException, InterruptedException {
        if (!state.compareAndSet(State.IDLE, State.STREAMING)) {
            throw new IllegalStateException("SSE writer is single-use (state=" + state.get() + ")");
        }
        TransportHeaders.apply(channel, StreamFormat.SSE);
        out = new BufferedOutputStream(channel.body(), options.bufferSize());

        ScheduledFuture<?> heartbeat = heartbeatTimer.start(options.heartbeatInterval(), () -> heartbeat(cancellation));
        cancellation.onCancel(() -> {
            heartbeat.cancel(false);
            state.compareAndSet(State.STREAMING, State.ABORTED);
        });

        try {
            while (state.get() == State.STREAMING) {
                Optional<WireFrame> frame = frames.next();
                if (frame.isEmpty()) {
                    break;
                }
                writeFrame(frame.get());
            }
            heartbeat.cancel(false);
            if (!cancellation.isCancelled() && state.compareAndSet(State.STREAMING, State.COMPLETING)) {
                writeTerminal();
            }
        } catch (IOException writeFailure) {
            abort(cancellation);
            throw writeFailure;
        } finally {
            heartbeat.cancel(false);
        }

        IOException lostClient = heartbeatFailure.get();
        if (lostClient != null) {
            throw lostClient;
        }
    }

    State state() {
        return state.get();
    }

    private void writeFrame(WireFrame frame) throws IOException {
        SseEmitter.SseEventBuilder event = newEvent();
        if (mode == StreamMode.NORMALIZED) {
            event.name(frame.eventType());
        }
        if (frame.error() && options.maxRetries() > 0) {
            event.reconnectTime(
                    frame.retryAfterMs() != null ? frame.retryAfterMs() : options.retryInterval().toMillis());
        }
        event.data(serialize(frame));
        writeLocked(render(event), options.flushAfterWrite());
    }

    private void writeTerminal() throws IOException {
        SseEmitter.SseEventBuilder event = newEvent();
        if (mode == StreamMode.NORMALIZED) {
            event.name(NormalizedEventTypes.DONE).data(DONE_DATA);
        } else {
            event.data(PASSTHROUGH_DONE_DATA);
        }
        writeLocked(render(event), true);
    }

    private SseEmitter.SseEventBuilder newEvent() {
        SseEmitter.SseEventBuilder event = SseEmitter.event();
        if (options.includeIds()) {
            event.id(Long.toString(eventIds.incrementAndGet()));
        }
        return event;
    }

    private void heartbeat(StreamCancellation cancellation) {
        if (state.get() != State.STREAMING || !writeLock.tryLock()) {
            // a frame being written already keeps the connection busy
            return;
        }
        IOException failure = null;
        try {
            if (state.get() != State.STREAMING) {
                return;
            }
            out.write(KEEP_ALIVE_FRAME);
            out.flush();
            HEARTBEAT_COUNTER.increment();
        } catch (IOException heartbeatWriteFailure) {
            failure = heartbeatWriteFailure;
        } finally {
            writeLock.unlock();
        }
        if (failure != null) {
            log.debug("SSE heartbeat failed; client likely disconnected", failure);
            heartbeatFailure.compareAndSet(null, failure);
            abort(cancellation);
        }
    }

    private void writeLocked(byte[] bytes, boolean flush) throws IOException {
        writeLock.lock();
        try {
            State current = state.get();
            if (current == State.ABORTED || current == State.IDLE) {
                return;
            }
            out.write(bytes);
            if (flush) {
                out.flush();
            }
        } finally {
            writeLock.unlock();
        }
    }

    private void abort(StreamCancellation cancellation) {
        state.set(State.ABORTED);
        cancellation.cancel();
    }

    /** Concatenates the builder's text and data parts; every part here is a string. */
    static byte[] render(SseEmitter.SseEventBuilder event) {
        StringBuilder frame = new StringBuilder();
        for (ResponseBodyEmitter.DataWithMediaType part : event.build()) {
            frame.append(part.getData());
        }
        return frame.toString().getBytes(StandardCharsets.UTF_8);
    }

    private String serialize(WireFrame frame) {
        try {
            return jsonWriter.writeValueAsString(frame.payload());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize SSE data", e);
        }
    }
}
