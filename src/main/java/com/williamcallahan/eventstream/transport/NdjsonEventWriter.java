package com.williamcallahan.eventstream.transport;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.williamcallahan.eventstream.domain.wire.NormalizedEventTypes;
import com.williamcallahan.eventstream.stream.StreamCancellation;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes a stream as newline-delimited JSON.
 *
 * <p>Every line is flushed as soon as it is written, and a timer flushes on a fixed period
 * so buffered bytes never sit longer than the flush interval. A periodic flush that finds a
 * line being written skips its tick.</p>
 *
 * <p>In normalized mode the {@code finish} line carries {@code "finished":true} and ends
 * the stream. A separate {@code {"type":"done","finished":true}} line is written only when
 * the source ends without a finish event. Passthrough streams end with
 * {@code {"object":"done"}}.</p>
 */
public final class NdjsonEventWriter implements StreamWriter {
    private static final Logger log = LoggerFactory.getLogger(NdjsonEventWriter.class);

    static final String FINISHED_FIELD = "finished";
    static final String TIMESTAMP_FIELD = "timestamp";

    private final NdjsonOptions options;
    private final StreamMode mode;
    private final WriterTimer flushTimer;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final ReentrantLock writeLock = new ReentrantLock();
    private final AtomicBoolean started = new AtomicBoolean();
    private final AtomicBoolean aborted = new AtomicBoolean();
    private final AtomicReference<IOException> flushFailure = new AtomicReference<>();
    private NdjsonLineWriter lines;
    private boolean finishWritten;

    public NdjsonEventWriter(
            NdjsonOptions options,
            StreamMode mode,
            ScheduledExecutorService scheduler,
            Executor tickExecutor,
            ObjectMapper objectMapper,
            Clock clock) {
        this.options = Objects.requireNonNull(options, "options");
        this.mode = Objects.requireNonNull(mode, "mode");
        this.flushTimer = new WriterTimer(scheduler, tickExecutor);
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public void write(FrameSource frames, ResponseChannel channel, StreamCancellation cancellation)
            throws IOException, InterruptedException {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("NDJSON writer is single-use");
        }
        TransportHeaders.apply(channel, StreamFormat.NDJSON);
        lines = new NdjsonLineWriter(
                new BufferedOutputStream(channel.body(), options.bufferSize()), objectMapper, options.compactJson());

        ScheduledFuture<?> periodicFlush = flushTimer.start(options.flushInterval(), () -> periodicFlush(cancellation));
        cancellation.onCancel(() -> {
            periodicFlush.cancel(false);
            aborted.set(true);
        });

        try {
            while (!aborted.get()) {
                Optional<WireFrame> frame = frames.next();
                if (frame.isEmpty()) {
                    break;
                }
                writeFrame(frame.get());
            }
            periodicFlush.cancel(false);
            if (!cancellation.isCancelled() && !aborted.get()) {
                writeTerminal();
            }
        } catch (IOException writeFailure) {
            abort(cancellation);
            throw writeFailure;
        } finally {
            periodicFlush.cancel(false);
        }

        IOException lostClient = flushFailure.get();
        if (lostClient != null) {
            throw lostClient;
        }
    }

    private void writeFrame(WireFrame frame) throws IOException {
        ObjectNode line = decorate(frame.payload());
        if (mode == StreamMode.NORMALIZED && frame.finish()) {
            line.put(FINISHED_FIELD, true);
            finishWritten = true;
        }
        writeLocked(line);
    }

    private void writeTerminal() throws IOException {
        if (mode == StreamMode.PASSTHROUGH) {
            ObjectNode done = objectMapper.createObjectNode();
            done.put("object", "done");
            writeLocked(done);
        } else if (!finishWritten) {
            ObjectNode done = objectMapper.createObjectNode();
            done.put("type", NormalizedEventTypes.DONE);
            done.put(FINISHED_FIELD, true);
            writeLocked(decorate(done));
        }
    }

    private ObjectNode decorate(ObjectNode payload) {
        ObjectNode line = payload.deepCopy();
        if (options.includeTimestamps()) {
            line.put(TIMESTAMP_FIELD, clock.millis());
        }
        return line;
    }

    private void writeLocked(ObjectNode line) throws IOException {
        writeLock.lock();
        try {
            if (aborted.get()) {
                return;
            }
            lines.writeLine(line);
            lines.flush();
        } finally {
            writeLock.unlock();
        }
    }

    private void periodicFlush(StreamCancellation cancellation) {
        if (aborted.get() || !writeLock.tryLock()) {
            // a line being written flushes itself
            return;
        }
        try {
            lines.flush();
        } catch (IOException flushWriteFailure) {
            log.debug("NDJSON periodic flush failed; client likely disconnected", flushWriteFailure);
            flushFailure.compareAndSet(null, flushWriteFailure);
            aborted.set(true);
        } finally {
            writeLock.unlock();
        }
        if (aborted.get() && flushFailure.get() != null) {
            cancellation.cancel();
        }
    }

    private void abort(StreamCancellation cancellation) {
        aborted.set(true);
        cancellation.cancel();
    }
}
