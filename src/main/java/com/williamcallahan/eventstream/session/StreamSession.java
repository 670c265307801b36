package com.williamcallahan.eventstream.session;

import com.williamcallahan.eventstream.stream.EventStream;
import com.williamcallahan.eventstream.stream.NormalizedEventPipeline;
import com.williamcallahan.eventstream.stream.StreamCancellation;
import com.williamcallahan.eventstream.transport.FrameSource;
import com.williamcallahan.eventstream.transport.ResponseChannel;
import com.williamcallahan.eventstream.transport.StreamFormat;
import com.williamcallahan.eventstream.transport.StreamMode;
import com.williamcallahan.eventstream.transport.StreamWriter;
import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One client connection: a source, an optional normalizing pipeline, and one writer.
 *
 * <p>Closing is idempotent and reachable from three paths: normal completion, an explicit
 * {@link #close()}, and cancellation. Each path closes the pipeline (when present) and the
 * source, which releases the upstream provider call.</p>
 */
public final class StreamSession implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(StreamSession.class);

    private final String requestId;
    private final StreamMode mode;
    private final StreamFormat format;
    private final EventStream source;
    private final NormalizedEventPipeline pipeline;
    private final FrameSource frames;
    private final StreamWriter writer;
    private final StreamCancellation cancellation;
    private final Duration closeTimeout;
    private final AtomicBoolean closed = new AtomicBoolean();

    StreamSession(
            String requestId,
            StreamMode mode,
            StreamFormat format,
            EventStream source,
            NormalizedEventPipeline pipeline,
            FrameSource frames,
            StreamWriter writer,
            StreamCancellation cancellation,
            Duration closeTimeout) {
        this.requestId = Objects.requireNonNull(requestId, "requestId");
        this.mode = Objects.requireNonNull(mode, "mode");
        this.format = Objects.requireNonNull(format, "format");
        this.source = Objects.requireNonNull(source, "source");
        this.pipeline = pipeline;
        this.frames = Objects.requireNonNull(frames, "frames");
        this.writer = Objects.requireNonNull(writer, "writer");
        this.cancellation = Objects.requireNonNull(cancellation, "cancellation");
        this.closeTimeout = Objects.requireNonNull(closeTimeout, "closeTimeout");
    }

    /**
     * Streams the whole session to {@code channel} and releases it.
     *
     * @return {@link SessionOutcome#COMPLETED} or {@link SessionOutcome#CANCELLED}
     * @throws IOException if the client could not be written to; the session is already released
     */
    public SessionOutcome run(ResponseChannel channel) throws IOException {
        cancellation.onCancel(this::close);
        try {
            if (pipeline != null) {
                pipeline.start();
            }
            writer.write(frames, channel, cancellation);
            return cancellation.isCancelled() ? SessionOutcome.CANCELLED : SessionOutcome.COMPLETED;
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            log.debug("Stream session interrupted (requestId={})", requestId);
            return SessionOutcome.CANCELLED;
        } finally {
            close();
            awaitForwardingTask();
        }
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        if (pipeline != null) {
            pipeline.close();
        }
        try {
            source.close();
        } catch (RuntimeException closeFailure) {
            log.warn("Closing event source failed (requestId={})", requestId, closeFailure);
        }
    }

    private void awaitForwardingTask() {
        if (pipeline == null) {
            return;
        }
        try {
            if (!pipeline.awaitTermination(closeTimeout)) {
                log.warn("Forwarding task still running {} after close (requestId={})", closeTimeout, requestId);
            }
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    public String requestId() {
        return requestId;
    }

    public StreamMode mode() {
        return mode;
    }

    public StreamFormat format() {
        return format;
    }

    public StreamCancellation cancellation() {
        return cancellation;
    }

    NormalizedEventPipeline pipeline() {
        return pipeline;
    }
}
