package com.williamcallahan.eventstream.session;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.eventstream.config.StreamingExecutorsConfig;
import com.williamcallahan.eventstream.config.StreamingProperties;
import com.williamcallahan.eventstream.domain.event.GenerationEvent;
import com.williamcallahan.eventstream.domain.wire.NormalizedEventCodec;
import com.williamcallahan.eventstream.stream.EventStream;
import com.williamcallahan.eventstream.stream.NormalizedEventPipeline;
import com.williamcallahan.eventstream.stream.Normalizer;
import com.williamcallahan.eventstream.stream.PassthroughConverter;
import com.williamcallahan.eventstream.stream.StreamCancellation;
import com.williamcallahan.eventstream.stream.StreamMetadata;
import com.williamcallahan.eventstream.transport.FrameSource;
import com.williamcallahan.eventstream.transport.NdjsonEventWriter;
import com.williamcallahan.eventstream.transport.SseEventWriter;
import com.williamcallahan.eventstream.transport.StreamFormat;
import com.williamcallahan.eventstream.transport.StreamMode;
import com.williamcallahan.eventstream.transport.StreamWriter;
import com.williamcallahan.eventstream.transport.WireFrame;
import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Assembles a {@link StreamSession} for a resolved transport and mode.
 *
 * <p>Normalized sessions get a fresh {@link Normalizer} and pipeline; passthrough sessions
 * read the source directly through a fresh {@link PassthroughConverter}. Chunks have no
 * error shape, so a source failure in passthrough mode is logged and ends the frames; the
 * client still receives the closing sentinel.</p>
 */
@Component
public class StreamSessionFactory {
    private static final Logger log = LoggerFactory.getLogger(StreamSessionFactory.class);

    private final StreamingProperties properties;
    private final ObjectMapper objectMapper;
    private final NormalizedEventCodec codec;
    private final ExecutorService pipelineExecutor;
    private final ScheduledExecutorService timerScheduler;
    private final Executor tickExecutor;
    private final Clock clock;

    public StreamSessionFactory(
            StreamingProperties properties,
            ObjectMapper objectMapper,
            @Qualifier(StreamingExecutorsConfig.PIPELINE_EXECUTOR) ExecutorService pipelineExecutor,
            @Qualifier(StreamingExecutorsConfig.TIMER_SCHEDULER) ScheduledExecutorService timerScheduler,
            @Qualifier(StreamingExecutorsConfig.TICK_EXECUTOR) Executor tickExecutor,
            Clock clock) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.codec = new NormalizedEventCodec(objectMapper);
        this.pipelineExecutor = pipelineExecutor;
        this.timerScheduler = timerScheduler;
        this.tickExecutor = tickExecutor;
        this.clock = clock;
    }

    /**
     * Creates an unstarted session. Nothing is read or written until {@link StreamSession#run}.
     */
    public StreamSession create(
            StreamFormat format,
            StreamMode mode,
            StreamMetadata metadata,
            EventStream source,
            StreamCancellation cancellation) {
        StreamWriter writer = newWriter(format, mode);
        if (mode == StreamMode.PASSTHROUGH) {
            PassthroughConverter converter =
                    new PassthroughConverter(objectMapper, metadata.requestId(), metadata.model(), clock);
            return new StreamSession(
                    metadata.requestId(),
                    mode,
                    format,
                    source,
                    null,
                    passthroughFrames(metadata.requestId(), source, converter),
                    writer,
                    cancellation,
                    properties.getPipeline().getCloseTimeout());
        }
        Normalizer normalizer = new Normalizer(metadata, objectMapper, clock);
        NormalizedEventPipeline pipeline = new NormalizedEventPipeline(
                source, normalizer, pipelineExecutor, properties.getPipeline().getQueueCapacity());
        FrameSource frames = () -> pipeline.next().map(event -> WireFrame.normalized(event, codec.toCompactNode(event)));
        return new StreamSession(
                metadata.requestId(),
                mode,
                format,
                source,
                pipeline,
                frames,
                writer,
                cancellation,
                properties.getPipeline().getCloseTimeout());
    }

    private StreamWriter newWriter(StreamFormat format, StreamMode mode) {
        if (format == StreamFormat.NDJSON) {
            return new NdjsonEventWriter(
                    properties.ndjsonOptions(), mode, timerScheduler, tickExecutor, objectMapper, clock);
        }
        return new SseEventWriter(properties.sseOptions(), mode, timerScheduler, tickExecutor, objectMapper);
    }

    private static FrameSource passthroughFrames(
            String requestId, EventStream source, PassthroughConverter converter) {
        return () -> {
            while (true) {
                Optional<GenerationEvent> event;
                try {
                    event = source.next();
                } catch (RuntimeException sourceFailure) {
                    log.warn("Passthrough source failed, ending stream (requestId={}): {}",
                            requestId, sourceFailure.getMessage());
                    return Optional.empty();
                }
                if (event.isEmpty()) {
                    return Optional.empty();
                }
                Optional<WireFrame> frame = converter.convert(event.get()).map(WireFrame::passthrough);
                if (frame.isPresent()) {
                    return frame;
                }
            }
        };
    }
}
