package com.williamcallahan.eventstream.transport;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.eventstream.domain.errors.ErrorCategory;
import com.williamcallahan.eventstream.domain.errors.GenerationException;
import com.williamcallahan.eventstream.domain.event.GenerationEvent;
import com.williamcallahan.eventstream.domain.event.TokenUsage;
import com.williamcallahan.eventstream.stream.StreamCancellation;
import com.williamcallahan.eventstream.support.FrameScripts;
import com.williamcallahan.eventstream.support.RecordingResponseChannel;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Verifies SSE framing, heartbeats, terminal events and failure handling.
 */
class SseEventWriterTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Clock clock = Clock.fixed(Instant.ofEpochMilli(1_700_000_000_000L), ZoneOffset.UTC);
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
    private final ExecutorService tickExecutor = Executors.newCachedThreadPool();

    @AfterEach
    void shutdown() {
        scheduler.shutdownNow();
        tickExecutor.shutdownNow();
    }

    @Test
    void normalizedStreamWritesNamedEventsThenDone() throws Exception {
        SseEventWriter writer =
                new SseEventWriter(SseOptions.defaults(), StreamMode.NORMALIZED, scheduler, tickExecutor, objectMapper);
        RecordingResponseChannel channel = new RecordingResponseChannel();

        writer.write(
                FrameScripts.normalized(objectMapper, clock,
                        new GenerationEvent.TextDelta("Hello"),
                        new GenerationEvent.Finish(TokenUsage.of(2, 1), "stop")),
                channel,
                new StreamCancellation());

        assertEquals(
                "event:text.delta\ndata:{\"type\":\"text.delta\",\"seq\":1,\"text\":\"Hello\"}\n\n"
                        + "event:finish\ndata:{\"type\":\"finish\",\"usage\":{\"input_tokens\":2,"
                        + "\"output_tokens\":1,\"total_tokens\":3},\"finish_reason\":\"stop\"}\n\n"
                        + "event:done\ndata:{\"type\":\"done\",\"finished\":true}\n\n",
                channel.bodyText());
        assertEquals("text/event-stream", channel.header(TransportHeaders.CONTENT_TYPE));
        assertEquals(TransportHeaders.NO_CACHE, channel.header(TransportHeaders.CACHE_CONTROL));
        assertEquals("no", channel.header(TransportHeaders.ACCEL_BUFFERING));
        assertEquals(SseEventWriter.State.COMPLETING, writer.state());
    }

    @Test
    void includesIncrementingIdsWhenEnabled() throws Exception {
        SseEventWriter writer = new SseEventWriter(
                SseOptions.defaults().withIncludeIds(true), StreamMode.NORMALIZED, scheduler, tickExecutor, objectMapper);
        RecordingResponseChannel channel = new RecordingResponseChannel();

        writer.write(
                FrameScripts.normalized(objectMapper, clock, new GenerationEvent.TextDelta("a")),
                channel,
                new StreamCancellation());

        assertTrue(channel.bodyText().startsWith("id:1\nevent:text.delta\n"));
        assertTrue(channel.bodyText().contains("id:2\nevent:done\n"));
    }

    @Test
    void errorEventCarriesRetryHintFromProvider() throws Exception {
        SseEventWriter writer =
                new SseEventWriter(SseOptions.defaults(), StreamMode.NORMALIZED, scheduler, tickExecutor, objectMapper);
        RecordingResponseChannel channel = new RecordingResponseChannel();
        GenerationException rateLimited = GenerationException.builder(ErrorCategory.RATE_LIMIT, "slow down")
                .retryAfter(Duration.ofSeconds(12))
                .build();

        writer.write(
                FrameScripts.normalized(objectMapper, clock,
                        new GenerationEvent.Failure(rateLimited),
                        new GenerationEvent.Failure(new IllegalStateException("boom"))),
                channel,
                new StreamCancellation());

        String body = channel.bodyText();
        assertTrue(body.contains("event:error\nretry:12000\ndata:{\"type\":\"error\",\"seq\":1,"));
        assertTrue(body.contains("event:error\nretry:5000\ndata:{\"type\":\"error\",\"seq\":2,"));
    }

    @Test
    void errorEventOmitsRetryLineWhenRetriesDisabled() throws Exception {
        SseEventWriter writer = new SseEventWriter(
                SseOptions.defaults().withMaxRetries(0), StreamMode.NORMALIZED, scheduler, tickExecutor, objectMapper);
        RecordingResponseChannel channel = new RecordingResponseChannel();

        writer.write(
                FrameScripts.normalized(objectMapper, clock, new GenerationEvent.Failure(new IllegalStateException("x"))),
                channel,
                new StreamCancellation());

        assertFalse(channel.bodyText().contains("retry:"));
    }

    @Test
    void passthroughStreamUsesUnnamedEventsAndDoneSentinel() throws Exception {
        SseEventWriter writer =
                new SseEventWriter(SseOptions.defaults(), StreamMode.PASSTHROUGH, scheduler, tickExecutor, objectMapper);
        RecordingResponseChannel channel = new RecordingResponseChannel();

        writer.write(
                FrameScripts.passthrough(objectMapper, clock,
                        new GenerationEvent.Start(),
                        new GenerationEvent.TextDelta("Hi"),
                        new GenerationEvent.Finish(null, "stop")),
                channel,
                new StreamCancellation());

        String body = channel.bodyText();
        assertFalse(body.contains("event:"));
        assertTrue(body.startsWith("data:{\"id\":\"req_test\",\"object\":\"chat.completion.chunk\""));
        assertTrue(body.endsWith("data:[DONE]\n\n"));
        assertEquals(3, body.split("\n\n").length);
    }

    @Test
    void heartbeatArrivesWithinTwoIntervalsWhileSourceIsIdle() throws Exception {
        Duration interval = Duration.ofMillis(100);
        SseEventWriter writer = new SseEventWriter(
                SseOptions.defaults().withHeartbeatInterval(interval), StreamMode.NORMALIZED, scheduler, tickExecutor, objectMapper);
        RecordingResponseChannel channel = new RecordingResponseChannel();
        StreamCancellation cancellation = new StreamCancellation();
        CountDownLatch released = new CountDownLatch(1);
        cancellation.onCancel(released::countDown);
        FrameSource idle = () -> {
            released.await();
            return Optional.empty();
        };

        long startedAt = System.nanoTime();
        CompletableFuture<Void> writing = CompletableFuture.runAsync(() -> {
            try {
                writer.write(idle, channel, cancellation);
            } catch (IOException | InterruptedException e) {
                throw new IllegalStateException(e);
            }
        });
        long deadline = startedAt + interval.multipliedBy(2).toNanos();
        while (!channel.bodyText().contains(":keep-alive\n\n") && System.nanoTime() < deadline) {
            Thread.sleep(5);
        }
        boolean sawHeartbeat = channel.bodyText().contains(":keep-alive\n\n");
        cancellation.cancel();
        writing.get(2, TimeUnit.SECONDS);

        assertTrue(sawHeartbeat, "expected a keep-alive within " + interval.multipliedBy(2));
        assertFalse(channel.bodyText().contains("event:done"), "cancelled streams end without done");
        assertEquals(SseEventWriter.State.ABORTED, writer.state());
    }

    @Test
    void slowConsumerReadingOneByteAtATimeReceivesEveryEventInOrder() throws Exception {
        int eventCount = 200;
        GenerationEvent[] events = new GenerationEvent[eventCount];
        for (int i = 0; i < eventCount; i++) {
            events[i] = new GenerationEvent.TextDelta("chunk-" + i);
        }
        SseEventWriter writer =
                new SseEventWriter(SseOptions.defaults(), StreamMode.NORMALIZED, scheduler, tickExecutor, objectMapper);
        ByteQueueChannel channel = new ByteQueueChannel(1);

        CompletableFuture<Void> writing = CompletableFuture.runAsync(() -> {
            try {
                writer.write(FrameScripts.normalized(objectMapper, clock, events), channel, new StreamCancellation());
            } catch (IOException | InterruptedException e) {
                throw new IllegalStateException(e);
            }
        });
        String received = channel.readUntil("data:{\"type\":\"done\",\"finished\":true}\n\n", Duration.ofSeconds(10));
        writing.get(2, TimeUnit.SECONDS);

        Matcher seq = Pattern.compile("\"seq\":(\\d+),\"text\":\"chunk-(\\d+)\"").matcher(received);
        List<Integer> order = new ArrayList<>();
        while (seq.find()) {
            assertEquals(Integer.parseInt(seq.group(1)) - 1, Integer.parseInt(seq.group(2)));
            order.add(Integer.parseInt(seq.group(2)));
        }
        assertEquals(eventCount, order.size());
        for (int i = 0; i < eventCount; i++) {
            assertEquals(i, order.get(i));
        }
    }

    @Test
    void writeFailureAbortsAndCancels() {
        SseEventWriter writer =
                new SseEventWriter(SseOptions.defaults(), StreamMode.NORMALIZED, scheduler, tickExecutor, objectMapper);
        StreamCancellation cancellation = new StreamCancellation();

        assertThrows(IOException.class, () -> writer.write(
                FrameScripts.normalized(objectMapper, clock, new GenerationEvent.TextDelta("lost")),
                RecordingResponseChannel.failingAfter(0),
                cancellation));
        assertTrue(cancellation.isCancelled());
        assertEquals(SseEventWriter.State.ABORTED, writer.state());
    }

    @Test
    void writerIsSingleUse() throws Exception {
        SseEventWriter writer =
                new SseEventWriter(SseOptions.defaults(), StreamMode.NORMALIZED, scheduler, tickExecutor, objectMapper);
        writer.write(FrameScripts.fromList(List.of()), new RecordingResponseChannel(), new StreamCancellation());

        assertThrows(IllegalStateException.class, () -> writer.write(
                FrameScripts.fromList(List.of()), new RecordingResponseChannel(), new StreamCancellation()));
    }

    @Test
    void rendersSpringEventFieldsInCallOrder() {
        String frame = new String(
                SseEventWriter.render(SseEmitter.event().id("7").name("error").reconnectTime(5000).data("{}")),
                StandardCharsets.UTF_8);

        assertEquals("id:7\nevent:error\nretry:5000\ndata:{}\n\n", frame);
    }

    @Test
    void rendersMultiLineDataAsOneDataFieldPerLine() {
        String frame = new String(SseEventWriter.render(SseEmitter.event().data("one\ntwo")), StandardCharsets.UTF_8);

        assertEquals("data:one\ndata:two\n\n", frame);
    }

    @Test
    void heartbeatsContinueWhileOtherClientsStall() throws Exception {
        Duration interval = Duration.ofMillis(50);
        SseOptions options = SseOptions.defaults().withHeartbeatInterval(interval);
        ScheduledExecutorService sharedScheduler = Executors.newScheduledThreadPool(2);
        ExecutorService writers = Executors.newCachedThreadPool();
        CountDownLatch release = new CountDownLatch(1);
        StreamCancellation busyCancellation = new StreamCancellation();
        StreamCancellation idleCancellation = new StreamCancellation();
        StreamCancellation healthyCancellation = new StreamCancellation();
        RecordingResponseChannel healthy = new RecordingResponseChannel();
        try {
            // one stalled client blocks mid-event, the other blocks in its own keep-alive
            FrameSource firstFrame = FrameScripts.normalized(objectMapper, clock, new GenerationEvent.TextDelta("stuck"));
            FrameSource idleAfterFrame = idleUntilCancelled(busyCancellation);
            FrameSource busy = () -> {
                Optional<WireFrame> frame = firstFrame.next();
                return frame.isPresent() ? frame : idleAfterFrame.next();
            };
            FrameSource idle = idleUntilCancelled(idleCancellation);
            writers.submit(() -> {
                new SseEventWriter(options, StreamMode.NORMALIZED, sharedScheduler, tickExecutor, objectMapper)
                        .write(busy, new StalledChannel(release), busyCancellation);
                return null;
            });
            writers.submit(() -> {
                new SseEventWriter(options, StreamMode.NORMALIZED, sharedScheduler, tickExecutor, objectMapper)
                        .write(idle, new StalledChannel(release), idleCancellation);
                return null;
            });
            Thread.sleep(interval.multipliedBy(4).toMillis());

            FrameSource healthyIdle = idleUntilCancelled(healthyCancellation);
            writers.submit(() -> {
                new SseEventWriter(options, StreamMode.NORMALIZED, sharedScheduler, tickExecutor, objectMapper)
                        .write(healthyIdle, healthy, healthyCancellation);
                return null;
            });
            Thread.sleep(1000);
            int keepAlives = healthy.bodyText().split(":keep-alive\n\n", -1).length - 1;

            assertTrue(keepAlives >= 10, "expected about 20 keep-alives in one second, saw " + keepAlives);
        } finally {
            busyCancellation.cancel();
            idleCancellation.cancel();
            healthyCancellation.cancel();
            release.countDown();
            writers.shutdown();
            assertTrue(writers.awaitTermination(2, TimeUnit.SECONDS));
            sharedScheduler.shutdownNow();
        }
    }

    private static FrameSource idleUntilCancelled(StreamCancellation cancellation) {
        CountDownLatch cancelled = new CountDownLatch(1);
        cancellation.onCancel(cancelled::countDown);
        return () -> {
            cancelled.await();
            return Optional.empty();
        };
    }

    /** Response whose body never accepts a byte until released. */
    private static final class StalledChannel implements ResponseChannel {
        private final CountDownLatch release;

        StalledChannel(CountDownLatch release) {
            this.release = release;
        }

        @Override
        public void header(String name, String value) {}

        @Override
        public OutputStream body() {
            return new OutputStream() {
                @Override
                public void write(int b) throws IOException {
                    write(new byte[] {(byte) b}, 0, 1);
                }

                @Override
                public void write(byte[] bytes, int offset, int length) throws IOException {
                    try {
                        release.await();
                    } catch (InterruptedException interrupted) {
                        Thread.currentThread().interrupt();
                        throw new IOException("interrupted", interrupted);
                    }
                }
            };
        }
    }

    /** Response whose body blocks once {@code capacity} unread bytes are pending. */
    private static final class ByteQueueChannel implements ResponseChannel {
        private final BlockingQueue<Byte> pending;

        ByteQueueChannel(int capacity) {
            this.pending = new ArrayBlockingQueue<>(capacity);
        }

        @Override
        public void header(String name, String value) {}

        @Override
        public OutputStream body() {
            return new OutputStream() {
                @Override
                public void write(int b) throws IOException {
                    try {
                        pending.put((byte) b);
                    } catch (InterruptedException interrupted) {
                        Thread.currentThread().interrupt();
                        throw new IOException("interrupted", interrupted);
                    }
                }
            };
        }

        String readUntil(String terminator, Duration timeout) throws InterruptedException {
            byte[] buffer = new byte[1 << 20];
            int length = 0;
            long deadline = System.nanoTime() + timeout.toNanos();
            while (System.nanoTime() < deadline) {
                Byte next = pending.poll(100, TimeUnit.MILLISECONDS);
                if (next == null) {
                    continue;
                }
                buffer[length++] = next;
                if (next != '\n') {
                    continue;
                }
                String soFar = new String(buffer, 0, length, StandardCharsets.UTF_8);
                if (soFar.endsWith(terminator)) {
                    return soFar;
                }
            }
            throw new AssertionError("terminator not received within " + timeout);
        }
    }
}
