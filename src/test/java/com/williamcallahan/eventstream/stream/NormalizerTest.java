package com.williamcallahan.eventstream.stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.eventstream.domain.errors.ErrorCategory;
import com.williamcallahan.eventstream.domain.errors.GenerationException;
import com.williamcallahan.eventstream.domain.event.GenerationEvent;
import com.williamcallahan.eventstream.domain.event.TokenUsage;
import com.williamcallahan.eventstream.domain.wire.NormalizedEvent;
import com.williamcallahan.eventstream.domain.wire.NormalizedEventTypes;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentSkipListSet;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

/**
 * Covers sequence numbering and per-type field mapping of the normalizer.
 */
class NormalizerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private final StreamMetadata metadata = new StreamMetadata("req_1", "trace-1", "openai", "gpt-4o-mini");

    @Test
    void assignsSequenceNumbersOneToNInReceiptOrder() {
        Normalizer normalizer = new Normalizer(metadata, objectMapper, clock);
        List<GenerationEvent> source = List.of(
                new GenerationEvent.Start(),
                new GenerationEvent.TextDelta("Hel"),
                new GenerationEvent.TextDelta("lo"),
                new GenerationEvent.Finish(TokenUsage.of(3, 2), "stop"));

        List<Long> sequence = new ArrayList<>();
        for (GenerationEvent event : source) {
            sequence.add(normalizer.normalize(event).seq());
        }

        assertEquals(List.of(1L, 2L, 3L, 4L), sequence);
        assertEquals(4L, normalizer.lastSequence());
    }

    @Test
    void concurrentProducersNeverShareOrSkipASequenceNumber() throws Exception {
        Normalizer normalizer = new Normalizer(metadata, objectMapper, clock);
        int producers = 8;
        int perProducer = 500;
        ConcurrentSkipListSet<Long> seen = new ConcurrentSkipListSet<>();
        CountDownLatch go = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(producers);
        try {
            List<Future<?>> tasks = new ArrayList<>();
            for (int p = 0; p < producers; p++) {
                tasks.add(pool.submit(() -> {
                    go.await();
                    for (int i = 0; i < perProducer; i++) {
                        seen.add(normalizer.normalize(new GenerationEvent.TextDelta("x")).seq());
                    }
                    return null;
                }));
            }
            go.countDown();
            for (Future<?> task : tasks) {
                task.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        int total = producers * perProducer;
        assertEquals(total, seen.size());
        assertEquals(1L, seen.first());
        assertEquals((long) total, seen.last());
    }

    @Test
    void providerAndModelAppearOnStartAndFinishOnly() {
        Normalizer normalizer = new Normalizer(metadata, objectMapper, clock);

        NormalizedEvent start = normalizer.normalize(new GenerationEvent.Start());
        NormalizedEvent delta = normalizer.normalize(new GenerationEvent.TextDelta("hi"));
        NormalizedEvent finish = normalizer.normalize(new GenerationEvent.Finish(TokenUsage.of(1, 1), "length"));

        assertEquals("openai", start.provider());
        assertEquals("gpt-4o-mini", start.model());
        assertNull(delta.provider());
        assertNull(delta.model());
        assertEquals("openai", finish.provider());
        assertEquals("length", finish.finishReason());
        assertEquals(2L, finish.usage().totalTokens());
        assertEquals("req_1", delta.requestId());
        assertEquals("trace-1", delta.traceId());
    }

    @Test
    void usesClockWhenSourceEventHasNoTimestamp() {
        Normalizer normalizer = new Normalizer(metadata, objectMapper, clock);
        Instant providerTime = NOW.minusSeconds(5);

        NormalizedEvent stamped = normalizer.normalize(new GenerationEvent.TextDelta("a", providerTime));
        NormalizedEvent unstamped = normalizer.normalize(new GenerationEvent.TextDelta("b"));

        assertEquals(providerTime.toEpochMilli(), stamped.ts());
        assertEquals(NOW.toEpochMilli(), unstamped.ts());
    }

    @Test
    void toolInputIsParsedWhenValidAndKeptVerbatimOtherwise() {
        Normalizer normalizer = new Normalizer(metadata, objectMapper, clock);

        NormalizedEvent valid = normalizer.normalize(
                new GenerationEvent.ToolCall("call_1", "weather", "{\"city\":\"Oslo\"}"));
        NormalizedEvent truncated = normalizer.normalize(
                new GenerationEvent.ToolCall("call_2", "weather", "{\"city\":\"Os"));
        NormalizedEvent blank = normalizer.normalize(new GenerationEvent.ToolCall("call_3", "ping", ""));

        assertEquals("Oslo", valid.toolCall().input().get("city").asText());
        assertTrue(truncated.toolCall().input().isTextual());
        assertEquals("{\"city\":\"Os", truncated.toolCall().input().asText());
        assertTrue(blank.toolCall().input().isObject());
        assertEquals(0, blank.toolCall().input().size());
    }

    @Test
    void generationFailuresKeepTheirCodeAndRetryHint() {
        Normalizer normalizer = new Normalizer(metadata, objectMapper, clock);
        GenerationException rateLimited = GenerationException.builder(ErrorCategory.RATE_LIMIT, "slow down")
                .retryAfter(Duration.ofSeconds(12))
                .build();

        NormalizedEvent error = normalizer.normalize(new GenerationEvent.Failure(rateLimited));

        assertEquals(NormalizedEventTypes.ERROR, error.type());
        assertEquals("rate_limit", error.error().code());
        assertEquals("slow down", error.error().message());
        assertTrue(error.error().retryable());
        assertEquals(12_000L, error.error().retryAfterMs());
    }

    @Test
    void unstructuredFailuresBecomeInternalErrors() {
        Normalizer normalizer = new Normalizer(metadata, objectMapper, clock);

        NormalizedEvent withMessage = normalizer.normalize(new GenerationEvent.Failure(new IllegalStateException("boom")));
        NormalizedEvent withoutMessage = normalizer.normalize(new GenerationEvent.Failure(new IllegalStateException()));
        NormalizedEvent withoutCause = normalizer.normalize(new GenerationEvent.Failure(null));

        assertEquals(Normalizer.INTERNAL_ERROR_CODE, withMessage.error().code());
        assertEquals("boom", withMessage.error().message());
        assertEquals(IllegalStateException.class.getName(), withoutMessage.error().message());
        assertEquals("unknown error", withoutCause.error().message());
    }

    @Test
    void rawEventsAreTaggedWithTheirKindCode() {
        Normalizer normalizer = new Normalizer(metadata, objectMapper, clock);

        NormalizedEvent raw = normalizer.normalize(
                new GenerationEvent.Raw(42, objectMapper.createObjectNode().put("vendor", "x"), null));

        assertEquals("raw.42", raw.type());
        assertEquals("x", raw.raw().get("vendor").asText());
    }
}
