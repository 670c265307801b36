package com.williamcallahan.eventstream.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.eventstream.domain.errors.GenerationException;
import com.williamcallahan.eventstream.domain.event.AudioFormat;
import com.williamcallahan.eventstream.domain.event.GenerationEvent;
import com.williamcallahan.eventstream.domain.event.SafetyVerdict;
import com.williamcallahan.eventstream.domain.event.TokenUsage;
import com.williamcallahan.eventstream.domain.wire.NormalizedEvent;
import com.williamcallahan.eventstream.domain.wire.NormalizedEventTypes;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Maps source events to {@code gai.events.v1} records for one stream.
 *
 * <p>Every call produces exactly one event and consumes exactly one sequence number, so a
 * stream of N source events yields sequence numbers 1..N in receipt order. Provider and
 * model appear on {@code start} and {@code finish} only. The normalizer never throws:
 * failures it cannot classify become {@code internal} error events.</p>
 *
 * <p>Instances are single-stream and must not be shared.</p>
 */
public final class Normalizer {

    static final String INTERNAL_ERROR_CODE = "internal";

    private final StreamMetadata metadata;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final AtomicLong sequence = new AtomicLong();
    private final PayloadMapper payloadMapper = new PayloadMapper();

    public Normalizer(StreamMetadata metadata, ObjectMapper objectMapper, Clock clock) {
        this.metadata = Objects.requireNonNull(metadata, "metadata");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public Normalizer(StreamMetadata metadata, ObjectMapper objectMapper) {
        this(metadata, objectMapper, Clock.systemUTC());
    }

    /** Converts one source event, assigning it the next sequence number. */
    public NormalizedEvent normalize(GenerationEvent event) {
        Objects.requireNonNull(event, "event");
        long seq = sequence.incrementAndGet();
        Instant when = event.timestamp() == null ? clock.instant() : event.timestamp();
        NormalizedEvent.Builder builder = event.accept(payloadMapper)
                .apply(seq)
                .ts(when.toEpochMilli())
                .requestId(metadata.requestId())
                .traceId(metadata.traceId());
        return builder.build();
    }

    /** Number of events normalized so far. */
    public long lastSequence() {
        return sequence.get();
    }

    public StreamMetadata metadata() {
        return metadata;
    }

    private NormalizedEvent.Builder withProviderAndModel(NormalizedEvent.Builder builder) {
        return builder.provider(metadata.provider()).model(metadata.model());
    }

    private JsonNode toolInput(String rawInput) {
        if (rawInput == null || rawInput.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(rawInput);
        } catch (JsonProcessingException notJson) {
            // Providers occasionally stream truncated arguments; keep them verbatim.
            return objectMapper.getNodeFactory().textNode(rawInput);
        }
    }

    private static NormalizedEvent.Error errorPayload(Throwable cause) {
        if (cause instanceof GenerationException generationFailure) {
            Long retryAfterMs = generationFailure.retryAfter().map(Duration::toMillis).orElse(null);
            return new NormalizedEvent.Error(
                    generationFailure.wireCode(),
                    generationFailure.getMessage(),
                    generationFailure.retryable(),
                    retryAfterMs);
        }
        if (cause == null) {
            return new NormalizedEvent.Error(INTERNAL_ERROR_CODE, "unknown error", false, null);
        }
        String message = cause.getMessage() == null ? cause.getClass().getName() : cause.getMessage();
        return new NormalizedEvent.Error(INTERNAL_ERROR_CODE, message, false, null);
    }

    /**
     * Per-variant payload mapping. Each method returns a builder factory keyed by sequence
     * number so the common fields are applied in one place.
     */
    private final class PayloadMapper implements GenerationEvent.Visitor<SequencedBuilder> {

        @Override
        public SequencedBuilder visitStart(GenerationEvent.Start start) {
            return seq -> withProviderAndModel(NormalizedEvent.builder(NormalizedEventTypes.START, seq));
        }

        @Override
        public SequencedBuilder visitTextDelta(GenerationEvent.TextDelta textDelta) {
            return seq -> NormalizedEvent.builder(NormalizedEventTypes.TEXT_DELTA, seq).text(textDelta.text());
        }

        @Override
        public SequencedBuilder visitAudioDelta(GenerationEvent.AudioDelta audioDelta) {
            AudioFormat format = audioDelta.format();
            NormalizedEvent.Audio audio = new NormalizedEvent.Audio(
                    Base64.getEncoder().encodeToString(audioDelta.chunk()), format.mimeType());
            return seq -> NormalizedEvent.builder(NormalizedEventTypes.AUDIO_DELTA, seq).audio(audio);
        }

        @Override
        public SequencedBuilder visitToolCall(GenerationEvent.ToolCall toolCall) {
            NormalizedEvent.ToolCall payload =
                    new NormalizedEvent.ToolCall(toolCall.name(), toolInput(toolCall.rawInput()));
            return seq -> NormalizedEvent.builder(NormalizedEventTypes.TOOL_CALL, seq)
                    .callId(toolCall.callId())
                    .toolCall(payload);
        }

        @Override
        public SequencedBuilder visitToolResult(GenerationEvent.ToolResult toolResult) {
            return seq -> NormalizedEvent.builder(NormalizedEventTypes.TOOL_RESULT, seq)
                    .callId(toolResult.callId())
                    .toolResult(toolResult.output());
        }

        @Override
        public SequencedBuilder visitCitations(GenerationEvent.Citations citations) {
            List<NormalizedEvent.Citation> payload = citations.citations().stream()
                    .map(c -> new NormalizedEvent.Citation(c.uri(), c.title(), c.start(), c.end()))
                    .toList();
            return seq -> NormalizedEvent.builder(NormalizedEventTypes.CITATIONS, seq).citations(payload);
        }

        @Override
        public SequencedBuilder visitSafety(GenerationEvent.Safety safety) {
            SafetyVerdict verdict = safety.verdict();
            NormalizedEvent.Safety payload =
                    new NormalizedEvent.Safety(verdict.category(), verdict.action(), verdict.score());
            return seq -> NormalizedEvent.builder(NormalizedEventTypes.SAFETY, seq).safety(payload);
        }

        @Override
        public SequencedBuilder visitStepFinish(GenerationEvent.StepFinish stepFinish) {
            return seq -> NormalizedEvent.builder(NormalizedEventTypes.STEP_END, seq).step(stepFinish.stepNumber());
        }

        @Override
        public SequencedBuilder visitFinish(GenerationEvent.Finish finish) {
            TokenUsage usage = finish.usage();
            NormalizedEvent.Usage payload = usage == null
                    ? null
                    : new NormalizedEvent.Usage(usage.inputTokens(), usage.outputTokens(), usage.totalTokens());
            return seq -> withProviderAndModel(NormalizedEvent.builder(NormalizedEventTypes.FINISH, seq))
                    .usage(payload)
                    .finishReason(finish.finishReason());
        }

        @Override
        public SequencedBuilder visitFailure(GenerationEvent.Failure failure) {
            NormalizedEvent.Error payload = errorPayload(failure.cause());
            return seq -> NormalizedEvent.builder(NormalizedEventTypes.ERROR, seq).error(payload);
        }

        @Override
        public SequencedBuilder visitRaw(GenerationEvent.Raw raw) {
            return seq -> NormalizedEvent.builder(NormalizedEventTypes.raw(raw.kindCode()), seq).raw(raw.payload());
        }
    }

    @FunctionalInterface
    private interface SequencedBuilder {
        NormalizedEvent.Builder apply(long seq);
    }
}
