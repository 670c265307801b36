package com.williamcallahan.eventstream.domain.event;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Provider-agnostic event produced by a generation provider.
 *
 * <p>The hierarchy is closed. Consumers dispatch through {@link Visitor}, so adding a
 * variant forces every mapper to handle it at compile time.</p>
 *
 * <p>Each variant carries an optional timestamp; a null timestamp means "now" to
 * whichever component first needs one.</p>
 */
public sealed interface GenerationEvent
        permits GenerationEvent.Start,
                GenerationEvent.TextDelta,
                GenerationEvent.AudioDelta,
                GenerationEvent.ToolCall,
                GenerationEvent.ToolResult,
                GenerationEvent.Citations,
                GenerationEvent.Safety,
                GenerationEvent.StepFinish,
                GenerationEvent.Finish,
                GenerationEvent.Failure,
                GenerationEvent.Raw {

    /** When the provider produced the event, or null if it did not say. */
    Instant timestamp();

    /** Kind tag of this variant. */
    EventKind kind();

    /** Double-dispatches to the visitor method for this variant. */
    <R> R accept(Visitor<R> visitor);

    /**
     * Exhaustive handler over every event variant.
     *
     * @param <R> result type
     */
    interface Visitor<R> {
        R visitStart(Start start);

        R visitTextDelta(TextDelta textDelta);

        R visitAudioDelta(AudioDelta audioDelta);

        R visitToolCall(ToolCall toolCall);

        R visitToolResult(ToolResult toolResult);

        R visitCitations(Citations citations);

        R visitSafety(Safety safety);

        R visitStepFinish(StepFinish stepFinish);

        R visitFinish(Finish finish);

        R visitFailure(Failure failure);

        R visitRaw(Raw raw);
    }

    record Start(Instant timestamp) implements GenerationEvent {
        public Start() {
            this(null);
        }

        @Override
        public EventKind kind() {
            return EventKind.START;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitStart(this);
        }
    }

    record TextDelta(String text, Instant timestamp) implements GenerationEvent {
        public TextDelta {
            text = text == null ? "" : text;
        }

        public TextDelta(String text) {
            this(text, null);
        }

        @Override
        public EventKind kind() {
            return EventKind.TEXT_DELTA;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitTextDelta(this);
        }
    }

    /**
     * Binary audio chunk. The array is copied on the way in and out so the event stays immutable.
     */
    record AudioDelta(byte[] chunk, AudioFormat format, Instant timestamp) implements GenerationEvent {
        public AudioDelta {
            chunk = chunk == null ? new byte[0] : chunk.clone();
            Objects.requireNonNull(format, "format");
        }

        public AudioDelta(byte[] chunk, AudioFormat format) {
            this(chunk, format, null);
        }

        @Override
        public byte[] chunk() {
            return chunk.clone();
        }

        @Override
        public EventKind kind() {
            return EventKind.AUDIO_DELTA;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAudioDelta(this);
        }

        @Override
        public boolean equals(Object other) {
            return other instanceof AudioDelta that
                    && Arrays.equals(chunk, that.chunk)
                    && format.equals(that.format)
                    && Objects.equals(timestamp, that.timestamp);
        }

        @Override
        public int hashCode() {
            return Objects.hash(Arrays.hashCode(chunk), format, timestamp);
        }

        @Override
        public String toString() {
            return "AudioDelta[bytes=" + chunk.length + ", format=" + format + "]";
        }
    }

    /**
     * Tool invocation requested by the model.
     *
     * @param callId provider call identifier used to correlate the result
     * @param name tool name
     * @param rawInput tool arguments as raw JSON text, exactly as the provider sent them
     * @param timestamp provider timestamp, may be null
     */
    record ToolCall(String callId, String name, String rawInput, Instant timestamp) implements GenerationEvent {
        public ToolCall {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("name cannot be null or blank");
            }
            callId = callId == null ? "" : callId;
            rawInput = rawInput == null ? "" : rawInput;
        }

        public ToolCall(String callId, String name, String rawInput) {
            this(callId, name, rawInput, null);
        }

        @Override
        public EventKind kind() {
            return EventKind.TOOL_CALL;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitToolCall(this);
        }
    }

    record ToolResult(String callId, String name, JsonNode output, Instant timestamp) implements GenerationEvent {
        public ToolResult {
            callId = callId == null ? "" : callId;
            name = name == null ? "" : name;
        }

        public ToolResult(String callId, String name, JsonNode output) {
            this(callId, name, output, null);
        }

        @Override
        public EventKind kind() {
            return EventKind.TOOL_RESULT;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitToolResult(this);
        }
    }

    record Citations(List<Citation> citations, Instant timestamp) implements GenerationEvent {
        public Citations {
            citations = citations == null ? List.of() : List.copyOf(citations);
        }

        public Citations(List<Citation> citations) {
            this(citations, null);
        }

        @Override
        public EventKind kind() {
            return EventKind.CITATIONS;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCitations(this);
        }
    }

    record Safety(SafetyVerdict verdict, Instant timestamp) implements GenerationEvent {
        public Safety {
            Objects.requireNonNull(verdict, "verdict");
        }

        public Safety(SafetyVerdict verdict) {
            this(verdict, null);
        }

        @Override
        public EventKind kind() {
            return EventKind.SAFETY;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSafety(this);
        }
    }

    record StepFinish(int stepNumber, Instant timestamp) implements GenerationEvent {
        public StepFinish(int stepNumber) {
            this(stepNumber, null);
        }

        @Override
        public EventKind kind() {
            return EventKind.STEP_FINISH;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitStepFinish(this);
        }
    }

    /**
     * End of generation.
     *
     * @param usage token counters, null when the provider did not report them
     * @param finishReason provider finish reason such as {@code stop}, null when unknown
     * @param timestamp provider timestamp, may be null
     */
    record Finish(TokenUsage usage, String finishReason, Instant timestamp) implements GenerationEvent {
        public Finish(TokenUsage usage, String finishReason) {
            this(usage, finishReason, null);
        }

        @Override
        public EventKind kind() {
            return EventKind.FINISH;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFinish(this);
        }
    }

    /**
     * Upstream failure delivered in-band. A {@link com.williamcallahan.eventstream.domain.errors.GenerationException} cause keeps its
     * structured code; any other throwable is reported as an internal error.
     */
    record Failure(Throwable cause, Instant timestamp) implements GenerationEvent {
        public Failure(Throwable cause) {
            this(cause, null);
        }

        @Override
        public EventKind kind() {
            return EventKind.ERROR;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFailure(this);
        }
    }

    /**
     * Provider-specific event with no normalized counterpart.
     *
     * @param kindCode numeric kind the provider reported
     * @param payload provider payload, may be null
     * @param timestamp provider timestamp, may be null
     */
    record Raw(int kindCode, JsonNode payload, Instant timestamp) implements GenerationEvent {
        public Raw(JsonNode payload) {
            this(EventKind.RAW.code(), payload, null);
        }

        @Override
        public EventKind kind() {
            return EventKind.RAW;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitRaw(this);
        }
    }
}
