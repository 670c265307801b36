package com.williamcallahan.eventstream.domain.wire;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

/**
 * Wire-stable, provider-independent event of the {@code gai.events.v1} schema.
 *
 * <p>This is the full form. Every field except {@code schema}, {@code type}, {@code ts}
 * and {@code seq} is optional and omitted from JSON when null. The compact per-frame form
 * is produced by {@link NormalizedEventCodec#toCompactJson(NormalizedEvent)}.</p>
 *
 * @param schema schema version, {@link NormalizedEventTypes#SCHEMA_VERSION} when produced here
 * @param type event type tag
 * @param ts event time in epoch milliseconds
 * @param seq 1-based per-stream sequence number
 * @param requestId stream correlation id
 * @param traceId optional distributed trace id
 * @param step step number for {@code step.end}
 * @param callId tool call id for {@code tool.call} and {@code tool.result}
 * @param provider provider name, start and finish only
 * @param model model name, start and finish only
 * @param text generated text for {@code text.delta}
 * @param audio audio chunk for {@code audio.delta}
 * @param toolCall tool invocation for {@code tool.call}
 * @param toolResult tool output for {@code tool.result}
 * @param citations sources for {@code citations}
 * @param safety verdict for {@code safety}
 * @param usage token counters for {@code finish}
 * @param finishReason finish reason for {@code finish}
 * @param error failure details for {@code error}
 * @param raw provider payload for {@code raw.<n>}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({
    "schema", "type", "ts", "seq", "request_id", "trace_id", "step", "call_id", "provider", "model",
    "text", "audio", "tool_call", "tool_result", "citations", "safety", "usage", "finish_reason", "error", "raw"
})
public record NormalizedEvent(
        String schema,
        String type,
        long ts,
        long seq,
        @JsonProperty("request_id") String requestId,
        @JsonProperty("trace_id") String traceId,
        Integer step,
        @JsonProperty("call_id") String callId,
        String provider,
        String model,
        String text,
        Audio audio,
        @JsonProperty("tool_call") ToolCall toolCall,
        @JsonProperty("tool_result") JsonNode toolResult,
        List<Citation> citations,
        Safety safety,
        Usage usage,
        @JsonProperty("finish_reason") String finishReason,
        Error error,
        JsonNode raw) {

    public NormalizedEvent {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("type cannot be null or blank");
        }
        citations = citations == null ? null : List.copyOf(citations);
    }

    public static Builder builder(String type, long seq) {
        return new Builder(type, seq);
    }

    /** Base64 audio chunk plus its MIME type. */
    public record Audio(String chunk, String format) {}

    /** Tool name and its arguments as embedded JSON. */
    public record ToolCall(String name, JsonNode input) {}

    public record Citation(String uri, String title, int start, int end) {}

    public record Safety(String category, String action, double score) {}

    public record Usage(
            @JsonProperty("input_tokens") long inputTokens,
            @JsonProperty("output_tokens") long outputTokens,
            @JsonProperty("total_tokens") long totalTokens) {}

    /**
     * Failure details.
     *
     * @param code provider or category code, {@code internal} for unstructured failures
     * @param message human-readable message
     * @param retryable whether the client may retry the request
     * @param retryAfterMs suggested retry delay, null when none
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonPropertyOrder({"code", "message", "retryable", "retry_after_ms"})
    public record Error(
            String code,
            String message,
            boolean retryable,
            @JsonProperty("retry_after_ms") Long retryAfterMs) {}

    /**
     * Fluent builder; type and sequence number are required.
     */
    public static final class Builder {
        private final String type;
        private final long seq;
        private String schema = NormalizedEventTypes.SCHEMA_VERSION;
        private long ts;
        private String requestId;
        private String traceId;
        private Integer step;
        private String callId;
        private String provider;
        private String model;
        private String text;
        private Audio audio;
        private ToolCall toolCall;
        private JsonNode toolResult;
        private List<Citation> citations;
        private Safety safety;
        private Usage usage;
        private String finishReason;
        private Error error;
        private JsonNode raw;

        private Builder(String type, long seq) {
            this.type = type;
            this.seq = seq;
        }

        public Builder schema(String schema) {
            this.schema = schema;
            return this;
        }

        public Builder ts(long ts) {
            this.ts = ts;
            return this;
        }

        public Builder requestId(String requestId) {
            this.requestId = requestId;
            return this;
        }

        public Builder traceId(String traceId) {
            this.traceId = traceId;
            return this;
        }

        public Builder step(Integer step) {
            this.step = step;
            return this;
        }

        public Builder callId(String callId) {
            this.callId = callId;
            return this;
        }

        public Builder provider(String provider) {
            this.provider = provider;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder text(String text) {
            this.text = text;
            return this;
        }

        public Builder audio(Audio audio) {
            this.audio = audio;
            return this;
        }

        public Builder toolCall(ToolCall toolCall) {
            this.toolCall = toolCall;
            return this;
        }

        public Builder toolResult(JsonNode toolResult) {
            this.toolResult = toolResult;
            return this;
        }

        public Builder citations(List<Citation> citations) {
            this.citations = citations;
            return this;
        }

        public Builder safety(Safety safety) {
            this.safety = safety;
            return this;
        }

        public Builder usage(Usage usage) {
            this.usage = usage;
            return this;
        }

        public Builder finishReason(String finishReason) {
            this.finishReason = finishReason;
            return this;
        }

        public Builder error(Error error) {
            this.error = error;
            return this;
        }

        public Builder raw(JsonNode raw) {
            this.raw = raw;
            return this;
        }

        public NormalizedEvent build() {
            return new NormalizedEvent(
                    schema, type, ts, seq, requestId, traceId, step, callId, provider, model, text, audio,
                    toolCall, toolResult, citations, safety, usage, finishReason, error, raw);
        }
    }
}
