package com.williamcallahan.eventstream.stream;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.williamcallahan.eventstream.domain.event.GenerationEvent;
import com.williamcallahan.eventstream.domain.event.TokenUsage;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts source events into OpenAI {@code chat.completion.chunk} objects.
 *
 * <p>Only text deltas, tool calls and finish events have a chunk equivalent. Every other
 * kind converts to empty and is not written; such drops are counted on
 * {@code eventstream.passthrough.dropped_events} so passthrough clients missing data can be
 * diagnosed. Passthrough chunks never carry normalized schema or sequence fields.</p>
 *
 * <p>One converter per stream: it numbers tool calls within the stream.</p>
 */
public final class PassthroughConverter implements GenerationEvent.Visitor<Optional<ObjectNode>> {
    private static final Logger log = LoggerFactory.getLogger(PassthroughConverter.class);

    static final String CHUNK_OBJECT = "chat.completion.chunk";
    static final String DEFAULT_FINISH_REASON = "stop";

    private static final Counter DROPPED_EVENT_COUNTER = Metrics.counter("eventstream.passthrough.dropped_events");

    private final ObjectMapper objectMapper;
    private final String completionId;
    private final String model;
    private final long created;
    private int toolCallIndex;

    /**
     * @param objectMapper mapper used to build chunk trees
     * @param completionId chunk {@code id}, omitted when null
     * @param model chunk {@code model}, omitted when null
     * @param clock source of the chunk {@code created} epoch seconds
     */
    public PassthroughConverter(ObjectMapper objectMapper, String completionId, String model, Clock clock) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.completionId = completionId;
        this.model = model;
        this.created = clock.instant().getEpochSecond();
    }

    /** Converts one event, or returns empty when the kind has no chunk equivalent. */
    public Optional<ObjectNode> convert(GenerationEvent event) {
        Optional<ObjectNode> chunk = event.accept(this);
        if (chunk.isEmpty()) {
            DROPPED_EVENT_COUNTER.increment();
            log.debug("Passthrough dropped {} event (id={})", event.kind(), completionId);
        }
        return chunk;
    }

    @Override
    public Optional<ObjectNode> visitTextDelta(GenerationEvent.TextDelta textDelta) {
        ObjectNode chunk = chunkEnvelope();
        ObjectNode choice = firstChoice(chunk);
        choice.putObject("delta").put("content", textDelta.text());
        return Optional.of(chunk);
    }

    @Override
    public Optional<ObjectNode> visitToolCall(GenerationEvent.ToolCall toolCall) {
        ObjectNode chunk = chunkEnvelope();
        ObjectNode choice = firstChoice(chunk);
        ArrayNode toolCalls = choice.putObject("delta").putArray("tool_calls");
        ObjectNode call = toolCalls.addObject();
        call.put("index", toolCallIndex++);
        call.put("id", toolCall.callId());
        call.put("type", "function");
        ObjectNode function = call.putObject("function");
        function.put("name", toolCall.name());
        function.put("arguments", toolCall.rawInput());
        return Optional.of(chunk);
    }

    @Override
    public Optional<ObjectNode> visitFinish(GenerationEvent.Finish finish) {
        ObjectNode chunk = chunkEnvelope();
        ObjectNode choice = firstChoice(chunk);
        choice.putObject("delta");
        String finishReason = finish.finishReason();
        choice.put("finish_reason", finishReason == null || finishReason.isBlank() ? DEFAULT_FINISH_REASON : finishReason);
        TokenUsage tokens = finish.usage();
        if (tokens != null) {
            ObjectNode usage = chunk.putObject("usage");
            usage.put("prompt_tokens", tokens.inputTokens());
            usage.put("completion_tokens", tokens.outputTokens());
            usage.put("total_tokens", tokens.totalTokens());
        }
        return Optional.of(chunk);
    }

    @Override
    public Optional<ObjectNode> visitStart(GenerationEvent.Start start) {
        return Optional.empty();
    }

    @Override
    public Optional<ObjectNode> visitAudioDelta(GenerationEvent.AudioDelta audioDelta) {
        return Optional.empty();
    }

    @Override
    public Optional<ObjectNode> visitToolResult(GenerationEvent.ToolResult toolResult) {
        return Optional.empty();
    }

    @Override
    public Optional<ObjectNode> visitCitations(GenerationEvent.Citations citations) {
        return Optional.empty();
    }

    @Override
    public Optional<ObjectNode> visitSafety(GenerationEvent.Safety safety) {
        return Optional.empty();
    }

    @Override
    public Optional<ObjectNode> visitStepFinish(GenerationEvent.StepFinish stepFinish) {
        return Optional.empty();
    }

    @Override
    public Optional<ObjectNode> visitFailure(GenerationEvent.Failure failure) {
        return Optional.empty();
    }

    @Override
    public Optional<ObjectNode> visitRaw(GenerationEvent.Raw raw) {
        return Optional.empty();
    }

    private ObjectNode chunkEnvelope() {
        ObjectNode chunk = objectMapper.createObjectNode();
        if (completionId != null) {
            chunk.put("id", completionId);
        }
        chunk.put("object", CHUNK_OBJECT);
        chunk.put("created", created);
        if (model != null) {
            chunk.put("model", model);
        }
        return chunk;
    }

    private static ObjectNode firstChoice(ObjectNode chunk) {
        ObjectNode choice = chunk.putArray("choices").addObject();
        choice.put("index", 0);
        return choice;
    }
}
