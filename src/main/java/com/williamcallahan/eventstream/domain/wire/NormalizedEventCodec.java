package com.williamcallahan.eventstream.domain.wire;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import java.util.Objects;

/**
 * Serializes and parses {@link NormalizedEvent}s.
 *
 * <p>The full form mirrors the record field by field. The compact form is the per-frame
 * shape written to clients: it keeps only the fields each type needs, in a fixed key
 * order, and carries {@code schema}, {@code provider} and {@code model} on {@code start}
 * alone. Output of both forms is deterministic and covered by golden tests.</p>
 */
public final class NormalizedEventCodec {

    private final ObjectMapper objectMapper;
    private final ObjectWriter jsonWriter;
    private final ObjectReader eventReader;

    public NormalizedEventCodec(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.jsonWriter = objectMapper.writer();
        this.eventReader = objectMapper.readerFor(NormalizedEvent.class);
    }

    /**
     * Serializes the full form of an event.
     *
     * @throws WireFormatException if Jackson cannot write the event
     */
    public String toJson(NormalizedEvent event) {
        try {
            return jsonWriter.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new WireFormatException("Failed to serialize normalized event", e);
        }
    }

    /**
     * Serializes the compact per-frame form of an event.
     *
     * @throws WireFormatException if Jackson cannot write the event
     */
    public String toCompactJson(NormalizedEvent event) {
        try {
            return jsonWriter.writeValueAsString(toCompactNode(event));
        } catch (JsonProcessingException e) {
            throw new WireFormatException("Failed to serialize compact event", e);
        }
    }

    /** Builds the compact form as a tree so transports can decorate it before writing. */
    public ObjectNode toCompactNode(NormalizedEvent event) {
        ObjectNode node = objectMapper.createObjectNode();
        String type = event.type();
        switch (type) {
            case NormalizedEventTypes.START -> {
                putIfPresent(node, "schema", event.schema());
                node.put("type", type);
                node.put("ts", event.ts());
                node.put("seq", event.seq());
                putIfPresent(node, "trace_id", event.traceId());
                putIfPresent(node, "request_id", event.requestId());
                putIfPresent(node, "provider", event.provider());
                putIfPresent(node, "model", event.model());
            }
            case NormalizedEventTypes.TEXT_DELTA -> {
                typeAndSeq(node, event);
                node.put("text", event.text() == null ? "" : event.text());
            }
            case NormalizedEventTypes.TOOL_CALL -> {
                typeAndSeq(node, event);
                node.put("call_id", nullToEmpty(event.callId()));
                NormalizedEvent.ToolCall toolCall = event.toolCall();
                node.put("name", toolCall == null ? "" : nullToEmpty(toolCall.name()));
                node.set("input", toolCall == null ? objectMapper.nullNode() : toolCall.input());
            }
            case NormalizedEventTypes.TOOL_RESULT -> {
                typeAndSeq(node, event);
                node.put("call_id", nullToEmpty(event.callId()));
                node.set("output", event.toolResult() == null ? objectMapper.nullNode() : event.toolResult());
            }
            case NormalizedEventTypes.FINISH -> {
                node.put("type", type);
                if (event.usage() != null) {
                    node.set("usage", objectMapper.valueToTree(event.usage()));
                }
                putIfPresent(node, "finish_reason", event.finishReason());
            }
            case NormalizedEventTypes.ERROR -> {
                typeAndSeq(node, event);
                NormalizedEvent.Error error = event.error();
                node.put("code", error == null ? "internal" : nullToEmpty(error.code()));
                node.put("message", error == null ? "" : nullToEmpty(error.message()));
                if (error != null && error.retryAfterMs() != null) {
                    node.put("retry_after_ms", error.retryAfterMs());
                }
            }
            case NormalizedEventTypes.AUDIO_DELTA -> {
                typeAndSeq(node, event);
                if (event.audio() != null) {
                    node.set("audio", objectMapper.valueToTree(event.audio()));
                }
            }
            case NormalizedEventTypes.CITATIONS -> {
                typeAndSeq(node, event);
                node.set("citations", objectMapper.valueToTree(
                        event.citations() == null ? List.of() : event.citations()));
            }
            case NormalizedEventTypes.SAFETY -> {
                typeAndSeq(node, event);
                if (event.safety() != null) {
                    node.set("safety", objectMapper.valueToTree(event.safety()));
                }
            }
            case NormalizedEventTypes.STEP_END -> {
                typeAndSeq(node, event);
                node.put("step", event.step() == null ? 0 : event.step());
            }
            default -> {
                // raw.<n> and any type this build does not know
                typeAndSeq(node, event);
                if (event.raw() != null) {
                    node.set("raw", event.raw());
                }
            }
        }
        return node;
    }

    /**
     * Parses the full form of an event.
     *
     * @throws WireFormatException if the text is not a valid normalized event
     */
    public NormalizedEvent parse(String json) {
        try {
            return eventReader.readValue(json);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new WireFormatException("Failed to parse normalized event", e);
        }
    }

    /**
     * Checks the schema version. Only {@code start} events are checked; every other type
     * passes regardless of its schema field.
     *
     * @throws UnsupportedSchemaException if a start event carries another schema version
     */
    public static void validateSchema(NormalizedEvent event) {
        if (NormalizedEventTypes.START.equals(event.type())
                && !NormalizedEventTypes.SCHEMA_VERSION.equals(event.schema())) {
            throw new UnsupportedSchemaException(event.schema());
        }
    }

    private static void typeAndSeq(ObjectNode node, NormalizedEvent event) {
        node.put("type", event.type());
        node.put("seq", event.seq());
    }

    private static void putIfPresent(ObjectNode node, String field, String value) {
        if (value != null && !value.isEmpty()) {
            node.put(field, value);
        }
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
