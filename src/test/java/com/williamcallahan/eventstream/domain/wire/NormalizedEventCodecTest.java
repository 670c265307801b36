package com.williamcallahan.eventstream.domain.wire;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

/**
 * Golden output and parsing rules for the {@code gai.events.v1} codec.
 */
class NormalizedEventCodecTest {

    private static final long TS = 1_700_000_000_000L;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final NormalizedEventCodec codec = new NormalizedEventCodec(objectMapper);

    @Test
    void startEventCompactFormCarriesSchemaAndIdentifiers() {
        NormalizedEvent start = NormalizedEvent.builder(NormalizedEventTypes.START, 1)
                .ts(TS)
                .requestId("req_1")
                .traceId("trace-9")
                .provider("openai")
                .model("gpt-4o-mini")
                .build();

        assertEquals(
                "{\"schema\":\"gai.events.v1\",\"type\":\"start\",\"ts\":1700000000000,\"seq\":1,"
                        + "\"trace_id\":\"trace-9\",\"request_id\":\"req_1\",\"provider\":\"openai\","
                        + "\"model\":\"gpt-4o-mini\"}",
                codec.toCompactJson(start));
    }

    @Test
    void textDeltaCompactFormDropsEnvelopeFields() {
        NormalizedEvent delta = NormalizedEvent.builder(NormalizedEventTypes.TEXT_DELTA, 2)
                .ts(TS)
                .requestId("req_1")
                .text("Hello")
                .build();

        assertEquals("{\"type\":\"text.delta\",\"seq\":2,\"text\":\"Hello\"}", codec.toCompactJson(delta));
    }

    @Test
    void toolCallCompactFormEmbedsInputAsJson() throws Exception {
        NormalizedEvent call = NormalizedEvent.builder(NormalizedEventTypes.TOOL_CALL, 3)
                .callId("call_1")
                .toolCall(new NormalizedEvent.ToolCall("weather", objectMapper.readTree("{\"city\":\"Paris\"}")))
                .build();

        assertEquals(
                "{\"type\":\"tool.call\",\"seq\":3,\"call_id\":\"call_1\",\"name\":\"weather\","
                        + "\"input\":{\"city\":\"Paris\"}}",
                codec.toCompactJson(call));
    }

    @Test
    void finishCompactFormHasNoSequence() {
        NormalizedEvent finish = NormalizedEvent.builder(NormalizedEventTypes.FINISH, 9)
                .usage(new NormalizedEvent.Usage(5, 7, 12))
                .finishReason("stop")
                .provider("openai")
                .build();

        assertEquals(
                "{\"type\":\"finish\",\"usage\":{\"input_tokens\":5,\"output_tokens\":7,\"total_tokens\":12},"
                        + "\"finish_reason\":\"stop\"}",
                codec.toCompactJson(finish));
    }

    @Test
    void errorCompactFormCarriesRetryHint() {
        NormalizedEvent error = NormalizedEvent.builder(NormalizedEventTypes.ERROR, 4)
                .error(new NormalizedEvent.Error("rate_limit", "slow down", true, 12_000L))
                .build();

        assertEquals(
                "{\"type\":\"error\",\"seq\":4,\"code\":\"rate_limit\",\"message\":\"slow down\","
                        + "\"retry_after_ms\":12000}",
                codec.toCompactJson(error));
    }

    @Test
    void fullFormFollowsDeclaredFieldOrderAndOmitsNulls() {
        NormalizedEvent delta = NormalizedEvent.builder(NormalizedEventTypes.TEXT_DELTA, 2)
                .ts(TS)
                .requestId("req_1")
                .text("Hello")
                .build();

        assertEquals(
                "{\"schema\":\"gai.events.v1\",\"type\":\"text.delta\",\"ts\":1700000000000,\"seq\":2,"
                        + "\"request_id\":\"req_1\",\"text\":\"Hello\"}",
                codec.toJson(delta));
    }

    @Test
    void fullFormParsesBackToTheSameEvent() throws Exception {
        NormalizedEvent original = NormalizedEvent.builder(NormalizedEventTypes.TOOL_CALL, 5)
                .ts(TS)
                .requestId("req_2")
                .traceId("trace-1")
                .callId("call_7")
                .toolCall(new NormalizedEvent.ToolCall("search", objectMapper.readTree("{\"q\":\"java\"}")))
                .build();

        assertEquals(original, codec.parse(codec.toJson(original)));
    }

    @Test
    void parseRejectsMalformedInput() {
        assertThrows(WireFormatException.class, () -> codec.parse("{\"type\":"));
        assertThrows(WireFormatException.class, () -> codec.parse("{\"seq\":1}"));
    }

    @Test
    void schemaValidationAppliesToStartEventsOnly() {
        NormalizedEvent foreignStart = NormalizedEvent.builder(NormalizedEventTypes.START, 1)
                .schema("gai.events.v2")
                .build();
        NormalizedEvent foreignDelta = NormalizedEvent.builder(NormalizedEventTypes.TEXT_DELTA, 2)
                .schema("gai.events.v2")
                .text("x")
                .build();

        UnsupportedSchemaException rejected =
                assertThrows(UnsupportedSchemaException.class, () -> NormalizedEventCodec.validateSchema(foreignStart));
        assertEquals("gai.events.v2", rejected.schema());
        assertDoesNotThrow(() -> NormalizedEventCodec.validateSchema(foreignDelta));
    }
}
