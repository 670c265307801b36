package com.williamcallahan.eventstream.web;

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.williamcallahan.eventstream.transport.StreamFormat;
import com.williamcallahan.eventstream.transport.StreamMode;
import org.junit.jupiter.api.Test;

/**
 * Verifies transport and mode negotiation order.
 */
class StreamRouteTest {

    @Test
    void acceptHeaderWinsOverPathHint() {
        assertEquals(StreamFormat.SSE, StreamRoute.resolveFormat("text/event-stream", "/api/stream/ndjson"));
        assertEquals(StreamFormat.NDJSON, StreamRoute.resolveFormat("application/x-ndjson", "/api/stream/sse"));
        assertEquals(StreamFormat.NDJSON, StreamRoute.resolveFormat("Application/JSON", "/api/stream"));
    }

    @Test
    void pathHintAppliesWhenAcceptIsGeneric() {
        assertEquals(StreamFormat.NDJSON, StreamRoute.resolveFormat("*/*", "/api/stream/ndjson"));
        assertEquals(StreamFormat.SSE, StreamRoute.resolveFormat(null, "/api/stream/events"));
        assertEquals(StreamFormat.SSE, StreamRoute.resolveFormat(null, null));
    }

    @Test
    void modeParameterBeatsHeaderBeatsEndpointDefault() {
        assertEquals(StreamMode.PASSTHROUGH, StreamRoute.resolveMode("passthrough", "normalized", StreamMode.NORMALIZED));
        assertEquals(StreamMode.NORMALIZED, StreamRoute.resolveMode(null, "normalized", StreamMode.PASSTHROUGH));
        assertEquals(StreamMode.PASSTHROUGH, StreamRoute.resolveMode("bogus", null, StreamMode.PASSTHROUGH));
        assertEquals(StreamMode.NORMALIZED, StreamRoute.resolveMode(null, null, null));
    }

    @Test
    void resolveCombinesBoth() {
        StreamRoute route = StreamRoute.resolve(
                "application/x-ndjson", "/v1/chat/completions", null, null, StreamMode.PASSTHROUGH);

        assertEquals(new StreamRoute(StreamFormat.NDJSON, StreamMode.PASSTHROUGH), route);
    }
}
