package com.williamcallahan.eventstream.config;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.eventstream.transport.NdjsonOptions;
import com.williamcallahan.eventstream.transport.SseOptions;
import java.time.Duration;
import org.junit.jupiter.api.Test;

/**
 * Verifies streaming property validation and the options handed to the writers.
 */
class StreamingPropertiesValidationTest {

    @Test
    void defaultsAreValid() {
        assertDoesNotThrow(new StreamingProperties()::validateConfiguration);
    }

    @Test
    void rejectsZeroQueueCapacity() {
        StreamingProperties properties = new StreamingProperties();
        properties.getPipeline().setQueueCapacity(0);

        IllegalArgumentException rejected =
                assertThrows(IllegalArgumentException.class, properties::validateConfiguration);
        assertTrue(rejected.getMessage().contains("streaming.pipeline.queue-capacity"));
    }

    @Test
    void rejectsNonPositiveHeartbeatInterval() {
        StreamingProperties properties = new StreamingProperties();
        properties.getSse().setHeartbeatInterval(Duration.ZERO);

        assertThrows(IllegalArgumentException.class, properties::validateConfiguration);
    }

    @Test
    void rejectsNegativeMaxRetries() {
        StreamingProperties properties = new StreamingProperties();
        properties.getSse().setMaxRetries(-1);

        assertThrows(IllegalArgumentException.class, properties::validateConfiguration);
    }

    @Test
    void rejectsMissingSessionTimeout() {
        StreamingProperties properties = new StreamingProperties();
        properties.getPipeline().setSessionTimeout(null);

        assertThrows(IllegalArgumentException.class, properties::validateConfiguration);
    }

    @Test
    void optionsMirrorConfiguredValues() {
        StreamingProperties properties = new StreamingProperties();
        properties.getSse().setHeartbeatInterval(Duration.ofSeconds(5));
        properties.getSse().setIncludeIds(true);
        properties.getNdjson().setCompactJson(false);
        properties.getNdjson().setFlushInterval(Duration.ofMillis(250));

        SseOptions sse = properties.sseOptions();
        NdjsonOptions ndjson = properties.ndjsonOptions();

        assertEquals(Duration.ofSeconds(5), sse.heartbeatInterval());
        assertTrue(sse.includeIds());
        assertEquals(SseOptions.DEFAULT_MAX_RETRIES, sse.maxRetries());
        assertFalse(ndjson.compactJson());
        assertEquals(Duration.ofMillis(250), ndjson.flushInterval());
    }
}
