package com.williamcallahan.eventstream.config;

import com.williamcallahan.eventstream.stream.NormalizedEventPipeline;
import com.williamcallahan.eventstream.transport.NdjsonOptions;
import com.williamcallahan.eventstream.transport.SseOptions;
import jakarta.annotation.PostConstruct;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "streaming")
public class StreamingProperties {

    private Sse sse = new Sse();
    private Ndjson ndjson = new Ndjson();
    private Pipeline pipeline = new Pipeline();
    private Provider provider = new Provider();
    private OpenAi openai = new OpenAi();

    public Sse getSse() {
        return sse;
    }

    public void setSse(Sse sse) {
        this.sse = sse;
    }

    public Ndjson getNdjson() {
        return ndjson;
    }

    public void setNdjson(Ndjson ndjson) {
        this.ndjson = ndjson;
    }

    public Pipeline getPipeline() {
        return pipeline;
    }

    public void setPipeline(Pipeline pipeline) {
        this.pipeline = pipeline;
    }

    public Provider getProvider() {
        return provider;
    }

    public void setProvider(Provider provider) {
        this.provider = provider;
    }

    public OpenAi getOpenai() {
        return openai;
    }

    public void setOpenai(OpenAi openai) {
        this.openai = openai;
    }

    /**
     * Rejects settings the writers cannot run with, at startup rather than on the first stream.
     *
     * @throws IllegalArgumentException if a value is out of range
     */
    @PostConstruct
    public void validateConfiguration() {
        requirePositive(sse.getHeartbeatInterval(), "streaming.sse.heartbeat-interval");
        requirePositive(sse.getBufferSize(), "streaming.sse.buffer-size");
        if (sse.getMaxRetries() < 0) {
            throw new IllegalArgumentException("streaming.sse.max-retries cannot be negative");
        }
        if (sse.getRetryInterval() == null || sse.getRetryInterval().isNegative()) {
            throw new IllegalArgumentException("streaming.sse.retry-interval cannot be negative");
        }
        requirePositive(ndjson.getBufferSize(), "streaming.ndjson.buffer-size");
        requirePositive(ndjson.getFlushInterval(), "streaming.ndjson.flush-interval");
        requirePositive(pipeline.getQueueCapacity(), "streaming.pipeline.queue-capacity");
        requirePositive(pipeline.getCloseTimeout(), "streaming.pipeline.close-timeout");
        requirePositive(pipeline.getSessionTimeout(), "streaming.pipeline.session-timeout");
        requirePositive(openai.getTimeout(), "streaming.openai.timeout");
    }

    /** SSE settings as the writer consumes them. */
    public SseOptions sseOptions() {
        return new SseOptions(
                sse.getHeartbeatInterval(),
                sse.isFlushAfterWrite(),
                sse.getMaxRetries(),
                sse.getRetryInterval(),
                sse.getBufferSize(),
                sse.isIncludeIds());
    }

    /** NDJSON settings as the writer consumes them. */
    public NdjsonOptions ndjsonOptions() {
        return new NdjsonOptions(
                ndjson.getBufferSize(), ndjson.getFlushInterval(), ndjson.isCompactJson(), ndjson.isIncludeTimestamps());
    }

    private static void requirePositive(int value, String name) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive, got " + value);
        }
    }

    private static void requirePositive(Duration value, String name) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive, got " + value);
        }
    }

    public static class Sse {
        private Duration heartbeatInterval = SseOptions.DEFAULT_HEARTBEAT_INTERVAL;
        private boolean flushAfterWrite = true;
        private int maxRetries = SseOptions.DEFAULT_MAX_RETRIES;
        private Duration retryInterval = SseOptions.DEFAULT_RETRY_INTERVAL;
        private int bufferSize = SseOptions.DEFAULT_BUFFER_SIZE;
        private boolean includeIds;

        public Duration getHeartbeatInterval() {
            return heartbeatInterval;
        }

        public void setHeartbeatInterval(Duration heartbeatInterval) {
            this.heartbeatInterval = heartbeatInterval;
        }

        public boolean isFlushAfterWrite() {
            return flushAfterWrite;
        }

        public void setFlushAfterWrite(boolean flushAfterWrite) {
            this.flushAfterWrite = flushAfterWrite;
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public Duration getRetryInterval() {
            return retryInterval;
        }

        public void setRetryInterval(Duration retryInterval) {
            this.retryInterval = retryInterval;
        }

        public int getBufferSize() {
            return bufferSize;
        }

        public void setBufferSize(int bufferSize) {
            this.bufferSize = bufferSize;
        }

        public boolean isIncludeIds() {
            return includeIds;
        }

        public void setIncludeIds(boolean includeIds) {
            this.includeIds = includeIds;
        }
    }

    public static class Ndjson {
        private int bufferSize = NdjsonOptions.DEFAULT_BUFFER_SIZE;
        private Duration flushInterval = NdjsonOptions.DEFAULT_FLUSH_INTERVAL;
        private boolean compactJson = true;
        private boolean includeTimestamps;

        public int getBufferSize() {
            return bufferSize;
        }

        public void setBufferSize(int bufferSize) {
            this.bufferSize = bufferSize;
        }

        public Duration getFlushInterval() {
            return flushInterval;
        }

        public void setFlushInterval(Duration flushInterval) {
            this.flushInterval = flushInterval;
        }

        public boolean isCompactJson() {
            return compactJson;
        }

        public void setCompactJson(boolean compactJson) {
            this.compactJson = compactJson;
        }

        public boolean isIncludeTimestamps() {
            return includeTimestamps;
        }

        public void setIncludeTimestamps(boolean includeTimestamps) {
            this.includeTimestamps = includeTimestamps;
        }
    }

    public static class Pipeline {
        private int queueCapacity = NormalizedEventPipeline.DEFAULT_QUEUE_CAPACITY;
        private Duration closeTimeout = Duration.ofSeconds(2);
        private Duration sessionTimeout = Duration.ofMinutes(30);

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        /** How long a closing session waits for its forwarding task before logging a leak. */
        public Duration getCloseTimeout() {
            return closeTimeout;
        }

        public void setCloseTimeout(Duration closeTimeout) {
            this.closeTimeout = closeTimeout;
        }

        /** Servlet async timeout for one streaming response; expiry cancels the session. */
        public Duration getSessionTimeout() {
            return sessionTimeout;
        }

        public void setSessionTimeout(Duration sessionTimeout) {
            this.sessionTimeout = sessionTimeout;
        }
    }

    public static class Provider {
        private String name = "openai";
        private String defaultModel = "gpt-4o-mini";

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getDefaultModel() {
            return defaultModel;
        }

        public void setDefaultModel(String defaultModel) {
            this.defaultModel = defaultModel;
        }
    }

    public static class OpenAi {
        private String apiKey = "";
        private String baseUrl = "https://api.openai.com/v1";
        private Duration timeout = Duration.ofSeconds(60);

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }
    }
}
