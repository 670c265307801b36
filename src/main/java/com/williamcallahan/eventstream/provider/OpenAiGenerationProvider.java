package com.williamcallahan.eventstream.provider;

import com.openai.client.OpenAIClient;
import com.openai.client.okhttp.OpenAIOkHttpClient;
import com.openai.core.http.StreamResponse;
import com.openai.models.chat.completions.ChatCompletionAssistantMessageParam;
import com.openai.models.chat.completions.ChatCompletionChunk;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import com.openai.models.chat.completions.ChatCompletionStreamOptions;
import com.williamcallahan.eventstream.config.StreamingExecutorsConfig;
import com.williamcallahan.eventstream.config.StreamingProperties;
import com.williamcallahan.eventstream.domain.errors.ErrorCategory;
import com.williamcallahan.eventstream.domain.errors.GenerationException;
import com.williamcallahan.eventstream.domain.event.GenerationEvent;
import com.williamcallahan.eventstream.stream.EventStream;
import com.williamcallahan.eventstream.stream.QueueingEventStream;
import java.util.Iterator;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Streams chat completions from an OpenAI-compatible endpoint through the OpenAI Java SDK.
 *
 * <p>The upstream call is opened on the caller's thread so HTTP failures surface before any
 * response bytes are written. Chunks are then read on the pipeline executor and pushed into a
 * bounded {@link QueueingEventStream}; closing that stream closes the SDK response.</p>
 */
@Service
public class OpenAiGenerationProvider implements GenerationProvider {
    private static final Logger log = LoggerFactory.getLogger(OpenAiGenerationProvider.class);

    private static final String IDEMPOTENCY_HEADER = "Idempotency-Key";

    private final String providerName;
    private final int queueCapacity;
    private final ExecutorService producerExecutor;
    private final OpenAiErrorMapper errorMapper;
    private final OpenAIClient client;

    public OpenAiGenerationProvider(
            StreamingProperties properties,
            @Qualifier(StreamingExecutorsConfig.PIPELINE_EXECUTOR) ExecutorService producerExecutor) {
        this.providerName = properties.getProvider().getName();
        this.queueCapacity = properties.getPipeline().getQueueCapacity();
        this.producerExecutor = producerExecutor;
        this.errorMapper = new OpenAiErrorMapper(providerName);
        this.client = createClient(properties.getOpenai());
    }

    private static OpenAIClient createClient(StreamingProperties.OpenAi openAi) {
        String apiKey = openAi.getApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("No API key configured (streaming.openai.api-key) - generation streaming will not be available");
            return null;
        }
        log.info("Initializing OpenAI client for {}", openAi.getBaseUrl());
        return OpenAIOkHttpClient.builder()
                .apiKey(apiKey)
                .baseUrl(openAi.getBaseUrl())
                .timeout(openAi.getTimeout())
                .build();
    }

    @Override
    public String name() {
        return providerName;
    }

    @Override
    public boolean isAvailable() {
        return client != null;
    }

    @Override
    public EventStream stream(GenerationRequest request) {
        if (client == null) {
            throw GenerationException.builder(ErrorCategory.AUTH, "OpenAI client is not configured")
                    .provider(providerName)
                    .retryable(false)
                    .build();
        }
        StreamResponse<ChatCompletionChunk> response;
        try {
            response = client.chat().completions().createStreaming(buildParams(request));
        } catch (RuntimeException openFailure) {
            throw errorMapper.map(openFailure);
        }

        QueueingEventStream events = new QueueingEventStream(queueCapacity);
        Future<?> producer;
        try {
            producer = producerExecutor.submit(() -> produce(request.requestId(), response, events));
        } catch (RejectedExecutionException rejected) {
            response.close();
            throw GenerationException.builder(ErrorCategory.TRANSIENT, "Streaming executor rejected the request")
                    .provider(providerName)
                    .cause(rejected)
                    .build();
        }
        events.onClose(() -> {
            producer.cancel(true);
            response.close();
        });
        return events;
    }

    private void produce(
            String requestId, StreamResponse<ChatCompletionChunk> response, QueueingEventStream events) {
        OpenAiStreamAccumulator accumulator = new OpenAiStreamAccumulator();
        try {
            if (!events.emit(new GenerationEvent.Start())) {
                return;
            }
            Iterator<ChatCompletionChunk> chunks = response.stream().iterator();
            while (chunks.hasNext()) {
                if (!emitChunk(chunks.next(), accumulator, events)) {
                    return;
                }
            }
            for (GenerationEvent closing : accumulator.finish()) {
                if (!events.emit(closing)) {
                    return;
                }
            }
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
        } catch (RuntimeException upstreamFailure) {
            if (events.isClosed()) {
                log.debug("Upstream read ended after close (request {})", requestId);
            } else {
                log.warn("Upstream stream failed (request {}): {}", requestId, upstreamFailure.getMessage());
                emitFailure(events, errorMapper.map(upstreamFailure));
            }
        } finally {
            events.complete();
            response.close();
        }
    }

    private static boolean emitChunk(
            ChatCompletionChunk chunk, OpenAiStreamAccumulator accumulator, QueueingEventStream events)
            throws InterruptedException {
        chunk.usage().ifPresent(usage ->
                accumulator.usage(usage.promptTokens(), usage.completionTokens(), usage.totalTokens()));
        for (ChatCompletionChunk.Choice choice : chunk.choices()) {
            ChatCompletionChunk.Choice.Delta delta = choice.delta();
            delta.toolCalls().ifPresent(toolCalls -> toolCalls.forEach(toolCall -> accumulator.toolCallDelta(
                    toolCall.index(),
                    toolCall.id().orElse(null),
                    toolCall.function().flatMap(function -> function.name()).orElse(null),
                    toolCall.function().flatMap(function -> function.arguments()).orElse(null))));
            choice.finishReason().ifPresent(reason -> accumulator.finishReason(reason.asString()));
            Optional<GenerationEvent> text = accumulator.content(delta.content().orElse(null));
            if (text.isPresent() && !events.emit(text.get())) {
                return false;
            }
        }
        return true;
    }

    private static void emitFailure(QueueingEventStream events, GenerationException failure) {
        try {
            events.emit(new GenerationEvent.Failure(failure));
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    private static ChatCompletionCreateParams buildParams(GenerationRequest request) {
        ChatCompletionCreateParams.Builder builder =
                ChatCompletionCreateParams.builder().model(request.model());
        for (ChatMessage message : request.messages()) {
            switch (message.role()) {
                case "system" -> builder.addSystemMessage(message.content());
                case "developer" -> builder.addDeveloperMessage(message.content());
                case "assistant" -> builder.addMessage(ChatCompletionAssistantMessageParam.builder()
                        .content(message.content())
                        .build());
                default -> builder.addUserMessage(message.content());
            }
        }
        if (request.temperature() != null) {
            builder.temperature(request.temperature());
        }
        if (request.maxTokens() != null) {
            builder.maxCompletionTokens(request.maxTokens().longValue());
        }
        builder.streamOptions(ChatCompletionStreamOptions.builder().includeUsage(true).build());
        if (request.idempotencyKey() != null && !request.idempotencyKey().isBlank()) {
            builder.putAdditionalHeader(IDEMPOTENCY_HEADER, request.idempotencyKey());
        }
        return builder.build();
    }
}
