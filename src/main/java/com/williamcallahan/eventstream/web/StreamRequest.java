package com.williamcallahan.eventstream.web;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.williamcallahan.eventstream.provider.ChatMessage;
import com.williamcallahan.eventstream.provider.GenerationRequest;
import java.util.List;

/**
 * Request body shared by the streaming endpoints. Field names follow the OpenAI chat
 * completions request so the same body works on every route.
 *
 * @param model model name, optional
 * @param messages conversation, required and non-empty
 * @param temperature sampling temperature, optional
 * @param maxTokens output token cap, optional
 * @param stream accepted for compatibility; streaming is always on
 * @param requestId caller-supplied correlation id, optional
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StreamRequest(
        String model,
        List<ChatMessage> messages,
        Double temperature,
        @JsonProperty("max_tokens") Integer maxTokens,
        Boolean stream,
        @JsonProperty("request_id") String requestId) {

    /**
     * Converts to a provider request.
     *
     * @throws IllegalArgumentException if the messages are missing or a value is out of range
     */
    GenerationRequest toGenerationRequest(String idempotencyKey) {
        return new GenerationRequest(
                requestId, model, messages, temperature, maxTokens, Boolean.TRUE.equals(stream), idempotencyKey);
    }
}
