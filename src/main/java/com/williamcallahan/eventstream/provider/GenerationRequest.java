package com.williamcallahan.eventstream.provider;

import java.util.List;

/**
 * Provider-agnostic generation request.
 *
 * @param requestId correlation id; blank until the dispatcher assigns one
 * @param model model name, may be blank to use the provider default
 * @param messages conversation, at least one message
 * @param temperature sampling temperature, null for the provider default
 * @param maxTokens output token cap, null for the provider default
 * @param stream whether the provider should stream; the dispatcher always sets it
 * @param idempotencyKey client idempotency key, may be null
 */
public record GenerationRequest(
        String requestId,
        String model,
        List<ChatMessage> messages,
        Double temperature,
        Integer maxTokens,
        boolean stream,
        String idempotencyKey) {

    public GenerationRequest {
        if (messages == null || messages.isEmpty()) {
            throw new IllegalArgumentException("messages cannot be null or empty");
        }
        messages = List.copyOf(messages);
        requestId = requestId == null ? "" : requestId.trim();
        model = model == null ? "" : model.trim();
        if (temperature != null && (temperature.isNaN() || temperature < 0)) {
            throw new IllegalArgumentException("temperature must be a non-negative number");
        }
        if (maxTokens != null && maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens must be positive");
        }
    }

    public GenerationRequest withRequestId(String newRequestId) {
        return new GenerationRequest(newRequestId, model, messages, temperature, maxTokens, stream, idempotencyKey);
    }

    public GenerationRequest withModel(String newModel) {
        return new GenerationRequest(requestId, newModel, messages, temperature, maxTokens, stream, idempotencyKey);
    }

    public GenerationRequest withStreaming() {
        return new GenerationRequest(requestId, model, messages, temperature, maxTokens, true, idempotencyKey);
    }

    public boolean hasRequestId() {
        return !requestId.isEmpty();
    }
}
