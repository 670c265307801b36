package com.williamcallahan.eventstream.provider;

import com.williamcallahan.eventstream.domain.event.GenerationEvent;
import com.williamcallahan.eventstream.domain.event.TokenUsage;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Turns the pieces of OpenAI chat-completion chunks into generation events.
 *
 * <p>Text is forwarded as it arrives. Tool calls stream as argument fragments keyed by index
 * and are emitted whole, in index order, when the completion finishes. Usage arrives on a
 * trailing chunk with no choices, so the finish event is only built once the stream ends.</p>
 *
 * <p>Not thread-safe; one accumulator per upstream stream.</p>
 */
final class OpenAiStreamAccumulator {

    private final Map<Long, PendingToolCall> toolCalls = new TreeMap<>();
    private String finishReason;
    private TokenUsage usage;

    Optional<GenerationEvent> content(String text) {
        if (text == null || text.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new GenerationEvent.TextDelta(text));
    }

    void toolCallDelta(long index, String id, String name, String argumentsFragment) {
        PendingToolCall pending = toolCalls.computeIfAbsent(index, ignored -> new PendingToolCall());
        if (id != null && !id.isEmpty()) {
            pending.id = id;
        }
        if (name != null && !name.isEmpty()) {
            pending.name = name;
        }
        if (argumentsFragment != null) {
            pending.arguments.append(argumentsFragment);
        }
    }

    void finishReason(String reason) {
        if (reason != null && !reason.isEmpty()) {
            finishReason = reason;
        }
    }

    void usage(long promptTokens, long completionTokens, long totalTokens) {
        usage = new TokenUsage(promptTokens, completionTokens, totalTokens);
    }

    /** Completed tool calls followed by the finish event. */
    List<GenerationEvent> finish() {
        List<GenerationEvent> events = new ArrayList<>();
        for (PendingToolCall pending : toolCalls.values()) {
            if (pending.name != null) {
                events.add(new GenerationEvent.ToolCall(pending.id, pending.name, pending.arguments.toString()));
            }
        }
        toolCalls.clear();
        events.add(new GenerationEvent.Finish(usage, finishReason));
        return events;
    }

    private static final class PendingToolCall {
        private String id;
        private String name;
        private final StringBuilder arguments = new StringBuilder();
    }
}
