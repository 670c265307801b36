package com.williamcallahan.eventstream.domain.event;

/**
 * Token counters reported with a finish event.
 *
 * @param inputTokens prompt tokens
 * @param outputTokens completion tokens
 * @param totalTokens total billed tokens
 */
public record TokenUsage(long inputTokens, long outputTokens, long totalTokens) {
    public TokenUsage {
        if (inputTokens < 0 || outputTokens < 0 || totalTokens < 0) {
            throw new IllegalArgumentException("token counts cannot be negative");
        }
    }

    /** Usage whose total is the sum of input and output. */
    public static TokenUsage of(long inputTokens, long outputTokens) {
        return new TokenUsage(inputTokens, outputTokens, inputTokens + outputTokens);
    }
}
