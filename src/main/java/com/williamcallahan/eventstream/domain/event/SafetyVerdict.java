package com.williamcallahan.eventstream.domain.event;

/**
 * Provider safety classification for a span of output.
 *
 * @param category harm category reported by the provider
 * @param action action taken, for example {@code block} or {@code allow}
 * @param score provider confidence in [0, 1]
 * @param note free-form provider detail, may be empty
 */
public record SafetyVerdict(String category, String action, double score, String note) {
    public SafetyVerdict {
        if (category == null || category.isBlank()) {
            throw new IllegalArgumentException("category cannot be null or blank");
        }
        action = action == null ? "" : action;
        note = note == null ? "" : note;
    }
}
