package com.williamcallahan.eventstream.stream;

/**
 * Fixed per-stream identifiers stamped onto normalized events.
 *
 * @param requestId request correlation id, never blank
 * @param traceId distributed trace id, may be null
 * @param provider provider name, may be null
 * @param model model name, may be null
 */
public record StreamMetadata(String requestId, String traceId, String provider, String model) {
    public StreamMetadata {
        if (requestId == null || requestId.isBlank()) {
            throw new IllegalArgumentException("requestId cannot be null or blank");
        }
        traceId = blankToNull(traceId);
        provider = blankToNull(provider);
        model = blankToNull(model);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
