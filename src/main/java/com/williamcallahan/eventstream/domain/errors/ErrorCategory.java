package com.williamcallahan.eventstream.domain.errors;

/**
 * Classification of generation failures. Wire names are stable and appear in error events
 * when a provider does not supply its own code.
 */
public enum ErrorCategory {
    UNKNOWN("unknown"),
    TRANSIENT("transient"),
    RATE_LIMIT("rate_limit"),
    CONTENT_FILTERED("content_filtered"),
    BAD_REQUEST("bad_request"),
    AUTH("auth"),
    NOT_FOUND("not_found"),
    TIMEOUT("timeout"),
    CONTEXT_SIZE("context_size"),
    QUOTA("quota"),
    UNSUPPORTED("unsupported");

    private final String wireName;

    ErrorCategory(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /** Whether a failure of this category is retryable absent other information. */
    public boolean retryableByDefault() {
        return this == TRANSIENT || this == RATE_LIMIT;
    }
}
