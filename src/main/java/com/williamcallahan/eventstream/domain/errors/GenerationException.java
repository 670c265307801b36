package com.williamcallahan.eventstream.domain.errors;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Structured failure raised by a generation provider.
 *
 * <p>Construction uses {@link #builder(ErrorCategory, String)}. Retryability starts from the
 * category default and is overridden by an HTTP status when one is supplied: 429 and 5xx are
 * retryable, any other 4xx is not.</p>
 */
public class GenerationException extends RuntimeException {

    private final ErrorCategory category;
    private final String provider;
    private final String code;
    private final int httpStatus;
    private final boolean retryable;
    private final Duration retryAfter;

    private GenerationException(Builder builder) {
        super(builder.message, builder.cause);
        this.category = builder.category;
        this.provider = builder.provider;
        this.code = builder.code;
        this.httpStatus = builder.httpStatus;
        this.retryable = builder.resolveRetryable();
        this.retryAfter = builder.retryAfter;
    }

    public static Builder builder(ErrorCategory category, String message) {
        return new Builder(category, message);
    }

    public ErrorCategory category() {
        return category;
    }

    /** Provider name, empty when unknown. */
    public String provider() {
        return provider;
    }

    /** Provider error code, empty when the provider gave none. */
    public String code() {
        return code;
    }

    /** Provider code when present, otherwise the category wire name. */
    public String wireCode() {
        return code.isEmpty() ? category.wireName() : code;
    }

    /** HTTP status of the failed upstream call, zero when not applicable. */
    public int httpStatus() {
        return httpStatus;
    }

    public boolean retryable() {
        return retryable;
    }

    public Optional<Duration> retryAfter() {
        return Optional.ofNullable(retryAfter);
    }

    @Override
    public String toString() {
        StringBuilder description = new StringBuilder();
        if (!provider.isEmpty()) {
            description.append('[').append(provider).append("] ");
        }
        description.append(category.wireName());
        if (!code.isEmpty()) {
            description.append(" (").append(code).append(')');
        }
        description.append(' ').append(getMessage());
        if (httpStatus != 0) {
            description.append(" (HTTP ").append(httpStatus).append(')');
        }
        if (retryAfter != null) {
            description.append(" (retry after ").append(retryAfter.toSeconds()).append("s)");
        }
        return description.toString();
    }

    /**
     * Fluent builder; category and message are required, everything else is optional.
     */
    public static final class Builder {
        private final ErrorCategory category;
        private final String message;
        private String provider = "";
        private String code = "";
        private int httpStatus;
        private Boolean retryable;
        private Duration retryAfter;
        private Throwable cause;

        private Builder(ErrorCategory category, String message) {
            this.category = Objects.requireNonNull(category, "category");
            this.message = message == null ? "" : message;
        }

        public Builder provider(String provider) {
            this.provider = provider == null ? "" : provider;
            return this;
        }

        public Builder code(String code) {
            this.code = code == null ? "" : code;
            return this;
        }

        public Builder httpStatus(int httpStatus) {
            this.httpStatus = httpStatus;
            return this;
        }

        /** Overrides both the category default and any HTTP-derived retryability. */
        public Builder retryable(boolean retryable) {
            this.retryable = retryable;
            return this;
        }

        public Builder retryAfter(Duration retryAfter) {
            if (retryAfter != null && retryAfter.isNegative()) {
                throw new IllegalArgumentException("retryAfter cannot be negative");
            }
            this.retryAfter = retryAfter;
            return this;
        }

        public Builder cause(Throwable cause) {
            this.cause = cause;
            return this;
        }

        public GenerationException build() {
            return new GenerationException(this);
        }

        private boolean resolveRetryable() {
            if (retryable != null) {
                return retryable;
            }
            if (httpStatus == 429 || httpStatus >= 500) {
                return true;
            }
            if (httpStatus >= 400) {
                return false;
            }
            return category.retryableByDefault();
        }
    }
}
