package com.williamcallahan.eventstream.provider;

import com.openai.core.http.Headers;
import com.openai.errors.OpenAIIoException;
import com.openai.errors.OpenAIServiceException;
import com.openai.errors.PermissionDeniedException;
import com.openai.errors.RateLimitException;
import com.openai.errors.UnauthorizedException;
import com.williamcallahan.eventstream.domain.errors.ErrorCategory;
import com.williamcallahan.eventstream.domain.errors.GenerationException;
import java.time.Duration;
import java.util.List;

/**
 * Maps OpenAI SDK failures onto {@link GenerationException}.
 */
final class OpenAiErrorMapper {

    private static final String RETRY_AFTER_HEADER = "Retry-After";
    private static final int HTTP_BAD_REQUEST = 400;
    private static final int HTTP_UNAUTHORIZED = 401;
    private static final int HTTP_FORBIDDEN = 403;
    private static final int HTTP_NOT_FOUND = 404;
    private static final int HTTP_REQUEST_TIMEOUT = 408;
    private static final int HTTP_PAYLOAD_TOO_LARGE = 413;
    private static final int HTTP_UNPROCESSABLE = 422;
    private static final int HTTP_TOO_MANY_REQUESTS = 429;
    private static final int HTTP_INTERNAL_SERVER_ERROR = 500;

    private final String providerName;

    OpenAiErrorMapper(String providerName) {
        this.providerName = providerName;
    }

    GenerationException map(Throwable failure) {
        if (failure instanceof GenerationException generationException) {
            return generationException;
        }
        if (failure instanceof OpenAIServiceException serviceException) {
            return mapServiceException(serviceException);
        }
        if (failure instanceof OpenAIIoException) {
            return GenerationException.builder(ErrorCategory.TRANSIENT, describe(failure))
                    .provider(providerName)
                    .cause(failure)
                    .build();
        }
        return GenerationException.builder(ErrorCategory.UNKNOWN, describe(failure))
                .provider(providerName)
                .cause(failure)
                .build();
    }

    private GenerationException mapServiceException(OpenAIServiceException serviceException) {
        int statusCode = serviceException.statusCode();
        GenerationException.Builder builder = GenerationException.builder(
                        categorize(serviceException, statusCode), describe(serviceException))
                .provider(providerName)
                .httpStatus(statusCode)
                .cause(serviceException);
        if (statusCode == HTTP_TOO_MANY_REQUESTS) {
            builder.retryAfter(parseRetryAfter(serviceException.headers()));
        }
        return builder.build();
    }

    private static ErrorCategory categorize(OpenAIServiceException serviceException, int statusCode) {
        if (serviceException instanceof RateLimitException || statusCode == HTTP_TOO_MANY_REQUESTS) {
            return ErrorCategory.RATE_LIMIT;
        }
        if (serviceException instanceof UnauthorizedException
                || serviceException instanceof PermissionDeniedException
                || statusCode == HTTP_UNAUTHORIZED
                || statusCode == HTTP_FORBIDDEN) {
            return ErrorCategory.AUTH;
        }
        if (statusCode == HTTP_NOT_FOUND) {
            return ErrorCategory.NOT_FOUND;
        }
        if (statusCode == HTTP_REQUEST_TIMEOUT) {
            return ErrorCategory.TIMEOUT;
        }
        if (statusCode == HTTP_PAYLOAD_TOO_LARGE) {
            return ErrorCategory.CONTEXT_SIZE;
        }
        if (statusCode == HTTP_BAD_REQUEST || statusCode == HTTP_UNPROCESSABLE) {
            return ErrorCategory.BAD_REQUEST;
        }
        if (statusCode >= HTTP_INTERNAL_SERVER_ERROR) {
            return ErrorCategory.TRANSIENT;
        }
        return ErrorCategory.UNKNOWN;
    }

    /**
     * Reads Retry-After as whole seconds. HTTP-date values and garbage yield null so the
     * writer falls back to its configured retry interval.
     */
    static Duration parseRetryAfter(Headers headers) {
        if (headers == null) {
            return null;
        }
        List<String> values = headers.values(RETRY_AFTER_HEADER);
        if (values.isEmpty()) {
            return null;
        }
        String trimmed = values.get(0).trim();
        if (trimmed.isEmpty() || !trimmed.chars().allMatch(Character::isDigit)) {
            return null;
        }
        try {
            return Duration.ofSeconds(Long.parseLong(trimmed));
        } catch (NumberFormatException overflow) {
            return null;
        }
    }

    private static String describe(Throwable failure) {
        String message = failure.getMessage();
        return message == null || message.isBlank() ? failure.getClass().getSimpleName() : message;
    }
}
