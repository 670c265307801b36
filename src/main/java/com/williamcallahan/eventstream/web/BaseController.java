package com.williamcallahan.eventstream.web;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;

/**
 * Shared error handling for the streaming controllers.
 *
 * <p>These handlers only run for failures raised before the response is committed.</p>
 */
public abstract class BaseController {
    private static final Logger log = LoggerFactory.getLogger(BaseController.class);

    protected final ExceptionResponseBuilder exceptionBuilder;

    protected BaseController(ExceptionResponseBuilder exceptionBuilder) {
        this.exceptionBuilder = exceptionBuilder;
    }

    @ExceptionHandler(StreamRequestException.class)
    public ResponseEntity<ApiErrorResponse> handleStreamRequestException(StreamRequestException rejected) {
        if (rejected.status().is5xxServerError()) {
            log.warn("Stream request failed with {}: {}", rejected.status().value(), rejected.getMessage());
        } else {
            log.debug("Stream request rejected with {}: {}", rejected.status().value(), rejected.getMessage());
        }
        return exceptionBuilder.buildErrorResponse(rejected.status(), rejected.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiErrorResponse> handleUnreadableBody(HttpMessageNotReadableException unreadable) {
        return exceptionBuilder.buildErrorResponse(
                HttpStatus.BAD_REQUEST, "Malformed request body", unreadable);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiErrorResponse> handleValidationException(IllegalArgumentException validationException) {
        return exceptionBuilder.buildErrorResponse(HttpStatus.BAD_REQUEST, validationException.getMessage());
    }
}
