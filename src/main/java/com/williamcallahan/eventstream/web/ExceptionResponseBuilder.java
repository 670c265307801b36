package com.williamcallahan.eventstream.web;

import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;

/**
 * Builds the error responses returned before a stream is opened.
 *
 * <p>Errors that happen after the first body byte are delivered in-band as error events;
 * this builder is never used for those.</p>
 */
@Component
public class ExceptionResponseBuilder {

    /**
     * Builds a standardized error response with status and message.
     *
     * @param status HTTP status
     * @param message user-facing message
     * @return JSON error response
     */
    public ResponseEntity<ApiErrorResponse> buildErrorResponse(HttpStatus status, String message) {
        return ResponseEntity.status(status)
                .contentType(MediaType.APPLICATION_JSON)
                .body(ApiErrorResponse.error(message));
    }

    /**
     * Builds an error response carrying the root cause message as details.
     */
    public ResponseEntity<ApiErrorResponse> buildErrorResponse(HttpStatus status, String message, Exception exception) {
        return ResponseEntity.status(status)
                .contentType(MediaType.APPLICATION_JSON)
                .body(ApiErrorResponse.error(message, describeException(exception)));
    }

    /**
     * Describes an exception for client diagnostics, falling back to the type name.
     */
    public String describeException(Exception exception) {
        if (exception == null) {
            return null;
        }
        Throwable root = exception;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        String message = root.getMessage();
        return message == null || message.isBlank() ? root.getClass().getSimpleName() : message;
    }
}
