package com.williamcallahan.eventstream.web;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Standard JSON error payload for requests that fail before streaming starts.
 *
 * @param status fixed status indicator, always {@code "error"}
 * @param message user-facing error message
 * @param details optional diagnostic details, omitted when null
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiErrorResponse(String status, String message, String details) {

    public static ApiErrorResponse error(String message) {
        return new ApiErrorResponse("error", message, null);
    }

    public static ApiErrorResponse error(String message, String details) {
        return new ApiErrorResponse("error", message, details);
    }
}
