package com.williamcallahan.eventstream.web;

import org.springframework.http.HttpStatus;

/**
 * A streaming request rejected before any response bytes were written.
 */
public class StreamRequestException extends RuntimeException {

    private final HttpStatus status;

    public StreamRequestException(HttpStatus status, String message) {
        super(message);
        this.status = status;
    }

    public StreamRequestException(HttpStatus status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public HttpStatus status() {
        return status;
    }
}
