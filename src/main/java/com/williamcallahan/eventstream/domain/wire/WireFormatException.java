package com.williamcallahan.eventstream.domain.wire;

/**
 * Thrown when a normalized event cannot be serialized or parsed.
 */
public class WireFormatException extends RuntimeException {

    public WireFormatException(String message, Throwable cause) {
        super(message, cause);
    }

    public WireFormatException(String message) {
        super(message);
    }
}
