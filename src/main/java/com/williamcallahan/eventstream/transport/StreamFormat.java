package com.williamcallahan.eventstream.transport;

/** Transport framing. */
public enum StreamFormat {
    SSE("text/event-stream"),
    NDJSON("application/x-ndjson");

    private final String contentType;

    StreamFormat(String contentType) {
        this.contentType = contentType;
    }

    public String contentType() {
        return contentType;
    }
}
