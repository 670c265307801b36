package com.williamcallahan.eventstream.transport;

/**
 * Response headers shared by the SSE and NDJSON writers.
 *
 * <p>Streams must not be cached or buffered by intermediaries, and browser clients on other
 * origins may read them.</p>
 */
public final class TransportHeaders {

    public static final String CONTENT_TYPE = "Content-Type";
    public static final String CACHE_CONTROL = "Cache-Control";
    public static final String CONNECTION = "Connection";
    public static final String ACCEL_BUFFERING = "X-Accel-Buffering";
    public static final String ALLOW_ORIGIN = "Access-Control-Allow-Origin";
    public static final String ALLOW_METHODS = "Access-Control-Allow-Methods";
    public static final String ALLOW_HEADERS = "Access-Control-Allow-Headers";

    public static final String NO_CACHE = "no-cache, no-store, must-revalidate";
    public static final String KEEP_ALIVE = "keep-alive";
    public static final String ALLOWED_METHODS = "GET, POST, OPTIONS";
    public static final String ALLOWED_HEADERS = "Content-Type, Authorization, X-Idempotency-Key";

    private TransportHeaders() {}

    /** Applies the content type plus the common cache, connection, proxy and CORS headers. */
    static void apply(ResponseChannel channel, StreamFormat format) {
        channel.header(CONTENT_TYPE, format.contentType());
        channel.header(CACHE_CONTROL, NO_CACHE);
        channel.header(CONNECTION, KEEP_ALIVE);
        channel.header(ACCEL_BUFFERING, "no"); // Nginx: disable proxy buffering
        channel.header(ALLOW_ORIGIN, "*");
        channel.header(ALLOW_METHODS, ALLOWED_METHODS);
        channel.header(ALLOW_HEADERS, ALLOWED_HEADERS);
    }
}
