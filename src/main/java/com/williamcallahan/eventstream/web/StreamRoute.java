package com.williamcallahan.eventstream.web;

import com.williamcallahan.eventstream.transport.StreamFormat;
import com.williamcallahan.eventstream.transport.StreamMode;
import java.util.Locale;

/**
 * Transport and event shape negotiated for one request.
 *
 * <p>Format: an {@code Accept} of {@code text/event-stream} wins, then
 * {@code application/x-ndjson} or {@code application/json}, then path hints
 * ({@code /events}, {@code /sse}, {@code /ndjson}), then SSE. Mode: the {@code mode}
 * parameter, then the {@code X-Stream-Mode} header, then the endpoint default.</p>
 */
public record StreamRoute(StreamFormat format, StreamMode mode) {

    public static StreamRoute resolve(
            String accept, String path, String modeParameter, String modeHeader, StreamMode endpointDefault) {
        return new StreamRoute(
                resolveFormat(accept, path), resolveMode(modeParameter, modeHeader, endpointDefault));
    }

    static StreamFormat resolveFormat(String accept, String path) {
        if (accept != null) {
            String normalizedAccept = accept.toLowerCase(Locale.ROOT);
            if (normalizedAccept.contains("text/event-stream")) {
                return StreamFormat.SSE;
            }
            if (normalizedAccept.contains("application/x-ndjson") || normalizedAccept.contains("application/json")) {
                return StreamFormat.NDJSON;
            }
        }
        if (path != null) {
            if (path.contains("/events") || path.contains("/sse")) {
                return StreamFormat.SSE;
            }
            if (path.contains("/ndjson")) {
                return StreamFormat.NDJSON;
            }
        }
        return StreamFormat.SSE;
    }

    static StreamMode resolveMode(String modeParameter, String modeHeader, StreamMode endpointDefault) {
        return StreamMode.fromHint(modeParameter)
                .or(() -> StreamMode.fromHint(modeHeader))
                .orElse(endpointDefault == null ? StreamMode.NORMALIZED : endpointDefault);
    }
}
