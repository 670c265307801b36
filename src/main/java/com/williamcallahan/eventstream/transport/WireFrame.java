package com.williamcallahan.eventstream.transport;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.williamcallahan.eventstream.domain.wire.NormalizedEvent;
import com.williamcallahan.eventstream.domain.wire.NormalizedEventTypes;
import java.util.Objects;

/**
 * One event ready for framing.
 *
 * @param eventType SSE event name, null in passthrough mode
 * @param payload JSON body of the frame
 * @param error whether the frame reports a failure
 * @param retryAfterMs retry hint carried by an error frame, may be null
 * @param finish whether the frame is the normalized {@code finish} event
 */
public record WireFrame(String eventType, ObjectNode payload, boolean error, Long retryAfterMs, boolean finish) {
    public WireFrame {
        Objects.requireNonNull(payload, "payload");
    }

    /** Frame for a normalized event whose compact form is {@code compact}. */
    public static WireFrame normalized(NormalizedEvent event, ObjectNode compact) {
        boolean error = NormalizedEventTypes.ERROR.equals(event.type());
        Long retryAfterMs = error && event.error() != null ? event.error().retryAfterMs() : null;
        return new WireFrame(
                event.type(), compact, error, retryAfterMs, NormalizedEventTypes.FINISH.equals(event.type()));
    }

    /** Frame for a vendor chunk; carries no event name. */
    public static WireFrame passthrough(ObjectNode chunk) {
        return new WireFrame(null, chunk, false, null, false);
    }
}
