package com.williamcallahan.eventstream.transport;

import java.util.Locale;
import java.util.Optional;

/** Shape of the events on the wire. */
public enum StreamMode {
    /** {@code gai.events.v1} normalized events. */
    NORMALIZED,
    /** OpenAI-compatible {@code chat.completion.chunk} objects. */
    PASSTHROUGH;

    /** Parses a request hint such as {@code ?mode=passthrough}; unknown values give empty. */
    public static Optional<StreamMode> fromHint(String hint) {
        if (hint == null || hint.isBlank()) {
            return Optional.empty();
        }
        return switch (hint.trim().toLowerCase(Locale.ROOT)) {
            case "normalized", "normalised", "gai" -> Optional.of(NORMALIZED);
            case "passthrough", "openai" -> Optional.of(PASSTHROUGH);
            default -> Optional.empty();
        };
    }
}
