package com.williamcallahan.eventstream.domain.event;

/**
 * Source event kinds. Declaration order is part of the wire contract because
 * {@link #code()} feeds the {@code raw.<n>} type names.
 */
public enum EventKind {
    START,
    TEXT_DELTA,
    AUDIO_DELTA,
    TOOL_CALL,
    TOOL_RESULT,
    CITATIONS,
    SAFETY,
    STEP_FINISH,
    FINISH,
    ERROR,
    RAW;

    /** Numeric code of this kind as providers report it. */
    public int code() {
        return ordinal();
    }
}
