package com.williamcallahan.eventstream.domain.wire;

/**
 * Type tags and schema version of the {@code gai.events.v1} wire format.
 *
 * <p>These strings are a public contract. Renaming one is a breaking schema change.</p>
 */
public final class NormalizedEventTypes {

    /** Schema version carried by every normalized event and checked on {@code start}. */
    public static final String SCHEMA_VERSION = "gai.events.v1";

    public static final String START = "start";
    public static final String TEXT_DELTA = "text.delta";
    public static final String AUDIO_DELTA = "audio.delta";
    public static final String TOOL_CALL = "tool.call";
    public static final String TOOL_RESULT = "tool.result";
    public static final String CITATIONS = "citations";
    public static final String SAFETY = "safety";
    public static final String STEP_END = "step.end";
    public static final String FINISH = "finish";
    public static final String ERROR = "error";

    /** Transport-level terminal event; never produced by the normalizer. */
    public static final String DONE = "done";

    private static final String RAW_PREFIX = "raw.";

    private NormalizedEventTypes() {}

    /** Type tag for a provider-specific event with the given numeric kind. */
    public static String raw(int kindCode) {
        return RAW_PREFIX + kindCode;
    }

    public static boolean isRaw(String type) {
        return type != null && type.startsWith(RAW_PREFIX);
    }
}
