package com.williamcallahan.eventstream.session;

import java.util.Locale;

/** How a stream session ended. */
public enum SessionOutcome {
    /** Source exhausted and the terminal marker written. */
    COMPLETED,
    /** Client went away or the session was closed early; not an error. */
    CANCELLED,
    /** Writing to the client failed. */
    ABORTED;

    /** Metric tag value. */
    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
