package com.williamcallahan.eventstream.transport;

import java.io.IOException;
import java.io.OutputStream;

/**
 * Minimal view of an HTTP response used by the stream writers.
 *
 * <p>Headers must be set before {@link #body()} is first written to. Once body bytes are on
 * the wire no further header changes are possible.</p>
 */
public interface ResponseChannel {

    void header(String name, String value);

    /** The response body; the writers buffer and flush it themselves. */
    OutputStream body() throws IOException;
}
