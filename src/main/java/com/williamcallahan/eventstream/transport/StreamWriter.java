package com.williamcallahan.eventstream.transport;

import com.williamcallahan.eventstream.stream.StreamCancellation;
import java.io.IOException;

/**
 * Writes one stream of frames to one response. Instances are single-use.
 */
public interface StreamWriter {

    /**
     * Sets the transport headers, writes every frame and the terminal marker.
     *
     * <p>Returns normally when the frames are exhausted or the stream is cancelled.</p>
     *
     * @throws IOException if the response can no longer be written; the stream is aborted
     *     and {@code cancellation} has been triggered
     * @throws InterruptedException if the writing thread is interrupted
     */
    void write(FrameSource frames, ResponseChannel channel, StreamCancellation cancellation)
            throws IOException, InterruptedException;
}
