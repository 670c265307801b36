package com.williamcallahan.eventstream.transport;

import java.util.Optional;

/** Blocking supplier of frames for a writer; empty means the stream has ended. */
@FunctionalInterface
public interface FrameSource {

    Optional<WireFrame> next() throws InterruptedException;
}
