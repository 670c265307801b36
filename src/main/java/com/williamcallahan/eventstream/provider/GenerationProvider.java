package com.williamcallahan.eventstream.provider;

import com.williamcallahan.eventstream.domain.errors.GenerationException;
import com.williamcallahan.eventstream.stream.EventStream;

/**
 * Upstream source of generation events.
 */
public interface GenerationProvider {

    /** Provider name stamped on normalized start and finish events. */
    String name();

    /** Whether the provider is configured to serve requests. */
    boolean isAvailable();

    /**
     * Opens a streaming generation.
     *
     * <p>Failures that occur before the first event are thrown; failures after that are
     * delivered in-band as {@link com.williamcallahan.eventstream.domain.event.GenerationEvent.Failure}.
     * Closing the returned stream cancels the upstream call.</p>
     *
     * @throws GenerationException if the upstream call cannot be opened
     */
    EventStream stream(GenerationRequest request);
}
