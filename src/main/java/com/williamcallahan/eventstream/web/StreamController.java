package com.williamcallahan.eventstream.web;

import com.williamcallahan.eventstream.transport.StreamMode;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Streaming generation endpoints.
 *
 * <p>{@code /api/stream} negotiates the transport from {@code Accept}; the suffixed paths
 * pin it. All default to normalized {@code gai.events.v1} events; pass
 * {@code ?mode=passthrough} or {@code X-Stream-Mode: passthrough} for OpenAI chunks.</p>
 */
@RestController
@RequestMapping("/api/stream")
public class StreamController extends BaseController {

    private final StreamDispatcher dispatcher;

    public StreamController(StreamDispatcher dispatcher, ExceptionResponseBuilder exceptionBuilder) {
        super(exceptionBuilder);
        this.dispatcher = dispatcher;
    }

    @PostMapping({"", "/events", "/sse", "/ndjson"})
    public void stream(
            @RequestBody StreamRequest body, HttpServletRequest request, HttpServletResponse response) {
        dispatcher.dispatch(body, request, response, StreamMode.NORMALIZED);
    }
}
