package com.williamcallahan.eventstream.web;

import com.williamcallahan.eventstream.transport.StreamMode;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * OpenAI-compatible chat completions endpoint. Always streams; defaults to passthrough
 * chunks so existing OpenAI clients work unchanged.
 */
@RestController
public class ChatCompletionsController extends BaseController {

    private final StreamDispatcher dispatcher;

    public ChatCompletionsController(StreamDispatcher dispatcher, ExceptionResponseBuilder exceptionBuilder) {
        super(exceptionBuilder);
        this.dispatcher = dispatcher;
    }

    @PostMapping("/v1/chat/completions")
    public void completions(
            @RequestBody StreamRequest body, HttpServletRequest request, HttpServletResponse response) {
        dispatcher.dispatch(body, request, response, StreamMode.PASSTHROUGH);
    }
}
