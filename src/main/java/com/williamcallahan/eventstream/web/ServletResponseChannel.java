package com.williamcallahan.eventstream.web;

import com.williamcallahan.eventstream.transport.ResponseChannel;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.io.OutputStream;

/** {@link ResponseChannel} over a servlet response. */
final class ServletResponseChannel implements ResponseChannel {

    private final HttpServletResponse response;

    ServletResponseChannel(HttpServletResponse response) {
        this.response = response;
    }

    @Override
    public void header(String name, String value) {
        if (response.isCommitted()) {
            throw new IllegalStateException("Response already committed; cannot set header " + name);
        }
        response.setHeader(name, value);
    }

    @Override
    public OutputStream body() throws IOException {
        return response.getOutputStream();
    }
}
