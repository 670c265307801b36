package com.williamcallahan.eventstream.web;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import java.io.IOException;
import java.io.UncheckedIOException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;

/**
 * Verifies error bodies and exception descriptions.
 */
class ExceptionResponseBuilderTest {

    private final ExceptionResponseBuilder builder = new ExceptionResponseBuilder();

    @Test
    void describeException_usesRootCauseMessage() {
        UncheckedIOException wrapped = new UncheckedIOException("outer", new IOException("socket closed"));

        assertEquals("socket closed", builder.describeException(wrapped));
    }

    @Test
    void describeException_fallsBackToTypeName() {
        assertEquals("IllegalStateException", builder.describeException(new IllegalStateException()));
        assertNull(builder.describeException(null));
    }

    @Test
    void buildErrorResponse_setsStatusAndJsonBody() {
        ResponseEntity<ApiErrorResponse> response =
                builder.buildErrorResponse(HttpStatus.SERVICE_UNAVAILABLE, "not configured");

        assertEquals(HttpStatus.SERVICE_UNAVAILABLE, response.getStatusCode());
        assertEquals(MediaType.APPLICATION_JSON, response.getHeaders().getContentType());
        assertEquals(ApiErrorResponse.error("not configured"), response.getBody());
    }
}
