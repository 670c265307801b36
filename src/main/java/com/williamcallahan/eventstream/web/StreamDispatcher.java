package com.williamcallahan.eventstream.web;

import com.williamcallahan.eventstream.config.StreamingExecutorsConfig;
import com.williamcallahan.eventstream.config.StreamingProperties;
import com.williamcallahan.eventstream.domain.errors.GenerationException;
import com.williamcallahan.eventstream.provider.GenerationProvider;
import com.williamcallahan.eventstream.provider.GenerationRequest;
import com.williamcallahan.eventstream.session.SessionOutcome;
import com.williamcallahan.eventstream.session.StreamSession;
import com.williamcallahan.eventstream.session.StreamSessionFactory;
import com.williamcallahan.eventstream.stream.EventStream;
import com.williamcallahan.eventstream.stream.StreamCancellation;
import com.williamcallahan.eventstream.stream.StreamMetadata;
import com.williamcallahan.eventstream.transport.ResponseChannel;
import com.williamcallahan.eventstream.transport.StreamMode;
import io.micrometer.core.instrument.Metrics;
import jakarta.servlet.AsyncContext;
import jakarta.servlet.AsyncEvent;
import jakarta.servlet.AsyncListener;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Locale;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;

/**
 * Turns an HTTP request into a running stream session.
 *
 * <p>Everything that can fail with an ordinary HTTP error happens on the request thread:
 * body validation, provider availability, and opening the upstream call. Only then is the
 * request switched to async mode and the session handed to the session executor, which
 * completes the {@link AsyncContext} when the stream ends. Async errors and timeouts cancel
 * the session.</p>
 */
@Component
public class StreamDispatcher {
    private static final Logger log = LoggerFactory.getLogger(StreamDispatcher.class);
    private static final Logger STREAM_LOG = LoggerFactory.getLogger("STREAM");

    static final String TRACE_ID_HEADER = "X-Trace-Id";
    static final String IDEMPOTENCY_HEADER = "X-Idempotency-Key";
    static final String IDEMPOTENCY_FALLBACK_HEADER = "Idempotency-Key";
    static final String MODE_HEADER = "X-Stream-Mode";
    static final String MODE_PARAMETER = "mode";
    static final String SESSIONS_METRIC = "eventstream.sessions";

    private final GenerationProvider provider;
    private final StreamSessionFactory sessionFactory;
    private final RequestIdGenerator requestIds;
    private final StreamingProperties properties;
    private final Executor sessionExecutor;

    public StreamDispatcher(
            GenerationProvider provider,
            StreamSessionFactory sessionFactory,
            RequestIdGenerator requestIds,
            StreamingProperties properties,
            @Qualifier(StreamingExecutorsConfig.SESSION_EXECUTOR) Executor sessionExecutor) {
        this.provider = provider;
        this.sessionFactory = sessionFactory;
        this.requestIds = requestIds;
        this.properties = properties;
        this.sessionExecutor = sessionExecutor;
    }

    /**
     * Negotiates, opens and starts a stream for one request.
     *
     * @throws StreamRequestException if the request is rejected before streaming starts
     */
    public void dispatch(
            StreamRequest body,
            HttpServletRequest request,
            HttpServletResponse response,
            StreamMode endpointDefault) {
        StreamRoute route = StreamRoute.resolve(
                request.getHeader(HttpHeaders.ACCEPT),
                request.getRequestURI(),
                request.getParameter(MODE_PARAMETER),
                request.getHeader(MODE_HEADER),
                endpointDefault);
        GenerationRequest prepared = prepare(body, idempotencyKey(request));
        StreamSession session = open(prepared, route, request.getHeader(TRACE_ID_HEADER));

        AsyncContext async = request.startAsync(request, response);
        async.setTimeout(properties.getPipeline().getSessionTimeout().toMillis());
        async.addListener(new CancellingAsyncListener(session));
        ResponseChannel channel = new ServletResponseChannel(response);
        try {
            sessionExecutor.execute(() -> runAndComplete(session, channel, async));
        } catch (RejectedExecutionException rejected) {
            STREAM_LOG.warn("[{}] Session executor rejected stream", session.requestId());
            session.close();
            response.setStatus(HttpStatus.SERVICE_UNAVAILABLE.value());
            async.complete();
        }
    }

    /**
     * Validates the body and fills in what the provider needs: streaming on, a request id
     * and a model.
     *
     * @throws StreamRequestException with 400 when the body is missing or invalid
     */
    GenerationRequest prepare(StreamRequest body, String idempotencyKey) {
        if (body == null) {
            throw new StreamRequestException(HttpStatus.BAD_REQUEST, "Request body is required");
        }
        GenerationRequest request;
        try {
            request = body.toGenerationRequest(idempotencyKey);
        } catch (IllegalArgumentException invalid) {
            throw new StreamRequestException(HttpStatus.BAD_REQUEST, invalid.getMessage(), invalid);
        }
        request = request.withStreaming();
        if (!request.hasRequestId()) {
            request = request.withRequestId(requestIds.next());
        }
        if (request.model().isEmpty()) {
            request = request.withModel(properties.getProvider().getDefaultModel());
        }
        return request;
    }

    /**
     * Opens the upstream stream and wraps it in an unstarted session.
     *
     * @throws StreamRequestException with 503 when no provider is configured, or the
     *     provider's HTTP status (500 when it has none) when the upstream call fails
     */
    StreamSession open(GenerationRequest request, StreamRoute route, String traceId) {
        if (!provider.isAvailable()) {
            throw new StreamRequestException(
                    HttpStatus.SERVICE_UNAVAILABLE, "Generation provider '" + provider.name() + "' is not configured");
        }
        EventStream source;
        try {
            source = provider.stream(request);
        } catch (GenerationException openFailure) {
            STREAM_LOG.warn("[{}] Provider failed to open stream: {}", request.requestId(), openFailure.toString());
            throw new StreamRequestException(statusFor(openFailure), openFailure.getMessage(), openFailure);
        } catch (RuntimeException openFailure) {
            STREAM_LOG.warn("[{}] Provider failed to open stream", request.requestId(), openFailure);
            throw new StreamRequestException(
                    HttpStatus.INTERNAL_SERVER_ERROR, "Failed to open generation stream", openFailure);
        }
        try {
            StreamMetadata metadata =
                    new StreamMetadata(request.requestId(), traceId, provider.name(), request.model());
            StreamSession session = sessionFactory.create(
                    route.format(), route.mode(), metadata, source, new StreamCancellation());
            STREAM_LOG.info("[{}] Streaming {} {} from {} ({})",
                    request.requestId(), route.mode().name().toLowerCase(Locale.ROOT),
                    route.format().contentType(), provider.name(), request.model());
            return session;
        } catch (RuntimeException sessionFailure) {
            source.close();
            throw sessionFailure;
        }
    }

    /**
     * Runs a session to the end and records its outcome. The session is always closed.
     */
    SessionOutcome run(StreamSession session, ResponseChannel channel) {
        SessionOutcome outcome;
        try {
            outcome = session.run(channel);
        } catch (IOException writeFailure) {
            STREAM_LOG.warn("[{}] Client write failed, stream aborted: {}", session.requestId(), writeFailure.getMessage());
            outcome = SessionOutcome.ABORTED;
        } catch (RuntimeException unexpected) {
            log.error("Stream session failed (requestId={})", session.requestId(), unexpected);
            outcome = SessionOutcome.ABORTED;
        } finally {
            session.close();
        }
        if (outcome == SessionOutcome.CANCELLED) {
            STREAM_LOG.debug("[{}] Stream cancelled", session.requestId());
        } else if (outcome == SessionOutcome.COMPLETED) {
            STREAM_LOG.info("[{}] Stream complete", session.requestId());
        }
        Metrics.counter(SESSIONS_METRIC, "outcome", outcome.tag()).increment();
        return outcome;
    }

    private void runAndComplete(StreamSession session, ResponseChannel channel, AsyncContext async) {
        try {
            run(session, channel);
        } finally {
            try {
                async.complete();
            } catch (IllegalStateException alreadyCompleted) {
                log.debug("Async context already completed (requestId={})", session.requestId());
            }
        }
    }

    private static String idempotencyKey(HttpServletRequest request) {
        String key = request.getHeader(IDEMPOTENCY_HEADER);
        if (key == null || key.isBlank()) {
            key = request.getHeader(IDEMPOTENCY_FALLBACK_HEADER);
        }
        return key == null || key.isBlank() ? null : key.trim();
    }

    private static HttpStatus statusFor(GenerationException failure) {
        HttpStatus status = HttpStatus.resolve(failure.httpStatus());
        if (status == null || !status.isError()) {
            return HttpStatus.INTERNAL_SERVER_ERROR;
        }
        return status;
    }

    /** Cancels the session when the container reports an async error or timeout. */
    private static final class CancellingAsyncListener implements AsyncListener {
        private final StreamSession session;

        private CancellingAsyncListener(StreamSession session) {
            this.session = session;
        }

        @Override
        public void onComplete(AsyncEvent event) {
            // Normal end; the session has already closed itself.
        }

        @Override
        public void onTimeout(AsyncEvent event) {
            STREAM_LOG.debug("[{}] Async timeout, cancelling stream", session.requestId());
            session.cancellation().cancel();
        }

        @Override
        public void onError(AsyncEvent event) {
            STREAM_LOG.debug("[{}] Async error, cancelling stream", session.requestId(), event.getThrowable());
            session.cancellation().cancel();
        }

        @Override
        public void onStartAsync(AsyncEvent event) {
            // Not re-dispatched.
        }
    }
}
