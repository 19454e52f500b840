package com.example.threadlog.web;

import com.example.threadlog.logs.LogAggregator;
import com.example.threadlog.logs.handles.RequestLog;
import jakarta.servlet.AsyncEvent;
import jakarta.servlet.AsyncListener;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Opens a {@link RequestLog} for every HTTP request and ends it with the
 * route, response status and elapsed milliseconds once the request completes.
 *
 * <p>The thread id is always generated, so concurrent requests never share a
 * buffer. An incoming {@code X-Request-ID} is only correlation data: it is
 * recorded on the request's first entry, put in the MDC as {@code requestId}
 * and echoed back. Without one, the thread id is echoed instead.</p>
 *
 * <p>Async requests are ended from an {@link AsyncListener} when the async
 * context completes. Async redispatches reuse the handle of the original
 * dispatch.</p>
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
@ConditionalOnProperty(name = "threadlog.web.request-filter.enabled", havingValue = "true", matchIfMissing = true)
public class RequestLogFilter extends OncePerRequestFilter {

    static final String REQUEST_ID_HEADER = "X-Request-ID";
    static final String MDC_KEY = "threadId";
    static final String MDC_REQUEST_ID_KEY = "requestId";

    private final LogAggregator logAggregator;

    public RequestLogFilter(LogAggregator logAggregator) {
        this.logAggregator = logAggregator;
    }

    @Override
    protected boolean shouldNotFilterAsyncDispatch() {
        return false;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        if (isAsyncDispatch(request)) {
            RequestLog existing = RequestLogs.current(request);
            if (existing != null) {
                continueAsync(existing, request, response, chain);
                return;
            }
        }

        long startTimeNanos = System.nanoTime();
        RequestLog requestLog = logAggregator.newRequest();
        String requestId = request.getHeader(REQUEST_ID_HEADER);
        boolean correlated = requestId != null && !requestId.isBlank();

        request.setAttribute(RequestLogs.ATTRIBUTE, requestLog);
        response.setHeader(REQUEST_ID_HEADER, correlated ? requestId : requestLog.getId());
        MDC.put(MDC_KEY, requestLog.getId());
        if (correlated) {
            MDC.put(MDC_REQUEST_ID_KEY, requestId);
            requestLog.info("request received").data("requestId", requestId);
        }

        int status = HttpServletResponse.SC_INTERNAL_SERVER_ERROR;
        boolean asyncStarted = false;
        try {
            chain.doFilter(request, response);
            status = response.getStatus();
            asyncStarted = request.isAsyncStarted();
        } catch (IOException | ServletException | RuntimeException e) {
            requestLog.errorF("unhandled %s: %s", e.getClass().getSimpleName(), e.getMessage());
            throw e;
        } finally {
            if (asyncStarted) {
                request.getAsyncContext().addListener(new EndOnCompletion(requestLog, request, response, startTimeNanos));
            } else {
                end(requestLog, request, status, startTimeNanos);
            }
            MDC.remove(MDC_KEY);
            MDC.remove(MDC_REQUEST_ID_KEY);
        }
    }

    private void continueAsync(RequestLog requestLog,
                               HttpServletRequest request,
                               HttpServletResponse response,
                               FilterChain chain) throws ServletException, IOException {
        MDC.put(MDC_KEY, requestLog.getId());
        try {
            chain.doFilter(request, response);
        } catch (IOException | ServletException | RuntimeException e) {
            requestLog.errorF("unhandled %s: %s", e.getClass().getSimpleName(), e.getMessage());
            throw e;
        } finally {
            MDC.remove(MDC_KEY);
        }
    }

    private static void end(RequestLog requestLog, HttpServletRequest request, int status, long startTimeNanos) {
        int durationMs = (int) ((System.nanoTime() - startTimeNanos) / 1_000_000);
        requestLog.end(route(request), status, durationMs);
    }

    private static String route(HttpServletRequest request) {
        return request.getMethod() + " " + request.getRequestURI();
    }

    /**
     * Ends the request once its async context completes. Timeouts and errors
     * are recorded as error entries; the container completes the context after
     * either, so the request is still ended exactly once.
     */
    private static final class EndOnCompletion implements AsyncListener {

        private final RequestLog requestLog;
        private final HttpServletRequest request;
        private final HttpServletResponse response;
        private final long startTimeNanos;

        private EndOnCompletion(RequestLog requestLog,
                                HttpServletRequest request,
                                HttpServletResponse response,
                                long startTimeNanos) {
            this.requestLog = requestLog;
            this.request = request;
            this.response = response;
            this.startTimeNanos = startTimeNanos;
        }

        @Override
        public void onComplete(AsyncEvent event) {
            end(requestLog, request, response.getStatus(), startTimeNanos);
        }

        @Override
        public void onTimeout(AsyncEvent event) {
            log.warn("Async request {} timed out", requestLog.getId());
            requestLog.error("async request timed out");
        }

        @Override
        public void onError(AsyncEvent event) {
            Throwable cause = event.getThrowable();
            log.warn("Async request {} failed", requestLog.getId(), cause);
            requestLog.errorF("async request failed: %s",
                    cause == null ? "unknown" : cause.getClass().getSimpleName() + ": " + cause.getMessage());
        }

        @Override
        public void onStartAsync(AsyncEvent event) {
            // a restarted async cycle drops its listeners
            event.getAsyncContext().addListener(this);
        }
    }
}
