package com.example.threadlog.web;

import com.example.threadlog.logs.handles.RequestLog;
import jakarta.servlet.http.HttpServletRequest;

/**
 * Access to the {@link RequestLog} that {@link RequestLogFilter} opened for a request.
 */
public final class RequestLogs {

    public static final String ATTRIBUTE = RequestLogs.class.getName() + ".requestLog";

    private RequestLogs() {
    }

    /**
     * @return the request's log handle, or null when the filter did not run
     */
    public static RequestLog current(HttpServletRequest request) {
        Object handle = request.getAttribute(ATTRIBUTE);
        return handle instanceof RequestLog requestLog ? requestLog : null;
    }
}
