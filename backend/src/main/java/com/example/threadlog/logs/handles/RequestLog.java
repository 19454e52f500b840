package com.example.threadlog.logs.handles;

import com.example.threadlog.logs.LogAggregator;
import com.example.threadlog.logs.models.Entry;
import com.example.threadlog.logs.models.Kind;
import lombok.Getter;
import lombok.ToString;

/**
 * Log handle for one request. {@link #end} always emits, even when nothing
 * was recorded, because the route, status and duration are worth keeping.
 */
@ToString(onlyExplicitlyIncluded = true)
public class RequestLog implements LogHandle {

    private final LogAggregator aggregator;
    @Getter
    @ToString.Include
    private final String id;

    public RequestLog(LogAggregator aggregator, String id) {
        this.aggregator = aggregator;
        this.id = id;
    }

    @Override
    public Entry info(String message) {
        return aggregator.info(id, message);
    }

    @Override
    public Entry error(String message) {
        return aggregator.error(id, message);
    }

    @Override
    public Entry debug(String message) {
        return aggregator.debug(id, message);
    }

    @Override
    public Entry infoF(String format, Object... args) {
        return aggregator.infoF(id, format, args);
    }

    @Override
    public Entry errorF(String format, Object... args) {
        return aggregator.errorF(id, format, args);
    }

    @Override
    public Entry debugF(String format, Object... args) {
        return aggregator.debugF(id, format, args);
    }

    public void end(String route, int status, int duration) {
        aggregator.finish(Kind.REQUEST, id, route, status, duration);
    }
}
