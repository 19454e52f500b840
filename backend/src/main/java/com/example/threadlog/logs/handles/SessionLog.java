package com.example.threadlog.logs.handles;

import com.example.threadlog.logs.LogAggregator;
import com.example.threadlog.logs.models.Entry;
import com.example.threadlog.logs.models.Kind;
import lombok.Getter;
import lombok.ToString;

/**
 * Log handle for a named, long-lived unit of work such as a websocket
 * connection or a background job. The name is reported as the route.
 */
@ToString(onlyExplicitlyIncluded = true)
public class SessionLog implements LogHandle {

    private final LogAggregator aggregator;
    @Getter
    @ToString.Include
    private final String id;
    @Getter
    @ToString.Include
    private final String name;

    public SessionLog(LogAggregator aggregator, String id, String name) {
        this.aggregator = aggregator;
        this.id = id;
        this.name = name;
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

    /**
     * Whether an ERROR entry is buffered right now. Does not drain anything,
     * and may already be stale if other threads log under the same id.
     */
    public boolean seenError() {
        return aggregator.seenError(id);
    }

    /**
     * Emits the session, unless nothing was recorded since it started or last ended.
     */
    public void end() {
        aggregator.finish(Kind.SESSION, id, name, 0, 0);
    }
}
