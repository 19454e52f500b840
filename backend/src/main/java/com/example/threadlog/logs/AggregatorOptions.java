package com.example.threadlog.logs;

import com.example.threadlog.logs.models.AggregateLog;
import lombok.Builder;

import java.util.function.Consumer;

/**
 * Construction-time settings of a {@link LogAggregator}. Either callback may be null.
 *
 * @param disableDebug    drop DEBUG entries instead of buffering them
 * @param disableCallSite skip stack inspection; entries carry no function, file or line
 * @param onLogEvent      receives every emitted aggregate, unfiltered
 * @param onError         receives an errors-only copy of aggregates that contain errors
 */
@Builder
public record AggregatorOptions(
        boolean disableDebug,
        boolean disableCallSite,
        Consumer<AggregateLog> onLogEvent,
        Consumer<AggregateLog> onError
) {
    public static AggregatorOptions defaults() {
        return builder().build();
    }
}
