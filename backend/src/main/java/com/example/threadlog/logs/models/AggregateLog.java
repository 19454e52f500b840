package com.example.threadlog.logs.models;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Everything one request or session logged, emitted once when it ends.
 */
public record AggregateLog(
        @JsonProperty("date") Instant date,
        @JsonProperty("kind") Kind kind,
        @JsonProperty("threadId") String threadId,
        @JsonProperty("route") String route,
        @JsonProperty("status") int status,
        @JsonProperty("duration") int duration,
        @JsonProperty("entries") List<LogEntry> entries
) {
    public AggregateLog {
        entries = entries == null ? List.of() : List.copyOf(entries);
    }

    public AggregateLog withEntries(List<LogEntry> replacement) {
        return new AggregateLog(date, kind, threadId, route, status, duration, replacement);
    }

    /**
     * A copy of this record holding only the ERROR entries, in their original order.
     */
    public AggregateLog errorsOnly() {
        return withEntries(entries.stream()
                .filter(LogEntry::isError)
                .toList());
    }

    public boolean hasErrors() {
        return entries.stream().anyMatch(LogEntry::isError);
    }
}
