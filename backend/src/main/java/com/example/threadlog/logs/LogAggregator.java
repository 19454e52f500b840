package com.example.threadlog.logs;

import com.example.threadlog.logs.handles.RequestLog;
import com.example.threadlog.logs.handles.SessionLog;
import com.example.threadlog.logs.models.AggregateLog;
import com.example.threadlog.logs.models.Entry;
import com.example.threadlog.logs.models.Kind;
import com.example.threadlog.logs.models.LogEntry;
import com.example.threadlog.logs.models.Severity;
import com.example.threadlog.logs.services.CallSiteProvider;
import com.example.threadlog.logs.services.IdGenerationException;
import com.example.threadlog.logs.services.IdGenerator;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Arrays;
import java.util.IllegalFormatException;
import java.util.List;
import java.util.function.Consumer;

/**
 * Buffers entries per thread id and emits one {@link AggregateLog} when the
 * request or session behind that id ends.
 *
 * <p>Safe for concurrent use. Callbacks run synchronously on the thread that
 * calls {@link #finish}. Entries of an id that is never finished stay buffered.</p>
 */
@Slf4j
public class LogAggregator {

    /** Thread id that the aggregator's own error entries are buffered under. */
    public static final String INTERNAL_THREAD_ID = "";

    /** Returned by {@link #newId()} when the generator fails. */
    public static final String FALLBACK_ID = "00000000-0000-0000-0000-000000000000";

    private final EntryStore store;
    private final EntryFactory factory;
    private final IdGenerator idGenerator;
    private final Consumer<AggregateLog> onLogEvent;
    private final Consumer<AggregateLog> onError;
    private final Clock clock;

    public LogAggregator(AggregatorOptions options, IdGenerator idGenerator, CallSiteProvider callSiteProvider) {
        this(options,
                new EntryStore(),
                new EntryFactory(options.disableDebug(), options.disableCallSite(), callSiteProvider),
                idGenerator,
                Clock.systemUTC());
    }

    public LogAggregator(AggregatorOptions options,
                         EntryStore store,
                         EntryFactory factory,
                         IdGenerator idGenerator,
                         Clock clock) {
        this.store = store;
        this.factory = factory;
        this.idGenerator = idGenerator;
        this.onLogEvent = options.onLogEvent();
        this.onError = options.onError();
        this.clock = clock;
    }

    // ==================== HANDLES ====================

    public RequestLog newRequest() {
        return new RequestLog(this, newId());
    }

    public RequestLog newRequest(String threadId) {
        return new RequestLog(this, threadId);
    }

    public SessionLog newSession(String name) {
        return new SessionLog(this, newId(), name);
    }

    /**
     * Never throws. When the generator fails the problem is buffered as an
     * internal error entry and {@link #FALLBACK_ID} is returned.
     */
    public String newId() {
        try {
            return idGenerator.generate();
        } catch (IdGenerationException e) {
            log.warn("Id generation failed, falling back to {}: {}", FALLBACK_ID, e.getMessage());
            store.append(INTERNAL_THREAD_ID,
                    factory.internalError("couldn't generate id for logger thread: " + e.getMessage()));
            return FALLBACK_ID;
        }
    }

    // ==================== RECORDING ====================

    public Entry info(String threadId, String message) {
        return recordEntry(Severity.INFO, threadId, message);
    }

    public Entry error(String threadId, String message) {
        return recordEntry(Severity.ERROR, threadId, message);
    }

    public Entry debug(String threadId, String message) {
        return recordEntry(Severity.DEBUG, threadId, message);
    }

    public Entry infoF(String threadId, String format, Object... args) {
        return recordEntry(Severity.INFO, threadId, format(format, args));
    }

    public Entry errorF(String threadId, String format, Object... args) {
        return recordEntry(Severity.ERROR, threadId, format(format, args));
    }

    public Entry debugF(String threadId, String format, Object... args) {
        return recordEntry(Severity.DEBUG, threadId, format(format, args));
    }

    public Entry recordEntry(Severity level, String threadId, String message) {
        String id = key(threadId);
        Entry entry = factory.make(level, id, message);
        if (entry instanceof LogEntry logEntry) {
            store.append(id, logEntry);
        }
        return entry;
    }

    // ==================== FLUSHING ====================

    public void end(String threadId, String route, int status, int duration) {
        finish(Kind.REQUEST, threadId, route, status, duration);
    }

    /**
     * Drains the entries buffered for {@code threadId} and hands them to the
     * callbacks. The error callback gets an errors-only copy, the log event
     * callback always gets every entry. Empty sessions are dropped.
     */
    public void finish(Kind kind, String threadId, String route, int status, int duration) {
        String id = key(threadId);
        List<LogEntry> entries = store.takeAndClear(id);

        if (kind == Kind.SESSION && entries.isEmpty()) {
            log.debug("Session {} ({}) ended with no entries, nothing emitted", route, id);
            return;
        }

        AggregateLog aggregate = new AggregateLog(
                clock.instant(), kind, id, route, status, duration, entries);

        if (onError != null && aggregate.hasErrors()) {
            deliver(onError, aggregate.errorsOnly(), "onError");
        }
        if (onLogEvent != null) {
            deliver(onLogEvent, aggregate, "onLogEvent");
        }
    }

    public boolean seenError(String threadId) {
        return store.snapshot(key(threadId)).stream().anyMatch(LogEntry::isError);
    }

    public int pendingThreadCount() {
        return store.size();
    }

    private void deliver(Consumer<AggregateLog> callback, AggregateLog aggregate, String name) {
        try {
            callback.accept(aggregate);
        } catch (RuntimeException e) {
            log.error("{} callback failed for {} {}: {}",
                    name, aggregate.kind(), aggregate.threadId(), e.getMessage(), e);
        }
    }

    private static String key(String threadId) {
        return threadId == null ? INTERNAL_THREAD_ID : threadId;
    }

    private static String format(String format, Object... args) {
        if (format == null) {
            return Arrays.toString(args);
        }
        try {
            return String.format(format, args);
        } catch (IllegalFormatException e) {
            log.warn("Bad log format \"{}\": {}", format, e.getMessage());
            return format + " " + Arrays.toString(args);
        }
    }
}
