package com.example.threadlog.logs;

import com.example.threadlog.logs.models.CallSite;
import com.example.threadlog.logs.models.Entry;
import com.example.threadlog.logs.models.LogEntry;
import com.example.threadlog.logs.models.NoopEntry;
import com.example.threadlog.logs.models.Severity;
import com.example.threadlog.logs.services.CallSiteProvider;

/**
 * Builds entries and applies the level and call-site policy fixed at construction.
 */
public class EntryFactory {

    private final boolean disableDebug;
    private final boolean disableCallSite;
    private final CallSiteProvider callSiteProvider;

    public EntryFactory(boolean disableDebug, boolean disableCallSite, CallSiteProvider callSiteProvider) {
        this.disableDebug = disableDebug;
        this.disableCallSite = disableCallSite;
        this.callSiteProvider = callSiteProvider;
    }

    public Entry make(Severity level, String threadId, String message) {
        if (level == Severity.DEBUG && disableDebug) {
            return NoopEntry.INSTANCE;
        }
        return new LogEntry(threadId, level, callSite(), message);
    }

    public LogEntry internalError(String message) {
        return new LogEntry(LogAggregator.INTERNAL_THREAD_ID, Severity.ERROR, CallSite.NONE, message);
    }

    private CallSite callSite() {
        if (disableCallSite) {
            return CallSite.NONE;
        }
        return callSiteProvider.capture().orElse(CallSite.UNAVAILABLE);
    }
}
