package com.example.threadlog.logs;

import com.example.threadlog.logs.models.LogEntry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Buffered entries per thread id.
 *
 * <p>Every read or write of a sequence happens inside a per-key
 * {@link ConcurrentHashMap} operation, so the lists themselves need no
 * locking and unrelated thread ids never contend.</p>
 */
public class EntryStore {

    private final ConcurrentMap<String, List<LogEntry>> buffers = new ConcurrentHashMap<>();

    public void append(String threadId, LogEntry entry) {
        buffers.compute(threadId, (id, entries) -> {
            List<LogEntry> sequence = entries == null ? new ArrayList<>() : entries;
            sequence.add(entry);
            return sequence;
        });
    }

    /**
     * Removes and returns the sequence for {@code threadId}. An append racing
     * with this call either makes it into the returned list or starts a new
     * sequence for the next take.
     */
    public List<LogEntry> takeAndClear(String threadId) {
        List<LogEntry> entries = buffers.remove(threadId);
        if (entries == null) {
            return List.of();
        }
        return Collections.unmodifiableList(entries);
    }

    /**
     * Copies the current sequence without removing it.
     */
    public List<LogEntry> snapshot(String threadId) {
        List<List<LogEntry>> copy = new ArrayList<>(1);
        buffers.computeIfPresent(threadId, (id, entries) -> {
            copy.add(List.copyOf(entries));
            return entries;
        });
        return copy.isEmpty() ? List.of() : copy.get(0);
    }

    public int size() {
        return buffers.size();
    }
}
