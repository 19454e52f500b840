package com.example.threadlog.logs.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

@Getter
@ToString
public final class LogEntry implements Entry {
    private final String threadId;
    private final Severity level;
    private final String function;
    private final String file;
    private final int line;
    private final String message;
    private final List<KeyValue> keyVals = new CopyOnWriteArrayList<>();

    public LogEntry(String threadId, Severity level, CallSite callSite, String message) {
        this.threadId = threadId;
        this.level = level;
        this.function = callSite.function();
        this.file = callSite.file();
        this.line = callSite.line();
        this.message = message;
    }

    @Override
    public LogEntry data(String key, Object value) {
        keyVals.add(new KeyValue(key, value));
        return this;
    }

    @Override
    @JsonIgnore
    public boolean isRecorded() {
        return true;
    }

    public List<KeyValue> getKeyVals() {
        return Collections.unmodifiableList(keyVals);
    }

    @JsonIgnore
    public boolean isError() {
        return level == Severity.ERROR;
    }
}
