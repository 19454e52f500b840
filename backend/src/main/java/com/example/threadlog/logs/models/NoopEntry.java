package com.example.threadlog.logs.models;

public enum NoopEntry implements Entry {
    INSTANCE;

    @Override
    public Entry data(String key, Object value) {
        return this;
    }

    @Override
    public boolean isRecorded() {
        return false;
    }
}
