package com.example.threadlog.logs.models;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Severity {
    INFO("Info"),
    ERROR("Error"),
    DEBUG("Debug");

    private final String displayName;

    Severity(String displayName) {
        this.displayName = displayName;
    }

    @JsonValue
    public String getDisplayName() {
        return displayName;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
