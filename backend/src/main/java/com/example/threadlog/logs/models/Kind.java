package com.example.threadlog.logs.models;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * What kind of unit of work an aggregate describes. Sessions carry no
 * status or duration, so an empty session is not worth emitting.
 */
public enum Kind {
    REQUEST("request"),
    SESSION("session");

    private final String displayName;

    Kind(String displayName) {
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
