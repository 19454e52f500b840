package com.example.threadlog.logs.models;

import com.fasterxml.jackson.annotation.JsonProperty;

public record KeyValue(
        @JsonProperty("key") String key,
        @JsonProperty("value") Object value
) {
}
