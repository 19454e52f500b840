package com.example.threadlog.logs.services;

import com.example.threadlog.logs.models.AggregateLog;
import com.example.threadlog.logs.models.CallSite;
import com.example.threadlog.logs.models.Kind;
import com.example.threadlog.logs.models.LogEntry;
import com.example.threadlog.logs.models.Severity;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class JsonAggregateLogWriterTest {

    private ObjectMapper objectMapper;
    private JsonAggregateLogWriter writer;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        writer = new JsonAggregateLogWriter(objectMapper);
    }

    @Test
    void shouldSerializeAggregateWithEntriesAndKeyValues() throws Exception {
        LogEntry entry = new LogEntry("req-1", Severity.ERROR,
                new CallSite("PaymentService.charge", "PaymentService.java", 88), "card declined")
                .data("amount", 1999)
                .data("currency", "EUR");
        AggregateLog aggregate = new AggregateLog(
                Instant.parse("2025-01-01T00:00:00Z"), Kind.REQUEST, "req-1", "POST /pay", 402, 35, List.of(entry));

        JsonNode json = objectMapper.readTree(writer.toJson(aggregate));

        assertThat(json.get("date").asText()).isEqualTo("2025-01-01T00:00:00Z");
        assertThat(json.get("kind").asText()).isEqualTo("request");
        assertThat(json.get("threadId").asText()).isEqualTo("req-1");
        assertThat(json.get("route").asText()).isEqualTo("POST /pay");
        assertThat(json.get("status").asInt()).isEqualTo(402);
        assertThat(json.get("duration").asInt()).isEqualTo(35);

        JsonNode first = json.get("entries").get(0);
        assertThat(first.get("level").asText()).isEqualTo("Error");
        assertThat(first.get("function").asText()).isEqualTo("PaymentService.charge");
        assertThat(first.get("file").asText()).isEqualTo("PaymentService.java");
        assertThat(first.get("line").asInt()).isEqualTo(88);
        assertThat(first.get("message").asText()).isEqualTo("card declined");
        assertThat(first.get("keyVals").get(0).get("key").asText()).isEqualTo("amount");
        assertThat(first.get("keyVals").get(0).get("value").asInt()).isEqualTo(1999);
        assertThat(first.get("keyVals").get(1).get("value").asText()).isEqualTo("EUR");
        assertThat(first.has("recorded")).isFalse();
        assertThat(first.has("error")).isFalse();
    }

    @Test
    void shouldSerializeSessionKind() throws Exception {
        AggregateLog aggregate = new AggregateLog(
                Instant.parse("2025-01-01T00:00:00Z"), Kind.SESSION, "sess-1", "import", 0, 0, List.of());

        JsonNode json = objectMapper.readTree(writer.toJson(aggregate));

        assertThat(json.get("kind").asText()).isEqualTo("session");
        assertThat(json.get("entries")).isEmpty();
    }

    @Test
    void shouldFallBackToToStringWhenValueCannotBeSerialized() {
        LogEntry entry = new LogEntry("req-1", Severity.INFO, CallSite.NONE, "odd value")
                .data("self", new Object());
        AggregateLog aggregate = new AggregateLog(
                Instant.parse("2025-01-01T00:00:00Z"), Kind.REQUEST, "req-1", "GET /", 200, 1, List.of(entry));

        String output = writer.toJson(aggregate);

        assertThat(output).startsWith("AggregateLog[");
    }

    @Test
    void shouldWriteWithoutThrowing() {
        AggregateLog aggregate = new AggregateLog(
                Instant.parse("2025-01-01T00:00:00Z"), Kind.REQUEST, "req-1", "GET /", 200, 1, List.of());

        writer.writeEvent(aggregate);
        writer.writeErrors(aggregate.errorsOnly());
    }
}
