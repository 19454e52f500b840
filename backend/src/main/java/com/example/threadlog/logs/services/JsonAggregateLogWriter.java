package com.example.threadlog.logs.services;

import com.example.threadlog.logs.models.AggregateLog;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Default destination for emitted aggregates: one JSON line per aggregate on
 * a dedicated SLF4J logger, so the logging backend decides where it ends up.
 */
@Slf4j
@Service
public class JsonAggregateLogWriter {

    static final String EVENTS_LOGGER = "threadlog.aggregate";
    static final String ERRORS_LOGGER = "threadlog.errors";

    private static final Logger EVENTS = LoggerFactory.getLogger(EVENTS_LOGGER);
    private static final Logger ERRORS = LoggerFactory.getLogger(ERRORS_LOGGER);

    private final ObjectMapper objectMapper;

    public JsonAggregateLogWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public void writeEvent(AggregateLog aggregate) {
        if (EVENTS.isInfoEnabled()) {
            EVENTS.info(toJson(aggregate));
        }
    }

    public void writeErrors(AggregateLog aggregate) {
        if (ERRORS.isErrorEnabled()) {
            ERRORS.error(toJson(aggregate));
        }
    }

    public String toJson(AggregateLog aggregate) {
        try {
            return objectMapper.writeValueAsString(aggregate);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize aggregate {} as JSON: {}", aggregate.threadId(), e.getMessage());
            return aggregate.toString();
        }
    }
}
