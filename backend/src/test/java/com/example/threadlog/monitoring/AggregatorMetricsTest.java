package com.example.threadlog.monitoring;

import com.example.threadlog.logs.AggregatorOptions;
import com.example.threadlog.logs.LogAggregator;
import com.example.threadlog.logs.models.AggregateLog;
import com.example.threadlog.logs.models.CallSite;
import com.example.threadlog.logs.models.Kind;
import com.example.threadlog.logs.models.LogEntry;
import com.example.threadlog.logs.models.Severity;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Counters behind the aggregator callbacks, checked against an in-memory registry.
 */
class AggregatorMetricsTest {

    private MeterRegistry meterRegistry;
    private AggregatorMetrics metrics;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        metrics = new AggregatorMetrics(meterRegistry);
    }

    private static AggregateLog aggregate(Kind kind, int entries) {
        List<LogEntry> list = new ArrayList<>();
        for (int i = 0; i < entries; i++) {
            list.add(new LogEntry("t", Severity.INFO, CallSite.NONE, "m" + i));
        }
        return new AggregateLog(Instant.now(), kind, "t", "r", 0, 0, list);
    }

    private double emitted(Kind kind) {
        return meterRegistry.get("threadlog.aggregates.emitted").tag("kind", kind.getDisplayName()).counter().count();
    }

    @Test
    void shouldCountEmittedAggregatesPerKind() {
        metrics.recordEmitted(aggregate(Kind.REQUEST, 3));
        metrics.recordEmitted(aggregate(Kind.REQUEST, 0));
        metrics.recordEmitted(aggregate(Kind.SESSION, 2));

        assertThat(emitted(Kind.REQUEST)).isEqualTo(2.0);
        assertThat(emitted(Kind.SESSION)).isEqualTo(1.0);
        assertThat(meterRegistry.counter("threadlog.entries.flushed").count()).isEqualTo(5.0);
    }

    @Test
    void shouldCountThroughWrappedCallbacks() {
        List<AggregateLog> seen = new ArrayList<>();
        Consumer<AggregateLog> events = metrics.countingEvents(seen::add);
        Consumer<AggregateLog> errors = metrics.countingErrors(seen::add);

        events.accept(aggregate(Kind.REQUEST, 1));
        errors.accept(aggregate(Kind.REQUEST, 1));

        assertThat(seen).hasSize(2);
        assertThat(emitted(Kind.REQUEST)).isEqualTo(1.0);
        assertThat(meterRegistry.counter("threadlog.aggregates.errors").count()).isEqualTo(1.0);
    }

    @Test
    void shouldCountAndRethrowCallbackFailures() {
        Consumer<AggregateLog> events = metrics.countingEvents(aggregate -> {
            throw new IllegalStateException("disk full");
        });

        assertThatThrownBy(() -> events.accept(aggregate(Kind.SESSION, 1)))
                .isInstanceOf(IllegalStateException.class);
        assertThat(meterRegistry.counter("threadlog.callbacks.failed").count()).isEqualTo(1.0);
    }

    @Test
    void shouldTrackPendingThreadsThroughGauge() {
        LogAggregator aggregator = new LogAggregator(AggregatorOptions.defaults(), () -> "id", Optional::empty);
        metrics.bindPendingThreads(aggregator);

        aggregator.info("a", "x");
        aggregator.info("b", "y");
        assertThat(meterRegistry.get("threadlog.pending.threads").gauge().value()).isEqualTo(2.0);

        aggregator.end("a", "GET /", 200, 1);
        assertThat(meterRegistry.get("threadlog.pending.threads").gauge().value()).isEqualTo(1.0);
    }

    @Test
    void shouldKeepCountingWhenAggregatorCallbackFails() {
        LogAggregator aggregator = new LogAggregator(
                AggregatorOptions.builder()
                        .onLogEvent(metrics.countingEvents(aggregate -> {
                            throw new IllegalStateException("sink down");
                        }))
                        .build(),
                () -> "id",
                Optional::empty);

        aggregator.end("a", "GET /", 200, 1);
        aggregator.end("b", "GET /", 200, 1);

        assertThat(emitted(Kind.REQUEST)).isEqualTo(2.0);
        assertThat(meterRegistry.counter("threadlog.callbacks.failed").count()).isEqualTo(2.0);
    }
}
