package com.example.threadlog.monitoring;

import com.example.threadlog.logs.LogAggregator;
import com.example.threadlog.logs.models.AggregateLog;
import com.example.threadlog.logs.models.Kind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.function.Consumer;

@Slf4j
@Component
public class AggregatorMetrics {

    private final MeterRegistry meterRegistry;

    private final Map<Kind, Counter> aggregatesEmittedCounters = new EnumMap<>(Kind.class);
    private final Counter entriesFlushedCounter;
    private final Counter errorAggregatesCounter;
    private final Counter callbackFailuresCounter;

    public AggregatorMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        for (Kind kind : Kind.values()) {
            aggregatesEmittedCounters.put(kind, Counter.builder("threadlog.aggregates.emitted")
                    .description("Aggregates handed to the log event callback")
                    .tag("kind", kind.getDisplayName())
                    .register(meterRegistry));
        }

        this.entriesFlushedCounter = Counter.builder("threadlog.entries.flushed")
                .description("Entries contained in emitted aggregates")
                .register(meterRegistry);

        this.errorAggregatesCounter = Counter.builder("threadlog.aggregates.errors")
                .description("Errors-only aggregates handed to the error callback")
                .register(meterRegistry);

        this.callbackFailuresCounter = Counter.builder("threadlog.callbacks.failed")
                .description("Callback invocations that threw")
                .register(meterRegistry);
    }

    public void recordEmitted(AggregateLog aggregate) {
        aggregatesEmittedCounters.get(aggregate.kind()).increment();
        entriesFlushedCounter.increment(aggregate.entries().size());
    }

    public void recordErrorAggregate() {
        errorAggregatesCounter.increment();
    }

    public void recordCallbackFailure() {
        callbackFailuresCounter.increment();
    }

    /**
     * Exposes how many thread ids are still buffering. A value that only grows
     * means handles are created and never ended.
     */
    public void bindPendingThreads(LogAggregator aggregator) {
        Gauge.builder("threadlog.pending.threads", aggregator, LogAggregator::pendingThreadCount)
                .description("Thread ids with buffered entries that have not been finished")
                .register(meterRegistry);
    }

    public Consumer<AggregateLog> countingEvents(Consumer<AggregateLog> delegate) {
        return aggregate -> {
            recordEmitted(aggregate);
            invoke(delegate, aggregate);
        };
    }

    public Consumer<AggregateLog> countingErrors(Consumer<AggregateLog> delegate) {
        return aggregate -> {
            recordErrorAggregate();
            invoke(delegate, aggregate);
        };
    }

    private void invoke(Consumer<AggregateLog> delegate, AggregateLog aggregate) {
        try {
            delegate.accept(aggregate);
        } catch (RuntimeException e) {
            recordCallbackFailure();
            throw e;
        }
    }
}
