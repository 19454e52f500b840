package com.example.threadlog.config;

import com.example.threadlog.logs.AggregatorOptions;
import com.example.threadlog.logs.LogAggregator;
import com.example.threadlog.logs.services.CallSiteProvider;
import com.example.threadlog.logs.services.IdGenerator;
import com.example.threadlog.logs.services.JsonAggregateLogWriter;
import com.example.threadlog.logs.services.StackWalkerCallSiteProvider;
import com.example.threadlog.logs.services.UuidIdGenerator;
import com.example.threadlog.monitoring.AggregatorMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class AggregatorConfig {

    @Value("${threadlog.disable-debug:false}")
    private boolean disableDebug;

    @Value("${threadlog.disable-call-site:false}")
    private boolean disableCallSite;

    @Value("${threadlog.callbacks.log-events.enabled:true}")
    private boolean logEventsEnabled;

    @Value("${threadlog.callbacks.errors.enabled:true}")
    private boolean errorsEnabled;

    @Bean
    public IdGenerator idGenerator() {
        return new UuidIdGenerator();
    }

    @Bean
    public CallSiteProvider callSiteProvider() {
        return StackWalkerCallSiteProvider.forAggregator();
    }

    @Bean
    public LogAggregator logAggregator(
            IdGenerator idGenerator,
            CallSiteProvider callSiteProvider,
            JsonAggregateLogWriter writer,
            AggregatorMetrics metrics) {

        AggregatorOptions options = AggregatorOptions.builder()
                .disableDebug(disableDebug)
                .disableCallSite(disableCallSite)
                .onLogEvent(logEventsEnabled ? metrics.countingEvents(writer::writeEvent) : null)
                .onError(errorsEnabled ? metrics.countingErrors(writer::writeErrors) : null)
                .build();

        LogAggregator aggregator = new LogAggregator(options, idGenerator, callSiteProvider);
        metrics.bindPendingThreads(aggregator);

        log.info("Log aggregator initialized: debug={}, callSite={}, logEvents={}, errors={}",
                !disableDebug, !disableCallSite, logEventsEnabled, errorsEnabled);
        return aggregator;
    }
}
