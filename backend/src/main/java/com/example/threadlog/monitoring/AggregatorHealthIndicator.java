package com.example.threadlog.monitoring;

import com.example.threadlog.logs.LogAggregator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class AggregatorHealthIndicator implements HealthIndicator {

    private final LogAggregator logAggregator;
    private final int pendingThreadsWarning;

    public AggregatorHealthIndicator(
            LogAggregator logAggregator,
            @Value("${threadlog.health.pending-threads-warning:10000}") int pendingThreadsWarning) {
        this.logAggregator = logAggregator;
        this.pendingThreadsWarning = pendingThreadsWarning;
    }

    @Override
    public Health health() {
        int pending = logAggregator.pendingThreadCount();

        Health.Builder builder = Health.up()
                .withDetail("pending_threads", pending)
                .withDetail("pending_threads_warning", pendingThreadsWarning);

        // Buffered ids are only released by end(), so a large backlog usually means leaked handles
        if (pending > pendingThreadsWarning) {
            log.warn("{} thread ids are still buffering entries (warning threshold {})",
                    pending, pendingThreadsWarning);
            builder.withDetail("warning", "Unfinished requests or sessions are accumulating");
        }

        return builder.build();
    }
}
