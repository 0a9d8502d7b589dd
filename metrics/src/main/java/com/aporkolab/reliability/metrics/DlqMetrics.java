package com.aporkolab.reliability.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

import com.aporkolab.reliability.dlq.DlqListener;
import com.aporkolab.reliability.dlq.FailureType;

import java.time.Duration;

/**
 * Micrometer metrics for the retry and Dead Letter Queue paths.
 * 
 * Provides the following metrics:
 * - dlq_retries_total: Retries scheduled through the delay exchange, by queue
 * - dlq_retry_delay: Delay assigned to each scheduled retry
 * - dlq_messages_total: Messages dead-lettered, by queue and failure type
 * - dlq_retry_count_at_dead_letter: Retry count carried by dead-lettered messages
 */
public class DlqMetrics implements DlqListener {

    private static final String METRIC_PREFIX = "dlq";

    private final MeterRegistry registry;
    private final Tags baseTags;

    public DlqMetrics(MeterRegistry registry) {
        this(registry, Tags.empty());
    }

    public DlqMetrics(MeterRegistry registry, String serviceName) {
        this(registry, Tags.of("service", serviceName));
    }

    public DlqMetrics(MeterRegistry registry, Tags tags) {
        this.registry = registry;
        this.baseTags = tags;
    }

    @Override
    public void onRetryScheduled(String queue, int retryCount, long delayMs) {
        Tags tags = baseTags.and("queue", queue);

        Counter.builder(METRIC_PREFIX + "_retries_total")
                .description("Retries scheduled through the delay exchange")
                .tags(tags)
                .register(registry)
                .increment();

        Timer.builder(METRIC_PREFIX + "_retry_delay")
                .description("Delay assigned to scheduled retries")
                .tags(tags)
                .register(registry)
                .record(Duration.ofMillis(delayMs));
    }

    @Override
    public void onDeadLettered(String queue, FailureType failureType, int retryCount) {
        Tags tags = baseTags.and("queue", queue, "failure_type", failureType.name());

        Counter.builder(METRIC_PREFIX + "_messages_total")
                .description("Messages routed to the Dead Letter Queue")
                .tags(tags)
                .register(registry)
                .increment();

        // Distribution of how far messages got before giving up
        registry.summary(METRIC_PREFIX + "_retry_count_at_dead_letter", tags).record(retryCount);
    }

    /**
     * Retries scheduled for a queue so far.
     */
    public double getRetryCount(String queue) {
        Counter counter = registry.find(METRIC_PREFIX + "_retries_total")
                .tags(baseTags.and("queue", queue))
                .counter();
        return counter != null ? counter.count() : 0;
    }

    /**
     * Messages dead-lettered for a queue and failure type so far.
     */
    public double getDeadLetteredCount(String queue, FailureType failureType) {
        Counter counter = registry.find(METRIC_PREFIX + "_messages_total")
                .tags(baseTags.and("queue", queue, "failure_type", failureType.name()))
                .counter();
        return counter != null ? counter.count() : 0;
    }
}
