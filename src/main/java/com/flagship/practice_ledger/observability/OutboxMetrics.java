package com.flagship.practice_ledger.observability;

import com.flagship.practice_ledger.outbox.OutboxEventRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Outbox gauges and publish counters.
 *
 * Gauges read a snapshot taken on a timer, so a scrape never queries the database.
 */
@Component
@Slf4j
public class OutboxMetrics {

    private final OutboxEventRepository outboxRepository;
    private final int maxRetries;

    private final AtomicLong pending = new AtomicLong();
    private final AtomicLong oldestPendingAgeSeconds = new AtomicLong();
    private final AtomicLong deadLetters = new AtomicLong();

    private final MeterRegistry registry;

    public OutboxMetrics(OutboxEventRepository outboxRepository,
                         MeterRegistry registry,
                         @Value("${outbox.publisher.max-retries:5}") int maxRetries) {
        this.outboxRepository = outboxRepository;
        this.registry = registry;
        this.maxRetries = maxRetries;

        Gauge.builder("ledger.outbox.pending", pending, AtomicLong::get)
            .description("Ledger events not yet published")
            .register(registry);
        Gauge.builder("ledger.outbox.oldest.pending.age", oldestPendingAgeSeconds, AtomicLong::get)
            .description("Age of the oldest unpublished ledger event")
            .baseUnit("seconds")
            .register(registry);
        Gauge.builder("ledger.outbox.dead.letters", deadLetters, AtomicLong::get)
            .description("Ledger events that used up their retries")
            .register(registry);
    }

    @Scheduled(fixedDelayString = "${metrics.refresh.interval:15000}")
    public void refresh() {
        try {
            pending.set(outboxRepository.countUnpublished());
            deadLetters.set(outboxRepository.countDeadLetters(maxRetries));
            oldestPendingAgeSeconds.set(outboxRepository.findOldestUnpublishedCreatedAt()
                .map(oldest -> Math.max(0, Duration.between(oldest, Instant.now()).getSeconds()))
                .orElse(0L));
        } catch (DataAccessException e) {
            log.warn("Outbox gauges not refreshed: {}", e.getMessage());
        }
    }

    public long getPending() {
        return pending.get();
    }

    public long getDeadLetters() {
        return deadLetters.get();
    }

    public void recordEventPublished(String eventType) {
        increment("ledger.outbox.publish", "event_type", eventType, "outcome", "success");
    }

    public void recordEventPublishFailed(String eventType) {
        increment("ledger.outbox.publish", "event_type", eventType, "outcome", "failure");
    }

    public void recordEventDeadLettered(String eventType) {
        increment("ledger.outbox.dead.lettered", "event_type", eventType);
    }

    private void increment(String name, String... tags) {
        registry.counter(name, tags).increment();
    }
}
