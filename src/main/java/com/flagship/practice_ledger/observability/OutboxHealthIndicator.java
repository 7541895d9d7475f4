package com.flagship.practice_ledger.observability;

import com.flagship.practice_ledger.outbox.OutboxEventRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.actuate.health.Status;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Reports the outbox as DEGRADED when the backlog passes the threshold or any event has
 * used up its retries, and DOWN when the outbox cannot be read.
 */
@Component("outbox")
public class OutboxHealthIndicator implements HealthIndicator {

    public static final Status DEGRADED = new Status("DEGRADED");

    private final OutboxEventRepository outboxRepository;
    private final int maxRetries;
    private final long backlogThreshold;

    public OutboxHealthIndicator(OutboxEventRepository outboxRepository,
                                 @Value("${outbox.publisher.max-retries:5}") int maxRetries,
                                 @Value("${outbox.health.backlog-threshold:1000}") long backlogThreshold) {
        this.outboxRepository = outboxRepository;
        this.maxRetries = maxRetries;
        this.backlogThreshold = backlogThreshold;
    }

    @Override
    public Health health() {
        try {
            long pending = outboxRepository.countUnpublished();
            long deadLetters = outboxRepository.countDeadLetters(maxRetries);
            long oldestAgeSeconds = outboxRepository.findOldestUnpublishedCreatedAt()
                .map(oldest -> Duration.between(oldest, Instant.now()).getSeconds())
                .orElse(0L);

            return Health.status(pending >= backlogThreshold || deadLetters > 0 ? DEGRADED : Status.UP)
                .withDetail("pending", pending)
                .withDetail("deadLetters", deadLetters)
                .withDetail("oldestPendingAgeSeconds", oldestAgeSeconds)
                .withDetail("backlogThreshold", backlogThreshold)
                .build();
        } catch (DataAccessException e) {
            return Health.down(e).build();
        }
    }
}
