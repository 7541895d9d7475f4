package com.flagship.practice_ledger.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Outbox bookkeeping: events are stored inside the ledger write that produced them and
 * handed to {@link OutboxPublisher} afterwards.
 *
 * A failed send is retried after a delay that doubles per attempt, up to a cap. Once an
 * event reaches the retry limit it stays as a dead letter until it is requeued.
 */
@Service
@Slf4j
public class OutboxService {

    private final OutboxEventRepository repository;
    private final ObjectMapper objectMapper;
    private final Duration initialBackoff;
    private final Duration maxBackoff;

    public OutboxService(OutboxEventRepository repository,
                         ObjectMapper objectMapper,
                         @Value("${outbox.publisher.retry-backoff-ms:1000}") long initialBackoffMs,
                         @Value("${outbox.publisher.max-backoff-ms:300000}") long maxBackoffMs) {
        this.repository = repository;
        this.objectMapper = objectMapper;
        this.initialBackoff = Duration.ofMillis(initialBackoffMs);
        this.maxBackoff = Duration.ofMillis(maxBackoffMs);
    }

    /**
     * Stores the event in the caller's transaction. There must be one: an event written
     * outside the ledger change it describes could survive that change rolling back.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent saveEvent(LedgerEvent event) {
        OutboxEventEntity saved = repository.save(OutboxEventEntity.pending(event, toJson(event)));
        log.debug("Outbox event stored: eventType={}, aggregateType={}, aggregateId={}, tenantId={}",
            event.getEventType(), event.getAggregateType(), event.getAggregateId(), event.getTenantId());
        return saved.toDomain();
    }

    /**
     * Due events in write order, at most {@code limit}, skipping dead letters and events
     * still waiting out a retry delay.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<OutboxEvent> findDueEvents(int limit, int maxRetries) {
        return repository.lockDueEvents(Instant.now(), maxRetries, limit).stream()
            .map(OutboxEventEntity::toDomain)
            .toList();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markPublished(UUID eventId) {
        repository.findById(eventId).ifPresent(OutboxEventEntity::markPublished);
    }

    /**
     * Records a failed send and schedules the next attempt.
     *
     * @return the updated event, or null if it no longer exists
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public OutboxEvent markFailed(UUID eventId, String error) {
        return repository.findById(eventId)
            .map(entity -> {
                entity.markFailed(error, Instant.now().plus(backoffAfter(entity.getRetryCount() + 1)));
                log.warn("Outbox event send failed: eventId={}, eventType={}, attempt={}, nextAttemptAt={}, error={}",
                    eventId, entity.getEventType(), entity.getRetryCount(), entity.getNextAttemptAt(), error);
                return entity.toDomain();
            })
            .orElse(null);
    }

    /**
     * Gives every dead letter of the tenant a fresh retry budget.
     *
     * @return the number of events requeued
     */
    @Transactional
    public int requeueDeadLetters(long tenantId, int maxRetries) {
        List<OutboxEventEntity> deadLetters = repository.findDeadLetters(tenantId, maxRetries);
        deadLetters.forEach(OutboxEventEntity::requeue);
        if (!deadLetters.isEmpty()) {
            log.info("Dead-lettered outbox events requeued: tenantId={}, count={}", tenantId, deadLetters.size());
        }
        return deadLetters.size();
    }

    @Transactional
    public int purgePublishedBefore(Instant cutoff) {
        int deleted = repository.deletePublishedBefore(cutoff);
        if (deleted > 0) {
            log.info("Published outbox events purged: count={}, cutoff={}", deleted, cutoff);
        }
        return deleted;
    }

    @Transactional(readOnly = true)
    public List<OutboxEvent> getEventsForAggregate(String aggregateType, UUID aggregateId) {
        return repository.findByAggregateTypeAndAggregateIdOrderBySequenceNumberAsc(aggregateType, aggregateId)
            .stream()
            .map(OutboxEventEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public long countUnpublished() {
        return repository.countUnpublished();
    }

    Duration backoffAfter(int attempts) {
        Duration delay = initialBackoff;
        for (int i = 1; i < attempts && delay.compareTo(maxBackoff) < 0; i++) {
            delay = delay.multipliedBy(2);
        }
        return delay.compareTo(maxBackoff) > 0 ? maxBackoff : delay;
    }

    private String toJson(LedgerEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Event " + event.getEventType() + " cannot be serialized", e);
        }
    }
}
