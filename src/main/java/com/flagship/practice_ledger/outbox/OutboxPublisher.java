package com.flagship.practice_ledger.outbox;

import com.flagship.practice_ledger.observability.OutboxMetrics;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Drains the outbox to the ledger events topic.
 *
 * Records are keyed by aggregate id, so the events of one journal entry or account keep
 * their order on a single partition. Event type, tenant and aggregate type travel as
 * record headers so consumers can route without parsing the payload.
 */
@Component
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class OutboxPublisher {

    public static final String EVENT_TYPE_HEADER = "eventType";
    public static final String TENANT_ID_HEADER = "tenantId";
    public static final String AGGREGATE_TYPE_HEADER = "aggregateType";

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;
    private final String topic;
    private final int batchSize;
    private final int maxRetries;
    private final long sendTimeoutMs;
    private final Duration retention;

    public OutboxPublisher(OutboxService outboxService,
                           KafkaTemplate<String, String> kafkaTemplate,
                           OutboxMetrics outboxMetrics,
                           @Value("${ledger.events.topic:ledger-events}") String topic,
                           @Value("${outbox.publisher.batch-size:100}") int batchSize,
                           @Value("${outbox.publisher.max-retries:5}") int maxRetries,
                           @Value("${outbox.publisher.send-timeout-ms:10000}") long sendTimeoutMs,
                           @Value("${outbox.retention-days:7}") int retentionDays) {
        this.outboxService = outboxService;
        this.kafkaTemplate = kafkaTemplate;
        this.outboxMetrics = outboxMetrics;
        this.topic = topic;
        this.batchSize = batchSize;
        this.maxRetries = maxRetries;
        this.sendTimeoutMs = sendTimeoutMs;
        this.retention = Duration.ofDays(retentionDays);
    }

    @Scheduled(fixedDelayString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishDueEvents() {
        List<OutboxEvent> batch;
        try {
            batch = outboxService.findDueEvents(batchSize, maxRetries);
        } catch (RuntimeException e) {
            log.error("Outbox poll failed", e);
            return;
        }
        if (batch.isEmpty()) {
            return;
        }

        int published = 0;
        for (OutboxEvent event : batch) {
            if (send(event)) {
                published++;
            }
        }
        log.debug("Outbox batch sent: size={}, published={}", batch.size(), published);
    }

    @Scheduled(cron = "${outbox.retention-cron:0 15 3 * * *}")
    public void purgePublishedEvents() {
        outboxService.purgePublishedBefore(Instant.now().minus(retention));
    }

    /**
     * Sends one event and records the outcome on its outbox row.
     *
     * @return whether the broker acknowledged the record
     */
    boolean send(OutboxEvent event) {
        try {
            RecordMetadata metadata = kafkaTemplate.send(toRecord(event))
                .get(sendTimeoutMs, TimeUnit.MILLISECONDS)
                .getRecordMetadata();
            outboxService.markPublished(event.getId());
            outboxMetrics.recordEventPublished(event.getEventType());
            log.debug("Outbox event published: eventId={}, eventType={}, partition={}, offset={}",
                event.getId(), event.getEventType(), metadata.partition(), metadata.offset());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            recordFailure(event, "Interrupted while waiting for the broker");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            recordFailure(event, cause.getMessage());
        } catch (TimeoutException e) {
            recordFailure(event, "No broker acknowledgement within " + sendTimeoutMs + " ms");
        } catch (RuntimeException e) {
            recordFailure(event, e.getMessage());
        }
        return false;
    }

    private ProducerRecord<String, String> toRecord(OutboxEvent event) {
        ProducerRecord<String, String> record =
            new ProducerRecord<>(topic, event.getAggregateId().toString(), event.getPayload());
        record.headers()
            .add(EVENT_TYPE_HEADER, event.getEventType().getBytes(StandardCharsets.UTF_8))
            .add(TENANT_ID_HEADER, String.valueOf(event.getTenantId()).getBytes(StandardCharsets.UTF_8))
            .add(AGGREGATE_TYPE_HEADER, event.getAggregateType().getBytes(StandardCharsets.UTF_8));
        return record;
    }

    private void recordFailure(OutboxEvent event, String error) {
        outboxMetrics.recordEventPublishFailed(event.getEventType());
        OutboxEvent failed = outboxService.markFailed(event.getId(), error);
        if (failed != null && failed.isDeadLetter(maxRetries)) {
            log.error("Outbox event dead-lettered after {} attempts: eventId={}, eventType={}, aggregateId={}, tenantId={}",
                failed.getRetryCount(), failed.getId(), failed.getEventType(), failed.getAggregateId(),
                failed.getTenantId());
            outboxMetrics.recordEventDeadLettered(event.getEventType());
        }
    }
}
