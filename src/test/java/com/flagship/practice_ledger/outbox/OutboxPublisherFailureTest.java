package com.flagship.practice_ledger.outbox;

import com.flagship.practice_ledger.observability.OutboxMetrics;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class OutboxPublisherFailureTest {

    private static final int MAX_RETRIES = 3;

    @Mock
    private OutboxService outboxService;

    @Mock
    private KafkaTemplate<String, String> kafkaTemplate;

    @Mock
    private OutboxMetrics outboxMetrics;

    private OutboxPublisher publisher;

    @BeforeEach
    void setUp() {
        publisher = new OutboxPublisher(outboxService, kafkaTemplate, outboxMetrics,
            "ledger-events", 10, MAX_RETRIES, 1000, 7);
    }

    private static OutboxEvent pending(int retryCount) {
        return new OutboxEvent(UUID.randomUUID(), 11L, "JournalEntry", UUID.randomUUID(), "JournalEntryPosted",
            "{}", Instant.now(), null, retryCount, null, null, 1L);
    }

    @Test
    void brokerErrorSchedulesRetry() {
        OutboxEvent event = pending(0);
        when(outboxService.findDueEvents(10, MAX_RETRIES)).thenReturn(List.of(event));
        when(kafkaTemplate.send(any(ProducerRecord.class)))
            .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));
        when(outboxService.markFailed(event.getId(), "broker down")).thenReturn(pending(1));

        publisher.publishDueEvents();

        verify(outboxService).markFailed(event.getId(), "broker down");
        verify(outboxService, never()).markPublished(any());
        verify(outboxMetrics).recordEventPublishFailed("JournalEntryPosted");
        verify(outboxMetrics, never()).recordEventDeadLettered(any());
    }

    @Test
    void lastAttemptDeadLetters() {
        OutboxEvent event = pending(MAX_RETRIES - 1);
        when(kafkaTemplate.send(any(ProducerRecord.class)))
            .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));
        when(outboxService.markFailed(eq(event.getId()), any())).thenReturn(pending(MAX_RETRIES));

        assertFalse(publisher.send(event));

        verify(outboxMetrics).recordEventDeadLettered("JournalEntryPosted");
    }

    @Test
    void pollFailureDoesNotPropagate() {
        when(outboxService.findDueEvents(anyInt(), anyInt())).thenThrow(new IllegalStateException("db down"));

        assertDoesNotThrow(() -> publisher.publishDueEvents());
        verifyNoInteractions(kafkaTemplate);
    }
}
