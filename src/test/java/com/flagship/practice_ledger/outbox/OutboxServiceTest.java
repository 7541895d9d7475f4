package com.flagship.practice_ledger.outbox;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.practice_ledger.LedgerIntegrationTest;
import com.flagship.practice_ledger.hierarchy.Account;
import com.flagship.practice_ledger.hierarchy.AccountType;
import com.flagship.practice_ledger.hierarchy.event.AccountCreatedEvent;
import com.flagship.practice_ledger.observability.OutboxHealthIndicator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.actuate.health.Health;
import org.springframework.transaction.IllegalTransactionStateException;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class OutboxServiceTest extends LedgerIntegrationTest {

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private OutboxEventRepository outboxEventRepository;

    @Autowired
    private TransactionTemplate transactionTemplate;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private OutboxHealthIndicator outboxHealthIndicator;

    private AccountCreatedEvent accountCreated(long tenantId) {
        Account account = Account.builder()
            .id(UUID.randomUUID())
            .tenantId(tenantId)
            .detailedGroupId(UUID.randomUUID())
            .accountCode("1100")
            .accountName("Bank")
            .accountType(AccountType.ASSET)
            .systemAccount(true)
            .active(true)
            .openingBalance(new BigDecimal("10.50"))
            .currentBalance(new BigDecimal("10.50"))
            .build();
        return AccountCreatedEvent.fromAccount(account);
    }

    private OutboxEvent saveInTransaction(LedgerEvent event) {
        return transactionTemplate.execute(status -> outboxService.saveEvent(event));
    }

    @Test
    @DisplayName("Saved event carries the serialized payload and starts unpublished")
    void saveEventSerializesPayload() throws Exception {
        printTestHeader("Outbox Save");
        long tenantId = newTenantId();
        AccountCreatedEvent event = accountCreated(tenantId);

        OutboxEvent saved = saveInTransaction(event);
        printOutput("Payload", saved.getPayload());

        assertEquals(AccountCreatedEvent.AGGREGATE_TYPE, saved.getAggregateType());
        assertEquals(event.getAccountId(), saved.getAggregateId());
        assertEquals(AccountCreatedEvent.EVENT_TYPE, saved.getEventType());
        assertFalse(saved.isPublished());
        assertEquals(0, saved.getRetryCount());

        JsonNode payload = objectMapper.readTree(saved.getPayload());
        assertEquals(tenantId, payload.get("tenantId").asLong());
        assertEquals(tenantId, saved.getTenantId());
        assertEquals("1100", payload.get("accountCode").asText());
        assertEquals("ASSET", payload.get("accountType").asText());
        assertEquals(event.getEventId().toString(), payload.get("eventId").asText());
        assertTrue(payload.get("occurredAt").isTextual(), "timestamps are written as ISO strings");
        printSuccess("Event stored with JSON payload");
    }

    @Test
    @DisplayName("Saving outside a transaction is rejected")
    void saveRequiresTransaction() {
        AccountCreatedEvent event = accountCreated(newTenantId());

        assertThrows(IllegalTransactionStateException.class, () -> outboxService.saveEvent(event));
        assertTrue(outboxService.getEventsForAggregate(AccountCreatedEvent.AGGREGATE_TYPE, event.getAccountId()).isEmpty());
        printExpectedException("IllegalTransactionStateException", "no surrounding ledger write");
    }

    @Test
    @DisplayName("Rolled back writes leave no event behind")
    void rollbackDiscardsEvent() {
        AccountCreatedEvent event = accountCreated(newTenantId());

        transactionTemplate.executeWithoutResult(status -> {
            outboxService.saveEvent(event);
            status.setRollbackOnly();
        });

        assertTrue(outboxService.getEventsForAggregate(AccountCreatedEvent.AGGREGATE_TYPE, event.getAccountId()).isEmpty());
    }

    @Test
    @DisplayName("Failed events wait out a growing delay and dead-letter at the retry limit")
    void markFailedSchedulesRetries() {
        long tenantId = newTenantId();
        OutboxEvent saved = saveInTransaction(accountCreated(tenantId));
        assertTrue(dueIds(3).contains(saved.getId()));

        OutboxEvent afterFirst = outboxService.markFailed(saved.getId(), "broker unavailable");
        OutboxEvent afterSecond = outboxService.markFailed(saved.getId(), "broker unavailable");

        assertEquals(1, afterFirst.getRetryCount());
        assertEquals(2, afterSecond.getRetryCount());
        assertEquals("broker unavailable", afterSecond.getLastError());
        assertTrue(afterSecond.getNextAttemptAt().isAfter(Instant.now()));
        assertFalse(dueIds(3).contains(saved.getId()), "not due before the retry delay passes");

        assertTrue(afterSecond.isDeadLetter(2));
        assertEquals(1, outboxService.requeueDeadLetters(tenantId, 2));

        OutboxEvent requeued = outboxEventRepository.findById(saved.getId()).orElseThrow().toDomain();
        assertEquals(0, requeued.getRetryCount());
        assertNull(requeued.getNextAttemptAt());
        assertTrue(dueIds(2).contains(saved.getId()));
    }

    @Test
    void backoffDoublesUpToTheCap() {
        assertEquals(Duration.ofSeconds(1), outboxService.backoffAfter(1));
        assertEquals(Duration.ofSeconds(2), outboxService.backoffAfter(2));
        assertEquals(Duration.ofSeconds(8), outboxService.backoffAfter(4));
        assertEquals(Duration.ofMinutes(5), outboxService.backoffAfter(30));
    }

    @Test
    void longErrorsAreTruncated() {
        OutboxEvent saved = saveInTransaction(accountCreated(newTenantId()));

        OutboxEvent failed = outboxService.markFailed(saved.getId(), "x".repeat(5000));

        assertEquals(OutboxEventEntity.MAX_ERROR_LENGTH, failed.getLastError().length());
        assertNull(outboxService.markFailed(UUID.randomUUID(), "gone"));
    }

    private List<UUID> dueIds(int maxRetries) {
        return outboxService.findDueEvents(10_000, maxRetries).stream().map(OutboxEvent::getId).toList();
    }

    @Test
    @DisplayName("Published events are excluded from the batch and purged after retention")
    void markPublishedAndPurge() {
        OutboxEvent saved = saveInTransaction(accountCreated(newTenantId()));
        long backlogBefore = outboxService.countUnpublished();

        outboxService.markPublished(saved.getId());

        OutboxEvent reloaded = outboxEventRepository.findById(saved.getId()).orElseThrow().toDomain();
        assertTrue(reloaded.isPublished());
        assertNull(reloaded.getLastError());
        assertEquals(backlogBefore - 1, outboxService.countUnpublished());

        outboxService.purgePublishedBefore(reloaded.getPublishedAt().minusSeconds(60));
        assertTrue(outboxEventRepository.findById(saved.getId()).isPresent());
        assertTrue(outboxService.purgePublishedBefore(Instant.now().plusSeconds(60)) >= 1);
        assertTrue(outboxEventRepository.findById(saved.getId()).isEmpty());
    }

    @Test
    @DisplayName("Events of one aggregate come back in write order")
    void eventsForAggregateOrdered() {
        AccountCreatedEvent first = accountCreated(newTenantId());
        AccountCreatedEvent second = new AccountCreatedEvent(UUID.randomUUID(), first.getTenantId(), first.getAccountId(),
            first.getDetailedGroupId(), "1100", "Bank (renamed)", "ASSET", null, true, BigDecimal.ZERO, Instant.now());

        transactionTemplate.executeWithoutResult(status -> {
            outboxService.saveEvent(first);
            outboxService.saveEvent(second);
        });

        List<OutboxEvent> events = outboxService.getEventsForAggregate(AccountCreatedEvent.AGGREGATE_TYPE, first.getAccountId());
        assertEquals(2, events.size());
        assertTrue(events.get(0).getSequenceNumber() < events.get(1).getSequenceNumber());
        assertTrue(events.get(1).getPayload().contains("Bank (renamed)"));
    }

    @Test
    @DisplayName("Outbox health reports the backlog and dead letters")
    void outboxHealthReportsBacklog() {
        OutboxEvent saved = saveInTransaction(accountCreated(newTenantId()));
        for (int i = 0; i < 5; i++) {
            outboxService.markFailed(saved.getId(), "broker unavailable");
        }

        Health health = outboxHealthIndicator.health();

        assertEquals(OutboxHealthIndicator.DEGRADED, health.getStatus());
        assertTrue((Long) health.getDetails().get("pending") >= 1);
        assertTrue((Long) health.getDetails().get("deadLetters") >= 1);
    }
}
