package com.flagship.practice_ledger.journal.event;

import com.flagship.practice_ledger.journal.JournalEntry;
import com.flagship.practice_ledger.outbox.LedgerEvent;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Published when an entry and its lines are removed.
 */
@Value
public class JournalEntryDeletedEvent implements LedgerEvent {
    UUID eventId;
    long tenantId;
    UUID entryId;
    String reference;
    String sourceDocument;
    Long sourceDocumentId;
    BigDecimal totalAmount;
    List<UUID> affectedAccountIds;
    Instant occurredAt;

    public static final String EVENT_TYPE = "JournalEntryDeleted";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public String getAggregateType() {
        return JournalEntry.AGGREGATE_TYPE;
    }

    @Override
    public UUID getAggregateId() {
        return entryId;
    }

    public static JournalEntryDeletedEvent of(JournalEntry entry, List<UUID> affectedAccountIds) {
        return new JournalEntryDeletedEvent(
            UUID.randomUUID(),
            entry.getTenantId(),
            entry.getId(),
            entry.getReference(),
            entry.getSourceDocument(),
            entry.getSourceDocumentId(),
            entry.getTotalAmount(),
            List.copyOf(affectedAccountIds),
            Instant.now()
        );
    }
}
