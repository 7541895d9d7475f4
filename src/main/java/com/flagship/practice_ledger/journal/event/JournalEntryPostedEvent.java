package com.flagship.practice_ledger.journal.event;

import com.flagship.practice_ledger.journal.JournalEntry;
import com.flagship.practice_ledger.outbox.LedgerEvent;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Published when a journal entry and its lines are written for the first time.
 * {@code posted} tells consumers whether the entry was created as posted or as a draft.
 */
@Value
public class JournalEntryPostedEvent implements LedgerEvent {
    UUID eventId;
    long tenantId;
    UUID entryId;
    LocalDate entryDate;
    String entryType;
    String reference;
    String sourceDocument;
    Long sourceDocumentId;
    BigDecimal totalAmount;
    boolean posted;
    int lineCount;
    Instant occurredAt;

    public static final String EVENT_TYPE = "JournalEntryPosted";

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

    public static JournalEntryPostedEvent fromEntry(JournalEntry entry, int lineCount) {
        return new JournalEntryPostedEvent(
            UUID.randomUUID(),
            entry.getTenantId(),
            entry.getId(),
            entry.getEntryDate(),
            entry.getEntryType(),
            entry.getReference(),
            entry.getSourceDocument(),
            entry.getSourceDocumentId(),
            entry.getTotalAmount(),
            entry.isPosted(),
            lineCount,
            Instant.now()
        );
    }
}
