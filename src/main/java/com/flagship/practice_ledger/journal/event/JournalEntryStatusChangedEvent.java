package com.flagship.practice_ledger.journal.event;

import com.flagship.practice_ledger.journal.JournalEntry;
import com.flagship.practice_ledger.outbox.LedgerEvent;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when an entry is marked posted or back to draft. Balances are not affected.
 */
@Value
public class JournalEntryStatusChangedEvent implements LedgerEvent {
    UUID eventId;
    long tenantId;
    UUID entryId;
    boolean previouslyPosted;
    boolean posted;
    Instant occurredAt;

    public static final String EVENT_TYPE = "JournalEntryStatusChanged";

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

    public static JournalEntryStatusChangedEvent of(JournalEntry entry, boolean posted) {
        return new JournalEntryStatusChangedEvent(
            UUID.randomUUID(),
            entry.getTenantId(),
            entry.getId(),
            entry.isPosted(),
            posted,
            Instant.now()
        );
    }
}
