package com.flagship.practice_ledger.journal.event;

import com.flagship.practice_ledger.journal.JournalEntry;
import com.flagship.practice_ledger.outbox.LedgerEvent;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Published when the lines of an existing entry are replaced in place.
 */
@Value
public class JournalEntryLinesReplacedEvent implements LedgerEvent {
    UUID eventId;
    long tenantId;
    UUID entryId;
    String reference;
    BigDecimal previousTotalAmount;
    BigDecimal totalAmount;
    boolean posted;
    int lineCount;
    Instant occurredAt;

    public static final String EVENT_TYPE = "JournalEntryLinesReplaced";

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

    public static JournalEntryLinesReplacedEvent of(JournalEntry before, JournalEntry after, int lineCount) {
        return new JournalEntryLinesReplacedEvent(
            UUID.randomUUID(),
            after.getTenantId(),
            after.getId(),
            after.getReference(),
            before.getTotalAmount(),
            after.getTotalAmount(),
            after.isPosted(),
            lineCount,
            Instant.now()
        );
    }
}
