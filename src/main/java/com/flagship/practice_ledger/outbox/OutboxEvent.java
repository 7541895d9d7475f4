package com.flagship.practice_ledger.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Read-only view of an outbox row.
 */
@Value
public class OutboxEvent {
    UUID id;
    long tenantId;
    String aggregateType;      // "JournalEntry" or "Account"
    UUID aggregateId;
    String eventType;          // e.g. "JournalEntryPosted"
    String payload;            // JSON
    Instant createdAt;
    Instant publishedAt;
    int retryCount;
    Instant nextAttemptAt;     // null when due immediately
    String lastError;
    Long sequenceNumber;       // assigned by the database

    public boolean isPublished() {
        return publishedAt != null;
    }

    public boolean isDeadLetter(int maxRetries) {
        return !isPublished() && retryCount >= maxRetries;
    }
}
