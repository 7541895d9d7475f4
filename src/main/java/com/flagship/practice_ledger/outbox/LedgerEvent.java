package com.flagship.practice_ledger.outbox;

import java.time.Instant;
import java.util.UUID;

/**
 * Common shape of every domain event the ledger core emits.
 *
 * Events are facts about committed ledger state. Subscribers (notifications, websockets,
 * reporting caches) consume them from Kafka; the ledger never calls them directly.
 */
public interface LedgerEvent {

    /**
     * Unique identifier for this event instance, for consumer-side deduplication.
     */
    UUID getEventId();

    long getTenantId();

    /**
     * Aggregate type used for routing, e.g. "JournalEntry" or "Account".
     */
    String getAggregateType();

    UUID getAggregateId();

    Instant getOccurredAt();

    String getEventType();
}
