package com.flagship.practice_ledger.journal;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Header of a double-entry journal entry. Lines are stored separately.
 *
 * {@code totalAmount} equals both the debit and the credit total of the lines.
 * {@code sequenceNumber} is assigned by the database and orders entries of the same date.
 */
@Value
@Builder(toBuilder = true)
public class JournalEntry {
    public static final String AGGREGATE_TYPE = "JournalEntry";

    UUID id;
    long tenantId;
    LocalDate entryDate;
    String reference;
    String entryType;           // free-form: INVAP, PMT, MANUAL, ...
    String description;
    boolean posted;
    String sourceDocument;      // e.g. "invoice", "payment"; null for manual entries
    Long sourceDocumentId;
    BigDecimal totalAmount;
    Long createdBy;
    Long updatedBy;
    Instant createdAt;
    Instant updatedAt;
    Long sequenceNumber;

    public boolean isLinkedTo(String document, long documentId) {
        return document.equals(sourceDocument) && sourceDocumentId != null && sourceDocumentId == documentId;
    }
}
