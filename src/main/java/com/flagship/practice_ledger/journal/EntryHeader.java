package com.flagship.practice_ledger.journal;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Header fields supplied when creating an entry.
 */
@Value
@Builder(toBuilder = true)
public class EntryHeader {
    LocalDate entryDate;
    String reference;
    String entryType;
    String description;
    boolean posted;
    String sourceDocument;
    Long sourceDocumentId;
    Long userId;

    public boolean hasSourceDocument() {
        return sourceDocument != null && sourceDocumentId != null;
    }
}
