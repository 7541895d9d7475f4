package com.flagship.practice_ledger.journal;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class JournalEntryLine {
    UUID id;
    long tenantId;
    UUID journalEntryId;
    UUID accountId;
    BigDecimal debitAmount;
    BigDecimal creditAmount;
    int lineOrder;              // 1-based
    String description;

    public boolean isDebit() {
        return debitAmount.signum() > 0;
    }

    public boolean isCredit() {
        return creditAmount.signum() > 0;
    }
}
