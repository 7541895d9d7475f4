package com.flagship.practice_ledger.journal;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * One line of an entry as submitted. {@code lineOrder} may be null, in which case the
 * position in the submitted list is used.
 */
@Value
public class LineRequest {
    UUID accountId;
    BigDecimal debitAmount;
    BigDecimal creditAmount;
    Integer lineOrder;
    String description;

    public static LineRequest debit(UUID accountId, BigDecimal amount, String description) {
        return new LineRequest(accountId, amount, BigDecimal.ZERO, null, description);
    }

    public static LineRequest credit(UUID accountId, BigDecimal amount, String description) {
        return new LineRequest(accountId, BigDecimal.ZERO, amount, null, description);
    }
}
