package com.flagship.practice_ledger.exception;

import lombok.Getter;

import java.math.BigDecimal;

/**
 * Raised when the debit and credit totals of a journal entry differ.
 * Unbalanced entries are always rejected, never coerced.
 */
@Getter
public class UnbalancedEntryException extends LedgerException {

    private final BigDecimal totalDebit;
    private final BigDecimal totalCredit;

    public UnbalancedEntryException(BigDecimal totalDebit, BigDecimal totalCredit) {
        super(String.format("Journal entry is not balanced: debits=%s, credits=%s",
                totalDebit.toPlainString(), totalCredit.toPlainString()));
        this.totalDebit = totalDebit;
        this.totalCredit = totalCredit;
    }
}
