package com.flagship.practice_ledger.query;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * One journal line against the account, with the balance after it.
 */
@Value
public class LedgerRow {
    UUID entryId;
    LocalDate entryDate;
    String reference;
    String description;
    BigDecimal debit;
    BigDecimal credit;
    BigDecimal runningBalance;
}
