package com.flagship.practice_ledger.hierarchy;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A postable account, owned by exactly one detailed group.
 *
 * {@code accountType} is derived from the element group above the account and is never
 * set independently. {@code currentBalance} is a cache maintained by the journal engine.
 */
@Value
@Builder(toBuilder = true)
public class Account {
    UUID id;
    long tenantId;
    UUID detailedGroupId;
    String accountCode;
    String accountName;
    AccountType accountType;
    String description;
    Long linkedEntityId;
    boolean systemAccount;
    boolean active;
    BigDecimal openingBalance;
    BigDecimal currentBalance;
    Instant createdAt;
    Instant updatedAt;
}
