package com.flagship.practice_ledger.hierarchy.event;

import com.flagship.practice_ledger.hierarchy.Account;
import com.flagship.practice_ledger.outbox.LedgerEvent;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Published when an account is added to a tenant's chart, whether by an administrator,
 * the bulk import, seeding or auto-provisioning during a posting.
 */
@Value
public class AccountCreatedEvent implements LedgerEvent {
    UUID eventId;
    long tenantId;
    UUID accountId;
    UUID detailedGroupId;
    String accountCode;
    String accountName;
    String accountType;
    Long linkedEntityId;
    boolean systemAccount;
    BigDecimal openingBalance;
    Instant occurredAt;

    public static final String EVENT_TYPE = "AccountCreated";
    public static final String AGGREGATE_TYPE = "Account";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public String getAggregateType() {
        return AGGREGATE_TYPE;
    }

    @Override
    public UUID getAggregateId() {
        return accountId;
    }

    public static AccountCreatedEvent fromAccount(Account account) {
        return new AccountCreatedEvent(
            UUID.randomUUID(),
            account.getTenantId(),
            account.getId(),
            account.getDetailedGroupId(),
            account.getAccountCode(),
            account.getAccountName(),
            account.getAccountType().name(),
            account.getLinkedEntityId(),
            account.isSystemAccount(),
            account.getOpeningBalance(),
            Instant.now()
        );
    }
}
