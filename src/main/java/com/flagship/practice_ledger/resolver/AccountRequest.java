package com.flagship.practice_ledger.resolver;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.UUID;

/**
 * What a posting needs resolved: a role plus the role-specific inputs.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AccountRequest {
    AccountRole role;
    Long entityId;              // ENTITY_RECEIVABLE
    String entityName;          // ENTITY_RECEIVABLE
    UUID selectedAccountId;     // INCOME, explicit choice
    UUID defaultAccountId;      // INCOME, the entity's revenue account

    public static AccountRequest receivable(long entityId, String entityName) {
        return new AccountRequest(AccountRole.ENTITY_RECEIVABLE, entityId, entityName, null, null);
    }

    public static AccountRequest income(UUID selectedAccountId, UUID defaultAccountId) {
        return new AccountRequest(AccountRole.INCOME, null, null, selectedAccountId, defaultAccountId);
    }

    public static AccountRequest taxPayable() {
        return new AccountRequest(AccountRole.TAX_PAYABLE, null, null, null, null);
    }

    public static AccountRequest discountAllowed() {
        return new AccountRequest(AccountRole.DISCOUNT_ALLOWED, null, null, null, null);
    }

    public static AccountRequest cashAtBank() {
        return new AccountRequest(AccountRole.CASH_AT_BANK, null, null, null, null);
    }

    public static AccountRequest cashInHand() {
        return new AccountRequest(AccountRole.CASH_IN_HAND, null, null, null, null);
    }

    /**
     * Entity name for display, falling back to the id.
     */
    public String entityDisplayName() {
        return entityName != null && !entityName.isBlank() ? entityName.trim() : "Entity " + entityId;
    }
}
