package com.flagship.practice_ledger.exception;

import lombok.Getter;

import java.util.UUID;

/**
 * Raised on an attempt to rename or delete a system account.
 */
@Getter
public class SystemAccountProtectionException extends LedgerException {

    private final UUID accountId;

    public SystemAccountProtectionException(UUID accountId, String operation) {
        super(String.format("Cannot %s system account %s", operation, accountId));
        this.accountId = accountId;
    }
}
