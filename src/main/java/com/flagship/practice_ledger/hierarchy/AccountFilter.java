package com.flagship.practice_ledger.hierarchy;

import lombok.Builder;
import lombok.Value;

import java.util.UUID;

/**
 * Optional filters for listing accounts. Null fields do not filter.
 */
@Value
@Builder
public class AccountFilter {
    AccountType accountType;
    UUID detailedGroupId;
    @Builder.Default
    boolean includeSystemAccounts = true;
    @Builder.Default
    boolean activeOnly = false;

    public static AccountFilter all() {
        return AccountFilter.builder().build();
    }
}
