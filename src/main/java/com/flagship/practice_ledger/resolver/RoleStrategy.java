package com.flagship.practice_ledger.resolver;

import com.flagship.practice_ledger.hierarchy.Account;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * How one role is resolved: existing-account matchers first, then group fallback tiers
 * to provision into, then the gap to report.
 */
record RoleStrategy(List<ExistingAccountMatcher> matchers,
                    List<GroupFallbackTier> tiers,
                    Function<AccountRequest, ProvisionedAccount> provisioning,
                    Function<AccountRequest, String> gapDescription) {

    @FunctionalInterface
    interface ExistingAccountMatcher {
        Optional<Account> match(long tenantId, AccountRequest request);
    }

    /**
     * Code, name and flags of an account created when no existing one matched.
     */
    record ProvisionedAccount(String code, String name, String description,
                              boolean systemAccount, Long linkedEntityId) {
    }
}
