package com.flagship.practice_ledger.resolver;

import com.flagship.practice_ledger.exception.MissingAccountException;
import com.flagship.practice_ledger.exception.MissingAccountException.MissingAccount;
import com.flagship.practice_ledger.hierarchy.Account;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.List;

/**
 * Outcome of resolving one role: either an account or the gap that prevented it.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Resolution {
    AccountRole role;
    Account account;
    MissingAccount missing;
    boolean provisioned;

    public static Resolution found(AccountRole role, Account account) {
        return new Resolution(role, account, null, false);
    }

    public static Resolution provisioned(AccountRole role, Account account) {
        return new Resolution(role, account, null, true);
    }

    public static Resolution missing(AccountRole role, String description) {
        return new Resolution(role, null, new MissingAccount(role.name(), description), false);
    }

    public boolean isResolved() {
        return account != null;
    }

    public Account orElseThrow() {
        if (account == null) {
            throw new MissingAccountException(List.of(missing));
        }
        return account;
    }
}
