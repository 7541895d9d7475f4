package com.flagship.practice_ledger.exception;

import lombok.Getter;
import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Raised when one or more accounts required by a posting cannot be resolved
 * or provisioned because the chart of accounts lacks the structure for them.
 *
 * Always carries every gap found, not only the first one.
 */
@Getter
public class MissingAccountException extends LedgerException {

    public static final String DEFAULT_GUIDANCE =
            "Set up the required accounts in the Chart of Accounts before retrying. "
                    + "Missing groups can be created from Finance > Chart of Accounts or via bulk import.";

    private final List<MissingAccount> missingAccounts;
    private final String guidance;

    public MissingAccountException(List<MissingAccount> missingAccounts) {
        this(missingAccounts, DEFAULT_GUIDANCE);
    }

    public MissingAccountException(List<MissingAccount> missingAccounts, String guidance) {
        super("Missing required accounts in Chart of Accounts: " + missingAccounts.stream()
                .map(MissingAccount::getDescription)
                .collect(Collectors.joining("; ")));
        if (missingAccounts.isEmpty()) {
            throw new IllegalArgumentException("At least one missing account is required");
        }
        this.missingAccounts = List.copyOf(missingAccounts);
        this.guidance = guidance;
    }

    /**
     * One unresolved account: the role it was needed for and what is missing.
     */
    @Value
    public static class MissingAccount {
        String role;
        String description;
    }
}
