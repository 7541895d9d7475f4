package com.flagship.practice_ledger.resolver;

/**
 * Roles an account plays in an automated posting.
 */
public enum AccountRole {
    ENTITY_RECEIVABLE("Accounts receivable"),
    INCOME("Income"),
    TAX_PAYABLE("Tax payable"),
    DISCOUNT_ALLOWED("Discount allowed"),
    CASH_AT_BANK("Cash at bank"),
    CASH_IN_HAND("Cash in hand");

    private final String label;

    AccountRole(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
