package com.flagship.practice_ledger.invoice;

/**
 * Invoice fields reported as changed by an edit.
 */
public enum InvoiceField {
    SUBTOTAL(true),
    TAX_AMOUNT(true),
    DISCOUNT_AMOUNT(true),
    TOTAL_AMOUNT(true),
    ISSUE_DATE(false),
    DUE_DATE(false),
    NOTES(false),
    LINE_ITEMS(false);

    private final boolean affectsPosting;

    InvoiceField(boolean affectsPosting) {
        this.affectsPosting = affectsPosting;
    }

    public boolean affectsPosting() {
        return affectsPosting;
    }
}
