package com.flagship.practice_ledger.invoice;

import java.util.EnumSet;
import java.util.Set;

/**
 * Invoice lifecycle. The invoice itself is owned by the billing module; the ledger only
 * checks transitions before projecting them into journal entries.
 *
 * Any status may go back to DRAFT, because editing reopens an invoice.
 */
public enum InvoiceStatus {
    DRAFT,
    APPROVED,
    SENT,
    PAID,
    PARTIALLY_PAID,
    OVERDUE,
    CANCELED,
    VOID;

    public Set<InvoiceStatus> allowedTransitions() {
        Set<InvoiceStatus> targets = switch (this) {
            case DRAFT -> EnumSet.of(APPROVED, SENT, CANCELED, VOID);
            case SENT -> EnumSet.of(APPROVED, PAID, PARTIALLY_PAID, OVERDUE, CANCELED, VOID);
            case APPROVED -> EnumSet.of(SENT, PAID, PARTIALLY_PAID, OVERDUE, CANCELED, VOID);
            case PARTIALLY_PAID -> EnumSet.of(PAID, OVERDUE, VOID);
            case OVERDUE -> EnumSet.of(PAID, PARTIALLY_PAID, VOID);
            case PAID -> EnumSet.of(VOID);
            case CANCELED, VOID -> EnumSet.noneOf(InvoiceStatus.class);
        };
        if (this != DRAFT) {
            targets.add(DRAFT);
        }
        return targets;
    }

    public boolean canTransitionTo(InvoiceStatus target) {
        return allowedTransitions().contains(target);
    }
}
