package com.flagship.practice_ledger.invoice;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Snapshot of an invoice as handed over by the billing module when a lifecycle hook fires.
 *
 * Amounts follow the billing module's convention: {@code totalAmount = subtotal + taxAmount - |discountAmount|}.
 */
@Value
@Builder(toBuilder = true)
public class Invoice {
    long id;
    long tenantId;
    String invoiceNumber;
    long entityId;
    String entityName;
    InvoiceStatus status;
    LocalDate issueDate;
    BigDecimal subtotal;
    BigDecimal taxAmount;
    BigDecimal discountAmount;
    BigDecimal totalAmount;
    UUID defaultIncomeAccountId;    // the entity's revenue account, if configured
    Long userId;

    public BigDecimal taxOrZero() {
        return taxAmount != null ? taxAmount : BigDecimal.ZERO;
    }

    public BigDecimal discountMagnitude() {
        return discountAmount != null ? discountAmount.abs() : BigDecimal.ZERO;
    }

    public boolean hasTax() {
        return taxOrZero().signum() > 0;
    }

    public boolean hasDiscount() {
        return discountMagnitude().signum() != 0;
    }
}
