package com.flagship.practice_ledger.invoice;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A payment recorded against an invoice.
 */
@Value
@Builder
public class InvoicePayment {
    long id;
    BigDecimal amount;
    LocalDate paymentDate;
    PaymentMethod method;
    String reference;
}
