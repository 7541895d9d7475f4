package com.flagship.practice_ledger.invoice;

import com.flagship.practice_ledger.journal.LineRequest;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Builds the journal lines an invoice posts.
 *
 * <pre>
 * Dr receivable        total + |discount|
 *   Cr income          subtotal
 *   Cr tax payable     tax                 (tax > 0)
 * Dr discount allowed  |discount|          (discount != 0)
 *   Cr receivable      |discount|          (discount != 0)
 * </pre>
 */
public final class InvoicePostingLines {

    private InvoicePostingLines() {
    }

    /**
     * @param taxAccountId      required when the invoice has tax
     * @param discountAccountId required when the invoice has a discount
     */
    public static List<LineRequest> forApproval(Invoice invoice, UUID receivableAccountId, UUID incomeAccountId,
                                                UUID taxAccountId, UUID discountAccountId) {
        String number = invoice.getInvoiceNumber();
        BigDecimal discount = invoice.discountMagnitude();
        List<LineRequest> lines = new ArrayList<>(5);

        lines.add(LineRequest.debit(receivableAccountId, invoice.getTotalAmount().add(discount),
            "Accounts Receivable - Invoice " + number));
        lines.add(LineRequest.credit(incomeAccountId, invoice.getSubtotal(),
            "Revenue - Invoice " + number));

        if (invoice.hasTax()) {
            requireAccount(taxAccountId, "tax payable");
            lines.add(LineRequest.credit(taxAccountId, invoice.getTaxAmount(),
                "Tax Liability - Invoice " + number));
        }

        if (invoice.hasDiscount()) {
            requireAccount(discountAccountId, "discount allowed");
            lines.add(LineRequest.debit(discountAccountId, discount,
                "Discount Allowed - Invoice " + number));
            lines.add(LineRequest.credit(receivableAccountId, discount,
                "Discount on Invoice " + number));
        }

        return lines;
    }

    public static List<LineRequest> forPayment(Invoice invoice, InvoicePayment payment,
                                               UUID cashAccountId, UUID receivableAccountId) {
        String number = invoice.getInvoiceNumber();
        return List.of(
            LineRequest.debit(cashAccountId, payment.getAmount(), "Payment received - Invoice " + number),
            LineRequest.credit(receivableAccountId, payment.getAmount(), "Accounts Receivable - Invoice " + number)
        );
    }

    private static void requireAccount(UUID accountId, String role) {
        if (accountId == null) {
            throw new IllegalArgumentException("No " + role + " account supplied for the invoice");
        }
    }
}
