package com.flagship.practice_ledger.invoice;

import com.flagship.practice_ledger.journal.JournalLines;
import com.flagship.practice_ledger.journal.LineRequest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class InvoicePostingLinesTest {

    private final UUID receivable = UUID.randomUUID();
    private final UUID income = UUID.randomUUID();
    private final UUID tax = UUID.randomUUID();
    private final UUID discount = UUID.randomUUID();

    private Invoice invoice(String subtotal, String tax, String discount, String total) {
        return Invoice.builder()
                .id(1L)
                .tenantId(1L)
                .invoiceNumber("INV-0001")
                .entityId(10L)
                .entityName("Acme Ltd")
                .status(InvoiceStatus.DRAFT)
                .issueDate(LocalDate.of(2024, 3, 1))
                .subtotal(new BigDecimal(subtotal))
                .taxAmount(new BigDecimal(tax))
                .discountAmount(new BigDecimal(discount))
                .totalAmount(new BigDecimal(total))
                .build();
    }

    @Test
    @DisplayName("Subtotal 1000, tax 170, discount 50 posts five balanced lines")
    void fullInvoice() {
        List<LineRequest> lines = InvoicePostingLines.forApproval(
                invoice("1000.00", "170.00", "-50.00", "1120.00"), receivable, income, tax, discount);

        assertEquals(5, lines.size());
        assertLine(lines.get(0), receivable, "1170.00", "0");
        assertLine(lines.get(1), income, "0", "1000.00");
        assertLine(lines.get(2), tax, "0", "170.00");
        assertLine(lines.get(3), discount, "50.00", "0");
        assertLine(lines.get(4), receivable, "0", "50.00");
        assertDoesNotThrow(() -> JournalLines.validate(lines, JournalLines.DEFAULT_EPSILON));
    }

    @Test
    @DisplayName("No tax and no discount posts two lines")
    void plainInvoice() {
        List<LineRequest> lines = InvoicePostingLines.forApproval(
                invoice("500.00", "0", "0", "500.00"), receivable, income, null, null);

        assertEquals(2, lines.size());
        assertLine(lines.get(0), receivable, "500.00", "0");
        assertLine(lines.get(1), income, "0", "500.00");
    }

    @Test
    void missingTaxAccountIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> InvoicePostingLines.forApproval(
                invoice("100.00", "17.00", "0", "117.00"), receivable, income, null, null));
    }

    @Test
    void paymentDebitsCashAndCreditsReceivable() {
        UUID cash = UUID.randomUUID();
        InvoicePayment payment = InvoicePayment.builder()
                .id(3L).amount(new BigDecimal("200.00")).method(PaymentMethod.CASH).build();

        List<LineRequest> lines = InvoicePostingLines.forPayment(
                invoice("500.00", "0", "0", "500.00"), payment, cash, receivable);

        assertLine(lines.get(0), cash, "200.00", "0");
        assertLine(lines.get(1), receivable, "0", "200.00");
    }

    private void assertLine(LineRequest line, UUID account, String debit, String credit) {
        assertEquals(account, line.getAccountId());
        assertEquals(0, new BigDecimal(debit).compareTo(line.getDebitAmount()), "debit");
        assertEquals(0, new BigDecimal(credit).compareTo(line.getCreditAmount()), "credit");
    }
}
