package com.flagship.practice_ledger.invoice;

import com.flagship.practice_ledger.exception.MissingAccountException;
import com.flagship.practice_ledger.exception.MissingAccountException.MissingAccount;
import com.flagship.practice_ledger.exception.UnbalancedEntryException;
import com.flagship.practice_ledger.hierarchy.Account;
import com.flagship.practice_ledger.hierarchy.AccountRepository;
import com.flagship.practice_ledger.hierarchy.AccountType;
import com.flagship.practice_ledger.journal.EntryHeader;
import com.flagship.practice_ledger.journal.HeaderUpdate;
import com.flagship.practice_ledger.journal.JournalEntry;
import com.flagship.practice_ledger.journal.JournalEntryEngine;
import com.flagship.practice_ledger.journal.JournalEntryLine;
import com.flagship.practice_ledger.journal.JournalLines;
import com.flagship.practice_ledger.journal.LineRequest;
import com.flagship.practice_ledger.journal.PostingLocks;
import com.flagship.practice_ledger.observability.CorrelationContext;
import com.flagship.practice_ledger.observability.LedgerMetrics;
import com.flagship.practice_ledger.resolver.AccountRequest;
import com.flagship.practice_ledger.resolver.AccountResolver;
import com.flagship.practice_ledger.resolver.AccountRole;
import com.flagship.practice_ledger.resolver.Resolution;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Projects invoice lifecycle hooks into journal entries.
 *
 * Each invoice owns at most one approval entry, found by ("invoice", invoiceId). Re-approving
 * or editing rewrites that entry's lines in place instead of adding another one. Payments get
 * their own entry per payment id.
 *
 * Every hook holds an advisory lock on its source document for the whole transaction, so two
 * concurrent approvals of one invoice run one after the other and the second one finds the
 * first one's entry.
 */
@Service
@Slf4j
public class InvoicePostingProjector {

    public static final String INVOICE_SOURCE = "invoice";
    public static final String PAYMENT_SOURCE = "payment";
    public static final String APPROVAL_ENTRY_TYPE = "INVAP";
    public static final String PAYMENT_ENTRY_TYPE = "PMT";
    public static final String DRAFT_PREFIX = "[DRAFT] ";

    private final JournalEntryEngine engine;
    private final AccountResolver resolver;
    private final AccountRepository accountRepository;
    private final PostingLocks postingLocks;
    private final LedgerMetrics ledgerMetrics;
    private final BigDecimal epsilon;

    public InvoicePostingProjector(JournalEntryEngine engine,
                                   AccountResolver resolver,
                                   AccountRepository accountRepository,
                                   PostingLocks postingLocks,
                                   LedgerMetrics ledgerMetrics,
                                   @Value("${ledger.balance.epsilon:0.0001}") BigDecimal epsilon) {
        this.engine = engine;
        this.resolver = resolver;
        this.accountRepository = accountRepository;
        this.postingLocks = postingLocks;
        this.ledgerMetrics = ledgerMetrics;
        this.epsilon = epsilon;
    }

    /**
     * Posts (or re-posts) the approval entry of an invoice.
     *
     * @param selectedIncomeAccountId income account picked by the user, or null for the default
     * @throws IllegalStateException   if the invoice cannot move to APPROVED from its current status
     * @throws MissingAccountException listing every account that could not be resolved
     */
    @Transactional
    public JournalEntry onInvoiceApproved(Invoice invoice, UUID selectedIncomeAccountId) {
        long tenantId = invoice.getTenantId();
        if (invoice.getStatus() != InvoiceStatus.APPROVED && !invoice.getStatus().canTransitionTo(InvoiceStatus.APPROVED)) {
            ledgerMetrics.recordInvoiceApproval("rejected");
            throw new IllegalStateException(String.format("Cannot approve invoice %s from status %s",
                invoice.getInvoiceNumber(), invoice.getStatus()));
        }

        try (CorrelationContext.Scope ignored = CorrelationContext.tenantScope(tenantId)) {
            postingLocks.lockSourceDocument(tenantId, INVOICE_SOURCE, invoice.getId());

            Resolution income = resolver.tryResolve(tenantId,
                AccountRequest.income(selectedIncomeAccountId, invoice.getDefaultIncomeAccountId()));
            ApprovalAccounts accounts = resolveApprovalAccounts(invoice, income);
            List<LineRequest> lines = approvalLines(invoice, accounts);

            Optional<JournalEntry> existing = engine.findBySourceDocument(tenantId, INVOICE_SOURCE, invoice.getId());
            JournalEntry entry;
            if (existing.isPresent()) {
                entry = engine.replaceLines(tenantId, existing.get().getId(),
                    HeaderUpdate.builder()
                        .description(approvalDescription(invoice))
                        .entryDate(invoice.getIssueDate())
                        .reference(invoiceReference(invoice))
                        .posted(true)
                        .userId(invoice.getUserId())
                        .build(),
                    lines);
                ledgerMetrics.recordInvoiceApproval("reposted");
            } else {
                entry = engine.createEntry(tenantId,
                    EntryHeader.builder()
                        .entryDate(invoice.getIssueDate())
                        .reference(invoiceReference(invoice))
                        .entryType(APPROVAL_ENTRY_TYPE)
                        .description(approvalDescription(invoice))
                        .posted(true)
                        .sourceDocument(INVOICE_SOURCE)
                        .sourceDocumentId(invoice.getId())
                        .userId(invoice.getUserId())
                        .build(),
                    lines);
                ledgerMetrics.recordInvoiceApproval("posted");
            }

            log.info("Invoice approval projected: invoiceId={}, number={}, entryId={}, total={}, reused={}",
                invoice.getId(), invoice.getInvoiceNumber(), entry.getId(), entry.getTotalAmount(), existing.isPresent());
            return entry;
        }
    }

    /**
     * Rewrites the approval entry after an edit that changed amounts, as long as the
     * invoice still has a posted entry.
     *
     * @return the updated entry, or empty if nothing had to change
     */
    @Transactional
    public Optional<JournalEntry> onInvoiceEdited(Invoice invoice, Set<InvoiceField> changedFields) {
        long tenantId = invoice.getTenantId();
        if (changedFields.stream().noneMatch(InvoiceField::affectsPosting)) {
            return Optional.empty();
        }

        try (CorrelationContext.Scope ignored = CorrelationContext.tenantScope(tenantId)) {
            postingLocks.lockSourceDocument(tenantId, INVOICE_SOURCE, invoice.getId());

            Optional<JournalEntry> existing = engine.findBySourceDocument(tenantId, INVOICE_SOURCE, invoice.getId())
                .filter(JournalEntry::isPosted);
            if (existing.isEmpty()) {
                log.debug("Invoice edit has no posted entry to update: invoiceId={}", invoice.getId());
                return Optional.empty();
            }

            JournalEntry entry = existing.get();
            Resolution income = incomeForEdit(invoice, entry);
            ApprovalAccounts accounts = resolveApprovalAccounts(invoice, income);
            List<LineRequest> lines = approvalLines(invoice, accounts);

            JournalEntry updated = engine.replaceLines(tenantId, entry.getId(),
                HeaderUpdate.builder().userId(invoice.getUserId()).build(), lines);

            log.info("Invoice edit projected: invoiceId={}, entryId={}, changed={}, previousTotal={}, total={}",
                invoice.getId(), entry.getId(), changedFields, entry.getTotalAmount(), updated.getTotalAmount());
            return Optional.of(updated);
        }
    }

    /**
     * Marks the invoice's entry as belonging to a draft invoice. Lines, balances and the
     * posted flag are left alone; re-approval rewrites the description.
     *
     * @return the annotated entry, or empty if the invoice was never posted
     */
    @Transactional
    public Optional<JournalEntry> onInvoiceRevertedToDraft(Invoice invoice) {
        long tenantId = invoice.getTenantId();
        try (CorrelationContext.Scope ignored = CorrelationContext.tenantScope(tenantId)) {
            postingLocks.lockSourceDocument(tenantId, INVOICE_SOURCE, invoice.getId());

            Optional<JournalEntry> existing = engine.findBySourceDocument(tenantId, INVOICE_SOURCE, invoice.getId());
            if (existing.isEmpty()) {
                return Optional.empty();
            }

            JournalEntry entry = existing.get();
            String description = entry.getDescription() != null ? entry.getDescription() : "";
            if (description.startsWith(DRAFT_PREFIX)) {
                return Optional.of(entry);
            }

            JournalEntry annotated = engine.updateHeader(tenantId, entry.getId(),
                HeaderUpdate.builder().description(DRAFT_PREFIX + description).userId(invoice.getUserId()).build());
            log.info("Invoice reverted to draft, entry annotated: invoiceId={}, entryId={}", invoice.getId(), entry.getId());
            return Optional.of(annotated);
        }
    }

    /**
     * Posts a payment: Dr cash or bank, Cr the entity's receivable. Recording the same
     * payment again returns the entry from the first time.
     */
    @Transactional
    public JournalEntry onPaymentRecorded(Invoice invoice, InvoicePayment payment) {
        long tenantId = invoice.getTenantId();
        if (payment.getAmount() == null || payment.getAmount().signum() <= 0) {
            throw new IllegalArgumentException("Payment amount must be positive");
        }
        if (payment.getMethod() == null) {
            throw new IllegalArgumentException("Payment method is required");
        }

        try (CorrelationContext.Scope ignored = CorrelationContext.tenantScope(tenantId)) {
            postingLocks.lockSourceDocument(tenantId, PAYMENT_SOURCE, payment.getId());

            Optional<JournalEntry> existing = engine.findBySourceDocument(tenantId, PAYMENT_SOURCE, payment.getId());
            if (existing.isPresent()) {
                log.info("Payment already posted: paymentId={}, entryId={}", payment.getId(), existing.get().getId());
                return existing.get();
            }

            List<Resolution> resolutions = List.of(
                resolver.tryResolve(tenantId, payment.getMethod().cashAccountRequest()),
                resolver.tryResolve(tenantId, AccountRequest.receivable(invoice.getEntityId(), invoice.getEntityName()))
            );
            failOnGaps(invoice, resolutions);

            List<LineRequest> lines = InvoicePostingLines.forPayment(invoice, payment,
                resolutions.get(0).getAccount().getId(), resolutions.get(1).getAccount().getId());

            JournalEntry entry = engine.createEntry(tenantId,
                EntryHeader.builder()
                    .entryDate(payment.getPaymentDate() != null ? payment.getPaymentDate() : invoice.getIssueDate())
                    .reference("PMT-" + payment.getId())
                    .entryType(PAYMENT_ENTRY_TYPE)
                    .description(String.format("Payment received for Invoice %s%s", invoice.getInvoiceNumber(),
                        payment.getReference() != null ? " (" + payment.getReference() + ")" : ""))
                    .posted(true)
                    .sourceDocument(PAYMENT_SOURCE)
                    .sourceDocumentId(payment.getId())
                    .userId(invoice.getUserId())
                    .build(),
                lines);

            log.info("Payment projected: invoiceId={}, paymentId={}, method={}, amount={}, entryId={}",
                invoice.getId(), payment.getId(), payment.getMethod(), payment.getAmount(), entry.getId());
            return entry;
        }
    }

    // ==================== Helpers ====================

    private record ApprovalAccounts(Account receivable, Account income, Account tax, Account discount) {
    }

    /**
     * Resolves every account the approval needs and fails with all gaps at once.
     */
    private ApprovalAccounts resolveApprovalAccounts(Invoice invoice, Resolution income) {
        long tenantId = invoice.getTenantId();
        Resolution receivable = resolver.tryResolve(tenantId,
            AccountRequest.receivable(invoice.getEntityId(), invoice.getEntityName()));
        Resolution tax = invoice.hasTax() ? resolver.tryResolve(tenantId, AccountRequest.taxPayable()) : null;
        Resolution discount = invoice.hasDiscount() ? resolver.tryResolve(tenantId, AccountRequest.discountAllowed()) : null;

        List<Resolution> all = new ArrayList<>(List.of(receivable, income));
        if (tax != null) {
            all.add(tax);
        }
        if (discount != null) {
            all.add(discount);
        }
        failOnGaps(invoice, all);

        return new ApprovalAccounts(receivable.getAccount(), income.getAccount(),
            tax != null ? tax.getAccount() : null,
            discount != null ? discount.getAccount() : null);
    }

    private void failOnGaps(Invoice invoice, List<Resolution> resolutions) {
        List<MissingAccount> gaps = resolutions.stream()
            .filter(resolution -> !resolution.isResolved())
            .map(Resolution::getMissing)
            .toList();
        if (!gaps.isEmpty()) {
            ledgerMetrics.recordInvoiceApproval("missing_accounts");
            log.warn("Invoice posting blocked by missing accounts: invoiceId={}, gaps={}", invoice.getId(), gaps.size());
            throw new MissingAccountException(gaps);
        }
    }

    private List<LineRequest> approvalLines(Invoice invoice, ApprovalAccounts accounts) {
        List<LineRequest> lines = InvoicePostingLines.forApproval(invoice,
            accounts.receivable().getId(),
            accounts.income().getId(),
            accounts.tax() != null ? accounts.tax().getId() : null,
            accounts.discount() != null ? accounts.discount().getId() : null);
        try {
            JournalLines.validate(lines, epsilon);
        } catch (UnbalancedEntryException e) {
            log.error("Computed invoice lines do not balance: invoiceId={}, debits={}, credits={}",
                invoice.getId(), e.getTotalDebit(), e.getTotalCredit());
            throw new IllegalStateException("Invoice " + invoice.getInvoiceNumber()
                + " amounts are inconsistent: subtotal + tax - discount must equal total", e);
        }
        return lines;
    }

    /**
     * Income account for an edit: the invoice default if valid, else the revenue account
     * already credited by the entry, else the usual income fallback.
     */
    private Resolution incomeForEdit(Invoice invoice, JournalEntry entry) {
        long tenantId = invoice.getTenantId();
        Optional<Account> fromDefault = Optional.ofNullable(invoice.getDefaultIncomeAccountId())
            .flatMap(id -> accountRepository.findById(tenantId, id))
            .filter(account -> account.getAccountType() == AccountType.REVENUE);
        if (fromDefault.isPresent()) {
            return Resolution.found(AccountRole.INCOME, fromDefault.get());
        }

        for (JournalEntryLine line : engine.getLines(tenantId, entry.getId())) {
            if (!line.isCredit()) {
                continue;
            }
            Optional<Account> account = accountRepository.findById(tenantId, line.getAccountId())
                .filter(candidate -> candidate.getAccountType() == AccountType.REVENUE);
            if (account.isPresent()) {
                return Resolution.found(AccountRole.INCOME, account.get());
            }
        }
        return resolver.tryResolve(tenantId, AccountRequest.income(null, null));
    }

    static String invoiceReference(Invoice invoice) {
        return "INV-" + invoice.getInvoiceNumber();
    }

    static String approvalDescription(Invoice invoice) {
        return "Invoice " + invoice.getInvoiceNumber() + " approved";
    }
}
