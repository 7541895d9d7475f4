package com.flagship.practice_ledger.journal;

import com.flagship.practice_ledger.exception.ConstraintException;
import com.flagship.practice_ledger.exception.DuplicateCodeException;
import com.flagship.practice_ledger.exception.ResourceNotFoundException;
import com.flagship.practice_ledger.exception.UnbalancedEntryException;
import com.flagship.practice_ledger.hierarchy.AccountRepository;
import com.flagship.practice_ledger.journal.event.JournalEntryDeletedEvent;
import com.flagship.practice_ledger.journal.event.JournalEntryLinesReplacedEvent;
import com.flagship.practice_ledger.journal.event.JournalEntryPostedEvent;
import com.flagship.practice_ledger.journal.event.JournalEntryStatusChangedEvent;
import com.flagship.practice_ledger.observability.CorrelationContext;
import com.flagship.practice_ledger.observability.LedgerMetrics;
import com.flagship.practice_ledger.outbox.OutboxService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Writes journal entries and keeps account balances consistent with them.
 *
 * This service enforces the core invariants:
 * 1. Debits equal credits (within the configured epsilon) on every write
 * 2. Header, lines and balance updates of one operation commit or roll back together
 * 3. The cached balance of every touched account is recomputed from its lines
 *
 * Account rows are locked in id order before any line is written, so concurrent
 * postings against overlapping accounts queue instead of deadlocking.
 */
@Service
@Slf4j
public class JournalEntryEngine {

    private final JournalEntryRepository entryRepository;
    private final AccountRepository accountRepository;
    private final OutboxService outboxService;
    private final LedgerMetrics ledgerMetrics;
    private final BigDecimal epsilon;

    public JournalEntryEngine(JournalEntryRepository entryRepository,
                              AccountRepository accountRepository,
                              OutboxService outboxService,
                              LedgerMetrics ledgerMetrics,
                              @Value("${ledger.balance.epsilon:0.0001}") BigDecimal epsilon) {
        this.entryRepository = entryRepository;
        this.accountRepository = accountRepository;
        this.outboxService = outboxService;
        this.ledgerMetrics = ledgerMetrics;
        this.epsilon = epsilon;
    }

    /**
     * Creates an entry with its lines and updates the balances of every account it touches.
     *
     * @throws UnbalancedEntryException  if debits and credits differ
     * @throws ResourceNotFoundException if a line references an account outside the tenant
     * @throws DuplicateCodeException    if the source document already has an entry
     */
    @Transactional
    public JournalEntry createEntry(long tenantId, EntryHeader header, List<LineRequest> lines) {
        validateHeader(header);
        JournalLines.Validated validated = JournalLines.validate(lines, epsilon);

        try (CorrelationContext.Scope ignored = CorrelationContext.tenantScope(tenantId)) {
            return ledgerMetrics.timePosting(() -> {
                lockAccounts(tenantId, validated.accountIds());

                Instant now = Instant.now();
                JournalEntry entry = JournalEntry.builder()
                    .id(UUID.randomUUID())
                    .tenantId(tenantId)
                    .entryDate(header.getEntryDate())
                    .reference(header.getReference())
                    .entryType(header.getEntryType())
                    .description(header.getDescription())
                    .posted(header.isPosted())
                    .sourceDocument(header.getSourceDocument())
                    .sourceDocumentId(header.getSourceDocumentId())
                    .totalAmount(validated.totalDebit())
                    .createdBy(header.getUserId())
                    .updatedBy(header.getUserId())
                    .createdAt(now)
                    .updatedAt(now)
                    .build();

                try {
                    entryRepository.insertEntry(entry);
                } catch (DuplicateKeyException e) {
                    log.warn("Duplicate journal entry for source document: tenantId={}, source={}:{}",
                        tenantId, header.getSourceDocument(), header.getSourceDocumentId());
                    throw new DuplicateCodeException(String.format("A journal entry already exists for %s %s",
                        header.getSourceDocument(), header.getSourceDocumentId()), e);
                }
                entryRepository.insertLines(tenantId, entry.getId(), validated.lines());
                recomputeBalances(tenantId, validated.accountIds());

                outboxService.saveEvent(JournalEntryPostedEvent.fromEntry(entry, validated.lines().size()));
                ledgerMetrics.recordEntryWritten("created", entry.getEntryType());

                log.info("Journal entry created: entryId={}, type={}, reference={}, total={}, lines={}, posted={}",
                    entry.getId(), entry.getEntryType(), entry.getReference(), entry.getTotalAmount(),
                    validated.lines().size(), entry.isPosted());

                return reload(tenantId, entry.getId());
            });
        }
    }

    /**
     * Replaces all lines of an entry in place, optionally updating header fields, and
     * recomputes the balances of accounts on both the old and the new lines.
     */
    @Transactional
    public JournalEntry replaceLines(long tenantId, UUID entryId, HeaderUpdate update, List<LineRequest> lines) {
        JournalLines.Validated validated = JournalLines.validate(lines, epsilon);
        HeaderUpdate changes = update != null ? update : HeaderUpdate.none();

        try (CorrelationContext.Scope tenantScope = CorrelationContext.tenantScope(tenantId);
             CorrelationContext.Scope entryScope = CorrelationContext.entryScope(entryId)) {
            return ledgerMetrics.timePosting(() -> {
                JournalEntry before = entryRepository.findByIdForUpdate(tenantId, entryId)
                    .orElseThrow(() -> new ResourceNotFoundException("JournalEntry", entryId));

                Set<UUID> touched = new HashSet<>(validated.accountIds());
                entryRepository.findLines(tenantId, entryId)
                    .forEach(line -> touched.add(line.getAccountId()));
                lockAccounts(tenantId, touched, validated.accountIds());

                JournalEntry after = before.toBuilder()
                    .entryDate(changes.getEntryDate() != null ? changes.getEntryDate() : before.getEntryDate())
                    .reference(changes.getReference() != null ? changes.getReference() : before.getReference())
                    .description(changes.getDescription() != null ? changes.getDescription() : before.getDescription())
                    .posted(changes.getPosted() != null ? changes.getPosted() : before.isPosted())
                    .totalAmount(validated.totalDebit())
                    .updatedBy(changes.getUserId() != null ? changes.getUserId() : before.getUpdatedBy())
                    .updatedAt(Instant.now())
                    .build();

                entryRepository.deleteLines(tenantId, entryId);
                entryRepository.insertLines(tenantId, entryId, validated.lines());
                entryRepository.updateHeader(after);
                recomputeBalances(tenantId, touched);

                outboxService.saveEvent(JournalEntryLinesReplacedEvent.of(before, after, validated.lines().size()));
                ledgerMetrics.recordEntryWritten("replaced", after.getEntryType());

                log.info("Journal entry lines replaced: entryId={}, previousTotal={}, total={}, lines={}, accountsTouched={}",
                    entryId, before.getTotalAmount(), after.getTotalAmount(), validated.lines().size(), touched.size());

                return reload(tenantId, entryId);
            });
        }
    }

    /**
     * Marks an entry posted or draft. A status annotation only: balances already include
     * the entry's lines and are not changed here.
     *
     * @throws ConstraintException if asked to post an entry without lines
     */
    @Transactional
    public JournalEntry setPosted(long tenantId, UUID entryId, boolean posted) {
        try (CorrelationContext.Scope tenantScope = CorrelationContext.tenantScope(tenantId);
             CorrelationContext.Scope entryScope = CorrelationContext.entryScope(entryId)) {
            JournalEntry entry = entryRepository.findByIdForUpdate(tenantId, entryId)
                .orElseThrow(() -> new ResourceNotFoundException("JournalEntry", entryId));

            if (posted && entryRepository.countLines(tenantId, entryId) == 0) {
                log.warn("Posting rejected, entry has no lines: entryId={}", entryId);
                throw new ConstraintException("Journal entry " + entryId + " has no lines and cannot be posted");
            }
            if (entry.isPosted() == posted) {
                return entry;
            }

            JournalEntry updated = entry.toBuilder()
                .posted(posted)
                .updatedAt(Instant.now())
                .build();
            entryRepository.updateHeader(updated);

            outboxService.saveEvent(JournalEntryStatusChangedEvent.of(entry, posted));
            log.info("Journal entry status changed: entryId={}, posted={} -> {}", entryId, entry.isPosted(), posted);
            return reload(tenantId, entryId);
        }
    }

    /**
     * Changes descriptive header fields (date, reference, description) without touching
     * lines or balances. Use {@link #setPosted} for the posted flag.
     */
    @Transactional
    public JournalEntry updateHeader(long tenantId, UUID entryId, HeaderUpdate update) {
        if (update.getPosted() != null) {
            throw new IllegalArgumentException("Use setPosted to change the posted flag");
        }
        try (CorrelationContext.Scope tenantScope = CorrelationContext.tenantScope(tenantId);
             CorrelationContext.Scope entryScope = CorrelationContext.entryScope(entryId)) {
            JournalEntry entry = entryRepository.findByIdForUpdate(tenantId, entryId)
                .orElseThrow(() -> new ResourceNotFoundException("JournalEntry", entryId));

            JournalEntry updated = entry.toBuilder()
                .entryDate(update.getEntryDate() != null ? update.getEntryDate() : entry.getEntryDate())
                .reference(update.getReference() != null ? update.getReference() : entry.getReference())
                .description(update.getDescription() != null ? update.getDescription() : entry.getDescription())
                .updatedBy(update.getUserId() != null ? update.getUserId() : entry.getUpdatedBy())
                .updatedAt(Instant.now())
                .build();
            entryRepository.updateHeader(updated);

            log.info("Journal entry header updated: entryId={}, description='{}'", entryId, updated.getDescription());
            return reload(tenantId, entryId);
        }
    }

    /**
     * Deletes an entry and its lines, posted or not, and recomputes the affected balances.
     */
    @Transactional
    public void deleteEntry(long tenantId, UUID entryId) {
        try (CorrelationContext.Scope tenantScope = CorrelationContext.tenantScope(tenantId);
             CorrelationContext.Scope entryScope = CorrelationContext.entryScope(entryId)) {
            JournalEntry entry = entryRepository.findByIdForUpdate(tenantId, entryId)
                .orElseThrow(() -> new ResourceNotFoundException("JournalEntry", entryId));

            Set<UUID> touched = new HashSet<>();
            entryRepository.findLines(tenantId, entryId).forEach(line -> touched.add(line.getAccountId()));
            accountRepository.lockForUpdate(tenantId, touched);

            entryRepository.deleteEntry(tenantId, entryId);
            recomputeBalances(tenantId, touched);

            outboxService.saveEvent(JournalEntryDeletedEvent.of(entry, new ArrayList<>(touched)));
            ledgerMetrics.recordEntryWritten("deleted", entry.getEntryType());

            log.info("Journal entry deleted: entryId={}, reference={}, total={}, accountsTouched={}",
                entryId, entry.getReference(), entry.getTotalAmount(), touched.size());
        }
    }

    @Transactional(readOnly = true)
    public JournalEntry getEntry(long tenantId, UUID entryId) {
        return entryRepository.findById(tenantId, entryId)
            .orElseThrow(() -> new ResourceNotFoundException("JournalEntry", entryId));
    }

    @Transactional(readOnly = true)
    public List<JournalEntryLine> getLines(long tenantId, UUID entryId) {
        getEntry(tenantId, entryId);
        return entryRepository.findLines(tenantId, entryId);
    }

    @Transactional(readOnly = true)
    public Optional<JournalEntry> findBySourceDocument(long tenantId, String sourceDocument, long sourceDocumentId) {
        return entryRepository.findBySourceDocument(tenantId, sourceDocument, sourceDocumentId);
    }

    /**
     * Entries of a tenant, newest first. Both filters are optional.
     */
    @Transactional(readOnly = true)
    public List<JournalEntry> listEntries(long tenantId, String sourceDocument, Long sourceDocumentId) {
        return entryRepository.findEntries(tenantId, sourceDocument, sourceDocumentId);
    }

    // ==================== Helpers ====================

    private void validateHeader(EntryHeader header) {
        if (header == null || header.getEntryDate() == null) {
            throw new IllegalArgumentException("Entry date is required");
        }
        if (header.getEntryType() == null || header.getEntryType().isBlank()) {
            throw new IllegalArgumentException("Entry type is required");
        }
        if ((header.getSourceDocument() == null) != (header.getSourceDocumentId() == null)) {
            throw new IllegalArgumentException("Source document and source document id go together");
        }
    }

    private void lockAccounts(long tenantId, Set<UUID> accountIds) {
        lockAccounts(tenantId, accountIds, accountIds);
    }

    /**
     * Locks every touched account and checks that all accounts referenced by the new
     * lines exist in the tenant.
     */
    private void lockAccounts(long tenantId, Set<UUID> touched, Set<UUID> required) {
        Set<UUID> locked = new HashSet<>(accountRepository.lockForUpdate(tenantId, touched));
        for (UUID accountId : required) {
            if (!locked.contains(accountId)) {
                log.warn("Journal line references unknown account: tenantId={}, accountId={}", tenantId, accountId);
                throw new ResourceNotFoundException("Account", accountId);
            }
        }
    }

    private void recomputeBalances(long tenantId, Set<UUID> accountIds) {
        for (UUID accountId : accountIds) {
            BigDecimal balance = accountRepository.recomputeBalance(tenantId, accountId);
            log.debug("Balance recomputed: accountId={}, balance={}", accountId, balance);
        }
    }

    private JournalEntry reload(long tenantId, UUID entryId) {
        return entryRepository.findById(tenantId, entryId)
            .orElseThrow(() -> new IllegalStateException("Journal entry vanished within its transaction: " + entryId));
    }
}
