package com.flagship.practice_ledger.chartimport;

import com.flagship.practice_ledger.exception.LedgerException;
import com.flagship.practice_ledger.hierarchy.Account;
import com.flagship.practice_ledger.hierarchy.AccountGroup;
import com.flagship.practice_ledger.hierarchy.AccountHierarchyService;
import com.flagship.practice_ledger.hierarchy.ChartOfAccountsTree;
import com.flagship.practice_ledger.hierarchy.GroupKind;
import com.flagship.practice_ledger.hierarchy.GroupLevel;
import com.flagship.practice_ledger.observability.CorrelationContext;
import com.flagship.practice_ledger.observability.LedgerMetrics;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Bulk import of accounts from spreadsheet rows.
 *
 * Each row commits or rolls back on its own, so a bad row is reported and the rest of the
 * batch still goes in. Groups created by an earlier row are visible to later rows.
 */
@Service
@Slf4j
public class ChartOfAccountsImportService {

    private final AccountHierarchyService hierarchyService;
    private final LedgerMetrics ledgerMetrics;
    private final Validator validator;
    private final TransactionTemplate rowTransaction;

    public ChartOfAccountsImportService(AccountHierarchyService hierarchyService,
                                        LedgerMetrics ledgerMetrics,
                                        Validator validator,
                                        PlatformTransactionManager transactionManager) {
        this.hierarchyService = hierarchyService;
        this.ledgerMetrics = ledgerMetrics;
        this.validator = validator;
        this.rowTransaction = new TransactionTemplate(transactionManager);
        this.rowTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    public ChartImportReport importAccounts(long tenantId, List<ChartImportRow> rows) {
        if (rows == null) {
            throw new IllegalArgumentException("Import rows are required");
        }

        List<ChartImportRowResult> results = new ArrayList<>(rows.size());
        try (CorrelationContext.Scope ignored = CorrelationContext.tenantScope(tenantId)) {
            for (int i = 0; i < rows.size(); i++) {
                results.add(importRow(tenantId, i + 1, rows.get(i)));
            }
        }

        ChartImportReport report = new ChartImportReport(List.copyOf(results));
        log.info("Chart import finished: tenantId={}, rows={}, succeeded={}, failed={}",
            tenantId, rows.size(), report.successCount(), report.failureCount());
        return report;
    }

    private ChartImportRowResult importRow(long tenantId, int rowNumber, ChartImportRow row) {
        if (row == null) {
            ledgerMetrics.recordImportRow(false);
            return ChartImportRowResult.failure(rowNumber, "Row is empty");
        }

        Set<ConstraintViolation<ChartImportRow>> violations = validator.validate(row);
        if (!violations.isEmpty()) {
            String message = violations.stream()
                .sorted(Comparator.comparing(violation -> violation.getPropertyPath().toString()))
                .map(ConstraintViolation::getMessage)
                .collect(Collectors.joining("; "));
            log.warn("Import row rejected: tenantId={}, row={}, reason={}", tenantId, rowNumber, message);
            ledgerMetrics.recordImportRow(false);
            return ChartImportRowResult.failure(rowNumber, message);
        }

        try {
            ChartImportRowResult result = rowTransaction.execute(status -> applyRow(tenantId, rowNumber, row));
            ledgerMetrics.recordImportRow(true);
            return result;
        } catch (LedgerException | IllegalArgumentException e) {
            log.warn("Import row failed: tenantId={}, row={}, reason={}", tenantId, rowNumber, e.getMessage());
            ledgerMetrics.recordImportRow(false);
            return ChartImportRowResult.failure(rowNumber, e.getMessage());
        } catch (DataAccessException e) {
            log.error("Import row failed on database error: tenantId={}, row={}", tenantId, rowNumber, e);
            ledgerMetrics.recordImportRow(false);
            return ChartImportRowResult.failure(rowNumber, "Database error: " + e.getMostSpecificCause().getMessage());
        } catch (RuntimeException e) {
            log.error("Import row failed unexpectedly: tenantId={}, row={}", tenantId, rowNumber, e);
            ledgerMetrics.recordImportRow(false);
            return ChartImportRowResult.failure(rowNumber, "Unexpected error: " + e.getMessage());
        }
    }

    private ChartImportRowResult applyRow(long tenantId, int rowNumber, ChartImportRow row) {
        List<UUID> created = new ArrayList<>();

        GroupKind mainKind = GroupKind.fromName(GroupLevel.MAIN_GROUP, row.getMainGroupName())
            .orElseThrow(() -> new IllegalArgumentException("Unknown main group: " + row.getMainGroupName()));
        GroupKind elementKind = GroupKind.fromName(GroupLevel.ELEMENT_GROUP, row.getElementGroupName())
            .orElseThrow(() -> new IllegalArgumentException("Unknown element group: " + row.getElementGroupName()));

        AccountGroup main = ensureGroup(tenantId, GroupLevel.MAIN_GROUP, null, mainKind, null, created);
        AccountGroup element = ensureGroup(tenantId, GroupLevel.ELEMENT_GROUP, main.getId(), elementKind, null, created);
        AccountGroup subElement = ensureNamedGroup(tenantId, GroupLevel.SUB_ELEMENT_GROUP, element.getId(),
            row.getSubElementGroupName(), created);
        AccountGroup detailed = ensureNamedGroup(tenantId, GroupLevel.DETAILED_GROUP, subElement.getId(),
            row.getDetailedGroupName(), created);

        BigDecimal opening = row.getOpeningBalance() != null ? row.getOpeningBalance() : BigDecimal.ZERO;
        Account account = hierarchyService.createAccount(tenantId, detailed.getId(), row.getAccountName().trim(),
            row.getDescription(), opening);

        log.debug("Import row applied: tenantId={}, row={}, accountCode={}, groupsCreated={}",
            tenantId, rowNumber, account.getAccountCode(), created.size());
        return ChartImportRowResult.success(rowNumber, account.getId(), account.getAccountCode(), created);
    }

    /**
     * Sub-element and detailed names: a predefined kind of the level, else an existing
     * custom group with that name, else a new custom group.
     */
    private AccountGroup ensureNamedGroup(long tenantId, GroupLevel level, UUID parentId, String name,
                                          List<UUID> created) {
        Optional<GroupKind> kind = GroupKind.fromName(level, name);
        if (kind.isPresent()) {
            return ensureGroup(tenantId, level, parentId, kind.get(), null, created);
        }
        return ensureGroup(tenantId, level, parentId, GroupKind.CUSTOM, name.trim(), created);
    }

    private AccountGroup ensureGroup(long tenantId, GroupLevel level, UUID parentId, GroupKind kind,
                                     String customName, List<UUID> created) {
        ChartOfAccountsTree tree = hierarchyService.loadTree(tenantId);
        Optional<AccountGroup> existing = tree.findChild(parentId, kind, customName);
        if (existing.isPresent()) {
            return existing.get();
        }
        AccountGroup group = hierarchyService.createGroup(tenantId, level, parentId, kind, customName,
            "Created by chart import");
        created.add(group.getId());
        return group;
    }
}
