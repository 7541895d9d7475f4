package com.flagship.practice_ledger.query;

import com.flagship.practice_ledger.hierarchy.Account;
import com.flagship.practice_ledger.hierarchy.AccountFilter;
import com.flagship.practice_ledger.hierarchy.AccountHierarchyService;
import com.flagship.practice_ledger.hierarchy.AccountRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Read side of the ledger: paginated account ledgers with running balances and
 * filtered account listings.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerQueryService {

    public static final int MAX_PAGE_SIZE = 500;

    // Window runs over all lines of the account before LIMIT/OFFSET apply, so later pages
    // carry the balance of earlier ones.
    private static final String LEDGER_SQL =
        "SELECT l.journal_entry_id, e.entry_date, e.reference, " +
        "       COALESCE(l.description, e.description) AS description, " +
        "       l.debit_amount, l.credit_amount, " +
        "       SUM((l.debit_amount - l.credit_amount) * ?) OVER (" +
        "           ORDER BY e.entry_date, e.sequence_number, l.line_order " +
        "           ROWS BETWEEN UNBOUNDED PRECEDING AND CURRENT ROW) AS movement " +
        "FROM journal_entry_lines l " +
        "JOIN journal_entries e ON e.id = l.journal_entry_id " +
        "WHERE l.tenant_id = ? AND l.account_id = ? " +
        "ORDER BY e.entry_date, e.sequence_number, l.line_order " +
        "LIMIT ? OFFSET ?";

    private final JdbcTemplate jdbcTemplate;
    private final AccountHierarchyService hierarchyService;
    private final AccountRepository accountRepository;

    /**
     * Returns one page of the account's ledger, oldest first.
     *
     * @param page     zero-based page index
     * @param pageSize rows per page, 1 to {@value #MAX_PAGE_SIZE}
     */
    @Transactional(readOnly = true)
    public LedgerPage getLedger(long tenantId, UUID accountId, int page, int pageSize) {
        if (page < 0) {
            throw new IllegalArgumentException("Page must not be negative");
        }
        if (pageSize < 1 || pageSize > MAX_PAGE_SIZE) {
            throw new IllegalArgumentException("Page size must be between 1 and " + MAX_PAGE_SIZE);
        }

        Account account = hierarchyService.getAccount(tenantId, accountId);
        BigDecimal opening = account.getOpeningBalance();
        int sign = account.getAccountType().isDebitNormal() ? 1 : -1;

        Long total = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM journal_entry_lines WHERE tenant_id = ? AND account_id = ?",
            Long.class, tenantId, accountId);
        long totalRows = total != null ? total : 0L;

        List<LedgerRow> rows = jdbcTemplate.query(LEDGER_SQL,
            (rs, rowNum) -> new LedgerRow(
                rs.getObject("journal_entry_id", UUID.class),
                rs.getObject("entry_date", LocalDate.class),
                rs.getString("reference"),
                rs.getString("description"),
                rs.getBigDecimal("debit_amount"),
                rs.getBigDecimal("credit_amount"),
                opening.add(rs.getBigDecimal("movement"))
            ),
            sign, tenantId, accountId, pageSize, (long) page * pageSize);

        BigDecimal runningBalance = rows.isEmpty()
            ? balanceBefore(tenantId, accountId, opening, sign, (long) page * pageSize)
            : rows.get(rows.size() - 1).getRunningBalance();

        log.debug("Ledger page read: tenantId={}, accountId={}, page={}, rows={}, totalRows={}",
            tenantId, accountId, page, rows.size(), totalRows);

        return LedgerPage.builder()
            .account(account)
            .openingBalance(opening)
            .rows(rows)
            .runningBalance(runningBalance)
            .page(page)
            .pageSize(pageSize)
            .totalRows(totalRows)
            .build();
    }

    @Transactional(readOnly = true)
    public List<Account> listAccounts(long tenantId, AccountFilter filter) {
        return accountRepository.findByFilter(tenantId, filter != null ? filter : AccountFilter.all());
    }

    /**
     * Balance after the first {@code rowCount} lines, for pages past the end.
     */
    private BigDecimal balanceBefore(long tenantId, UUID accountId, BigDecimal opening, int sign, long rowCount) {
        BigDecimal movement = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM((x.debit_amount - x.credit_amount) * ?), 0) FROM (" +
            "  SELECT l.debit_amount, l.credit_amount FROM journal_entry_lines l " +
            "  JOIN journal_entries e ON e.id = l.journal_entry_id " +
            "  WHERE l.tenant_id = ? AND l.account_id = ? " +
            "  ORDER BY e.entry_date, e.sequence_number, l.line_order LIMIT ?) x",
            BigDecimal.class, sign, tenantId, accountId, rowCount);
        return opening.add(movement != null ? movement : BigDecimal.ZERO);
    }
}
