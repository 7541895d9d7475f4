package com.flagship.practice_ledger.hierarchy;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC access to the {@code accounts} table. Every query is tenant scoped.
 */
@Repository
public class AccountRepository {

    private static final String COLUMNS =
            "id, tenant_id, detailed_group_id, account_code, account_name, account_type, description, " +
            "linked_entity_id, is_system_account, is_active, opening_balance, current_balance, created_at, updated_at";

    private final JdbcTemplate jdbcTemplate;

    public AccountRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void insert(Account account) {
        jdbcTemplate.update(
            "INSERT INTO accounts (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
            account.getId(),
            account.getTenantId(),
            account.getDetailedGroupId(),
            account.getAccountCode(),
            account.getAccountName(),
            account.getAccountType().name(),
            account.getDescription(),
            account.getLinkedEntityId(),
            account.isSystemAccount(),
            account.isActive(),
            account.getOpeningBalance(),
            account.getCurrentBalance(),
            Timestamp.from(account.getCreatedAt()),
            Timestamp.from(account.getUpdatedAt())
        );
    }

    public Optional<Account> findById(long tenantId, UUID id) {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM accounts WHERE tenant_id = ? AND id = ?",
            rowMapper(),
            tenantId, id
        ).stream().findFirst();
    }

    public Optional<Account> findByCode(long tenantId, String accountCode) {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM accounts WHERE tenant_id = ? AND account_code = ?",
            rowMapper(),
            tenantId, accountCode
        ).stream().findFirst();
    }

    public List<Account> findByType(long tenantId, AccountType accountType) {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM accounts WHERE tenant_id = ? AND account_type = ? ORDER BY account_code",
            rowMapper(),
            tenantId, accountType.name()
        );
    }

    /**
     * Accounts auto-provisioned for an entity, oldest first.
     */
    public List<Account> findByLinkedEntity(long tenantId, long entityId) {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM accounts WHERE tenant_id = ? AND linked_entity_id = ? ORDER BY created_at",
            rowMapper(),
            tenantId, entityId
        );
    }

    public List<Account> findByNameIgnoreCase(long tenantId, String accountName) {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM accounts WHERE tenant_id = ? AND LOWER(account_name) = LOWER(?) ORDER BY created_at",
            rowMapper(),
            tenantId, accountName
        );
    }

    public List<Account> findByFilter(long tenantId, AccountFilter filter) {
        StringBuilder sql = new StringBuilder("SELECT " + COLUMNS + " FROM accounts WHERE tenant_id = ?");
        List<Object> args = new ArrayList<>();
        args.add(tenantId);
        if (filter.getAccountType() != null) {
            sql.append(" AND account_type = ?");
            args.add(filter.getAccountType().name());
        }
        if (filter.getDetailedGroupId() != null) {
            sql.append(" AND detailed_group_id = ?");
            args.add(filter.getDetailedGroupId());
        }
        if (!filter.isIncludeSystemAccounts()) {
            sql.append(" AND is_system_account = FALSE");
        }
        if (filter.isActiveOnly()) {
            sql.append(" AND is_active = TRUE");
        }
        sql.append(" ORDER BY account_code");
        return jdbcTemplate.query(sql.toString(), rowMapper(), args.toArray());
    }

    public int countByDetailedGroup(long tenantId, UUID detailedGroupId) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM accounts WHERE tenant_id = ? AND detailed_group_id = ?",
            Integer.class,
            tenantId, detailedGroupId
        );
        return count != null ? count : 0;
    }

    public boolean existsByCode(long tenantId, String accountCode) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM accounts WHERE tenant_id = ? AND account_code = ?",
            Integer.class,
            tenantId, accountCode
        );
        return count != null && count > 0;
    }

    public int countJournalLines(long tenantId, UUID accountId) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM journal_entry_lines WHERE tenant_id = ? AND account_id = ?",
            Integer.class,
            tenantId, accountId
        );
        return count != null ? count : 0;
    }

    /**
     * Locks the given account rows for the rest of the transaction, in id order so that
     * concurrent postings touching overlapping accounts cannot deadlock.
     *
     * @return the ids that exist in the tenant and are now locked
     */
    public List<UUID> lockForUpdate(long tenantId, Collection<UUID> accountIds) {
        if (accountIds.isEmpty()) {
            return List.of();
        }
        String placeholders = String.join(", ", Collections.nCopies(accountIds.size(), "?"));
        List<Object> args = new ArrayList<>();
        args.add(tenantId);
        args.addAll(accountIds.stream().sorted().toList());
        return jdbcTemplate.queryForList(
            "SELECT id FROM accounts WHERE tenant_id = ? AND id IN (" + placeholders + ") ORDER BY id FOR UPDATE",
            UUID.class,
            args.toArray()
        );
    }

    /**
     * Recomputes the cached balance from the opening balance and every journal line
     * against the account, applying the sign convention of the account type.
     */
    public BigDecimal recomputeBalance(long tenantId, UUID accountId) {
        jdbcTemplate.update(
            "UPDATE accounts a SET current_balance = a.opening_balance + COALESCE((" +
            "  SELECT SUM(CASE WHEN a.account_type IN ('ASSET', 'EXPENSE') " +
            "                  THEN l.debit_amount - l.credit_amount " +
            "                  ELSE l.credit_amount - l.debit_amount END) " +
            "  FROM journal_entry_lines l WHERE l.account_id = a.id), 0), " +
            "updated_at = CURRENT_TIMESTAMP " +
            "WHERE a.tenant_id = ? AND a.id = ?",
            tenantId, accountId
        );
        return jdbcTemplate.queryForObject(
            "SELECT current_balance FROM accounts WHERE tenant_id = ? AND id = ?",
            BigDecimal.class,
            tenantId, accountId
        );
    }

    public int updateName(long tenantId, UUID id, String accountName) {
        return jdbcTemplate.update(
            "UPDATE accounts SET account_name = ?, updated_at = CURRENT_TIMESTAMP WHERE tenant_id = ? AND id = ?",
            accountName, tenantId, id
        );
    }

    public int updateActive(long tenantId, UUID id, boolean active) {
        return jdbcTemplate.update(
            "UPDATE accounts SET is_active = ?, updated_at = CURRENT_TIMESTAMP WHERE tenant_id = ? AND id = ?",
            active, tenantId, id
        );
    }

    public int delete(long tenantId, UUID id) {
        return jdbcTemplate.update(
            "DELETE FROM accounts WHERE tenant_id = ? AND id = ?",
            tenantId, id
        );
    }

    private RowMapper<Account> rowMapper() {
        return (rs, rowNum) -> Account.builder()
            .id(rs.getObject("id", UUID.class))
            .tenantId(rs.getLong("tenant_id"))
            .detailedGroupId(rs.getObject("detailed_group_id", UUID.class))
            .accountCode(rs.getString("account_code"))
            .accountName(rs.getString("account_name"))
            .accountType(AccountType.valueOf(rs.getString("account_type")))
            .description(rs.getString("description"))
            .linkedEntityId(rs.getObject("linked_entity_id", Long.class))
            .systemAccount(rs.getBoolean("is_system_account"))
            .active(rs.getBoolean("is_active"))
            .openingBalance(rs.getBigDecimal("opening_balance"))
            .currentBalance(rs.getBigDecimal("current_balance"))
            .createdAt(rs.getTimestamp("created_at").toInstant())
            .updatedAt(rs.getTimestamp("updated_at").toInstant())
            .build();
    }
}
