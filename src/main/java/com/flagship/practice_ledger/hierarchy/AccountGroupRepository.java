package com.flagship.practice_ledger.hierarchy;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC access to the {@code account_groups} table. Every query is tenant scoped.
 */
@Repository
public class AccountGroupRepository {

    private static final String COLUMNS =
            "id, tenant_id, parent_id, level, kind, custom_name, code, description, created_at";

    private final JdbcTemplate jdbcTemplate;

    public AccountGroupRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void insert(AccountGroup group) {
        jdbcTemplate.update(
            "INSERT INTO account_groups (id, tenant_id, parent_id, level, kind, custom_name, code, description, created_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)",
            group.getId(),
            group.getTenantId(),
            group.getParentId(),
            group.getLevel().name(),
            group.getKind().name(),
            group.getCustomName(),
            group.getCode(),
            group.getDescription(),
            Timestamp.from(group.getCreatedAt())
        );
    }

    public Optional<AccountGroup> findById(long tenantId, UUID id) {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM account_groups WHERE tenant_id = ? AND id = ?",
            rowMapper(),
            tenantId, id
        ).stream().findFirst();
    }

    public List<AccountGroup> findChildren(long tenantId, UUID parentId) {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM account_groups WHERE tenant_id = ? AND parent_id = ? ORDER BY sequence_number",
            rowMapper(),
            tenantId, parentId
        );
    }

    public List<AccountGroup> findByLevel(long tenantId, GroupLevel level) {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM account_groups WHERE tenant_id = ? AND level = ? ORDER BY sequence_number",
            rowMapper(),
            tenantId, level.name()
        );
    }

    /**
     * Loads the whole group tree of a tenant, ordered by creation.
     */
    public List<AccountGroup> findAllByTenant(long tenantId) {
        return jdbcTemplate.query(
            "SELECT " + COLUMNS + " FROM account_groups WHERE tenant_id = ? ORDER BY sequence_number",
            rowMapper(),
            tenantId
        );
    }

    public boolean existsByCode(long tenantId, String code) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM account_groups WHERE tenant_id = ? AND code = ?",
            Integer.class,
            tenantId, code
        );
        return count != null && count > 0;
    }

    public int countChildren(long tenantId, UUID parentId) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM account_groups WHERE tenant_id = ? AND parent_id = ?",
            Integer.class,
            tenantId, parentId
        );
        return count != null ? count : 0;
    }

    public int delete(long tenantId, UUID id) {
        return jdbcTemplate.update(
            "DELETE FROM account_groups WHERE tenant_id = ? AND id = ?",
            tenantId, id
        );
    }

    private RowMapper<AccountGroup> rowMapper() {
        return (rs, rowNum) -> new AccountGroup(
            rs.getObject("id", UUID.class),
            rs.getLong("tenant_id"),
            rs.getObject("parent_id", UUID.class),
            GroupLevel.valueOf(rs.getString("level")),
            GroupKind.valueOf(rs.getString("kind")),
            rs.getString("custom_name"),
            rs.getString("code"),
            rs.getString("description"),
            rs.getTimestamp("created_at").toInstant()
        );
    }
}
