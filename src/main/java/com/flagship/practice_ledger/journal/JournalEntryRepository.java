package com.flagship.practice_ledger.journal;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Date;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC access to {@code journal_entries} and {@code journal_entry_lines}.
 */
@Repository
public class JournalEntryRepository {

    private static final String ENTRY_COLUMNS =
            "id, tenant_id, entry_date, reference, entry_type, description, is_posted, source_document, " +
            "source_document_id, total_amount, created_by, updated_by, created_at, updated_at, sequence_number";

    private static final String LINE_COLUMNS =
            "id, tenant_id, journal_entry_id, account_id, debit_amount, credit_amount, line_order, description";

    private final JdbcTemplate jdbcTemplate;

    public JournalEntryRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void insertEntry(JournalEntry entry) {
        jdbcTemplate.update(
            "INSERT INTO journal_entries (id, tenant_id, entry_date, reference, entry_type, description, is_posted, " +
            "source_document, source_document_id, total_amount, created_by, updated_by, created_at, updated_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)",
            entry.getId(),
            entry.getTenantId(),
            Date.valueOf(entry.getEntryDate()),
            entry.getReference(),
            entry.getEntryType(),
            entry.getDescription(),
            entry.isPosted(),
            entry.getSourceDocument(),
            entry.getSourceDocumentId(),
            entry.getTotalAmount(),
            entry.getCreatedBy(),
            entry.getUpdatedBy(),
            Timestamp.from(entry.getCreatedAt()),
            Timestamp.from(entry.getUpdatedAt())
        );
    }

    /**
     * Writes all header fields that may change after creation.
     */
    public int updateHeader(JournalEntry entry) {
        return jdbcTemplate.update(
            "UPDATE journal_entries SET entry_date = ?, reference = ?, description = ?, is_posted = ?, " +
            "total_amount = ?, updated_by = ?, updated_at = ? WHERE tenant_id = ? AND id = ?",
            Date.valueOf(entry.getEntryDate()),
            entry.getReference(),
            entry.getDescription(),
            entry.isPosted(),
            entry.getTotalAmount(),
            entry.getUpdatedBy(),
            Timestamp.from(entry.getUpdatedAt()),
            entry.getTenantId(),
            entry.getId()
        );
    }

    public int deleteEntry(long tenantId, UUID entryId) {
        return jdbcTemplate.update(
            "DELETE FROM journal_entries WHERE tenant_id = ? AND id = ?",
            tenantId, entryId
        );
    }

    public Optional<JournalEntry> findById(long tenantId, UUID entryId) {
        return jdbcTemplate.query(
            "SELECT " + ENTRY_COLUMNS + " FROM journal_entries WHERE tenant_id = ? AND id = ?",
            entryRowMapper(),
            tenantId, entryId
        ).stream().findFirst();
    }

    /**
     * Row-locks the entry header for the rest of the transaction.
     */
    public Optional<JournalEntry> findByIdForUpdate(long tenantId, UUID entryId) {
        return jdbcTemplate.query(
            "SELECT " + ENTRY_COLUMNS + " FROM journal_entries WHERE tenant_id = ? AND id = ? FOR UPDATE",
            entryRowMapper(),
            tenantId, entryId
        ).stream().findFirst();
    }

    public Optional<JournalEntry> findBySourceDocument(long tenantId, String sourceDocument, long sourceDocumentId) {
        return jdbcTemplate.query(
            "SELECT " + ENTRY_COLUMNS + " FROM journal_entries " +
            "WHERE tenant_id = ? AND source_document = ? AND source_document_id = ?",
            entryRowMapper(),
            tenantId, sourceDocument, sourceDocumentId
        ).stream().findFirst();
    }

    /**
     * Entries of a tenant, optionally narrowed to a source document type and id,
     * newest first.
     */
    public List<JournalEntry> findEntries(long tenantId, String sourceDocument, Long sourceDocumentId) {
        StringBuilder sql = new StringBuilder("SELECT " + ENTRY_COLUMNS + " FROM journal_entries WHERE tenant_id = ?");
        List<Object> args = new ArrayList<>();
        args.add(tenantId);
        if (sourceDocument != null) {
            sql.append(" AND source_document = ?");
            args.add(sourceDocument);
        }
        if (sourceDocumentId != null) {
            sql.append(" AND source_document_id = ?");
            args.add(sourceDocumentId);
        }
        sql.append(" ORDER BY entry_date DESC, sequence_number DESC");
        return jdbcTemplate.query(sql.toString(), entryRowMapper(), args.toArray());
    }

    public void insertLines(long tenantId, UUID entryId, List<LineRequest> lines) {
        List<Object[]> batch = new ArrayList<>(lines.size());
        for (LineRequest line : lines) {
            batch.add(new Object[] {
                UUID.randomUUID(),
                tenantId,
                entryId,
                line.getAccountId(),
                line.getDebitAmount(),
                line.getCreditAmount(),
                line.getLineOrder(),
                line.getDescription()
            });
        }
        jdbcTemplate.batchUpdate(
            "INSERT INTO journal_entry_lines (" + LINE_COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?)",
            batch
        );
    }

    public int deleteLines(long tenantId, UUID entryId) {
        return jdbcTemplate.update(
            "DELETE FROM journal_entry_lines WHERE tenant_id = ? AND journal_entry_id = ?",
            tenantId, entryId
        );
    }

    public List<JournalEntryLine> findLines(long tenantId, UUID entryId) {
        return jdbcTemplate.query(
            "SELECT " + LINE_COLUMNS + " FROM journal_entry_lines " +
            "WHERE tenant_id = ? AND journal_entry_id = ? ORDER BY line_order",
            lineRowMapper(),
            tenantId, entryId
        );
    }

    public int countLines(long tenantId, UUID entryId) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM journal_entry_lines WHERE tenant_id = ? AND journal_entry_id = ?",
            Integer.class,
            tenantId, entryId
        );
        return count != null ? count : 0;
    }

    private RowMapper<JournalEntry> entryRowMapper() {
        return (rs, rowNum) -> JournalEntry.builder()
            .id(rs.getObject("id", UUID.class))
            .tenantId(rs.getLong("tenant_id"))
            .entryDate(rs.getDate("entry_date").toLocalDate())
            .reference(rs.getString("reference"))
            .entryType(rs.getString("entry_type"))
            .description(rs.getString("description"))
            .posted(rs.getBoolean("is_posted"))
            .sourceDocument(rs.getString("source_document"))
            .sourceDocumentId(rs.getObject("source_document_id", Long.class))
            .totalAmount(rs.getBigDecimal("total_amount"))
            .createdBy(rs.getObject("created_by", Long.class))
            .updatedBy(rs.getObject("updated_by", Long.class))
            .createdAt(rs.getTimestamp("created_at").toInstant())
            .updatedAt(rs.getTimestamp("updated_at").toInstant())
            .sequenceNumber(rs.getLong("sequence_number"))
            .build();
    }

    private RowMapper<JournalEntryLine> lineRowMapper() {
        return (rs, rowNum) -> new JournalEntryLine(
            rs.getObject("id", UUID.class),
            rs.getLong("tenant_id"),
            rs.getObject("journal_entry_id", UUID.class),
            rs.getObject("account_id", UUID.class),
            rs.getBigDecimal("debit_amount"),
            rs.getBigDecimal("credit_amount"),
            rs.getInt("line_order"),
            rs.getString("description")
        );
    }
}
