package com.flagship.practice_ledger.journal;

import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * Transaction-scoped PostgreSQL advisory locks that serialize postings per business key.
 *
 * Locks are released automatically at commit or rollback, so callers must already be
 * inside a transaction. The unique index on journal_entries is the backstop if a caller
 * forgets to lock.
 */
@Component
@Slf4j
public class PostingLocks {

    private static final long FNV_OFFSET_BASIS = 0xcbf29ce484222325L;
    private static final long FNV_PRIME = 0x100000001b3L;

    private final JdbcTemplate jdbcTemplate;

    public PostingLocks(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Serializes every posting for one source document, e.g. ("invoice", 42).
     */
    public void lockSourceDocument(long tenantId, String sourceDocument, long sourceDocumentId) {
        lock(tenantId, "source:" + sourceDocument, Long.toString(sourceDocumentId));
    }

    /**
     * Serializes the provisioning of one account code.
     */
    public void lockAccountCode(long tenantId, String accountCode) {
        lock(tenantId, "account-code", accountCode);
    }

    private void lock(long tenantId, String scope, String key) {
        long lockKey = lockKey(tenantId, scope, key);
        log.debug("Acquiring advisory lock: tenantId={}, scope={}, key={}, lockKey={}", tenantId, scope, key, lockKey);
        jdbcTemplate.queryForList("SELECT pg_advisory_xact_lock(?)", lockKey);
    }

    /**
     * 64-bit FNV-1a over "tenant|scope|key". Stable across JVMs and restarts.
     */
    static long lockKey(long tenantId, String scope, String key) {
        byte[] bytes = (tenantId + "|" + scope + "|" + key).getBytes(StandardCharsets.UTF_8);
        long hash = FNV_OFFSET_BASIS;
        for (byte b : bytes) {
            hash ^= (b & 0xff);
            hash *= FNV_PRIME;
        }
        return hash;
    }
}
