package com.flagship.practice_ledger.observability;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Counters and timers for ledger writes.
 *
 * <ul>
 *   <li>ledger.entries: created / replaced / deleted journal entries, tagged by operation</li>
 *   <li>ledger.invoice.approvals: approval hook outcomes (posted, reposted, missing_accounts, rejected)</li>
 *   <li>ledger.missing_accounts: resolver gaps, tagged by account role</li>
 *   <li>ledger.import.rows: bulk-import rows by outcome</li>
 *   <li>ledger.posting.duration: latency of a single posting</li>
 * </ul>
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;
    private final Timer postingTimer;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.postingTimer = Timer.builder("ledger.posting.duration")
                .description("Time taken to write one journal entry and refresh balances")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    public void recordEntryWritten(String operation, String entryType) {
        registry.counter("ledger.entries",
                "operation", sanitizeTag(operation),
                "entry_type", sanitizeTag(entryType)
        ).increment();
    }

    public void recordInvoiceApproval(String outcome) {
        registry.counter("ledger.invoice.approvals", "outcome", sanitizeTag(outcome)).increment();
    }

    public void recordMissingAccount(String role) {
        registry.counter("ledger.missing_accounts", "role", sanitizeTag(role)).increment();
    }

    public void recordImportRow(boolean success) {
        registry.counter("ledger.import.rows", "outcome", success ? "success" : "failure").increment();
    }

    public <T> T timePosting(Supplier<T> operation) {
        return postingTimer.record(operation);
    }

    /**
     * Keeps tag values to a bounded alphabet and length.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
