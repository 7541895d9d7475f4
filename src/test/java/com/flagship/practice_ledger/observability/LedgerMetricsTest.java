package com.flagship.practice_ledger.observability;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LedgerMetricsTest {

    @Test
    void countersAreTaggedAndSanitized() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        LedgerMetrics metrics = new LedgerMetrics(registry);

        metrics.recordEntryWritten("created", "INVAP");
        metrics.recordEntryWritten("created", "INVAP");
        metrics.recordInvoiceApproval("missing accounts!");
        metrics.recordImportRow(false);

        assertEquals(2.0, registry.get("ledger.entries").tag("operation", "created").tag("entry_type", "INVAP")
                .counter().count());
        assertEquals(1.0, registry.get("ledger.invoice.approvals").tag("outcome", "missing_accounts_")
                .counter().count());
        assertEquals(1.0, registry.get("ledger.import.rows").tag("outcome", "failure").counter().count());
    }

    @Test
    void postingTimerRecordsAndReturns() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        LedgerMetrics metrics = new LedgerMetrics(registry);

        assertEquals("done", metrics.timePosting(() -> "done"));
        assertEquals(1L, registry.get("ledger.posting.duration").timer().count());
    }
}
