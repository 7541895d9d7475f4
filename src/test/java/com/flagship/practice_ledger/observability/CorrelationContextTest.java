package com.flagship.practice_ledger.observability;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class CorrelationContextTest {

    @AfterEach
    void tearDown() {
        CorrelationContext.clear();
        MDC.clear();
    }

    @Test
    void nestedScopesRestoreOuterValue() {
        try (CorrelationContext.Scope outer = CorrelationContext.tenantScope(7)) {
            try (CorrelationContext.Scope inner = CorrelationContext.tenantScope(7)) {
                assertEquals("7", MDC.get(CorrelationContext.TENANT_ID_MDC_KEY));
            }
            assertEquals("7", MDC.get(CorrelationContext.TENANT_ID_MDC_KEY));

            try (CorrelationContext.Scope other = CorrelationContext.tenantScope(9)) {
                assertEquals("9", MDC.get(CorrelationContext.TENANT_ID_MDC_KEY));
            }
            assertEquals("7", MDC.get(CorrelationContext.TENANT_ID_MDC_KEY));
        }
        assertNull(MDC.get(CorrelationContext.TENANT_ID_MDC_KEY));
    }

    @Test
    void entryScopeRemovedOnClose() {
        UUID entryId = UUID.randomUUID();
        try (CorrelationContext.Scope scope = CorrelationContext.entryScope(entryId)) {
            assertEquals(entryId.toString(), MDC.get(CorrelationContext.ENTRY_ID_MDC_KEY));
        }
        assertNull(MDC.get(CorrelationContext.ENTRY_ID_MDC_KEY));
    }

    @Test
    void correlationIdGeneratedOnce() {
        assertFalse(CorrelationContext.hasCorrelationId());
        String id = CorrelationContext.getCorrelationId();
        assertEquals(8, id.length());
        assertEquals(id, CorrelationContext.getCorrelationId());

        CorrelationContext.setCorrelationId(" ");
        assertNotEquals(id, CorrelationContext.getCorrelationId());

        CorrelationContext.setCorrelationId("abc");
        assertEquals("abc", CorrelationContext.getCorrelationId());
    }
}
