package com.flagship.practice_ledger.observability;

import jakarta.servlet.FilterChain;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CorrelationIdFilterTest {

    private final CorrelationIdFilter filter = new CorrelationIdFilter();

    @Test
    void propagatesHeadersIntoMdcForTheRequestOnly() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/invoices/1/approve");
        request.addHeader(CorrelationContext.CORRELATION_ID_HEADER, "req-123");
        request.addHeader(CorrelationContext.TENANT_ID_HEADER, " 42 ");
        MockHttpServletResponse response = new MockHttpServletResponse();
        Map<String, String> seen = new HashMap<>();

        FilterChain chain = (req, res) -> {
            seen.put("correlationId", MDC.get(CorrelationContext.CORRELATION_ID_MDC_KEY));
            seen.put("tenantId", MDC.get(CorrelationContext.TENANT_ID_MDC_KEY));
            seen.put("context", CorrelationContext.getCorrelationId());
        };
        filter.doFilter(request, response, chain);

        assertEquals("req-123", seen.get("correlationId"));
        assertEquals("42", seen.get("tenantId"));
        assertEquals("req-123", seen.get("context"));
        assertEquals("req-123", response.getHeader(CorrelationContext.CORRELATION_ID_HEADER));

        assertNull(MDC.get(CorrelationContext.CORRELATION_ID_MDC_KEY));
        assertNull(MDC.get(CorrelationContext.TENANT_ID_MDC_KEY));
        assertFalse(CorrelationContext.hasCorrelationId());
    }

    @Test
    void generatesIdWhenHeaderMissing() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/ledger");
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(request, response, (req, res) -> { });

        String generated = response.getHeader(CorrelationContext.CORRELATION_ID_HEADER);
        assertNotNull(generated);
        assertEquals(8, generated.length());
    }

    @Test
    void ignoresNonNumericTenant() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/ledger");
        request.addHeader(CorrelationContext.TENANT_ID_HEADER, "acme");
        Map<String, String> seen = new HashMap<>();

        filter.doFilter(request, new MockHttpServletResponse(),
            (req, res) -> seen.put("tenantId", MDC.get(CorrelationContext.TENANT_ID_MDC_KEY)));

        assertTrue(seen.containsKey("tenantId"));
        assertNull(seen.get("tenantId"));
    }

    @Test
    void skipsActuatorEndpoints() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/actuator/health");
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(request, response, (req, res) -> { });

        assertNull(response.getHeader(CorrelationContext.CORRELATION_ID_HEADER));
    }
}
