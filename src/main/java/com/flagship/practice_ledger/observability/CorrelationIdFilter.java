package com.flagship.practice_ledger.observability;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.OptionalLong;

/**
 * Gives every request handled by the host application a correlation id, echoed back in
 * the response, and tags its log lines with the tenant named in {@code X-Tenant-ID}.
 * Ledger services called during the request add their own MDC keys on top.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
@Slf4j
public class CorrelationIdFilter extends OncePerRequestFilter {

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String correlationId = request.getHeader(CorrelationContext.CORRELATION_ID_HEADER);
        CorrelationContext.setCorrelationId(correlationId);
        String effectiveId = CorrelationContext.getCorrelationId();
        response.setHeader(CorrelationContext.CORRELATION_ID_HEADER, effectiveId);

        OptionalLong tenantId = parseTenant(request.getHeader(CorrelationContext.TENANT_ID_HEADER));
        try (CorrelationContext.Scope correlation = CorrelationContext.correlationScope(effectiveId);
             CorrelationContext.Scope tenant = tenantId.isPresent()
                 ? CorrelationContext.tenantScope(tenantId.getAsLong())
                 : CorrelationContext.Scope.none()) {
            filterChain.doFilter(request, response);
        } finally {
            CorrelationContext.clear();
        }
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return request.getRequestURI().startsWith("/actuator");
    }

    private OptionalLong parseTenant(String header) {
        if (header == null || header.isBlank()) {
            return OptionalLong.empty();
        }
        try {
            return OptionalLong.of(Long.parseLong(header.trim()));
        } catch (NumberFormatException e) {
            log.debug("Ignoring non-numeric tenant header: {}", header);
            return OptionalLong.empty();
        }
    }
}
