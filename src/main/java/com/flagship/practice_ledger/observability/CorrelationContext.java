package com.flagship.practice_ledger.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Thread-local correlation id plus the MDC keys the ledger logs with.
 *
 * The correlation id arrives on the HTTP boundary (or is generated) and is printed on
 * every log line written while the request is handled. Services add the tenant and the
 * journal entry they are working on around write operations.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String TENANT_ID_HEADER = "X-Tenant-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String TENANT_ID_MDC_KEY = "tenantId";
    public static final String ENTRY_ID_MDC_KEY = "entryId";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
    }

    /**
     * Gets the current correlation id, generating one if none is set.
     */
    public static String getCorrelationId() {
        String id = correlationId.get();
        if (id == null) {
            id = generateCorrelationId();
            correlationId.set(id);
        }
        return id;
    }

    public static void setCorrelationId(String id) {
        if (id != null && !id.isBlank()) {
            correlationId.set(id);
        } else {
            correlationId.set(generateCorrelationId());
        }
    }

    public static void clear() {
        correlationId.remove();
    }

    /**
     * Short form for readability in logs.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    public static boolean hasCorrelationId() {
        return correlationId.get() != null;
    }

    /**
     * Puts the tenant into the MDC until the returned scope is closed, then restores
     * whatever value the key had before. Scopes nest, so a service called from another
     * service does not wipe the caller's context.
     */
    public static Scope tenantScope(long tenantId) {
        return Scope.put(TENANT_ID_MDC_KEY, String.valueOf(tenantId));
    }

    public static Scope entryScope(UUID entryId) {
        return Scope.put(ENTRY_ID_MDC_KEY, String.valueOf(entryId));
    }

    public static Scope correlationScope(String correlationId) {
        return Scope.put(CORRELATION_ID_MDC_KEY, correlationId);
    }

    /**
     * An MDC entry that lives for one try-with-resources block.
     */
    public static final class Scope implements AutoCloseable {

        private final String key;
        private final String previous;

        private Scope(String key, String previous) {
            this.key = key;
            this.previous = previous;
        }

        /**
         * A scope that changes nothing, for optional keys.
         */
        public static Scope none() {
            return new Scope(null, null);
        }

        static Scope put(String key, String value) {
            String previous = MDC.get(key);
            MDC.put(key, value);
            return new Scope(key, previous);
        }

        @Override
        public void close() {
            if (key == null) {
                return;
            }
            if (previous == null) {
                MDC.remove(key);
            } else {
                MDC.put(key, previous);
            }
        }
    }
}
