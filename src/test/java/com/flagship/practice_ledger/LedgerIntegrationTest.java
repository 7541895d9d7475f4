package com.flagship.practice_ledger;

import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Shared setup for tests that need PostgreSQL.
 *
 * One container serves every test class so that Spring can reuse the application context.
 * Tests isolate themselves by working in a fresh tenant instead of cleaning tables.
 * Kafka is not started: the publisher is disabled and the bootstrap address points nowhere.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
public abstract class LedgerIntegrationTest {

    static final PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("practice_ledger_test")
            .withUsername("test")
            .withPassword("test");

    private static final AtomicLong TENANT_SEQUENCE =
            new AtomicLong(ThreadLocalRandom.current().nextLong(1_000_000L, 1_000_000_000L));

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        postgres.start();
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("outbox.publisher.enabled", () -> "false");
        registry.add("ledger.events.create-topic", () -> "false");
    }

    protected static long newTenantId() {
        return TENANT_SEQUENCE.incrementAndGet();
    }

    // Helper methods for test output
    protected void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    protected void printInput(String label, Object value) {
        System.out.println("INPUT  - " + label + ": " + value);
    }

    protected void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    protected void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    protected void printExpectedException(String exceptionType, String reason) {
        System.out.println("⚠ EXPECTED EXCEPTION: " + exceptionType);
        System.out.println("  Reason: " + reason);
    }
}
