package com.flagship.practice_ledger.chartimport;

import com.flagship.practice_ledger.hierarchy.AccountHierarchyService;
import com.flagship.practice_ledger.observability.LedgerMetrics;
import jakarta.validation.Validation;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionStatus;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Failures outside the usual business and database errors still only fail their own row.
 */
@ExtendWith(MockitoExtension.class)
class ChartImportRowFailureTest {

    private static final long TENANT_ID = 77L;

    @Mock
    private AccountHierarchyService hierarchyService;

    @Mock
    private LedgerMetrics ledgerMetrics;

    @Mock
    private PlatformTransactionManager transactionManager;

    @Mock
    private TransactionStatus transactionStatus;

    private ValidatorFactory validatorFactory;
    private ChartOfAccountsImportService importService;

    @BeforeEach
    void setUp() {
        validatorFactory = Validation.buildDefaultValidatorFactory();
        importService = new ChartOfAccountsImportService(hierarchyService, ledgerMetrics,
            validatorFactory.getValidator(), transactionManager);
    }

    @AfterEach
    void tearDown() {
        validatorFactory.close();
    }

    private static ChartImportRow row(String accountName, String mainGroup) {
        return ChartImportRow.builder()
            .accountName(accountName)
            .mainGroupName(mainGroup)
            .elementGroupName("Assets")
            .subElementGroupName("Current Assets")
            .detailedGroupName("Trade Debtors")
            .build();
    }

    @Test
    void unexpectedRowErrorsDoNotAbortTheBatch() {
        when(transactionManager.getTransaction(any()))
            .thenReturn(transactionStatus)
            .thenThrow(new CannotCreateTransactionException("Connection pool exhausted"))
            .thenReturn(transactionStatus);
        when(hierarchyService.loadTree(TENANT_ID))
            .thenThrow(new IllegalStateException("Could not generate a free group code under BS-A"));

        ChartImportReport report = importService.importAccounts(TENANT_ID, List.of(
            row("Client A", "Balance Sheet"),
            row("Client B", "Balance Sheet"),
            row("Client C", "Trial Balance")));

        assertEquals(3, report.getRows().size());
        assertEquals(3, report.failureCount());
        assertEquals("Unexpected error: Could not generate a free group code under BS-A",
            report.getRows().get(0).getError());
        assertEquals("Unexpected error: Connection pool exhausted", report.getRows().get(1).getError());
        assertEquals("Unknown main group: Trial Balance", report.getRows().get(2).getError());

        verify(transactionManager, times(2)).rollback(transactionStatus);
        verify(transactionManager, never()).commit(any());
        verify(ledgerMetrics, times(3)).recordImportRow(false);
        verify(ledgerMetrics, never()).recordImportRow(true);
    }
}
