package com.flagship.practice_ledger.query;

import com.flagship.practice_ledger.LedgerIntegrationTest;
import com.flagship.practice_ledger.exception.ResourceNotFoundException;
import com.flagship.practice_ledger.hierarchy.Account;
import com.flagship.practice_ledger.hierarchy.AccountFilter;
import com.flagship.practice_ledger.hierarchy.AccountHierarchyService;
import com.flagship.practice_ledger.hierarchy.AccountType;
import com.flagship.practice_ledger.hierarchy.StandardChartSeeder;
import com.flagship.practice_ledger.journal.EntryHeader;
import com.flagship.practice_ledger.journal.JournalEntryEngine;
import com.flagship.practice_ledger.journal.LineRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class LedgerQueryServiceTest extends LedgerIntegrationTest {

    @Autowired
    private LedgerQueryService queryService;

    @Autowired
    private JournalEntryEngine engine;

    @Autowired
    private AccountHierarchyService hierarchyService;

    @Autowired
    private StandardChartSeeder seeder;

    private long tenantId;
    private Account pettyCash;
    private Account revenue;

    @BeforeEach
    void setUp() {
        tenantId = newTenantId();
        seeder.seed(tenantId);
        Account bank = hierarchyService.findAccountByCode(tenantId, StandardChartSeeder.BANK_CODE).orElseThrow();
        revenue = hierarchyService.findAccountByCode(tenantId, StandardChartSeeder.SERVICE_REVENUE_CODE).orElseThrow();
        pettyCash = hierarchyService.createAccount(tenantId, bank.getDetailedGroupId(), "Petty Cash", null,
                new BigDecimal("1000.00"));
    }

    private void receive(LocalDate date, String amount, String reference) {
        engine.createEntry(tenantId,
                EntryHeader.builder().entryDate(date).entryType("JV").reference(reference).posted(true).build(),
                List.of(LineRequest.debit(pettyCash.getId(), new BigDecimal(amount), reference),
                        LineRequest.credit(revenue.getId(), new BigDecimal(amount), reference)));
    }

    private void spend(LocalDate date, String amount, String reference) {
        engine.createEntry(tenantId,
                EntryHeader.builder().entryDate(date).entryType("JV").reference(reference).posted(true).build(),
                List.of(LineRequest.credit(pettyCash.getId(), new BigDecimal(amount), reference),
                        LineRequest.debit(revenue.getId(), new BigDecimal(amount), reference)));
    }

    @Test
    @DisplayName("Running balance starts from the opening balance and carries across pages")
    void runningBalanceAcrossPages() {
        printTestHeader("Ledger Pagination");
        receive(LocalDate.of(2024, 1, 3), "100.00", "R-3");
        receive(LocalDate.of(2024, 1, 1), "50.00", "R-1");
        spend(LocalDate.of(2024, 1, 2), "30.00", "S-2");
        receive(LocalDate.of(2024, 1, 3), "20.00", "R-3b");
        spend(LocalDate.of(2024, 1, 5), "40.00", "S-5");

        LedgerPage first = queryService.getLedger(tenantId, pettyCash.getId(), 0, 2);
        LedgerPage second = queryService.getLedger(tenantId, pettyCash.getId(), 1, 2);
        LedgerPage third = queryService.getLedger(tenantId, pettyCash.getId(), 2, 2);
        LedgerPage beyond = queryService.getLedger(tenantId, pettyCash.getId(), 3, 2);

        printOutput("Page 1", first.getRows());
        printOutput("Page 2", second.getRows());
        printOutput("Page 3", third.getRows());

        assertEquals(5, first.getTotalRows());
        assertEquals(3, first.totalPages());
        assertEquals(0, new BigDecimal("1000.00").compareTo(first.getOpeningBalance()));

        assertEquals(List.of("R-1", "S-2"), first.getRows().stream().map(LedgerRow::getReference).toList());
        assertEquals(List.of("R-3", "R-3b"), second.getRows().stream().map(LedgerRow::getReference).toList());
        assertEquals(List.of("S-5"), third.getRows().stream().map(LedgerRow::getReference).toList());

        assertBalance("1050.00", first.getRows().get(0).getRunningBalance());
        assertBalance("1020.00", first.getRunningBalance());
        assertBalance("1120.00", second.getRows().get(0).getRunningBalance());
        assertBalance("1140.00", second.getRunningBalance());
        assertBalance("1100.00", third.getRunningBalance());
        assertFalse(third.hasNext());

        assertTrue(beyond.getRows().isEmpty());
        assertBalance("1100.00", beyond.getRunningBalance());
        assertBalance("1100.00", hierarchyService.getAccount(tenantId, pettyCash.getId()).getCurrentBalance());
        printSuccess("Running balance continuous across pages");
    }

    @Test
    @DisplayName("Credit-normal accounts accumulate credits as positive")
    void creditNormalRunningBalance() {
        receive(LocalDate.of(2024, 2, 1), "75.00", "R-1");
        spend(LocalDate.of(2024, 2, 2), "25.00", "S-1");

        LedgerPage page = queryService.getLedger(tenantId, revenue.getId(), 0, 10);

        assertBalance("75.00", page.getRows().get(0).getRunningBalance());
        assertBalance("50.00", page.getRunningBalance());
        assertEquals(0, new BigDecimal("75.00").compareTo(page.getRows().get(0).getCredit()));
    }

    @Test
    @DisplayName("Empty ledger returns the opening balance")
    void emptyLedger() {
        LedgerPage page = queryService.getLedger(tenantId, pettyCash.getId(), 0, 20);

        assertTrue(page.getRows().isEmpty());
        assertEquals(0, page.getTotalRows());
        assertBalance("1000.00", page.getRunningBalance());
    }

    @Test
    void invalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> queryService.getLedger(tenantId, pettyCash.getId(), -1, 10));
        assertThrows(IllegalArgumentException.class, () -> queryService.getLedger(tenantId, pettyCash.getId(), 0, 0));
        assertThrows(ResourceNotFoundException.class, () -> queryService.getLedger(tenantId, UUID.randomUUID(), 0, 10));
        assertThrows(ResourceNotFoundException.class, () -> queryService.getLedger(newTenantId(), pettyCash.getId(), 0, 10));
    }

    @Test
    @DisplayName("Account listing honours type, group, system and active filters")
    void listAccounts() {
        hierarchyService.setAccountActive(tenantId, pettyCash.getId(), false);

        List<Account> assets = queryService.listAccounts(tenantId, AccountFilter.builder().accountType(AccountType.ASSET).build());
        List<Account> nonSystem = queryService.listAccounts(tenantId, AccountFilter.builder().includeSystemAccounts(false).build());
        List<Account> activeAssets = queryService.listAccounts(tenantId,
                AccountFilter.builder().accountType(AccountType.ASSET).activeOnly(true).build());

        assertEquals(4, assets.size());
        assertEquals(List.of(pettyCash.getId()), nonSystem.stream().map(Account::getId).toList());
        assertEquals(3, activeAssets.size());
        assertEquals(1, queryService.listAccounts(tenantId,
                AccountFilter.builder().detailedGroupId(revenue.getDetailedGroupId()).build()).size());
        assertEquals(6, queryService.listAccounts(tenantId, null).size());
    }

    private void assertBalance(String expected, BigDecimal actual) {
        assertEquals(0, new BigDecimal(expected).compareTo(actual), () -> "expected " + expected + " but was " + actual);
    }
}
