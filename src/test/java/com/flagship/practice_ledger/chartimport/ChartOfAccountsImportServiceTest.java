package com.flagship.practice_ledger.chartimport;

import com.flagship.practice_ledger.LedgerIntegrationTest;
import com.flagship.practice_ledger.hierarchy.Account;
import com.flagship.practice_ledger.hierarchy.AccountGroup;
import com.flagship.practice_ledger.hierarchy.AccountHierarchyService;
import com.flagship.practice_ledger.hierarchy.AccountType;
import com.flagship.practice_ledger.hierarchy.ChartOfAccountsTree;
import com.flagship.practice_ledger.hierarchy.GroupKind;
import com.flagship.practice_ledger.hierarchy.GroupLevel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ChartOfAccountsImportServiceTest extends LedgerIntegrationTest {

    @Autowired
    private ChartOfAccountsImportService importService;

    @Autowired
    private AccountHierarchyService hierarchyService;

    private long tenantId;

    @BeforeEach
    void setUp() {
        tenantId = newTenantId();
    }

    private static ChartImportRow.ChartImportRowBuilder cashRow(String accountName) {
        return ChartImportRow.builder()
            .accountName(accountName)
            .mainGroupName("Balance Sheet")
            .elementGroupName("Assets")
            .subElementGroupName("Current Assets")
            .detailedGroupName("Cash & Bank Balances");
    }

    @Test
    @DisplayName("Rows build the missing groups and accounts under predefined kinds")
    void importsIntoPredefinedGroups() {
        printTestHeader("Chart Import");
        ChartImportRow row = cashRow("Operating Account").openingBalance(new BigDecimal("2500.00")).build();
        printInput("Row", row);

        ChartImportReport report = importService.importAccounts(tenantId, List.of(row));
        ChartImportRowResult result = report.getRows().get(0);
        printOutput("Result", result);

        assertTrue(result.isSuccess());
        assertEquals(1, result.getRowNumber());
        assertEquals("BS-A-CA-CB.001", result.getAccountCode());
        assertEquals(4, result.getCreatedGroupIds().size());

        Account account = hierarchyService.getAccount(tenantId, result.getAccountId());
        assertEquals(AccountType.ASSET, account.getAccountType());
        assertEquals(0, new BigDecimal("2500.00").compareTo(account.getOpeningBalance()));
        assertEquals(0, new BigDecimal("2500.00").compareTo(account.getCurrentBalance()));

        AccountGroup detailed = hierarchyService.getGroup(tenantId, account.getDetailedGroupId());
        assertEquals(GroupKind.CASH_BANK_BALANCES, detailed.getKind());
        printSuccess("Account imported under predefined groups");
    }

    @Test
    @DisplayName("A new custom group is created once and reused by later rows")
    void customGroupsReusedAcrossRows() {
        ChartImportRow first = ChartImportRow.builder()
            .accountName("Rent")
            .mainGroupName("Profit & Loss")
            .elementGroupName("Expenses")
            .subElementGroupName("Premises Costs")
            .detailedGroupName("Office Rent")
            .build();
        ChartImportRow second = ChartImportRow.builder()
            .accountName("Rent Deposit Fees")
            .mainGroupName("profit and loss")
            .elementGroupName("EXPENSES")
            .subElementGroupName("premises costs")
            .detailedGroupName("Office Rent")
            .build();

        ChartImportReport report = importService.importAccounts(tenantId, List.of(first, second));

        assertEquals(2, report.successCount());
        assertEquals(4, report.getRows().get(0).getCreatedGroupIds().size());
        assertTrue(report.getRows().get(1).getCreatedGroupIds().isEmpty());

        ChartOfAccountsTree tree = hierarchyService.loadTree(tenantId);
        List<AccountGroup> subElements = tree.atLevel(GroupLevel.SUB_ELEMENT_GROUP);
        assertEquals(1, subElements.size());
        assertEquals("Premises Costs", subElements.get(0).getName());

        Account rent = hierarchyService.getAccount(tenantId, report.getRows().get(0).getAccountId());
        Account deposit = hierarchyService.getAccount(tenantId, report.getRows().get(1).getAccountId());
        assertEquals(rent.getDetailedGroupId(), deposit.getDetailedGroupId());
        assertEquals(AccountType.EXPENSE, rent.getAccountType());
        assertTrue(deposit.getAccountCode().endsWith(".002"));
    }

    @Test
    @DisplayName("Bad rows are reported without aborting the batch")
    void badRowsDoNotAbortBatch() {
        printTestHeader("Chart Import Failures");
        ChartImportRow unknownMain = cashRow("Ghost").mainGroupName("Trial Balance").build();
        ChartImportRow missingName = cashRow(" ").build();
        ChartImportRow good = cashRow("Payroll Account").build();

        ChartImportReport report = importService.importAccounts(tenantId,
            Arrays.asList(unknownMain, missingName, null, good));
        printOutput("Failures", report.failures());

        assertEquals(1, report.successCount());
        assertEquals(3, report.failureCount());
        assertEquals("Unknown main group: Trial Balance", report.getRows().get(0).getError());
        assertEquals("Account name is required", report.getRows().get(1).getError());
        assertEquals("Row is empty", report.getRows().get(2).getError());
        assertEquals(4, report.getRows().get(3).getRowNumber());
        assertTrue(report.getRows().get(3).isSuccess());

        assertEquals(1, hierarchyService.listGroups(tenantId, GroupLevel.MAIN_GROUP, null).size());
        printExpectedException("Rows 1-3", "reported individually");
    }

    @Test
    @DisplayName("An element group under the wrong main group fails only its row")
    void elementUnderWrongMainGroupReported() {
        ChartImportRow misplaced = ChartImportRow.builder()
            .accountName("Office Supplies")
            .mainGroupName("Balance Sheet")
            .elementGroupName("Expenses")
            .subElementGroupName("Admin Costs")
            .detailedGroupName("Stationery")
            .build();
        ChartImportRow good = cashRow("Petty Cash").build();

        ChartImportReport report = importService.importAccounts(tenantId, List.of(misplaced, good));

        assertEquals("Expenses belongs under Profit And Loss, not Balance Sheet", report.getRows().get(0).getError());
        assertTrue(report.getRows().get(1).isSuccess());
        assertEquals(1, hierarchyService.listGroups(tenantId, GroupLevel.ELEMENT_GROUP, null).size());
    }

    @Test
    void multipleViolationsJoined() {
        ChartImportRow row = ChartImportRow.builder()
            .accountName("Something")
            .mainGroupName("Balance Sheet")
            .build();

        ChartImportReport report = importService.importAccounts(tenantId, List.of(row));

        assertEquals("Detailed group name is required; Element group name is required; "
            + "Sub-element group name is required", report.getRows().get(0).getError());
    }

    @Test
    void nullRowsRejected() {
        assertThrows(IllegalArgumentException.class, () -> importService.importAccounts(tenantId, null));
    }
}
