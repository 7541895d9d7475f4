package com.flagship.practice_ledger.hierarchy;

import com.flagship.practice_ledger.LedgerIntegrationTest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import static org.junit.jupiter.api.Assertions.*;

class StandardChartSeederTest extends LedgerIntegrationTest {

    @Autowired
    private StandardChartSeeder seeder;

    @Autowired
    private AccountHierarchyService hierarchyService;

    @Test
    @DisplayName("Seeding creates the standard system accounts with the right types")
    void seedsSystemAccounts() {
        printTestHeader("Seed Standard Chart");
        long tenantId = newTenantId();

        int created = seeder.seed(tenantId);
        printOutput("Created", created);

        assertEquals(AccountType.ASSET, account(tenantId, StandardChartSeeder.BANK_CODE).getAccountType());
        assertEquals(AccountType.ASSET, account(tenantId, StandardChartSeeder.CASH_IN_HAND_CODE).getAccountType());
        assertEquals(AccountType.ASSET, account(tenantId, StandardChartSeeder.TRADE_DEBTORS_CODE).getAccountType());
        assertEquals(AccountType.LIABILITY, account(tenantId, StandardChartSeeder.TAX_LIABILITY_CODE).getAccountType());
        assertEquals(AccountType.REVENUE, account(tenantId, StandardChartSeeder.SERVICE_REVENUE_CODE).getAccountType());
        assertTrue(account(tenantId, StandardChartSeeder.BANK_CODE).isSystemAccount());

        ChartOfAccountsTree tree = hierarchyService.loadTree(tenantId);
        assertEquals(2, tree.roots().size());
        assertEquals(5, tree.atLevel(GroupLevel.ELEMENT_GROUP).size());
        assertEquals(created - 5, tree.size());
        printSuccess("Standard chart in place");
    }

    @Test
    @DisplayName("Seeding twice creates nothing the second time")
    void seedingIsIdempotent() {
        long tenantId = newTenantId();
        seeder.seed(tenantId);
        int groups = hierarchyService.loadTree(tenantId).size();

        assertEquals(0, seeder.seed(tenantId));
        assertEquals(groups, hierarchyService.loadTree(tenantId).size());
    }

    @Test
    @DisplayName("Seeding fills in around groups the tenant already created")
    void seedingKeepsExistingGroups() {
        long tenantId = newTenantId();
        AccountGroup bs = hierarchyService.createGroup(tenantId, GroupLevel.MAIN_GROUP, null,
                GroupKind.BALANCE_SHEET, null, null);

        seeder.seed(tenantId);

        assertEquals(bs.getId(), hierarchyService.loadTree(tenantId)
                .findChild(null, GroupKind.BALANCE_SHEET, null).orElseThrow().getId());
    }

    private Account account(long tenantId, String code) {
        return hierarchyService.findAccountByCode(tenantId, code).orElseThrow();
    }
}
