package com.flagship.practice_ledger.hierarchy;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Seeds the standard chart of accounts for a new tenant.
 *
 * Existing nodes and accounts are kept, so seeding twice, or seeding a tenant that already
 * built part of its chart, only fills in what is missing.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StandardChartSeeder {

    public static final String BANK_CODE = "1100";
    public static final String CASH_IN_HAND_CODE = "1110";
    public static final String TRADE_DEBTORS_CODE = "1200";
    public static final String TAX_LIABILITY_CODE = "2200";
    public static final String SERVICE_REVENUE_CODE = "4000";

    static final String TAX_LIABILITIES_GROUP = "Tax Liabilities";
    static final String PROFESSIONAL_FEES_GROUP = "Professional Fees";
    static final String OPERATING_EXPENSES_GROUP = "Operating Expenses";
    static final String ADMINISTRATIVE_EXPENSES_GROUP = "Administrative Expenses";

    private final AccountHierarchyService hierarchyService;

    /**
     * Path from a main group down to a detailed group, one kind (or custom name) per level.
     */
    private record GroupPath(GroupKind main, GroupKind element,
                             GroupKind subElement, String subElementName,
                             GroupKind detailed, String detailedName) {

        static GroupPath of(GroupKind main, GroupKind element, GroupKind subElement, GroupKind detailed) {
            return new GroupPath(main, element, subElement, null, detailed, null);
        }
    }

    private record SystemAccount(String code, String name, String description, GroupPath path) {
    }

    private static final List<GroupPath> STANDARD_GROUPS = List.of(
        GroupPath.of(GroupKind.BALANCE_SHEET, GroupKind.ASSETS, GroupKind.CURRENT_ASSETS, GroupKind.CASH_BANK_BALANCES),
        GroupPath.of(GroupKind.BALANCE_SHEET, GroupKind.ASSETS, GroupKind.CURRENT_ASSETS, GroupKind.TRADE_DEBTORS),
        GroupPath.of(GroupKind.BALANCE_SHEET, GroupKind.ASSETS, GroupKind.CURRENT_ASSETS, GroupKind.ADVANCES_PREPAYMENTS),
        GroupPath.of(GroupKind.BALANCE_SHEET, GroupKind.ASSETS, GroupKind.NON_CURRENT_ASSETS, GroupKind.PROPERTY_PLANT_EQUIPMENT),
        GroupPath.of(GroupKind.BALANCE_SHEET, GroupKind.LIABILITIES, GroupKind.CURRENT_LIABILITIES, GroupKind.TRADE_CREDITORS),
        GroupPath.of(GroupKind.BALANCE_SHEET, GroupKind.LIABILITIES, GroupKind.CURRENT_LIABILITIES, GroupKind.ACCRUED_CHARGES),
        new GroupPath(GroupKind.BALANCE_SHEET, GroupKind.LIABILITIES, GroupKind.CURRENT_LIABILITIES, null,
            GroupKind.CUSTOM, TAX_LIABILITIES_GROUP),
        GroupPath.of(GroupKind.BALANCE_SHEET, GroupKind.LIABILITIES, GroupKind.NON_CURRENT_LIABILITIES, GroupKind.LONG_TERM_LOANS),
        GroupPath.of(GroupKind.BALANCE_SHEET, GroupKind.EQUITY, GroupKind.CAPITAL, GroupKind.OWNERS_CAPITAL),
        new GroupPath(GroupKind.PROFIT_AND_LOSS, GroupKind.INCOMES, GroupKind.SERVICE_REVENUE, null,
            GroupKind.CUSTOM, PROFESSIONAL_FEES_GROUP),
        new GroupPath(GroupKind.PROFIT_AND_LOSS, GroupKind.EXPENSES, GroupKind.CUSTOM, OPERATING_EXPENSES_GROUP,
            GroupKind.CUSTOM, ADMINISTRATIVE_EXPENSES_GROUP)
    );

    private static final List<SystemAccount> SYSTEM_ACCOUNTS = List.of(
        new SystemAccount(BANK_CODE, "Bank", "Main operating bank account", STANDARD_GROUPS.get(0)),
        new SystemAccount(CASH_IN_HAND_CODE, "Cash in Hand", "Petty cash", STANDARD_GROUPS.get(0)),
        new SystemAccount(TRADE_DEBTORS_CODE, "Trade Debtors", "Money owed by clients", STANDARD_GROUPS.get(1)),
        new SystemAccount(TAX_LIABILITY_CODE, "Tax Liability", "Sales tax collected on invoices", STANDARD_GROUPS.get(6)),
        new SystemAccount(SERVICE_REVENUE_CODE, "Service Revenue", "Revenue from professional services", STANDARD_GROUPS.get(9))
    );

    /**
     * Creates the standard groups and system accounts that the tenant does not have yet.
     *
     * @return the number of groups and accounts created
     */
    @Transactional
    public int seed(long tenantId) {
        int created = 0;

        for (GroupPath path : STANDARD_GROUPS) {
            created += ensurePath(tenantId, path).created();
        }

        for (SystemAccount systemAccount : SYSTEM_ACCOUNTS) {
            if (hierarchyService.findAccountByCode(tenantId, systemAccount.code()).isPresent()) {
                continue;
            }
            UUID detailedGroupId = ensurePath(tenantId, systemAccount.path()).groupId();
            hierarchyService.createAccount(tenantId, detailedGroupId, systemAccount.name(),
                systemAccount.description(), BigDecimal.ZERO, systemAccount.code(), true, null);
            created++;
        }

        log.info("Standard chart seeded: tenantId={}, created={}", tenantId, created);
        return created;
    }

    private record Ensured(UUID groupId, int created) {
    }

    private Ensured ensurePath(long tenantId, GroupPath path) {
        Ensured main = ensureGroup(tenantId, GroupLevel.MAIN_GROUP, null, path.main(), null);
        Ensured element = ensureGroup(tenantId, GroupLevel.ELEMENT_GROUP, main.groupId(), path.element(), null);
        Ensured sub = ensureGroup(tenantId, GroupLevel.SUB_ELEMENT_GROUP, element.groupId(),
            path.subElement(), path.subElementName());
        Ensured detailed = ensureGroup(tenantId, GroupLevel.DETAILED_GROUP, sub.groupId(),
            path.detailed(), path.detailedName());
        return new Ensured(detailed.groupId(),
            main.created() + element.created() + sub.created() + detailed.created());
    }

    private Ensured ensureGroup(long tenantId, GroupLevel level, UUID parentId, GroupKind kind, String customName) {
        ChartOfAccountsTree tree = hierarchyService.loadTree(tenantId);
        return tree.findChild(parentId, kind, customName)
            .map(existing -> new Ensured(existing.getId(), 0))
            .orElseGet(() -> new Ensured(
                hierarchyService.createGroup(tenantId, level, parentId, kind, customName, null).getId(), 1));
    }
}
