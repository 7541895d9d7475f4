package com.flagship.practice_ledger.resolver;

import com.flagship.practice_ledger.exception.MissingAccountException;
import com.flagship.practice_ledger.hierarchy.Account;
import com.flagship.practice_ledger.hierarchy.AccountGroup;
import com.flagship.practice_ledger.hierarchy.AccountHierarchyService;
import com.flagship.practice_ledger.hierarchy.AccountRepository;
import com.flagship.practice_ledger.hierarchy.AccountType;
import com.flagship.practice_ledger.hierarchy.ChartOfAccountsTree;
import com.flagship.practice_ledger.hierarchy.GroupKind;
import com.flagship.practice_ledger.hierarchy.StandardChartSeeder;
import com.flagship.practice_ledger.journal.PostingLocks;
import com.flagship.practice_ledger.observability.LedgerMetrics;
import com.flagship.practice_ledger.resolver.RoleStrategy.ExistingAccountMatcher;
import com.flagship.practice_ledger.resolver.RoleStrategy.ProvisionedAccount;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static com.flagship.practice_ledger.resolver.GroupFallbackTier.anyDetailedUnderElement;
import static com.flagship.practice_ledger.resolver.GroupFallbackTier.anyDetailedUnderSubElement;
import static com.flagship.practice_ledger.resolver.GroupFallbackTier.detailedNamed;
import static com.flagship.practice_ledger.resolver.GroupFallbackTier.detailedOfKindOrNamed;

/**
 * Maps an accounting role to a concrete account of the tenant, creating the account
 * under the best available group when the chart has the structure but not the account.
 *
 * Income accounts are never created here. They are chosen by users or fall back to the
 * Service Revenue system account.
 */
@Service
@Slf4j
public class AccountResolver {

    public static final String RECEIVABLE_CODE_PREFIX = "1210-";
    public static final String RECEIVABLE_NAME_SUFFIX = " - Receivable";
    public static final String DISCOUNT_ALLOWED_CODE = "5100";

    private final AccountRepository accountRepository;
    private final AccountHierarchyService hierarchyService;
    private final PostingLocks postingLocks;
    private final LedgerMetrics ledgerMetrics;
    private final Map<AccountRole, RoleStrategy> strategies = new EnumMap<>(AccountRole.class);

    public AccountResolver(AccountRepository accountRepository,
                           AccountHierarchyService hierarchyService,
                           PostingLocks postingLocks,
                           LedgerMetrics ledgerMetrics) {
        this.accountRepository = accountRepository;
        this.hierarchyService = hierarchyService;
        this.postingLocks = postingLocks;
        this.ledgerMetrics = ledgerMetrics;
        registerStrategies();
    }

    /**
     * Resolves a role, provisioning the account if needed.
     *
     * @throws MissingAccountException if the chart lacks the structure for the role
     */
    @Transactional
    public Account resolve(long tenantId, AccountRequest request) {
        return tryResolve(tenantId, request).orElseThrow();
    }

    /**
     * Resolves a role without throwing for gaps, so callers can collect every gap of
     * a posting before failing.
     */
    @Transactional
    public Resolution tryResolve(long tenantId, AccountRequest request) {
        if (request.getRole() == AccountRole.INCOME) {
            return resolveIncome(tenantId, request);
        }
        if (request.getRole() == AccountRole.ENTITY_RECEIVABLE && request.getEntityId() == null) {
            throw new IllegalArgumentException("Receivable resolution requires an entity id");
        }

        RoleStrategy strategy = strategies.get(request.getRole());
        Optional<Account> existing = findExisting(tenantId, request, strategy);
        if (existing.isPresent()) {
            return Resolution.found(request.getRole(), existing.get());
        }

        ChartOfAccountsTree tree = hierarchyService.loadTree(tenantId);
        Optional<AccountGroup> group = strategy.tiers().stream()
            .map(tier -> tier.locate(tree))
            .flatMap(Optional::stream)
            .findFirst();

        if (group.isEmpty()) {
            String description = strategy.gapDescription().apply(request);
            log.warn("Account gap: tenantId={}, role={}, missing={}", tenantId, request.getRole(), description);
            ledgerMetrics.recordMissingAccount(request.getRole().name());
            return Resolution.missing(request.getRole(), description);
        }

        return provision(tenantId, request, strategy, group.get());
    }

    private Resolution resolveIncome(long tenantId, AccountRequest request) {
        if (request.getSelectedAccountId() != null) {
            UUID selectedId = request.getSelectedAccountId();
            Optional<Account> selected = accountRepository.findById(tenantId, selectedId);
            if (selected.isEmpty()) {
                return incomeGap(tenantId, "Selected income account " + selectedId + " not found");
            }
            if (selected.get().getAccountType() != AccountType.REVENUE) {
                return incomeGap(tenantId, String.format("Selected income account %s is a %s account, not a revenue account",
                    selected.get().getAccountCode(), selected.get().getAccountType()));
            }
            return Resolution.found(AccountRole.INCOME, selected.get());
        }

        Optional<Account> fallback = Optional.ofNullable(request.getDefaultAccountId())
            .flatMap(id -> accountRepository.findById(tenantId, id))
            .filter(account -> account.getAccountType() == AccountType.REVENUE)
            .or(() -> accountRepository.findByCode(tenantId, StandardChartSeeder.SERVICE_REVENUE_CODE)
                .filter(account -> account.getAccountType() == AccountType.REVENUE));

        if (fallback.isPresent()) {
            return Resolution.found(AccountRole.INCOME, fallback.get());
        }

        return incomeGap(tenantId, "Income account: select a revenue account for the invoice, set a default revenue account "
            + "for the entity, or create the Service Revenue (" + StandardChartSeeder.SERVICE_REVENUE_CODE
            + ") account under Incomes");
    }

    private Resolution incomeGap(long tenantId, String description) {
        log.warn("Account gap: tenantId={}, role={}, missing={}", tenantId, AccountRole.INCOME, description);
        ledgerMetrics.recordMissingAccount(AccountRole.INCOME.name());
        return Resolution.missing(AccountRole.INCOME, description);
    }

    private Optional<Account> findExisting(long tenantId, AccountRequest request, RoleStrategy strategy) {
        return strategy.matchers().stream()
            .map(matcher -> matcher.match(tenantId, request))
            .flatMap(Optional::stream)
            .findFirst();
    }

    private Resolution provision(long tenantId, AccountRequest request, RoleStrategy strategy, AccountGroup group) {
        ProvisionedAccount toCreate = strategy.provisioning().apply(request);

        // Two postings may need the same account at once; the second one re-checks after the lock.
        postingLocks.lockAccountCode(tenantId, toCreate.code());
        Optional<Account> raced = findExisting(tenantId, request, strategy);
        if (raced.isPresent()) {
            return Resolution.found(request.getRole(), raced.get());
        }

        Account account = hierarchyService.createAccount(tenantId, group.getId(), toCreate.name(), toCreate.description(),
            BigDecimal.ZERO, toCreate.code(), toCreate.systemAccount(), toCreate.linkedEntityId());

        log.info("Account provisioned: tenantId={}, role={}, accountId={}, code={}, group={}",
            tenantId, request.getRole(), account.getId(), account.getAccountCode(), group.getCode());
        return Resolution.provisioned(request.getRole(), account);
    }

    // ==================== Role definitions ====================

    private void registerStrategies() {
        strategies.put(AccountRole.ENTITY_RECEIVABLE, new RoleStrategy(
            List.of(
                this::byLinkedEntity,
                (tenantId, request) -> byCode(tenantId, receivableCode(request), AccountType.ASSET),
                (tenantId, request) -> byName(tenantId, receivableName(request), AccountType.ASSET),
                (tenantId, request) -> byName(tenantId, request.entityDisplayName(), AccountType.ASSET)
            ),
            List.of(
                detailedOfKindOrNamed(GroupKind.ASSETS, GroupKind.TRADE_DEBTORS, "receivable", "debtor"),
                anyDetailedUnderSubElement(GroupKind.CURRENT_ASSETS),
                anyDetailedUnderElement(GroupKind.ASSETS)
            ),
            request -> new ProvisionedAccount(receivableCode(request), receivableName(request),
                "Receivable for " + request.entityDisplayName(), false, request.getEntityId()),
            request -> "Accounts receivable for " + request.entityDisplayName()
                + ": add a Trade Debtors or other detailed group under Assets"
        ));

        strategies.put(AccountRole.TAX_PAYABLE, systemAccountStrategy(
            StandardChartSeeder.TAX_LIABILITY_CODE, "Tax Liability", "Sales tax collected on invoices",
            AccountType.LIABILITY,
            List.of(
                detailedNamed(GroupKind.LIABILITIES, "tax"),
                anyDetailedUnderSubElement(GroupKind.CURRENT_LIABILITIES),
                anyDetailedUnderElement(GroupKind.LIABILITIES)
            ),
            "Tax payable: add a detailed group under Liabilities (for example Current Liabilities > Tax Liabilities)"
        ));

        strategies.put(AccountRole.DISCOUNT_ALLOWED, systemAccountStrategy(
            DISCOUNT_ALLOWED_CODE, "Discount Allowed", "Discounts granted on invoices",
            AccountType.EXPENSE,
            List.of(
                detailedNamed(GroupKind.EXPENSES, "discount"),
                anyDetailedUnderElement(GroupKind.EXPENSES)
            ),
            "Discount allowed: add a detailed group under Expenses"
        ));

        List<GroupFallbackTier> cashTiers = List.of(
            detailedOfKindOrNamed(GroupKind.ASSETS, GroupKind.CASH_BANK_BALANCES, "cash", "bank"),
            anyDetailedUnderSubElement(GroupKind.CURRENT_ASSETS),
            anyDetailedUnderElement(GroupKind.ASSETS)
        );
        strategies.put(AccountRole.CASH_AT_BANK, systemAccountStrategy(
            StandardChartSeeder.BANK_CODE, "Bank", "Main operating bank account",
            AccountType.ASSET, cashTiers,
            "Cash at bank: add a Cash & Bank Balances group under Current Assets"
        ));
        strategies.put(AccountRole.CASH_IN_HAND, systemAccountStrategy(
            StandardChartSeeder.CASH_IN_HAND_CODE, "Cash in Hand", "Petty cash",
            AccountType.ASSET, cashTiers,
            "Cash in hand: add a Cash & Bank Balances group under Current Assets"
        ));
    }

    private RoleStrategy systemAccountStrategy(String code, String name, String description, AccountType type,
                                               List<GroupFallbackTier> tiers, String gap) {
        List<ExistingAccountMatcher> matchers = List.of(
            (tenantId, request) -> byCode(tenantId, code, type),
            (tenantId, request) -> byName(tenantId, name, type)
        );
        return new RoleStrategy(matchers, tiers,
            request -> new ProvisionedAccount(code, name, description, true, null),
            request -> gap);
    }

    private Optional<Account> byLinkedEntity(long tenantId, AccountRequest request) {
        return accountRepository.findByLinkedEntity(tenantId, request.getEntityId()).stream()
            .filter(account -> account.getAccountType() == AccountType.ASSET)
            .findFirst();
    }

    private Optional<Account> byCode(long tenantId, String code, AccountType type) {
        return accountRepository.findByCode(tenantId, code)
            .filter(account -> account.getAccountType() == type);
    }

    private Optional<Account> byName(long tenantId, String name, AccountType type) {
        return accountRepository.findByNameIgnoreCase(tenantId, name).stream()
            .filter(account -> account.getAccountType() == type)
            .findFirst();
    }

    static String receivableCode(AccountRequest request) {
        return RECEIVABLE_CODE_PREFIX + request.getEntityId();
    }

    static String receivableName(AccountRequest request) {
        return request.entityDisplayName() + RECEIVABLE_NAME_SUFFIX;
    }
}
