package com.flagship.practice_ledger.hierarchy;

import com.flagship.practice_ledger.exception.ConstraintException;
import com.flagship.practice_ledger.exception.DuplicateCodeException;
import com.flagship.practice_ledger.exception.ResourceNotFoundException;
import com.flagship.practice_ledger.exception.SystemAccountProtectionException;
import com.flagship.practice_ledger.hierarchy.event.AccountCreatedEvent;
import com.flagship.practice_ledger.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.security.SecureRandom;
import java.time.Instant;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Administrative operations on a tenant's chart of accounts: the four group levels and
 * the accounts hanging off detailed groups.
 *
 * Account types are never chosen by callers. They follow from the element group above
 * the account's detailed group.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AccountHierarchyService {

    private static final int ACCOUNT_SEQUENCE_WIDTH = 3;
    private static final int CUSTOM_SUFFIX_BYTES = 3;
    private static final int MAX_CODE_ATTEMPTS = 10;

    private static final SecureRandom RANDOM = new SecureRandom();

    private final AccountGroupRepository groupRepository;
    private final AccountRepository accountRepository;
    private final OutboxService outboxService;

    // ==================== Groups ====================

    /**
     * Creates a group node under the given parent.
     *
     * @param parentId   null for main groups, otherwise a group one level up in the same tenant
     * @param kind       a predefined kind of the level, or CUSTOM together with a custom name
     * @throws ResourceNotFoundException if the parent does not exist in the tenant
     * @throws DuplicateCodeException    if the parent already has a child with this name
     */
    @Transactional
    public AccountGroup createGroup(long tenantId, GroupLevel level, UUID parentId,
                                    GroupKind kind, String customName, String description) {
        if (level == null || kind == null) {
            throw new IllegalArgumentException("Group level and kind are required");
        }
        if (!kind.belongsTo(level)) {
            throw new IllegalArgumentException(
                String.format("Group kind %s is not allowed at level %s", kind, level));
        }
        if (kind.isCustom() && (customName == null || customName.isBlank())) {
            throw new IllegalArgumentException("Custom groups require a name");
        }
        String name = kind.isCustom() ? customName.trim() : null;

        AccountGroup parent = resolveParent(tenantId, level, parentId);
        Optional<GroupKind> requiredMain = kind.requiredMainGroup();
        if (requiredMain.isPresent() && parent.getKind() != requiredMain.get()) {
            throw new IllegalArgumentException(String.format("%s belongs under %s, not %s",
                kind.label(), requiredMain.get().label(), parent.getKind().label()));
        }
        List<AccountGroup> siblings = parent == null
            ? groupRepository.findByLevel(tenantId, GroupLevel.MAIN_GROUP)
            : groupRepository.findChildren(tenantId, parent.getId());

        if (siblings.stream().anyMatch(sibling -> sibling.matches(kind, name))) {
            throw new DuplicateCodeException(String.format("Group '%s' already exists under %s",
                name != null ? name : kind.label(), parent != null ? parent.getCode() : "the chart root"));
        }

        AccountGroup group = new AccountGroup(
            UUID.randomUUID(),
            tenantId,
            parent != null ? parent.getId() : null,
            level,
            kind,
            name,
            nextGroupCode(tenantId, parent, kind),
            description,
            Instant.now()
        );

        try {
            groupRepository.insert(group);
        } catch (DuplicateKeyException e) {
            throw new DuplicateCodeException("Group code already in use: " + group.getCode(), e);
        }

        log.info("Account group created: tenantId={}, groupId={}, level={}, code={}, name={}",
            tenantId, group.getId(), level, group.getCode(), group.getName());
        return group;
    }

    /**
     * Deletes a group that has no child groups and, for detailed groups, no accounts.
     */
    @Transactional
    public void deleteGroup(long tenantId, UUID groupId) {
        AccountGroup group = getGroup(tenantId, groupId);

        if (groupRepository.countChildren(tenantId, groupId) > 0) {
            log.warn("Group delete rejected, child groups exist: tenantId={}, groupId={}", tenantId, groupId);
            throw new ConstraintException(
                String.format("Group %s has child groups and cannot be deleted", group.getCode()));
        }
        if (group.getLevel() == GroupLevel.DETAILED_GROUP
                && accountRepository.countByDetailedGroup(tenantId, groupId) > 0) {
            log.warn("Group delete rejected, accounts exist: tenantId={}, groupId={}", tenantId, groupId);
            throw new ConstraintException(
                String.format("Group %s has accounts and cannot be deleted", group.getCode()));
        }

        groupRepository.delete(tenantId, groupId);
        log.info("Account group deleted: tenantId={}, groupId={}, code={}", tenantId, groupId, group.getCode());
    }

    @Transactional(readOnly = true)
    public AccountGroup getGroup(long tenantId, UUID groupId) {
        return groupRepository.findById(tenantId, groupId)
            .orElseThrow(() -> new ResourceNotFoundException("AccountGroup", groupId));
    }

    /**
     * Lists groups of one level, optionally restricted to the children of one parent.
     */
    @Transactional(readOnly = true)
    public List<AccountGroup> listGroups(long tenantId, GroupLevel level, UUID parentId) {
        List<AccountGroup> groups;
        if (parentId != null) {
            groups = groupRepository.findChildren(tenantId, parentId);
        } else if (level != null) {
            groups = groupRepository.findByLevel(tenantId, level);
        } else {
            groups = groupRepository.findAllByTenant(tenantId);
        }
        return groups.stream()
            .filter(group -> level == null || group.getLevel() == level)
            .toList();
    }

    @Transactional(readOnly = true)
    public ChartOfAccountsTree loadTree(long tenantId) {
        return ChartOfAccountsTree.of(groupRepository.findAllByTenant(tenantId));
    }

    // ==================== Accounts ====================

    /**
     * Creates an account with a generated code of the form {@code {detailedGroupCode}.{nnn}}.
     */
    @Transactional
    public Account createAccount(long tenantId, UUID detailedGroupId, String accountName,
                                 String description, BigDecimal openingBalance) {
        AccountGroup detailedGroup = requireDetailedGroup(tenantId, detailedGroupId);
        String code = nextAccountCode(tenantId, detailedGroup);
        return insertAccount(tenantId, detailedGroup, code, accountName, description,
            openingBalance, false, null);
    }

    /**
     * Creates an account with an explicit code. Used for system accounts and accounts
     * provisioned during postings.
     *
     * @throws DuplicateCodeException if the code is taken in the tenant
     */
    @Transactional
    public Account createAccount(long tenantId, UUID detailedGroupId, String accountName,
                                 String description, BigDecimal openingBalance,
                                 String accountCode, boolean systemAccount, Long linkedEntityId) {
        if (accountCode == null || accountCode.isBlank()) {
            throw new IllegalArgumentException("Account code is required");
        }
        AccountGroup detailedGroup = requireDetailedGroup(tenantId, detailedGroupId);
        if (accountRepository.existsByCode(tenantId, accountCode.trim())) {
            throw new DuplicateCodeException("Account code already in use: " + accountCode.trim());
        }
        return insertAccount(tenantId, detailedGroup, accountCode.trim(), accountName, description,
            openingBalance, systemAccount, linkedEntityId);
    }

    @Transactional
    public Account renameAccount(long tenantId, UUID accountId, String newName) {
        if (newName == null || newName.isBlank()) {
            throw new IllegalArgumentException("Account name is required");
        }
        Account account = getAccount(tenantId, accountId);
        if (account.isSystemAccount()) {
            log.warn("Rename rejected for system account: tenantId={}, accountId={}", tenantId, accountId);
            throw new SystemAccountProtectionException(accountId, "rename");
        }
        accountRepository.updateName(tenantId, accountId, newName.trim());
        log.info("Account renamed: tenantId={}, accountId={}, from='{}', to='{}'",
            tenantId, accountId, account.getAccountName(), newName.trim());
        return getAccount(tenantId, accountId);
    }

    @Transactional
    public Account setAccountActive(long tenantId, UUID accountId, boolean active) {
        getAccount(tenantId, accountId);
        accountRepository.updateActive(tenantId, accountId, active);
        log.info("Account {}: tenantId={}, accountId={}", active ? "activated" : "deactivated", tenantId, accountId);
        return getAccount(tenantId, accountId);
    }

    /**
     * Deletes an account that is not a system account and has no journal lines,
     * whether or not the entries holding them are posted.
     */
    @Transactional
    public void deleteAccount(long tenantId, UUID accountId) {
        Account account = getAccount(tenantId, accountId);
        if (account.isSystemAccount()) {
            log.warn("Delete rejected for system account: tenantId={}, accountId={}", tenantId, accountId);
            throw new SystemAccountProtectionException(accountId, "delete");
        }
        int lineCount = accountRepository.countJournalLines(tenantId, accountId);
        if (lineCount > 0) {
            log.warn("Delete rejected, account has journal lines: tenantId={}, accountId={}, lines={}",
                tenantId, accountId, lineCount);
            throw new ConstraintException(String.format(
                "Account %s is referenced by %d journal entry lines and cannot be deleted",
                account.getAccountCode(), lineCount));
        }
        accountRepository.delete(tenantId, accountId);
        log.info("Account deleted: tenantId={}, accountId={}, code={}", tenantId, accountId, account.getAccountCode());
    }

    @Transactional(readOnly = true)
    public Account getAccount(long tenantId, UUID accountId) {
        return accountRepository.findById(tenantId, accountId)
            .orElseThrow(() -> new ResourceNotFoundException("Account", accountId));
    }

    @Transactional(readOnly = true)
    public Optional<Account> findAccountByCode(long tenantId, String accountCode) {
        return accountRepository.findByCode(tenantId, accountCode);
    }

    // ==================== Helpers ====================

    private AccountGroup resolveParent(long tenantId, GroupLevel level, UUID parentId) {
        GroupLevel expectedParentLevel = level.parentLevel();
        if (expectedParentLevel == null) {
            if (parentId != null) {
                throw new IllegalArgumentException("Main groups cannot have a parent");
            }
            return null;
        }
        if (parentId == null) {
            throw new IllegalArgumentException(level + " requires a parent group");
        }
        AccountGroup parent = getGroup(tenantId, parentId);
        if (parent.getLevel() != expectedParentLevel) {
            throw new IllegalArgumentException(String.format(
                "Parent of a %s must be a %s, got %s", level, expectedParentLevel, parent.getLevel()));
        }
        return parent;
    }

    private String nextGroupCode(long tenantId, AccountGroup parent, GroupKind kind) {
        if (!kind.isCustom()) {
            return parent == null ? kind.getMnemonic() : parent.getCode() + "-" + kind.getMnemonic();
        }
        for (int attempt = 0; attempt < MAX_CODE_ATTEMPTS; attempt++) {
            byte[] suffix = new byte[CUSTOM_SUFFIX_BYTES];
            RANDOM.nextBytes(suffix);
            String code = parent.getCode() + "-" + HexFormat.of().withUpperCase().formatHex(suffix);
            if (!groupRepository.existsByCode(tenantId, code)) {
                return code;
            }
        }
        throw new IllegalStateException("Could not generate a free group code under " + parent.getCode());
    }

    private AccountGroup requireDetailedGroup(long tenantId, UUID detailedGroupId) {
        AccountGroup group = getGroup(tenantId, detailedGroupId);
        if (group.getLevel() != GroupLevel.DETAILED_GROUP) {
            throw new IllegalArgumentException(
                "Accounts can only be created under a detailed group, got " + group.getLevel());
        }
        return group;
    }

    private String nextAccountCode(long tenantId, AccountGroup detailedGroup) {
        int sequence = accountRepository.countByDetailedGroup(tenantId, detailedGroup.getId()) + 1;
        String code = formatAccountCode(detailedGroup, sequence);
        while (accountRepository.existsByCode(tenantId, code)) {
            sequence++;
            code = formatAccountCode(detailedGroup, sequence);
        }
        return code;
    }

    private static String formatAccountCode(AccountGroup detailedGroup, int sequence) {
        return detailedGroup.getCode() + "." + String.format("%0" + ACCOUNT_SEQUENCE_WIDTH + "d", sequence);
    }

    private Account insertAccount(long tenantId, AccountGroup detailedGroup, String code, String accountName,
                                  String description, BigDecimal openingBalance,
                                  boolean systemAccount, Long linkedEntityId) {
        if (accountName == null || accountName.isBlank()) {
            throw new IllegalArgumentException("Account name is required");
        }
        AccountType accountType = loadTree(tenantId).accountTypeOf(detailedGroup)
            .orElseThrow(() -> new IllegalStateException(
                "Detailed group " + detailedGroup.getCode() + " is not under an element group"));
        BigDecimal opening = openingBalance != null ? openingBalance : BigDecimal.ZERO;
        Instant now = Instant.now();

        Account account = Account.builder()
            .id(UUID.randomUUID())
            .tenantId(tenantId)
            .detailedGroupId(detailedGroup.getId())
            .accountCode(code)
            .accountName(accountName.trim())
            .accountType(accountType)
            .description(description)
            .linkedEntityId(linkedEntityId)
            .systemAccount(systemAccount)
            .active(true)
            .openingBalance(opening)
            .currentBalance(opening)
            .createdAt(now)
            .updatedAt(now)
            .build();

        try {
            accountRepository.insert(account);
        } catch (DuplicateKeyException e) {
            throw new DuplicateCodeException("Account code already in use: " + code, e);
        }
        outboxService.saveEvent(AccountCreatedEvent.fromAccount(account));

        log.info("Account created: tenantId={}, accountId={}, code={}, type={}, system={}",
            tenantId, account.getId(), code, accountType, systemAccount);
        return account;
    }
}
