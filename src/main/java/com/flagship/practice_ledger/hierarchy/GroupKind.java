package com.flagship.practice_ledger.hierarchy;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Predefined group names per level, plus CUSTOM for free-text sub-element and
 * detailed groups. The mnemonic is appended to the parent code to build a node code.
 */
public enum GroupKind {
    // Main groups
    BALANCE_SHEET(GroupLevel.MAIN_GROUP, "BS"),
    PROFIT_AND_LOSS(GroupLevel.MAIN_GROUP, "PL"),

    // Element groups
    ASSETS(GroupLevel.ELEMENT_GROUP, "A"),
    LIABILITIES(GroupLevel.ELEMENT_GROUP, "L"),
    EQUITY(GroupLevel.ELEMENT_GROUP, "E"),
    INCOMES(GroupLevel.ELEMENT_GROUP, "I"),
    EXPENSES(GroupLevel.ELEMENT_GROUP, "X"),

    // Sub-element groups
    CAPITAL(GroupLevel.SUB_ELEMENT_GROUP, "C"),
    SHARE_CAPITAL(GroupLevel.SUB_ELEMENT_GROUP, "SC"),
    RESERVES(GroupLevel.SUB_ELEMENT_GROUP, "R"),
    NON_CURRENT_LIABILITIES(GroupLevel.SUB_ELEMENT_GROUP, "NCL"),
    CURRENT_LIABILITIES(GroupLevel.SUB_ELEMENT_GROUP, "CL"),
    NON_CURRENT_ASSETS(GroupLevel.SUB_ELEMENT_GROUP, "NCA"),
    CURRENT_ASSETS(GroupLevel.SUB_ELEMENT_GROUP, "CA"),
    SALES(GroupLevel.SUB_ELEMENT_GROUP, "S"),
    SERVICE_REVENUE(GroupLevel.SUB_ELEMENT_GROUP, "SR"),
    COST_OF_SALES(GroupLevel.SUB_ELEMENT_GROUP, "COS"),
    COST_OF_SERVICE_REVENUE(GroupLevel.SUB_ELEMENT_GROUP, "COSR"),
    PURCHASE_RETURNS(GroupLevel.SUB_ELEMENT_GROUP, "PR"),

    // Detailed groups
    OWNERS_CAPITAL(GroupLevel.DETAILED_GROUP, "OC"),
    LONG_TERM_LOANS(GroupLevel.DETAILED_GROUP, "LTL"),
    SHORT_TERM_LOANS(GroupLevel.DETAILED_GROUP, "STL"),
    TRADE_CREDITORS(GroupLevel.DETAILED_GROUP, "TC"),
    ACCRUED_CHARGES(GroupLevel.DETAILED_GROUP, "AC"),
    OTHER_PAYABLES(GroupLevel.DETAILED_GROUP, "OP"),
    PROPERTY_PLANT_EQUIPMENT(GroupLevel.DETAILED_GROUP, "PPE"),
    INTANGIBLE_ASSETS(GroupLevel.DETAILED_GROUP, "IA"),
    STOCK_IN_TRADE(GroupLevel.DETAILED_GROUP, "SIT"),
    TRADE_DEBTORS(GroupLevel.DETAILED_GROUP, "TD"),
    ADVANCES_PREPAYMENTS(GroupLevel.DETAILED_GROUP, "AP"),
    OTHER_RECEIVABLES(GroupLevel.DETAILED_GROUP, "OR"),
    CASH_BANK_BALANCES(GroupLevel.DETAILED_GROUP, "CB"),

    CUSTOM(null, null);

    private final GroupLevel level;
    private final String mnemonic;

    GroupKind(GroupLevel level, String mnemonic) {
        this.level = level;
        this.mnemonic = mnemonic;
    }

    public String getMnemonic() {
        return mnemonic;
    }

    public boolean isCustom() {
        return this == CUSTOM;
    }

    /**
     * Whether this kind may be used for a node at the given level.
     */
    public boolean belongsTo(GroupLevel candidate) {
        return isCustom() ? candidate.allowsCustomKind() : level == candidate;
    }

    /**
     * Account type implied by an element-group kind.
     */
    public Optional<AccountType> impliedAccountType() {
        return switch (this) {
            case ASSETS -> Optional.of(AccountType.ASSET);
            case LIABILITIES -> Optional.of(AccountType.LIABILITY);
            case EQUITY -> Optional.of(AccountType.EQUITY);
            case INCOMES -> Optional.of(AccountType.REVENUE);
            case EXPENSES -> Optional.of(AccountType.EXPENSE);
            default -> Optional.empty();
        };
    }

    /**
     * Main group an element-group kind must sit under.
     */
    public Optional<GroupKind> requiredMainGroup() {
        return switch (this) {
            case ASSETS, LIABILITIES, EQUITY -> Optional.of(BALANCE_SHEET);
            case INCOMES, EXPENSES -> Optional.of(PROFIT_AND_LOSS);
            default -> Optional.empty();
        };
    }

    /**
     * Human readable label, e.g. "Trade Debtors".
     */
    public String label() {
        String[] words = name().toLowerCase(Locale.ROOT).split("_");
        StringBuilder sb = new StringBuilder();
        for (String word : words) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1));
        }
        return sb.toString();
    }

    /**
     * Matches a free-text group name ("Current Assets", "current_assets",
     * "Cash & Bank Balances") against the predefined kinds of a level.
     * Case, punctuation and the word "and" are ignored.
     */
    public static Optional<GroupKind> fromName(GroupLevel level, String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String normalized = normalize(name);
        return Arrays.stream(values())
                .filter(kind -> !kind.isCustom() && kind.level == level)
                .filter(kind -> normalize(kind.name()).equals(normalized))
                .findFirst();
    }

    static String normalize(String name) {
        return Arrays.stream(name.trim().toUpperCase(Locale.ROOT).split("[^A-Z0-9]+"))
                .filter(word -> !word.isEmpty() && !word.equals("AND"))
                .collect(Collectors.joining("_"));
    }
}
