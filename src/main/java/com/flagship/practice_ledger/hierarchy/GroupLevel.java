package com.flagship.practice_ledger.hierarchy;

/**
 * The four group levels of the chart of accounts. Accounts hang off DETAILED_GROUP.
 */
public enum GroupLevel {
    MAIN_GROUP,
    ELEMENT_GROUP,
    SUB_ELEMENT_GROUP,
    DETAILED_GROUP;

    /**
     * Level a parent of this level must have, or null for the root level.
     */
    public GroupLevel parentLevel() {
        return switch (this) {
            case MAIN_GROUP -> null;
            case ELEMENT_GROUP -> MAIN_GROUP;
            case SUB_ELEMENT_GROUP -> ELEMENT_GROUP;
            case DETAILED_GROUP -> SUB_ELEMENT_GROUP;
        };
    }

    public boolean allowsCustomKind() {
        return this == SUB_ELEMENT_GROUP || this == DETAILED_GROUP;
    }
}
