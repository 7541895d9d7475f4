package com.flagship.practice_ledger.hierarchy;

import lombok.Value;

import java.time.Instant;
import java.util.Locale;
import java.util.UUID;

/**
 * A node of the chart of accounts at one of the four group levels.
 *
 * Nodes are only created through a parent, so the hierarchy is a tree by construction.
 */
@Value
public class AccountGroup {
    UUID id;
    long tenantId;
    UUID parentId;          // null for main groups
    GroupLevel level;
    GroupKind kind;
    String customName;      // only for CUSTOM kind
    String code;
    String description;
    Instant createdAt;

    /**
     * Display name: the custom name for custom nodes, otherwise the kind label.
     */
    public String getName() {
        return kind.isCustom() ? customName : kind.label();
    }

    /**
     * Case-insensitive check of the display name and the enum name against a fragment,
     * e.g. "receivable" or "trade_debtors".
     */
    public boolean nameContains(String fragment) {
        String needle = fragment.toLowerCase(Locale.ROOT);
        return getName().toLowerCase(Locale.ROOT).contains(needle)
                || kind.name().toLowerCase(Locale.ROOT).contains(needle);
    }

    /**
     * Whether this node represents the given name: the same predefined kind,
     * or a custom node with the same name (case-insensitive).
     */
    public boolean matches(GroupKind otherKind, String otherCustomName) {
        if (kind != otherKind) {
            return false;
        }
        return !kind.isCustom() || customName.equalsIgnoreCase(otherCustomName.trim());
    }
}
