package com.flagship.practice_ledger.hierarchy;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Predicate;

/**
 * In-memory view of one tenant's group hierarchy: the nodes indexed by id and by parent.
 *
 * Built from a single query per resolution instead of walking the table level by level.
 * Children keep the order in which they were loaded (creation order), which makes every
 * "first group found" lookup deterministic.
 */
public final class ChartOfAccountsTree {

    private final Map<UUID, AccountGroup> nodes = new LinkedHashMap<>();
    private final Map<UUID, List<AccountGroup>> childrenByParent = new LinkedHashMap<>();
    private final List<AccountGroup> roots = new ArrayList<>();

    private ChartOfAccountsTree(List<AccountGroup> groups) {
        for (AccountGroup group : groups) {
            nodes.put(group.getId(), group);
        }
        for (AccountGroup group : groups) {
            if (group.getParentId() == null) {
                roots.add(group);
            } else {
                childrenByParent.computeIfAbsent(group.getParentId(), k -> new ArrayList<>()).add(group);
            }
        }
    }

    public static ChartOfAccountsTree of(List<AccountGroup> groups) {
        return new ChartOfAccountsTree(groups);
    }

    public Optional<AccountGroup> get(UUID id) {
        return Optional.ofNullable(nodes.get(id));
    }

    public List<AccountGroup> roots() {
        return Collections.unmodifiableList(roots);
    }

    public List<AccountGroup> children(UUID parentId) {
        return Collections.unmodifiableList(childrenByParent.getOrDefault(parentId, List.of()));
    }

    public Optional<AccountGroup> parent(AccountGroup node) {
        return node.getParentId() == null ? Optional.empty() : get(node.getParentId());
    }

    /**
     * Walks up from a node to its ancestor at the given level (or the node itself).
     */
    public Optional<AccountGroup> ancestorAt(AccountGroup node, GroupLevel level) {
        AccountGroup current = node;
        while (current != null) {
            if (current.getLevel() == level) {
                return Optional.of(current);
            }
            current = current.getParentId() == null ? null : nodes.get(current.getParentId());
        }
        return Optional.empty();
    }

    /**
     * Account type of a detailed group, from the element group above it.
     */
    public Optional<AccountType> accountTypeOf(AccountGroup detailedGroup) {
        return ancestorAt(detailedGroup, GroupLevel.ELEMENT_GROUP)
                .flatMap(element -> element.getKind().impliedAccountType());
    }

    /**
     * Finds the child of a parent (or a root when parentId is null) representing the
     * given kind or custom name.
     */
    public Optional<AccountGroup> findChild(UUID parentId, GroupKind kind, String customName) {
        List<AccountGroup> candidates = parentId == null ? roots : children(parentId);
        return candidates.stream()
                .filter(candidate -> candidate.matches(kind, customName))
                .findFirst();
    }

    /**
     * All nodes of one level, in load order.
     */
    public List<AccountGroup> atLevel(GroupLevel level) {
        return nodes.values().stream()
                .filter(node -> node.getLevel() == level)
                .toList();
    }

    /**
     * Depth-first, creation-ordered search for the first detailed group below the given
     * node (inclusive) matching the predicate.
     */
    public Optional<AccountGroup> firstDetailedGroupUnder(AccountGroup node, Predicate<AccountGroup> predicate) {
        Deque<AccountGroup> stack = new ArrayDeque<>();
        stack.push(node);
        while (!stack.isEmpty()) {
            AccountGroup current = stack.pop();
            if (current.getLevel() == GroupLevel.DETAILED_GROUP) {
                if (predicate.test(current)) {
                    return Optional.of(current);
                }
                continue;
            }
            List<AccountGroup> children = children(current.getId());
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return Optional.empty();
    }

    /**
     * All element groups of the given kind, across main groups.
     */
    public List<AccountGroup> elementGroups(GroupKind kind) {
        return atLevel(GroupLevel.ELEMENT_GROUP).stream()
                .filter(node -> node.getKind() == kind)
                .toList();
    }

    public int size() {
        return nodes.size();
    }
}
