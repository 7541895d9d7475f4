package com.flagship.practice_ledger.resolver;

import com.flagship.practice_ledger.hierarchy.AccountGroup;
import com.flagship.practice_ledger.hierarchy.ChartOfAccountsTree;
import com.flagship.practice_ledger.hierarchy.GroupKind;
import com.flagship.practice_ledger.hierarchy.GroupLevel;

import java.util.Arrays;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * One step of a role's group fallback chain: picks a detailed group to provision into.
 *
 * Tiers are tried in order and the first one that finds a group wins. Within a tier the
 * tree is searched depth-first in creation order, so the choice is deterministic.
 */
@FunctionalInterface
public interface GroupFallbackTier {

    Optional<AccountGroup> locate(ChartOfAccountsTree tree);

    /**
     * A detailed group under the given element kind that has one of the predefined kinds
     * or whose name contains one of the fragments.
     */
    static GroupFallbackTier detailedOfKindOrNamed(GroupKind elementKind, GroupKind detailedKind, String... nameFragments) {
        Predicate<AccountGroup> byName = group -> group.getKind() == detailedKind
                || Arrays.stream(nameFragments).anyMatch(group::nameContains);
        return tree -> tree.elementGroups(elementKind).stream()
                .map(element -> tree.firstDetailedGroupUnder(element, byName))
                .flatMap(Optional::stream)
                .findFirst();
    }

    /**
     * A detailed group under the given element kind whose name contains one of the fragments.
     */
    static GroupFallbackTier detailedNamed(GroupKind elementKind, String... nameFragments) {
        Predicate<AccountGroup> byName = group -> Arrays.stream(nameFragments).anyMatch(group::nameContains);
        return tree -> tree.elementGroups(elementKind).stream()
                .map(element -> tree.firstDetailedGroupUnder(element, byName))
                .flatMap(Optional::stream)
                .findFirst();
    }

    /**
     * Any detailed group under a sub-element of the given kind.
     */
    static GroupFallbackTier anyDetailedUnderSubElement(GroupKind subElementKind) {
        return tree -> tree.atLevel(GroupLevel.SUB_ELEMENT_GROUP).stream()
                .filter(sub -> sub.getKind() == subElementKind)
                .map(sub -> tree.firstDetailedGroupUnder(sub, group -> true))
                .flatMap(Optional::stream)
                .findFirst();
    }

    /**
     * The first detailed group anywhere under an element group of the given kind.
     */
    static GroupFallbackTier anyDetailedUnderElement(GroupKind elementKind) {
        return tree -> tree.elementGroups(elementKind).stream()
                .map(element -> tree.firstDetailedGroupUnder(element, group -> true))
                .flatMap(Optional::stream)
                .findFirst();
    }
}
