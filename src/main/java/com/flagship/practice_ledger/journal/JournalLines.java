package com.flagship.practice_ledger.journal;

import com.flagship.practice_ledger.exception.UnbalancedEntryException;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Validation and normalization of submitted journal lines.
 */
public final class JournalLines {

    public static final BigDecimal DEFAULT_EPSILON = new BigDecimal("0.0001");

    private JournalLines() {
    }

    /**
     * Lines after validation: ordered by line order, with their totals and distinct accounts.
     */
    public record Validated(List<LineRequest> lines, BigDecimal totalDebit, BigDecimal totalCredit,
                            Set<UUID> accountIds) {
    }

    /**
     * Validates a line set.
     *
     * @throws IllegalArgumentException if there are no lines, an account is missing, an amount is
     *                                  negative, or two lines claim the same order
     * @throws UnbalancedEntryException if debit and credit totals differ by more than epsilon
     */
    public static Validated validate(List<LineRequest> lines, BigDecimal epsilon) {
        if (lines == null || lines.isEmpty()) {
            throw new IllegalArgumentException("A journal entry needs at least one line");
        }

        List<LineRequest> ordered = new ArrayList<>(lines.size());
        Set<Integer> usedOrders = new HashSet<>();
        Set<UUID> accountIds = new LinkedHashSet<>();
        BigDecimal totalDebit = BigDecimal.ZERO;
        BigDecimal totalCredit = BigDecimal.ZERO;

        for (int i = 0; i < lines.size(); i++) {
            LineRequest line = lines.get(i);
            if (line.getAccountId() == null) {
                throw new IllegalArgumentException("Line " + (i + 1) + " has no account");
            }
            BigDecimal debit = line.getDebitAmount() != null ? line.getDebitAmount() : BigDecimal.ZERO;
            BigDecimal credit = line.getCreditAmount() != null ? line.getCreditAmount() : BigDecimal.ZERO;
            if (debit.signum() < 0 || credit.signum() < 0) {
                throw new IllegalArgumentException("Line " + (i + 1) + " has a negative amount");
            }

            int order = line.getLineOrder() != null ? line.getLineOrder() : i + 1;
            if (order < 1) {
                throw new IllegalArgumentException("Line order must be positive, got " + order);
            }
            if (!usedOrders.add(order)) {
                throw new IllegalArgumentException("Duplicate line order " + order);
            }

            ordered.add(new LineRequest(line.getAccountId(), debit, credit, order, line.getDescription()));
            accountIds.add(line.getAccountId());
            totalDebit = totalDebit.add(debit);
            totalCredit = totalCredit.add(credit);
        }

        if (!isBalanced(totalDebit, totalCredit, epsilon)) {
            throw new UnbalancedEntryException(totalDebit, totalCredit);
        }

        ordered.sort(Comparator.comparing(LineRequest::getLineOrder));
        return new Validated(List.copyOf(ordered), totalDebit, totalCredit, Set.copyOf(accountIds));
    }

    public static boolean isBalanced(BigDecimal totalDebit, BigDecimal totalCredit, BigDecimal epsilon) {
        return totalDebit.subtract(totalCredit).abs().compareTo(epsilon) <= 0;
    }
}
