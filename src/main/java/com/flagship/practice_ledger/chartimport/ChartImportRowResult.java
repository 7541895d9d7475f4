package com.flagship.practice_ledger.chartimport;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.List;
import java.util.UUID;

/**
 * Outcome of one import row. Rows are numbered from 1 in submission order.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ChartImportRowResult {
    int rowNumber;
    boolean success;
    UUID accountId;
    String accountCode;
    List<UUID> createdGroupIds;
    String error;

    public static ChartImportRowResult success(int rowNumber, UUID accountId, String accountCode,
                                               List<UUID> createdGroupIds) {
        return new ChartImportRowResult(rowNumber, true, accountId, accountCode,
            List.copyOf(createdGroupIds), null);
    }

    public static ChartImportRowResult failure(int rowNumber, String error) {
        return new ChartImportRowResult(rowNumber, false, null, null, List.of(), error);
    }
}
