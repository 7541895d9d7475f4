package com.flagship.practice_ledger.chartimport;

import lombok.Value;

import java.util.List;

@Value
public class ChartImportReport {
    List<ChartImportRowResult> rows;

    public long successCount() {
        return rows.stream().filter(ChartImportRowResult::isSuccess).count();
    }

    public long failureCount() {
        return rows.size() - successCount();
    }

    public List<ChartImportRowResult> failures() {
        return rows.stream().filter(row -> !row.isSuccess()).toList();
    }
}
