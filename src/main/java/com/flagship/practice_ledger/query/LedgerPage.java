package com.flagship.practice_ledger.query;

import com.flagship.practice_ledger.hierarchy.Account;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * A page of an account ledger. {@code runningBalance} is the balance after the last row
 * of this page, or after all earlier rows when the page is empty.
 */
@Value
@Builder
public class LedgerPage {
    Account account;
    BigDecimal openingBalance;
    List<LedgerRow> rows;
    BigDecimal runningBalance;
    int page;
    int pageSize;
    long totalRows;

    public int totalPages() {
        return pageSize == 0 ? 0 : (int) ((totalRows + pageSize - 1) / pageSize);
    }

    public boolean hasNext() {
        return (long) (page + 1) * pageSize < totalRows;
    }
}
