package com.flagship.practice_ledger.hierarchy;

import java.math.BigDecimal;

/**
 * Account classification, derived from the element group an account sits under.
 *
 * Sign convention for balances:
 * ASSET and EXPENSE increase on debit; LIABILITY, EQUITY and REVENUE increase on credit.
 */
public enum AccountType {
    ASSET(true),
    LIABILITY(false),
    EQUITY(false),
    REVENUE(false),
    EXPENSE(true);

    private final boolean debitNormal;

    AccountType(boolean debitNormal) {
        this.debitNormal = debitNormal;
    }

    public boolean isDebitNormal() {
        return debitNormal;
    }

    /**
     * Signed effect of one line on a balance of this type.
     */
    public BigDecimal movement(BigDecimal debitAmount, BigDecimal creditAmount) {
        BigDecimal net = debitAmount.subtract(creditAmount);
        return debitNormal ? net : net.negate();
    }
}
