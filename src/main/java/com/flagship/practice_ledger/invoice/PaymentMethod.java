package com.flagship.practice_ledger.invoice;

import com.flagship.practice_ledger.resolver.AccountRequest;

/**
 * How a payment was received. Cash goes to cash in hand, everything else to the bank.
 */
public enum PaymentMethod {
    CASH,
    BANK_TRANSFER,
    CHEQUE,
    CARD,
    ONLINE;

    public AccountRequest cashAccountRequest() {
        return this == CASH ? AccountRequest.cashInHand() : AccountRequest.cashAtBank();
    }
}
