package com.flagship.practice_ledger.exception;

/**
 * Raised when a delete is blocked by a dependent group, account or journal line.
 */
public class ConstraintException extends LedgerException {

    public ConstraintException(String message) {
        super(message);
    }
}
