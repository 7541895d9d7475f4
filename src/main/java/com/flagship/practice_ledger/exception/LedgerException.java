package com.flagship.practice_ledger.exception;

/**
 * Base type for business failures raised by the ledger core.
 *
 * All ledger failures are unchecked so that they roll back the surrounding
 * {@code @Transactional} boundary without extra configuration.
 */
public abstract class LedgerException extends RuntimeException {

    protected LedgerException(String message) {
        super(message);
    }

    protected LedgerException(String message, Throwable cause) {
        super(message, cause);
    }
}
