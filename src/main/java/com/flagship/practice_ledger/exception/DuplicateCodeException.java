package com.flagship.practice_ledger.exception;

/**
 * Raised when an administrative create collides with an existing code or name
 * within the same scope.
 */
public class DuplicateCodeException extends LedgerException {

    public DuplicateCodeException(String message) {
        super(message);
    }

    public DuplicateCodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
