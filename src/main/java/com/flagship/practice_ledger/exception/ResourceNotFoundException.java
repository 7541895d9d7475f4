package com.flagship.practice_ledger.exception;

import lombok.Getter;

/**
 * Raised when an id is unknown within the tenant scope.
 */
@Getter
public class ResourceNotFoundException extends LedgerException {

    private final String resourceType;
    private final Object resourceId;

    public ResourceNotFoundException(String resourceType, Object resourceId) {
        super(String.format("%s not found: %s", resourceType, resourceId));
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }
}
