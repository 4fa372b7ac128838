package com.flagship.cash_ledger.common.exception;

/**
 * Requested exception, identity or tenant resource does not exist. Maps to 404.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }
}
