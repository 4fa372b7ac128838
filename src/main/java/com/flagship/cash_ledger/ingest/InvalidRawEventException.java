package com.flagship.cash_ledger.ingest;

/**
 * A single inbound record violates the schema or a data-integrity rule.
 * Fatal for that record only.
 */
public class InvalidRawEventException extends IllegalArgumentException {

    private final String externalId;

    public InvalidRawEventException(String externalId, String message) {
        super(message);
        this.externalId = externalId;
    }

    public InvalidRawEventException(String externalId, String message, Throwable cause) {
        super(message, cause);
        this.externalId = externalId;
    }

    public String getExternalId() {
        return externalId;
    }
}
