package com.flagship.cash_ledger.ingest.payload;

/**
 * Source-specific detail of a raw event. The concrete type is chosen by the
 * event kind, so the stored JSON needs no type discriminator.
 */
public interface EventPayload {
}
