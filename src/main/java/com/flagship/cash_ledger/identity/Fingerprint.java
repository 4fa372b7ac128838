package com.flagship.cash_ledger.identity;

import lombok.Value;

/**
 * Deterministic, source-independent key of a raw event.
 */
@Value
public class Fingerprint {

    public static final double FULL_CONFIDENCE = 1.0;
    public static final double LOW_CONFIDENCE = 0.5;

    /** SHA-256 hex of the normalized parts. */
    String key;
    CanonicalKind canonicalKind;
    double confidence;
    /** Human-readable account of which inputs went into the key. */
    String reason;

    public boolean isLowConfidence() {
        return confidence < FULL_CONFIDENCE;
    }
}
