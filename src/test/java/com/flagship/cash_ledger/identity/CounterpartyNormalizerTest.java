package com.flagship.cash_ledger.identity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CounterpartyNormalizerTest {

    @Test
    @DisplayName("Rail tokens, legal forms and trace numbers are dropped")
    void dropsNoiseTokens() {
        assertEquals("acme", CounterpartyNormalizer.normalize("STRIPE TRANSFER 000123456 ACME LLC"));
        assertEquals("acme", CounterpartyNormalizer.normalize("Acme, LLC - Stripe Payout"));
        assertEquals("joe s plumbing", CounterpartyNormalizer.normalize("Joe's Plumbing"));
    }

    @Test
    @DisplayName("Blank or noise-only descriptors normalize to empty")
    void emptyDescriptors() {
        assertEquals("", CounterpartyNormalizer.normalize(null));
        assertEquals("", CounterpartyNormalizer.normalize("   "));
        assertEquals("", CounterpartyNormalizer.normalize("ACH DEPOSIT 12345678"));
    }

    @Test
    @DisplayName("Tokens keep every word")
    void tokensKeepEverything() {
        assertEquals(List.of("stripe", "payout", "acme"), CounterpartyNormalizer.tokens("Stripe-Payout  ACME"));
        assertTrue(CounterpartyNormalizer.tokens("--").isEmpty());
    }
}
