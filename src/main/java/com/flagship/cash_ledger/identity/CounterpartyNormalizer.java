package com.flagship.cash_ledger.identity;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Normalizes bank and processor descriptors so that the same counterparty
 * reads the same regardless of which feed reported it.
 *
 * "STRIPE TRANSFER 000123456 ACME LLC" and "Acme, LLC - Stripe Payout" both
 * normalize to {@code "acme"}: tokens that only name the rail or the legal form
 * are dropped, as are trace numbers.
 */
public final class CounterpartyNormalizer {

    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9]+");
    private static final Pattern TRACE_NUMBER = Pattern.compile("^\\d{6,}$");

    static final Set<String> PROCESSOR_TOKENS = Set.of(
        "stripe", "square", "sq", "paypal", "pp", "jobber", "jobberpay",
        "transfer", "payout", "ach", "deposit", "ppd", "id", "des", "co", "inc", "llc"
    );

    private CounterpartyNormalizer() {
    }

    /**
     * Lower-cased, punctuation-free descriptor with rail tokens and trace numbers removed.
     * Returns an empty string when nothing meaningful is left.
     */
    public static String normalize(String descriptor) {
        List<String> kept = new ArrayList<>();
        for (String token : tokens(descriptor)) {
            if (PROCESSOR_TOKENS.contains(token) || TRACE_NUMBER.matcher(token).matches()) {
                continue;
            }
            kept.add(token);
        }
        return String.join(" ", kept);
    }

    /**
     * Lower-cased alphanumeric tokens, nothing dropped.
     */
    public static List<String> tokens(String descriptor) {
        if (descriptor == null || descriptor.isBlank()) {
            return List.of();
        }
        String cleaned = NON_ALPHANUMERIC.matcher(descriptor.toLowerCase(Locale.ROOT)).replaceAll(" ").trim();
        if (cleaned.isEmpty()) {
            return List.of();
        }
        return Arrays.asList(cleaned.split(" "));
    }
}
