package com.flagship.cash_ledger.identity;

import com.flagship.cash_ledger.ingest.RawEvent;
import com.flagship.cash_ledger.ingest.payload.BalanceTransactionPayload;
import com.flagship.cash_ledger.ingest.payload.BalanceTransactionType;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Maps a raw event to its identity fingerprint.
 *
 * Pure and deterministic: the same event always yields the same key, and no
 * source-specific identifier participates in the key of a bank record. Each
 * key starts with a kind tag so fingerprints of different kinds never collide.
 */
@Component
public class FingerprintEngine {

    private static final String SEPARATOR = "|";

    public Fingerprint fingerprint(RawEvent event) {
        return switch (event.getKind()) {
            case BANK_TRANSACTION -> bankSettlement(event);
            case PAYOUT -> payout(event.getSource(), event.getExternalId(), "payout " + event.getExternalId());
            case BALANCE_TRANSACTION -> balanceTransaction(event);
            case OPS_PAYMENT -> operational(event, CanonicalKind.PAYMENT);
            case OPS_INVOICE -> operational(event, CanonicalKind.INVOICE);
        };
    }

    private Fingerprint bankSettlement(RawEvent event) {
        String account = normalizeAccount(event.getAccountRef());
        String amount = event.getAmount().abs().stripTrailingZeros().toPlainString();
        LocalDate day = LocalDate.ofInstant(event.getOccurredAt(), ZoneOffset.UTC);
        String counterparty = CounterpartyNormalizer.normalize(event.getCounterparty());

        List<String> missing = new ArrayList<>();
        if (account.isEmpty()) {
            missing.add("account reference");
        }
        if (counterparty.isEmpty()) {
            missing.add("counterparty");
        }

        String key = hash("settlement", account, amount, day.toString(), counterparty);
        if (missing.isEmpty()) {
            return new Fingerprint(key, CanonicalKind.SETTLEMENT, Fingerprint.FULL_CONFIDENCE,
                String.format("bank record: account, amount %s, day %s, counterparty '%s'", amount, day, counterparty));
        }
        return new Fingerprint(key, CanonicalKind.SETTLEMENT, Fingerprint.LOW_CONFIDENCE,
            String.format("bank record missing %s: amount %s, day %s", String.join(" and ", missing), amount, day));
    }

    private Fingerprint balanceTransaction(RawEvent event) {
        BalanceTransactionPayload payload = event.payloadAs(BalanceTransactionPayload.class);
        BalanceTransactionType subType = payload.getSubType();

        if (subType == BalanceTransactionType.PAYOUT) {
            String payoutId = payload.getPayoutId() != null ? payload.getPayoutId() : event.getParentExternalId();
            if (payoutId == null) {
                payoutId = event.getExternalId();
            }
            return payout(event.getSource(), payoutId, "balance transaction referencing payout " + payoutId);
        }

        CanonicalKind kind = switch (subType) {
            case CHARGE -> CanonicalKind.CHARGE;
            case REFUND -> CanonicalKind.REFUND;
            case FEE -> CanonicalKind.FEE;
            case PAYOUT -> throw new IllegalStateException("handled above");
        };
        String key = hash("balance", subType.name().toLowerCase(Locale.ROOT), event.getSource(), event.getExternalId());
        return new Fingerprint(key, kind, Fingerprint.FULL_CONFIDENCE,
            String.format("%s %s from %s", subType.name().toLowerCase(Locale.ROOT), event.getExternalId(), event.getSource()));
    }

    private Fingerprint payout(String provider, String payoutId, String reason) {
        String key = hash("payout", provider, payoutId);
        return new Fingerprint(key, CanonicalKind.PAYOUT, Fingerprint.FULL_CONFIDENCE, reason + " from " + provider);
    }

    private Fingerprint operational(RawEvent event, CanonicalKind kind) {
        String tag = kind.name().toLowerCase(Locale.ROOT);
        String key = hash("ops", tag, event.getSource(), event.getExternalId());
        return new Fingerprint(key, kind, Fingerprint.FULL_CONFIDENCE,
            String.format("ops %s %s from %s", tag, event.getExternalId(), event.getSource()));
    }

    private static String normalizeAccount(String accountRef) {
        if (accountRef == null) {
            return "";
        }
        return accountRef.replaceAll("\\s+", "").toLowerCase(Locale.ROOT);
    }

    private static String hash(String... parts) {
        return DigestUtils.sha256Hex(String.join(SEPARATOR, parts));
    }
}
