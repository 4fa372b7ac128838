package com.flagship.cash_ledger.identity;

import com.flagship.cash_ledger.ingest.RawEvent;
import com.flagship.cash_ledger.ingest.RawEventKind;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * An identity together with the raw events that back it.
 *
 * Attribute accessors read from the primary event: the first linked event of
 * the kind that natively describes the identity (a bank record for a
 * settlement, a payout record for a payout), otherwise the first linked event.
 */
@Value
public class IdentitySnapshot {
    Identity identity;
    List<RawEvent> events;

    public UUID getId() {
        return identity.getId();
    }

    public CanonicalKind getKind() {
        return identity.getCanonicalKind();
    }

    public RawEvent primaryEvent() {
        RawEventKind nativeKind = nativeKind(identity.getCanonicalKind());
        return events.stream()
            .filter(e -> e.getKind() == nativeKind)
            .findFirst()
            .orElse(events.isEmpty() ? null : events.get(0));
    }

    public boolean hasNativeEvent() {
        RawEventKind nativeKind = nativeKind(identity.getCanonicalKind());
        return events.stream().anyMatch(e -> e.getKind() == nativeKind);
    }

    public BigDecimal amount() {
        return primaryEvent().getAmount();
    }

    public String currency() {
        return primaryEvent().getCurrency();
    }

    public Instant occurredAt() {
        return primaryEvent().getOccurredAt();
    }

    public LocalDate occurredOn() {
        return LocalDate.ofInstant(occurredAt(), ZoneOffset.UTC);
    }

    public String source() {
        return primaryEvent().getSource();
    }

    public String counterparty() {
        return primaryEvent().getCounterparty();
    }

    /** Source-native identifiers of every linked event. */
    public Set<String> externalIds() {
        Set<String> ids = new LinkedHashSet<>();
        events.forEach(e -> ids.add(e.getExternalId()));
        return ids;
    }

    public List<UUID> rawEventIds() {
        return events.stream().map(RawEvent::getId).toList();
    }

    private static RawEventKind nativeKind(CanonicalKind kind) {
        return switch (kind) {
            case SETTLEMENT -> RawEventKind.BANK_TRANSACTION;
            case PAYOUT -> RawEventKind.PAYOUT;
            case CHARGE, FEE, REFUND -> RawEventKind.BALANCE_TRANSACTION;
            case INVOICE -> RawEventKind.OPS_INVOICE;
            case PAYMENT -> RawEventKind.OPS_PAYMENT;
        };
    }
}
