package com.flagship.cash_ledger.matching;

import com.flagship.cash_ledger.identity.IdentitySnapshot;
import com.flagship.cash_ledger.ingest.RawEvent;
import com.flagship.cash_ledger.ingest.payload.PayoutPayload;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Readings of a payout identity shared by the matchers and payout queries.
 * Only meaningful for a payout snapshot with a native payout record.
 */
public final class PayoutFacts {

    private PayoutFacts() {
    }

    public static PayoutPayload payload(IdentitySnapshot payout) {
        PayoutPayload payload = payout.primaryEvent().payloadAs(PayoutPayload.class);
        return payload != null ? payload : new PayoutPayload();
    }

    /** Expected bank arrival; the creation day when the processor did not say. */
    public static LocalDate expectedArrival(IdentitySnapshot payout) {
        LocalDate arrival = payload(payout).getArrivalDate();
        return arrival != null ? arrival : payout.occurredOn();
    }

    /** Net amount the bank should see. */
    public static BigDecimal netAmount(IdentitySnapshot payout) {
        return payout.primaryEvent().getAmount();
    }

    /** What the composed line items must add up to. */
    public static BigDecimal compositionTarget(IdentitySnapshot payout) {
        BigDecimal gross = payload(payout).getGrossAmount();
        return gross != null ? gross : netAmount(payout);
    }

    /** Tokens a bank descriptor for this payout is likely to share. */
    public static String descriptor(IdentitySnapshot payout) {
        RawEvent event = payout.primaryEvent();
        StringBuilder text = new StringBuilder(event.getSource()).append(' ').append(event.getExternalId());
        if (event.getCounterparty() != null) {
            text.append(' ').append(event.getCounterparty());
        }
        return text.toString();
    }
}
