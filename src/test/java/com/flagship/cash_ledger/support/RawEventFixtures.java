package com.flagship.cash_ledger.support;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flagship.cash_ledger.ingest.dto.RawEventCommand;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.UUID;

/**
 * Builders for connector records used across the integration tests.
 */
public final class RawEventFixtures {

    public static final String BANK = "chase";
    public static final String PROCESSOR = "stripe";
    public static final String OPS = "jobber";
    public static final String ACCOUNT = "acct-001";

    private RawEventFixtures() {
    }

    /** Tests share one application context, so each test works in its own tenant. */
    public static String newTenant() {
        return "tenant-" + UUID.randomUUID().toString().substring(0, 8);
    }

    /** ISO date {@code days} before today (UTC), for flows that run on the real clock. */
    public static String daysAgo(int days) {
        return LocalDate.now(ZoneOffset.UTC).minusDays(days).toString();
    }

    public static Instant at(String date) {
        return LocalDate.parse(date).atTime(12, 0).toInstant(ZoneOffset.UTC);
    }

    public static RawEventCommand bankDeposit(String externalId, String amount, String date, String counterparty) {
        ObjectNode payload = JsonNodeFactory.instance.objectNode();
        payload.put("bank_name", "Chase");
        payload.put("transaction_type", "credit");
        return RawEventCommand.builder()
            .source(BANK)
            .kind("BANK_TRANSACTION")
            .externalId(externalId)
            .occurredAt(at(date))
            .amount(new BigDecimal(amount))
            .currency("USD")
            .accountRef(ACCOUNT)
            .counterparty(counterparty)
            .payload(payload)
            .build();
    }

    public static RawEventCommand payout(String externalId, String net, String gross, String createdOn, String arrivalDate) {
        ObjectNode payload = JsonNodeFactory.instance.objectNode();
        if (arrivalDate != null) {
            payload.put("arrival_date", arrivalDate);
        }
        if (gross != null) {
            payload.put("gross_amount", new BigDecimal(gross));
        }
        payload.put("status", "paid");
        return RawEventCommand.builder()
            .source(PROCESSOR)
            .kind("PAYOUT")
            .externalId(externalId)
            .occurredAt(at(createdOn))
            .amount(new BigDecimal(net))
            .currency("USD")
            .counterparty("STRIPE PAYOUT")
            .payload(payload)
            .build();
    }

    public static RawEventCommand balanceTransaction(String externalId, String subType, String amount,
                                                     String date, String payoutId, String counterparty) {
        ObjectNode payload = JsonNodeFactory.instance.objectNode();
        payload.put("sub_type", subType);
        if (payoutId != null) {
            payload.put("payout_id", payoutId);
        }
        return RawEventCommand.builder()
            .source(PROCESSOR)
            .kind("BALANCE_TRANSACTION")
            .externalId(externalId)
            .occurredAt(at(date))
            .amount(new BigDecimal(amount))
            .currency("USD")
            .counterparty(counterparty)
            .payload(payload)
            .build();
    }

    public static RawEventCommand opsPayment(String externalId, String amount, Instant occurredAt, String status,
                                             String chargeReference, String customerName, String invoiceId) {
        ObjectNode payload = JsonNodeFactory.instance.objectNode();
        payload.put("status", status);
        if (chargeReference != null) {
            payload.put("charge_reference", chargeReference);
        }
        payload.put("customer_name", customerName);
        return RawEventCommand.builder()
            .source(OPS)
            .kind("OPS_PAYMENT")
            .externalId(externalId)
            .occurredAt(occurredAt)
            .amount(new BigDecimal(amount))
            .currency("USD")
            .parentExternalId(invoiceId)
            .payload(payload)
            .build();
    }

    public static RawEventCommand opsInvoice(String externalId, String amount, Instant occurredAt, String status,
                                             String customerName) {
        ObjectNode payload = JsonNodeFactory.instance.objectNode();
        payload.put("status", status);
        payload.put("customer_name", customerName);
        return RawEventCommand.builder()
            .source(OPS)
            .kind("OPS_INVOICE")
            .externalId(externalId)
            .occurredAt(occurredAt)
            .amount(new BigDecimal(amount))
            .currency("USD")
            .payload(payload)
            .build();
    }
}
