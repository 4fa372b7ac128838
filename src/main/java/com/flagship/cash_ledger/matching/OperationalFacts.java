package com.flagship.cash_ledger.matching;

import com.flagship.cash_ledger.identity.CanonicalKind;
import com.flagship.cash_ledger.identity.IdentitySnapshot;
import com.flagship.cash_ledger.ingest.RawEvent;
import com.flagship.cash_ledger.ingest.payload.OpsInvoicePayload;
import com.flagship.cash_ledger.ingest.payload.OpsPaymentPayload;

/**
 * Readings of operational payment and invoice identities.
 */
final class OperationalFacts {

    private OperationalFacts() {
    }

    /** True only when the source reports a paid status. */
    static boolean isPaid(IdentitySnapshot snapshot) {
        RawEvent event = snapshot.primaryEvent();
        if (snapshot.getKind() == CanonicalKind.PAYMENT) {
            OpsPaymentPayload payload = event.payloadAs(OpsPaymentPayload.class);
            return payload != null && payload.isPaid();
        }
        OpsInvoicePayload payload = event.payloadAs(OpsInvoicePayload.class);
        return payload != null && payload.isPaid();
    }

    static String status(IdentitySnapshot snapshot) {
        RawEvent event = snapshot.primaryEvent();
        OpsPaymentPayload payment = event.payloadAs(OpsPaymentPayload.class);
        if (payment != null) {
            return payment.getStatus();
        }
        OpsInvoicePayload invoice = event.payloadAs(OpsInvoicePayload.class);
        return invoice != null ? invoice.getStatus() : null;
    }

    static String chargeReference(IdentitySnapshot snapshot) {
        RawEvent event = snapshot.primaryEvent();
        OpsPaymentPayload payment = event.payloadAs(OpsPaymentPayload.class);
        if (payment != null) {
            return payment.getChargeReference();
        }
        OpsInvoicePayload invoice = event.payloadAs(OpsInvoicePayload.class);
        return invoice != null ? invoice.getChargeReference() : null;
    }

    /** Customer name from the payload, falling back to the event counterparty. */
    static String customerName(IdentitySnapshot snapshot) {
        RawEvent event = snapshot.primaryEvent();
        String name = null;
        OpsPaymentPayload payment = event.payloadAs(OpsPaymentPayload.class);
        if (payment != null) {
            name = payment.getCustomerName();
        }
        OpsInvoicePayload invoice = event.payloadAs(OpsInvoicePayload.class);
        if (invoice != null) {
            name = invoice.getCustomerName();
        }
        return name != null ? name : event.getCounterparty();
    }
}
